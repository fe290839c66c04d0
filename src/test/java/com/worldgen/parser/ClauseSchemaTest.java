package com.worldgen.parser;

import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for schema-driven decoding of clause blocks.
 */
class ClauseSchemaTest {

    private static final ClauseSchema SCHEMA = ClauseSchema.builder()
            .required("id")
            .optional("name")
            .duplicated("period")
            .build();

    @Test
    @DisplayName("duplicated keys should accumulate every occurrence in order")
    void shouldAccumulateDuplicatedKeys() {
        ClauseRecord record = ClauseParser.parse("id = 1 period = 1 period = 2 period = 3").decode(SCHEMA);

        assertEquals(List.of(1, 2, 3), record.getAll("period", v -> v.asScalar().asInt()));
    }

    @Test
    @DisplayName("duplicated keys should decode as an empty list when absent")
    void shouldDecodeMissingDuplicatedKeyAsEmpty() {
        ClauseRecord record = ClauseParser.parse("id = 1").decode(SCHEMA);

        assertTrue(record.getAll("period", v -> v).isEmpty());
    }

    @Test
    @DisplayName("repeated non-duplicated keys should keep the last value")
    void shouldReplaceRepeatedKeys() {
        ClauseRecord record = ClauseParser.parse("id = 1 name = first name = second").decode(SCHEMA);

        assertEquals("second", record.getString("name"));
    }

    @Test
    @DisplayName("missing required key should be a decode error")
    void shouldRejectMissingRequiredKey() {
        MapLoadException ex = assertThrows(MapLoadException.class,
                () -> ClauseParser.parse("name = x").decode(SCHEMA));

        assertEquals(ErrorKind.DECODE, ex.getKind());
        assertTrue(ex.getMessage().contains("'id'"));
    }

    @Test
    @DisplayName("unknown keys should be ignored")
    void shouldIgnoreUnknownKeys() {
        ClauseRecord record = ClauseParser.parse("id = 4 colour = { 1 2 3 } unused = yes").decode(SCHEMA);

        assertEquals(4, record.getInt("id"));
        assertEquals(Optional.empty(), record.find("name", v -> v.asScalar().text()));
    }

    @Test
    @DisplayName("a failing field decoder should name the field")
    void shouldNameFailingField() {
        MapLoadException ex = assertThrows(MapLoadException.class,
                () -> ClauseParser.parse("id = abc").decode(SCHEMA).getInt("id"));

        assertEquals(ErrorKind.FORMAT, ex.getKind());
        assertTrue(ex.getMessage().startsWith("Field 'id'"));
    }

    @Test
    @DisplayName("a list field holding keyed fields should be a decode error")
    void shouldRejectObjectWhereListExpected() {
        ClauseSchema schema = ClauseSchema.builder().required("provinces").build();
        ClauseRecord record = ClauseParser.parse("provinces = { a = 1 }").decode(schema);

        MapLoadException ex = assertThrows(MapLoadException.class,
                () -> record.getList("provinces", v -> v.asScalar().asInt()));

        assertEquals(ErrorKind.DECODE, ex.getKind());
    }

    @Test
    @DisplayName("declaring the same key twice should be rejected")
    void shouldRejectDoubleDeclaration() {
        assertThrows(IllegalArgumentException.class,
                () -> ClauseSchema.builder().required("id").duplicated("id"));
    }

    @Test
    @DisplayName("reading a duplicated key as a single value should be rejected")
    void shouldRejectWrongAccessor() {
        ClauseRecord record = ClauseParser.parse("id = 1").decode(SCHEMA);

        assertThrows(IllegalArgumentException.class, () -> record.getString("period"));
    }
}
