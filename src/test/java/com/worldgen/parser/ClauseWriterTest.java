package com.worldgen.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for rendering clause blocks back to text.
 */
class ClauseWriterTest {

    @Test
    @DisplayName("written text should parse back into an equal tree")
    void shouldRoundTrip() {
        ClauseBlock original = ClauseParser.parse("""
                adjacency_rule = {
                    name = "STRAIT \\"A\\""
                    contested = { army = no navy = yes }
                    required_provinces = { 1 2 3 }
                    offset = { 1 0 -1 }
                    color = rgb { 1 2 3 }
                    empty = { }
                    weather = { period = { between = { 0.0 30.0 } } period = { between = { 1.1 2.1 } } }
                    limit < 5
                }
                """);

        ClauseBlock reparsed = ClauseParser.parse(ClauseWriter.write(original));

        assertEquals(original, reparsed);
    }

    @Test
    @DisplayName("scalar-only blocks should be written on one line")
    void shouldInlineScalarBlocks() {
        ClauseBlock block = ClauseBlock.builder()
                .field("provinces", ClauseBlock.ofItems(List.of(ClauseScalar.of(1), ClauseScalar.of(2))))
                .build();

        assertEquals("provinces = { 1 2 }\n", ClauseWriter.write(block));
    }

    @Test
    @DisplayName("nested object blocks should be indented with tabs")
    void shouldIndentNestedBlocks() {
        ClauseBlock block = ClauseBlock.builder()
                .field("state", ClauseBlock.builder().field("id", 1).quoted("name", "S").build())
                .build();

        assertEquals("state = {\n\tid = 1\n\tname = \"S\"\n}\n", ClauseWriter.write(block));
    }
}
