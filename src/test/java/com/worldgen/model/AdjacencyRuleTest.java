package com.worldgen.model;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.AdjacencyRuleName;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseParser;
import com.worldgen.parser.ClauseWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for adjacency rule decoding and encoding.
 */
class AdjacencyRuleTest {

    private static AdjacencyRule decodeFixture() {
        ClauseBlock root = ClauseParser.parse(MapFixture.ADJACENCY_RULES);
        return AdjacencyRule.fromClause(root.fields().get(0).value());
    }

    @Test
    @DisplayName("should decode every field of a rule")
    void shouldDecode() {
        AdjacencyRule rule = decodeFixture();

        assertEquals(new AdjacencyRuleName("STRAIT"), rule.name());
        assertEquals(new AdjacencyLogic(false, false, false, false), rule.contested());
        assertEquals(new AdjacencyLogic(false, false, true, false), rule.enemy());
        assertEquals(new AdjacencyLogic(true, true, true, true), rule.friend());
        assertEquals(List.of(new ProvinceId(2), new ProvinceId(6)), rule.requiredProvinces());
        assertEquals(new ProvinceId(2), rule.icon());
        assertEquals(new Offset(1, 0, -1), rule.offset());
        assertEquals(Optional.of("strait_closed"), rule.disabledTooltip());
    }

    @Test
    @DisplayName("decode, encode, decode should give an equal rule")
    void shouldRoundTrip() {
        AdjacencyRule rule = decodeFixture();

        String written = ClauseWriter.write(rule.toClause());
        AdjacencyRule reparsed = AdjacencyRule.fromClause(ClauseParser.parse(written));

        assertEquals(rule, reparsed);
    }

    @Test
    @DisplayName("a rule without is_disabled should have no tooltip")
    void shouldAllowMissingDisabledBlock() {
        AdjacencyRule rule = decodeFixture();
        AdjacencyRule enabled = new AdjacencyRule(rule.name(), rule.contested(), rule.enemy(), rule.friend(),
                rule.neutral(), rule.requiredProvinces(), rule.icon(), rule.offset(), Optional.empty());

        AdjacencyRule reparsed = AdjacencyRule.fromClause(ClauseParser.parse(ClauseWriter.write(enabled.toClause())));

        assertEquals(Optional.empty(), reparsed.disabledTooltip());
    }

    @Test
    @DisplayName("a missing logic block should be a decode error")
    void shouldRejectMissingLogic() {
        MapLoadException ex = assertThrows(MapLoadException.class, () -> AdjacencyRule.fromClause(
                ClauseParser.parse("name = X contested = { army = no navy = no submarine = no trade = no }")));

        assertEquals(ErrorKind.DECODE, ex.getKind());
    }
}
