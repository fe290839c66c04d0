package com.worldgen.loader;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.AdjacencyRule;
import com.worldgen.model.AdjacencyRules;
import com.worldgen.model.scalar.AdjacencyRuleName;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.parser.ClauseParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AdjacencyRuleLoader.
 */
class AdjacencyRuleLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("should load every adjacency rule block by name")
    void shouldLoadRules() {
        Path file = dir.resolve("adjacency_rules.txt");
        MapFixture.writeFile(file, MapFixture.ADJACENCY_RULES);

        AdjacencyRules rules = new AdjacencyRuleLoader().load(file);

        AdjacencyRule strait = rules.find(new AdjacencyRuleName("STRAIT")).orElseThrow();
        assertEquals(List.of(new ProvinceId(2), new ProvinceId(6)), strait.requiredProvinces());
        assertEquals(Optional.of("strait_closed"), strait.disabledTooltip());
        assertTrue(strait.friend().army());
        assertFalse(strait.enemy().army());
    }

    @Test
    @DisplayName("a repeated rule name should keep the last definition")
    void shouldKeepLastDuplicate() {
        String second = MapFixture.ADJACENCY_RULES.replace("icon = 2", "icon = 9");

        AdjacencyRules rules = AdjacencyRuleLoader.decode(ClauseParser.parse(MapFixture.ADJACENCY_RULES + second));

        assertEquals(1, rules.size());
        assertEquals(new ProvinceId(9), rules.find(new AdjacencyRuleName("STRAIT")).orElseThrow().icon());
    }

    @Test
    @DisplayName("an empty file should load no rules")
    void shouldAcceptEmptyFile() {
        assertEquals(0, AdjacencyRuleLoader.decode(ClauseParser.parse("")).size());
    }

    @Test
    @DisplayName("a rule missing a required field should be a decode error naming the file")
    void shouldRejectIncompleteRule() {
        Path file = dir.resolve("adjacency_rules.txt");
        MapFixture.writeFile(file, "adjacency_rule = { name = \"BROKEN\" }");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> new AdjacencyRuleLoader().load(file));

        assertEquals(ErrorKind.DECODE, ex.getKind());
        assertEquals(file, ex.getPath());
    }
}
