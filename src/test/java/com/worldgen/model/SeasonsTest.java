package com.worldgen.model;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.scalar.Hsv;
import com.worldgen.model.scalar.SeasonDate;
import com.worldgen.parser.ClauseParser;
import com.worldgen.parser.ClauseWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the seasons file.
 */
class SeasonsTest {

    @Test
    @DisplayName("should decode the four seasons and eight tree stages")
    void shouldDecode() {
        Seasons seasons = Seasons.fromFile(ClauseParser.parse(MapFixture.SEASONS));

        assertEquals(new SeasonDate(0, 12, 1), seasons.winter().startDate());
        assertEquals(new Hsv(0.0, 0.0, 0.7), seasons.winter().hsvNorth());
        assertEquals(new Hsv(1.0, 1.0, 0.9), seasons.summer().colorBalanceSouth());
        assertEquals(new SeasonDate(0, 11, 30), seasons.treeAutumn2().endDate());
    }

    @Test
    @DisplayName("decode, encode, decode should give equal seasons")
    void shouldRoundTrip() {
        Seasons seasons = Seasons.fromFile(ClauseParser.parse(MapFixture.SEASONS));

        Seasons reparsed = Seasons.fromFile(ClauseParser.parse(ClauseWriter.write(seasons.toFile())));

        assertEquals(seasons, reparsed);
        assertEquals(seasons.spring(), Season.fromClause(ClauseParser.parse(ClauseWriter.write(seasons.spring().toClause()))));
    }

    @Test
    @DisplayName("a missing tree stage should be a decode error")
    void shouldRejectMissingStage() {
        String text = MapFixture.SEASONS.replace("tree_summer2", "tree_summer3");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> Seasons.fromFile(ClauseParser.parse(text)));

        assertEquals(ErrorKind.DECODE, ex.getKind());
        assertTrue(ex.getMessage().contains("tree_summer2"));
    }
}
