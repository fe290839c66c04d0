package com.worldgen.loader;

import com.worldgen.MapFixture;
import com.worldgen.exception.ErrorKind;
import com.worldgen.exception.MapLoadException;
import com.worldgen.model.Adjacencies;
import com.worldgen.model.Adjacency;
import com.worldgen.model.AdjacencyType;
import com.worldgen.model.scalar.AdjacencyRuleName;
import com.worldgen.model.scalar.ProvinceId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AdjacencyLoader.
 */
class AdjacencyLoaderTest {

    @TempDir
    Path dir;

    private AdjacencyLoader loader;
    private Path file;

    @BeforeEach
    void setUp() {
        loader = new AdjacencyLoader();
        file = dir.resolve("adjacencies.csv");
    }

    @Test
    @DisplayName("should skip the header and read every record")
    void shouldLoadAdjacencies() {
        MapFixture.writeFile(file, MapFixture.ADJACENCIES);

        Adjacencies adjacencies = loader.load(file);

        assertEquals(2, adjacencies.size());
        Adjacency strait = adjacencies.adjacencies().get(0);
        assertEquals(new ProvinceId(2), strait.from());
        assertEquals(Optional.of(AdjacencyType.SEA), strait.type());
        assertEquals(Optional.of(new ProvinceId(4)), strait.through());
        assertEquals(Optional.of(new AdjacencyRuleName("STRAIT")), strait.ruleName());
        assertTrue(strait.startX().isEmpty());

        Adjacency mountains = adjacencies.adjacencies().get(1);
        assertTrue(mountains.through().isEmpty());
        assertTrue(mountains.ruleName().isEmpty());
        assertEquals(Optional.of("Mountains"), mountains.comment());
    }

    @Test
    @DisplayName("a sea crossing without a through province should still load")
    void shouldKeepSeaWithoutThrough() {
        MapFixture.writeFile(file, "From;To;Type;Through;start_x;stop_x;start_y;stop_y\n2;6;sea;-1;-1;-1;-1;-1\n");

        Adjacencies adjacencies = loader.load(file);

        assertTrue(adjacencies.adjacencies().get(0).isSeaWithoutThrough());
    }

    @Test
    @DisplayName("a record with too few columns should fail the file")
    void shouldRejectShortRow() {
        MapFixture.writeFile(file, "From;To;Type;Through;start_x;stop_x;start_y;stop_y\n2;6;sea;4\n");

        MapLoadException ex = assertThrows(MapLoadException.class, () -> loader.load(file));

        assertEquals(ErrorKind.DECODE, ex.getKind());
        assertTrue(ex.getDetail().startsWith("Row 2:"), ex.getDetail());
    }

    @Test
    @DisplayName("an unknown adjacency type should fail the file")
    void shouldRejectUnknownType() {
        MapFixture.writeFile(file, "From;To;Type;Through;start_x;stop_x;start_y;stop_y\n2;6;canal;-1;-1;-1;-1;-1\n");

        assertEquals(ErrorKind.FORMAT, assertThrows(MapLoadException.class, () -> loader.load(file)).getKind());
    }
}
