package com.worldgen;

import com.worldgen.config.MapLoader;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertFalse;

@SpringBootTest
class WorldGenApplicationTests {

    @Autowired
    private MapLoader mapLoader;

    @Test
    void contextLoads() {
        assertFalse(mapLoader.isLoaded());
    }
}
