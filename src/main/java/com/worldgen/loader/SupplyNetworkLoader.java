package com.worldgen.loader;

import com.worldgen.model.Railway;
import com.worldgen.model.Railways;
import com.worldgen.model.SupplyNodes;
import com.worldgen.model.scalar.ProvinceId;
import com.worldgen.model.scalar.RailLevel;
import com.worldgen.parser.PrefixedCountLine;
import com.worldgen.parser.PrefixedCountLineParser;
import com.worldgen.parser.SentinelPairLineParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Loads the railways and supply nodes files. Both are plain line formats where a single
 * invalid line fails the file.
 */
@Component
@Slf4j
public class SupplyNetworkLoader {

    private final PrefixedCountLineParser<RailLevel, ProvinceId> railwayParser =
            new PrefixedCountLineParser<>(RailLevel::parse, ProvinceId::parse, "railway");

    private final SentinelPairLineParser<ProvinceId> supplyNodeParser =
            new SentinelPairLineParser<>("1", ProvinceId::parse, "supply node");

    /**
     * Reads {@code <level> <count> <province> ...} lines.
     */
    public Railways loadRailways(Path path) {
        List<Railway> railways = railwayParser.parse(path).stream()
                .map(SupplyNetworkLoader::toRailway)
                .toList();
        log.info("Loaded {} railway(s)", railways.size());
        return new Railways(railways);
    }

    /**
     * Reads {@code 1 <province>} lines.
     */
    public SupplyNodes loadSupplyNodes(Path path) {
        Set<ProvinceId> provinces = supplyNodeParser.parse(path);
        log.info("Loaded {} supply node(s)", provinces.size());
        return new SupplyNodes(provinces);
    }

    private static Railway toRailway(PrefixedCountLine<RailLevel, ProvinceId> line) {
        return new Railway(line.prefix(), line.declaredCount(), line.ids());
    }
}
