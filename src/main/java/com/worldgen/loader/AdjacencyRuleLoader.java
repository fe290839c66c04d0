package com.worldgen.loader;

import com.worldgen.model.AdjacencyRule;
import com.worldgen.model.AdjacencyRules;
import com.worldgen.model.scalar.AdjacencyRuleName;
import com.worldgen.parser.ClauseBlock;
import com.worldgen.parser.ClauseParser;
import com.worldgen.parser.ClauseSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the adjacency rules file, a sequence of {@code adjacency_rule = { ... }} blocks.
 */
@Component
@Slf4j
public class AdjacencyRuleLoader {

    private static final ClauseSchema FILE_SCHEMA = ClauseSchema.builder()
            .duplicated("adjacency_rule")
            .build();

    public AdjacencyRules load(Path path) {
        AdjacencyRules rules = ClauseParser.decodeFile(path, AdjacencyRuleLoader::decode);
        log.info("Loaded {} adjacency rule(s)", rules.size());
        return rules;
    }

    static AdjacencyRules decode(ClauseBlock root) {
        List<AdjacencyRule> decoded = root.decode(FILE_SCHEMA).getAll("adjacency_rule", AdjacencyRule::fromClause);
        Map<AdjacencyRuleName, AdjacencyRule> rules = new LinkedHashMap<>();
        for (AdjacencyRule rule : decoded) {
            if (rules.put(rule.name(), rule) != null) {
                log.warn("Adjacency rule {} is defined more than once, keeping the last", rule.name());
            }
        }
        return new AdjacencyRules(rules);
    }
}
