package com.worldgen.loader;

import com.worldgen.exception.MapLoadException;
import com.worldgen.model.State;
import com.worldgen.model.States;
import com.worldgen.model.scalar.StateId;
import com.worldgen.parser.ClauseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the state history directory, one {@code state = { ... }} per {@code .txt} file.
 */
@Component
@Slf4j
public class StateLoader {

    public States load(Path directory) {
        Map<StateId, State> states = new LinkedHashMap<>();
        for (Path file : MapDirectory.regularFiles(directory)) {
            if (!file.getFileName().toString().endsWith(".txt")) {
                log.debug("Ignoring {}", file);
                continue;
            }
            State state = ClauseParser.decodeFile(file, State::fromFile);
            if (states.putIfAbsent(state.id(), state) != null) {
                throw MapLoadException.validation(file, "Duplicate state id " + state.id());
            }
        }
        log.info("Loaded {} state(s) from {}", states.size(), directory);
        return new States(states);
    }
}
