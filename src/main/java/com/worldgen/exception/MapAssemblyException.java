package com.worldgen.exception;

import lombok.Getter;

/**
 * Raised when assembling the whole map fails. Names the sub-load that failed and keeps
 * the kind and path of the underlying {@link MapLoadException}.
 */
@Getter
public class MapAssemblyException extends MapLoadException {

    private final String stage;

    public MapAssemblyException(String stage, MapLoadException cause) {
        super(cause.getKind(), cause.getPath(),
                "Failed to load " + stage + ": " + cause.getDetail(), cause);
        this.stage = stage;
    }
}
