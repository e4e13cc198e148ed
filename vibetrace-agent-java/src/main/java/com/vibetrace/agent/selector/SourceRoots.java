package com.vibetrace.agent.selector;

import java.nio.file.Path;
import java.util.List;

/**
 * Directories holding the project's Java sources, in discovery order.
 */
public record SourceRoots(List<Path> roots) {

    public SourceRoots {
        roots = List.copyOf(roots);
    }
}
