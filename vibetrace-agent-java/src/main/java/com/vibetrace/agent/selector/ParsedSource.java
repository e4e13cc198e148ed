package com.vibetrace.agent.selector;

import java.nio.file.Path;
import java.util.List;

/**
 * What the parser extracted from one source file.
 *
 * @param typeNames binary names of every named class, interface, enum and record in the file
 */
public record ParsedSource(Path file, String packageName, List<String> typeNames, List<SourceMethod> methods) {}
