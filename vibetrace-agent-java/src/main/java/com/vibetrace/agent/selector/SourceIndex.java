package com.vibetrace.agent.selector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maps a binary class name to the source file that declares it.
 *
 * The conventional location ({@code pkg/Outer.java} for {@code pkg.Outer$Inner}) is tried in
 * every source root. When nothing is there, the package directories are parsed to find a
 * secondary top-level type declared in another file.
 */
public class SourceIndex {

    private final SourceRoots roots;
    private final JdtSourceParser parser;

    public SourceIndex(SourceRoots roots, JdtSourceParser parser) {
        this.roots = roots;
        this.parser = parser;
    }

    /**
     * @throws InstrumentationException when no source file or more than one declares the type
     */
    public Path locate(String typeName) {
        String topLevel = topLevelName(typeName);
        String relative = topLevel.replace('.', '/') + ".java";

        List<Path> matches = new ArrayList<>();
        for (Path root : roots.roots()) {
            Path candidate = root.resolve(relative);
            if (Files.isRegularFile(candidate)) matches.add(candidate);
        }
        if (matches.isEmpty()) matches = scanPackage(topLevel);

        if (matches.size() == 1) return matches.get(0);
        if (matches.isEmpty()) {
            throw new InstrumentationException("No source file declares " + typeName + " under " + roots.roots());
        }
        throw new InstrumentationException("Ambiguous source for " + typeName + ": " + matches);
    }

    static String topLevelName(String typeName) {
        int dollar = typeName.indexOf('$');
        return dollar < 0 ? typeName : typeName.substring(0, dollar);
    }

    private List<Path> scanPackage(String topLevel) {
        int dot = topLevel.lastIndexOf('.');
        String packageDir = dot < 0 ? "" : topLevel.substring(0, dot).replace('.', '/');

        List<Path> matches = new ArrayList<>();
        for (Path root : roots.roots()) {
            Path dir = packageDir.isEmpty() ? root : root.resolve(packageDir);
            if (!Files.isDirectory(dir)) continue;
            for (Path file : javaFilesIn(dir)) {
                try {
                    if (parser.parse(file).typeNames().contains(topLevel)) matches.add(file);
                } catch (InstrumentationException e) {
                    System.err.println("[vibetrace] WARNING skipping " + file + " while looking for "
                        + topLevel + ": " + e.getMessage());
                }
            }
        }
        return matches;
    }

    private static List<Path> javaFilesIn(Path dir) {
        try (Stream<Path> list = Files.list(dir)) {
            return list
                .filter(p -> p.toString().endsWith(".java"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new InstrumentationException("Cannot list source directory " + dir + ": " + e.getMessage(), e);
        }
    }
}
