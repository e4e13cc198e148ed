package com.vibetrace.agent.selector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Decides from its code-source location whether a class belongs to the traced project.
 *
 * Rules, first match wins:
 *   1. the location must not be the agent's own jar or classes directory, which bundles
 *      the agent's libraries and may sit inside the project
 *   2. the location must be inside the project root
 *   3. no directory between the root and the location may be an isolated environment root
 *      (a JDK/JRE image or a conda environment)
 *   4. the location must not pass through a third-party package directory
 *   5. the location must not be under the running JVM's installation
 */
public final class InclusionPolicy {

    public enum Verdict {
        INCLUDED,
        AGENT_CODE,
        OUTSIDE_PROJECT,
        ISOLATED_ENVIRONMENT,
        THIRD_PARTY_DIRECTORY,
        RUNTIME_INSTALLATION;

        public boolean included() {
            return this == INCLUDED;
        }
    }

    static final Set<String> THIRD_PARTY_DIRECTORIES = Set.of(".m2", ".gradle", ".ivy2", "node_modules", "dependency");

    private final Path projectRoot;
    private final Path runtimeHome;
    private final Path agentLocation;

    public InclusionPolicy(Path projectRoot) {
        this(projectRoot, Path.of(System.getProperty("java.home")));
    }

    public InclusionPolicy(Path projectRoot, Path runtimeHome) {
        this(projectRoot, runtimeHome, CodeSources.locationOf(InclusionPolicy.class));
    }

    /**
     * @param agentLocation jar or classes directory the agent was loaded from; null if unknown
     */
    public InclusionPolicy(Path projectRoot, Path runtimeHome, Path agentLocation) {
        this.projectRoot = real(projectRoot);
        this.runtimeHome = real(runtimeHome);
        this.agentLocation = agentLocation == null ? null : real(agentLocation);
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public Verdict evaluate(Path location) {
        if (location == null) return Verdict.OUTSIDE_PROJECT;
        Path path = real(location);
        if (agentLocation != null && path.startsWith(agentLocation)) return Verdict.AGENT_CODE;
        if (!path.startsWith(projectRoot)) return Verdict.OUTSIDE_PROJECT;

        Path relative = projectRoot.relativize(path);
        Path current = projectRoot;
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            current = current.resolve(relative.getName(i));
            if (isEnvironmentRoot(current)) return Verdict.ISOLATED_ENVIRONMENT;
        }

        for (Path name : relative) {
            if (THIRD_PARTY_DIRECTORIES.contains(name.toString())) return Verdict.THIRD_PARTY_DIRECTORY;
        }

        if (path.startsWith(runtimeHome)) return Verdict.RUNTIME_INSTALLATION;
        return Verdict.INCLUDED;
    }

    static boolean isEnvironmentRoot(Path dir) {
        boolean jdkImage = Files.isRegularFile(dir.resolve("release")) && Files.isDirectory(dir.resolve("lib"));
        return jdkImage || Files.isDirectory(dir.resolve("conda-meta"));
    }

    private static Path real(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (IOException e) {
            return absolute;
        }
    }
}
