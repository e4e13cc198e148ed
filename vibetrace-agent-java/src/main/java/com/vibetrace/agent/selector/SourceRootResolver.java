package com.vibetrace.agent.selector;

import org.apache.maven.model.Build;
import org.apache.maven.model.Model;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.pull.XmlPullParserException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the source roots of every Maven or Gradle module below a project root.
 * A project with no build files is treated as one flat source root.
 */
public class SourceRootResolver {

    static final Set<String> SKIPPED_DIRECTORIES =
        Set.of(".git", "target", "build", "out", "node_modules", ".m2", ".gradle", ".idea");

    public SourceRoots resolve(Path projectRoot) {
        Path root = projectRoot.toAbsolutePath().normalize();
        List<Path> moduleDirs = findModuleDirs(root);

        Set<Path> roots = new LinkedHashSet<>();
        for (Path moduleDir : moduleDirs) {
            Path pom = moduleDir.resolve("pom.xml");
            if (Files.isRegularFile(pom)) {
                roots.addAll(resolveMaven(moduleDir, pom));
            } else {
                roots.add(moduleDir.resolve("src/main/java"));
                roots.add(moduleDir.resolve("src/test/java"));
            }
        }
        roots.removeIf(p -> !Files.isDirectory(p));
        if (roots.isEmpty()) roots.add(root);
        return new SourceRoots(new ArrayList<>(roots));
    }

    private List<Path> resolveMaven(Path moduleDir, Path pomFile) {
        String sourceDir = "src/main/java";
        String testSourceDir = "src/test/java";
        try (Reader reader = Files.newBufferedReader(pomFile, StandardCharsets.UTF_8)) {
            Model model = new MavenXpp3Reader().read(reader);
            Build build = model.getBuild();
            if (build != null && build.getSourceDirectory() != null) sourceDir = build.getSourceDirectory();
            if (build != null && build.getTestSourceDirectory() != null) testSourceDir = build.getTestSourceDirectory();
        } catch (IOException | XmlPullParserException e) {
            System.err.println("[vibetrace] WARNING could not parse " + pomFile
                + ", using default source roots: " + e.getMessage());
        }
        return List.of(
            moduleDir.resolve(stripBasedir(sourceDir)).normalize(),
            moduleDir.resolve(stripBasedir(testSourceDir)).normalize());
    }

    private static String stripBasedir(String dir) {
        String prefix = "${project.basedir}/";
        return dir.startsWith(prefix) ? dir.substring(prefix.length()) : dir;
    }

    private List<Path> findModuleDirs(Path root) {
        List<Path> modules = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (Files.isRegularFile(dir.resolve("pom.xml"))
                            || Files.isRegularFile(dir.resolve("build.gradle"))
                            || Files.isRegularFile(dir.resolve("build.gradle.kts"))) {
                        modules.add(dir);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    System.err.println("[vibetrace] WARNING skipping unreadable " + file + ": " + exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            System.err.println("[vibetrace] WARNING could not walk project tree: " + e.getMessage());
        }
        return modules;
    }
}
