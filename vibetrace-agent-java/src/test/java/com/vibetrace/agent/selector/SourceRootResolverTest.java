package com.vibetrace.agent.selector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceRootResolverTest {

    private final SourceRootResolver resolver = new SourceRootResolver();

    private static final String MINIMAL_POM = "<project><modelVersion>4.0.0</modelVersion>"
        + "<groupId>g</groupId><artifactId>a</artifactId><version>1</version></project>";

    @Test
    void mavenProjectUsesConventionalRoots(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), MINIMAL_POM);
        Path main = Files.createDirectories(tmp.resolve("src/main/java"));
        Path test = Files.createDirectories(tmp.resolve("src/test/java"));

        SourceRoots roots = resolver.resolve(tmp);

        assertEquals(List.of(main.toAbsolutePath().normalize(), test.toAbsolutePath().normalize()), roots.roots());
    }

    @Test
    void mavenCustomSourceDirectory(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), "<project><modelVersion>4.0.0</modelVersion>"
            + "<groupId>g</groupId><artifactId>a</artifactId><version>1</version>"
            + "<build><sourceDirectory>${project.basedir}/java</sourceDirectory></build></project>");
        Path custom = Files.createDirectories(tmp.resolve("java"));

        SourceRoots roots = resolver.resolve(tmp);

        assertEquals(List.of(custom.toAbsolutePath().normalize()), roots.roots());
    }

    @Test
    void multiModuleProjectCollectsEveryModule(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), MINIMAL_POM);
        Path core = Files.createDirectories(tmp.resolve("core"));
        Files.writeString(core.resolve("pom.xml"), MINIMAL_POM);
        Path coreMain = Files.createDirectories(core.resolve("src/main/java"));
        Path app = Files.createDirectories(tmp.resolve("app"));
        Files.writeString(app.resolve("build.gradle"), "plugins { id 'java' }");
        Path appMain = Files.createDirectories(app.resolve("src/main/java"));

        List<Path> roots = resolver.resolve(tmp).roots();

        assertEquals(2, roots.size());
        assertTrue(roots.contains(coreMain.toAbsolutePath().normalize()));
        assertTrue(roots.contains(appMain.toAbsolutePath().normalize()));
    }

    @Test
    void buildOutputDirectoriesAreNotScanned(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), MINIMAL_POM);
        Path main = Files.createDirectories(tmp.resolve("src/main/java"));
        Path copied = Files.createDirectories(tmp.resolve("target/unpacked"));
        Files.writeString(copied.resolve("pom.xml"), MINIMAL_POM);
        Files.createDirectories(copied.resolve("src/main/java"));

        assertEquals(List.of(main.toAbsolutePath().normalize()), resolver.resolve(tmp).roots());
    }

    @Test
    void unreadablePomFallsBackToDefaults(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("pom.xml"), "<project><broken");
        Path main = Files.createDirectories(tmp.resolve("src/main/java"));

        assertEquals(List.of(main.toAbsolutePath().normalize()), resolver.resolve(tmp).roots());
    }

    @Test
    void projectWithoutBuildFilesIsOneFlatRoot(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("Main.java"), "class Main {}");

        assertEquals(List.of(tmp.toAbsolutePath().normalize()), resolver.resolve(tmp).roots());
    }
}
