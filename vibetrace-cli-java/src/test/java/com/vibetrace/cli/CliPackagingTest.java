package com.vibetrace.cli;

import org.apache.maven.model.Model;
import org.apache.maven.model.Plugin;
import org.apache.maven.model.PluginExecution;
import org.apache.maven.model.io.xpp3.MavenXpp3Reader;
import org.codehaus.plexus.util.xml.Xpp3Dom;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The documented {@code java -jar vibetrace-cli-java.jar} entry point needs a self-contained jar
 * whose manifest names {@link CliMain}. Surefire runs from the module directory.
 */
class CliPackagingTest {

    private static final String SHADE = "maven-shade-plugin";
    private static final String MANIFEST_TRANSFORMER =
        "org.apache.maven.plugins.shade.resource.ManifestResourceTransformer";

    private Model model;

    @BeforeEach
    void readPom() throws Exception {
        Path pom = Paths.get("pom.xml");
        assertTrue(Files.isRegularFile(pom), "expected to run from the module directory");
        try (Reader reader = Files.newBufferedReader(pom, StandardCharsets.UTF_8)) {
            model = new MavenXpp3Reader().read(reader);
        }
        assertEquals("vibetrace-cli-java", model.getArtifactId());
    }

    private Plugin plugin(String artifactId) {
        return model.getBuild().getPlugins().stream()
            .filter(p -> artifactId.equals(p.getArtifactId()))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no " + artifactId + " in pom.xml"));
    }

    @Test
    void shadedJarBundlesDependenciesAtPackageTime() {
        PluginExecution execution = plugin(SHADE).getExecutions().get(0);
        assertEquals("package", execution.getPhase());
        assertTrue(execution.getGoals().contains("shade"));
    }

    @Test
    void shadedManifestNamesCliMain() {
        Xpp3Dom configuration = (Xpp3Dom) plugin(SHADE).getExecutions().get(0).getConfiguration();
        assertNotNull(configuration);
        Xpp3Dom transformers = configuration.getChild("transformers");
        assertNotNull(transformers);

        String mainClass = null;
        for (Xpp3Dom transformer : transformers.getChildren("transformer")) {
            if (MANIFEST_TRANSFORMER.equals(transformer.getAttribute("implementation"))) {
                mainClass = transformer.getChild("mainClass").getValue();
            }
        }
        assertEquals(CliMain.class.getName(), mainClass);
    }

    @Test
    void signatureFilesAreStrippedFromBundledLibraries() {
        Xpp3Dom configuration = (Xpp3Dom) plugin(SHADE).getExecutions().get(0).getConfiguration();
        Xpp3Dom excludes = configuration.getChild("filters").getChild("filter").getChild("excludes");
        boolean stripsSignatures = false;
        for (Xpp3Dom exclude : excludes.getChildren("exclude")) {
            if ("META-INF/*.SF".equals(exclude.getValue())) stripsSignatures = true;
        }
        assertTrue(stripsSignatures);
    }
}
