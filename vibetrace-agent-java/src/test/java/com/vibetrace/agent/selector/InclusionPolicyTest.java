package com.vibetrace.agent.selector;

import com.vibetrace.agent.selector.InclusionPolicy.Verdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InclusionPolicyTest {

    @TempDir
    Path tmp;

    private Path project;
    private InclusionPolicy policy;

    @BeforeEach
    void setUp() throws IOException {
        project = Files.createDirectories(tmp.resolve("project"));
        Path runtime = Files.createDirectories(project.resolve("runtime"));
        policy = new InclusionPolicy(project, runtime);
    }

    @Test
    void classesUnderTheProjectAreIncluded() throws IOException {
        Path classes = Files.createDirectories(project.resolve("target/classes"));
        assertEquals(Verdict.INCLUDED, policy.evaluate(classes));
        assertTrue(policy.evaluate(classes).included());
    }

    @Test
    void projectRootItselfIsIncluded() {
        assertEquals(Verdict.INCLUDED, policy.evaluate(project));
    }

    @Test
    void locationsOutsideTheRootAreExcluded() throws IOException {
        Path elsewhere = Files.createDirectories(tmp.resolve("elsewhere/classes"));
        assertEquals(Verdict.OUTSIDE_PROJECT, policy.evaluate(elsewhere));
        assertFalse(policy.evaluate(elsewhere).included());
    }

    @Test
    void siblingWithCommonPrefixIsOutside() throws IOException {
        Path sibling = Files.createDirectories(tmp.resolve("project-other/classes"));
        assertEquals(Verdict.OUTSIDE_PROJECT, policy.evaluate(sibling));
    }

    @Test
    void unknownLocationIsOutside() {
        assertEquals(Verdict.OUTSIDE_PROJECT, policy.evaluate(null));
    }

    @Test
    void jdkImageInsideProjectIsIsolated() throws IOException {
        Path jdk = Files.createDirectories(project.resolve("tools/jdk-17"));
        Files.writeString(jdk.resolve("release"), "JAVA_VERSION=\"17\"");
        Path lib = Files.createDirectories(jdk.resolve("lib"));
        assertEquals(Verdict.ISOLATED_ENVIRONMENT, policy.evaluate(lib.resolve("ext.jar")));
    }

    @Test
    void condaEnvironmentIsIsolated() throws IOException {
        Path env = Files.createDirectories(project.resolve("env"));
        Files.createDirectories(env.resolve("conda-meta"));
        Path jar = env.resolve("share/java/tool.jar");
        assertEquals(Verdict.ISOLATED_ENVIRONMENT, policy.evaluate(jar));
    }

    @Test
    void releaseFileWithoutLibIsNotAnEnvironment() throws IOException {
        Path dir = Files.createDirectories(project.resolve("dist"));
        Files.writeString(dir.resolve("release"), "notes");
        Path classes = Files.createDirectories(dir.resolve("classes"));
        assertEquals(Verdict.INCLUDED, policy.evaluate(classes));
    }

    @Test
    void thirdPartyDirectoriesAreExcluded() throws IOException {
        assertEquals(Verdict.THIRD_PARTY_DIRECTORY,
            policy.evaluate(project.resolve(".m2/repository/com/google/gson/gson.jar")));
        assertEquals(Verdict.THIRD_PARTY_DIRECTORY,
            policy.evaluate(project.resolve("target/dependency/guava.jar")));
        assertEquals(Verdict.THIRD_PARTY_DIRECTORY,
            policy.evaluate(project.resolve("web/node_modules/x/classes")));
    }

    @Test
    void runtimeInstallationIsExcluded() {
        assertEquals(Verdict.RUNTIME_INSTALLATION, policy.evaluate(project.resolve("runtime/jmods/java.base.jmod")));
    }

    @Test
    void environmentRootWinsOverThirdPartyDirectory() throws IOException {
        Path env = Files.createDirectories(project.resolve("venv"));
        Files.createDirectories(env.resolve("conda-meta"));
        assertEquals(Verdict.ISOLATED_ENVIRONMENT, policy.evaluate(env.resolve("node_modules/lib.jar")));
    }

    @Test
    void agentJarInsideProjectIsExcluded() throws IOException {
        Path tools = Files.createDirectories(project.resolve("tools"));
        Path agentJar = Files.createFile(tools.resolve("vibetrace-agent-java.jar"));
        Path classes = Files.createDirectories(project.resolve("target/classes"));
        InclusionPolicy withAgent = new InclusionPolicy(project, project.resolve("runtime"), agentJar);

        assertEquals(Verdict.AGENT_CODE, withAgent.evaluate(agentJar));
        assertFalse(withAgent.evaluate(agentJar).included());
        assertEquals(Verdict.INCLUDED, withAgent.evaluate(classes));
    }

    @Test
    void defaultAgentLocationIsWhereThisPolicyWasLoadedFrom() {
        Path agentClasses = CodeSources.locationOf(InclusionPolicy.class);
        assertNotNull(agentClasses);
        assertEquals(Verdict.AGENT_CODE, new InclusionPolicy(agentClasses.getParent()).evaluate(agentClasses));
    }
}
