package com.vibetrace.agent.selector;

import com.vibetrace.agent.FunctionCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentationSelectorTest {

    @TempDir
    Path project;

    private FunctionCatalog catalog;
    private InstrumentationSelector selector;
    private Path classes;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(project.resolve("pom.xml"), "<project><modelVersion>4.0.0</modelVersion>"
            + "<groupId>g</groupId><artifactId>a</artifactId><version>1</version></project>");
        Path pkg = Files.createDirectories(project.resolve("src/main/java/com/example"));
        Files.writeString(pkg.resolve("Calculator.java"), String.join("\n",
            "package com.example;",
            "public class Calculator {",
            "    public int add(int a, int b) { return a + b; }",
            "    static class Memory { void store(int v) {} }",
            "}"));
        Files.writeString(pkg.resolve("Broken.java"), "package com.example; public class Broken { void x( }");
        classes = Files.createDirectories(project.resolve("target/classes"));

        catalog = new FunctionCatalog();
        selector = new InstrumentationSelector(project, catalog);
    }

    @Test
    void selectsProjectClasses() {
        assertTrue(selector.isSelected("com.example.Calculator", classes));
    }

    @Test
    void rejectsClassesOutsideTheProject() {
        assertFalse(selector.isSelected("com.google.gson.Gson", project.getParent()));
        assertFalse(selector.isSelected("java.lang.String", null));
    }

    @Test
    void rejectsGeneratedAndAgentClasses() {
        assertFalse(selector.isSelected("com.vibetrace.agent.CallRecorder", classes));
        assertFalse(selector.isSelected("net.bytebuddy.ByteBuddy", classes));
        assertFalse(selector.isSelected("com.example.Calculator$$Lambda$14/0x0000000800c03000", classes));
        assertFalse(selector.isSelected("com.example.$Proxy12", classes));
        assertFalse(selector.isSelected("com.example.Calculator$$EnhancerBySpringCGLIB$$1a2b", classes));
    }

    @Test
    void rejectsLibrariesBundledInAgentJarInsideTheProject() throws IOException {
        Path agentJar = Files.createFile(Files.createDirectories(project.resolve("tools"))
            .resolve("vibetrace-agent-java.jar"));
        InstrumentationSelector withAgent = new InstrumentationSelector(
            new InclusionPolicy(project, Path.of(System.getProperty("java.home")), agentJar),
            new SourceRootResolver().resolve(project), catalog);

        assertFalse(withAgent.isSelected("com.google.gson.Gson", agentJar));
        assertFalse(withAgent.isSelected("org.sqlite.JDBC", agentJar));
        assertTrue(withAgent.isSelected("com.example.Calculator", classes));
    }

    @Test
    void isExcludedName() {
        assertTrue(InstrumentationSelector.isExcludedName("com.vibetrace.agent.store.SqliteTraceStore"));
        assertFalse(InstrumentationSelector.isExcludedName("com.example.Calculator"));
    }

    @Test
    void prepareRegistersMethodsInCatalog() {
        assertFalse(catalog.knows("com.example.Calculator"));

        ParsedSource parsed = selector.prepare("com.example.Calculator");

        assertEquals(2, parsed.methods().size());
        assertTrue(catalog.knows("com.example.Calculator"));
        assertTrue(catalog.knows("com.example.Calculator$Memory"));
    }

    @Test
    void preparingNestedClassReusesParsedFile() {
        ParsedSource outer = selector.prepare("com.example.Calculator");
        ParsedSource inner = selector.prepare("com.example.Calculator$Memory");
        assertSame(outer, inner);
    }

    @Test
    void prepareFailsForUnparseableSource() {
        InstrumentationException e = assertThrows(InstrumentationException.class,
            () -> selector.prepare("com.example.Broken"));
        assertTrue(e.getMessage().contains("Syntax error"));
        assertFalse(catalog.knows("com.example.Broken"));
    }

    @Test
    void prepareFailsForMissingSource() {
        assertThrows(InstrumentationException.class, () -> selector.prepare("com.example.Missing"));
    }
}
