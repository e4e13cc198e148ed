package com.vibetrace.agent.selector;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdtSourceParserTest {

    private static final Path FILE = Path.of("/src/com/example/Orders.java");

    private static final String SOURCE = String.join("\n",
        "package com.example;",
        "",
        "import java.util.List;",
        "import java.util.Map;",
        "",
        "public class Orders<T extends Comparable<T>> {",
        "",
        "    /** Adds two numbers. */",
        "    public static int add(int a, int b) {",
        "        Runnable r = new Runnable() {",
        "            public void run() {}",
        "        };",
        "        return a + b;",
        "    }",
        "",
        "    protected <K> Map<K, List<T>> group(List<? extends T> items, K key, String... tags)",
        "            throws java.io.IOException {",
        "        return null;",
        "    }",
        "",
        "    T first(T[] values, int matrix[]) { return values[0]; }",
        "",
        "    Orders() {}",
        "",
        "    static class Line {",
        "        double total(java.math.BigDecimal price) { return 0; }",
        "    }",
        "",
        "    enum Status { OPEN, CLOSED; boolean open() { return this == OPEN; } }",
        "",
        "    interface Listener { void changed(Orders<?> orders); }",
        "}",
        "",
        "record Pair(String left, String right) {",
        "    String joined() { return left + right; }",
        "}",
        "");

    private final JdtSourceParser parser = new JdtSourceParser();

    private static SourceMethod method(ParsedSource parsed, String name) {
        return parsed.methods().stream()
            .filter(m -> m.methodName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("no method " + name));
    }

    @Test
    void collectsPackageAndTypeNames() {
        ParsedSource parsed = parser.parse(FILE, SOURCE);
        assertEquals("com.example", parsed.packageName());
        assertEquals(List.of(
            "com.example.Orders",
            "com.example.Orders$Line",
            "com.example.Orders$Status",
            "com.example.Orders$Listener",
            "com.example.Pair"), parsed.typeNames());
    }

    @Test
    void collectsMethodsAndConstructorsButNotAnonymousClasses() {
        ParsedSource parsed = parser.parse(FILE, SOURCE);
        List<String> names = parsed.methods().stream().map(SourceMethod::methodName).toList();
        assertEquals(List.of("add", "group", "first", "<init>", "total", "open", "changed", "joined"), names);
    }

    @Test
    void constructorIsNamedInit() {
        SourceMethod constructor = method(parser.parse(FILE, SOURCE), SourceMethod.CONSTRUCTOR_NAME);
        assertEquals("com.example.Orders", constructor.className());
        assertEquals(List.of(), constructor.parameterTypes());
        assertEquals(23, constructor.line());
        assertEquals("Orders()", constructor.signature());
        assertEquals("Orders() {}", constructor.sourceText());
    }

    @Test
    void staticMethodDetails() {
        SourceMethod add = method(parser.parse(FILE, SOURCE), "add");
        assertEquals("com.example.Orders", add.className());
        assertEquals(List.of("int", "int"), add.parameterTypes());
        assertEquals(List.of("a", "b"), add.parameterNames());
        assertEquals(9, add.line());
        assertEquals(FILE, add.file());
        assertEquals("public static int add(int a, int b)", add.signature());
        assertTrue(add.sourceText().startsWith("/** Adds two numbers. */"));
        assertTrue(add.sourceText().endsWith("return a + b;\n    }"));
    }

    @Test
    void genericParametersAreErased() {
        SourceMethod group = method(parser.parse(FILE, SOURCE), "group");
        assertEquals(List.of("List", "Object", "String[]"), group.parameterTypes());
        assertEquals(List.of("items", "key", "tags"), group.parameterNames());
        assertTrue(group.signature().startsWith("protected <K> Map<"));
        assertTrue(group.signature().contains(" group("));
        assertTrue(group.signature().contains("K key, String... tags)"));
        assertTrue(group.signature().endsWith(" throws java.io.IOException"));
    }

    @Test
    void classTypeVariableErasesToItsBound() {
        SourceMethod first = method(parser.parse(FILE, SOURCE), "first");
        assertEquals(List.of("Comparable[]", "int[]"), first.parameterTypes());
    }

    @Test
    void nestedTypesUseBinaryNames() {
        ParsedSource parsed = parser.parse(FILE, SOURCE);
        SourceMethod total = method(parsed, "total");
        assertEquals("com.example.Orders$Line", total.className());
        assertEquals(List.of("BigDecimal"), total.parameterTypes());
        assertEquals("com.example.Orders$Status", method(parsed, "open").className());
        assertEquals(List.of("Orders"), method(parsed, "changed").parameterTypes());
        assertEquals("com.example.Pair", method(parsed, "joined").className());
    }

    @Test
    void defaultPackage() {
        ParsedSource parsed = parser.parse(Path.of("Main.java"), "class Main { void run() {} }");
        assertEquals("", parsed.packageName());
        assertEquals(List.of("Main"), parsed.typeNames());
        assertEquals("Main", parsed.methods().get(0).className());
    }

    @Test
    void syntaxErrorIsRejected() {
        InstrumentationException e = assertThrows(InstrumentationException.class,
            () -> parser.parse(FILE, "package com.example; class Broken { void x( { } }"));
        assertTrue(e.getMessage().contains("Syntax error"));
        assertTrue(e.getMessage().contains(FILE.toString()));
    }

    @Test
    void readsFromDisk(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("Orders.java");
        Files.writeString(file, SOURCE);
        ParsedSource parsed = parser.parse(file);
        assertEquals(file, parsed.file());
        assertEquals(8, parsed.methods().size());
    }

    @Test
    void missingFileIsAnInstrumentationProblem(@TempDir Path tmp) {
        assertThrows(InstrumentationException.class, () -> parser.parse(tmp.resolve("Nope.java")));
    }
}
