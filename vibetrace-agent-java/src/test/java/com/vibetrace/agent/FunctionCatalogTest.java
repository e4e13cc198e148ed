package com.vibetrace.agent;

import com.vibetrace.agent.selector.SourceMethod;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionCatalogTest {

    static class Shapes {
        public int area(int w, int h) { return w * h; }
        public double area(double r) { return r; }
        public String describe(List<String> parts) { return ""; }
    }

    class Pocket {
        final int coins;

        Pocket(int coins) { this.coins = coins; }
    }

    enum Size {
        SMALL(1), LARGE(3);

        final int weight;

        Size(int weight) { this.weight = weight; }
    }

    private static SourceMethod constructorOf(Class<?> type, List<String> types, int line) {
        return new SourceMethod(type.getName(), SourceMethod.CONSTRUCTOR_NAME, types, List.of("value"),
            Path.of("/src/FunctionCatalogTest.java"), line, type.getSimpleName() + "(...)", "");
    }

    private static SourceMethod declared(String name, List<String> types, List<String> names, int line) {
        return new SourceMethod(Shapes.class.getName(), name, types, names,
            Path.of("/src/Shapes.java"), line, "public int " + name + "(...)", "");
    }

    @Test
    void exactParameterTypesSelectTheOverload() throws Exception {
        FunctionCatalog catalog = new FunctionCatalog();
        catalog.register(List.of(
            declared("area", List.of("int", "int"), List.of("w", "h"), 3),
            declared("area", List.of("double"), List.of("r"), 4)));

        SourceMethod found = catalog.find(Shapes.class.getMethod("area", double.class));
        assertNotNull(found);
        assertEquals(4, found.line());
        assertEquals(List.of("r"), found.parameterNames());
    }

    @Test
    void uniqueNameAndArityIsAcceptedWhenTypesDiffer() throws Exception {
        FunctionCatalog catalog = new FunctionCatalog();
        catalog.register(List.of(declared("describe", List.of("Collection"), List.of("parts"), 5)));

        SourceMethod found = catalog.find(Shapes.class.getMethod("describe", List.class));
        assertNotNull(found);
        assertEquals(5, found.line());
    }

    @Test
    void ambiguousArityMatchReturnsNull() throws Exception {
        FunctionCatalog catalog = new FunctionCatalog();
        catalog.register(List.of(
            declared("area", List.of("long", "long"), List.of("a", "b"), 3),
            declared("area", List.of("short", "short"), List.of("a", "b"), 4)));

        assertNull(catalog.find(Shapes.class.getMethod("area", int.class, int.class)));
    }

    @Test
    void unknownClassReturnsNull() throws Exception {
        FunctionCatalog catalog = new FunctionCatalog();
        assertFalse(catalog.knows(Shapes.class.getName()));
        assertNull(catalog.find(Shapes.class.getMethod("area", double.class)));
    }

    @Test
    void constructorIsFoundUnderInitName() throws Exception {
        FunctionCatalog catalog = new FunctionCatalog();
        catalog.register(List.of(
            new SourceMethod(Shapes.class.getName(), SourceMethod.CONSTRUCTOR_NAME, List.of(), List.of(),
                Path.of("/src/Shapes.java"), 2, "Shapes()", "")));

        SourceMethod found = catalog.find(Shapes.class.getDeclaredConstructor());
        assertNotNull(found);
        assertEquals(2, found.line());
    }

    @Test
    void innerClassConstructorSkipsEnclosingInstance() throws Exception {
        FunctionCatalog catalog = new FunctionCatalog();
        catalog.register(List.of(constructorOf(Pocket.class, List.of("int"), 20)));

        SourceMethod found = catalog.find(Pocket.class.getDeclaredConstructor(FunctionCatalogTest.class, int.class));
        assertNotNull(found);
        assertEquals(20, found.line());
    }

    @Test
    void enumConstructorSkipsNameAndOrdinal() throws Exception {
        FunctionCatalog catalog = new FunctionCatalog();
        catalog.register(List.of(constructorOf(Size.class, List.of("int"), 30)));

        SourceMethod found = catalog.find(Size.class.getDeclaredConstructor(String.class, int.class, int.class));
        assertNotNull(found);
        assertEquals(30, found.line());
    }
}
