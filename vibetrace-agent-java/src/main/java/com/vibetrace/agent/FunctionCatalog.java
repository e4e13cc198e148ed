package com.vibetrace.agent;

import com.vibetrace.agent.selector.SourceMethod;

import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Source-level metadata of the methods and constructors the selector parsed, keyed by binary class name.
 * Filled at class-load time, read by the recorder when a method is first called.
 */
public final class FunctionCatalog {

    private final ConcurrentHashMap<String, List<SourceMethod>> byClass = new ConcurrentHashMap<>();

    public void register(Collection<SourceMethod> methods) {
        for (SourceMethod m : methods) {
            byClass.computeIfAbsent(m.className(), k -> new CopyOnWriteArrayList<>()).add(m);
        }
    }

    public boolean knows(String className) {
        return byClass.containsKey(className);
    }

    /**
     * Finds the declaration of {@code executable}: exact match on name and erased simple parameter
     * types first, then the only declaration with the same name and arity.
     * Returns null when neither matches.
     *
     * Constructors of inner classes and enums take leading parameters the source does not
     * declare; they are skipped before comparing.
     */
    public SourceMethod find(Executable executable) {
        List<SourceMethod> candidates = byClass.get(executable.getDeclaringClass().getName());
        if (candidates == null) return null;

        List<String> types = new ArrayList<>();
        Class<?>[] parameterTypes = executable.getParameterTypes();
        for (int i = implicitParameterCount(executable); i < parameterTypes.length; i++) {
            types.add(parameterTypes[i].getSimpleName());
        }

        String name = sourceName(executable);
        SourceMethod sameArity = null;
        int sameArityCount = 0;
        for (SourceMethod candidate : candidates) {
            if (!candidate.methodName().equals(name)) continue;
            if (candidate.parameterTypes().equals(types)) return candidate;
            if (candidate.parameterTypes().size() == types.size()) {
                sameArity = candidate;
                sameArityCount++;
            }
        }
        return sameArityCount == 1 ? sameArity : null;
    }

    /** Name as written in source: the method name, or {@code <init>} for a constructor. */
    static String sourceName(Executable executable) {
        return executable instanceof Constructor<?> ? SourceMethod.CONSTRUCTOR_NAME : executable.getName();
    }

    /** Leading compiler-added parameters: enum name and ordinal, or the enclosing instance. */
    static int implicitParameterCount(Executable executable) {
        if (!(executable instanceof Constructor<?>)) return 0;
        Class<?> declaring = executable.getDeclaringClass();
        int count = 0;
        if (declaring.isEnum()) {
            count = 2;
        } else if (declaring.isMemberClass() && !Modifier.isStatic(declaring.getModifiers())) {
            count = 1;
        }
        return Math.min(count, executable.getParameterCount());
    }

    public void clear() {
        byClass.clear();
    }
}
