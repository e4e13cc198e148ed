package com.vibetrace.agent.selector;

import java.nio.file.Path;
import java.util.List;

/**
 * A method declaration found in a parsed source file.
 *
 * @param className      binary name of the declaring class ({@code com.example.Outer$Inner})
 * @param methodName     method name, or {@value #CONSTRUCTOR_NAME} for a constructor
 * @param parameterTypes erased simple type names, arrays and varargs as {@code T[]}
 * @param line           line of the method name
 * @param signature      declaration header without body or annotations
 * @param sourceText     full declaration text, including javadoc and body
 */
public record SourceMethod(
    String className,
    String methodName,
    List<String> parameterTypes,
    List<String> parameterNames,
    Path file,
    int line,
    String signature,
    String sourceText
) {

    public static final String CONSTRUCTOR_NAME = "<init>";
}
