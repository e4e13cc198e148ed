package com.vibetrace.agent.selector;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.ASTVisitor;
import org.eclipse.jdt.core.dom.AbstractTypeDeclaration;
import org.eclipse.jdt.core.dom.AnnotationTypeDeclaration;
import org.eclipse.jdt.core.dom.AnonymousClassDeclaration;
import org.eclipse.jdt.core.dom.ArrayType;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.eclipse.jdt.core.dom.EnumDeclaration;
import org.eclipse.jdt.core.dom.MethodDeclaration;
import org.eclipse.jdt.core.dom.Modifier;
import org.eclipse.jdt.core.dom.NameQualifiedType;
import org.eclipse.jdt.core.dom.ParameterizedType;
import org.eclipse.jdt.core.dom.PrimitiveType;
import org.eclipse.jdt.core.dom.QualifiedType;
import org.eclipse.jdt.core.dom.RecordDeclaration;
import org.eclipse.jdt.core.dom.SimpleType;
import org.eclipse.jdt.core.dom.SingleVariableDeclaration;
import org.eclipse.jdt.core.dom.Type;
import org.eclipse.jdt.core.dom.TypeDeclaration;
import org.eclipse.jdt.core.dom.TypeDeclarationStatement;
import org.eclipse.jdt.core.dom.TypeParameter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses one Java source file with Eclipse JDT (syntax only, no binding resolution) and
 * extracts the methods and constructors of its named types.
 */
public class JdtSourceParser {

    public ParsedSource parse(Path file) {
        String source;
        try {
            source = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InstrumentationException("Cannot read source file " + file + ": " + e.getMessage(), e);
        }
        return parse(file, source);
    }

    public ParsedSource parse(Path file, String source) {
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setResolveBindings(false);
        Map<String, String> options = new HashMap<>();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        parser.setCompilerOptions(options);
        parser.setSource(source.toCharArray());

        CompilationUnit cu = (CompilationUnit) parser.createAST(null);
        for (IProblem problem : cu.getProblems()) {
            if (problem.isError()) {
                throw new InstrumentationException("Syntax error in " + file + ":"
                    + problem.getSourceLineNumber() + ": " + problem.getMessage());
            }
        }

        String packageName = cu.getPackage() == null ? "" : cu.getPackage().getName().getFullyQualifiedName();
        MethodCollector collector = new MethodCollector(file, source, cu, packageName);
        cu.accept(collector);
        return new ParsedSource(file, packageName, collector.typeNames, collector.methods);
    }

    // -----------------------------------------------------------------------
    // Visitor
    // -----------------------------------------------------------------------

    private static final class MethodCollector extends ASTVisitor {

        private final Path file;
        private final String source;
        private final CompilationUnit cu;
        private final String packageName;
        private final Deque<String> types = new ArrayDeque<>();
        // type variable name -> erased simple name, innermost scope first
        private final Deque<Map<String, String>> typeVariables = new ArrayDeque<>();
        final List<String> typeNames = new ArrayList<>();
        final List<SourceMethod> methods = new ArrayList<>();

        MethodCollector(Path file, String source, CompilationUnit cu, String packageName) {
            this.file = file;
            this.source = source;
            this.cu = cu;
            this.packageName = packageName;
        }

        @Override
        public boolean visit(TypeDeclaration node) {
            enterType(node, node.typeParameters());
            return true;
        }

        @Override
        public void endVisit(TypeDeclaration node) {
            exitType();
        }

        @Override
        public boolean visit(EnumDeclaration node) {
            enterType(node, List.of());
            return true;
        }

        @Override
        public void endVisit(EnumDeclaration node) {
            exitType();
        }

        @Override
        public boolean visit(RecordDeclaration node) {
            enterType(node, node.typeParameters());
            return true;
        }

        @Override
        public void endVisit(RecordDeclaration node) {
            exitType();
        }

        @Override
        public boolean visit(AnnotationTypeDeclaration node) {
            enterType(node, List.of());
            return true;
        }

        @Override
        public void endVisit(AnnotationTypeDeclaration node) {
            exitType();
        }

        // Anonymous and local classes get compiler-assigned binary names; they are not indexed.
        @Override
        public boolean visit(AnonymousClassDeclaration node) {
            return false;
        }

        @Override
        public boolean visit(TypeDeclarationStatement node) {
            return false;
        }

        @Override
        public boolean visit(MethodDeclaration node) {
            if (types.isEmpty()) return false;

            typeVariables.push(erasures(node.typeParameters()));
            try {
                List<String> parameterTypes = new ArrayList<>();
                List<String> parameterNames = new ArrayList<>();
                List<String> declaredParameters = new ArrayList<>();
                for (Object p : node.parameters()) {
                    SingleVariableDeclaration param = (SingleVariableDeclaration) p;
                    String dims = "[]".repeat(param.getExtraDimensions());
                    parameterTypes.add(erase(param.getType()) + dims + (param.isVarargs() ? "[]" : ""));
                    parameterNames.add(param.getName().getIdentifier());
                    declaredParameters.add(param.getType() + (param.isVarargs() ? "..." : "")
                        + " " + param.getName().getIdentifier() + dims);
                }

                int start = node.getStartPosition();
                methods.add(new SourceMethod(
                    types.peek(),
                    node.isConstructor() ? SourceMethod.CONSTRUCTOR_NAME : node.getName().getIdentifier(),
                    List.copyOf(parameterTypes),
                    List.copyOf(parameterNames),
                    file,
                    cu.getLineNumber(node.getName().getStartPosition()),
                    signature(node, declaredParameters),
                    source.substring(start, start + node.getLength())
                ));
            } finally {
                typeVariables.pop();
            }
            // Bodies may declare anonymous classes, which are skipped anyway.
            return false;
        }

        private void enterType(AbstractTypeDeclaration node, List<?> typeParameters) {
            String simple = node.getName().getIdentifier();
            String binary;
            if (types.isEmpty()) {
                binary = packageName.isEmpty() ? simple : packageName + "." + simple;
            } else {
                binary = types.peek() + "$" + simple;
            }
            types.push(binary);
            typeNames.add(binary);
            typeVariables.push(erasures(typeParameters));
        }

        private void exitType() {
            types.pop();
            typeVariables.pop();
        }

        private Map<String, String> erasures(List<?> typeParameters) {
            Map<String, String> scope = new HashMap<>();
            for (Object o : typeParameters) {
                TypeParameter tp = (TypeParameter) o;
                List<?> bounds = tp.typeBounds();
                scope.put(tp.getName().getIdentifier(), bounds.isEmpty() ? "Object" : erase((Type) bounds.get(0)));
            }
            return scope;
        }

        private String erase(Type type) {
            if (type instanceof ParameterizedType pt) return erase(pt.getType());
            if (type instanceof ArrayType at) return erase(at.getElementType()) + "[]".repeat(at.getDimensions());
            if (type instanceof PrimitiveType) return type.toString();
            if (type instanceof QualifiedType qt) return qt.getName().getIdentifier();
            if (type instanceof NameQualifiedType nqt) return nqt.getName().getIdentifier();
            if (type instanceof SimpleType st) {
                String name = st.getName().getFullyQualifiedName();
                String simple = name.substring(name.lastIndexOf('.') + 1);
                if (name.equals(simple)) {
                    for (Map<String, String> scope : typeVariables) {
                        String erased = scope.get(simple);
                        if (erased != null) return erased;
                    }
                }
                return simple;
            }
            return type.toString();
        }

        private static String signature(MethodDeclaration node, List<String> declaredParameters) {
            StringBuilder sb = new StringBuilder();
            for (Object m : node.modifiers()) {
                if (m instanceof Modifier modifier) sb.append(modifier.getKeyword()).append(' ');
            }
            if (!node.typeParameters().isEmpty()) {
                List<String> tps = new ArrayList<>();
                for (Object tp : node.typeParameters()) tps.add(tp.toString());
                sb.append('<').append(String.join(", ", tps)).append("> ");
            }
            if (node.getReturnType2() != null) sb.append(node.getReturnType2()).append(' ');
            sb.append(node.getName().getIdentifier())
              .append('(').append(String.join(", ", declaredParameters)).append(')');
            if (!node.thrownExceptionTypes().isEmpty()) {
                List<String> thrown = new ArrayList<>();
                for (Object t : node.thrownExceptionTypes()) thrown.add(t.toString());
                sb.append(" throws ").append(String.join(", ", thrown));
            }
            return sb.toString();
        }
    }
}
