package com.vibetrace.agent;

import com.vibetrace.agent.selector.CodeSources;
import com.vibetrace.agent.selector.SourceMethod;
import com.vibetrace.agent.store.CallKind;
import com.vibetrace.agent.store.CallOutcome;
import com.vibetrace.agent.store.CallStart;
import com.vibetrace.agent.store.FunctionDefinition;
import com.vibetrace.agent.store.TraceStore;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.Executable;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Records the lifecycle of traced invocations into a {@link TraceStore}.
 *
 * Two-phase: {@link #enter} writes the Call and Argument rows before the body runs,
 * {@link #exit} completes the row with duration and outcome. The program's own result or
 * throwable is never altered. Failures inside the recorder, storage or serialization alike, are
 * logged and otherwise ignored; only fatal VM errors other than stack overflow propagate.
 */
public final class CallRecorder {

    private static volatile CallRecorder installed;

    private final TraceStore store;
    private final ValueSerializer serializer;
    private final FunctionCatalog catalog;
    private final CallStack stack = new CallStack();
    private final ConcurrentHashMap<Executable, Long> functionIds = new ConcurrentHashMap<>();

    public CallRecorder(TraceStore store) {
        this(store, SerializerConfig.defaults(), new FunctionCatalog());
    }

    public CallRecorder(TraceStore store, SerializerConfig config, FunctionCatalog catalog) {
        this.store = store;
        this.serializer = new ValueSerializer(config);
        this.catalog = catalog;
    }

    // -----------------------------------------------------------------------
    // Process-wide instance used by woven advice
    // -----------------------------------------------------------------------

    public static void install(CallRecorder recorder) {
        installed = recorder;
    }

    /** The recorder woven advice reports to, or null when tracing is off. */
    public static CallRecorder installed() {
        return installed;
    }

    public static void uninstall() {
        installed = null;
    }

    // -----------------------------------------------------------------------
    // Explicit wrapping
    // -----------------------------------------------------------------------

    /**
     * Runs {@code body} as a traced invocation of {@code executable}. Returns its result or
     * rethrows its throwable, both unchanged.
     */
    public <T, E extends Throwable> T intercept(Executable executable, Object receiver, Object[] args,
                                                TracedBody<T, E> body) throws E {
        ActiveCall call = enter(executable, receiver, args);
        T result;
        try {
            result = body.call();
        } catch (Throwable t) {
            exit(call, null, t);
            throw t;
        }
        exit(call, result, null);
        return result;
    }

    // -----------------------------------------------------------------------
    // Two-phase protocol
    // -----------------------------------------------------------------------

    /**
     * Opens a traced invocation. Returns null when the thread is already inside recorder code,
     * in which case the invocation is not traced and {@link #exit} ignores it.
     * A constructor is entered with a null receiver.
     */
    public ActiveCall enter(Executable executable, Object receiver, Object[] args) {
        if (stack.isBusy()) return null;
        stack.setBusy(true);
        try {
            double timestamp = epochSeconds(Instant.now());
            Long parentId = stack.innermostRecordedId();
            Long callId = null;
            try {
                long functionId = functionId(executable, receiver);
                CallKind kind = classify(executable, receiver, args);
                CallStart start = new CallStart(functionId, parentId, timestamp,
                    Thread.currentThread().getId(), isCoroutine(executable), kind,
                    className(kind, executable, receiver, args));
                callId = store.insertCall(start);
                store.insertArguments(callId, bindArguments(executable, args));
            } catch (Throwable t) {
                rethrowIfFatal(t);
                warn("could not record call to " + describeMethod(executable), t);
            }
            // pushed even when a later step failed, so that an inserted row still gets completed
            ActiveCall call = new ActiveCall(this, executable, callId, parentId, System.nanoTime());
            stack.push(call);
            return call;
        } finally {
            stack.setBusy(false);
        }
    }

    /**
     * Completes a traced invocation. {@code thrown} is null on normal return; {@code result}
     * is ignored when {@code thrown} is set.
     */
    public void exit(ActiveCall call, Object result, Throwable thrown) {
        if (call == null) return;
        double durationMs = (System.nanoTime() - call.startNanos()) / 1_000_000.0;
        stack.setBusy(true);
        try {
            if (call.recorded()) {
                CallOutcome outcome = thrown != null
                    ? CallOutcome.raised(durationMs, exceptionType(thrown),
                        ValueSerializer.truncate(thrown.getMessage()), stackTrace(thrown))
                    : CallOutcome.returned(durationMs, returnText(call.executable(), result));
                store.completeCall(call.callId(), outcome);
            }
        } catch (Throwable t) {
            rethrowIfFatal(t);
            warn("could not complete call " + call.callId() + " to " + describeMethod(call.executable()), t);
        } finally {
            stack.setBusy(false);
            stack.pop(call);
        }
    }

    /** Number of frames on the current thread's stack. */
    public int depth() {
        return stack.depth();
    }

    public TraceStore store() {
        return store;
    }

    public FunctionCatalog catalog() {
        return catalog;
    }

    // -----------------------------------------------------------------------
    // Function identity
    // -----------------------------------------------------------------------

    private long functionId(Executable executable, Object receiver) {
        return functionIds.computeIfAbsent(executable,
            e -> store.findOrCreateFunction(describe(e, receiver)));
    }

    FunctionDefinition describe(Executable executable, Object receiver) {
        Class<?> declaring = executable.getDeclaringClass();
        SourceMethod source = catalog.find(executable);
        return new FunctionDefinition(
            declaring.getPackageName(),
            qualifiedName(executable),
            source != null ? source.file().toString() : codeLocation(declaring),
            source != null ? source.line() : -1,
            source != null ? source.signature() : executable.toGenericString(),
            annotations(executable),
            defaults(executable),
            closureVars(receiver),
            source != null ? source.sourceText() : null
        );
    }

    /**
     * {@code Outer.Inner.name(int, String)}: class path relative to the package plus erased parameters.
     * Constructors are named {@code <init>}.
     */
    static String qualifiedName(Executable executable) {
        Class<?> declaring = executable.getDeclaringClass();
        String pkg = declaring.getPackageName();
        String className = declaring.getName();
        if (!pkg.isEmpty()) className = className.substring(pkg.length() + 1);
        List<String> params = new ArrayList<>();
        for (Class<?> p : executable.getParameterTypes()) {
            params.add(p.getSimpleName());
        }
        return className.replace('$', '.') + "." + FunctionCatalog.sourceName(executable)
            + "(" + String.join(", ", params) + ")";
    }

    private static String codeLocation(Class<?> declaring) {
        Path location = CodeSources.locationOf(declaring);
        return location != null ? location.toString() : "<unknown>";
    }

    private String annotations(Executable executable) {
        Annotation[] annotations = executable.getAnnotations();
        if (annotations.length == 0) return null;
        List<String> rendered = new ArrayList<>();
        for (Annotation a : annotations) {
            rendered.add(a.toString());
        }
        return serializer.toText(rendered);
    }

    private String defaults(Executable executable) {
        if (!(executable instanceof Method method)) return null;
        Object value = method.getDefaultValue();
        return value == null ? null : serializer.toText(value);
    }

    /**
     * Values captured by a local or anonymous class ({@code val$x}) or by a lambda
     * ({@code arg$1}), read from the receiver of the first recorded call.
     */
    private String closureVars(Object receiver) {
        if (receiver == null) return null;
        Class<?> cls = receiver.getClass();
        String prefix;
        if (cls.isAnonymousClass() || cls.isLocalClass()) {
            prefix = "val$";
        } else if (cls.isSynthetic()) {
            prefix = "arg$";
        } else {
            return null;
        }
        Map<String, Object> captured = new LinkedHashMap<>();
        for (Field field : cls.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || !field.getName().startsWith(prefix)) continue;
            try {
                field.setAccessible(true);
                captured.put(prefix.equals("val$") ? field.getName().substring(prefix.length()) : field.getName(),
                    field.get(receiver));
            } catch (RuntimeException | IllegalAccessException e) {
                captured.put(field.getName(), "<inaccessible>");
            }
        }
        return captured.isEmpty() ? null : serializer.toText(captured);
    }

    // -----------------------------------------------------------------------
    // Call attributes
    // -----------------------------------------------------------------------

    static CallKind classify(Executable executable, Object receiver, Object[] args) {
        if (executable instanceof Constructor<?>) return CallKind.INSTANCE_METHOD;
        if (!Modifier.isStatic(executable.getModifiers())) {
            return receiver != null && receiver.getClass().isSynthetic() ? CallKind.FUNCTION : CallKind.INSTANCE_METHOD;
        }
        Class<?>[] params = executable.getParameterTypes();
        if (params.length > 0 && params[0] == Class.class && args != null && args.length > 0 && args[0] != null) {
            return CallKind.CLASS_METHOD;
        }
        return CallKind.STATIC_METHOD;
    }

    static String className(CallKind kind, Executable executable, Object receiver, Object[] args) {
        return switch (kind) {
            case FUNCTION -> null;
            case INSTANCE_METHOD -> simpleName(receiver != null ? receiver.getClass() : executable.getDeclaringClass());
            case CLASS_METHOD -> simpleName((Class<?>) args[0]);
            case STATIC_METHOD -> simpleName(executable.getDeclaringClass());
        };
    }

    static boolean isCoroutine(Executable executable) {
        if (!(executable instanceof Method method)) return false;
        Class<?> returnType = method.getReturnType();
        return CompletionStage.class.isAssignableFrom(returnType) || Future.class.isAssignableFrom(returnType);
    }

    private Map<String, String> bindArguments(Executable executable, Object[] args) {
        Map<String, String> bound = new LinkedHashMap<>();
        if (args == null) return bound;
        List<String> names = parameterNames(executable);
        for (int i = 0; i < args.length; i++) {
            String name = i < names.size() ? names.get(i) : "arg" + i;
            bound.put(name, serializer.toText(args[i]));
        }
        return bound;
    }

    private List<String> parameterNames(Executable executable) {
        List<String> names = new ArrayList<>();
        for (Parameter p : executable.getParameters()) {
            names.add(p.getName());
        }
        SourceMethod source = catalog.find(executable);
        int implicit = FunctionCatalog.implicitParameterCount(executable);
        if (source != null && implicit + source.parameterNames().size() == names.size()) {
            List<String> declared = new ArrayList<>(names.subList(0, implicit));
            declared.addAll(source.parameterNames());
            return declared;
        }
        return names;
    }

    // constructors and void methods have no return value
    private String returnText(Executable executable, Object result) {
        if (!(executable instanceof Method method) || method.getReturnType() == void.class) return null;
        return serializer.toText(result);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + (instant.getNano() / 1_000) / 1_000_000.0;
    }

    static String stackTrace(Throwable thrown) {
        StringWriter out = new StringWriter();
        thrown.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    /** Simple class name of the throwable; binary name for anonymous and local classes. */
    static String exceptionType(Throwable thrown) {
        return simpleName(thrown.getClass());
    }

    /**
     * Lets errors the JVM cannot recover from reach the program. Stack overflow is not one of them:
     * it is typically raised inside the recorder by a value's own recursive {@code toString()}.
     */
    static void rethrowIfFatal(Throwable t) {
        if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) {
            throw (VirtualMachineError) t;
        }
    }

    private static String simpleName(Class<?> cls) {
        String name = cls.getSimpleName();
        return name.isEmpty() ? cls.getName() : name;
    }

    private static String describeMethod(Executable executable) {
        return executable.getDeclaringClass().getName() + "." + FunctionCatalog.sourceName(executable);
    }

    private static void warn(String message, Throwable t) {
        System.err.println("[vibetrace] WARNING " + message + ": " + t);
    }
}
