package com.vibetrace.agent;

import com.vibetrace.agent.selector.CodeSources;
import com.vibetrace.agent.selector.InstrumentationException;
import com.vibetrace.agent.selector.InstrumentationSelector;
import com.vibetrace.agent.store.SqliteTraceStore;
import com.vibetrace.agent.store.TraceStoreException;
import com.vibetrace.agent.store.TraceStores;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.asm.Advice;
import net.bytebuddy.description.method.MethodDescription;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.matcher.ElementMatcher;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.nio.file.Paths;
import java.util.concurrent.ConcurrentHashMap;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the target application JVM via:
 *   java -javaagent:vibetrace-agent-java.jar=project=/path/to/project,output=/path/to/dbs -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   project         - root of the project whose classes are traced (default: working directory)
 *   output          - directory receiving run_yyyyMMdd_HHmmss.db (default: ./vibetrace_db)
 *   db              - explicit database file, overrides output
 *   on_source_error - "fail" (default) or "fallback" when a selected class has no usable source
 *   depth           - serialization depth limit (default: 4)
 *   max_elements    - max collection elements to serialize (default: 100)
 */
public class AgentBootstrap {

    /** Shared config, set during premain. */
    public static volatile AgentConfig agentConfig;

    private static final ElementMatcher.Junction<MethodDescription> TRACED_METHODS =
        isMethod().and(not(isAbstract())).and(not(isNative())).and(not(isSynthetic()));

    private static final ConcurrentHashMap<String, InstrumentationException> loadFailures = new ConcurrentHashMap<>();

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        // Allow ByteBuddy to process Java versions beyond its officially supported range.
        System.setProperty("net.bytebuddy.experimental", "true");

        AgentConfig config = parseArgs(agentArgs);
        agentConfig = config;
        System.err.println("[vibetrace] project: " + config.projectRoot());
        System.err.println("[vibetrace] on_source_error=" + (config.failOnSourceError() ? "fail" : "fallback")
            + " depth=" + config.depthLimit() + " max_elements=" + config.maxCollectionElements());

        SqliteTraceStore store;
        try {
            store = config.databaseFile() != null
                ? TraceStores.open(Paths.get(config.databaseFile()))
                : TraceStores.openRun(Paths.get(config.outputDir()));
        } catch (TraceStoreException e) {
            System.err.println("[vibetrace] ERROR cannot open trace store, tracing disabled: " + e.getMessage());
            return;
        }
        System.err.println("[vibetrace] database: " + store.databaseFile());

        FunctionCatalog catalog = new FunctionCatalog();
        CallRecorder.install(new CallRecorder(store,
            new SerializerConfig(config.depthLimit(), config.maxCollectionElements()), catalog));

        // Register shutdown hook first so the store is closed even if instrumentation fails
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(store, store.databaseFile())));

        InstrumentationSelector selector = new InstrumentationSelector(Paths.get(config.projectRoot()), catalog);
        install(instrumentation, selector, config.failOnSourceError());
        System.err.println("[vibetrace] instrumentation installed");
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    static void install(Instrumentation instrumentation, InstrumentationSelector selector, boolean failOnSourceError) {
        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[vibetrace] TRANSFORM ERROR for " + typeName + ": " + throwable);
                }
            })
            .type((typeDescription, classLoader, module, classBeingRedefined, protectionDomain) ->
                selector.isSelected(typeDescription.getName(), CodeSources.toPath(protectionDomain)))
            .transform((builder, typeDescription, classLoader, module, protectionDomain) ->
                weave(builder, selector, typeDescription.getName(), failOnSourceError))
            .installOn(instrumentation);
    }

    /**
     * Prepares a selected class and weaves it. Methods and constructors are traced. When the
     * source cannot be prepared in fail mode, the static initializer, constructors and methods
     * raise the problem instead, so no code of the class runs untraced.
     */
    static DynamicType.Builder<?> weave(DynamicType.Builder<?> builder, InstrumentationSelector selector,
                                        String typeName, boolean failOnSourceError) {
        try {
            selector.prepare(typeName);
        } catch (InstrumentationException e) {
            System.err.println("[vibetrace] ERROR " + e.getMessage());
            if (failOnSourceError) {
                loadFailures.put(typeName, e);
                return builder.visit(Advice.to(LoadFailureAdvice.class)
                    .on(isTypeInitializer().or(isConstructor()).or(TRACED_METHODS)));
            }
            System.err.println("[vibetrace] tracing " + typeName + " with reflection metadata only");
        }
        return builder
            .visit(Advice.to(MethodAdvice.class).on(TRACED_METHODS))
            .visit(Advice.to(ConstructorAdvice.class).on(isConstructor()));
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static AgentConfig parseArgs(String agentArgs) {
        String projectRoot = System.getProperty("user.dir");
        String outputDir = Paths.get(System.getProperty("user.dir"), "vibetrace_db").toString();
        String databaseFile = null;
        boolean failOnSourceError = true;
        int depthLimit = 4;
        int maxCollectionElements = 100;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length != 2) continue;
                String value = kv[1].trim();
                switch (kv[0].trim()) {
                    case "project"         -> projectRoot       = value;
                    case "output"          -> outputDir         = value;
                    case "db"              -> databaseFile      = value;
                    case "on_source_error" -> failOnSourceError = !"fallback".equalsIgnoreCase(value);
                    case "depth"           -> depthLimit        = parseInt("depth", value, depthLimit);
                    case "max_elements"    -> maxCollectionElements = parseInt("max_elements", value, maxCollectionElements);
                    default -> System.err.println("[vibetrace] WARNING unknown agent argument: " + kv[0].trim());
                }
            }
        }
        return new AgentConfig(projectRoot, outputDir, databaseFile, failOnSourceError, depthLimit, maxCollectionElements);
    }

    private static int parseInt(String key, String value, int fallback) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            System.err.println("[vibetrace] WARNING " + key + "=" + value + " is not a number, using " + fallback);
            return fallback;
        }
    }

    // -----------------------------------------------------------------------
    // Public static accessor for LoadFailureAdvice (inlined bytecode must not
    // reach into package-private state of the agent).
    // -----------------------------------------------------------------------

    /** A fresh exception describing why {@code typeName} could not be traced, or null. */
    public static InstrumentationException loadFailure(String typeName) {
        InstrumentationException cause = loadFailures.get(typeName);
        if (cause == null) return null;
        return new InstrumentationException("Class " + typeName + " was not loaded for tracing: "
            + cause.getMessage(), cause);
    }

    static void recordLoadFailure(String typeName, InstrumentationException e) {
        loadFailures.put(typeName, e);
    }

    static void clearLoadFailures() {
        loadFailures.clear();
    }

    record AgentConfig(
        String projectRoot,
        String outputDir,
        String databaseFile,
        boolean failOnSourceError,
        int depthLimit,
        int maxCollectionElements
    ) {}
}
