package com.vibetrace.agent.selector;

import com.vibetrace.agent.FunctionCatalog;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decides which loading classes get traced and collects their source metadata.
 *
 * {@link #isSelected} is cheap and runs for every class the JVM loads. {@link #prepare} parses
 * the declaring source file (once per file) and registers its methods in the catalog.
 */
public class InstrumentationSelector {

    static final List<String> EXCLUDED_PACKAGES = List.of("com.vibetrace.agent.", "net.bytebuddy.");

    // Generated proxies and lambda classes have no source of their own.
    static final List<String> EXCLUDED_NAME_FRAGMENTS = List.of("$$EnhancerBySpring", "$Proxy", "CGLIB", "$$Lambda");

    private final InclusionPolicy policy;
    private final SourceIndex index;
    private final JdtSourceParser parser;
    private final FunctionCatalog catalog;
    private final ConcurrentHashMap<Path, ParsedSource> parsed = new ConcurrentHashMap<>();

    public InstrumentationSelector(Path projectRoot, FunctionCatalog catalog) {
        this(new InclusionPolicy(projectRoot), new SourceRootResolver().resolve(projectRoot), catalog);
    }

    public InstrumentationSelector(InclusionPolicy policy, SourceRoots roots, FunctionCatalog catalog) {
        this.policy = policy;
        this.parser = new JdtSourceParser();
        this.index = new SourceIndex(roots, parser);
        this.catalog = catalog;
    }

    public boolean isSelected(String typeName, Path codeSource) {
        return !isExcludedName(typeName) && policy.evaluate(codeSource).included();
    }

    static boolean isExcludedName(String typeName) {
        for (String prefix : EXCLUDED_PACKAGES) {
            if (typeName.startsWith(prefix)) return true;
        }
        for (String fragment : EXCLUDED_NAME_FRAGMENTS) {
            if (typeName.contains(fragment)) return true;
        }
        return false;
    }

    /**
     * Parses the source declaring {@code typeName} and registers its methods.
     *
     * @throws InstrumentationException if the source cannot be located, read or parsed
     */
    public ParsedSource prepare(String typeName) {
        Path file = index.locate(typeName);
        return parsed.computeIfAbsent(file, f -> {
            ParsedSource source = parser.parse(f);
            catalog.register(source.methods());
            return source;
        });
    }

    public InclusionPolicy policy() {
        return policy;
    }
}
