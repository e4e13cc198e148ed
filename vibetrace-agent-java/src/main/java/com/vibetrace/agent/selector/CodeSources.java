package com.vibetrace.agent.selector;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Path;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Converts the code source of a class (the class directory or jar it was loaded from) to a
 * file system path.
 */
public final class CodeSources {

    private CodeSources() {}

    /** Location of the directory or jar that defines {@code type}, or null when unknown. */
    public static Path locationOf(Class<?> type) {
        try {
            return toPath(type.getProtectionDomain());
        } catch (SecurityException e) {
            return null;
        }
    }

    public static Path toPath(ProtectionDomain domain) {
        if (domain == null) return null;
        CodeSource source = domain.getCodeSource();
        return source == null ? null : toPath(source.getLocation());
    }

    /**
     * Handles {@code file:} URLs and {@code jar:file:...!/} URLs. Anything else (in-memory or
     * remote class loaders) has no path.
     */
    public static Path toPath(URL location) {
        if (location == null) return null;
        String text = location.toString();
        if (text.startsWith("jar:")) {
            int separator = text.indexOf("!/");
            text = separator >= 0 ? text.substring(4, separator) : text.substring(4);
        }
        if (!text.startsWith("file:")) return null;
        try {
            return Path.of(new URI(text));
        } catch (URISyntaxException | IllegalArgumentException | FileSystemNotFoundException e) {
            return null;
        }
    }
}
