package com.vibetrace.cli;

import com.vibetrace.agent.store.SqliteTraceStore;
import com.vibetrace.agent.store.TraceStores;
import com.vibetrace.cli.report.TraceRenderer;
import com.vibetrace.cli.runtime.AgentLauncher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Entry point for the vibetrace command line.
 *
 * Usage:
 *   java -jar vibetrace-cli-java.jar run \
 *     --project <project-dir> \
 *     --agent   <path-to-vibetrace-agent-java.jar> \
 *     [--output <db-dir>] [--on-source-error fail|fallback] [--timeout <seconds>] \
 *     -- <java args, e.g. -cp target/classes com.example.Main>
 *
 *   java -jar vibetrace-cli-java.jar dump --db <run.db> [--output <file>]
 */
public class CliMain {

    static final String USAGE = "Usage:\n"
        + "  vibetrace run --project <dir> --agent <jar> [--output <dir>] [--on-source-error fail|fallback]"
        + " [--timeout <s>] -- <java args>\n"
        + "  vibetrace dump --db <file> [--output <file>]";

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (UsageException e) {
            System.err.println("[vibetrace-cli] ERROR: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[vibetrace-cli] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Runs a subcommand and returns the process exit code. */
    static int run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        return switch (args[0]) {
            case "run" -> runCommand(Arrays.copyOfRange(args, 1, args.length));
            case "dump" -> dumpCommand(Arrays.copyOfRange(args, 1, args.length));
            default -> throw new UsageException("Unknown subcommand: " + args[0]);
        };
    }

    // -----------------------------------------------------------------------
    // run
    // -----------------------------------------------------------------------

    static RunOptions parseRun(String[] args) {
        String project = null;
        String agent = null;
        String output = null;
        boolean failOnSourceError = true;
        int timeout = AgentLauncher.DEFAULT_TIMEOUT_SECONDS;
        List<String> javaArgs = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--")) {
                javaArgs.addAll(Arrays.asList(args).subList(i + 1, args.length));
                break;
            }
            switch (args[i]) {
                case "--project"         -> project = requireNext(args, i++, "--project");
                case "--agent"           -> agent   = requireNext(args, i++, "--agent");
                case "--output"          -> output  = requireNext(args, i++, "--output");
                case "--on-source-error" -> failOnSourceError = parseSourceErrorMode(requireNext(args, i++, "--on-source-error"));
                case "--timeout"         -> timeout = parseTimeout(requireNext(args, i++, "--timeout"));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (project == null) throw new UsageException("--project is required");
        if (agent == null)   throw new UsageException("--agent is required");
        if (javaArgs.isEmpty()) throw new UsageException("Java arguments are required after --");

        Path projectRoot = Paths.get(project).toAbsolutePath().normalize();
        Path outputDir = output != null ? Paths.get(output) : projectRoot.resolve("vibetrace_db");
        return new RunOptions(projectRoot, Paths.get(agent), outputDir, failOnSourceError, timeout, List.copyOf(javaArgs));
    }

    private static int runCommand(String[] args) {
        RunOptions options = parseRun(args);
        if (!Files.isDirectory(options.projectRoot())) {
            throw new UsageException("Project directory not found: " + options.projectRoot());
        }
        if (!Files.isRegularFile(options.agentJar())) {
            throw new UsageException("Agent jar not found: " + options.agentJar());
        }

        System.err.println("[vibetrace-cli] Tracing project: " + options.projectRoot());
        AgentLauncher.LaunchResult result = new AgentLauncher().launch(
            options.agentJar(),
            options.projectRoot(),
            options.outputDir(),
            options.failOnSourceError(),
            options.javaArgs(),
            options.timeoutSeconds()
        );
        System.err.println("[vibetrace-cli] Trace database: " + result.database());
        return result.exitCode();
    }

    private static boolean parseSourceErrorMode(String value) {
        return switch (value) {
            case "fail" -> true;
            case "fallback" -> false;
            default -> throw new UsageException("--on-source-error must be fail or fallback, got: " + value);
        };
    }

    private static int parseTimeout(String value) {
        try {
            int seconds = Integer.parseInt(value);
            if (seconds <= 0) throw new UsageException("--timeout must be positive, got: " + value);
            return seconds;
        } catch (NumberFormatException e) {
            throw new UsageException("--timeout must be a number of seconds, got: " + value);
        }
    }

    record RunOptions(Path projectRoot, Path agentJar, Path outputDir, boolean failOnSourceError,
                      int timeoutSeconds, List<String> javaArgs) {}

    // -----------------------------------------------------------------------
    // dump
    // -----------------------------------------------------------------------

    static DumpOptions parseDump(String[] args) {
        String db = null;
        String output = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--db"     -> db     = requireNext(args, i++, "--db");
                case "--output" -> output = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (db == null) throw new UsageException("--db is required");

        Path database = Paths.get(db).toAbsolutePath();
        return new DumpOptions(database, output != null ? Paths.get(output) : defaultDumpFile(database));
    }

    /** {@code <dir>/run_x.db} dumps to {@code <dir>/run_x/dump_llm.txt}. */
    static Path defaultDumpFile(Path database) {
        String name = database.getFileName().toString();
        String stem = name.endsWith(".db") ? name.substring(0, name.length() - 3) : name;
        return database.resolveSibling(stem).resolve("dump_llm.txt");
    }

    private static int dumpCommand(String[] args) {
        DumpOptions options = parseDump(args);
        if (!Files.isRegularFile(options.database())) {
            throw new UsageException("Trace database not found: " + options.database());
        }

        String text;
        try (SqliteTraceStore store = TraceStores.open(options.database())) {
            text = new TraceRenderer().render(store);
        }
        try {
            Path parent = options.output().toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(options.output(), text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write " + options.output(), e);
        }
        System.err.println("[vibetrace-cli] Dump written: " + options.output());
        return 0;
    }

    record DumpOptions(Path database, Path output) {}

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
