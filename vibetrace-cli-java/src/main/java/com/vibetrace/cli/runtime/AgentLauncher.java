package com.vibetrace.cli.runtime;

import com.vibetrace.agent.store.TraceStores;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Launches the target program in a child JVM with the tracing agent attached, streams its
 * output and waits for it to exit.
 */
public class AgentLauncher {

    public static final int DEFAULT_TIMEOUT_SECONDS = 600;

    public static class AgentLaunchException extends RuntimeException {
        public AgentLaunchException(String msg) { super(msg); }
        public AgentLaunchException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** Exit code of the target JVM and the database its agent wrote. */
    public record LaunchResult(int exitCode, Path database) {}

    /**
     * @param javaArgs everything after {@code java -javaagent:...}, e.g. {@code -cp app.jar com.example.Main}
     */
    public LaunchResult launch(Path agentJar, Path projectRoot, Path outputDir, boolean failOnSourceError,
                               List<String> javaArgs, int timeoutSeconds) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new AgentLaunchException("Could not create output dir: " + outputDir, e);
        }
        Path database = TraceStores.runFile(outputDir.toAbsolutePath(), LocalDateTime.now());

        List<String> command = buildCommand(agentJar, projectRoot, database, failOnSourceError, javaArgs);
        System.err.println("[vibetrace-cli] Launching: " + String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command)
            .directory(projectRoot.toFile())
            .redirectErrorStream(true);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new AgentLaunchException("Failed to start target JVM: " + e.getMessage(), e);
        }

        // Stream app output to our stderr
        Thread logThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    System.err.println("[target-app] " + line);
                }
            } catch (IOException e) {
                System.err.println("[vibetrace-cli] WARNING lost target output: " + e.getMessage());
            }
        });
        logThread.setDaemon(true);
        logThread.start();

        int exitCode = waitFor(process, timeoutSeconds);
        try {
            logThread.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!Files.exists(database)) {
            throw new AgentLaunchException("Trace database not found at " + database
                + " after JVM exit (code " + exitCode + "). Was the agent attached?");
        }
        if (exitCode != 0) {
            System.err.println("[vibetrace-cli] WARNING target JVM exited with code " + exitCode);
        }
        return new LaunchResult(exitCode, database);
    }

    static List<String> buildCommand(Path agentJar, Path projectRoot, Path database, boolean failOnSourceError,
                                     List<String> javaArgs) {
        String javaHome = System.getProperty("java.home");
        String javaExe = javaHome != null ? Path.of(javaHome, "bin", "java").toString() : "java";

        String agentArg = agentJar.toAbsolutePath()
            + "=project=" + projectRoot.toAbsolutePath()
            + ",db=" + database.toAbsolutePath()
            + ",on_source_error=" + (failOnSourceError ? "fail" : "fallback");

        List<String> command = new ArrayList<>();
        command.add(javaExe);
        command.add("-javaagent:" + agentArg);
        command.addAll(javaArgs);
        return command;
    }

    private static int waitFor(Process process, int timeoutSeconds) {
        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new AgentLaunchException("Target JVM did not exit within " + timeoutSeconds + "s.");
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new AgentLaunchException("Interrupted while waiting for target JVM", e);
        }
    }
}
