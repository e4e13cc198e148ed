package com.vibetrace.cli.report;

import com.vibetrace.agent.store.ArgumentRecord;
import com.vibetrace.agent.store.CallRecord;
import com.vibetrace.agent.store.FunctionDefinition;
import com.vibetrace.agent.store.FunctionRecord;
import com.vibetrace.agent.store.TraceStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a trace store as the plain-text dump handed to LLMs: a metadata block per function,
 * then every call tree depth-first.
 *
 * Read-only and deterministic: roots and siblings are ordered by start time, then by id.
 * A call whose parent row is missing is rendered as a root.
 */
public class TraceRenderer {

    static final Comparator<CallRecord> START_ORDER =
        Comparator.comparingDouble(CallRecord::timestamp).thenComparingLong(CallRecord::id);

    public String render(TraceStore store) {
        return render(store.listFunctions(), store.listCalls(), store.listArguments());
    }

    String render(List<FunctionRecord> functions, List<CallRecord> calls, List<ArgumentRecord> arguments) {
        List<String> lines = new ArrayList<>();
        renderFunctions(functions, lines);
        renderCalls(calls, arguments, lines);
        return String.join("\n", lines);
    }

    // -----------------------------------------------------------------------
    // Functions Metadata
    // -----------------------------------------------------------------------

    private void renderFunctions(List<FunctionRecord> functions, List<String> lines) {
        lines.add("=== Functions Metadata ===");
        List<FunctionRecord> ordered = new ArrayList<>(functions);
        ordered.sort(Comparator.comparingLong(FunctionRecord::id));
        for (FunctionRecord f : ordered) {
            FunctionDefinition d = f.definition();
            lines.add("Function ID: " + f.id());
            lines.add("Module: " + d.module());
            lines.add("Qualified Name: " + d.qualname());
            lines.add("Defined at: " + d.filename() + ":" + d.lineno());
            lines.add("Signature: " + d.signature());
            if (notEmpty(d.annotations())) lines.add("Annotations: " + d.annotations());
            if (notEmpty(d.defaults())) lines.add("Defaults: " + d.defaults());
            if (notEmpty(d.closureVars())) lines.add("Closure Vars: " + d.closureVars());
            lines.add("Source Code:");
            if (d.sourceCode() != null) {
                for (String sourceLine : d.sourceCode().split("\\R")) {
                    lines.add("    " + sourceLine);
                }
            }
            lines.add("");
        }
    }

    // -----------------------------------------------------------------------
    // Call Execution Flow
    // -----------------------------------------------------------------------

    private void renderCalls(List<CallRecord> calls, List<ArgumentRecord> arguments, List<String> lines) {
        lines.add("=== Call Execution Flow ===");

        Map<Long, CallRecord> byId = new HashMap<>();
        for (CallRecord c : calls) byId.put(c.id(), c);

        Map<Long, List<CallRecord>> children = new HashMap<>();
        List<CallRecord> roots = new ArrayList<>();
        for (CallRecord c : calls) {
            if (c.parentCallId() == null || !byId.containsKey(c.parentCallId())) {
                roots.add(c);
            } else {
                children.computeIfAbsent(c.parentCallId(), k -> new ArrayList<>()).add(c);
            }
        }
        roots.sort(START_ORDER);
        children.values().forEach(list -> list.sort(START_ORDER));

        Map<Long, Map<String, String>> argumentsByCall = new HashMap<>();
        List<ArgumentRecord> orderedArguments = new ArrayList<>(arguments);
        orderedArguments.sort(Comparator.comparingLong(ArgumentRecord::id));
        for (ArgumentRecord a : orderedArguments) {
            argumentsByCall.computeIfAbsent(a.callId(), k -> new LinkedHashMap<>()).put(a.name(), a.value());
        }

        for (CallRecord root : roots) {
            // Iterative depth-first walk; children pushed in reverse to pop in start order.
            Deque<Frame> pending = new ArrayDeque<>();
            pending.push(new Frame(root, 0));
            while (!pending.isEmpty()) {
                Frame frame = pending.pop();
                renderCall(frame.call(), frame.depth(), argumentsByCall.get(frame.call().id()), lines);
                List<CallRecord> kids = children.getOrDefault(frame.call().id(), List.of());
                for (int i = kids.size() - 1; i >= 0; i--) {
                    pending.push(new Frame(kids.get(i), frame.depth() + 1));
                }
            }
            lines.add("");
        }
    }

    private void renderCall(CallRecord c, int depth, Map<String, String> args, List<String> lines) {
        String prefix = "[DEPTH=" + depth + "] ";
        lines.add(prefix + "CALL " + c.id() + ":");
        lines.add(prefix + "  Function ID: " + c.functionId());
        lines.add(prefix + "  Timestamp: " + String.format(Locale.ROOT, "%.6f", c.timestamp()));
        lines.add(prefix + "  Duration (ms): "
            + (c.durationMs() == null ? "null" : String.format(Locale.ROOT, "%.3f", c.durationMs())));
        lines.add(prefix + "  Thread ID: " + c.threadId() + "  Coroutine: " + c.coroutine());
        lines.add(prefix + "  Method Type: " + c.kind().storedName() + "  Class: " + c.className());
        if (args != null && !args.isEmpty()) {
            lines.add(prefix + "  Arguments:");
            for (Map.Entry<String, String> arg : args.entrySet()) {
                lines.add(prefix + "    - " + arg.getKey() + ": " + arg.getValue());
            }
        }
        if (c.returnValue() != null) lines.add(prefix + "  Return Value: " + c.returnValue());
        if (notEmpty(c.exceptionType())) {
            lines.add(prefix + "  Exception: " + c.exceptionType() + " - " + c.exceptionMessage());
        }
        if (notEmpty(c.traceback())) {
            lines.add(prefix + "  Traceback:");
            for (String tbLine : c.traceback().split("\\R")) {
                lines.add(prefix + "    " + tbLine);
            }
        }
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    private record Frame(CallRecord call, int depth) {}
}
