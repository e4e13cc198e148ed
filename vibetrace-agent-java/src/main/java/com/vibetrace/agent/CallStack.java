package com.vibetrace.agent;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Per-thread stack of in-flight calls, plus the flag that marks a thread as currently running
 * recorder code. Each {@link CallRecorder} owns one, so recorders never see each other's frames.
 */
final class CallStack {

    private final ThreadLocal<Deque<ActiveCall>> frames = ThreadLocal.withInitial(ArrayDeque::new);

    // Set while the recorder itself runs on this thread; nested intercepted calls pass through.
    private final ThreadLocal<Boolean> busy = ThreadLocal.withInitial(() -> Boolean.FALSE);

    void push(ActiveCall call) {
        frames.get().push(call);
    }

    /**
     * Removes {@code call} and anything pushed above it. Frames above it can only exist if an
     * exit was skipped, which would otherwise corrupt the parent of every later call.
     */
    void pop(ActiveCall call) {
        Deque<ActiveCall> s = frames.get();
        if (!s.contains(call)) return;
        while (!s.isEmpty()) {
            if (s.pop() == call) break;
        }
    }

    /** Returns the innermost frame, or null if the thread is not inside a traced call. */
    ActiveCall peek() {
        return frames.get().peek();
    }

    /** Id of the innermost frame whose call row was stored, or null. */
    Long innermostRecordedId() {
        Iterator<ActiveCall> it = frames.get().iterator();
        while (it.hasNext()) {
            ActiveCall call = it.next();
            if (call.recorded()) return call.callId();
        }
        return null;
    }

    int depth() {
        return frames.get().size();
    }

    boolean isBusy() {
        return busy.get();
    }

    void setBusy(boolean value) {
        busy.set(value);
    }

    void clear() {
        frames.get().clear();
        busy.set(Boolean.FALSE);
    }
}
