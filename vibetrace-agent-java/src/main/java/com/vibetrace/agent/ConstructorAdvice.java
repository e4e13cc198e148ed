package com.vibetrace.agent;

import net.bytebuddy.asm.Advice;

import java.lang.reflect.Constructor;

/**
 * ByteBuddy advice woven into every constructor of a selected class. The receiver is not yet
 * initialized on entry, so the call is recorded without one.
 *
 * ByteBuddy cannot catch a throwable around a constructor body. A constructor that throws leaves
 * its row without an outcome; its frame is discarded when the enclosing traced call exits.
 */
public class ConstructorAdvice {

    @Advice.OnMethodEnter(suppress = Throwable.class)
    public static ActiveCall onEnter(
            @Advice.Origin Constructor<?> constructor,
            @Advice.AllArguments(readOnly = true) Object[] args) {

        CallRecorder recorder = CallRecorder.installed();
        return recorder == null ? null : recorder.enter(constructor, null, args);
    }

    @Advice.OnMethodExit(suppress = Throwable.class)
    public static void onExit(@Advice.Enter ActiveCall call) {
        if (call != null) {
            call.recorder().exit(call, null, null);
        }
    }
}
