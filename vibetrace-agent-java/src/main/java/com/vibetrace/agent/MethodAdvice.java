package com.vibetrace.agent;

import net.bytebuddy.asm.Advice;
import net.bytebuddy.implementation.bytecode.assign.Assigner;

import java.lang.reflect.Method;

/**
 * ByteBuddy advice woven into every selected method. Inlined into application classes, so it
 * may only use public members of the agent.
 *
 * Recorder failures are suppressed here; the method's own result and throwable pass through
 * untouched.
 */
public class MethodAdvice {

    @Advice.OnMethodEnter(suppress = Throwable.class)
    public static ActiveCall onEnter(
            @Advice.Origin Method method,
            @Advice.This(optional = true) Object self,
            @Advice.AllArguments(readOnly = true) Object[] args) {

        CallRecorder recorder = CallRecorder.installed();
        return recorder == null ? null : recorder.enter(method, self, args);
    }

    @Advice.OnMethodExit(onThrowable = Throwable.class, suppress = Throwable.class)
    public static void onExit(
            @Advice.Enter ActiveCall call,
            @Advice.Return(typing = Assigner.Typing.DYNAMIC, readOnly = true) Object returnValue,
            @Advice.Thrown(readOnly = true) Throwable thrown) {

        if (call != null) {
            call.recorder().exit(call, returnValue, thrown);
        }
    }
}
