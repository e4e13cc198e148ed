package com.vibetrace.agent;

import com.vibetrace.agent.selector.InstrumentationException;
import net.bytebuddy.asm.Advice;

/**
 * Woven instead of the tracing advice into classes whose source could not be prepared while
 * {@code on_source_error=fail}. Exceptions thrown by a class file transformer are discarded by
 * the JVM, so the failure is raised on first use of the class instead: from its static
 * initializer when it has one, otherwise from its constructors and methods.
 */
public class LoadFailureAdvice {

    @Advice.OnMethodEnter
    public static void onEnter(@Advice.Origin("#t") String typeName) {
        InstrumentationException failure = AgentBootstrap.loadFailure(typeName);
        if (failure != null) throw failure;
    }
}
