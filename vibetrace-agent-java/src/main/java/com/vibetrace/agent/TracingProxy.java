package com.vibetrace.agent;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;

/**
 * Explicit wrapping for code that is not woven at load time: every interface method called on
 * the returned proxy is recorded against the target's implementing method.
 */
public final class TracingProxy {

    private TracingProxy() {}

    @SuppressWarnings("unchecked")
    public static <T> T wrap(CallRecorder recorder, Class<T> iface, T target) {
        if (!iface.isInterface()) {
            throw new IllegalArgumentException(iface.getName() + " is not an interface");
        }
        InvocationHandler handler = (proxy, method, args) -> {
            if (method.getDeclaringClass() == Object.class) {
                return invoke(method, target, args);
            }
            Method traced = implementationOf(target, method);
            Object[] arguments = args == null ? new Object[0] : args;
            return recorder.intercept(traced, target, arguments, () -> invoke(method, target, args));
        };
        return (T) Proxy.newProxyInstance(iface.getClassLoader(), new Class<?>[]{iface}, handler);
    }

    /** The method the target's class actually runs, or the interface method for lambdas. */
    static Method implementationOf(Object target, Method interfaceMethod) {
        Class<?> cls = target.getClass();
        if (cls.isSynthetic()) return interfaceMethod;
        try {
            return cls.getMethod(interfaceMethod.getName(), interfaceMethod.getParameterTypes());
        } catch (NoSuchMethodException e) {
            return interfaceMethod;
        }
    }

    private static Object invoke(Method method, Object target, Object[] args) throws Throwable {
        try {
            method.setAccessible(true);
            return method.invoke(target, args);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }
}
