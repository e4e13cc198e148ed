package com.vibetrace.agent;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Converts argument and return values to the human-readable text stored in the trace.
 *
 * Rules:
 * - null, booleans, JDK numbers, characters, strings, enums: JSON primitives
 * - arrays, collections: JSON arrays of at most maxCollectionElements entries, then "..."
 * - maps: JSON objects keyed by String.valueOf(key), same element cap
 * - Optional: its content, or null
 * - beyond depthLimit: "<TypeName>"
 * - cycles: "<circular>"
 * - objects whose class overrides toString(): that string
 * - other application objects: JSON object of declared and inherited instance fields
 * - other JDK objects: "<TypeName>"
 * - a value whose toString(), accessors or iteration throw: "<TypeName>"
 * - the rendered text is cut to {@link SerializerConfig#MAX_VALUE_LENGTH} characters
 */
public final class ValueSerializer {

    private static final Gson GSON = new GsonBuilder()
        .disableHtmlEscaping()
        .serializeNulls()
        .serializeSpecialFloatingPointValues()
        .create();

    private final SerializerConfig config;

    public ValueSerializer(SerializerConfig config) {
        this.config = config;
    }

    /** Serializes and truncates a value. Never throws for a misbehaving value. */
    public String toText(Object value) {
        try {
            return truncate(GSON.toJson(toJson(value, 0, new IdentityHashMap<>())));
        } catch (Throwable t) {
            CallRecorder.rethrowIfFatal(t);
            return GSON.toJson(placeholder(value.getClass()));
        }
    }

    public static String truncate(String text) {
        if (text == null || text.length() <= SerializerConfig.MAX_VALUE_LENGTH) return text;
        return text.substring(0, SerializerConfig.MAX_VALUE_LENGTH);
    }

    private JsonElement toJson(Object obj, int depth, IdentityHashMap<Object, Boolean> visited) {
        if (obj == null) return JsonNull.INSTANCE;

        if (obj instanceof Boolean b) return new JsonPrimitive(b);
        if (obj instanceof Number n && isJdkType(n.getClass())) return new JsonPrimitive(n);
        if (obj instanceof Character c) return new JsonPrimitive(c);
        if (obj instanceof CharSequence s) return new JsonPrimitive(s.toString());
        if (obj instanceof Enum<?> e) return new JsonPrimitive(e.name());

        Class<?> cls = obj.getClass();
        boolean container = cls.isArray() || obj instanceof Collection<?> || obj instanceof Map<?, ?>
            || obj instanceof Optional<?>;
        if (!container && overridesToString(cls)) return describe(obj);
        if (!container && isJdkType(cls)) return placeholder(cls);

        if (visited.containsKey(obj)) return new JsonPrimitive("<circular>");
        if (depth >= config.depthLimit) return placeholder(cls);

        visited.put(obj, Boolean.TRUE);
        try {
            if (obj instanceof Optional<?> optional) {
                return optional.isPresent() ? toJson(optional.get(), depth + 1, visited) : JsonNull.INSTANCE;
            }
            if (obj instanceof Map<?, ?> map) {
                return mapToJson(map, depth, visited);
            }
            if (!container) {
                return fieldsToJson(obj, depth, visited);
            }
            JsonArray array = new JsonArray();
            if (cls.isArray()) {
                int length = Array.getLength(obj);
                for (int i = 0; i < length; i++) {
                    if (i >= config.maxCollectionElements) {
                        array.add("...");
                        break;
                    }
                    array.add(toJson(Array.get(obj, i), depth + 1, visited));
                }
            } else {
                int count = 0;
                for (Object element : (Collection<?>) obj) {
                    if (count++ >= config.maxCollectionElements) {
                        array.add("...");
                        break;
                    }
                    array.add(toJson(element, depth + 1, visited));
                }
            }
            return array;
        } finally {
            visited.remove(obj);
        }
    }

    private JsonElement mapToJson(Map<?, ?> map, int depth, IdentityHashMap<Object, Boolean> visited) {
        JsonObject object = new JsonObject();
        int count = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (count++ >= config.maxCollectionElements) {
                object.addProperty("...", "...");
                break;
            }
            object.add(String.valueOf(entry.getKey()), toJson(entry.getValue(), depth + 1, visited));
        }
        return object;
    }

    private JsonElement fieldsToJson(Object obj, int depth, IdentityHashMap<Object, Boolean> visited) {
        JsonObject object = new JsonObject();
        for (Class<?> c = obj.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (field.isSynthetic() || Modifier.isStatic(field.getModifiers())) continue;
                if (object.has(field.getName())) continue;
                try {
                    field.setAccessible(true);
                    object.add(field.getName(), toJson(field.get(obj), depth + 1, visited));
                } catch (IllegalAccessException e) {
                    object.addProperty(field.getName(), "<inaccessible>");
                } catch (Throwable t) {
                    CallRecorder.rethrowIfFatal(t);
                    object.addProperty(field.getName(), "<inaccessible>");
                }
            }
        }
        return object;
    }

    private static JsonElement describe(Object obj) {
        Class<?> cls = obj.getClass();
        try {
            return new JsonPrimitive(String.valueOf(obj));
        } catch (Throwable t) {
            CallRecorder.rethrowIfFatal(t);
            return placeholder(cls);
        }
    }

    private static JsonElement placeholder(Class<?> cls) {
        String name = cls.getSimpleName();
        return new JsonPrimitive("<" + (name.isEmpty() ? cls.getName() : name) + ">");
    }

    static boolean overridesToString(Class<?> cls) {
        try {
            return cls.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException | SecurityException e) {
            return false;
        }
    }

    private static boolean isJdkType(Class<?> cls) {
        return cls.getPackageName().startsWith("java.");
    }
}
