package jsontree;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Stack;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.Vector;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;
import jsontree.JsonException.ConversionException;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;

/**
 * Reflection helpers shared by the decoder.
 *
 * @author Freeman
 * @since 0.1.0
 */
final class Types {

    private Types() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Type shapes
    // ============================================================

    static Class<?> raw(Type t) {
        if (t instanceof Class<?> c) return c;
        if (t instanceof ParameterizedType p) return (Class<?>) p.getRawType();
        if (t instanceof GenericArrayType ga) {
            var comp = raw(ga.getGenericComponentType());
            return Array.newInstance(comp, 0).getClass();
        }
        if (t instanceof TypeVariable<?> tv) return raw(erasureOf(tv));
        if (t instanceof WildcardType w) return raw(erasureOf(w));
        throw new IllegalArgumentException("Unsupported type: " + t);
    }

    static Type canonicalize(Type t) {
        if (t instanceof WildcardType w) return erasureOf(w);
        if (t instanceof TypeVariable<?> tv) return erasureOf(tv);
        return t;
    }

    static Type erasureOf(WildcardType w) {
        var uppers = w.getUpperBounds();
        return uppers.length == 0 ? Object.class : uppers[0];
    }

    static Type erasureOf(TypeVariable<?> tv) {
        var uppers = tv.getBounds();
        return uppers.length == 0 ? Object.class : uppers[0];
    }

    static boolean typeBetween(Class<?> raw, @Nullable Class<?> lower, @Nullable Class<?> upper) {
        return (lower == null || raw.isAssignableFrom(lower)) && (upper == null || upper.isAssignableFrom(raw));
    }

    /**
     * Type argument {@code index} of a parameterized type, {@code Object} for a raw type.
     */
    static Type typeArgument(Type t, int index) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[index]);
        return Object.class;
    }

    static Type mapKeyType(Type t) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[0]);
        return String.class;
    }

    static Type mapValueType(Type t) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[1]);
        return Object.class;
    }

    static Type collectionElementType(Type t) {
        if (t instanceof ParameterizedType p) return canonicalize(p.getActualTypeArguments()[0]);
        if (t instanceof GenericArrayType ga) return canonicalize(ga.getGenericComponentType());
        if (t instanceof Class<?> c && c.isArray()) return c.getComponentType();
        return Object.class;
    }

    /**
     * Holder types the decoder looks through: {@code Optional}, {@code AtomicReference} and {@link Ref}.
     */
    static boolean isIndirection(Class<?> raw) {
        return raw == Optional.class || raw == AtomicReference.class || Ref.class.isAssignableFrom(raw);
    }

    /**
     * Open destinations resolved from the node kind or the type registry: {@code Object}, interfaces and
     * abstract classes, except collections and maps which are decoded structurally.
     */
    static boolean isDynamic(Class<?> raw) {
        if (raw == Object.class) return true;
        if (raw.isPrimitive() || raw.isArray()) return false;
        if (!raw.isInterface() && !Modifier.isAbstract(raw.getModifiers())) return false;
        return !Collection.class.isAssignableFrom(raw) && !Map.class.isAssignableFrom(raw) && !isIndirection(raw);
    }

    /**
     * Classes decoded field by field: concrete, non-JDK classes that are neither enums, records nor nodes.
     */
    static boolean isStruct(Class<?> raw) {
        if (raw.isPrimitive() || raw.isArray() || raw.isInterface() || raw.isEnum() || raw.isRecord()) return false;
        if (Modifier.isAbstract(raw.getModifiers())) return false;
        return !isJdkType(raw) && !Node.class.isAssignableFrom(raw);
    }

    static boolean isJdkType(Class<?> raw) {
        var name = raw.getName();
        return name.startsWith("java.") || name.startsWith("javax.") || name.startsWith("jdk.");
    }

    static boolean isClassPresent(String name) {
        try {
            Class.forName(name);
            return true;
        } catch (ClassNotFoundException e) {
            return false;
        }
    }

    // ============================================================
    // Values
    // ============================================================

    static @Nullable Object defaultValue(Class<?> t) {
        if (t == boolean.class) return false;
        if (t == byte.class) return (byte) 0;
        if (t == short.class) return (short) 0;
        if (t == int.class) return 0;
        if (t == long.class) return 0L;
        if (t == float.class) return 0f;
        if (t == double.class) return 0d;
        if (t == char.class) return '\0';
        if (t == Optional.class) return Optional.empty();
        return null;
    }

    static Object instantiate(Class<?> raw) {
        try {
            Constructor<?> ctor = raw.getDeclaredConstructor();
            makeAccessible(ctor, raw);
            return ctor.newInstance();
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ConversionException(
                    ConversionException.Reason.INSTANTIATION,
                    "Cannot instantiate " + raw.getName() + " (no accessible no-arg constructor)",
                    null,
                    raw,
                    e);
        }
    }

    /**
     * Reset every instance field of {@code o}, including inherited and non-public ones, to its default value.
     */
    @SneakyThrows
    static void clearFields(Object o) {
        for (Class<?> c = o.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (Modifier.isStatic(mod) || Modifier.isFinal(mod) || f.isSynthetic()) continue;
                if (!f.trySetAccessible()) continue;
                f.set(o, defaultValue(f.getType()));
            }
        }
    }

    static void makeAccessible(Constructor<?> c, Class<?> raw) {
        if (!Modifier.isPublic(c.getModifiers()) || !Modifier.isPublic(raw.getModifiers())) c.setAccessible(true);
    }

    static void makeAccessible(Field f) {
        if (!Modifier.isPublic(f.getDeclaringClass().getModifiers())) f.setAccessible(true);
    }

    static int mapCap(int size) {
        int n = -1 >>> Integer.numberOfLeadingZeros(size - 1);
        return (n < 0) ? 1 : (n >= 1 << 30) ? 1 << 30 : n + 1;
    }

    @SuppressWarnings("unchecked")
    static Map<Object, Object> createMap(Class<?> raw, int size) {
        int cap = mapCap(size);
        if (typeBetween(raw, LinkedHashMap.class, Map.class)) return new LinkedHashMap<>(cap);
        if (typeBetween(raw, TreeMap.class, null)) return new TreeMap<>();
        if (typeBetween(raw, IdentityHashMap.class, null)) return new IdentityHashMap<>(cap);
        if (typeBetween(raw, ConcurrentHashMap.class, null)) return new ConcurrentHashMap<>(cap);
        if (typeBetween(raw, ConcurrentSkipListMap.class, null)) return new ConcurrentSkipListMap<>();
        try {
            return (Map<Object, Object>) instantiate(raw);
        } catch (ConversionException e) {
            throw new ConversionException(
                    ConversionException.Reason.INSTANTIATION,
                    "Cannot instantiate Map type " + raw.getName() + " (no accessible no-arg constructor)",
                    "object",
                    raw,
                    e.getCause());
        }
    }

    @SuppressWarnings("unchecked")
    static Collection<Object> createCollection(Class<?> raw, int size) {
        if (typeBetween(raw, ArrayList.class, Collection.class)) return new ArrayList<>(size);
        if (typeBetween(raw, LinkedList.class, null)) return new LinkedList<>();
        if (typeBetween(raw, LinkedHashSet.class, null)) return new LinkedHashSet<>(mapCap(size));
        if (typeBetween(raw, TreeSet.class, null)) return new TreeSet<>();
        if (typeBetween(raw, ArrayDeque.class, null)) return new ArrayDeque<>(size);
        if (typeBetween(raw, PriorityQueue.class, null)) return new PriorityQueue<>(Math.max(1, size));
        if (typeBetween(raw, Vector.class, null)) return new Vector<>(size);
        if (typeBetween(raw, Stack.class, null)) return new Stack<>();
        if (typeBetween(raw, ArrayBlockingQueue.class, null)) return new ArrayBlockingQueue<>(Math.max(1, size));
        if (typeBetween(raw, LinkedBlockingQueue.class, null)) return new LinkedBlockingQueue<>();
        if (typeBetween(raw, ConcurrentLinkedQueue.class, null)) return new ConcurrentLinkedQueue<>();
        if (typeBetween(raw, ConcurrentSkipListSet.class, null)) return new ConcurrentSkipListSet<>();
        if (typeBetween(raw, CopyOnWriteArrayList.class, null)) return new CopyOnWriteArrayList<>();
        try {
            return (Collection<Object>) instantiate(raw);
        } catch (ConversionException e) {
            throw new ConversionException(
                    ConversionException.Reason.INSTANTIATION,
                    "Cannot instantiate Collection type " + raw.getName() + " (no accessible no-arg constructor)",
                    "array",
                    raw,
                    e.getCause());
        }
    }
}
