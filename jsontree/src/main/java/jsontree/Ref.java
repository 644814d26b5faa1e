package jsontree;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Typed, mutable slot used as a decode destination.
 *
 * <p> The slot type is captured from the generic superclass, so generic destinations are written as an
 * anonymous subclass:
 *
 * <pre>{@code
 * Ref<List<Shape>> shapes = new Ref<>() {};
 * Json.parse(text).decode(shapes);
 * List<Shape> result = shapes.get();
 * }</pre>
 *
 * @param <T> slot type
 * @author Freeman
 * @since 0.1.0
 */
public abstract class Ref<T> {
    private final Type type;
    private @Nullable T value;

    protected Ref() {
        Class<?> c = findRefSubclass(getClass());
        var p = (ParameterizedType) c.getGenericSuperclass();
        this.type = p.getActualTypeArguments()[0];
        this.value = initialValue(type);
    }

    protected Ref(@Nullable T value) {
        this();
        this.value = value;
    }

    private Ref(Type type, @Nullable T value) {
        this.type = type;
        this.value = value != null ? value : initialValue(type);
    }

    public static <T> Ref<T> of(Class<T> type) {
        return new Ref<>(type, null) {};
    }

    public static <T> Ref<T> of(Class<T> type, @Nullable T value) {
        return new Ref<>(type, value) {};
    }

    /**
     * @param type any reflective type, e.g. a field's generic type
     * @return an empty slot of the given type
     */
    public static Ref<Object> ofType(Type type) {
        return new Ref<>(type, null) {};
    }

    public Type getType() {
        return type;
    }

    public T get() {
        return value;
    }

    public void set(@Nullable T value) {
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    private static <T> @Nullable T initialValue(Type type) {
        return type instanceof Class<?> c && c.isPrimitive() ? (T) Types.defaultValue(c) : null;
    }

    private static Class<?> findRefSubclass(Class<?> child) {
        Class<?> parent = child.getSuperclass();
        if (parent == Ref.class) return child;
        if (parent == Object.class) throw new IllegalStateException("Expected Ref superclass");
        return findRefSubclass(parent);
    }

    @Override
    public String toString() {
        return "Ref{" + type.getTypeName() + "=" + Objects.toString(value) + '}';
    }
}
