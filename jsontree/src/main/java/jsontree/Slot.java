package jsontree;

import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Type;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;

/**
 * An assignable location of a known type: a {@link Ref}, a field, an array element or a temporary.
 *
 * @author Freeman
 * @since 0.1.0
 */
interface Slot {

    Type type();

    @Nullable
    Object get();

    void set(@Nullable Object value);

    /**
     * Whether the current value is caller-owned and must be updated instead of replaced.
     */
    default boolean inPlace() {
        return false;
    }

    /**
     * Reset to the zero value of the slot type.
     */
    default void clear() {
        set(Types.defaultValue(Types.raw(type())));
    }

    @SuppressWarnings("unchecked")
    static Slot of(Ref<?> ref) {
        var r = (Ref<Object>) ref;
        return new Slot() {
            @Override
            public Type type() {
                return r.getType();
            }

            @Override
            public @Nullable Object get() {
                return r.get();
            }

            @Override
            public void set(@Nullable Object value) {
                r.set(value);
            }
        };
    }

    static Slot field(Object owner, Field field) {
        return new Slot() {
            @Override
            public Type type() {
                return field.getGenericType();
            }

            @Override
            @SneakyThrows
            public @Nullable Object get() {
                return field.get(owner);
            }

            @Override
            @SneakyThrows
            public void set(@Nullable Object value) {
                field.set(owner, value);
            }
        };
    }

    static Slot element(Object array, int index, Type componentType) {
        return new Slot() {
            @Override
            public Type type() {
                return componentType;
            }

            @Override
            public @Nullable Object get() {
                return Array.get(array, index);
            }

            @Override
            public void set(@Nullable Object value) {
                Array.set(array, index, value);
            }
        };
    }

    static Slot temp(Type type) {
        return new Slot() {
            private @Nullable Object value = Types.defaultValue(Types.raw(type));

            @Override
            public Type type() {
                return type;
            }

            @Override
            public @Nullable Object get() {
                return value;
            }

            @Override
            public void set(@Nullable Object value) {
                this.value = value;
            }
        };
    }

    /**
     * A caller-owned object decoded in place. It cannot be replaced, only updated; clearing resets its fields.
     */
    static Slot fixed(Object instance) {
        return new Slot() {
            @Override
            public Type type() {
                return instance.getClass();
            }

            @Override
            public Object get() {
                return instance;
            }

            @Override
            public boolean inPlace() {
                return true;
            }

            @Override
            public void set(@Nullable Object value) {
                if (value != instance) {
                    throw new IllegalStateException(
                            "In-place destination of type " + instance.getClass().getName() + " cannot be replaced");
                }
            }

            @Override
            public void clear() {
                if (instance.getClass().isArray()) {
                    var zero = Types.defaultValue(instance.getClass().getComponentType());
                    for (int i = 0, n = Array.getLength(instance); i < n; i++) Array.set(instance, i, zero);
                } else {
                    Types.clearFields(instance);
                }
            }
        };
    }

    // ============================================================
    // Indirections
    // ============================================================

    /**
     * Look through an {@code Optional}, {@code AtomicReference} or {@link Ref} held by {@code outer},
     * creating an empty holder when there is none.
     */
    static Slot unwrap(Slot outer) {
        Type type = outer.type();
        Class<?> raw = Types.raw(type);
        Type inner = Ref.class.isAssignableFrom(raw) ? refType(type) : Types.typeArgument(type, 0);
        if (raw == Optional.class) {
            return new Slot() {
                @Override
                public Type type() {
                    return inner;
                }

                @Override
                public @Nullable Object get() {
                    var o = (Optional<?>) outer.get();
                    return o == null ? null : o.orElse(null);
                }

                @Override
                public void set(@Nullable Object value) {
                    outer.set(Optional.ofNullable(value));
                }
            };
        }
        if (raw == AtomicReference.class) {
            @SuppressWarnings("unchecked")
            var holder = (AtomicReference<Object>) outer.get();
            if (holder == null) {
                holder = new AtomicReference<>();
                outer.set(holder);
            }
            var ref = holder;
            return new Slot() {
                @Override
                public Type type() {
                    return inner;
                }

                @Override
                public @Nullable Object get() {
                    return ref.get();
                }

                @Override
                public void set(@Nullable Object value) {
                    ref.set(value);
                }
            };
        }
        var ref = (Ref<?>) outer.get();
        if (ref == null) {
            ref = Ref.ofType(inner);
            outer.set(ref);
        }
        return of(ref);
    }

    private static Type refType(Type type) {
        // a Ref subclass declared with a concrete type argument
        if (type instanceof Class<?> c && c != Ref.class) {
            for (Class<?> k = c; k.getSuperclass() != null; k = k.getSuperclass()) {
                if (k.getSuperclass() == Ref.class)
                    return Types.typeArgument(k.getGenericSuperclass(), 0);
            }
        }
        return Types.typeArgument(type, 0);
    }
}
