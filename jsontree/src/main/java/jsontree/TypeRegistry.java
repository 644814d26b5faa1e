package jsontree;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps abstract destination types to user supplied {@link TypeConstructor}s.
 *
 * <p> The registry is consulted when a decode destination is an interface or an abstract class.
 * Registration is expected at startup; lookups are safe from any thread.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class TypeRegistry {

    private final ConcurrentMap<Class<?>, TypeConstructor<?>> constructors = new ConcurrentHashMap<>();

    public static TypeRegistry defaultRegistry() {
        return Holder.INSTANCE;
    }

    /**
     * @param type        an interface or abstract class, not a collection or map
     * @param constructor builds values for {@code type}
     * @throws IllegalArgumentException if {@code type} is not an abstract destination type
     * @throws IllegalStateException    if {@code type} is already registered
     */
    public <T> TypeRegistry register(Class<T> type, TypeConstructor<? extends T> constructor) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(constructor, "constructor");
        if (type == Object.class || !Types.isDynamic(type) || Node.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException("User type must be an interface or abstract class: " + type.getName());
        }
        if (constructors.putIfAbsent(type, constructor) != null) {
            throw new IllegalStateException("Duplicate user type: " + type.getName());
        }
        LOGGER.debug("Registered type constructor for {}", type.getName());
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable TypeConstructor<? extends T> lookup(Class<T> type) {
        return (TypeConstructor<? extends T>) constructors.get(type);
    }

    private static final class Holder {
        private static final TypeRegistry INSTANCE = new TypeRegistry();
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(TypeRegistry.class);
}
