package jsontree;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named {@link Encoding} schemes, referenced from {@link JsonTag} options such as {@code "hex"} or {@code "[base64]"}.
 *
 * <p> The {@linkplain #defaultRegistry() default registry} holds {@code base64} and {@code hex}.
 * Registration is expected at startup; lookups are safe from any thread.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class EncodingRegistry {

    private final ConcurrentMap<String, Encoding> encodings = new ConcurrentHashMap<>();

    /**
     * Create an empty registry.
     */
    public EncodingRegistry() {}

    /**
     * @return a new registry holding {@code base64} and {@code hex}
     */
    public static EncodingRegistry withDefaults() {
        return new EncodingRegistry().register("base64", Encoding.BASE64).register("hex", Encoding.HEX);
    }

    public static EncodingRegistry defaultRegistry() {
        return Holder.INSTANCE;
    }

    /**
     * @throws IllegalStateException if the name is already taken
     */
    public EncodingRegistry register(String name, Encoding encoding) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(encoding, "encoding");
        if (encodings.putIfAbsent(name, encoding) != null) {
            throw new IllegalStateException("Duplicate encoding: " + name);
        }
        LOGGER.debug("Registered encoding '{}'", name);
        return this;
    }

    public @Nullable Encoding lookup(String name) {
        return encodings.get(name);
    }

    private static final class Holder {
        private static final EncodingRegistry INSTANCE = withDefaults();
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(EncodingRegistry.class);
}
