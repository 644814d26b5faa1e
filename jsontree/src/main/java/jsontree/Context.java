package jsontree;

import lombok.Builder;
import org.jspecify.annotations.Nullable;

/**
 * Call-wide decode policy, passed unchanged to every nested decode.
 *
 * @param disallowUnknownFields fail on object keys that match no field of the destination
 * @param types                 type registry, the default registry if {@code null}
 * @param encodings             encoding registry, the default registry if {@code null}
 * @param maxDepth              maximum decode nesting, {@link JsonParser#DEFAULT_MAX_DEPTH} if not positive
 * @author Freeman
 * @since 0.1.0
 */
@Builder(toBuilder = true)
public record Context(
        boolean disallowUnknownFields,
        @Nullable TypeRegistry types,
        @Nullable EncodingRegistry encodings,
        int maxDepth) {

    public static final Context DEFAULT = Context.builder().build();

    public Context {
        if (maxDepth <= 0) maxDepth = JsonParser.DEFAULT_MAX_DEPTH;
    }

    public TypeRegistry typeRegistry() {
        return types != null ? types : TypeRegistry.defaultRegistry();
    }

    public EncodingRegistry encodingRegistry() {
        return encodings != null ? encodings : EncodingRegistry.defaultRegistry();
    }
}
