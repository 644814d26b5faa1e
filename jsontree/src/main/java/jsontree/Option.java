package jsontree;

import java.util.List;
import java.util.Objects;

/**
 * A decode option. Options are applied left to right, later ones override earlier ones,
 * except {@link #elements(Option...)} which accumulates.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * node.decode(ids, Option.elements(Option.asString()), Option.disallowUnknownFields());
 * }</pre>
 *
 * @author Freeman
 * @since 0.1.0
 */
@FunctionalInterface
public interface Option {

    void apply(Options options);

    /**
     * Treat the destination as textual: numbers and booleans are parsed from strings,
     * and byte arrays receive the raw bytes of the string.
     */
    static Option asString() {
        return options -> options.asString = true;
    }

    /**
     * Byte encoding for strings decoded into {@code byte[]}, base64 by default.
     */
    static Option encoding(Encoding encoding) {
        Objects.requireNonNull(encoding, "encoding");
        return options -> options.encoding = encoding;
    }

    /**
     * Options for the elements of an array, a collection or a map, one level down.
     */
    static Option elements(Option... elementOptions) {
        var list = List.of(elementOptions);
        return options -> {
            if (options.element == null) options.element = new Options();
            options.element.apply(list);
        };
    }

    static Option types(TypeRegistry types) {
        Objects.requireNonNull(types, "types");
        return options -> options.context = options.context.toBuilder().types(types).build();
    }

    static Option encodings(EncodingRegistry encodings) {
        Objects.requireNonNull(encodings, "encodings");
        return options -> options.context = options.context.toBuilder().encodings(encodings).build();
    }

    static Option disallowUnknownFields() {
        return options -> options.context = options.context.toBuilder().disallowUnknownFields(true).build();
    }

    static Option maxDepth(int maxDepth) {
        return options -> options.context = options.context.toBuilder().maxDepth(maxDepth).build();
    }

    /**
     * Replace the call-wide context, used by {@link TypeConstructor}s to pass it on.
     */
    static Option context(Context context) {
        Objects.requireNonNull(context, "context");
        return options -> options.context = context;
    }
}
