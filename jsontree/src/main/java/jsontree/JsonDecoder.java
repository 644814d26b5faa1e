package jsontree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes a stream of whitespace separated JSON values, one value per {@link #decode(Object)} call.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * var decoder = Json.newDecoder(reader).disallowUnknownFields();
 * var event = new Event();
 * while (decoder.decode(event)) {
 *     handle(event);
 * }
 * }</pre>
 *
 * <p> Not thread-safe.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class JsonDecoder {

    private final JsonParser parser;
    private final List<Option> options = new ArrayList<>();

    JsonDecoder(JsonParser parser) {
        this.parser = parser;
    }

    /**
     * Reject object keys that do not match a destination field.
     */
    public JsonDecoder disallowUnknownFields() {
        options.add(Option.disallowUnknownFields());
        return this;
    }

    /**
     * Options applied to every subsequent {@link #decode(Object)}.
     */
    public JsonDecoder options(Option... options) {
        Collections.addAll(this.options, options);
        return this;
    }

    /**
     * Decode the next value into the destination.
     *
     * @param destination a {@link Ref} or an object decoded in place
     * @return {@code false} if the stream is exhausted, the destination is then untouched
     */
    public boolean decode(Object destination) {
        var node = parser.parseNext();
        if (node == null) return false;
        node.decode(destination, options.toArray(Option[]::new));
        return true;
    }
}
