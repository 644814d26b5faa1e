package jsontree;

import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Entry points: parse JSON text into {@link Node}s and decode them into Java values.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Ref<List<Point>> points = new Ref<>() {};
 * Json.unmarshal("[{\"x\":1,\"y\":2}]", points);
 * }</pre>
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class Json {

    private Json() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Parse one JSON value.
     *
     * @param json JSON text
     * @return parsed node
     * @throws JsonException.SyntaxException if the text is malformed
     */
    public static Node parse(String json) {
        return JsonParser.of(json).parse();
    }

    public static Node parse(Reader reader) {
        return JsonParser.of(reader).parse();
    }

    /**
     * Parse one JSON value and decode it into the destination.
     *
     * @param json        JSON text
     * @param destination a {@link Ref} or an object decoded in place
     * @param options     decode options
     * @see Node#decode(Object, Option...)
     */
    public static void unmarshal(String json, Object destination, Option... options) {
        parse(json).decode(destination, options);
    }

    public static void unmarshal(byte[] json, Object destination, Option... options) {
        parse(new InputStreamReader(new ByteArrayInputStream(json), StandardCharsets.UTF_8))
                .decode(destination, options);
    }

    /**
     * Streaming decoder reading consecutive JSON values from the reader.
     */
    public static JsonDecoder newDecoder(Reader reader) {
        return new JsonDecoder(JsonParser.of(reader));
    }
}
