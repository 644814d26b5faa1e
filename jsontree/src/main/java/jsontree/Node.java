package jsontree;

/**
 * Immutable JSON syntax tree node.
 *
 * <p> A node is produced by {@link JsonParser} and converted into Java values with {@link #decode(Object, Option...)}.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * Node node = Json.parse("{\"x\":42,\"y\":21}");
 * Point point = new Point();
 * node.decode(point);
 *
 * Ref<Map<String, Integer>> map = new Ref<>() {};
 * node.decode(map);
 * }</pre>
 *
 * @author Freeman
 * @since 0.1.0
 */
public sealed interface Node permits NumberNode, StringNode, ObjectNode, ArrayNode, BooleanNode, NullNode {

    /**
     * @return one of {@code "number"}, {@code "string"}, {@code "object"}, {@code "array"}, {@code "boolean"}, {@code "null"}
     */
    String type();

    /**
     * Decode this node into the destination.
     *
     * <p> The destination is either a {@link Ref} holding a typed slot, or a mutable object decoded in place:
     * an array, a class with public fields, a {@link NodeDecodable} or a {@link TextDecodable}.
     *
     * @param destination where to store the result
     * @param options     decode options, applied left to right
     * @throws JsonException if the node cannot be decoded into the destination
     */
    default void decode(Object destination, Option... options) {
        Decoder.decode(this, destination, options);
    }

    /**
     * Decode this node into a fresh value of the given type.
     *
     * @param type    destination type
     * @param options decode options
     * @param <T>     destination type
     * @return decoded value, {@code null} for a {@code null} node and a reference type
     */
    default <T> T decodeAs(Class<T> type, Option... options) {
        Ref<T> ref = Ref.of(type);
        decode(ref, options);
        return ref.get();
    }

    /**
     * Decode this node into a fresh value of the type captured by the reference.
     *
     * @param ref     type token, its current value is replaced
     * @param options decode options
     * @param <T>     destination type
     * @return decoded value
     */
    default <T> T decodeAs(Ref<T> ref, Option... options) {
        decode(ref, options);
        return ref.get();
    }
}
