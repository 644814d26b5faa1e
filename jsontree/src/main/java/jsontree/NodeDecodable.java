package jsontree;

/**
 * Implemented by destination types that decode themselves from a node.
 *
 * <p> The decoder creates the instance with its no-arg constructor when the destination slot is empty,
 * then hands it the node. {@code null} nodes never reach this method.
 *
 * @author Freeman
 * @since 0.1.0
 */
public interface NodeDecodable {

    /**
     * @param node source node
     * @throws RuntimeException if the node is not acceptable; non-{@link JsonException} failures are wrapped in
     *                          {@link JsonException.ExtensionException}
     */
    void decodeNode(Node node);
}
