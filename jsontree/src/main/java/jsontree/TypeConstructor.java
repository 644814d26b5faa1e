package jsontree;

/**
 * Builds a value of an abstract destination type from a node, typically by inspecting a discriminator field.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * TypeConstructor<Shape> shapes = (node, ctx) -> {
 *     var kind = ((ObjectNode) node).fieldByName("kind");
 *     Shape shape = new StringNode("circle").equals(kind) ? new Circle() : new Square();
 *     node.decode(shape, Option.context(ctx));
 *     return shape;
 * };
 * }</pre>
 *
 * @param <T> abstract destination type
 * @author Freeman
 * @since 0.1.0
 */
@FunctionalInterface
public interface TypeConstructor<T> {

    /**
     * @param node    source node, never a {@link NullNode}
     * @param context call-wide options to pass on to nested decode calls
     * @return the constructed value
     */
    T construct(Node node, Context context);
}
