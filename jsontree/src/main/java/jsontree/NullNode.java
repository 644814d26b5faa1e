package jsontree;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record NullNode() implements Node {

    public static final NullNode INSTANCE = new NullNode();

    @Override
    public String type() {
        return "null";
    }
}
