package jsontree;

import java.util.Objects;

/**
 *
 *
 * @author Freeman
 * @since 0.1.0
 */
public record StringNode(String value) implements Node {

    public StringNode {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String type() {
        return "string";
    }
}
