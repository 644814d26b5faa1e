package jsontree;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * JSON number, kept as an exact decimal.
 *
 * @author Freeman
 * @since 0.1.0
 */
public record NumberNode(BigDecimal value) implements Node {

    public NumberNode {
        Objects.requireNonNull(value, "value");
    }

    public static NumberNode of(long value) {
        return new NumberNode(BigDecimal.valueOf(value));
    }

    public static NumberNode of(String text) {
        return new NumberNode(new BigDecimal(text));
    }

    @Override
    public String type() {
        return "number";
    }
}
