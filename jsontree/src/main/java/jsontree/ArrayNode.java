package jsontree;

import java.util.List;
import lombok.Builder;
import lombok.Singular;

/**
 * JSON array.
 *
 * @author Freeman
 * @since 0.1.0
 */
@Builder
public record ArrayNode(@Singular List<Node> elements) implements Node {

    public ArrayNode {
        elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public Node get(int index) {
        return elements.get(index);
    }

    @Override
    public String type() {
        return "array";
    }
}
