package jsontree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import org.jspecify.annotations.Nullable;

/**
 * JSON object.
 *
 * <p> Fields keep the order in which their keys first appeared. A repeated key replaces the
 * earlier value but stays at the position of its first occurrence. Two objects are equal when they
 * have the same fields in the same order.
 *
 * <h3>Example</h3>
 * <pre>{@code
 * ObjectNode node = ObjectNode.builder()
 *         .field("kind", new StringNode("circle"))
 *         .field("radius", NumberNode.of(2))
 *         .build();
 * }</pre>
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class ObjectNode implements Node {

    private final Map<String, Node> fields;
    private final List<Map.Entry<String, Node>> entries;

    @Builder
    public ObjectNode(@Singular("field") Map<String, Node> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        var list = new ArrayList<Map.Entry<String, Node>>(this.fields.size());
        for (var e : this.fields.entrySet()) list.add(Map.entry(e.getKey(), e.getValue()));
        this.entries = Collections.unmodifiableList(list);
    }

    /**
     * @return fields in order, unmodifiable
     */
    public Map<String, Node> fields() {
        return fields;
    }

    /**
     * @return keys in field order
     */
    public List<String> keys() {
        return List.copyOf(fields.keySet());
    }

    /**
     * @param index field position
     * @return key and value of the field at the given position
     * @throws IndexOutOfBoundsException if there is no such field
     */
    public Map.Entry<String, Node> field(int index) {
        if (index < 0 || index >= entries.size())
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for " + entries.size() + " fields");
        return entries.get(index);
    }

    public @Nullable Node fieldByName(String name) {
        return fields.get(name);
    }

    public int numFields() {
        return entries.size();
    }

    @Override
    public String type() {
        return "object";
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ObjectNode that && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "ObjectNode[fields=" + fields + "]";
    }
}
