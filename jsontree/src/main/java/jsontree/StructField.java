package jsontree;

import java.lang.reflect.Field;
import java.util.List;

/**
 * A decodable field of a struct-like class, possibly reached through {@link Embedded} fields.
 *
 * @param name    external name
 * @param path    fields to follow from the root instance, the last one is the target
 * @param options tag options
 * @author Freeman
 * @since 0.1.0
 */
public record StructField(String name, List<Field> path, FieldOptions options) {

    public StructField {
        path = List.copyOf(path);
    }

    public int depth() {
        return path.size();
    }

    public Field field() {
        return path.get(path.size() - 1);
    }
}
