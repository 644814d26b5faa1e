package jsontree;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the table of decodable fields of a struct-like class.
 *
 * <p> Rules:
 * <ul>
 *   <li>only public, non-static, non-final fields take part</li>
 *   <li>a field tagged {@code "-"} is skipped</li>
 *   <li>an {@link Embedded} field without a tag name contributes its own fields one level deeper</li>
 *   <li>when two fields share a name the shallower one wins, then the one declared first;
 *       a class's own fields come before inherited ones</li>
 *   <li>embedding a class already on the current embedding path is skipped</li>
 * </ul>
 *
 * <p> Tables are cached per class.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class StructFields {

    private static final ClassValue<Map<String, StructField>> CACHE = new ClassValue<>() {
        @Override
        protected Map<String, StructField> computeValue(Class<?> type) {
            return collect(type);
        }
    };

    private StructFields() {
        throw new UnsupportedOperationException();
    }

    /**
     * @param type struct-like class
     * @return unmodifiable name to field table, in discovery order
     */
    public static Map<String, StructField> of(Class<?> type) {
        return CACHE.get(type);
    }

    public static List<StructField> visibleFields(Class<?> type) {
        return List.copyOf(of(type).values());
    }

    static Map<String, StructField> collect(Class<?> root) {
        var out = new LinkedHashMap<String, StructField>();
        var visiting = new HashSet<Class<?>>();
        visiting.add(root);
        collect(root, List.of(), visiting, out);
        LOGGER.trace("Fields of {}: {}", root.getName(), out.keySet());
        return Collections.unmodifiableMap(out);
    }

    private static void collect(
            Class<?> type, List<Field> prefix, Set<Class<?>> visiting, Map<String, StructField> out) {
        for (Field f : declaredFields(type)) {
            int mod = f.getModifiers();
            if (Modifier.isStatic(mod) || Modifier.isFinal(mod) || f.isSynthetic() || !Modifier.isPublic(mod))
                continue;
            var tag = f.getAnnotation(JsonTag.class);
            var options = FieldOptions.parse(tag == null ? null : tag.value());
            if (options.ignored()) continue;

            var path = append(prefix, f);
            if (options.name().isEmpty() && f.isAnnotationPresent(Embedded.class) && Types.isStruct(f.getType())) {
                if (!visiting.add(f.getType())) {
                    LOGGER.debug(
                            "Embedding cycle detected at {}.{}, skipping", type.getName(), f.getName());
                    continue;
                }
                Types.makeAccessible(f);
                collect(f.getType(), path, visiting, out);
                visiting.remove(f.getType());
                continue;
            }

            String name = options.name().isEmpty() ? f.getName() : options.name();
            var prev = out.get(name);
            if (prev != null && prev.depth() <= path.size()) continue;
            Types.makeAccessible(f);
            out.put(name, new StructField(name, path, options));
        }
    }

    private static List<Field> declaredFields(Class<?> type) {
        var fields = new ArrayList<Field>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            Collections.addAll(fields, c.getDeclaredFields());
        }
        return fields;
    }

    private static List<Field> append(List<Field> prefix, Field f) {
        var path = new ArrayList<Field>(prefix.size() + 1);
        path.addAll(prefix);
        path.add(f);
        return path;
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(StructFields.class);
}
