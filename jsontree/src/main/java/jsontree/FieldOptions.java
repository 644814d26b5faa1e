package jsontree;

import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Parsed {@link JsonTag} value.
 *
 * @param name            external name, empty to use the declared name, {@code "-"} to ignore the field
 * @param options         field-level options, e.g. {@code string} or an encoding name
 * @param elementOptions  options written in brackets, applied to container elements
 * @author Freeman
 * @since 0.1.0
 */
public record FieldOptions(String name, List<String> options, List<String> elementOptions) {

    public static final FieldOptions NONE = new FieldOptions("", List.of(), List.of());

    public FieldOptions {
        options = List.copyOf(options);
        elementOptions = List.copyOf(elementOptions);
    }

    public static FieldOptions parse(@Nullable String tag) {
        if (tag == null || tag.isEmpty()) return NONE;
        String[] parts = tag.split(",", -1);
        var options = new ArrayList<String>();
        var elementOptions = new ArrayList<String>();
        for (int i = 1; i < parts.length; i++) {
            String s = parts[i];
            if (s.isEmpty()) continue;
            if (s.charAt(0) == '[') {
                // unterminated brackets are dropped
                if (s.length() < 2 || s.charAt(s.length() - 1) != ']') continue;
                elementOptions.add(s.substring(1, s.length() - 1));
            } else {
                options.add(s);
            }
        }
        return new FieldOptions(parts[0], options, elementOptions);
    }

    public boolean ignored() {
        return "-".equals(name);
    }

    /**
     * Resolve option names against an encoding registry. Unknown names are skipped.
     */
    public List<Option> toOptions(EncodingRegistry encodings) {
        var out = new ArrayList<Option>(options.size() + 1);
        resolve(options, encodings, out);
        if (!elementOptions.isEmpty()) {
            var element = new ArrayList<Option>(elementOptions.size());
            resolve(elementOptions, encodings, element);
            if (!element.isEmpty()) out.add(Option.elements(element.toArray(Option[]::new)));
        }
        return out;
    }

    private static void resolve(List<String> names, EncodingRegistry encodings, List<Option> out) {
        for (var name : names) {
            if (name.equals("string")) {
                out.add(Option.asString());
                continue;
            }
            var encoding = encodings.lookup(name);
            if (encoding != null) out.add(Option.encoding(encoding));
        }
    }
}
