package jsontree;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Mutable decode configuration built from a chain of {@link Option}s.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class Options {

    boolean asString;
    @Nullable Encoding encoding;
    @Nullable Options element;
    Context context = Context.DEFAULT;
    int depth;

    Options() {}

    static Options of(Option... options) {
        return new Options().apply(List.of(options));
    }

    Options apply(List<Option> options) {
        for (var o : options) o.apply(this);
        return this;
    }

    /**
     * Options for a container element: the element options of this level plus the context.
     */
    Options forElement() {
        var child = new Options();
        if (element != null) {
            child.asString = element.asString;
            child.encoding = element.encoding;
        }
        child.context = context;
        child.depth = depth + 1;
        return child;
    }

    /**
     * Options for a struct field: the context plus the field's own tag options.
     */
    Options forField(List<Option> fieldOptions) {
        var child = new Options();
        child.context = context;
        child.depth = depth + 1;
        return child.apply(fieldOptions);
    }

    public boolean asString() {
        return asString;
    }

    public @Nullable Encoding encoding() {
        return encoding;
    }

    public @Nullable Options element() {
        return element;
    }

    public Context context() {
        return context;
    }

    public int depth() {
        return depth;
    }
}
