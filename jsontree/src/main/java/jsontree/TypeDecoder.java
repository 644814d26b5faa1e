package jsontree;

import java.lang.reflect.Type;
import org.jspecify.annotations.Nullable;

/**
 * Decoder for a family of concrete destination types that the generic rules do not cover.
 *
 * <p> Implementations are discovered with {@link java.util.ServiceLoader} from
 * {@code META-INF/services/jsontree.TypeDecoder} and consulted before the generic rules.
 *
 * @author Freeman
 * @since 0.1.0
 */
public interface TypeDecoder {

    boolean canDecode(Class<?> raw);

    /**
     * @param node    source node, never a {@link NullNode}
     * @param type    destination type
     * @param current current value of the destination, may be updated in place and returned
     * @param options options in effect for this node
     * @return decoded value
     */
    Object decode(Node node, Type type, @Nullable Object current, Options options);
}
