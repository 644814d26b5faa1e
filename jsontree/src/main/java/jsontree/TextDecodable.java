package jsontree;

/**
 * Implemented by destination types that parse themselves from a JSON string.
 *
 * @author Freeman
 * @since 0.1.0
 */
public interface TextDecodable {

    void decodeText(String text);
}
