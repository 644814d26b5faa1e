package jsontree;

import java.util.Base64;
import java.util.HexFormat;

/**
 * Reversible transform between bytes and text, used when a JSON string carries binary data.
 *
 * @author Freeman
 * @since 0.1.0
 */
public interface Encoding {

    /**
     * Standard Base64 alphabet with mandatory padding.
     */
    Encoding BASE64 = new Encoding() {
        @Override
        public String encode(byte[] data) {
            return Base64.getEncoder().encodeToString(data);
        }

        @Override
        public byte[] decode(String text) {
            if (text.length() % 4 != 0)
                throw new IllegalArgumentException("illegal base64 data: length " + text.length() + " is not padded");
            return Base64.getDecoder().decode(text);
        }

        @Override
        public String toString() {
            return "base64";
        }
    };

    /**
     * Two hex digits per byte, lowercase on output, either case on input.
     */
    Encoding HEX = new Encoding() {
        @Override
        public String encode(byte[] data) {
            return HexFormat.of().formatHex(data);
        }

        @Override
        public byte[] decode(String text) {
            return HexFormat.of().parseHex(text);
        }

        @Override
        public String toString() {
            return "hex";
        }
    };

    String encode(byte[] data);

    /**
     * @throws IllegalArgumentException if the text is not valid for this scheme
     */
    byte[] decode(String text);
}
