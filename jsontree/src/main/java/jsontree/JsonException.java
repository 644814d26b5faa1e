package jsontree;

import java.lang.reflect.Type;
import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when JSON parsing or decoding fails.
 * This is the base exception for all jsontree-related errors.
 *
 * @author Freeman
 * @since 0.1.0
 */
public class JsonException extends RuntimeException {

    /**
     * Constructs a new JsonException with the specified detail message.
     *
     * @param message the detail message
     */
    public JsonException(String message) {
        super(message);
    }

    /**
     * Constructs a new JsonException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public JsonException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }

    /**
     * Exception thrown when the input is not lexically or syntactically valid JSON.
     */
    public static class SyntaxException extends JsonException {

        public enum Reason {
            UNEXPECTED_CHARACTER,
            INVALID_HEX_DIGIT,
            INVALID_SURROGATE_PAIR,
            END_OF_INPUT,
            MALFORMED_NUMBER,
            UNDEFINED_KEYWORD,
            UNEXPECTED_TOKEN,
            OBJECT_KEY_EXPECTED,
            COLON_EXPECTED,
            NESTING_TOO_DEEP
        }

        private final Reason reason;
        private final long offset;
        private final @Nullable String token;

        public SyntaxException(Reason reason, String message, long offset, @Nullable String token) {
            this(reason, message, offset, token, null);
        }

        public SyntaxException(
                Reason reason, String message, long offset, @Nullable String token, @Nullable Throwable cause) {
            super(message, cause);
            this.reason = reason;
            this.offset = offset;
            this.token = token;
        }

        public Reason getReason() {
            return reason;
        }

        /**
         * @return position of the offending character or token, in UTF-16 code units from the start of input
         */
        public long getOffset() {
            return offset;
        }

        public @Nullable String getToken() {
            return token;
        }
    }

    /**
     * Exception thrown when a node cannot be converted into the requested destination.
     */
    public static class ConversionException extends JsonException {

        public enum Reason {
            NIL_DESTINATION,
            POINTER_EXPECTED,
            INCOMPATIBLE_TYPES,
            CANNOT_CONVERT_NUMBER,
            CANNOT_CONVERT_STRING,
            CANNOT_CONVERT_BOOLEAN,
            STRUCT_OR_MAP_EXPECTED,
            SEQUENCE_EXPECTED,
            MAP_KEY_MUST_BE_STRING,
            NUMBER_FORMAT,
            TEXT_FORMAT,
            ENCODING,
            INSTANTIATION,
            NESTING_TOO_DEEP
        }

        private final Reason reason;
        private final @Nullable String source;
        private final @Nullable Type target;

        public ConversionException(Reason reason, String message, @Nullable String source, @Nullable Type target) {
            this(reason, message, source, target, null);
        }

        public ConversionException(
                Reason reason,
                String message,
                @Nullable String source,
                @Nullable Type target,
                @Nullable Throwable cause) {
            super(message, cause);
            this.reason = reason;
            this.source = source;
            this.target = target;
        }

        public Reason getReason() {
            return reason;
        }

        /**
         * @return kind of the source node, as returned by {@link Node#type()}
         */
        public @Nullable String getSource() {
            return source;
        }

        public @Nullable Type getTarget() {
            return target;
        }
    }

    /**
     * Exception thrown in strict mode when an object key matches no field of the destination.
     */
    public static class UndefinedFieldException extends JsonException {
        private final String field;
        private final Type target;

        public UndefinedFieldException(String field, Type target) {
            super(String.format("undefined field '%s': %s", field, target.getTypeName()));
            this.field = field;
            this.target = target;
        }

        public String getField() {
            return field;
        }

        public Type getTarget() {
            return target;
        }
    }

    /**
     * Exception wrapping a failure raised by user code: a registered type constructor,
     * a {@link NodeDecodable} or a {@link TextDecodable} destination.
     */
    public static class ExtensionException extends JsonException {
        public ExtensionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
