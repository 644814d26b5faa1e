package jsontree;

import static jsontree.JsonException.ConversionException.Reason.CANNOT_CONVERT_BOOLEAN;
import static jsontree.JsonException.ConversionException.Reason.CANNOT_CONVERT_NUMBER;
import static jsontree.JsonException.ConversionException.Reason.CANNOT_CONVERT_STRING;
import static jsontree.JsonException.ConversionException.Reason.ENCODING;
import static jsontree.JsonException.ConversionException.Reason.NUMBER_FORMAT;
import static jsontree.JsonException.ConversionException.Reason.TEXT_FORMAT;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.MonthDay;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.Year;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;
import jsontree.JsonException.ConversionException;
import jsontree.JsonException.ExtensionException;
import org.jspecify.annotations.Nullable;

/**
 * Scalar conversion rules: number, string and boolean nodes into concrete destination types.
 *
 * @author Freeman
 * @since 0.1.0
 */
final class Conversions {

    private Conversions() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Number
    // ============================================================

    /**
     * Widest {@code BigInteger} a number literal may decode into, in decimal digits.
     */
    static final int MAX_BIG_INTEGER_DIGITS = 10_000;

    static Object fromNumber(NumberNode node, Type type) {
        Class<?> raw = Types.raw(type);
        BigDecimal bd = node.value();
        if (raw == BigInteger.class) {
            var value = integerPart(bd, MAX_BIG_INTEGER_DIGITS);
            if (value == null) {
                throw new ConversionException(
                        NUMBER_FORMAT,
                        "Number too large for BigInteger: more than " + MAX_BIG_INTEGER_DIGITS + " digits",
                        node.type(),
                        type);
            }
            return value;
        }
        if (raw == BigDecimal.class) return bd;
        if (raw == Instant.class || raw == OffsetDateTime.class || raw == ZonedDateTime.class)
            return fromEpochSeconds(node, type, raw);
        // integral kinds keep the low-order bits, like a narrowing primitive conversion
        if (raw == long.class || raw == Long.class) return lowBits(bd);
        if (raw == int.class || raw == Integer.class) return (int) lowBits(bd);
        if (raw == short.class || raw == Short.class) return (short) lowBits(bd);
        if (raw == byte.class || raw == Byte.class) return (byte) lowBits(bd);
        if (raw == char.class || raw == Character.class) return (char) lowBits(bd);
        if (raw == AtomicLong.class) return new AtomicLong(lowBits(bd));
        if (raw == AtomicInteger.class) return new AtomicInteger((int) lowBits(bd));
        if (raw == double.class || raw == Double.class) return bd.doubleValue();
        if (raw == float.class || raw == Float.class) return bd.floatValue();
        if (raw == String.class) return bd.toString();
        if (raw == boolean.class || raw == Boolean.class) return bd.signum() != 0;
        if (raw.isEnum()) {
            Object[] constants = raw.getEnumConstants();
            BigInteger ord = integerPart(bd, 10);
            if (ord != null && ord.signum() >= 0 && ord.compareTo(BigInteger.valueOf(constants.length)) < 0)
                return constants[ord.intValue()];
            throw new ConversionException(
                    CANNOT_CONVERT_NUMBER,
                    "Enum ordinal out of range: expected 0-" + (constants.length - 1) + ", got " + bd,
                    node.type(),
                    type);
        }
        throw new ConversionException(
                CANNOT_CONVERT_NUMBER, "can't convert number to " + type.getTypeName(), node.type(), type);
    }

    /**
     * Digits before the decimal point, zero or negative when the magnitude is below one.
     */
    static long integerDigits(BigDecimal bd) {
        return (long) bd.precision() - bd.scale();
    }

    /**
     * Integer part of {@code bd}, truncated toward zero.
     *
     * @return the integer part, or {@code null} if it has more than {@code maxDigits} digits
     */
    static @Nullable BigInteger integerPart(BigDecimal bd, int maxDigits) {
        long digits = integerDigits(bd);
        if (digits <= 0) return BigInteger.ZERO;
        if (digits > maxDigits) return null;
        return bd.toBigInteger();
    }

    /**
     * Low 64 bits of the integer part of {@code bd}.
     */
    static long lowBits(BigDecimal bd) {
        if (integerDigits(bd) <= 0) return 0;
        // a multiple of 10^64 is a multiple of 2^64
        if (bd.scale() <= -Long.SIZE) return 0;
        return bd.toBigInteger().longValue();
    }

    private static Object fromEpochSeconds(NumberNode node, Type type, Class<?> raw) {
        var seconds = integerPart(node.value(), 19);
        if (seconds == null || seconds.bitLength() >= Long.SIZE) throw epochOutOfRange(node, type, raw, null);
        try {
            var instant = Instant.ofEpochSecond(seconds.longValue());
            if (raw == OffsetDateTime.class) return instant.atOffset(ZoneOffset.UTC);
            if (raw == ZonedDateTime.class) return instant.atZone(ZoneOffset.UTC);
            return instant;
        } catch (DateTimeException e) {
            throw epochOutOfRange(node, type, raw, e);
        }
    }

    private static ConversionException epochOutOfRange(
            NumberNode node, Type type, Class<?> raw, @Nullable Throwable cause) {
        return new ConversionException(
                CANNOT_CONVERT_NUMBER,
                "Epoch seconds out of range for " + raw.getSimpleName() + ": " + node.value(),
                node.type(),
                type,
                cause);
    }

    // ============================================================
    // String
    // ============================================================

    static Object fromString(StringNode node, Type type, @Nullable Object current, Options options) {
        Class<?> raw = Types.raw(type);
        String text = node.value();

        if (TextDecodable.class.isAssignableFrom(raw)) {
            var target = current != null ? (TextDecodable) current : (TextDecodable) Types.instantiate(raw);
            try {
                target.decodeText(text);
            } catch (JsonException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExtensionException("Failed to decode " + raw.getName() + " from text", e);
            }
            return target;
        }

        if (raw == String.class || raw == byte[].class) return textOrBytes(node, type, raw, options);
        if (isTextType(raw)) return parseText(node, type, raw);
        if (raw.isEnum()) return toEnum(node, type, raw);
        if (raw == char.class || raw == Character.class) {
            if (text.length() == 1) return text.charAt(0);
            throw new ConversionException(
                    CANNOT_CONVERT_STRING,
                    "Cannot convert string to char: expected length 1, got " + text.length() + " (\"" + text + "\")",
                    node.type(),
                    type);
        }

        if (options.asString) {
            try {
                if (raw == long.class || raw == Long.class) return Long.parseLong(text);
                if (raw == int.class || raw == Integer.class) return Integer.parseInt(text);
                if (raw == short.class || raw == Short.class) return Short.parseShort(text);
                if (raw == byte.class || raw == Byte.class) return Byte.parseByte(text);
                if (raw == double.class || raw == Double.class) return Double.parseDouble(text);
                if (raw == float.class || raw == Float.class) return Float.parseFloat(text);
            } catch (NumberFormatException e) {
                throw new ConversionException(
                        NUMBER_FORMAT,
                        "Cannot parse " + raw.getSimpleName() + " from string: '" + text + "'",
                        node.type(),
                        type,
                        e);
            }
            if (raw == boolean.class || raw == Boolean.class) {
                if (text.equals("true")) return true;
                if (text.equals("false")) return false;
                throw new ConversionException(
                        TEXT_FORMAT,
                        "Cannot parse boolean from string: expected 'true' or 'false', got '" + text + "'",
                        node.type(),
                        type);
            }
        }
        throw new ConversionException(
                CANNOT_CONVERT_STRING, "can't convert string to " + type.getTypeName(), node.type(), type);
    }

    private static Object textOrBytes(StringNode node, Type type, Class<?> raw, Options options) {
        String text = node.value();
        Encoding encoding = options.encoding;
        if (encoding == null && raw == byte[].class && !options.asString) encoding = Encoding.BASE64;
        if (encoding == null) return raw == String.class ? text : text.getBytes(StandardCharsets.UTF_8);
        byte[] bytes;
        try {
            bytes = encoding.decode(text);
        } catch (IllegalArgumentException e) {
            throw new ConversionException(
                    ENCODING, "Cannot decode " + encoding + " string: " + e.getMessage(), node.type(), type, e);
        }
        return raw == byte[].class ? bytes : new String(bytes, StandardCharsets.UTF_8);
    }

    static boolean isTextType(Class<?> raw) {
        return raw == BigInteger.class
                || raw == BigDecimal.class
                || raw == Instant.class
                || raw == OffsetDateTime.class
                || raw == ZonedDateTime.class
                || raw == LocalDate.class
                || raw == LocalTime.class
                || raw == LocalDateTime.class
                || raw == Duration.class
                || raw == Period.class
                || raw == Year.class
                || raw == YearMonth.class
                || raw == MonthDay.class
                || raw == ZoneOffset.class
                || raw == UUID.class
                || raw == URI.class
                || raw == URL.class
                || raw == Locale.class
                || raw == Currency.class
                || raw == Pattern.class;
    }

    private static Object parseText(StringNode node, Type type, Class<?> raw) {
        String value = node.value();
        try {
            if (raw == BigInteger.class) return new BigInteger(value);
            if (raw == BigDecimal.class) return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ConversionException(
                    NUMBER_FORMAT,
                    "Cannot parse " + raw.getSimpleName() + " from string: '" + value + "'",
                    node.type(),
                    type,
                    e);
        }
        try {
            if (raw == Instant.class) return Instant.parse(value);
            if (raw == OffsetDateTime.class) return OffsetDateTime.parse(value);
            if (raw == ZonedDateTime.class) return ZonedDateTime.parse(value);
            if (raw == LocalDate.class) return LocalDate.parse(value);
            if (raw == LocalTime.class) return LocalTime.parse(value);
            if (raw == LocalDateTime.class) return LocalDateTime.parse(value);
            if (raw == Duration.class) return Duration.parse(value);
            if (raw == Period.class) return Period.parse(value);
            if (raw == Year.class) return Year.parse(value);
            if (raw == YearMonth.class) return YearMonth.parse(value);
            if (raw == MonthDay.class) return MonthDay.parse(value);
            if (raw == ZoneOffset.class) return ZoneOffset.of(value);
            if (raw == UUID.class) return UUID.fromString(value);
            if (raw == URI.class) return new URI(value);
            if (raw == URL.class) return new URL(value);
            if (raw == Locale.class) return Locale.forLanguageTag(value);
            if (raw == Currency.class) return Currency.getInstance(value);
            if (raw == Pattern.class) return Pattern.compile(value);
        } catch (Exception e) {
            throw new ConversionException(
                    TEXT_FORMAT,
                    "Cannot parse " + raw.getSimpleName() + " from value: '" + value + "'",
                    node.type(),
                    type,
                    e);
        }
        throw new ConversionException(
                CANNOT_CONVERT_STRING, "can't convert string to " + type.getTypeName(), node.type(), type);
    }

    private static Object toEnum(StringNode node, Type type, Class<?> raw) {
        Object[] constants = raw.getEnumConstants();
        for (Object ec : constants) if (((Enum<?>) ec).name().equals(node.value())) return ec;
        for (Object ec : constants) if (((Enum<?>) ec).name().equalsIgnoreCase(node.value())) return ec;
        throw new ConversionException(
                TEXT_FORMAT,
                "No enum constant found with name '" + node.value() + "' in " + raw.getSimpleName(),
                node.type(),
                type);
    }

    // ============================================================
    // Boolean
    // ============================================================

    static Object fromBoolean(BooleanNode node, Type type) {
        Class<?> raw = Types.raw(type);
        boolean b = node.value();
        if (raw == boolean.class || raw == Boolean.class) return b;
        if (raw == String.class) return String.valueOf(b);
        int v = b ? 1 : 0;
        if (raw == int.class || raw == Integer.class) return v;
        if (raw == long.class || raw == Long.class) return (long) v;
        if (raw == short.class || raw == Short.class) return (short) v;
        if (raw == byte.class || raw == Byte.class) return (byte) v;
        if (raw == char.class || raw == Character.class) return (char) v;
        if (raw == double.class || raw == Double.class) return (double) v;
        if (raw == float.class || raw == Float.class) return (float) v;
        throw new ConversionException(
                CANNOT_CONVERT_BOOLEAN, "can't convert boolean to " + type.getTypeName(), node.type(), type);
    }
}
