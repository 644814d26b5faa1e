package jsontree;

import static jsontree.JsonException.ConversionException.Reason.INCOMPATIBLE_TYPES;
import static jsontree.JsonException.ConversionException.Reason.INSTANTIATION;
import static jsontree.JsonException.ConversionException.Reason.NESTING_TOO_DEEP;
import static jsontree.JsonException.ConversionException.Reason.NUMBER_FORMAT;
import static jsontree.JsonException.ConversionException.Reason.SEQUENCE_EXPECTED;
import static jsontree.JsonException.ConversionException.Reason.STRUCT_OR_MAP_EXPECTED;
import static jsontree.JsonException.ConversionException.Reason.TEXT_FORMAT;

import com.google.protobuf.BoolValue;
import com.google.protobuf.ByteString;
import com.google.protobuf.BytesValue;
import com.google.protobuf.Descriptors;
import com.google.protobuf.DoubleValue;
import com.google.protobuf.Empty;
import com.google.protobuf.FieldMask;
import com.google.protobuf.FloatValue;
import com.google.protobuf.Int32Value;
import com.google.protobuf.Int64Value;
import com.google.protobuf.ListValue;
import com.google.protobuf.Message;
import com.google.protobuf.NullValue;
import com.google.protobuf.ProtocolMessageEnum;
import com.google.protobuf.StringValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Timestamp;
import com.google.protobuf.UInt32Value;
import com.google.protobuf.UInt64Value;
import com.google.protobuf.Value;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import jsontree.JsonException.ConversionException;
import jsontree.JsonException.UndefinedFieldException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes Protocol Buffers messages, builders and enums following the proto3 JSON mapping.
 *
 * <p> Fields are matched by proto name, JSON name, and their snake/camel case variants.
 * 64-bit integers and other numbers may be quoted, bytes are base64, and the well-known types use
 * their special JSON forms.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class ProtobufDecoder implements TypeDecoder {

    private static final boolean PROTOBUF_PRESENT = Types.isClassPresent("com.google.protobuf.Message");

    public ProtobufDecoder() {}

    @Override
    public boolean canDecode(Class<?> raw) {
        return PROTOBUF_PRESENT && isProtobufClass(raw);
    }

    @Override
    public Object decode(Node node, Type type, @Nullable Object current, Options options) {
        Class<?> raw = Types.raw(type);
        if (isMessageClass(raw)) {
            var builder = newBuilder(raw);
            if (current != null) builder.mergeFrom((Message) current);
            mergeIntoBuilder(node, builder, options);
            return builder.build();
        }
        if (isMessageBuilderClass(raw)) {
            var builder = current != null ? (Message.Builder) current : newBuilder(raw);
            mergeIntoBuilder(node, builder, options);
            return builder;
        }
        if (isEnumClass(raw)) return parseEnum(node, raw);
        throw new ConversionException(
                INCOMPATIBLE_TYPES, "Not a protobuf Message, Builder, or Enum class: " + raw.getName(), node.type(), type);
    }

    static boolean isProtobufClass(Class<?> raw) {
        return isMessageClass(raw) || isMessageBuilderClass(raw) || isEnumClass(raw);
    }

    static boolean isMessageClass(Class<?> raw) {
        return Types.typeBetween(raw, null, Message.class);
    }

    static boolean isMessageBuilderClass(Class<?> raw) {
        return Types.typeBetween(raw, null, Message.Builder.class);
    }

    static boolean isEnumClass(Class<?> raw) {
        return raw.isEnum() && Types.typeBetween(raw, null, ProtocolMessageEnum.class);
    }

    // ============================================================
    // Messages
    // ============================================================

    static void mergeIntoBuilder(Node node, Message.Builder builder, Options options) {
        var descriptor = builder.getDescriptorForType();
        if (options.depth > options.context.maxDepth()) {
            throw new ConversionException(
                    NESTING_TOO_DEEP,
                    "decode nesting deeper than " + options.context.maxDepth(),
                    node.type(),
                    messageType(builder));
        }
        if (mergeWellKnown(node, builder, options)) return;

        ObjectNode object = expectObject(node, builder);
        var fieldMap = buildFieldMap(descriptor);
        for (var entry : object.fields().entrySet()) {
            var field = fieldMap.get(entry.getKey());
            if (field == null) {
                if (options.context.disallowUnknownFields())
                    throw new UndefinedFieldException(entry.getKey(), messageType(builder));
                LOGGER.trace("Skipping unknown field '{}' of {}", entry.getKey(), descriptor.getFullName());
                continue;
            }
            var value = entry.getValue();
            var child = options.forField(List.of());
            if (value instanceof NullNode) {
                mergeNull(builder, field);
            } else if (field.isMapField()) {
                mergeMap(value, builder, field, child);
            } else if (field.isRepeated()) {
                if (!(value instanceof ArrayNode array)) {
                    throw new ConversionException(
                            SEQUENCE_EXPECTED,
                            "Expected JSON array for repeated field '" + field.getFullName() + "'",
                            value.type(),
                            messageType(builder));
                }
                for (var element : array.elements()) {
                    builder.addRepeatedField(field, fieldValue(element, builder, field, child));
                }
            } else {
                builder.setField(field, fieldValue(value, builder, field, child));
            }
        }
    }

    private static void mergeNull(Message.Builder builder, Descriptors.FieldDescriptor field) {
        if (field.getJavaType() == Descriptors.FieldDescriptor.JavaType.MESSAGE
                && !field.isRepeated()
                && field.getMessageType().getFullName().equals(Value.getDescriptor().getFullName())) {
            builder.setField(field, Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build());
        } else if (field.getJavaType() == Descriptors.FieldDescriptor.JavaType.ENUM
                && !field.isRepeated()
                && field.getEnumType().getFullName().equals(NullValue.getDescriptor().getFullName())) {
            builder.setField(field, NullValue.NULL_VALUE.getValueDescriptor());
        } else {
            builder.clearField(field);
        }
    }

    private static void mergeMap(
            Node value, Message.Builder builder, Descriptors.FieldDescriptor field, Options options) {
        ObjectNode object = expectObject(value, builder);
        var entryType = field.getMessageType();
        var keyField = entryType.findFieldByName("key");
        var valueField = entryType.findFieldByName("value");
        for (var e : object.fields().entrySet()) {
            var entry = builder.newBuilderForField(field);
            entry.setField(keyField, fieldValue(new StringNode(e.getKey()), entry, keyField, options));
            if (!(e.getValue() instanceof NullNode)) {
                entry.setField(valueField, fieldValue(e.getValue(), entry, valueField, options));
            }
            builder.addRepeatedField(field, entry.build());
        }
    }

    /**
     * Single value of a field, in the representation {@link Message.Builder#setField} expects.
     */
    private static Object fieldValue(
            Node node, Message.Builder builder, Descriptors.FieldDescriptor field, Options options) {
        return switch (field.getJavaType()) {
            case INT -> isUnsigned(field)
                    ? (Object) (int) unsignedValue(node, Integer.SIZE)
                    : Objects.requireNonNull(Decoder.decodeValue(node, int.class, options, Option.asString()));
            case LONG -> isUnsigned(field)
                    ? (Object) unsignedValue(node, Long.SIZE)
                    : Objects.requireNonNull(Decoder.decodeValue(node, long.class, options, Option.asString()));
            case FLOAT -> Objects.requireNonNull(Decoder.decodeValue(node, float.class, options, Option.asString()));
            case DOUBLE -> Objects.requireNonNull(Decoder.decodeValue(node, double.class, options, Option.asString()));
            case BOOLEAN -> Objects.requireNonNull(Decoder.decodeValue(node, boolean.class, options, Option.asString()));
            case STRING -> Objects.requireNonNull(Decoder.decodeValue(node, String.class, options));
            case BYTE_STRING -> ByteString.copyFrom((byte[]) Objects.requireNonNull(
                    Decoder.decodeValue(node, byte[].class, options, Option.encoding(Encoding.BASE64))));
            case ENUM -> parseEnumValue(node, field.getEnumType());
            case MESSAGE -> {
                var sub = builder.newBuilderForField(field);
                mergeIntoBuilder(node, sub, options);
                yield sub.build();
            }
        };
    }

    static boolean mergeWellKnown(Node node, Message.Builder builder, Options options) {
        if (builder instanceof Timestamp.Builder timestamp) {
            var instant = (Instant) Objects.requireNonNull(Decoder.decodeValue(node, Instant.class, options));
            timestamp.setSeconds(instant.getEpochSecond());
            timestamp.setNanos(instant.getNano());
            return true;
        }
        if (builder instanceof com.google.protobuf.Duration.Builder duration) {
            Duration dur = parseDuration(node, options);
            long seconds = dur.getSeconds();
            int nanos = dur.getNano();
            // protobuf keeps seconds and nanos with the same sign
            if (seconds < 0 && nanos > 0) {
                seconds += 1;
                nanos -= 1_000_000_000;
            }
            duration.setSeconds(seconds);
            duration.setNanos(nanos);
            return true;
        }
        if (builder instanceof StringValue.Builder stringValue) {
            stringValue.setValue((String) Decoder.decodeValue(node, String.class, options));
            return true;
        }
        if (builder instanceof BytesValue.Builder bytesValue) {
            var bytes = (byte[]) Decoder.decodeValue(node, byte[].class, options, Option.encoding(Encoding.BASE64));
            bytesValue.setValue(ByteString.copyFrom(Objects.requireNonNull(bytes)));
            return true;
        }
        if (builder instanceof BoolValue.Builder boolValue) {
            boolValue.setValue((boolean) Decoder.decodeValue(node, boolean.class, options, Option.asString()));
            return true;
        }
        if (builder instanceof DoubleValue.Builder doubleValue) {
            doubleValue.setValue((double) Decoder.decodeValue(node, double.class, options, Option.asString()));
            return true;
        }
        if (builder instanceof FloatValue.Builder floatValue) {
            floatValue.setValue((float) Decoder.decodeValue(node, float.class, options, Option.asString()));
            return true;
        }
        if (builder instanceof Int32Value.Builder int32Value) {
            int32Value.setValue((int) Decoder.decodeValue(node, int.class, options, Option.asString()));
            return true;
        }
        if (builder instanceof UInt32Value.Builder uint32Value) {
            uint32Value.setValue((int) unsignedValue(node, Integer.SIZE));
            return true;
        }
        if (builder instanceof Int64Value.Builder int64Value) {
            int64Value.setValue((long) Decoder.decodeValue(node, long.class, options, Option.asString()));
            return true;
        }
        if (builder instanceof UInt64Value.Builder uint64Value) {
            uint64Value.setValue(unsignedValue(node, Long.SIZE));
            return true;
        }
        if (builder instanceof FieldMask.Builder fieldMask) {
            var paths = (String) Objects.requireNonNull(Decoder.decodeValue(node, String.class, options));
            for (var s : paths.split(",")) {
                if (!s.isEmpty()) fieldMask.addPaths(toSnakeCase(s));
            }
            return true;
        }
        if (builder instanceof Struct.Builder struct) {
            for (var entry : expectObject(node, builder).fields().entrySet()) {
                struct.putFields(entry.getKey(), toValue(entry.getValue(), options));
            }
            return true;
        }
        if (builder instanceof ListValue.Builder list) {
            var elements = node instanceof ArrayNode a ? a.elements() : List.of(node);
            for (var v : elements) list.addValues(toValue(v, options));
            return true;
        }
        if (builder instanceof Value.Builder value) {
            value.mergeFrom(toValue(node, options));
            return true;
        }
        return builder instanceof Empty.Builder;
    }

    /**
     * Proto3 JSON duration {@code "1.5s"}, also accepting ISO-8601 {@code "PT1.5S"}.
     */
    static Duration parseDuration(Node node, Options options) {
        if (node instanceof StringNode s && s.value().endsWith("s") && !s.value().startsWith("P")) {
            var text = s.value().substring(0, s.value().length() - 1);
            try {
                var seconds = new BigDecimal(text);
                var whole = Conversions.integerPart(seconds, 19);
                if (whole == null || whole.bitLength() >= Long.SIZE) throw durationFormat(s, null);
                var fraction = whole.signum() == 0 ? seconds : seconds.subtract(new BigDecimal(whole));
                var nanos = Objects.requireNonNull(Conversions.integerPart(fraction.movePointRight(9), 9));
                return Duration.ofSeconds(whole.longValue(), nanos.intValue());
            } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
                throw durationFormat(s, e);
            }
        }
        return (Duration) Objects.requireNonNull(Decoder.decodeValue(node, Duration.class, options));
    }

    private static ConversionException durationFormat(StringNode node, @Nullable Throwable cause) {
        return new ConversionException(
                TEXT_FORMAT, "Cannot parse Duration from value: '" + node.value() + "'", node.type(), Duration.class, cause);
    }

    static Value toValue(Node node, Options options) {
        var builder = Value.newBuilder();
        if (node instanceof NullNode) builder.setNullValue(NullValue.NULL_VALUE);
        else if (node instanceof BooleanNode b) builder.setBoolValue(b.value());
        else if (node instanceof NumberNode n) builder.setNumberValue(n.value().doubleValue());
        else if (node instanceof StringNode s) builder.setStringValue(s.value());
        else if (node instanceof ObjectNode o) {
            var sb = Struct.newBuilder();
            mergeIntoBuilder(o, sb, options.forField(List.of()));
            builder.setStructValue(sb.build());
        } else if (node instanceof ArrayNode a) {
            var lb = ListValue.newBuilder();
            mergeIntoBuilder(a, lb, options.forField(List.of()));
            builder.setListValue(lb.build());
        }
        return builder.build();
    }

    static boolean isUnsigned(Descriptors.FieldDescriptor field) {
        return switch (field.getType()) {
            case UINT32, FIXED32, UINT64, FIXED64 -> true;
            default -> false;
        };
    }

    /**
     * Unsigned integer of the given width from a number or a numeric string, returned as its two's complement bits.
     */
    static long unsignedValue(Node node, int bits) {
        BigDecimal bd;
        if (node instanceof NumberNode n) {
            bd = n.value();
        } else if (node instanceof StringNode s) {
            try {
                bd = new BigDecimal(s.value());
            } catch (NumberFormatException e) {
                throw new ConversionException(
                        NUMBER_FORMAT, "Cannot parse uint" + bits + " from string: '" + s.value() + "'", node.type(), long.class, e);
            }
        } else {
            throw new ConversionException(
                    INCOMPATIBLE_TYPES, "Cannot coerce " + node.type() + " to uint" + bits, node.type(), long.class);
        }
        if (bd.signum() == 0) return 0;
        BigInteger value = null;
        long digits = Conversions.integerDigits(bd);
        if (bd.signum() > 0 && digits >= 1 && digits <= 20 && bd.stripTrailingZeros().scale() <= 0) {
            value = bd.toBigInteger();
        }
        if (value == null || value.bitLength() > bits) {
            throw new ConversionException(
                    NUMBER_FORMAT, "Value out of range for uint" + bits + ": " + bd, node.type(), long.class);
        }
        return value.longValue();
    }

    // ============================================================
    // Enums
    // ============================================================

    static Object parseEnum(Node node, Class<?> raw) {
        if (node instanceof StringNode s) {
            for (Object ec : raw.getEnumConstants()) if (((Enum<?>) ec).name().equals(s.value())) return ec;
            for (Object ec : raw.getEnumConstants()) if (((Enum<?>) ec).name().equalsIgnoreCase(s.value())) return ec;
            throw new ConversionException(
                    TEXT_FORMAT, "No enum constant " + raw.getName() + "." + s.value(), node.type(), raw);
        }
        if (node instanceof NumberNode n) {
            var number = Conversions.integerPart(n.value(), 10);
            if (number == null || number.bitLength() >= Integer.SIZE) {
                throw new ConversionException(
                        TEXT_FORMAT, "No enum constant " + raw.getName() + " with number " + n.value(), node.type(), raw);
            }
            int i = number.intValue();
            for (Object constant : raw.getEnumConstants()) {
                var pm = (ProtocolMessageEnum) constant;
                if (((Enum<?>) constant).name().equals("UNRECOGNIZED")) continue;
                if (pm.getNumber() == i) return pm;
            }
            throw new ConversionException(
                    TEXT_FORMAT, "No enum constant " + raw.getName() + " with number " + i, node.type(), raw);
        }
        throw new ConversionException(
                INCOMPATIBLE_TYPES, "Cannot coerce " + node.type() + " to enum " + raw.getName(), node.type(), raw);
    }

    static Descriptors.EnumValueDescriptor parseEnumValue(Node node, Descriptors.EnumDescriptor enumType) {
        Descriptors.EnumValueDescriptor value = null;
        if (node instanceof StringNode s) {
            value = enumType.findValueByName(s.value());
        } else if (node instanceof NumberNode n) {
            var number = Conversions.integerPart(n.value(), 10);
            if (number != null && number.bitLength() < Integer.SIZE) {
                value = enumType.isClosed()
                        ? enumType.findValueByNumber(number.intValue())
                        : enumType.findValueByNumberCreatingIfUnknown(number.intValue());
            }
        }
        if (value == null) {
            throw new ConversionException(
                    TEXT_FORMAT,
                    "Invalid enum value " + node + " for enum type " + enumType.getFullName(),
                    node.type(),
                    null);
        }
        return value;
    }

    // ============================================================
    // Helpers
    // ============================================================

    static Message.Builder newBuilder(Class<?> raw) {
        Class<?> targetClass = raw;
        if (isMessageBuilderClass(raw)) {
            var enclosing = raw.getEnclosingClass();
            if (enclosing != null && isMessageClass(enclosing)) targetClass = enclosing;
        }
        try {
            var method = targetClass.getMethod("newBuilder");
            return (Message.Builder) method.invoke(null);
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new ConversionException(
                    INSTANTIATION, "Cannot create protobuf builder for " + targetClass.getName(), null, raw, e);
        }
    }

    /**
     * Accepted JSON keys of every field: proto name, JSON name, and their snake and camel forms.
     */
    static Map<String, Descriptors.FieldDescriptor> buildFieldMap(Descriptors.Descriptor descriptor) {
        Map<String, Descriptors.FieldDescriptor> map = new LinkedHashMap<>();
        for (var field : descriptor.getFields()) {
            map.put(field.getName(), field);
            map.putIfAbsent(toSnakeCase(field.getName()), field);
            map.putIfAbsent(toCamelCase(field.getName()), field);
            map.putIfAbsent(field.getJsonName(), field);
            map.putIfAbsent(toSnakeCase(field.getJsonName()), field);
        }
        return map;
    }

    static ObjectNode expectObject(Node node, Message.Builder builder) {
        if (node instanceof ObjectNode obj) return obj;
        throw new ConversionException(
                STRUCT_OR_MAP_EXPECTED,
                "Expected JSON object for protobuf message " + builder.getDescriptorForType().getFullName()
                        + ", but got " + node.type(),
                node.type(),
                messageType(builder));
    }

    private static Type messageType(Message.Builder builder) {
        return builder.getDefaultInstanceForType().getClass();
    }

    static String toSnakeCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    char prev = name.charAt(i - 1);
                    if (Character.isLowerCase(prev) || Character.isDigit(prev)) {
                        sb.append('_');
                    } else if (Character.isUpperCase(prev)
                            && i + 1 < name.length()
                            && Character.isLowerCase(name.charAt(i + 1))) {
                        sb.append('_');
                    }
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String toCamelCase(String name) {
        StringBuilder sb = new StringBuilder();
        boolean upperNext = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(ProtobufDecoder.class);
}
