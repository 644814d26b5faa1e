package jsontree;

import static jsontree.JsonException.ConversionException.Reason.INCOMPATIBLE_TYPES;
import static jsontree.JsonException.ConversionException.Reason.INSTANTIATION;
import static jsontree.JsonException.ConversionException.Reason.MAP_KEY_MUST_BE_STRING;
import static jsontree.JsonException.ConversionException.Reason.NESTING_TOO_DEEP;
import static jsontree.JsonException.ConversionException.Reason.NIL_DESTINATION;
import static jsontree.JsonException.ConversionException.Reason.POINTER_EXPECTED;
import static jsontree.JsonException.ConversionException.Reason.SEQUENCE_EXPECTED;
import static jsontree.JsonException.ConversionException.Reason.STRUCT_OR_MAP_EXPECTED;

import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import jsontree.JsonException.ConversionException;
import jsontree.JsonException.ExtensionException;
import jsontree.JsonException.UndefinedFieldException;
import lombok.SneakyThrows;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Type-directed decoding of {@link Node}s.
 *
 * <p> Dispatch order for a non-null node:
 * <ol>
 *   <li>look through {@code Optional}, {@code AtomicReference} and {@link Ref} holders, creating them as needed</li>
 *   <li>{@link Node} destinations receive the node itself</li>
 *   <li>open destinations ({@code Object}, interfaces, abstract classes) use the {@link TypeRegistry},
 *       then a type derived from the node kind</li>
 *   <li>{@link NodeDecodable} destinations decode themselves</li>
 *   <li>{@link TypeDecoder} extensions</li>
 *   <li>the generic rules for the node kind</li>
 * </ol>
 * A {@code null} node resets the destination to its zero value before any of the above.
 *
 * @author Freeman
 * @since 0.1.0
 */
public final class Decoder {

    private static final Type NUMBER_TYPE = Double.class;
    private static final Type STRING_TYPE = String.class;
    private static final Type BOOLEAN_TYPE = Boolean.class;
    private static final Type OBJECT_TYPE = new Ref<Map<String, Object>>() {}.getType();
    private static final Type ARRAY_TYPE = new Ref<List<Object>>() {}.getType();

    private Decoder() {
        throw new UnsupportedOperationException();
    }

    // ============================================================
    // Public API
    // ============================================================

    /**
     * Decode a node into a destination, see {@link Node#decode(Object, Option...)}.
     */
    public static void decode(Node node, @Nullable Object destination, Option... options) {
        if (destination == null) {
            throw new ConversionException(NIL_DESTINATION, "nil destination", node.type(), null);
        }
        Slot slot;
        if (destination instanceof Ref<?> ref) {
            slot = Slot.of(ref);
        } else if (isInPlace(destination.getClass())) {
            slot = Slot.fixed(destination);
        } else {
            throw new ConversionException(
                    POINTER_EXPECTED,
                    "pointer expected: " + destination.getClass().getName()
                            + " (pass a Ref or a mutable object)",
                    node.type(),
                    destination.getClass());
        }
        decode(node, slot, Options.of(options));
    }

    /**
     * Decode a node into a fresh value of an arbitrary reflective type. Intended for {@link TypeDecoder}s
     * and {@link TypeConstructor}s.
     */
    public static @Nullable Object decodeValue(Node node, Type type, Option... options) {
        var slot = Slot.temp(type);
        decode(node, slot, Options.of(options));
        return slot.get();
    }

    /**
     * Same as {@link #decodeValue(Node, Type, Option...)}, continuing the nesting of {@code parent}.
     */
    public static @Nullable Object decodeValue(Node node, Type type, Options parent, Option... options) {
        var slot = Slot.temp(type);
        decode(node, slot, parent.forField(List.of(options)));
        return slot.get();
    }

    // ============================================================
    // Dispatch
    // ============================================================

    static void decode(Node node, Slot slot, Options options) {
        if (options.depth > options.context.maxDepth()) {
            throw new ConversionException(
                    NESTING_TOO_DEEP,
                    "decode nesting deeper than " + options.context.maxDepth(),
                    node.type(),
                    slot.type());
        }
        if (node instanceof NullNode) {
            slot.clear();
            return;
        }

        Slot target = slot;
        while (Types.isIndirection(Types.raw(target.type()))) target = Slot.unwrap(target);

        Type type = Types.canonicalize(target.type());
        Class<?> raw = Types.raw(type);

        if (Node.class.isAssignableFrom(raw)) {
            if (!raw.isInstance(node)) throw incompatible(node, type);
            target.set(node);
            return;
        }
        if (Types.isDynamic(raw)) {
            decodeDynamic(node, target, type, raw, options);
            return;
        }
        if (NodeDecodable.class.isAssignableFrom(raw)) {
            target.set(decodeSelf(node, raw, target.get()));
            return;
        }
        for (var decoder : TypeDecoders.INSTANCE) {
            if (decoder.canDecode(raw)) {
                target.set(decoder.decode(node, type, target.get(), options));
                return;
            }
        }
        decodeGeneric(node, target, type, options);
    }

    private static void decodeDynamic(Node node, Slot target, Type type, Class<?> raw, Options options) {
        var context = options.context;
        var constructor = context.typeRegistry().lookup(raw);
        if (constructor != null) {
            Object value;
            try {
                value = constructor.construct(node, context);
            } catch (JsonException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExtensionException("Type constructor for " + raw.getName() + " failed", e);
            }
            if (value != null && !raw.isInstance(value)) throw incompatible(value.getClass(), node, type);
            target.set(value);
            return;
        }

        var tmp = Slot.temp(defaultType(node));
        decodeGeneric(node, tmp, tmp.type(), options);
        Object value = tmp.get();
        if (!raw.isInstance(value)) throw incompatible(Types.raw(tmp.type()), node, type);
        target.set(value);
    }

    private static Object decodeSelf(Node node, Class<?> raw, @Nullable Object current) {
        var target = current != null ? (NodeDecodable) current : (NodeDecodable) Types.instantiate(raw);
        try {
            target.decodeNode(node);
        } catch (JsonException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtensionException("Failed to decode " + raw.getName() + " from node", e);
        }
        return target;
    }

    private static void decodeGeneric(Node node, Slot target, Type type, Options options) {
        if (node instanceof NumberNode n) {
            target.set(Conversions.fromNumber(n, type));
        } else if (node instanceof StringNode s) {
            target.set(Conversions.fromString(s, type, target.get(), options));
        } else if (node instanceof BooleanNode b) {
            target.set(Conversions.fromBoolean(b, type));
        } else if (node instanceof ObjectNode o) {
            decodeObject(o, target, type, options);
        } else if (node instanceof ArrayNode a) {
            decodeArray(a, target, type, options);
        } else {
            throw new IllegalStateException("Unknown node: " + node);
        }
    }

    // ============================================================
    // Object
    // ============================================================

    private static void decodeObject(ObjectNode node, Slot target, Type type, Options options) {
        Class<?> raw = Types.raw(type);
        if (Map.class.isAssignableFrom(raw)) {
            target.set(toMap(node, type, options));
        } else if (raw.isRecord()) {
            target.set(toRecord(node, type, raw, options));
        } else if (Types.isStruct(raw)) {
            target.set(toStruct(node, type, raw, target.get(), options));
        } else {
            throw new ConversionException(
                    STRUCT_OR_MAP_EXPECTED, "struct or map expected: " + type.getTypeName(), node.type(), type);
        }
    }

    private static Map<Object, Object> toMap(ObjectNode node, Type type, Options options) {
        Type keyType = Types.mapKeyType(type);
        Class<?> keyRaw = Types.raw(keyType);
        if (keyRaw != String.class && keyRaw != CharSequence.class && keyRaw != Object.class) {
            throw new ConversionException(
                    MAP_KEY_MUST_BE_STRING,
                    "map key must be a string: " + type.getTypeName(),
                    node.type(),
                    type);
        }
        Type valueType = Types.mapValueType(type);
        var map = Types.createMap(Types.raw(type), node.numFields());
        for (var entry : node.fields().entrySet()) {
            var value = Slot.temp(valueType);
            decode(entry.getValue(), value, options.forElement());
            map.put(entry.getKey(), value.get());
        }
        return map;
    }

    private static Object toStruct(ObjectNode node, Type type, Class<?> raw, @Nullable Object current, Options options) {
        Object instance = current != null && current.getClass() == raw ? current : Types.instantiate(raw);
        var fields = StructFields.of(raw);
        var context = options.context;
        for (var entry : node.fields().entrySet()) {
            var field = fields.get(entry.getKey());
            if (field == null) {
                if (context.disallowUnknownFields()) throw new UndefinedFieldException(entry.getKey(), type);
                LOGGER.trace("Skipping unknown field '{}' of {}", entry.getKey(), raw.getName());
                continue;
            }
            var fieldOptions = field.options().toOptions(context.encodingRegistry());
            decode(entry.getValue(), Slot.field(owner(instance, field), field.field()), options.forField(fieldOptions));
        }
        return instance;
    }

    /**
     * Walk the embedding path of a field, creating missing embedded instances.
     */
    @SneakyThrows
    private static Object owner(Object root, StructField field) {
        Object owner = root;
        var path = field.path();
        for (int i = 0; i < path.size() - 1; i++) {
            Field hop = path.get(i);
            Object next = hop.get(owner);
            if (next == null) {
                next = Types.instantiate(hop.getType());
                hop.set(owner, next);
            }
            owner = next;
        }
        return owner;
    }

    private static Object toRecord(ObjectNode node, Type type, Class<?> raw, Options options) {
        var components = raw.getRecordComponents();
        var context = options.context;
        var names = new HashMap<String, Integer>();
        var args = new Object[components.length];
        for (int i = 0; i < components.length; i++) {
            var c = components[i];
            var tag = c.getAnnotation(JsonTag.class);
            var fieldOptions = FieldOptions.parse(tag == null ? null : tag.value());
            args[i] = Types.defaultValue(c.getType());
            if (fieldOptions.ignored()) continue;
            names.put(fieldOptions.name().isEmpty() ? c.getName() : fieldOptions.name(), i);
        }
        for (var entry : node.fields().entrySet()) {
            Integer index = names.get(entry.getKey());
            if (index == null) {
                if (context.disallowUnknownFields()) throw new UndefinedFieldException(entry.getKey(), type);
                LOGGER.trace("Skipping unknown component '{}' of {}", entry.getKey(), raw.getName());
                continue;
            }
            var c = components[index];
            var tag = c.getAnnotation(JsonTag.class);
            var fieldOptions = FieldOptions.parse(tag == null ? null : tag.value());
            var slot = Slot.temp(c.getGenericType());
            decode(entry.getValue(), slot, options.forField(fieldOptions.toOptions(context.encodingRegistry())));
            args[index] = slot.get();
        }
        Class<?>[] ctorTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class[]::new);
        try {
            Constructor<?> ctor = raw.getDeclaredConstructor(ctorTypes);
            Types.makeAccessible(ctor, raw);
            return ctor.newInstance(args);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof JsonException je) throw je;
            throw new ExtensionException("Record constructor of " + raw.getName() + " failed", e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new ConversionException(
                    INSTANTIATION, "Failed to construct record instance of type " + raw.getName(), node.type(), type, e);
        }
    }

    // ============================================================
    // Array
    // ============================================================

    private static void decodeArray(ArrayNode node, Slot target, Type type, Options options) {
        Class<?> raw = Types.raw(type);
        if (raw.isArray()) {
            target.set(toArray(node, type, raw, target.inPlace() ? target.get() : null, options));
        } else if (Collection.class.isAssignableFrom(raw)) {
            target.set(toCollection(node, type, raw, options));
        } else {
            throw new ConversionException(
                    SEQUENCE_EXPECTED, "slice or array expected: " + type.getTypeName(), node.type(), type);
        }
    }

    /**
     * A caller-owned array is filled in place and extra source elements are ignored; otherwise a new array
     * of the source length is created.
     */
    private static Object toArray(ArrayNode node, Type type, Class<?> raw, @Nullable Object current, Options options) {
        Type componentType = Types.collectionElementType(type);
        Object array = current != null ? current : Array.newInstance(raw.getComponentType(), node.size());
        int n = Math.min(node.size(), Array.getLength(array));
        for (int i = 0; i < n; i++) {
            decode(node.get(i), Slot.element(array, i, componentType), options.forElement());
        }
        return array;
    }

    private static Collection<Object> toCollection(ArrayNode node, Type type, Class<?> raw, Options options) {
        Type elementType = Types.collectionElementType(type);
        var collection = Types.createCollection(raw, node.size());
        for (var element : node.elements()) {
            var slot = Slot.temp(elementType);
            decode(element, slot, options.forElement());
            collection.add(slot.get());
        }
        return collection;
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * In-place destinations: objects that can be updated without replacing them.
     */
    static boolean isInPlace(Class<?> raw) {
        return raw.isArray()
                || NodeDecodable.class.isAssignableFrom(raw)
                || TextDecodable.class.isAssignableFrom(raw)
                || Types.isStruct(raw);
    }

    private static Type defaultType(Node node) {
        if (node instanceof NumberNode) return NUMBER_TYPE;
        if (node instanceof StringNode) return STRING_TYPE;
        if (node instanceof BooleanNode) return BOOLEAN_TYPE;
        if (node instanceof ObjectNode) return OBJECT_TYPE;
        if (node instanceof ArrayNode) return ARRAY_TYPE;
        throw new IllegalStateException("Unknown node: " + node);
    }

    private static ConversionException incompatible(Node node, Type type) {
        return incompatible(node.getClass(), node, type);
    }

    private static ConversionException incompatible(Class<?> actual, Node node, Type type) {
        return new ConversionException(
                INCOMPATIBLE_TYPES,
                "can't convert " + actual.getName() + " to " + type.getTypeName(),
                node.type(),
                type);
    }

    private static final class TypeDecoders {
        private static final List<TypeDecoder> INSTANCE = loadTypeDecoders();
    }

    static List<TypeDecoder> loadTypeDecoders() {
        var decoders = new ArrayList<TypeDecoder>();
        for (var d : ServiceLoader.load(TypeDecoder.class)) {
            LOGGER.debug("Loaded type decoder {}", d.getClass().getName());
            decoders.add(d);
        }
        return List.copyOf(decoders);
    }

    private static final Logger LOGGER = LoggerFactory.getLogger(Decoder.class);
}
