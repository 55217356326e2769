package com.acme.pubsub.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import jakarta.inject.Singleton;
import java.lang.reflect.Array;
import java.lang.reflect.Constructor;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Converts single values between Java and the JSON wire format, driven by the declared
 * (generic) type of the target field.
 * <p>
 * Containers are handled element by element, {@code java.time} values travel as ISO-8601
 * text and decimals never pass through {@code double}. Types the codec does not know are
 * written with {@code toString()} and read back with their own from-text factory.
 */
@Singleton
public final class ValueCodec {

    private static final List<String> FACTORY_METHODS = List.of("valueOf", "fromString", "parse", "of");

    private final JsonNodeFactory nodes = Jsons.nodes();
    private final Map<Class<?>, Function<String, Object>> textParsers = new ConcurrentHashMap<>();

    public JsonNode encode(Object value) {
        if (value == null) {
            return nodes.nullNode();
        }
        if (value instanceof Optional<?> optional) {
            return encode(optional.orElse(null));
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        if (value instanceof Map<?, ?> map) {
            ObjectNode object = nodes.objectNode();
            map.forEach((k, v) -> object.set(encodeKey(k), encode(v)));
            return object;
        }
        if (value instanceof Collection<?> collection) {
            ArrayNode array = nodes.arrayNode();
            collection.forEach(element -> array.add(encode(element)));
            return array;
        }
        if (value.getClass().isArray()) {
            ArrayNode array = nodes.arrayNode();
            for (int i = 0; i < Array.getLength(value); i++) {
                array.add(encode(Array.get(value, i)));
            }
            return array;
        }
        if (value instanceof String s) {
            return nodes.textNode(s);
        }
        if (value instanceof Boolean b) {
            return nodes.booleanNode(b);
        }
        if (value instanceof BigDecimal d) {
            return nodes.numberNode(d);
        }
        if (value instanceof BigInteger i) {
            return nodes.numberNode(i);
        }
        if (value instanceof Long l) {
            return nodes.numberNode(l);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return nodes.numberNode(((Number) value).intValue());
        }
        if (value instanceof Double d) {
            requireFinite(d);
            return nodes.numberNode(d);
        }
        if (value instanceof Float f) {
            requireFinite(f);
            return nodes.numberNode(f);
        }
        if (value instanceof Enum<?> e) {
            return nodes.textNode(e.name());
        }
        // java.time types and UUID render their ISO / canonical text through toString()
        return nodes.textNode(value.toString());
    }

    private static void requireFinite(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(value + " has no JSON representation");
        }
    }

    private String encodeKey(Object key) {
        if (key instanceof Enum<?> e) {
            return e.name();
        }
        return String.valueOf(key);
    }

    public Object decode(JsonNode node, Type type) {
        Class<?> raw = rawClass(type);
        if (raw == Optional.class) {
            return Optional.ofNullable(decode(node, typeArgument(type, 0)));
        }
        if (node == null || node.isNull() || node.isMissingNode()) {
            if (raw.isPrimitive()) {
                throw new PayloadDecodeException("null is not a valid " + raw.getName());
            }
            return null;
        }
        if (raw == JsonNode.class || raw == ObjectNode.class && node.isObject()) {
            return node;
        }
        if (Map.class.isAssignableFrom(raw)) {
            return decodeMap(node, type);
        }
        if (Collection.class.isAssignableFrom(raw)) {
            return decodeCollection(node, type, raw);
        }
        if (raw.isArray()) {
            requireArray(node, type);
            Class<?> component = raw.getComponentType();
            Object array = Array.newInstance(component, node.size());
            for (int i = 0; i < node.size(); i++) {
                Array.set(array, i, decode(node.get(i), component));
            }
            return array;
        }
        if (raw == Object.class) {
            return plain(node);
        }
        if (node.isContainerNode()) {
            throw new PayloadDecodeException("Expected a scalar for " + type.getTypeName() + " but got " + node.getNodeType());
        }
        return decodeScalar(node, raw);
    }

    private Map<Object, Object> decodeMap(JsonNode node, Type type) {
        if (!node.isObject()) {
            throw new PayloadDecodeException("Expected a JSON object for " + type.getTypeName());
        }
        Type keyType = typeArgument(type, 0);
        Type valueType = typeArgument(type, 1);
        Map<Object, Object> result = new LinkedHashMap<>();
        node.fields().forEachRemaining(e ->
            result.put(decodeText(e.getKey(), rawClass(keyType)), decode(e.getValue(), valueType)));
        return result;
    }

    private Collection<Object> decodeCollection(JsonNode node, Type type, Class<?> raw) {
        requireArray(node, type);
        Type elementType = typeArgument(type, 0);
        Collection<Object> result = Set.class.isAssignableFrom(raw) ? new LinkedHashSet<>() : new ArrayList<>();
        node.forEach(element -> result.add(decode(element, elementType)));
        return result;
    }

    private static void requireArray(JsonNode node, Type type) {
        if (!node.isArray()) {
            throw new PayloadDecodeException("Expected a JSON array for " + type.getTypeName());
        }
    }

    private Object decodeScalar(JsonNode node, Class<?> raw) {
        if (node.isNumber()) {
            if (raw == BigDecimal.class) {
                return node.decimalValue();
            }
            if (raw == BigInteger.class) {
                return node.bigIntegerValue();
            }
            if (raw == int.class || raw == Integer.class) {
                return (int) exactIntegral(node, raw, Integer.MIN_VALUE, Integer.MAX_VALUE);
            }
            if (raw == long.class || raw == Long.class) {
                return exactIntegral(node, raw, Long.MIN_VALUE, Long.MAX_VALUE);
            }
            if (raw == short.class || raw == Short.class) {
                return (short) exactIntegral(node, raw, Short.MIN_VALUE, Short.MAX_VALUE);
            }
            if (raw == byte.class || raw == Byte.class) {
                return (byte) exactIntegral(node, raw, Byte.MIN_VALUE, Byte.MAX_VALUE);
            }
            if (raw == double.class || raw == Double.class) {
                return node.doubleValue();
            }
            if (raw == float.class || raw == Float.class) {
                return node.floatValue();
            }
        }
        if (node.isBoolean() && (raw == boolean.class || raw == Boolean.class)) {
            return node.booleanValue();
        }
        return decodeText(node.asText(), raw);
    }

    /**
     * Whole numbers only; 7.0 is accepted, 7.9 and out-of-range values are not.
     */
    private static long exactIntegral(JsonNode node, Class<?> raw, long min, long max) {
        long value;
        try {
            value = node.decimalValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new PayloadDecodeException(node + " is not a valid " + raw.getName(), e);
        }
        if (value < min || value > max) {
            throw new PayloadDecodeException(node + " is out of range for " + raw.getName());
        }
        return value;
    }

    /**
     * Decodes a value from its text form, used for scalars sent as strings and for map keys.
     */
    public Object decodeText(String text, Class<?> type) {
        if (type == String.class || type == Object.class) {
            return text;
        }
        try {
            return textParser(type).apply(text);
        } catch (PayloadDecodeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PayloadDecodeException("Cannot decode '" + text + "' as " + type.getName(), e);
        }
    }

    private Function<String, Object> textParser(Class<?> type) {
        return textParsers.computeIfAbsent(type, ValueCodec::resolveTextParser);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Function<String, Object> resolveTextParser(Class<?> type) {
        if (type == int.class || type == Integer.class) {
            return Integer::valueOf;
        }
        if (type == long.class || type == Long.class) {
            return Long::valueOf;
        }
        if (type == short.class || type == Short.class) {
            return Short::valueOf;
        }
        if (type == byte.class || type == Byte.class) {
            return Byte::valueOf;
        }
        if (type == char.class || type == Character.class) {
            return ValueCodec::parseChar;
        }
        if (type == double.class || type == Double.class) {
            return Double::valueOf;
        }
        if (type == float.class || type == Float.class) {
            return Float::valueOf;
        }
        if (type == boolean.class || type == Boolean.class) {
            return Boolean::valueOf;
        }
        if (type == BigDecimal.class) {
            return BigDecimal::new;
        }
        if (type == BigInteger.class) {
            return BigInteger::new;
        }
        if (type == UUID.class) {
            return UUID::fromString;
        }
        if (type == LocalDate.class) {
            return LocalDate::parse;
        }
        if (type == LocalDateTime.class) {
            return LocalDateTime::parse;
        }
        if (type == LocalTime.class) {
            return LocalTime::parse;
        }
        if (type == OffsetDateTime.class) {
            return OffsetDateTime::parse;
        }
        if (type == ZonedDateTime.class) {
            return ZonedDateTime::parse;
        }
        if (type == Instant.class) {
            return ValueCodec::parseInstant;
        }
        if (type.isEnum()) {
            return text -> Enum.valueOf((Class) type, text);
        }
        return fromTextFactory(type);
    }

    private static Character parseChar(String text) {
        if (text.length() != 1) {
            throw new PayloadDecodeException("Expected a single character but got '" + text + "'");
        }
        return text.charAt(0);
    }

    private static Instant parseInstant(String text) {
        // timestamptz columns render with an offset, e.g. 2024-01-01T10:00:00+00:00
        try {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(text, Instant::from);
        } catch (DateTimeParseException e) {
            return Instant.parse(text);
        }
    }

    private static Function<String, Object> fromTextFactory(Class<?> type) {
        for (String name : FACTORY_METHODS) {
            for (Method method : type.getMethods()) {
                if (method.getName().equals(name) && isTextFactory(type, method)) {
                    return text -> invoke(() -> method.invoke(null, text));
                }
            }
        }
        for (Constructor<?> constructor : type.getConstructors()) {
            if (constructor.getParameterCount() == 1 && constructor.getParameterTypes()[0] == String.class) {
                return text -> invoke(() -> constructor.newInstance(text));
            }
        }
        throw new PayloadDecodeException("No from-text factory for " + type.getName());
    }

    private static boolean isTextFactory(Class<?> type, Method method) {
        if (!Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 1) {
            return false;
        }
        Class<?> parameter = method.getParameterTypes()[0];
        return (parameter == String.class || parameter == CharSequence.class)
            && type.isAssignableFrom(method.getReturnType());
    }

    private static Object invoke(ReflectiveCall call) {
        try {
            return call.call();
        } catch (ReflectiveOperationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PayloadDecodeException("Text conversion failed: " + cause.getMessage(), cause);
        }
    }

    private Object plain(JsonNode node) {
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> map.put(e.getKey(), plain(e.getValue())));
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            node.forEach(element -> list.add(plain(element)));
            return list;
        }
        if (node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        return node.asText();
    }

    static Class<?> rawClass(Type type) {
        if (type instanceof Class<?> c) {
            return c;
        }
        if (type instanceof ParameterizedType p) {
            return (Class<?>) p.getRawType();
        }
        if (type instanceof GenericArrayType g) {
            return Array.newInstance(rawClass(g.getGenericComponentType()), 0).getClass();
        }
        if (type instanceof WildcardType w) {
            return rawClass(w.getUpperBounds()[0]);
        }
        return Object.class;
    }

    private static Type typeArgument(Type type, int index) {
        if (type instanceof ParameterizedType p && p.getActualTypeArguments().length > index) {
            return p.getActualTypeArguments()[index];
        }
        return Object.class;
    }

    @FunctionalInterface
    private interface ReflectiveCall {
        Object call() throws ReflectiveOperationException;
    }
}
