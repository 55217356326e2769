package com.acme.pubsub.core;

import java.lang.annotation.Annotation;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Field layout of a record type: component names, generic types and the canonical
 * constructor. Built once per type and reused for every encode and decode.
 */
public final class RecordContract<T> {

    private final Class<T> type;
    private final List<Field> fields;
    private final Map<String, Field> byName;
    private final Constructor<T> constructor;

    private RecordContract(Class<T> type, List<Field> fields, Constructor<T> constructor) {
        this.type = type;
        this.fields = fields;
        this.constructor = constructor;
        Map<String, Field> index = new LinkedHashMap<>();
        fields.forEach(f -> index.put(f.name(), f));
        this.byName = Collections.unmodifiableMap(index);
    }

    public static <T> RecordContract<T> of(Class<T> type) {
        if (!type.isRecord()) {
            throw new ChannelConfigurationException(type.getName() + " must be a record");
        }
        RecordComponent[] components = type.getRecordComponents();
        List<Field> fields = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
            Method accessor = component.getAccessor();
            accessor.setAccessible(true);
            Column column = component.getAnnotation(Column.class);
            fields.add(new Field(
                component.getName(),
                component.getGenericType(),
                component.getType(),
                component.getType() == Optional.class || isNullable(component),
                column != null ? column.value() : null,
                accessor
            ));
        }
        try {
            Class<?>[] parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
            Constructor<T> constructor = type.getDeclaredConstructor(parameterTypes);
            constructor.setAccessible(true);
            return new RecordContract<>(type, List.copyOf(fields), constructor);
        } catch (NoSuchMethodException e) {
            throw new ChannelConfigurationException("No canonical constructor on " + type.getName());
        }
    }

    private static boolean isNullable(RecordComponent component) {
        return Stream.of(
                component.getAnnotations(),
                component.getAccessor().getAnnotations(),
                component.getAnnotatedType().getAnnotations())
            .flatMap(Arrays::stream)
            .map(Annotation::annotationType)
            .anyMatch(a -> a.getSimpleName().equals("Nullable"));
    }

    public Class<T> type() {
        return type;
    }

    public List<Field> fields() {
        return fields;
    }

    public Optional<Field> field(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean hasField(String name) {
        return byName.containsKey(name);
    }

    public Map<String, Object> values(T instance) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : fields) {
            values.put(field.name(), field.read(instance));
        }
        return values;
    }

    /**
     * Creates an instance from decoded field values. Absent optional fields become
     * {@code Optional.empty()} or {@code null}; with {@code lenient} every absent reference
     * field becomes {@code null}. Any other absent field is a decode error.
     */
    public T instantiate(Map<String, ?> values, boolean lenient) {
        Object[] args = new Object[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            if (values.containsKey(field.name())) {
                args[i] = values.get(field.name());
            } else if (field.rawType() == Optional.class) {
                args[i] = Optional.empty();
            } else if (field.optional() || lenient && !field.rawType().isPrimitive()) {
                args[i] = null;
            } else {
                throw new PayloadDecodeException(
                    "Missing required field '" + field.name() + "' for " + type.getSimpleName());
            }
        }
        try {
            return constructor.newInstance(args);
        } catch (InvocationTargetException e) {
            throw new PayloadDecodeException("Cannot create " + type.getSimpleName() + ": " + e.getCause().getMessage(), e.getCause());
        } catch (ReflectiveOperationException | IllegalArgumentException e) {
            throw new PayloadDecodeException("Cannot create " + type.getSimpleName(), e);
        }
    }

    public record Field(String name, Type type, Class<?> rawType, boolean optional, String column, Method accessor) {

        Object read(Object instance) {
            try {
                return accessor.invoke(instance);
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Cannot read " + name, e);
            }
        }
    }
}
