/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl;

import jurl.QueryParamCollection.QueryParam;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.*;
import java.util.*;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.lang.System.Logger.Level.DEBUG;
import static jurl.internal.Utils.toInvariantString;

/**
 * Turns arbitrary objects into ordered name/value pairs, the way {@link Url#setQueryParams(Object)} reads them.
 */
public final class KeyValuePairs {
    private static final System.Logger LOGGER = System.getLogger("jurl.KeyValuePairs");

    private static final String[] KEY_PROPERTIES = {"key", "Key", "name", "Name"};
    private static final String[] VALUE_PROPERTIES = {"value", "Value"};

    // un-instantiable
    private KeyValuePairs() {
    }

    /**
     * @return the name/value pairs of {@code obj}, as a lazy stream:
     * <ul>
     *     <li>a {@link ToQueryPairs} supplies its own pairs.</li>
     *     <li>a {@link String} is parsed as a query string, its values are decoded.</li>
     *     <li>a {@link Map} gives one pair per entry, in iteration order. Entries with a null key are skipped.</li>
     *     <li>an {@link Iterable}, an array or a {@link Stream} gives one pair per element. Each element must be a
     *     {@link Map.Entry}, a {@link QueryParam}, or an object with a readable {@code key}, {@code Key}, {@code name}
     *     or {@code Name} property and a readable {@code value} or {@code Value} property. Null elements and elements
     *     with a null key are skipped.</li>
     *     <li>any other object gives one pair per publicly readable property: the components of a record in
     *     declaration order, or else the public instance fields and the public {@code getX()} and {@code isX()}
     *     getters, ordered by property name. Members that are not public are skipped.</li>
     * </ul>
     * Keys are converted with their locale-independent string form, values are returned as they are.
     * @throws NullPointerException     if {@code obj} is null.
     * @throws IllegalArgumentException when an element of a collection that cannot be read as a pair is reached in the
     *                                  returned stream.
     * @throws IllegalStateException    when a property getter throws while its value is read from the returned stream.
     */
    public static @NonNull Stream<@NonNull QueryParam> of(final @NonNull Object obj) {
        Objects.requireNonNull(obj);

        if (obj instanceof ToQueryPairs toQueryPairs) {
            return toQueryPairs.toQueryPairs();
        }
        if (obj instanceof String query) {
            return StreamSupport.stream(QueryParamCollection.parse(query).spliterator(), false);
        }
        if (obj instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                    .filter(entry -> entry.getKey() != null)
                    .map(entry -> new QueryParam(toInvariantString(entry.getKey()), entry.getValue()));
        }
        if (obj instanceof Iterable<?> iterable) {
            return collectionToPairs(StreamSupport.stream(iterable.spliterator(), false));
        }
        if (obj instanceof Stream<?> stream) {
            return collectionToPairs(stream);
        }
        if (obj.getClass().isArray()) {
            final var length = Array.getLength(obj);
            return collectionToPairs(IntStream.range(0, length).mapToObj(i -> Array.get(obj, i)));
        }
        return objectToPairs(obj);
    }

    private static @NonNull Stream<@NonNull QueryParam> collectionToPairs(final @NonNull Stream<?> elements) {
        return elements
                .filter(Objects::nonNull)
                .map(KeyValuePairs::elementToPair)
                .filter(Objects::nonNull);
    }

    /**
     * @return the pair held by {@code element}, or null if its key is null.
     */
    private static @Nullable QueryParam elementToPair(final @NonNull Object element) {
        if (element instanceof QueryParam queryParam) {
            return queryParam;
        }
        if (element instanceof Map.Entry<?, ?> entry) {
            return (entry.getKey() != null)
                    ? new QueryParam(toInvariantString(entry.getKey()), entry.getValue())
                    : null;
        }

        final var type = element.getClass();
        final var keyProperty = findProperty(type, KEY_PROPERTIES);
        final var valueProperty = findProperty(type, VALUE_PROPERTIES);
        if (keyProperty == null || valueProperty == null) {
            throw new IllegalArgumentException("Cannot read " + type.getName() + " as a name/value pair, expected a " +
                    "key or name property and a value property");
        }

        final var key = keyProperty.read(element);
        return (key != null) ? new QueryParam(toInvariantString(key), valueProperty.read(element)) : null;
    }

    private static @NonNull Stream<@NonNull QueryParam> objectToPairs(final @NonNull Object obj) {
        final var properties = readableProperties(obj.getClass());
        return properties.stream()
                .map(property -> new QueryParam(property.name, property.read(obj)));
    }

    /**
     * @return the first of {@code names} that is a readable property of {@code type}, or null if none is.
     */
    private static @Nullable Property findProperty(final @NonNull Class<?> type, final @NonNull String[] names) {
        if (type.isRecord()) {
            for (final var name : names) {
                for (final var component : type.getRecordComponents()) {
                    if (component.getName().equals(name)) {
                        return Property.of(name, component.getAccessor());
                    }
                }
            }
            return null;
        }

        for (final var name : names) {
            final var getter = publicGetter(type, name);
            if (getter != null) {
                return Property.of(name, getter);
            }
            try {
                final var field = type.getField(name);
                if (!Modifier.isStatic(field.getModifiers())) {
                    return Property.of(name, field);
                }
            } catch (NoSuchFieldException _unused) {
                // try the next name
            }
        }
        return null;
    }

    private static @Nullable Method publicGetter(final @NonNull Class<?> type, final @NonNull String name) {
        final var capitalized = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (final var candidate : new String[]{"get" + capitalized, name}) {
            try {
                final var method = type.getMethod(candidate);
                if (!Modifier.isStatic(method.getModifiers()) && method.getReturnType() != void.class) {
                    return method;
                }
            } catch (NoSuchMethodException _unused) {
                // try the next candidate
            }
        }
        return null;
    }

    private static @NonNull List<@NonNull Property> readableProperties(final @NonNull Class<?> type) {
        if (type.isRecord()) {
            final var result = new ArrayList<Property>();
            for (final var component : type.getRecordComponents()) {
                final var property = Property.of(component.getName(), component.getAccessor());
                if (property != null) {
                    result.add(property);
                }
            }
            return result;
        }

        final var properties = new TreeMap<String, Property>();
        for (final var field : type.getFields()) {
            if (!Modifier.isStatic(field.getModifiers())) {
                final var property = Property.of(field.getName(), field);
                if (property != null) {
                    properties.put(property.name, property);
                }
            }
        }
        for (final var method : type.getMethods()) {
            final var name = getterPropertyName(method);
            if (name != null) {
                final var property = Property.of(name, method);
                if (property != null) {
                    properties.put(name, property);
                }
            }
        }

        if (LOGGER.isLoggable(DEBUG)) {
            for (var c = type; c != null && c != Object.class; c = c.getSuperclass()) {
                for (final var field : c.getDeclaredFields()) {
                    if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()
                            && !properties.containsKey(field.getName())) {
                        LOGGER.log(DEBUG, "Skipping {0}.{1}, it is not publicly readable",
                                c.getName(), field.getName());
                    }
                }
            }
        }
        return List.copyOf(properties.values());
    }

    /**
     * @return the property name of {@code method} if it is a public no-arg {@code getX()}, or a boolean
     * {@code isX()}, or null.
     */
    private static @Nullable String getterPropertyName(final @NonNull Method method) {
        if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0
                || method.getReturnType() == void.class || method.getDeclaringClass() == Object.class) {
            return null;
        }

        final var name = method.getName();
        if (name.length() > 3 && name.startsWith("get")) {
            return decapitalize(name.substring(3));
        }
        if (name.length() > 2 && name.startsWith("is") && method.getReturnType() == boolean.class) {
            return decapitalize(name.substring(2));
        }
        return null;
    }

    private static @NonNull String decapitalize(final @NonNull String name) {
        // "URL" stays "URL", "Name" becomes "name".
        if (name.length() > 1 && Character.isUpperCase(name.charAt(1)) && Character.isUpperCase(name.charAt(0))) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * A readable property, backed by a public getter or a public field.
     */
    private static final class Property {
        private final @NonNull String name;
        private final @NonNull AccessibleObject member;

        private Property(final @NonNull String name, final @NonNull AccessibleObject member) {
            this.name = name;
            this.member = member;
        }

        /**
         * @return the property, or null if {@code member} cannot be made accessible. A public member of a class that
         * is not public needs it.
         */
        static @Nullable Property of(final @NonNull String name, final @NonNull AccessibleObject member) {
            if (!member.trySetAccessible()) {
                LOGGER.log(DEBUG, "Skipping {0}, it is not accessible", member);
                return null;
            }
            return new Property(name, member);
        }

        @Nullable
        Object read(final @NonNull Object target) {
            try {
                if (member instanceof Method method) {
                    return method.invoke(target);
                }
                return ((Field) member).get(target);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Failed to read property " + name + " of " +
                        target.getClass().getName(), e.getCause());
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Property " + name + " of " + target.getClass().getName() +
                        " is not readable", e);
            }
        }
    }
}
