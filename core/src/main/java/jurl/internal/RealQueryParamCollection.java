/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl.internal;

import jurl.NullValueHandling;
import jurl.QueryParamCollection;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.Array;
import java.util.*;
import java.util.stream.Stream;

import static jurl.internal.Utils.splitOnFirstOccurrence;
import static jurl.internal.Utils.toInvariantString;
import static jurl.internal.url.UrlUtils.encodeIllegalCharacters;

public final class RealQueryParamCollection implements QueryParamCollection {
    private final @NonNull List<@NonNull Entry> entries;

    public RealQueryParamCollection() {
        this(new ArrayList<>());
    }

    private RealQueryParamCollection(final @NonNull List<@NonNull Entry> entries) {
        this.entries = entries;
    }

    public static @NonNull RealQueryParamCollection parse(final @Nullable String query) {
        final var result = new RealQueryParamCollection();
        if (query == null) {
            return result;
        }

        final var trimmed = Utils.trimStart(query, '?');
        if (trimmed.isEmpty()) {
            return result;
        }

        for (final var pair : trimmed.split("&", -1)) {
            final var nameAndValue = splitOnFirstOccurrence(pair, '=');
            final var value = (nameAndValue.length == 1) ? null : nameAndValue[1];
            result.entries.add(new Entry(nameAndValue[0], QueryParamValue.of(value, true)));
        }
        return result;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public @NonNull QueryParam get(final int index) {
        if (index < 0 || index >= entries.size()) {
            throw new IndexOutOfBoundsException("queryParam[" + index + "]");
        }
        return entries.get(index).toQueryParam();
    }

    @Override
    public @NonNull List<@NonNull String> names() {
        final var result = new LinkedHashSet<String>();
        for (final var entry : entries) {
            result.add(entry.name);
        }
        return List.copyOf(result);
    }

    @Override
    public @Nullable Object firstOrDefault(final @NonNull String name) {
        Objects.requireNonNull(name);
        for (final var entry : entries) {
            if (entry.name.equals(name)) {
                return entry.value.value();
            }
        }
        return null;
    }

    @Override
    public @NonNull List<@Nullable Object> getAll(final @NonNull String name) {
        Objects.requireNonNull(name);
        List<Object> result = null;
        for (final var entry : entries) {
            if (entry.name.equals(name)) {
                if (result == null) {
                    result = new ArrayList<>(2);
                }
                result.add(entry.value.value());
            }
        }
        // List.copyOf() rejects null elements.
        return (result != null) ? Collections.unmodifiableList(result) : List.of();
    }

    @Override
    public boolean contains(final @NonNull String name) {
        Objects.requireNonNull(name);
        for (final var entry : entries) {
            if (entry.name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean contains(final @NonNull String name, final @Nullable Object value) {
        Objects.requireNonNull(name);
        final var expected = (value != null) ? toInvariantString(value) : null;
        for (final var entry : entries) {
            if (!entry.name.equals(name)) {
                continue;
            }
            final var actual = entry.value.value();
            if (expected == null ? actual == null : actual != null && expected.equals(toInvariantString(actual))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void add(final @NonNull String name,
                    final @Nullable Object value,
                    final boolean isEncoded,
                    final @NonNull NullValueHandling nullValueHandling) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(nullValueHandling);

        if (value == null) {
            switch (nullValueHandling) {
                case REMOVE -> remove(name);
                case NAME_ONLY -> entries.add(new Entry(name, QueryParamValue.NULL));
                case IGNORE -> {
                }
            }
            return;
        }

        for (final var paramValue : split(value, isEncoded)) {
            entries.add(new Entry(name, paramValue));
        }
    }

    @Override
    public void addOrReplace(final @NonNull String name,
                             final @Nullable Object value,
                             final boolean isEncoded,
                             final @NonNull NullValueHandling nullValueHandling) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(nullValueHandling);

        if (value == null && nullValueHandling != NullValueHandling.NAME_ONLY) {
            if (nullValueHandling == NullValueHandling.REMOVE) {
                remove(name);
            }
            return;
        }

        final var values = split(value, isEncoded).iterator();

        // Existing slots of that name are overwritten in order, extra slots are dropped, extra values go at the end.
        final var result = new ArrayList<Entry>(entries.size() + 4);
        for (final var entry : entries) {
            if (!entry.name.equals(name)) {
                result.add(entry);
            } else if (values.hasNext()) {
                result.add(new Entry(name, values.next()));
            }
        }
        while (values.hasNext()) {
            result.add(new Entry(name, values.next()));
        }

        entries.clear();
        entries.addAll(result);
    }

    @Override
    public boolean remove(final @NonNull String name) {
        Objects.requireNonNull(name);
        return entries.removeIf(entry -> entry.name.equals(name));
    }

    @Override
    public void clear() {
        entries.clear();
    }

    /**
     * Replaces the entries of this collection with those of {@code other}, keeping this instance.
     */
    void replaceWith(final @NonNull RealQueryParamCollection other) {
        Objects.requireNonNull(other);
        final var copy = new ArrayList<>(other.entries);
        entries.clear();
        entries.addAll(copy);
    }

    @Override
    public @NonNull RealQueryParamCollection copy() {
        // entries are immutable, copying the list is enough.
        return new RealQueryParamCollection(new ArrayList<>(entries));
    }

    @Override
    public @NonNull Iterator<@NonNull QueryParam> iterator() {
        final var array = new QueryParam[entries.size()];
        Arrays.setAll(array, i -> entries.get(i).toQueryParam());
        return Arrays.stream(array).iterator();
    }

    @Override
    public @NonNull String toString() {
        return toString(false);
    }

    @Override
    public @NonNull String toString(final boolean encodeSpaceAsPlus) {
        final var sb = new StringBuilder();
        for (var i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sb.append('&');
            }
            final var entry = entries.get(i);
            sb.append(encodeIllegalCharacters(entry.name, encodeSpaceAsPlus));
            final var encodedValue = entry.value.encode(encodeSpaceAsPlus);
            if (encodedValue != null) {
                sb.append('=').append(encodedValue);
            }
        }
        return sb.toString();
    }

    /**
     * @return one value per element of {@code value} if it is an iterable, an array or a stream, flattening nested
     * ones, or {@code value} alone otherwise. A null element gives a bare name in its position.
     */
    private static @NonNull List<@NonNull QueryParamValue> split(final @Nullable Object value,
                                                                 final boolean isEncoded) {
        final var elements = new ArrayList<@Nullable Object>();
        flatten(value, elements);

        final var result = new ArrayList<QueryParamValue>(elements.size());
        for (final var element : elements) {
            result.add(QueryParamValue.of(element, isEncoded));
        }
        return result;
    }

    private static void flatten(final @Nullable Object value, final @NonNull List<@Nullable Object> out) {
        if (value instanceof Iterable<?> iterable) {
            for (final var element : iterable) {
                flatten(element, out);
            }
        } else if (value instanceof Stream<?> stream) {
            stream.forEachOrdered(element -> flatten(element, out));
        } else if (value != null && value.getClass().isArray()) {
            // Array.get() boxes the elements of primitive arrays.
            final var length = Array.getLength(value);
            for (var i = 0; i < length; i++) {
                flatten(Array.get(value, i), out);
            }
        } else {
            out.add(value);
        }
    }

    private record Entry(@NonNull String name, @NonNull QueryParamValue value) {
        private @NonNull QueryParam toQueryParam() {
            return new QueryParam(name, value.value());
        }
    }
}
