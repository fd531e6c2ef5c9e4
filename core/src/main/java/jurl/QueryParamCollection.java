/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl;

import jurl.internal.RealQueryParamCollection;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * The query of a {@link Url}, as an ordered list of name/value parameters. Insertion order is preserved and the same
 * name may appear several times, as in {@code x=1&y=2&x=3}.
 * <p>
 * Names are compared case-sensitively. Neither names nor values have to be non-empty: {@code =bar} has an empty name,
 * {@code foo=} has an empty value, and {@code abc} has a null value. All three are distinct from an absent parameter.
 * <p>
 * Values are exposed decoded. A value that was parsed from a query string, or added with {@code isEncoded = true},
 * remembers its original encoded text and is serialized with it, so parsing and serializing a query never changes it.
 * Any other value is fully encoded from its locale-independent string form when the query is serialized.
 * <p>
 * Instances of this class are mutable and not thread-safe.
 */
public sealed interface QueryParamCollection extends Iterable<QueryParamCollection.@NonNull QueryParam>
        permits RealQueryParamCollection {
    /**
     * @return a new empty query.
     */
    static @NonNull QueryParamCollection create() {
        return new RealQueryParamCollection();
    }

    /**
     * @return the parameters of {@code query}, an encoded query string with or without its leading {@code ?}. Each
     * {@code &}-separated piece is split on its first {@code =}; a piece without {@code =} gives a parameter with a
     * null value. A null or empty query gives an empty collection.
     */
    static @NonNull QueryParamCollection parse(final @Nullable String query) {
        return RealQueryParamCollection.parse(query);
    }

    /**
     * @return the number of parameters, counting every occurrence of a repeated name.
     */
    int size();

    boolean isEmpty();

    /**
     * @return the parameter at {@code index}.
     * @throws IndexOutOfBoundsException if {@code index} is out of range.
     */
    @NonNull
    QueryParam get(final int index);

    /**
     * @return an immutable list of the distinct parameter names, in the order they first appear.
     */
    @NonNull
    List<@NonNull String> names();

    /**
     * @return the decoded value of the first parameter named {@code name}, or null if there is none or if it has no
     * value.
     */
    @Nullable
    Object firstOrDefault(final @NonNull String name);

    /**
     * @return an immutable list of the decoded values of every parameter named {@code name}, in order. The list is
     * empty if there is none, and holds a null element for each parameter that has no value.
     */
    @NonNull
    List<@Nullable Object> getAll(final @NonNull String name);

    /**
     * @return true if at least one parameter is named {@code name}.
     */
    boolean contains(final @NonNull String name);

    /**
     * @return true if at least one parameter is named {@code name} and has a value whose string form equals the one of
     * {@code value}.
     */
    boolean contains(final @NonNull String name, final @Nullable Object value);

    /**
     * Appends {@code value} under {@code name}. The value is not encoded yet and null values remove every parameter of
     * that name.
     *
     * @see #add(String, Object, boolean, NullValueHandling)
     */
    default void add(final @NonNull String name, final @Nullable Object value) {
        add(name, value, false, NullValueHandling.REMOVE);
    }

    /**
     * @see #add(String, Object, boolean, NullValueHandling)
     */
    default void add(final @NonNull String name, final @Nullable Object value, final boolean isEncoded) {
        add(name, value, isEncoded, NullValueHandling.REMOVE);
    }

    /**
     * Appends {@code value} under {@code name}, after the existing parameters.
     * <p>
     * An iterable, an array or a stream is split into one parameter per element, all named {@code name}, in element
     * order. Nested collections are flattened and strings are never split. A null element gives a bare name in its
     * position, whatever {@code nullValueHandling} is.
     * <p>
     * A null {@code value} removes every parameter of that name with {@link NullValueHandling#REMOVE}, adds one bare
     * name with {@link NullValueHandling#NAME_ONLY} and does nothing with {@link NullValueHandling#IGNORE}.
     *
     * @param isEncoded true if string values are already percent-encoded and must be serialized as they are.
     * @throws NullPointerException if {@code name} or {@code nullValueHandling} is null.
     */
    void add(final @NonNull String name,
             final @Nullable Object value,
             final boolean isEncoded,
             final @NonNull NullValueHandling nullValueHandling);

    /**
     * Sets {@code value} under {@code name}, replacing the existing parameters of that name in place.
     *
     * @see #addOrReplace(String, Object, boolean, NullValueHandling)
     */
    default void addOrReplace(final @NonNull String name, final @Nullable Object value) {
        addOrReplace(name, value, false, NullValueHandling.REMOVE);
    }

    /**
     * @see #addOrReplace(String, Object, boolean, NullValueHandling)
     */
    default void addOrReplace(final @NonNull String name, final @Nullable Object value, final boolean isEncoded) {
        addOrReplace(name, value, isEncoded, NullValueHandling.REMOVE);
    }

    /**
     * Sets {@code value} under {@code name}. Collections are split as with {@link #add}.
     * <p>
     * The existing parameters of that name are overwritten one by one, in order, so they keep their position relative
     * to the other parameters. If there are fewer new values than existing parameters, the extra parameters are
     * removed. If there are more, the remaining values are appended at the end of the query. If the name is absent this
     * is the same as {@link #add}.
     * <p>
     * A null {@code value} is handled as with {@link #add}, except that {@link NullValueHandling#NAME_ONLY} turns the
     * existing parameters into a single bare name.
     *
     * @throws NullPointerException if {@code name} or {@code nullValueHandling} is null.
     */
    void addOrReplace(final @NonNull String name,
                      final @Nullable Object value,
                      final boolean isEncoded,
                      final @NonNull NullValueHandling nullValueHandling);

    /**
     * Removes every parameter named {@code name}.
     *
     * @return true if at least one parameter was removed.
     */
    boolean remove(final @NonNull String name);

    void clear();

    /**
     * @return a deep copy of this query. Changing one never changes the other.
     */
    @NonNull
    QueryParamCollection copy();

    /**
     * @return the encoded query string, without a leading {@code ?}. Spaces are encoded as {@code %20}.
     */
    @Override
    @NonNull
    String toString();

    /**
     * @return the encoded query string, without a leading {@code ?}. Parameters are joined with {@code &} in collection
     * order and a parameter with a null value is written as its bare name.
     * @param encodeSpaceAsPlus true to encode spaces as {@code +} instead of {@code %20}.
     */
    @NonNull
    String toString(final boolean encodeSpaceAsPlus);

    /**
     * One query parameter. {@code value} is the decoded value, or null for a bare name.
     */
    record QueryParam(@NonNull String name, @Nullable Object value) {
        public QueryParam {
            Objects.requireNonNull(name);
        }
    }
}
