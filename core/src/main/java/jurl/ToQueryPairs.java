/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl;

import org.jspecify.annotations.NonNull;

import java.util.stream.Stream;

/**
 * A type that knows how to turn itself into query parameters. {@link KeyValuePairs#of(Object)}, and so
 * {@link Url#setQueryParams(Object)}, use it instead of reading the properties of the object.
 * <pre>
 * {@code
 * record Page(int number, int size) implements ToQueryPairs {
 *     public Stream<QueryParam> toQueryPairs() {
 *         return Stream.of(new QueryParam("page", number), new QueryParam("per_page", size));
 *     }
 * }
 * }
 * </pre>
 */
@FunctionalInterface
public interface ToQueryPairs {
    /**
     * @return the name/value pairs of this object, in order. Values are not encoded yet.
     */
    @NonNull
    Stream<QueryParamCollection.@NonNull QueryParam> toQueryPairs();
}
