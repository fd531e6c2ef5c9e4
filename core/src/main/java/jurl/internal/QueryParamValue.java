/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl.internal;

import jurl.internal.url.UrlUtils;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import static jurl.internal.Utils.toInvariantString;
import static jurl.internal.url.UrlUtils.decode;

/**
 * The value of one query parameter. A value that came in already encoded keeps its encoded text, so it is written back
 * exactly as it was read.
 */
final class QueryParamValue {
    static final @NonNull QueryParamValue NULL = new QueryParamValue(null, null);

    private final @Nullable Object value;
    private final @Nullable String encodedValue;

    private QueryParamValue(final @Nullable Object value, final @Nullable String encodedValue) {
        this.value = value;
        this.encodedValue = encodedValue;
    }

    static @NonNull QueryParamValue of(final @Nullable Object value, final boolean isEncoded) {
        if (value == null) {
            return NULL;
        }
        if (isEncoded && value instanceof String encoded) {
            return new QueryParamValue(decode(encoded, true), encoded);
        }
        return new QueryParamValue(value, null);
    }

    /**
     * @return the decoded value, null for a bare name.
     */
    @Nullable
    Object value() {
        return value;
    }

    /**
     * @return the encoded text of this value, or null for a bare name.
     */
    @Nullable
    String encode(final boolean encodeSpaceAsPlus) {
        if (value == null) {
            return null;
        }
        if (encodedValue != null) {
            return encodeSpaceAsPlus ? encodedValue.replace("%20", "+") : encodedValue;
        }
        return UrlUtils.encode(toInvariantString(value), encodeSpaceAsPlus);
    }

    @Override
    public @NonNull String toString() {
        final var encoded = encode(false);
        return (encoded != null) ? encoded : "";
    }
}
