/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 *
 * Forked from OkHttp (https://github.com/square/okhttp), original copyright is below
 *
 * Copyright (C) 2013 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package jurl.internal;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Objects;

public final class Utils {
    // un-instantiable
    private Utils() {
    }

    /**
     * @return the index of the first {@code delimiter} in {@code string} on the range {@code [startIndex..endIndex)},
     * or endIndex if there is none.
     */
    static int delimiterOffset(final @NonNull String string,
                               final char delimiter,
                               final int startIndex,
                               final int endIndex) {
        assert string != null;

        for (var i = startIndex; i < endIndex; i++) {
            if (string.charAt(i) == delimiter) {
                return i;
            }
        }
        return endIndex;
    }

    public static int parseHexDigit(final char character) {
        if (character >= '0' && character <= '9') {
            return character - '0';
        }
        if (character >= 'a' && character <= 'f') {
            return character - 'a' + 10;
        }
        if (character >= 'A' && character <= 'F') {
            return character - 'A' + 10;
        }
        return -1;
    }

    /**
     * @return the index of the first character of {@code string} that is not ASCII whitespace, or its length.
     */
    static int indexOfFirstNonAsciiWhitespace(final @NonNull String string) {
        assert string != null;

        for (var i = 0; i < string.length(); i++) {
            if (!isAsciiWhitespace(string.charAt(i))) {
                return i;
            }
        }
        return string.length();
    }

    /**
     * @return the index right after the last character of {@code string} that is not ASCII whitespace, never less
     * than {@code startIndex}.
     */
    static int indexOfLastNonAsciiWhitespace(final @NonNull String string, final int startIndex) {
        assert string != null;

        for (var i = string.length() - 1; i >= startIndex; i--) {
            if (!isAsciiWhitespace(string.charAt(i))) {
                return i + 1;
            }
        }
        return startIndex;
    }

    private static boolean isAsciiWhitespace(final char c) {
        return c == '\t' || c == '\n' || c == '\u000C' || c == '\r' || c == ' ';
    }

    /**
     * Splits {@code string} at the first occurrence of {@code separator}.
     *
     * @return an array of two strings, before and after the separator, or an array holding only {@code string} if the
     * separator is absent.
     */
    public static @NonNull String @NonNull [] splitOnFirstOccurrence(final @NonNull String string,
                                                                     final char separator) {
        Objects.requireNonNull(string);

        final var i = string.indexOf(separator);
        if (i == -1) {
            return new String[]{string};
        }
        return new String[]{string.substring(0, i), string.substring(i + 1)};
    }

    /**
     * @return {@code string} without any leading {@code c}.
     */
    static @NonNull String trimStart(final @NonNull String string, final char c) {
        var start = 0;
        while (start < string.length() && string.charAt(start) == c) {
            start++;
        }
        return string.substring(start);
    }

    /**
     * @return {@code string} without any trailing {@code c}.
     */
    static @NonNull String trimEnd(final @NonNull String string, final char c) {
        var end = string.length();
        while (end > 0 && string.charAt(end - 1) == c) {
            end--;
        }
        return string.substring(0, end);
    }

    /**
     * @return a locale-independent text form of {@code value}: ISO-8601 for {@link Date}, the constant name for enums
     * and {@link String#valueOf(Object)} for everything else, {@code java.time} values and numbers included.
     */
    public static @NonNull String toInvariantString(final @NonNull Object value) {
        Objects.requireNonNull(value);

        if (value instanceof String string) {
            return string;
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        if (value instanceof Date date) {
            return DateTimeFormatter.ISO_INSTANT.format(date.toInstant());
        }
        return String.valueOf(value);
    }

    static boolean isNullOrEmpty(final @Nullable String string) {
        return string == null || string.isEmpty();
    }
}
