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

package jurl.internal.url;

import okio.Buffer;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.regex.Pattern;

import static jurl.internal.Utils.parseHexDigit;

public final class UrlUtils {
    // un-instantiable
    private UrlUtils() {
    }

    private final static char[] HEX_DIGITS =
            new char[]{'0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'};

    /**
     * Characters with a structural meaning in a URI. {@link #encodeIllegalCharacters} leaves them as-is.
     */
    public final static String RESERVED_SET = ":/?#[]@!$&'()*+,;=";

    /**
     * Longest run of characters that is encoded in one piece. Longer inputs are split and each chunk is encoded on its
     * own.
     */
    public final static int MAX_CHUNK_LENGTH = 65_519;

    private final static Pattern PERCENT_ENCODED_TRIPLET = Pattern.compile("%[0-9A-Fa-f]{2}");

    /**
     * @return {@code s} with every character outside of the unreserved set ({@code ALPHA / DIGIT / "-" / "_" / "." /
     * "~"}) percent-encoded as UTF-8. Reserved characters such as {@code /}, {@code ?} or {@code &} are encoded too.
     * @param encodeSpaceAsPlus true to render spaces as {@code +} instead of {@code %20}.
     */
    public static @Nullable String encode(final @Nullable String s, final boolean encodeSpaceAsPlus) {
        if (s == null || s.isEmpty()) {
            return s;
        }

        final var encoded = encodeChunked(s, false);
        return encodeSpaceAsPlus ? encoded.replace("%20", "+") : encoded;
    }

    /**
     * @return {@code s} with only the characters that are illegal anywhere in a URI percent-encoded. Reserved
     * characters are left untouched and so are valid {@code %XX} triplets, so an already encoded string is never
     * encoded twice. A {@code %} that does not start a valid triplet is encoded as {@code %25}.
     * @param encodeSpaceAsPlus true to render spaces as {@code +} instead of {@code %20}.
     */
    public static @Nullable String encodeIllegalCharacters(final @Nullable String s, final boolean encodeSpaceAsPlus) {
        if (s == null || s.isEmpty()) {
            return s;
        }

        final var input = encodeSpaceAsPlus ? s.replace(' ', '+') : s;

        // Fast path: no '%' at all, there is no triplet to preserve.
        if (input.indexOf('%') == -1) {
            return encodeChunked(input, true);
        }

        // Slow path: encode the runs between valid triplets and copy the triplets as they are.
        final var out = new StringBuilder(input.length() + 16);
        final var matcher = PERCENT_ENCODED_TRIPLET.matcher(input);
        var pos = 0;
        while (matcher.find()) {
            out.append(encodeChunked(input.substring(pos, matcher.start()), true));
            out.append(matcher.group());
            pos = matcher.end();
        }
        out.append(encodeChunked(input.substring(pos), true));
        return out.toString();
    }

    /**
     * @return {@code s} percent-decoded as UTF-8. Invalid {@code %} sequences are kept as-is.
     * @param interpretPlusAsSpace true to turn every literal {@code +} into a space. This substitution happens before
     *                             percent-decoding, so an encoded plus ({@code %2B}) always decodes to {@code +}.
     */
    public static @Nullable String decode(final @Nullable String s, final boolean interpretPlusAsSpace) {
        if (s == null || s.isEmpty()) {
            return s;
        }

        final var encoded = interpretPlusAsSpace ? s.replace('+', ' ') : s;
        return percentDecode(encoded, 0, encoded.length());
    }

    public static @NonNull String percentDecode(
            final @NonNull String encoded,
            final int pos,
            final int limit
    ) {
        Objects.requireNonNull(encoded);
        for (var i = pos; i < limit; i++) {
            final var c = encoded.charAt(i);
            if (c == '%') {
                // Slow path: the character at i requires decoding!
                final var out = new Buffer();
                out.writeUtf8(encoded, pos, i);
                writePercentDecoded(out, encoded, i, limit);
                return out.readUtf8();
            }
        }

        // Fast path: no characters in [pos..limit) required decoding.
        return encoded.substring(pos, limit);
    }

    /**
     * Splits {@code input} into chunks of at most {@link #MAX_CHUNK_LENGTH} characters, never between the two halves
     * of a surrogate pair, and encodes each chunk on its own.
     */
    private static @NonNull String encodeChunked(final @NonNull String input, final boolean keepReserved) {
        final var length = input.length();
        if (length <= MAX_CHUNK_LENGTH) {
            return canonicalize(input, 0, length, keepReserved);
        }

        final var out = new StringBuilder(length + length / 4);
        var pos = 0;
        while (pos < length) {
            var end = Math.min(pos + MAX_CHUNK_LENGTH, length);
            if (end < length && Character.isHighSurrogate(input.charAt(end - 1))) {
                end--;
            }
            out.append(canonicalize(input, pos, end, keepReserved));
            pos = end;
        }
        return out.toString();
    }

    /**
     * @return a substring of {@code input} on the range {@code [pos..limit)} where every character that
     * {@link #mustEncode(int, boolean)} reports is percent-encoded as UTF-8, all other characters being copied without
     * transformation.
     */
    static @NonNull String canonicalize(
            final @NonNull String input,
            final int pos,
            final int limit,
            final boolean keepReserved
    ) {
        int codePoint;
        var i = pos;
        while (i < limit) {
            codePoint = input.codePointAt(i);
            if (mustEncode(codePoint, keepReserved)) {
                // Slow path: the character at i requires encoding!
                final var out = new Buffer();
                out.writeUtf8(input, pos, i);
                writeCanonicalized(out, input, i, limit, keepReserved);
                return out.readUtf8();
            }
            i += Character.charCount(codePoint);
        }

        // Fast path: no characters in [pos..limit) required encoding.
        return input.substring(pos, limit);
    }

    private static void writeCanonicalized(
            final @NonNull Buffer buffer,
            final @NonNull String input,
            final int pos,
            final int limit,
            final boolean keepReserved
    ) {
        Buffer encodedCharBuffer = null; // Lazily allocated.
        int codePoint;
        var i = pos;
        while (i < limit) {
            codePoint = input.codePointAt(i);
            if (mustEncode(codePoint, keepReserved)) {
                // Percent encode this character.
                if (encodedCharBuffer == null) {
                    encodedCharBuffer = new Buffer();
                }
                encodedCharBuffer.writeUtf8CodePoint(codePoint);

                while (!encodedCharBuffer.exhausted()) {
                    final var b = ((int) encodedCharBuffer.readByte()) & 0xff;
                    buffer.writeByte('%');
                    buffer.writeByte(HEX_DIGITS[b >> 4 & 0xf]);
                    buffer.writeByte(HEX_DIGITS[b & 0xf]);
                }
            } else {
                // This character doesn't need encoding. Just copy it over.
                buffer.writeUtf8CodePoint(codePoint);
            }
            i += Character.charCount(codePoint);
        }
    }

    private static void writePercentDecoded(
            final @NonNull Buffer buffer,
            final @NonNull String encoded,
            final int pos,
            final int limit
    ) {
        int codePoint;
        var i = pos;
        while (i < limit) {
            codePoint = encoded.codePointAt(i);
            if (codePoint == (int) '%' && i + 2 < limit) {
                final var d1 = parseHexDigit(encoded.charAt(i + 1));
                final var d2 = parseHexDigit(encoded.charAt(i + 2));
                if (d1 != -1 && d2 != -1) {
                    buffer.writeByte((d1 << 4) + d2);
                    i += 3;
                    continue;
                }
            }
            buffer.writeUtf8CodePoint(codePoint);
            i += Character.charCount(codePoint);
        }
    }

    /**
     * @return true if {@code codePoint} has to be percent-encoded. Control characters, DEL and non-ASCII code points
     * are always encoded, unreserved characters never are, and reserved characters are kept only if
     * {@code keepReserved} is true.
     */
    private static boolean mustEncode(final int codePoint, final boolean keepReserved) {
        if (codePoint < 0x20 || codePoint >= 0x7f) {
            return true;
        }
        if ((codePoint >= 'a' && codePoint <= 'z') || (codePoint >= 'A' && codePoint <= 'Z')
                || (codePoint >= '0' && codePoint <= '9')
                || codePoint == '-' || codePoint == '_' || codePoint == '.' || codePoint == '~') {
            return false;
        }
        return !keepReserved || RESERVED_SET.indexOf(codePoint) < 0;
    }
}
