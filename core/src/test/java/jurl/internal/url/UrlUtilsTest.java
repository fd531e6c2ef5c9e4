/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl.internal.url;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static jurl.internal.url.UrlUtils.*;
import static org.assertj.core.api.Assertions.assertThat;

public final class UrlUtilsTest {
    @Test
    public void nullAndEmptyPassThrough() {
        assertThat(encode(null, false)).isNull();
        assertThat(encode("", true)).isEmpty();
        assertThat(encodeIllegalCharacters(null, false)).isNull();
        assertThat(encodeIllegalCharacters("", true)).isEmpty();
        assertThat(decode(null, true)).isNull();
        assertThat(decode("", false)).isEmpty();
    }

    @Test
    public void encodeUsesUtf8() {
        assertThat(encode("é", false)).isEqualTo("%C3%A9");
        assertThat(encode("😀", false)).isEqualTo("%F0%9F%98%80");
        assertThat(encode("\u0000\u007F", false)).isEqualTo("%00%7F");
    }

    @Test
    public void encodeKeepsUnreservedCharacters() {
        assertThat(encode("AZaz09-_.~", false)).isEqualTo("AZaz09-_.~");
        assertThat(encode(":/?#[]@!$&'()*+,;=", false))
                .isEqualTo("%3A%2F%3F%23%5B%5D%40%21%24%26%27%28%29%2A%2B%2C%3B%3D");
    }

    @Test
    public void encodeIllegalCharactersKeepsReservedCharacters() {
        assertThat(encodeIllegalCharacters(RESERVED_SET, false)).isEqualTo(RESERVED_SET);
        assertThat(encodeIllegalCharacters("a\"<>\\^`{|}", false)).isEqualTo("a%22%3C%3E%5C%5E%60%7B%7C%7D");
    }

    @Test
    public void encodeIllegalCharactersWithAndWithoutTriplets() {
        // no '%' goes through the fast path, the '%' forces the slow one, both encode the same way.
        final var plain = "a b/é?c";
        assertThat(encodeIllegalCharacters(plain, false)).isEqualTo("a%20b/%C3%A9?c");
        assertThat(encodeIllegalCharacters(plain + "%41", false)).isEqualTo("a%20b/%C3%A9?c%41");
        assertThat(encodeIllegalCharacters("%", false)).isEqualTo("%25");
        assertThat(encodeIllegalCharacters("%4", false)).isEqualTo("%254");
    }

    @Test
    public void surrogatePairIsNeverSplitAcrossChunks() {
        final var prefix = "a".repeat(MAX_CHUNK_LENGTH - 1);
        assertThat(encode(prefix + "😀", false)).isEqualTo(prefix + "%F0%9F%98%80");
        assertThat(encodeIllegalCharacters(prefix + "😀", false)).isEqualTo(prefix + "%F0%9F%98%80");
    }

    @ParameterizedTest
    @CsvSource({
            "%41,A",
            "%4a%4A,JJ",
            "%zz,%zz",
            "%4,%4",
            "100%,100%",
            "%C3%A9,é",
            "a%2,a%2"
    })
    public void percentDecoding(String encoded, String decoded) {
        assertThat(percentDecode(encoded, 0, encoded.length())).isEqualTo(decoded);
        assertThat(decode(encoded, false)).isEqualTo(decoded);
    }

    @Test
    public void decodePlus() {
        assertThat(decode("a+b%2Bc", true)).isEqualTo("a b+c");
        assertThat(decode("a+b%2Bc", false)).isEqualTo("a+b+c");
    }

    @Test
    public void percentDecodeRange() {
        assertThat(percentDecode("xx%41yy", 2, 5)).isEqualTo("A");
        assertThat(percentDecode("xxabyy", 2, 4)).isEqualTo("ab");
    }
}
