/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl.internal;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Date;

import static jurl.internal.Utils.*;
import static org.assertj.core.api.Assertions.assertThat;

public final class UtilsTest {
    @Test
    public void splitOnFirstOccurrenceSplitsOnce() {
        assertThat(splitOnFirstOccurrence("hello/how/are/you", '/')).containsExactly("hello", "how/are/you");
        assertThat(splitOnFirstOccurrence("hello", '/')).containsExactly("hello");
        assertThat(splitOnFirstOccurrence("/", '/')).containsExactly("", "");
    }

    @Test
    public void invariantStrings() {
        assertThat(toInvariantString("as is")).isEqualTo("as is");
        assertThat(toInvariantString(DayOfWeek.FRIDAY)).isEqualTo("FRIDAY");
        assertThat(toInvariantString(Date.from(Instant.parse("2017-12-01T02:34:56.789Z"))))
                .isEqualTo("2017-12-01T02:34:56.789Z");
        assertThat(toInvariantString(LocalDate.of(2017, 12, 1))).isEqualTo("2017-12-01");
        assertThat(toInvariantString(1.5d)).isEqualTo("1.5");
        assertThat(toInvariantString(42L)).isEqualTo("42");
    }

    @Test
    public void trims() {
        assertThat(trimStart("//a/", '/')).isEqualTo("a/");
        assertThat(trimEnd("//a//", '/')).isEqualTo("//a");
        assertThat(trimStart("///", '/')).isEmpty();
        assertThat(trimEnd("", '/')).isEmpty();
    }

    @Test
    public void asciiWhitespaceBounds() {
        final var s = " \t a b \n";
        final var start = indexOfFirstNonAsciiWhitespace(s);
        assertThat(start).isEqualTo(3);
        assertThat(indexOfLastNonAsciiWhitespace(s, start)).isEqualTo(6);
        assertThat(indexOfFirstNonAsciiWhitespace(" \r\n")).isEqualTo(3);
        assertThat(indexOfLastNonAsciiWhitespace(" \r\n", 3)).isEqualTo(3);
    }

    @Test
    public void hexDigits() {
        assertThat(parseHexDigit('0')).isEqualTo(0);
        assertThat(parseHexDigit('a')).isEqualTo(10);
        assertThat(parseHexDigit('F')).isEqualTo(15);
        assertThat(parseHexDigit('g')).isEqualTo(-1);
    }
}
