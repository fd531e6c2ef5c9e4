/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl;

import jurl.QueryParamCollection.QueryParam;
import org.junit.jupiter.api.Test;

import java.util.AbstractMap.SimpleEntry;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class KeyValuePairsTest {
    @Test
    public void recordComponentsInDeclarationOrder() {
        record Search(String q, int page, String sort) {
        }

        assertThat(KeyValuePairs.of(new Search("jurl", 2, null)).toList()).containsExactly(
                new QueryParam("q", "jurl"),
                new QueryParam("page", 2),
                new QueryParam("sort", null));
    }

    @Test
    public void publicGettersAndFieldsOrderedByName() {
        assertThat(KeyValuePairs.of(new Bean()).toList()).containsExactly(
                new QueryParam("active", true),
                new QueryParam("read1", "a"),
                new QueryParam("read2", "b"),
                new QueryParam("visible", 3));
    }

    @Test
    public void mapEntriesInIterationOrder() {
        final var map = new LinkedHashMap<Object, Object>();
        map.put("z", 1);
        map.put(null, "skipped");
        map.put(Kind.SOME_KIND, null);
        assertThat(KeyValuePairs.of(map).toList()).containsExactly(
                new QueryParam("z", 1),
                new QueryParam("SOME_KIND", null));
    }

    @Test
    public void mapEntriesInAList() {
        final var entries = Arrays.asList(
                new SimpleEntry<>("a", 1),
                null,
                new SimpleEntry<String, Integer>(null, 2),
                new SimpleEntry<>("a", 3));
        assertThat(KeyValuePairs.of(entries).toList()).containsExactly(
                new QueryParam("a", 1),
                new QueryParam("a", 3));
    }

    @Test
    public void conventionalKeyValueObjects() {
        final var elements = new Object[]{
                new KeyValue("k1", "v1"),
                new NameValue("n1", "v2"),
                new GetterPair("g1", 3),
                new FieldPair("f1", "v4"),
                new KeyValue(null, "skipped"),
                new QueryParam("p1", null)};
        assertThat(KeyValuePairs.of(elements).toList()).containsExactly(
                new QueryParam("k1", "v1"),
                new QueryParam("n1", "v2"),
                new QueryParam("g1", 3),
                new QueryParam("f1", "v4"),
                new QueryParam("p1", null));
    }

    @Test
    public void keysUseTheirInvariantStringForm() {
        assertThat(KeyValuePairs.of(List.of(new KeyValue(Kind.SOME_KIND, 1), new KeyValue(2.5, 2))).toList())
                .containsExactly(new QueryParam("SOME_KIND", 1), new QueryParam("2.5", 2));
    }

    @Test
    public void streamOfPairs() {
        assertThat(KeyValuePairs.of(Stream.of(new SimpleEntry<>("s", 1))).toList())
                .containsExactly(new QueryParam("s", 1));
    }

    @Test
    public void queryString() {
        assertThat(KeyValuePairs.of("one=1&two=foo%20bar&three").toList()).containsExactly(
                new QueryParam("one", "1"),
                new QueryParam("two", "foo bar"),
                new QueryParam("three", null));
    }

    @Test
    public void toQueryPairs() {
        final ToQueryPairs custom = () -> Stream.of(new QueryParam("x", 1), new QueryParam("x", 2));
        assertThat(KeyValuePairs.of(custom).toList())
                .containsExactly(new QueryParam("x", 1), new QueryParam("x", 2));
    }

    @Test
    public void nullThrows() {
        assertThatThrownBy(() -> KeyValuePairs.of(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void unreadableElementFailsWhenReached() {
        final var pairs = KeyValuePairs.of(List.of(new SimpleEntry<>("a", 1), new Object()));
        assertThatThrownBy(pairs::toList)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("java.lang.Object");
    }

    @Test
    public void throwingGetterFailsWhenRead() {
        final var pairs = KeyValuePairs.of(new Throwing());
        assertThatThrownBy(pairs::toList)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("boom")
                .hasRootCauseInstanceOf(UnsupportedOperationException.class);
    }

    private enum Kind {
        SOME_KIND
    }

    private record KeyValue(Object key, Object value) {
    }

    private record NameValue(String Name, String Value) {
    }

    public static final class GetterPair {
        private final String key;
        private final int value;

        GetterPair(String key, int value) {
            this.key = key;
            this.value = value;
        }

        public String getKey() {
            return key;
        }

        public int getValue() {
            return value;
        }
    }

    public static final class FieldPair {
        public final String name;
        public final String value;

        FieldPair(String name, String value) {
            this.name = name;
            this.value = value;
        }
    }

    public static final class Bean {
        public static final String IGNORED = "static";

        public final int visible = 3;
        private final String read1 = "a";
        private final String read2 = "b";
        private final String hidden = "c";

        public String getRead1() {
            return read1;
        }

        public String getRead2() {
            return read2;
        }

        public boolean isActive() {
            return true;
        }

        String getPackagePrivate() {
            return hidden;
        }
    }

    public static final class Throwing {
        public String getBoom() {
            throw new UnsupportedOperationException();
        }
    }
}
