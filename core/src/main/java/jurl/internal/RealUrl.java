/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 *
 * Forked from OkHttp (https://github.com/square/okhttp), original copyright is below
 *
 * Copyright (C) 2015 Square, Inc.
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

import jurl.KeyValuePairs;
import jurl.NullValueHandling;
import jurl.QueryParamCollection;
import jurl.Url;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.System.Logger.Level.TRACE;
import static jurl.internal.Utils.*;
import static jurl.internal.url.UrlUtils.encode;
import static jurl.internal.url.UrlUtils.encodeIllegalCharacters;

public final class RealUrl implements Url {
    private static final System.Logger LOGGER = System.getLogger("jurl.Url");

    private final @NonNull String originalString;

    private @NonNull String scheme = "";
    private @NonNull String userInfo = "";
    private @NonNull String host = "";
    private @Nullable Integer port = null;
    // "//" was read, the authority may still be empty.
    private boolean authorityMarker = false;
    private final @NonNull List<@NonNull String> pathSegments = new ArrayList<>();
    private boolean leadingSlash = false;
    private boolean trailingSlash = false;
    private final @NonNull RealQueryParamCollection queryParams;
    private @NonNull String fragment = "";

    public RealUrl(final @NonNull String url) {
        this.originalString = Objects.requireNonNull(url);
        this.queryParams = new RealQueryParamCollection();
        parse(url);
    }

    private RealUrl(final @NonNull RealUrl other) {
        this.originalString = other.originalString;
        this.scheme = other.scheme;
        this.userInfo = other.userInfo;
        this.host = other.host;
        this.port = other.port;
        this.authorityMarker = other.authorityMarker;
        this.pathSegments.addAll(other.pathSegments);
        this.leadingSlash = other.leadingSlash;
        this.trailingSlash = other.trailingSlash;
        this.queryParams = other.queryParams.copy();
        this.fragment = other.fragment;
    }

    /**
     * Splits {@code input} into the components of this URL. Nothing is validated: this accepts any string.
     */
    private void parse(final @NonNull String input) {
        scheme = "";
        userInfo = "";
        host = "";
        port = null;
        authorityMarker = false;
        pathSegments.clear();
        leadingSlash = false;
        trailingSlash = false;

        final var pos = indexOfFirstNonAsciiWhitespace(input);
        final var limit = indexOfLastNonAsciiWhitespace(input, pos);

        // Fragment, then query: both end at the first '#', whatever follows.
        final var fragmentOffset = delimiterOffset(input, '#', pos, limit);
        fragment = (fragmentOffset < limit) ? input.substring(fragmentOffset + 1, limit) : "";
        final var queryOffset = delimiterOffset(input, '?', pos, fragmentOffset);
        if (queryOffset < fragmentOffset) {
            queryParams.replaceWith(RealQueryParamCollection.parse(input.substring(queryOffset + 1, fragmentOffset)));
        } else {
            queryParams.clear();
        }

        // Scheme.
        var cursor = pos;
        final var schemeDelimiterOffset = schemeDelimiterOffset(input, pos, queryOffset);
        if (schemeDelimiterOffset != -1) {
            scheme = input.substring(pos, schemeDelimiterOffset);
            cursor = schemeDelimiterOffset + 1;
        }

        // Authority, only if introduced by "//".
        if (queryOffset - cursor >= 2 && input.startsWith("//", cursor)) {
            authorityMarker = true;
            final var authorityOffset = cursor + 2;
            cursor = delimiterOffset(input, '/', authorityOffset, queryOffset);
            parseAuthority(input, authorityOffset, cursor);
        }

        parsePath(input, cursor, queryOffset);

        if (scheme.isEmpty() && LOGGER.isLoggable(TRACE)) {
            if (authorityMarker) {
                LOGGER.log(TRACE, "Parsed protocol-relative URL: {0}", input);
            } else if (leadingSlash) {
                LOGGER.log(TRACE, "Parsed rooted relative URL: {0}", input);
            } else {
                LOGGER.log(TRACE, "Parsed relative URL: {0}", input);
            }
        }
    }

    /**
     * Reads {@code [userInfo@]host[:port]} on the range {@code [pos..limit)}.
     */
    private void parseAuthority(final @NonNull String input, final int pos, final int limit) {
        final var atOffset = input.lastIndexOf('@', limit - 1);
        var hostOffset = pos;
        if (atOffset >= pos) {
            userInfo = input.substring(pos, atOffset);
            hostOffset = atOffset + 1;
        }

        final var portColonOffset = portColonOffset(input, hostOffset, limit);
        if (portColonOffset != -1) {
            final var parsedPort = parsePort(input, portColonOffset + 1, limit);
            if (parsedPort != -1) {
                host = input.substring(hostOffset, portColonOffset);
                port = parsedPort;
                return;
            }
        }
        // No port, or something that is not a port: it stays part of the host.
        host = input.substring(hostOffset, limit);
    }

    /**
     * Reads the slashes and the segments of the path on the range {@code [pos..limit)}.
     */
    private void parsePath(final @NonNull String input, final int pos, final int limit) {
        var start = pos;
        var end = limit;
        if (start < end && input.charAt(start) == '/') {
            leadingSlash = true;
            start++;
        }
        if (start == end) {
            return;
        }
        if (input.charAt(end - 1) == '/') {
            trailingSlash = true;
            end--;
        }

        for (final var segment : input.substring(start, end).split("/", -1)) {
            pathSegments.add(Objects.requireNonNull(encodeIllegalCharacters(segment, false)));
        }
    }

    /**
     * @return the index of the ':' that follows the scheme of {@code input}, or -1 if {@code input} does not start with
     * a scheme.
     */
    private static int schemeDelimiterOffset(
            final @NonNull String input,
            final int pos,
            final int limit
    ) {
        if (limit - pos < 2) {
            return -1;
        }

        var c = input.charAt(pos);
        if ((c < 'a' || c > 'z') && (c < 'A' || c > 'Z')) {
            return -1; // Not a scheme start char.
        }

        for (var i = pos + 1; i < limit; i++) {
            c = input.charAt(i);
            // Scheme character. Keep going.
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
                    || c == '+' || c == '-' || c == '.') {
                continue;
            } else if (c == ':') { // Scheme prefix!
                return i;
            }
            return -1; // Non-scheme character before the first ':'.
        }

        return -1; // No ':'; doesn't start with a scheme.
    }

    /**
     * Finds the last ':' in {@code input}, skipping characters between square braces "[...]".
     *
     * @return its index, or -1 if there is none.
     */
    private static int portColonOffset(
            final @NonNull String input,
            final int pos,
            final int limit
    ) {
        var result = -1;
        var i = pos;
        while (i < limit) {
            switch (input.charAt(i)) {
                case '[' -> {
                    while (++i < limit) {
                        if (input.charAt(i) == ']') {
                            break;
                        }
                    }
                }
                case ':' -> result = i;
            }
            i++;
        }
        return result;
    }

    /**
     * @return the port written on the range {@code [pos..limit)}, or -1 if it is not made of 1 to 5 digits in
     * {@code [0..65535]}. A leading zero is refused so that the port is always written back as it was read.
     */
    private static int parsePort(
            final @NonNull String input,
            final int pos,
            final int limit
    ) {
        if (limit <= pos || limit - pos > 5 || (input.charAt(pos) == '0' && limit - pos > 1)) {
            return -1;
        }
        var result = 0;
        for (var i = pos; i < limit; i++) {
            final var c = input.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            result = result * 10 + (c - '0');
        }
        return (result <= 65535) ? result : -1;
    }

    @Override
    public @NonNull String getScheme() {
        return scheme;
    }

    @Override
    public @NonNull Url setScheme(final @Nullable String scheme) {
        this.scheme = (scheme != null) ? scheme : "";
        return this;
    }

    @Override
    public @NonNull String getUserInfo() {
        return userInfo;
    }

    @Override
    public @NonNull Url setUserInfo(final @Nullable String userInfo) {
        this.userInfo = (userInfo != null) ? userInfo : "";
        return this;
    }

    @Override
    public @NonNull String getHost() {
        return host;
    }

    @Override
    public @NonNull Url setHost(final @Nullable String host) {
        this.host = (host != null) ? host : "";
        return this;
    }

    @Override
    public @Nullable Integer getPort() {
        return port;
    }

    @Override
    public @NonNull Url setPort(final @Nullable Integer port) {
        if (port != null && (port < 0 || port > 65535)) {
            throw new IllegalArgumentException("unexpected port: " + port);
        }
        this.port = port;
        return this;
    }

    @Override
    public @NonNull String getAuthority() {
        final var result = new StringBuilder();
        if (!userInfo.isEmpty()) {
            result.append(userInfo).append('@');
        }
        result.append(host);
        if (port != null) {
            result.append(':').append(port);
        }
        return result.toString();
    }

    @Override
    public @NonNull String getRoot() {
        final var result = new StringBuilder(scheme);
        if (!scheme.isEmpty()) {
            result.append(':');
        }
        if (hasAuthority()) {
            result.append("//").append(getAuthority());
        }
        return result.toString();
    }

    @Override
    public @NonNull String getPath() {
        final var result = new StringBuilder();
        // An authority must be followed by a '/' before the first segment.
        if (leadingSlash || (!pathSegments.isEmpty() && hasAuthority())) {
            result.append('/');
        }
        result.append(String.join("/", pathSegments));
        if (trailingSlash && !pathSegments.isEmpty()) {
            result.append('/');
        }
        return result.toString();
    }

    private boolean hasAuthority() {
        return authorityMarker || !getAuthority().isEmpty();
    }

    @Override
    public @NonNull Url setPath(final @Nullable String path) {
        removePath();
        if (isNullOrEmpty(path)) {
            return this;
        }

        leadingSlash = path.startsWith("/");
        return appendPathSegment(path);
    }

    @Override
    public @NonNull List<@NonNull String> getPathSegments() {
        return Collections.unmodifiableList(pathSegments);
    }

    @Override
    public @NonNull String getQuery() {
        return queryParams.toString();
    }

    @Override
    public @NonNull Url setQuery(final @Nullable String query) {
        queryParams.replaceWith(RealQueryParamCollection.parse(query));
        return this;
    }

    @Override
    public @NonNull QueryParamCollection getQueryParams() {
        return queryParams;
    }

    @Override
    public @NonNull String getFragment() {
        return fragment;
    }

    @Override
    public @NonNull Url setFragment(final @Nullable String fragment) {
        this.fragment = (fragment != null) ? fragment : "";
        return this;
    }

    @Override
    public @NonNull Url removeFragment() {
        return setFragment("");
    }

    @Override
    public boolean isRelative() {
        return scheme.isEmpty();
    }

    @Override
    public boolean isSecureScheme() {
        return scheme.equalsIgnoreCase("https") || scheme.equalsIgnoreCase("wss");
    }

    @Override
    public @NonNull Url appendPathSegment(final @NonNull Object segment) {
        return appendPathSegment(segment, false);
    }

    @Override
    public @NonNull Url appendPathSegment(final @NonNull Object segment, final boolean fullyEncode) {
        Objects.requireNonNull(segment);

        final var raw = toInvariantString(segment);
        if (raw.isEmpty()) {
            // Nothing to append, the slashes stay as they are.
            return this;
        }
        if (fullyEncode) {
            pathSegments.add(Objects.requireNonNull(encode(raw, false)));
            trailingSlash = false;
            return this;
        }

        pathSegments.addAll(parsePathSegments(raw));
        trailingSlash = raw.endsWith("/");
        if (trailingSlash && pathSegments.isEmpty()) {
            // Only a '/' was appended to an empty path.
            leadingSlash = true;
        }
        return this;
    }

    @Override
    public @NonNull Url appendPathSegments(final @NonNull Object @NonNull ... segments) {
        Objects.requireNonNull(segments);
        for (final var segment : segments) {
            appendPathSegment(segment);
        }
        return this;
    }

    @Override
    public @NonNull Url appendPathSegments(final @NonNull Iterable<?> segments) {
        Objects.requireNonNull(segments);
        for (final var segment : segments) {
            appendPathSegment(segment);
        }
        return this;
    }

    @Override
    public @NonNull Url removePathSegment() {
        if (!pathSegments.isEmpty()) {
            pathSegments.remove(pathSegments.size() - 1);
        }
        return this;
    }

    @Override
    public @NonNull Url removePath() {
        pathSegments.clear();
        leadingSlash = false;
        trailingSlash = false;
        return this;
    }

    @Override
    public @NonNull Url setQueryParam(final @NonNull String name,
                                      final @Nullable Object value,
                                      final @NonNull NullValueHandling nullValueHandling) {
        queryParams.addOrReplace(name, value, false, nullValueHandling);
        return this;
    }

    @Override
    public @NonNull Url setQueryParam(final @NonNull String name,
                                      final @Nullable String value,
                                      final boolean isEncoded,
                                      final @NonNull NullValueHandling nullValueHandling) {
        queryParams.addOrReplace(name, value, isEncoded, nullValueHandling);
        return this;
    }

    @Override
    public @NonNull Url setQueryParam(final @NonNull String name) {
        queryParams.addOrReplace(name, null, false, NullValueHandling.NAME_ONLY);
        return this;
    }

    @Override
    public @NonNull Url setQueryParams(final @Nullable Object values,
                                       final @NonNull NullValueHandling nullValueHandling) {
        Objects.requireNonNull(nullValueHandling);
        if (values == null) {
            return this;
        }

        KeyValuePairs.of(values).forEachOrdered(pair ->
                queryParams.addOrReplace(pair.name(), pair.value(), false, nullValueHandling));
        return this;
    }

    @Override
    public @NonNull Url setQueryParamNames(final @Nullable String @NonNull ... names) {
        Objects.requireNonNull(names);
        return setQueryParamNames(Arrays.asList(names));
    }

    @Override
    public @NonNull Url setQueryParamNames(final @NonNull Iterable<@Nullable String> names) {
        Objects.requireNonNull(names);
        for (final var name : names) {
            if (name != null) {
                setQueryParam(name);
            }
        }
        return this;
    }

    @Override
    public @NonNull Url appendQueryParam(final @NonNull String name,
                                         final @Nullable Object value,
                                         final @NonNull NullValueHandling nullValueHandling) {
        queryParams.add(name, value, false, nullValueHandling);
        return this;
    }

    @Override
    public @NonNull Url appendQueryParam(final @NonNull String name,
                                         final @Nullable String value,
                                         final boolean isEncoded,
                                         final @NonNull NullValueHandling nullValueHandling) {
        queryParams.add(name, value, isEncoded, nullValueHandling);
        return this;
    }

    @Override
    public @NonNull Url appendQueryParam(final @NonNull String name) {
        queryParams.add(name, null, false, NullValueHandling.NAME_ONLY);
        return this;
    }

    @Override
    public @NonNull Url appendQueryParams(final @Nullable Object values,
                                          final @NonNull NullValueHandling nullValueHandling) {
        Objects.requireNonNull(nullValueHandling);
        if (values == null) {
            return this;
        }

        KeyValuePairs.of(values).forEachOrdered(pair ->
                queryParams.add(pair.name(), pair.value(), false, nullValueHandling));
        return this;
    }

    @Override
    public @NonNull Url removeQueryParam(final @NonNull String name) {
        queryParams.remove(name);
        return this;
    }

    @Override
    public @NonNull Url removeQueryParams(final @NonNull String @NonNull ... names) {
        Objects.requireNonNull(names);
        for (final var name : names) {
            queryParams.remove(name);
        }
        return this;
    }

    @Override
    public @NonNull Url removeQueryParams(final @NonNull Iterable<@NonNull String> names) {
        Objects.requireNonNull(names);
        for (final var name : names) {
            queryParams.remove(name);
        }
        return this;
    }

    @Override
    public @NonNull Url removeQuery() {
        queryParams.clear();
        return this;
    }

    @Override
    public @NonNull Url resetToRoot() {
        removePath();
        queryParams.clear();
        fragment = "";
        return this;
    }

    @Override
    public @NonNull Url reset() {
        parse(originalString);
        return this;
    }

    @Override
    public @NonNull Url copy() {
        return new RealUrl(this);
    }

    @Override
    public boolean isValid() {
        return isValid(toString());
    }

    @Override
    public @NonNull URI toUri() {
        final var url = toString();
        try {
            return new URI(url);
        } catch (URISyntaxException e) {
            // The fragment is written as it was set and may hold illegal characters. Encode them & retry.
            return URI.create(Objects.requireNonNull(encodeIllegalCharacters(url, false)));
        }
    }

    @Override
    public boolean equals(final @Nullable Object other) {
        if (!(other instanceof RealUrl that)) {
            return false;
        }

        return toString().equals(that.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public @NonNull String toString() {
        return toString(false);
    }

    @Override
    public @NonNull String toString(final boolean encodeSpaceAsPlus) {
        final var path = getPath();
        final var out = new StringBuilder(getRoot());
        out.append(encodeSpaceAsPlus ? path.replace("%20", "+") : path);
        if (!queryParams.isEmpty()) {
            out.append('?').append(queryParams.toString(encodeSpaceAsPlus));
        }
        if (!fragment.isEmpty()) {
            out.append('#').append(fragment);
        }
        return out.toString();
    }

    public static @NonNull String combine(final @Nullable String @NonNull ... parts) {
        Objects.requireNonNull(parts);

        var result = "";
        var inQuery = false;
        var inFragment = false;
        for (final var part : parts) {
            if (isNullOrEmpty(part)) {
                continue;
            }

            if (result.endsWith("?") || part.startsWith("?")) {
                result = combineEnsureSingleSeparator(result, part, '?');
            } else if (result.endsWith("#") || part.startsWith("#")) {
                result = combineEnsureSingleSeparator(result, part, '#');
            } else if (inFragment) {
                result += part;
            } else if (inQuery) {
                result = combineEnsureSingleSeparator(result, part, '&');
            } else {
                result = combineEnsureSingleSeparator(result, part, '/');
            }

            if (part.indexOf('#') != -1) {
                inQuery = false;
                inFragment = true;
            } else if (!inFragment && part.indexOf('?') != -1) {
                inQuery = true;
            }
        }
        return Objects.requireNonNull(encodeIllegalCharacters(result, false));
    }

    private static @NonNull String combineEnsureSingleSeparator(final @NonNull String a,
                                                                final @NonNull String b,
                                                                final char separator) {
        if (a.isEmpty()) {
            return b;
        }
        if (b.isEmpty()) {
            return a;
        }
        return trimEnd(a, separator) + separator + trimStart(b, separator);
    }

    public static @NonNull List<@NonNull String> parsePathSegments(final @NonNull String path) {
        final var encoded = Objects.requireNonNull(encodeIllegalCharacters(path, false))
                .replace("?", "%3F")
                .replace("#", "%23");

        final var tokens = encoded.split("/", -1);
        var from = 0;
        var to = tokens.length;
        if (tokens[0].isEmpty()) {
            from++;
        }
        if (to > from && tokens[to - 1].isEmpty()) {
            to--;
        }

        final var result = new ArrayList<String>(to - from);
        for (var i = from; i < to; i++) {
            result.add(tokens[i]);
        }
        return result;
    }

    public static boolean isValid(final @Nullable String url) {
        if (url == null) {
            return false;
        }

        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException _unused) {
            return false;
        }
        return uri.isAbsolute() && (uri.isOpaque() || uri.getRawAuthority() != null);
    }
}
