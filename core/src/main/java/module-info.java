/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

module jurl {
    requires okio;

    requires static org.jspecify;

    exports jurl;
}
