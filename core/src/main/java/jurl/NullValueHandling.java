/*
 * Copyright (c) 2024-present, pull-vert and Jayo contributors.
 * Use of this source code is governed by the Apache 2.0 license.
 */

package jurl;

/**
 * What to do when a query parameter is set or appended with a null value.
 */
public enum NullValueHandling {
    /**
     * Keep the parameter as a bare name, serialized as {@code name} with no {@code =}.
     */
    NAME_ONLY,

    /**
     * Remove every parameter of that name. This is the default.
     */
    REMOVE,

    /**
     * Leave the existing parameters of that name as they are.
     */
    IGNORE
}
