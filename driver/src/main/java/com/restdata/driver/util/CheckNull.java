/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.util;

import java.util.Objects;

/**
 * @hidden
 * Argument checks shared by the public API.
 */
public class CheckNull {

    public static <T> T requireNonNull(T value, String message) {
        return Objects.requireNonNull(value, message);
    }

    public static String requireNonEmpty(String value, String message) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
        return value;
    }
}
