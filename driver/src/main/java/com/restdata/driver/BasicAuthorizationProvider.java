/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import static com.restdata.driver.util.CheckNull.requireNonEmpty;
import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.restdata.driver.ops.DataRequest;

/**
 * An {@link AuthorizationProvider} for HTTP basic authentication. The
 * credentials are encoded once, when the provider is created, and the same
 * string is sent with every request.
 */
public class BasicAuthorizationProvider implements AuthorizationProvider {

    private static final String BASIC_PREFIX = "Basic ";

    private final String userName;
    private final String authString;

    /**
     * Creates a provider for the given user.
     *
     * @param userName the user name
     * @param password the password, not retained
     */
    public BasicAuthorizationProvider(String userName, char[] password) {
        requireNonEmpty(userName, "userName must be non-empty");
        requireNonNull(password, "password must be non-null");

        /*
         * Convert the user:password pair in base 64 format with
         * Basic prefix
         */
        final String encoded = Base64.getEncoder().encodeToString(
            (userName + ":" + String.valueOf(password))
            .getBytes(StandardCharsets.UTF_8));
        this.userName = userName;
        this.authString = BASIC_PREFIX + encoded;
    }

    @Override
    public String getAuthorizationString(DataRequest request) {
        return authString;
    }

    public String getUserName() {
        return userName;
    }
}
