/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import com.restdata.driver.ops.DataRequest;

/**
 * A callback interface used by the driver to obtain an authorization string
 * for a request. The string is sent in the Authorization header. A provider
 * may be set on the {@link DataClientConfig}, applying to every request of
 * the client, or on a single {@link DataRequest}.
 * <p>
 * Instances of this interface must be reentrant and thread-safe.
 */
public interface AuthorizationProvider {

    /**
     * Returns an authorization string for specified request. Authorization
     * information can be request-dependent.
     *
     * @param request the request being processed
     *
     * @return the value of the Authorization header, or null to send none
     */
    public String getAuthorizationString(DataRequest request);

    /**
     * Release resources provider is using. The default does nothing.
     */
    public default void close() {
    }
}
