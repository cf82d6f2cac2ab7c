/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.httpclient;

/**
 * Creates the {@link HttpTransport} of a client. Set a factory with
 * {@link com.restdata.driver.DataClientConfig#setTransportFactory} to
 * replace the default transport.
 */
@FunctionalInterface
public interface TransportFactory {

    /**
     * Creates a transport. The driver calls this at most once per client,
     * when the client sends its first request.
     *
     * @param options the settings of the client
     * @return the transport
     */
    HttpTransport create(TransportOptions options);
}
