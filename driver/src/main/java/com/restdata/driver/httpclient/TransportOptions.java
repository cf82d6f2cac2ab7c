/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.httpclient;

import java.net.URL;
import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

import reactor.netty.http.client.HttpClient;

/**
 * The settings a {@link TransportFactory} builds a transport from.
 */
public class TransportOptions {

    private final URL serviceURL;
    private final Duration responseTimeout;
    private final ConnectionPoolConfig connectionPoolConfig;
    private final Logger logger;
    private final UnaryOperator<HttpClient> httpClientCustomizer;

    /**
     * @hidden
     *
     * @param serviceURL the service URL of the client
     * @param responseTimeout the timeout, or null for the transport default
     * @param connectionPoolConfig the pool settings
     * @param logger the client logger
     * @param httpClientCustomizer the customizer, or null
     */
    public TransportOptions(URL serviceURL,
                            Duration responseTimeout,
                            ConnectionPoolConfig connectionPoolConfig,
                            Logger logger,
                            UnaryOperator<HttpClient> httpClientCustomizer) {
        this.serviceURL = serviceURL;
        this.responseTimeout = responseTimeout;
        this.connectionPoolConfig = connectionPoolConfig;
        this.logger = logger;
        this.httpClientCustomizer = httpClientCustomizer;
    }

    public URL getServiceURL() {
        return serviceURL;
    }

    /**
     * @return the time to wait for a response, empty to use the default of
     * the transport
     */
    public Optional<Duration> getResponseTimeout() {
        return Optional.ofNullable(responseTimeout);
    }

    public ConnectionPoolConfig getConnectionPoolConfig() {
        return connectionPoolConfig;
    }

    public Logger getLogger() {
        return logger;
    }

    /**
     * @return the customizer of the default reactor-netty client, if any
     */
    public Optional<UnaryOperator<HttpClient>> getHttpClientCustomizer() {
        return Optional.ofNullable(httpClientCustomizer);
    }
}
