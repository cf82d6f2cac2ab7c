/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.httpclient;

import com.restdata.driver.ops.DataResponse;

import reactor.core.publisher.Mono;

/**
 * An open HTTP channel used by one client for all of its requests. An
 * implementation must be safe for concurrent use by any number of requests
 * in flight.
 * <p>
 * The driver builds the transport on first use, through the
 * {@link TransportFactory} of the client configuration or, if none is set,
 * as a {@link ReactorHttpClient}, and closes it when the client is closed.
 */
public interface HttpTransport {

    /**
     * Sends a request and reads the whole response. Nothing is sent until
     * the returned Mono is subscribed to; cancelling the subscription
     * aborts the exchange.
     * <p>
     * Any status, successful or not, is emitted as a {@link DataResponse}.
     * The Mono fails only when no response was received.
     *
     * @param request the request, fully assembled
     * @return a Mono of the response
     */
    Mono<DataResponse> send(OutgoingRequest request);

    /**
     * Releases the resources of the transport. Called once, when the
     * owning client is closed.
     */
    void close();
}
