/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import java.util.concurrent.CompletableFuture;

import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;

/**
 * DataClient is the interface used to access a REST data service. It
 * executes {@link DataRequest}s built by the application, or by a query
 * layer on its behalf, and completes with the {@link DataResponse} of the
 * service.
 * <p>
 * Instances are created with {@link DataClientFactory#createClient}. A
 * client opens its HTTP transport when it executes its first request and
 * uses that transport for every request until it is closed. The client is
 * thread-safe; requests may be executed concurrently and no order is
 * guaranteed between them.
 * <p>
 * Execution is asynchronous: the returned future completes when the
 * response arrives, no thread waits for it in the meantime. A future that
 * fails does so with one of the subclasses of {@link DataServiceException}:
 * <ul>
 * <li>{@link UnsuccessfulResponseException} if the service answered with a
 * status outside of the 2xx range</li>
 * <li>{@link TransportException}, or {@link RequestTimeoutException}, if no
 * response was received</li>
 * <li>{@link RequestCancelledException} if the request was cancelled</li>
 * <li>{@link ClientClosedException} if the client was closed</li>
 * </ul>
 * The driver does not retry requests.
 * <p>
 * Several requests can be sent in one exchange with a {@link Batch}, created
 * by {@link #createBatch}.
 */
public interface DataClient extends AutoCloseable {

    /**
     * Executes a request.
     *
     * @param request the request
     *
     * @return a future completing with the response
     *
     * @throws NullPointerException if the request is null
     */
    CompletableFuture<DataResponse> execute(DataRequest request);

    /**
     * Executes a request that can be cancelled. Cancelling the token aborts
     * the exchange and fails the future with
     * {@link RequestCancelledException}.
     *
     * @param request the request
     * @param token the cancellation token
     *
     * @return a future completing with the response
     *
     * @throws NullPointerException if the request or token is null
     */
    CompletableFuture<DataResponse> execute(DataRequest request,
                                            CancellationToken token);

    /**
     * Opens a batch using this client's transport and configuration.
     *
     * @return a new batch
     *
     * @throws ClientClosedException if the client is closed
     * @throws BatchStateException if this client is itself a batch or a
     * batch response
     */
    Batch createBatch();

    /**
     * @return the configuration of the client, a copy of the one it was
     * created with
     */
    DataClientConfig getConfig();

    /**
     * @return the metadata cache of the client
     */
    MetadataCache<?> getMetadataCache();

    /**
     * Closes the client and its transport. Requests executed afterwards
     * fail with {@link ClientClosedException}. Calling close more than
     * once has no further effect.
     */
    @Override
    void close();
}
