/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import java.util.concurrent.CompletableFuture;

import com.restdata.driver.ops.BatchResult;
import com.restdata.driver.ops.CorrelationToken;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;

/**
 * A batch collects requests and sends them to the service in one
 * multipart exchange when it is committed. Reads are sent as individual
 * parts; consecutive writes are grouped into a changeset, which the service
 * applies atomically.
 * <p>
 * Adding a request does not touch the network. Each request receives
 * exactly one result when the batch is committed, in the order the
 * requests were added:
 * <pre>
 *    Batch batch = client.createBatch();
 *    CorrelationToken create = batch.add(createRequest);
 *    CorrelationToken read = batch.add(readRequest);
 *    BatchResult result = batch.commit().get();
 *    DataResponse created = result.get(create).getResponseOrThrow();
 * </pre>
 * A batch is also a {@link DataClient}: {@link #execute} adds the request
 * and returns a future that completes when the batch is committed. A
 * cancellation token given to execute has no effect, only the token given
 * to {@link #commit(CancellationToken)} cancels the exchange.
 * <p>
 * If the exchange as a whole fails, the commit and every request fail with
 * the same exception. If the service rejects individual requests, only
 * their results carry the failure. A batch may be committed once. Closing
 * a batch that was not committed abandons it; its requests fail with
 * {@link BatchStateException}. Closing a batch does not close the client
 * that created it.
 */
public interface Batch extends DataClient {

    /**
     * Adds a request to the batch.
     *
     * @param request the request
     *
     * @return the token identifying the request in the result
     *
     * @throws BatchStateException if the batch was committed or closed
     */
    CorrelationToken add(DataRequest request);

    /**
     * Returns a future completing with the response to a request of this
     * batch once it is committed. The future fails with the failure of the
     * request, if any.
     *
     * @param token the token returned by {@link #add}
     *
     * @return the future
     *
     * @throws IllegalArgumentException if the token is not part of this
     * batch
     */
    CompletableFuture<DataResponse> responseFor(CorrelationToken token);

    /**
     * Sends the batch.
     *
     * @return a future completing with the results of all requests
     *
     * @throws BatchStateException if the batch was already committed or
     * closed
     */
    CompletableFuture<BatchResult> commit();

    /**
     * Sends the batch, aborting the exchange if the token is cancelled.
     *
     * @param token the cancellation token
     *
     * @return a future completing with the results of all requests
     *
     * @throws BatchStateException if the batch was already committed or
     * closed
     */
    CompletableFuture<BatchResult> commit(CancellationToken token);

    /**
     * @return true once {@link #commit} was called
     */
    boolean isCommitted();
}
