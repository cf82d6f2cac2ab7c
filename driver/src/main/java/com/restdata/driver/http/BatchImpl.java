/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

import com.restdata.driver.Batch;
import com.restdata.driver.BatchStateException;
import com.restdata.driver.CancellationToken;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.MetadataCache;
import com.restdata.driver.ops.BatchResult;
import com.restdata.driver.ops.CorrelationToken;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.util.ConcurrentUtil;
import com.restdata.driver.util.LogUtil;

/**
 * A {@link Batch} of a {@link DataClientImpl}. It uses the transport,
 * executor and configuration of the client that created it. The
 * {@link BatchCoordinator} and the {@link BatchUnit} are created on first
 * use.
 */
public class BatchImpl implements Batch {

    private final DataClientImpl client;
    private final ReentrantLock lock = new ReentrantLock();

    /* created on first use, under the lock */
    private volatile BatchCoordinator coordinator;
    private volatile BatchUnit unit;
    private boolean closed;

    BatchImpl(DataClientImpl client) {
        this.client = requireNonNull(client, "client must be non-null");
    }

    /*
     * Returns the unit, opening it with a new coordinator on first use.
     */
    private BatchUnit unit() {
        BatchUnit current = unit;
        if (current != null) {
            return current;
        }
        return ConcurrentUtil.synchronizedCall(lock, () -> {
            if (closed) {
                throw new BatchStateException("Batch is closed");
            }
            if (unit == null) {
                coordinator = new BatchCoordinator(client.getConfig(),
                                                   client.getExecutor(),
                                                   client.getLogger());
                unit = coordinator.open();
            }
            return unit;
        });
    }

    @Override
    public CorrelationToken add(DataRequest request) {
        requireNonNull(request, "Batch: request must be non-null");
        client.checkClient();
        return coordinator().add(unit(), request);
    }

    /**
     * Adds the request. The future completes when the batch is committed.
     */
    @Override
    public CompletableFuture<DataResponse> execute(DataRequest request) {
        return responseFor(add(request));
    }

    /**
     * Adds the request. The token is not used: only the token given to
     * {@link #commit(CancellationToken)} cancels the exchange.
     */
    @Override
    public CompletableFuture<DataResponse> execute(DataRequest request,
                                                   CancellationToken token) {
        requireNonNull(token, "Batch: token must be non-null");
        return execute(request);
    }

    @Override
    public CompletableFuture<DataResponse> responseFor(
        CorrelationToken token) {

        return unit().futureFor(token);
    }

    @Override
    public CompletableFuture<BatchResult> commit() {
        return commit(CancellationToken.NONE);
    }

    @Override
    public CompletableFuture<BatchResult> commit(CancellationToken token) {
        requireNonNull(token, "Batch: token must be non-null");
        BatchUnit current = unit();
        return coordinator().commit(current, token).toFuture();
    }

    @Override
    public boolean isCommitted() {
        BatchUnit current = unit;
        return current != null &&
            current.getState() == BatchUnit.State.COMMITTED;
    }

    /**
     * Batches cannot be nested.
     *
     * @throws BatchStateException always
     */
    @Override
    public Batch createBatch() {
        throw new BatchStateException("Batches cannot be nested");
    }

    @Override
    public DataClientConfig getConfig() {
        return client.getConfig();
    }

    @Override
    public MetadataCache<?> getMetadataCache() {
        return client.getMetadataCache();
    }

    /**
     * Abandons the batch if it was not committed. The client that created
     * the batch stays open.
     */
    @Override
    public void close() {
        BatchUnit abandoned = ConcurrentUtil.synchronizedCall(lock, () -> {
            closed = true;
            return unit;
        });
        if (abandoned != null && abandoned.abandon()) {
            LogUtil.logFine(client.getLogger(), "Batch " +
                            abandoned.getId() + " closed before commit");
        }
    }

    private BatchCoordinator coordinator() {
        unit();
        return coordinator;
    }
}
