/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

import com.restdata.driver.Batch;
import com.restdata.driver.BatchStateException;
import com.restdata.driver.CancellationToken;
import com.restdata.driver.DataClient;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.MetadataCache;
import com.restdata.driver.ops.BatchResult;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.ops.ExecutionResult;
import com.restdata.driver.util.ConcurrentUtil;

/**
 * A read-only {@link DataClient} over a committed batch. It holds no
 * transport and sends nothing: {@link #execute} answers with the recorded
 * result of the next request of the batch with the same verb and URI.
 * This lets code reading the results of a batch use the same calls as code
 * reading the live service.
 */
public class BatchResponseClient implements DataClient {

    private final List<BatchResult.Entry> entries;
    private final DataClientConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final boolean[] consumed;

    /**
     * @hidden
     * @param result the committed batch
     * @param config the configuration of the client that committed it, may
     * be null
     */
    public BatchResponseClient(BatchResult result, DataClientConfig config) {
        requireNonNull(result, "result must be non-null");
        this.entries = result.getEntries();
        this.config = config;
        this.consumed = new boolean[entries.size()];
    }

    @Override
    public CompletableFuture<DataResponse> execute(DataRequest request) {
        requireNonNull(request, "BatchResponseClient: request must be " +
                       "non-null");
        final String uri = (config == null ? request.getUri() :
            RequestExecutor.resolveUri(config.getServiceURL(),
                                       request.getUri()));
        ExecutionResult result = ConcurrentUtil.synchronizedCall(lock, () -> {
            for (int i = 0; i < entries.size(); i++) {
                BatchResult.Entry e = entries.get(i);
                if (consumed[i] ||
                    e.getRequest().getVerb() != request.getVerb()) {
                    continue;
                }
                if (uri.equals(e.getResolvedUri()) ||
                    request.getUri().equals(e.getRequest().getUri())) {
                    consumed[i] = true;
                    return e.getResult();
                }
            }
            return null;
        });
        if (result == null) {
            CompletableFuture<DataResponse> failed = new CompletableFuture<>();
            failed.completeExceptionally(new BatchStateException(
                "No response recorded in the batch for " + request));
            return failed;
        }
        if (result.isSuccess()) {
            return CompletableFuture.completedFuture(result.getResponse());
        }
        CompletableFuture<DataResponse> failed = new CompletableFuture<>();
        failed.completeExceptionally(result.getFailure());
        return failed;
    }

    /**
     * The token is not used, the result is already available.
     */
    @Override
    public CompletableFuture<DataResponse> execute(DataRequest request,
                                                   CancellationToken token) {
        return execute(request);
    }

    /**
     * @throws BatchStateException always, a batch response is read-only
     */
    @Override
    public Batch createBatch() {
        throw new BatchStateException("A batch response is read-only");
    }

    /**
     * @return the configuration of the client that committed the batch, or
     * null
     */
    @Override
    public DataClientConfig getConfig() {
        return config;
    }

    @Override
    public MetadataCache<?> getMetadataCache() {
        return (config == null ? null : config.getMetadataCache());
    }

    /**
     * Nothing to release.
     */
    @Override
    public void close() {
    }
}
