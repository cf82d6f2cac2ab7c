/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import com.restdata.driver.BatchStateException;
import com.restdata.driver.ops.BatchResult;
import com.restdata.driver.ops.CorrelationToken;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.ops.ExecutionResult;
import com.restdata.driver.util.ConcurrentUtil;

/**
 * @hidden
 *
 * The requests of one batch, in the order they were added, each with its
 * token and the future of its response. A unit is open until it is
 * committed or abandoned; either happens once. Every future is completed
 * exactly once: with the results of the commit, with the failure of the
 * commit, or with {@link BatchStateException} if the unit is abandoned.
 */
public class BatchUnit {

    public enum State {
        OPEN,
        COMMITTED,
        ABANDONED
    }

    private static final AtomicLong nextId = new AtomicLong(1);

    private final long id = nextId.getAndIncrement();
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Entry> entries = new ArrayList<>();
    private volatile State state = State.OPEN;

    /**
     * Appends a request.
     *
     * @param request the request
     * @return its token
     * @throws BatchStateException if the unit is not open
     */
    CorrelationToken add(DataRequest request) {
        requireNonNull(request, "request must be non-null");
        return ConcurrentUtil.synchronizedCall(lock, () -> {
            checkOpen();
            CorrelationToken token = new CorrelationToken(id, entries.size());
            entries.add(new Entry(token, request));
            return token;
        });
    }

    /**
     * Closes the unit to further requests for commit.
     *
     * @return the requests, in add order
     * @throws BatchStateException if the unit is not open
     */
    List<Entry> seal() {
        return ConcurrentUtil.synchronizedCall(lock, () -> {
            checkOpen();
            state = State.COMMITTED;
            return new ArrayList<>(entries);
        });
    }

    /**
     * Abandons an open unit, failing the futures of its requests.
     *
     * @return true if the unit was open
     */
    boolean abandon() {
        List<Entry> abandoned = ConcurrentUtil.synchronizedCall(lock, () -> {
            if (state != State.OPEN) {
                return null;
            }
            state = State.ABANDONED;
            return new ArrayList<>(entries);
        });
        if (abandoned == null) {
            return false;
        }
        BatchStateException bse = new BatchStateException(
            "Batch was closed before it was committed");
        for (Entry e : abandoned) {
            e.future.completeExceptionally(bse);
        }
        return true;
    }

    /**
     * Completes the futures with the results of the commit.
     */
    void complete(BatchResult result) {
        for (BatchResult.Entry e : result.getEntries()) {
            ExecutionResult r = e.getResult();
            CompletableFuture<DataResponse> future =
                futureFor(e.getToken());
            if (r.isSuccess()) {
                future.complete(r.getResponse());
            } else {
                future.completeExceptionally(r.getFailure());
            }
        }
    }

    /**
     * Fails every future with the failure of the commit.
     */
    void fail(Throwable failure) {
        for (Entry e : getEntries()) {
            e.future.completeExceptionally(failure);
        }
    }

    /**
     * @param token a token of this unit
     * @return the future of the response to the request
     * @throws IllegalArgumentException if the token is not of this unit
     */
    CompletableFuture<DataResponse> futureFor(CorrelationToken token) {
        requireNonNull(token, "token must be non-null");
        return ConcurrentUtil.synchronizedCall(lock, () -> {
            if (token.getBatchId() != id ||
                token.getIndex() >= entries.size()) {
                throw new IllegalArgumentException(
                    "Token is not part of this batch: " + token);
            }
            return entries.get(token.getIndex()).future;
        });
    }

    public long getId() {
        return id;
    }

    public State getState() {
        return state;
    }

    public int size() {
        return ConcurrentUtil.synchronizedCall(lock, () -> entries.size());
    }

    List<Entry> getEntries() {
        return ConcurrentUtil.synchronizedCall(
            lock, () -> new ArrayList<>(entries));
    }

    private void checkOpen() {
        if (state == State.COMMITTED) {
            throw new BatchStateException("Batch is already committed");
        }
        if (state == State.ABANDONED) {
            throw new BatchStateException("Batch is closed");
        }
    }

    static class Entry {
        final CorrelationToken token;
        final DataRequest request;
        final CompletableFuture<DataResponse> future =
            new CompletableFuture<>();

        Entry(CorrelationToken token, DataRequest request) {
            this.token = token;
            this.request = request;
        }
    }
}
