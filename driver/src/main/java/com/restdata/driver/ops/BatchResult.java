/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.restdata.driver.DataClient;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.http.BatchResponseClient;

/**
 * The results of a committed batch, one {@link ExecutionResult} per
 * {@link CorrelationToken}. Iteration follows the order the requests were
 * added in, whatever order the service answered in.
 */
public class BatchResult implements Iterable<Map.Entry<CorrelationToken,
                                                       ExecutionResult>> {

    private final Map<CorrelationToken, ExecutionResult> results;
    private final List<Entry> entries;
    private final DataClientConfig config;

    /**
     * @hidden
     * @param entries the requests and results, in add order
     * @param config the configuration of the client that committed
     */
    public BatchResult(List<Entry> entries, DataClientConfig config) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        this.config = config;
        Map<CorrelationToken, ExecutionResult> map = new LinkedHashMap<>();
        for (Entry e : entries) {
            map.put(e.getToken(), e.getResult());
        }
        this.results = Collections.unmodifiableMap(map);
    }

    /**
     * @param token a token returned when the request was added
     * @return the result for the token
     * @throws IllegalArgumentException if the token is not part of this
     * batch
     */
    public ExecutionResult get(CorrelationToken token) {
        ExecutionResult result = results.get(token);
        if (result == null) {
            throw new IllegalArgumentException(
                "Token is not part of this batch: " + token);
        }
        return result;
    }

    /**
     * @return the results keyed by token, in add order
     */
    public Map<CorrelationToken, ExecutionResult> asMap() {
        return results;
    }

    /**
     * @return the results in add order
     */
    public List<ExecutionResult> getResults() {
        return new ArrayList<>(results.values());
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /**
     * @hidden
     * @return the requests and results, in add order
     */
    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * Returns a read-only client answering requests from the recorded
     * results, so code that reads a batch uses the same calls as code
     * that reads the live service. The client holds no transport.
     *
     * @return the client
     */
    public DataClient getResponseClient() {
        return new BatchResponseClient(this, config);
    }

    @Override
    public Iterator<Map.Entry<CorrelationToken, ExecutionResult>> iterator() {
        return results.entrySet().iterator();
    }

    @Override
    public String toString() {
        return "BatchResult" + results.values();
    }

    /**
     * @hidden
     * One request of the batch with its result. The uri is the resolved
     * one that was sent.
     */
    public static class Entry {
        private final CorrelationToken token;
        private final DataRequest request;
        private final String resolvedUri;
        private final ExecutionResult result;

        public Entry(CorrelationToken token,
                     DataRequest request,
                     String resolvedUri,
                     ExecutionResult result) {
            this.token = token;
            this.request = request;
            this.resolvedUri = resolvedUri;
            this.result = result;
        }

        public CorrelationToken getToken() {
            return token;
        }

        public DataRequest getRequest() {
            return request;
        }

        public String getResolvedUri() {
            return resolvedUri;
        }

        public ExecutionResult getResult() {
            return result;
        }
    }
}
