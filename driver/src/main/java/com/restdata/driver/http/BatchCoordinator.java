/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static com.restdata.driver.util.CheckNull.requireNonNull;
import static com.restdata.driver.util.HttpConstants.BATCH_PATH;
import static com.restdata.driver.util.HttpConstants.CONTENT_TYPE;
import static com.restdata.driver.util.HttpConstants.MULTIPART_MIXED;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import com.restdata.driver.BatchResponseFormatException;
import com.restdata.driver.BatchStateException;
import com.restdata.driver.CancellationToken;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.DataServiceException;
import com.restdata.driver.RequestCancelledException;
import com.restdata.driver.UnsuccessfulResponseException;
import com.restdata.driver.ops.BatchResult;
import com.restdata.driver.ops.CorrelationToken;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.ops.ExecutionResult;
import com.restdata.driver.ops.RestVerb;
import com.restdata.driver.ops.serde.BatchRequestWriter;
import com.restdata.driver.ops.serde.BatchRequestWriter.Group;
import com.restdata.driver.ops.serde.BatchRequestWriter.Operation;
import com.restdata.driver.ops.serde.BatchRequestWriter.Payload;
import com.restdata.driver.ops.serde.BatchResponseReader;
import com.restdata.driver.ops.serde.BatchResponseReader.Part;
import com.restdata.driver.util.LogUtil;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import reactor.core.publisher.Mono;

/**
 * @hidden
 *
 * Sends the requests of a {@link BatchUnit} in one multipart exchange and
 * maps the parts of the reply back to the requests.
 * <p>
 * The exchange is a POST to "$batch" under the service URL, executed by
 * the client's {@link RequestExecutor}, so it goes through the same hooks,
 * transport and classification as any request. If it fails, the commit
 * and every request of the unit fail with the same exception. Otherwise
 * each request gets its own {@link ExecutionResult}. Parts of the reply
 * are matched to requests by Content-ID, and by position only where the
 * reply carries none. A changeset the service rejected as a whole gives
 * all of its operations the same failure.
 */
public class BatchCoordinator {

    private final DataClientConfig config;
    private final RequestExecutor executor;
    private final Logger logger;

    public BatchCoordinator(DataClientConfig config,
                            RequestExecutor executor,
                            Logger logger) {
        this.config = requireNonNull(config, "config must be non-null");
        this.executor = requireNonNull(executor, "executor must be non-null");
        this.logger = requireNonNull(logger, "logger must be non-null");
    }

    public BatchUnit open() {
        return new BatchUnit();
    }

    /**
     * Adds a request to a unit. Nothing is sent.
     *
     * @param unit the unit
     * @param request the request
     * @return the token of the request
     * @throws BatchStateException if the unit is committed or abandoned
     */
    public CorrelationToken add(BatchUnit unit, DataRequest request) {
        requireNonNull(unit, "unit must be non-null");
        return unit.add(request);
    }

    /**
     * Commits a unit. The unit is sealed when this is called; the exchange
     * happens when the returned Mono is subscribed to. An empty unit
     * results in an empty {@link BatchResult} and no exchange.
     *
     * @param unit the unit
     * @param token the cancellation token of the exchange
     * @return a Mono of the results, in add order
     * @throws BatchStateException if the unit is already committed or
     * abandoned
     */
    public Mono<BatchResult> commit(BatchUnit unit, CancellationToken token) {
        requireNonNull(unit, "unit must be non-null");
        requireNonNull(token, "token must be non-null");
        final List<BatchUnit.Entry> entries = unit.seal();
        if (entries.isEmpty()) {
            LogUtil.logFine(logger, "Batch " + unit.getId() +
                            " is empty, nothing to send");
            return Mono.just(new BatchResult(Collections.emptyList(),
                                             config));
        }
        return Mono.defer(() -> send(entries, token))
            .doOnNext(unit::complete)
            .doOnError(unit::fail)
            .doOnCancel(() -> unit.fail(new RequestCancelledException(
                "Commit of batch " + unit.getId() + " was cancelled")));
    }

    private Mono<BatchResult> send(List<BatchUnit.Entry> entries,
                                   CancellationToken token) {
        final List<String> uris = new ArrayList<>(entries.size());
        final List<Operation> operations = new ArrayList<>(entries.size());
        for (BatchUnit.Entry e : entries) {
            String uri = executor.resolveUri(e.request.getUri());
            HttpHeaders headers = new DefaultHttpHeaders(false);
            executor.assembleHeaders(e.request, headers);
            operations.add(new Operation(e.request.getVerb(), uri, headers,
                                         e.request.getBody()));
            uris.add(uri);
        }
        final Payload payload = BatchRequestWriter.write(operations);
        LogUtil.logTrace(logger, () -> "Sending batch of " + entries.size() +
                         " requests as " + payload.getGroups());

        DataRequest batchRequest = DataRequest
            .builder(RestVerb.POST, BATCH_PATH)
            .contentType(payload.getContentType())
            .accept(MULTIPART_MIXED)
            .body(payload.getBody())
            .build();
        return executor.execute(batchRequest, token)
            .map(response -> demultiplex(entries, uris,
                                         payload.getGroups(), response));
    }

    /**
     * Maps the parts of the reply to the requests.
     *
     * @throws BatchResponseFormatException if the envelope cannot be read
     */
    BatchResult demultiplex(List<BatchUnit.Entry> entries,
                            List<String> uris,
                            List<Group> groups,
                            DataResponse response) {
        final List<Part> parts;
        try {
            parts = BatchResponseReader.read(response.getHeader(CONTENT_TYPE),
                                             response.getBody());
        } catch (DataServiceException dse) {
            throw dse;
        } catch (RuntimeException re) {
            throw new BatchResponseFormatException(
                "Unable to read batch response: " + re.getMessage(), re);
        }
        if (parts.size() != groups.size()) {
            LogUtil.logWarning(logger, "Batch response has " + parts.size() +
                               " parts, " + groups.size() + " expected");
        }

        Map<String, Part> byContentId = indexByContentId(parts);
        ExecutionResult[] results = new ExecutionResult[entries.size()];
        for (int g = 0; g < groups.size(); g++) {
            Group group = groups.get(g);
            Part part = findPart(group, g, parts, byContentId);
            if (part == null) {
                for (int index : group.getIndexes()) {
                    results[index] = missing(index);
                }
            } else if (!group.isChangeset()) {
                int index = group.getIndexes().get(0);
                results[index] = part.isChangeset() ?
                    malformed(index, "a changeset answers a single request") :
                    toResult(part);
            } else if (!part.isChangeset()) {
                /* the changeset was answered with one response */
                ExecutionResult r = toResult(part);
                boolean applies =
                    (group.getIndexes().size() == 1 || !r.isSuccess());
                for (int index : group.getIndexes()) {
                    results[index] = applies ? r :
                        malformed(index,
                                  "a changeset was answered with a single " +
                                  "successful response");
                }
            } else {
                matchChangeset(group, part.getParts(), results);
            }
        }

        List<BatchResult.Entry> resultEntries = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            BatchUnit.Entry e = entries.get(i);
            ExecutionResult r = (results[i] != null ? results[i] : missing(i));
            resultEntries.add(new BatchResult.Entry(e.token, e.request,
                                                    uris.get(i), r));
        }
        return new BatchResult(resultEntries, config);
    }

    /*
     * Maps the Content-IDs found in the reply to the top-level parts that
     * carry them, directly or in a changeset.
     */
    private static Map<String, Part> indexByContentId(List<Part> parts) {
        Map<String, Part> byContentId = new HashMap<>();
        for (Part p : parts) {
            if (p.isChangeset()) {
                for (Part inner : p.getParts()) {
                    if (inner.getContentId() != null) {
                        byContentId.putIfAbsent(inner.getContentId(), p);
                    }
                }
            } else if (p.getContentId() != null) {
                byContentId.putIfAbsent(p.getContentId(), p);
            }
        }
        return byContentId;
    }

    /*
     * The top-level part answering a group is found by the Content-ID of
     * one of its requests. Failing that, the part at the position of the
     * group is used, provided it carries no Content-ID of its own.
     */
    private static Part findPart(Group group,
                                 int position,
                                 List<Part> parts,
                                 Map<String, Part> byContentId) {
        for (int index : group.getIndexes()) {
            Part part = byContentId.get(BatchRequestWriter.contentIdOf(index));
            if (part != null) {
                return part;
            }
        }
        if (position >= parts.size()) {
            return null;
        }
        Part part = parts.get(position);
        return byContentId.containsValue(part) ? null : part;
    }

    /*
     * Responses in a changeset are matched by Content-ID. If the service
     * sent none, they are matched by position.
     */
    private static void matchChangeset(Group group,
                                       List<Part> parts,
                                       ExecutionResult[] results) {
        Map<String, Part> byContentId = new HashMap<>();
        for (Part p : parts) {
            if (p.getContentId() != null) {
                byContentId.put(p.getContentId(), p);
            }
        }
        List<Integer> indexes = group.getIndexes();
        for (int pos = 0; pos < indexes.size(); pos++) {
            int index = indexes.get(pos);
            Part match;
            if (byContentId.isEmpty()) {
                match = (pos < parts.size() ? parts.get(pos) : null);
            } else {
                match = byContentId.get(
                    BatchRequestWriter.contentIdOf(index));
            }
            results[index] = (match == null ? missing(index) :
                              toResult(match));
        }
    }

    private static ExecutionResult toResult(Part part) {
        if (part.getFailure() != null) {
            return ExecutionResult.failure(part.getFailure());
        }
        DataResponse response = part.getResponse();
        if (response.isSuccessStatusCode()) {
            return ExecutionResult.success(response);
        }
        return ExecutionResult.failure(
            new UnsuccessfulResponseException(response));
    }

    private static ExecutionResult missing(int index) {
        return ExecutionResult.failure(new BatchResponseFormatException(
            "Batch response has no response for request " + index));
    }

    private static ExecutionResult malformed(int index, String reason) {
        return ExecutionResult.failure(new BatchResponseFormatException(
            "Unexpected batch response for request " + index + ": " +
            reason));
    }
}
