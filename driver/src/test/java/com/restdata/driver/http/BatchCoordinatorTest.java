/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Logger;

import com.restdata.driver.BatchResponseFormatException;
import com.restdata.driver.BatchStateException;
import com.restdata.driver.CancellationToken;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.RequestCancelledException;
import com.restdata.driver.UnsuccessfulResponseException;
import com.restdata.driver.httpclient.OutgoingRequest;
import com.restdata.driver.ops.BatchResult;
import com.restdata.driver.ops.CorrelationToken;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.ops.ExecutionResult;
import com.restdata.driver.ops.RestVerb;
import com.restdata.driver.util.HttpConstants;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import org.junit.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Tests the batch exchange and the mapping of its reply to requests
 */
public class BatchCoordinatorTest {

    private static final Logger logger =
        Logger.getLogger(BatchCoordinatorTest.class.getName());

    private static final String BOUNDARY = "batchresponse_1";

    private FakeTransport transport;
    private BatchCoordinator coordinator;

    @Test
    public void testResultsInAddOrder() {
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            httpPart(null, "HTTP/1.1 200 OK", "{\"value\":[]}"),
            changeset("changesetresponse_1",
                      httpPart("3", "HTTP/1.1 204 No Content", ""),
                      httpPart("2", "HTTP/1.1 201 Created",
                               "{\"ID\":7}"))))));

        BatchUnit unit = coordinator.open();
        CorrelationToken t0 = coordinator.add(unit, get("Customers"));
        CorrelationToken t1 = coordinator.add(unit,
            DataRequest.builder(RestVerb.POST, "Customers")
            .contentType("application/json")
            .body("{\"Name\":\"Milk\"}")
            .build());
        CorrelationToken t2 = coordinator.add(unit,
            DataRequest.builder(RestVerb.DELETE, "Orders(1)")
            .checkOptimisticConcurrency(true)
            .build());
        assertEquals(0, t0.getIndex());
        assertEquals(2, t2.getIndex());
        assertEquals(3, unit.size());
        assertEquals(0, transport.getSubscriptions());

        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertNotNull(result);
        assertEquals(3, result.size());
        assertEquals(200, result.get(t0).getStatusCode());
        assertEquals(201, result.get(t1).getStatusCode());
        assertEquals("{\"ID\":7}",
                     result.get(t1).getResponse().getBodyAsString());
        assertEquals(204, result.get(t2).getStatusCode());
        assertEquals(t0, result.getEntries().get(0).getToken());
        assertEquals("http://localhost:8080/svc/Orders(1)",
                     result.getEntries().get(2).getResolvedUri());

        /* the per-request futures complete with the same responses */
        assertEquals(201, unit.futureFor(t1).join().getStatusCode());
        assertEquals(204, unit.futureFor(t2).join().getStatusCode());

        /* one physical exchange */
        assertEquals(1, transport.getSubscriptions());
        OutgoingRequest sent = transport.lastSent();
        assertEquals(RestVerb.POST, sent.getVerb());
        assertEquals("http://localhost:8080/svc/$batch", sent.getUri());
        assertTrue(sent.getHeaders().get(HttpConstants.CONTENT_TYPE)
                   .startsWith("multipart/mixed; boundary=batch_"));
        assertEquals("multipart/mixed",
                     sent.getHeaders().get(HttpConstants.ACCEPT));
        String body = new String(sent.getBody(), StandardCharsets.UTF_8);
        assertTrue(body.contains(
            "GET http://localhost:8080/svc/Customers HTTP/1.1\r\n"));
        assertTrue(body.contains("Content-ID: 2\r\n"));
        assertTrue(body.contains(
            "DELETE http://localhost:8080/svc/Orders(1) HTTP/1.1\r\n" +
            "If-Match: *\r\n"));
        assertEquals(BatchUnit.State.COMMITTED, unit.getState());
    }

    @Test
    public void testReorderedReads() {
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            httpPart("2", "HTTP/1.1 200 OK", "\"B\""),
            httpPart("1", "HTTP/1.1 200 OK", "\"A\"")))));

        BatchUnit unit = coordinator.open();
        CorrelationToken a = coordinator.add(unit, get("Items('A')"));
        CorrelationToken b = coordinator.add(unit, get("Items('B')"));
        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertEquals("\"A\"", result.get(a).getResponse().getBodyAsString());
        assertEquals("\"B\"", result.get(b).getResponse().getBodyAsString());
        assertEquals("\"A\"", unit.futureFor(a).join().getBodyAsString());

        String body = new String(transport.lastSent().getBody(),
                                 StandardCharsets.UTF_8);
        assertTrue(body.contains("Content-ID: 1\r\n\r\n" +
                                 "GET http://localhost:8080/svc/Items('A')"));
        assertTrue(body.contains("Content-ID: 2\r\n\r\n" +
                                 "GET http://localhost:8080/svc/Items('B')"));
    }

    @Test
    public void testChangesetAnsweredBeforeRead() {
        /* the read carries its Content-ID, the changeset its own */
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            changeset("changesetresponse_1",
                      httpPart("2", "HTTP/1.1 201 Created", "{\"ID\":1}")),
            httpPart("1", "HTTP/1.1 200 OK", "{\"value\":[]}")))));

        BatchUnit unit = coordinator.open();
        CorrelationToken read = coordinator.add(unit, get("Customers"));
        CorrelationToken write = coordinator.add(unit, post("Customers"));
        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertEquals(200, result.get(read).getStatusCode());
        assertEquals(201, result.get(write).getStatusCode());
        assertEquals(read, result.getEntries().get(0).getToken());
    }

    @Test
    public void testResultsCannotBeModified() {
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            httpPart("1", "HTTP/1.1 200 OK", "Hello")))));

        BatchUnit unit = coordinator.open();
        CorrelationToken t = coordinator.add(unit, get("Greetings(1)"));
        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));

        DataResponse response = result.get(t).getResponse();
        response.getBody()[0] = 'Z';
        try {
            response.getHeaders().set("X-Injected", "yes");
            fail("response headers should be read-only");
        } catch (UnsupportedOperationException expected) {
            // expect a failure
        }

        DataResponse other = unit.futureFor(t).join();
        assertEquals("Hello", other.getBodyAsString());
        assertEquals("Hello", result.get(t).getResponse().getBodyAsString());
        assertFalse(other.getHeaders().contains("X-Injected"));
    }

    @Test
    public void testFailedChangeset() {
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            httpPart(null, "HTTP/1.1 200 OK", "{}"),
            httpPart(null, "HTTP/1.1 400 Bad Request",
                     "{\"error\":{\"code\":\"BadRequest\"," +
                     "\"message\":\"Invalid Name\"}}")))));

        BatchUnit unit = coordinator.open();
        CorrelationToken read = coordinator.add(unit, get("Customers"));
        CorrelationToken w1 = coordinator.add(unit, post("Customers"));
        CorrelationToken w2 = coordinator.add(unit, post("Customers"));

        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertTrue(result.get(read).isSuccess());
        for (CorrelationToken t : new CorrelationToken[] {w1, w2}) {
            ExecutionResult r = result.get(t);
            assertFalse(r.isSuccess());
            assertTrue(r.getFailure() instanceof
                       UnsuccessfulResponseException);
            assertEquals(400, r.getStatusCode());
            assertEquals("Invalid Name",
                         ((UnsuccessfulResponseException) r.getFailure())
                         .getServiceMessage());
            try {
                r.getResponseOrThrow();
                fail("a failed result should throw");
            } catch (UnsuccessfulResponseException expected) {
                // expect a failure
            }
        }
    }

    @Test
    public void testSingleSuccessForChangeset() {
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            httpPart(null, "HTTP/1.1 204 No Content", "")))));

        BatchUnit unit = coordinator.open();
        CorrelationToken w1 = coordinator.add(unit, post("Customers"));
        CorrelationToken w2 = coordinator.add(unit, post("Customers"));
        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertTrue(result.get(w1).getFailure() instanceof
                   BatchResponseFormatException);
        assertTrue(result.get(w2).getFailure() instanceof
                   BatchResponseFormatException);
    }

    @Test
    public void testPositionalChangeset() {
        /* no Content-ID in the reply */
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            changeset("cs",
                      httpPart(null, "HTTP/1.1 201 Created", "{}"),
                      httpPart(null, "HTTP/1.1 204 No Content", ""))))));

        BatchUnit unit = coordinator.open();
        CorrelationToken w1 = coordinator.add(unit, post("Customers"));
        CorrelationToken w2 = coordinator.add(unit,
            DataRequest.builder(RestVerb.DELETE, "Customers(1)").build());
        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertEquals(201, result.get(w1).getStatusCode());
        assertEquals(204, result.get(w2).getStatusCode());
    }

    @Test
    public void testMissingAndMalformedParts() {
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            httpPart(null, "HTTP/1.1 200 OK", "{}"),
            "Content-Type: application/http\r\n\r\nnonsense\r\n"))));

        BatchUnit unit = coordinator.open();
        CorrelationToken t0 = coordinator.add(unit, get("Customers"));
        CorrelationToken t1 = coordinator.add(unit, get("Orders"));
        CorrelationToken t2 = coordinator.add(unit, get("Products"));
        BatchResult result = coordinator.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertTrue(result.get(t0).isSuccess());
        assertTrue(result.get(t1).getFailure() instanceof
                   BatchResponseFormatException);
        assertTrue(result.get(t2).getFailure() instanceof
                   BatchResponseFormatException);
        assertEquals(0, result.get(t2).getStatusCode());

        CompletableFuture<DataResponse> future = unit.futureFor(t1);
        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    public void testExchangeFailureFailsAll() {
        setUp(r -> Mono.just(FakeTransport.response(
            500, "{\"error\":{\"code\":\"Internal\",\"message\":\"down\"}}")));

        BatchUnit unit = coordinator.open();
        CorrelationToken t0 = coordinator.add(unit, get("Customers"));
        CorrelationToken t1 = coordinator.add(unit, post("Customers"));

        UnsuccessfulResponseException failure = null;
        try {
            coordinator.commit(unit, CancellationToken.NONE)
                .block(Duration.ofSeconds(5));
            fail("commit should fail");
        } catch (UnsuccessfulResponseException expected) {
            failure = expected;
        }
        assertEquals(500, failure.getStatusCode());
        assertSame(failure, causeOf(unit.futureFor(t0)));
        assertSame(failure, causeOf(unit.futureFor(t1)));
    }

    @Test
    public void testUnreadableEnvelope() {
        setUp(r -> Mono.just(FakeTransport.response(200, "{}")));

        BatchUnit unit = coordinator.open();
        CorrelationToken t0 = coordinator.add(unit, get("Customers"));
        StepVerifier.create(coordinator.commit(unit, CancellationToken.NONE))
            .expectError(BatchResponseFormatException.class)
            .verify(Duration.ofSeconds(5));
        assertTrue(causeOf(unit.futureFor(t0)) instanceof
                   BatchResponseFormatException);
    }

    @Test
    public void testEmptyCommit() {
        final AtomicInteger created = new AtomicInteger();
        DataClientConfig config = config().setTransportFactory(options -> {
            created.incrementAndGet();
            return FakeTransport.replying(200, "{}");
        });
        RequestExecutor executor = new RequestExecutor(
            config, new TransportManager(config, logger), logger);
        BatchCoordinator empty =
            new BatchCoordinator(config, executor, logger);

        BatchUnit unit = empty.open();
        BatchResult result = empty.commit(unit, CancellationToken.NONE)
            .block(Duration.ofSeconds(5));
        assertTrue(result.isEmpty());
        assertEquals(0, created.get());
        assertEquals(BatchUnit.State.COMMITTED, unit.getState());
    }

    @Test
    public void testStateErrors() {
        setUp(r -> Mono.just(multipart(envelope(BOUNDARY,
            httpPart(null, "HTTP/1.1 200 OK", "{}")))));

        BatchUnit unit = coordinator.open();
        CorrelationToken t0 = coordinator.add(unit, get("Customers"));
        Mono<BatchResult> commit =
            coordinator.commit(unit, CancellationToken.NONE);

        /* sealed by commit, before the exchange */
        try {
            coordinator.add(unit, get("Orders"));
            fail("add after commit should fail");
        } catch (BatchStateException expected) {
            // expect a failure
        }
        try {
            coordinator.commit(unit, CancellationToken.NONE);
            fail("a second commit should fail");
        } catch (BatchStateException expected) {
            // expect a failure
        }
        assertEquals(0, transport.getSubscriptions());

        commit.block(Duration.ofSeconds(5));
        assertTrue(unit.futureFor(t0).join().isSuccessStatusCode());

        /* a token from another unit */
        BatchUnit other = coordinator.open();
        try {
            other.futureFor(t0);
            fail("a foreign token should fail");
        } catch (IllegalArgumentException expected) {
            // expect a failure
        }
    }

    @Test
    public void testAbandon() {
        setUp(r -> Mono.just(FakeTransport.response(200, "{}")));

        BatchUnit unit = coordinator.open();
        CorrelationToken t0 = coordinator.add(unit, get("Customers"));
        assertTrue(unit.abandon());
        assertFalse(unit.abandon());
        assertEquals(BatchUnit.State.ABANDONED, unit.getState());
        assertTrue(causeOf(unit.futureFor(t0)) instanceof
                   BatchStateException);

        try {
            coordinator.add(unit, get("Orders"));
            fail("add after abandon should fail");
        } catch (BatchStateException expected) {
            // expect a failure
        }
        try {
            coordinator.commit(unit, CancellationToken.NONE);
            fail("commit after abandon should fail");
        } catch (BatchStateException expected) {
            // expect a failure
        }
        assertEquals(0, transport.getSubscriptions());
    }

    @Test
    public void testCancelCommit() {
        setUp(r -> Mono.never());

        BatchUnit unit = coordinator.open();
        CorrelationToken t0 = coordinator.add(unit, get("Customers"));
        final CancellationToken token = new CancellationToken();
        StepVerifier.create(coordinator.commit(unit, token))
            .then(token::cancel)
            .expectError(RequestCancelledException.class)
            .verify(Duration.ofSeconds(5));
        assertTrue(causeOf(unit.futureFor(t0)) instanceof
                   RequestCancelledException);
        assertEquals(1, transport.getCancellations());
    }

    private void setUp(Function<OutgoingRequest, Mono<DataResponse>> reply) {
        transport = new FakeTransport(reply);
        final FakeTransport t = transport;
        DataClientConfig config = config()
            .setTransportFactory(options -> t);
        RequestExecutor executor = new RequestExecutor(
            config, new TransportManager(config, logger), logger);
        coordinator = new BatchCoordinator(config, executor, logger);
    }

    private static DataClientConfig config() {
        return new DataClientConfig("http://localhost:8080/svc");
    }

    private static DataRequest get(String uri) {
        return DataRequest.builder(RestVerb.GET, uri)
            .accept("application/json").build();
    }

    private static DataRequest post(String uri) {
        return DataRequest.builder(RestVerb.POST, uri)
            .contentType("application/json").body("{}").build();
    }

    private static Throwable causeOf(CompletableFuture<DataResponse> f) {
        try {
            f.join();
            fail("future should have failed");
            return null;
        } catch (CompletionException ce) {
            return ce.getCause();
        }
    }

    static DataResponse multipart(String body) {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.set(HttpConstants.CONTENT_TYPE,
                    "multipart/mixed; boundary=" + BOUNDARY);
        return new DataResponse(202, null, headers,
                                body.getBytes(StandardCharsets.UTF_8));
    }

    static String envelope(String boundary, String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            sb.append("--").append(boundary).append("\r\n").append(part);
        }
        return sb.append("--").append(boundary).append("--\r\n").toString();
    }

    static String changeset(String boundary, String... parts) {
        return "Content-Type: multipart/mixed; boundary=" + boundary +
            "\r\n\r\n" + envelope(boundary, parts);
    }

    static String httpPart(String contentId, String statusLine, String body) {
        return "Content-Type: application/http\r\n" +
            "Content-Transfer-Encoding: binary\r\n" +
            (contentId == null ? "" : "Content-ID: " + contentId + "\r\n") +
            "\r\n" +
            statusLine + "\r\n" +
            "\r\n" +
            body + "\r\n";
    }
}
