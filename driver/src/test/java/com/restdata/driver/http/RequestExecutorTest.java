/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import com.restdata.driver.BasicAuthorizationProvider;
import com.restdata.driver.CancellationToken;
import com.restdata.driver.ClientClosedException;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.DataServiceException;
import com.restdata.driver.RequestCancelledException;
import com.restdata.driver.RequestTimeoutException;
import com.restdata.driver.TransportException;
import com.restdata.driver.UnsuccessfulResponseException;
import com.restdata.driver.httpclient.OutgoingRequest;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.ops.RestVerb;
import com.restdata.driver.util.HttpConstants;

import io.netty.handler.timeout.ReadTimeoutException;
import org.junit.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Tests request assembly, hooks and failure classification of
 * {@link RequestExecutor}
 */
public class RequestExecutorTest {

    private static final Logger logger =
        Logger.getLogger(RequestExecutorTest.class.getName());

    private static final String basicAuthString =
        "Basic dGVzdDpOb1NxbDAwX18xMjM0NTY=";

    private static final List<RestVerb> checkedVerbs = Arrays.asList(
        RestVerb.PUT, RestVerb.PATCH, RestVerb.MERGE, RestVerb.DELETE);

    @Test
    public void testIfMatch() {
        for (boolean toggle : new boolean[] {false, true}) {
            RequestExecutor executor = executor(
                config().setCheckOptimisticConcurrency(toggle),
                FakeTransport.replying(200, "{}"));
            for (RestVerb verb : RestVerb.values()) {
                for (boolean flag : new boolean[] {false, true}) {
                    DataRequest request =
                        DataRequest.builder(verb, "Customers('ALFKI')")
                        .checkOptimisticConcurrency(flag)
                        .build();
                    boolean expected =
                        (flag || toggle) && checkedVerbs.contains(verb);
                    String what = verb + " flag=" + flag +
                        " toggle=" + toggle;
                    assertEquals(what, expected,
                                 executor.requiresIfMatch(request));
                    OutgoingRequest outgoing = executor.prepare(request);
                    assertEquals(what, expected ? "*" : null,
                                 outgoing.getHeaders()
                                 .get(HttpConstants.IF_MATCH));
                }
            }
        }
    }

    @Test
    public void testPrepare() {
        RequestExecutor executor = executor(
            config().setAuthorizationProvider(
                new BasicAuthorizationProvider(
                    "test", "NoSql00__123456".toCharArray()))
            .setExtensionUserAgent("reports/2.1"),
            FakeTransport.replying(200, "{}"));

        DataRequest request =
            DataRequest.builder(RestVerb.POST, "Customers")
            .accept("application/json", "text/plain")
            .contentType("application/json")
            .header("X-Request-Tag", "42")
            .body("{\"CustomerID\":\"ALFKI\"}")
            .build();
        OutgoingRequest outgoing = executor.prepare(request);

        assertSame(request, outgoing.getSource());
        assertEquals(RestVerb.POST, outgoing.getVerb());
        assertEquals("http://localhost:8080/svc/Customers",
                     outgoing.getUri());
        assertEquals(Arrays.asList("application/json", "text/plain"),
                     outgoing.getHeaders().getAll(HttpConstants.ACCEPT));
        assertEquals("application/json",
                     outgoing.getHeaders().get(HttpConstants.CONTENT_TYPE));
        assertEquals("42", outgoing.getHeaders().get("x-request-tag"));
        assertEquals(basicAuthString,
                     outgoing.getHeaders().get(HttpConstants.AUTHORIZATION));
        assertEquals(HttpConstants.userAgent + " reports/2.1",
                     outgoing.getHeaders().get(HttpConstants.USER_AGENT));
        assertEquals("{\"CustomerID\":\"ALFKI\"}",
                     new String(outgoing.getBody(), StandardCharsets.UTF_8));
        assertNull(outgoing.getHeaders().get(HttpConstants.IF_MATCH));
    }

    @Test
    public void testCallerHeadersWin() {
        RequestExecutor executor = executor(
            config().setCheckOptimisticConcurrency(true)
            .setAuthorizationProvider(r -> "Bearer config"),
            FakeTransport.replying(200, "{}"));

        DataRequest request =
            DataRequest.builder(RestVerb.DELETE, "Orders(10248)")
            .accept("application/json")
            .header("accept", "application/xml")
            .header("If-Match", "W/\"3\"")
            .header("Authorization", "Bearer caller")
            .header("User-Agent", "custom-agent")
            .build();
        OutgoingRequest outgoing = executor.prepare(request);
        assertEquals(Collections.singletonList("application/xml"),
                     outgoing.getHeaders().getAll(HttpConstants.ACCEPT));
        assertEquals("W/\"3\"",
                     outgoing.getHeaders().get(HttpConstants.IF_MATCH));
        assertEquals("Bearer caller",
                     outgoing.getHeaders().get(HttpConstants.AUTHORIZATION));
        assertEquals("custom-agent",
                     outgoing.getHeaders().get(HttpConstants.USER_AGENT));
    }

    @Test
    public void testRequestCredentials() {
        RequestExecutor executor = executor(
            config().setAuthorizationProvider(r -> "Bearer config"),
            FakeTransport.replying(200, "{}"));

        DataRequest request = DataRequest.builder(RestVerb.GET, "Customers")
            .credentials(r -> "Bearer request")
            .build();
        assertEquals("Bearer request",
                     executor.prepare(request).getHeaders()
                     .get(HttpConstants.AUTHORIZATION));

        request = DataRequest.builder(RestVerb.GET, "Customers").build();
        assertEquals("Bearer config",
                     executor.prepare(request).getHeaders()
                     .get(HttpConstants.AUTHORIZATION));

        /* a provider may decline */
        executor = executor(config().setAuthorizationProvider(r -> null),
                            FakeTransport.replying(200, "{}"));
        assertFalse(executor.prepare(request).getHeaders()
                    .contains(HttpConstants.AUTHORIZATION));
    }

    @Test
    public void testResolveUri() throws Exception {
        URL service = new URL("http://localhost:8080/odata/Northwind.svc/");
        assertEquals("http://localhost:8080/odata/Northwind.svc/Customers",
                     RequestExecutor.resolveUri(service, "Customers"));
        assertEquals("http://localhost:8080/other/$metadata",
                     RequestExecutor.resolveUri(service, "/other/$metadata"));
        assertEquals("https://elsewhere.example.com/x",
                     RequestExecutor.resolveUri(
                         service, "https://elsewhere.example.com/x"));
        assertEquals("HTTP://elsewhere.example.com/x",
                     RequestExecutor.resolveUri(
                         service, "HTTP://elsewhere.example.com/x"));
    }

    @Test
    public void testHooksAndSuccess() {
        final List<String> events =
            Collections.synchronizedList(new ArrayList<>());
        FakeTransport transport = new FakeTransport(r -> {
            events.add("send " + r.getHeaders().get("X-Hook"));
            return Mono.just(FakeTransport.response(200, "{\"value\":[]}"));
        });
        DataClientConfig config = config()
            .setBeforeRequest(r -> {
                events.add("before " + r.getUri());
                r.getHeaders().set("X-Hook", "yes");
            })
            .setAfterResponse(r -> events.add("after " + r.getStatusCode()));
        RequestExecutor executor = executor(config, transport);

        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectNextMatches(r -> r.getStatusCode() == 200 &&
                               "{\"value\":[]}".equals(r.getBodyAsString()))
            .verifyComplete();

        assertEquals(Arrays.asList(
                         "before http://localhost:8080/svc/Customers",
                         "send yes",
                         "after 200"),
                     events);
    }

    @Test
    public void testNothingHappensBeforeSubscribe() {
        final AtomicInteger hooks = new AtomicInteger();
        FakeTransport transport = FakeTransport.replying(200, "{}");
        RequestExecutor executor = executor(
            config().setBeforeRequest(r -> hooks.incrementAndGet()),
            transport);
        Mono<DataResponse> mono = executor.execute(
            DataRequest.builder(RestVerb.GET, "Customers").build(),
            CancellationToken.NONE);
        assertEquals(0, hooks.get());
        assertEquals(0, transport.getSubscriptions());
        mono.block(Duration.ofSeconds(5));
        assertEquals(1, hooks.get());
        assertEquals(1, transport.getSubscriptions());
    }

    @Test
    public void testUnsuccessfulStatus() {
        final AtomicInteger after = new AtomicInteger();
        FakeTransport transport = FakeTransport.replying(
            404,
            "{\"error\":{\"code\":\"NotFound\"," +
            "\"message\":\"No such customer\"}}");
        RequestExecutor executor = executor(
            config().setAfterResponse(r -> after.incrementAndGet()),
            transport);

        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers('NONE')").build(),
                CancellationToken.NONE))
            .expectErrorMatches(t -> {
                if (!(t instanceof UnsuccessfulResponseException)) {
                    return false;
                }
                UnsuccessfulResponseException ure =
                    (UnsuccessfulResponseException) t;
                return ure.getStatusCode() == 404 &&
                    "Not Found".equals(ure.getReasonPhrase()) &&
                    "NotFound".equals(ure.getServiceCode()) &&
                    "No such customer".equals(ure.getServiceMessage());
            })
            .verify(Duration.ofSeconds(5));

        /* the hook sees error responses too */
        assertEquals(1, after.get());
    }

    @Test
    public void testTimeout() {
        RequestExecutor executor = executor(
            config().setRequestTimeout(Duration.ofSeconds(2)),
            new FakeTransport(r -> Mono.error(ReadTimeoutException.INSTANCE)));

        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectErrorMatches(t -> t instanceof RequestTimeoutException &&
                ((RequestTimeoutException) t).getTimeoutMs() == 2000 &&
                t.getCause() == ReadTimeoutException.INSTANCE)
            .verify(Duration.ofSeconds(5));

        executor = executor(
            config(),
            new FakeTransport(r -> Mono.error(new IllegalStateException(
                "wrapped", new java.util.concurrent.TimeoutException()))));
        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectErrorMatches(t -> t instanceof RequestTimeoutException &&
                ((RequestTimeoutException) t).getTimeoutMs() == 0)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    public void testTransportFailure() {
        final IOException reset = new IOException("Connection reset");
        RequestExecutor executor = executor(
            config(), new FakeTransport(r -> Mono.error(reset)));

        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectErrorMatches(t -> t.getClass() == TransportException.class
                                && t.getCause() == reset)
            .verify(Duration.ofSeconds(5));

        /* a failure to build the transport is a transport failure too */
        DataClientConfig config = config().setTransportFactory(options -> {
            throw new IllegalStateException("no sockets");
        });
        executor = new RequestExecutor(
            config, new TransportManager(config, logger), logger);
        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectErrorMatches(t -> t.getClass() == TransportException.class
                && t.getCause() instanceof IllegalStateException)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    public void testServiceExceptionsPassThrough() {
        final DataServiceException failure = new DataServiceException("boom");
        RequestExecutor executor = executor(
            config(), new FakeTransport(r -> Mono.error(failure)));
        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectErrorMatches(t -> t == failure)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    public void testHookFailurePropagates() {
        final IllegalStateException failure =
            new IllegalStateException("hook failed");
        FakeTransport transport = FakeTransport.replying(200, "{}");
        RequestExecutor executor = executor(
            config().setBeforeRequest(r -> {
                throw failure;
            }),
            transport);
        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectErrorMatches(t -> t == failure)
            .verify(Duration.ofSeconds(5));
        assertEquals(0, transport.getSubscriptions());
    }

    @Test
    public void testClosed() {
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger hooks = new AtomicInteger();
        DataClientConfig config = config()
            .setBeforeRequest(r -> hooks.incrementAndGet())
            .setTransportFactory(options -> {
                created.incrementAndGet();
                return FakeTransport.replying(200, "{}");
            });
        TransportManager manager = new TransportManager(config, logger);
        RequestExecutor executor =
            new RequestExecutor(config, manager, logger);
        manager.release();

        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                CancellationToken.NONE))
            .expectError(ClientClosedException.class)
            .verify(Duration.ofSeconds(5));
        assertEquals(0, hooks.get());
        assertEquals(0, created.get());
    }

    @Test
    public void testCancelledBeforeStart() {
        final AtomicInteger hooks = new AtomicInteger();
        FakeTransport transport = FakeTransport.replying(200, "{}");
        RequestExecutor executor = executor(
            config().setBeforeRequest(r -> hooks.incrementAndGet()),
            transport);
        CancellationToken token = new CancellationToken();
        token.cancel();

        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                token))
            .expectError(RequestCancelledException.class)
            .verify(Duration.ofSeconds(5));
        assertEquals(0, hooks.get());
        assertEquals(0, transport.getSubscriptions());
    }

    @Test
    public void testCancelledInFlight() {
        final AtomicInteger after = new AtomicInteger();
        FakeTransport transport = new FakeTransport(r -> Mono.never());
        RequestExecutor executor = executor(
            config().setAfterResponse(r -> after.incrementAndGet()),
            transport);
        final CancellationToken token = new CancellationToken();

        StepVerifier.create(executor.execute(
                DataRequest.builder(RestVerb.GET, "Customers").build(),
                token))
            .then(token::cancel)
            .expectError(RequestCancelledException.class)
            .verify(Duration.ofSeconds(5));
        assertEquals(1, transport.getSubscriptions());
        assertEquals(1, transport.getCancellations());
        assertEquals(0, after.get());
    }

    @Test
    public void testCancellationToken() {
        CancellationToken token = new CancellationToken();
        assertTrue(token.canBeCancelled());
        assertFalse(token.isCancellationRequested());
        token.cancel();
        token.cancel();
        assertTrue(token.isCancellationRequested());
        StepVerifier.create(token.whenCancelled())
            .verifyComplete();

        assertFalse(CancellationToken.NONE.canBeCancelled());
        try {
            CancellationToken.NONE.cancel();
            fail("NONE cannot be cancelled");
        } catch (IllegalStateException expected) {
            // expect a failure
        }
    }

    private static DataClientConfig config() {
        return new DataClientConfig("http://localhost:8080/svc");
    }

    private static RequestExecutor executor(DataClientConfig config,
                                            final FakeTransport transport) {
        config.setTransportFactory(options -> transport);
        return new RequestExecutor(
            config, new TransportManager(config, logger), logger);
    }
}
