/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static com.restdata.driver.util.CheckNull.requireNonNull;
import static com.restdata.driver.util.HttpConstants.ACCEPT;
import static com.restdata.driver.util.HttpConstants.AUTHORIZATION;
import static com.restdata.driver.util.HttpConstants.ETAG_ANY;
import static com.restdata.driver.util.HttpConstants.IF_MATCH;
import static com.restdata.driver.util.HttpConstants.USER_AGENT;

import java.net.URL;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

import com.restdata.driver.AuthorizationProvider;
import com.restdata.driver.CancellationToken;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.DataServiceException;
import com.restdata.driver.RequestCancelledException;
import com.restdata.driver.RequestTimeoutException;
import com.restdata.driver.TransportException;
import com.restdata.driver.UnsuccessfulResponseException;
import com.restdata.driver.httpclient.OutgoingRequest;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.util.HttpConstants;
import com.restdata.driver.util.LogUtil;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.timeout.ReadTimeoutException;
import reactor.core.publisher.Mono;

/**
 * @hidden
 *
 * Executes one {@link DataRequest}: assembles the outgoing request, runs
 * the pre-send hook, sends it over the client's transport, runs the
 * post-receive hook and checks the status. Failures are classified here,
 * once:
 * <ul>
 * <li>a timeout of the transport becomes {@link RequestTimeoutException}</li>
 * <li>any other failure to get a response becomes
 * {@link TransportException}</li>
 * <li>a status outside of the 2xx range becomes
 * {@link UnsuccessfulResponseException}</li>
 * <li>a {@link DataServiceException} passes through unchanged</li>
 * </ul>
 * Exceptions thrown by the hooks fail the request unchanged. Nothing is
 * retried.
 */
public class RequestExecutor {

    private final DataClientConfig config;
    private final TransportManager transportManager;
    private final Logger logger;
    private final String userAgent;

    public RequestExecutor(DataClientConfig config,
                           TransportManager transportManager,
                           Logger logger) {
        this.config = requireNonNull(config, "config must be non-null");
        this.transportManager = requireNonNull(
            transportManager, "transportManager must be non-null");
        this.logger = requireNonNull(logger, "logger must be non-null");
        this.userAgent = HttpConstants.userAgent(config);
    }

    /**
     * Returns a Mono executing the request when subscribed to. Cancelling
     * the token, or the subscription, aborts the exchange.
     *
     * @param request the request
     * @param token the cancellation token
     * @return a Mono of the successful response
     */
    public Mono<DataResponse> execute(DataRequest request,
                                      CancellationToken token) {
        requireNonNull(request, "request must be non-null");
        requireNonNull(token, "token must be non-null");
        return Mono.defer(() -> {
            transportManager.checkOpen();
            if (token.isCancellationRequested()) {
                return Mono.error(cancelled(request.getVerb() + " " +
                                            request.getUri()));
            }
            final OutgoingRequest outgoing = prepare(request);
            config.getBeforeRequest().ifPresent(h -> h.accept(outgoing));
            return send(outgoing, token);
        });
    }

    private Mono<DataResponse> send(OutgoingRequest outgoing,
                                    CancellationToken token) {
        LogUtil.logTrace(logger, () -> outgoing.getVerb() + " request: " +
                         outgoing.getUri());
        LogUtil.logContent(logger, "Request body", outgoing.getBody());

        Mono<DataResponse> exchange =
            Mono.defer(() -> transportManager.acquire().send(outgoing))
            .onErrorMap(t -> classify(t, outgoing));

        if (token.canBeCancelled()) {
            /*
             * The token goes first: if it is already cancelled, the
             * exchange is never subscribed to.
             */
            Mono<DataResponse> onCancel = token.whenCancelled()
                .then(Mono.error(() -> cancelled(outgoing.toString())));
            exchange = Mono.firstWithSignal(onCancel, exchange);
        }

        return exchange.flatMap(response -> {
            LogUtil.logTrace(logger, () -> "Request completed: " +
                             response.getStatusCode());
            LogUtil.logContent(logger, "Response body", response.getBody());
            config.getAfterResponse().ifPresent(h -> h.accept(response));
            if (!response.isSuccessStatusCode()) {
                return Mono.error(
                    new UnsuccessfulResponseException(response));
            }
            return Mono.just(response);
        });
    }

    /**
     * Assembles the outgoing request: resolved URI, driver and caller
     * headers, credentials, user agent and body.
     *
     * @param request the request
     * @return the outgoing request
     */
    OutgoingRequest prepare(DataRequest request) {
        OutgoingRequest outgoing = new OutgoingRequest(
            request, request.getVerb(), resolveUri(request.getUri()));
        HttpHeaders headers = outgoing.getHeaders();
        assembleHeaders(request, headers);

        AuthorizationProvider credentials = request.getCredentials();
        if (credentials == null) {
            credentials = config.getAuthorizationProvider();
        }
        if (credentials != null && !headers.contains(AUTHORIZATION)) {
            String authString = credentials.getAuthorizationString(request);
            if (authString != null) {
                headers.set(AUTHORIZATION, authString);
            }
        }
        if (!headers.contains(USER_AGENT)) {
            headers.set(USER_AGENT, userAgent);
        }
        outgoing.setBody(request.getBody());
        return outgoing;
    }

    /**
     * Adds the headers that describe the request itself: the accepted
     * types, If-Match when optimistic concurrency applies, then the
     * caller's headers, which are copied as they are and replace any of
     * the former with the same name. The parts of a batch carry exactly
     * these headers.
     *
     * @param request the request
     * @param headers the headers to add to
     */
    public void assembleHeaders(DataRequest request, HttpHeaders headers) {
        for (String type : request.getAcceptTypes()) {
            headers.add(ACCEPT, type);
        }
        if (requiresIfMatch(request)) {
            headers.set(IF_MATCH, ETAG_ANY);
        }
        for (Map.Entry<String, String> header :
                 request.getHeaders().entrySet()) {
            headers.set(header.getKey(), header.getValue());
        }
    }

    /**
     * Returns true if the request is sent with "If-Match: *": optimistic
     * concurrency was requested by the request or by the client, and the
     * verb is PUT, PATCH, MERGE or DELETE.
     *
     * @param request the request
     * @return true if the request carries If-Match
     */
    public boolean requiresIfMatch(DataRequest request) {
        return (request.getCheckOptimisticConcurrency() ||
                config.getCheckOptimisticConcurrency()) &&
            request.getVerb().isConcurrencyChecked();
    }

    /**
     * Resolves a request URI against the service URL of the client.
     *
     * @param uri the URI, absolute or relative
     * @return the absolute URI
     */
    public String resolveUri(String uri) {
        return resolveUri(config.getServiceURL(), uri);
    }

    /**
     * Resolves a URI against a service URL. Absolute http and https URIs
     * are returned as they are; a URI starting with "/" replaces the path
     * of the service URL; any other is appended to it.
     *
     * @param serviceURL the service URL, ending with "/"
     * @param uri the URI
     * @return the absolute URI
     */
    public static String resolveUri(URL serviceURL, String uri) {
        String lower = uri.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return uri;
        }
        if (uri.startsWith("/")) {
            return serviceURL.getProtocol() + "://" +
                serviceURL.getAuthority() + uri;
        }
        return serviceURL.toString() + uri;
    }

    private Throwable classify(Throwable t, OutgoingRequest outgoing) {
        if (t instanceof DataServiceException) {
            return t;
        }
        if (isTimeout(t)) {
            Duration timeout = TransportManager.effectiveTimeout(
                config.getRequestTimeout());
            return new RequestTimeoutException(
                timeout == null ? 0 : timeout.toMillis(),
                "Request timed out: " + outgoing, t);
        }
        LogUtil.logFine(logger, "Request failed: " + outgoing + ": " + t);
        return new TransportException("Request failed: " + outgoing, t);
    }

    private static boolean isTimeout(Throwable t) {
        for (Throwable cause = t; cause != null; cause = cause.getCause()) {
            if (cause instanceof ReadTimeoutException ||
                cause instanceof TimeoutException) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private static RequestCancelledException cancelled(String what) {
        return new RequestCancelledException("Request cancelled: " + what);
    }
}
