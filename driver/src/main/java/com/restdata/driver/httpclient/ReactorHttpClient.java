/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.httpclient;

import static com.restdata.driver.util.HttpConstants.CONTENT_LENGTH;

import java.time.Duration;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.util.LogUtil;

import io.netty.channel.ChannelOption;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Internal use only, not meant for public usage can change in the future.
 * <p>
 * The default {@link HttpTransport}, using the reactor netty
 * {@link HttpClient}.
 * <p>
 * Each instance owns a dedicated {@link ConnectionProvider}, which is
 * disposed by {@link #close}. The event loop resources are the default ones
 * of reactor netty, shared with every other client in the process and
 * never disposed here.
 * <p>
 * Redirects are followed. A response timeout is applied if one is given;
 * when it elapses the exchange fails with
 * {@link io.netty.handler.timeout.ReadTimeoutException}.
 */
public class ReactorHttpClient implements HttpTransport {
    static final int DEFAULT_MAX_CHUNK_SIZE = 65536;
    static final int DEFAULT_MAX_INITIAL_LINE_LENGTH = 4096;
    static final int DEFAULT_MAX_HEADER_SIZE = 8192;

    private static final byte[] EMPTY = new byte[0];

    private final Logger logger;
    private final String name;
    private final Duration responseTimeout;
    private final boolean followRedirect;
    private final ConnectionPoolConfig connectionPoolConfig;
    private final ConnectionProvider connectionProvider;
    private final HttpClient httpClient;

    private ReactorHttpClient(Builder builder) {
        this.name = builder.name;
        this.logger = builder.logger;
        this.responseTimeout = builder.responseTimeout;
        this.followRedirect = builder.followRedirect;
        this.connectionPoolConfig = builder.config;

        connectionProvider = ConnectionProvider
            .builder(name + "-pool")
            .maxConnections(connectionPoolConfig.getMaxConnections())
            .pendingAcquireTimeout(
                connectionPoolConfig.getPendingAcquireTimeout())
            .pendingAcquireMaxCount(
                connectionPoolConfig.getMaxPendingAcquires())
            .maxIdleTime(connectionPoolConfig.getMaxIdleTime())
            .maxLifeTime(connectionPoolConfig.getMaxLifetime())
            .build();

        HttpClient client = HttpClient
            .create(connectionProvider)
            .followRedirect(followRedirect)
            // Decoder config
            .httpResponseDecoder(spec -> {
                return spec.maxChunkSize(builder.maxChunkSize)
                        .maxHeaderSize(builder.maxHeaderSize)
                        .maxInitialLineLength(builder.maxInitialLineLength);
            })
            .option(ChannelOption.SO_KEEPALIVE, true)
            .option(ChannelOption.TCP_NODELAY, true);

        if (responseTimeout != null) {
            client = client.responseTimeout(responseTimeout);
        }
        if (builder.customizer != null) {
            client = builder.customizer.apply(client);
            if (client == null) {
                connectionProvider.dispose();
                throw new IllegalArgumentException(
                    "HttpClient customizer returned null");
            }
        }
        httpClient = client;
        LogUtil.logFine(logger, "Created HTTP transport " + name +
                        " with " + connectionPoolConfig);
    }

    /**
     * Creates the default transport of a client from its options.
     *
     * @param options the options
     * @return a new transport
     */
    public static ReactorHttpClient create(TransportOptions options) {
        Builder builder = builder()
            .name(options.getServiceURL().getHost() + ":" +
                  options.getServiceURL().getPort())
            .connectionPoolConfig(options.getConnectionPoolConfig())
            .responseTimeout(options.getResponseTimeout().orElse(null))
            .logger(options.getLogger());
        options.getHttpClientCustomizer().ifPresent(builder::customizer);
        return builder.build();
    }

    /**
     * Send the Http request to the remote server and read the response
     * into memory.
     *
     * @param request the request to send
     * @return Mono of the response from the server
     */
    @Override
    public Mono<DataResponse> send(OutgoingRequest request) {
        final byte[] body = request.getBody();
        return httpClient.request(request.getVerb().getHttpMethod())
            .uri(request.getUri())
            .send((httpClientRequest, nettyOutbound) -> {
                httpClientRequest.headers(request.getHeaders());
                if (body != null) {
                    if (!request.getHeaders().contains(CONTENT_LENGTH)) {
                        httpClientRequest.header(CONTENT_LENGTH,
                                                 String.valueOf(body.length));
                    }
                    return nettyOutbound.sendByteArray(Mono.just(body));
                }
                return nettyOutbound;
            })
            .responseSingle((httpClientResponse, content) -> content
                .asByteArray()
                .defaultIfEmpty(EMPTY)
                .map(bytes -> new DataResponse(
                    httpClientResponse.status().code(),
                    httpClientResponse.status().reasonPhrase(),
                    httpClientResponse.responseHeaders(),
                    bytes)));
    }

    /**
     * Disposes the connection pool. Connections in use are closed.
     */
    @Override
    public void close() {
        LogUtil.logFine(logger, "Closing HTTP transport " + name);
        connectionProvider.dispose();
    }

    /**
     * @hidden
     * For testing only
     */
    public HttpClient getHttpClient() {
        return httpClient;
    }

    /**
     * @hidden
     * For testing only
     */
    public ConnectionProvider getConnectionProvider() {
        return connectionProvider;
    }

    /**
     * @hidden
     * For testing only
     */
    public Logger getLogger() {
        return logger;
    }

    /**
     * @hidden
     * For testing only
     */
    public String getName() {
        return name;
    }

    /**
     * @hidden
     * For testing only
     */
    public Duration getResponseTimeout() {
        return responseTimeout;
    }

    /**
     * @hidden
     * For testing only
     */
    public boolean getFollowRedirect() {
        return followRedirect;
    }

    /**
     * @hidden
     * For testing only
     */
    public ConnectionPoolConfig getConnectionPoolConfig() {
        return connectionPoolConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private String name = "restdata";
        private int maxInitialLineLength = DEFAULT_MAX_INITIAL_LINE_LENGTH;
        private int maxHeaderSize = DEFAULT_MAX_HEADER_SIZE;
        private int maxChunkSize = DEFAULT_MAX_CHUNK_SIZE;
        private Duration responseTimeout;
        private boolean followRedirect = true;
        private ConnectionPoolConfig config =
            ConnectionPoolConfig.builder().build();
        private UnaryOperator<HttpClient> customizer;
        private Logger logger =
            Logger.getLogger(ReactorHttpClient.class.getName());

        /**
         * Sets the name of the client, used to name its connection pool.
         *
         * @param name the name
         * @return this
         * @throws IllegalArgumentException If name is null or empty
         */
        public Builder name(String name) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("name is either null or " +
                    "empty");
            }
            this.name = name;
            return this;
        }

        /**
         * Set the maximum length that can be decoded for the HTTP response's
         * initial line. If zero default value is used.
         * Default to {@value DEFAULT_MAX_INITIAL_LINE_LENGTH}
         *
         * @param maxInitialLineLength the maximum initial line length
         * @return this
         * @throws IllegalArgumentException If maxInitialLineLength is negative
         */
        public Builder maxInitialLineLength(int maxInitialLineLength) {
            if (maxInitialLineLength < 0) {
                throw new IllegalArgumentException("maxInitialLineLength is " +
                    "negative");
            }
            if (maxInitialLineLength != 0) {
                this.maxInitialLineLength = maxInitialLineLength;
            }
            return this;
        }

        /**
         * Set the maximum header size that can be decoded for the HTTP
         * response. If zero default value is used.
         * Default to {@value DEFAULT_MAX_HEADER_SIZE}
         *
         * @param maxHeaderSize the maximum header size
         * @return this
         * @throws IllegalArgumentException If maxHeaderSize is negative
         */
        public Builder maxHeaderSize(int maxHeaderSize) {
            if (maxHeaderSize < 0) {
                throw new IllegalArgumentException("maxHeaderSize is negative");
            }
            if (maxHeaderSize != 0) {
                this.maxHeaderSize = maxHeaderSize;
            }
            return this;
        }

        /**
         * Set the maximum chunk size that can be decoded for the HTTP
         * response. If zero default value is used.
         * Default to {@value DEFAULT_MAX_CHUNK_SIZE}
         *
         * @param maxChunkSize the maximum chunk size
         * @return this
         * @throws IllegalArgumentException If maxChunkSize is negative
         */
        public Builder maxChunkSize(int maxChunkSize) {
            if (maxChunkSize < 0) {
                throw new IllegalArgumentException("maxChunkSize is negative");
            }
            if (maxChunkSize != 0) {
                this.maxChunkSize = maxChunkSize;
            }
            return this;
        }

        /**
         * Set the time to wait for a response. If null, the default of
         * reactor netty applies, which is no timeout.
         *
         * @param responseTimeout the timeout
         * @return this
         * @throws IllegalArgumentException If responseTimeout is negative
         */
        public Builder responseTimeout(Duration responseTimeout) {
            if (responseTimeout != null && responseTimeout.isNegative()) {
                throw new IllegalArgumentException("responseTimeout is " +
                    "negative");
            }
            this.responseTimeout = responseTimeout;
            return this;
        }

        /**
         * Sets whether redirects are followed. Default to true.
         *
         * @param followRedirect true to follow redirects
         * @return this
         */
        public Builder followRedirect(boolean followRedirect) {
            this.followRedirect = followRedirect;
            return this;
        }

        /**
         * sets the connection pool config
         *
         * @param config connection pool config
         * @return this
         */
        public Builder connectionPoolConfig(ConnectionPoolConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Sets a function applied to the configured {@link HttpClient}
         * before use, for settings this builder does not cover, such as a
         * proxy, SSL or wiretap.
         *
         * @param customizer the function
         * @return this
         */
        public Builder customizer(UnaryOperator<HttpClient> customizer) {
            this.customizer = customizer;
            return this;
        }

        /**
         * Set the logger to use
         *
         * @param logger logger
         * @return this
         */
        public Builder logger(Logger logger) {
            if (logger != null) {
                this.logger = logger;
            }
            return this;
        }

        public ReactorHttpClient build() {
            if (config == null) {
                config = ConnectionPoolConfig.builder().build();
            }
            return new ReactorHttpClient(this);
        }
    }
}
