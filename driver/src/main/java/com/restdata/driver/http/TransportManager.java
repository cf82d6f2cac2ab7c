/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import com.restdata.driver.ClientClosedException;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.TransportException;
import com.restdata.driver.httpclient.HttpTransport;
import com.restdata.driver.httpclient.ReactorHttpClient;
import com.restdata.driver.httpclient.TransportFactory;
import com.restdata.driver.httpclient.TransportOptions;
import com.restdata.driver.util.ConcurrentUtil;
import com.restdata.driver.util.LogUtil;

/**
 * @hidden
 *
 * Owns the one {@link HttpTransport} of a client. The transport is built
 * by the first {@link #acquire} and returned to every later caller until
 * {@link #release}. Building, the check that precedes it and release all
 * run under one lock; the lock is never held while a request is in
 * flight.
 */
public class TransportManager {

    /**
     * Timeouts below this leave the timeout to the transport
     */
    static final Duration MIN_REQUEST_TIMEOUT = Duration.ofMillis(1);

    public enum State {
        UNINITIALIZED,
        TRANSPORT_ACQUIRED,
        DISPOSED
    }

    private final DataClientConfig config;
    private final Logger logger;
    private final ReentrantLock lock = new ReentrantLock();

    /* written under the lock, read without it */
    private volatile HttpTransport transport;
    private volatile State state = State.UNINITIALIZED;

    public TransportManager(DataClientConfig config, Logger logger) {
        this.config = requireNonNull(config, "config must be non-null");
        this.logger = requireNonNull(logger, "logger must be non-null");
    }

    /**
     * Returns the transport, building it on first use.
     *
     * @return the transport
     * @throws ClientClosedException if the transport was released
     */
    public HttpTransport acquire() {
        HttpTransport current = transport;
        if (current != null) {
            return current;
        }
        return ConcurrentUtil.synchronizedCall(lock, () -> {
            if (state == State.DISPOSED) {
                throw closed();
            }
            if (transport == null) {
                transport = createTransport();
                state = State.TRANSPORT_ACQUIRED;
            }
            return transport;
        });
    }

    /**
     * Closes the transport, if it was built. Later calls do nothing.
     */
    public void release() {
        ConcurrentUtil.synchronizedCall(lock, () -> {
            if (state == State.DISPOSED) {
                return;
            }
            state = State.DISPOSED;
            HttpTransport toClose = transport;
            transport = null;
            if (toClose != null) {
                LogUtil.logFine(logger, "Releasing HTTP transport");
                toClose.close();
            }
        });
    }

    /**
     * @throws ClientClosedException if the transport was released
     */
    public void checkOpen() {
        if (state == State.DISPOSED) {
            throw closed();
        }
    }

    public State getState() {
        return state;
    }

    public boolean isDisposed() {
        return state == State.DISPOSED;
    }

    /**
     * Returns the response timeout to give the transport, or null if the
     * configured timeout is below {@link #MIN_REQUEST_TIMEOUT}.
     *
     * @param requestTimeout the configured timeout
     * @return the timeout or null
     */
    static Duration effectiveTimeout(Duration requestTimeout) {
        if (requestTimeout == null ||
            requestTimeout.compareTo(MIN_REQUEST_TIMEOUT) < 0) {
            return null;
        }
        return requestTimeout;
    }

    private HttpTransport createTransport() {
        TransportOptions options = new TransportOptions(
            config.getServiceURL(),
            effectiveTimeout(config.getRequestTimeout()),
            config.getConnectionPoolConfig(),
            logger,
            config.getHttpClientCustomizer());
        TransportFactory factory = config.getTransportFactory();
        if (factory == null) {
            return ReactorHttpClient.create(options);
        }
        HttpTransport created = factory.create(options);
        if (created == null) {
            throw new TransportException(
                "TransportFactory returned a null transport");
        }
        LogUtil.logFine(logger, "Created HTTP transport with " +
                        factory.getClass().getName());
        return created;
    }

    private static ClientClosedException closed() {
        return new ClientClosedException("Client is closed");
    }
}
