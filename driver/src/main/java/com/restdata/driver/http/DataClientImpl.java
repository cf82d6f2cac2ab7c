/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.http;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import com.restdata.driver.AuthorizationProvider;
import com.restdata.driver.Batch;
import com.restdata.driver.CancellationToken;
import com.restdata.driver.ClientClosedException;
import com.restdata.driver.DataClient;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.MetadataCache;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.util.LogUtil;

import io.netty.util.internal.logging.InternalLoggerFactory;
import io.netty.util.internal.logging.JdkLoggerFactory;

/**
 * The {@link DataClient} created by
 * {@link com.restdata.driver.DataClientFactory}. It owns the
 * {@link TransportManager} of the client and routes requests to its
 * {@link RequestExecutor}.
 */
public class DataClientImpl implements DataClient {

    private final DataClientConfig config;
    private final Logger logger;
    private final TransportManager transportManager;
    private final RequestExecutor executor;
    private final AtomicBoolean isClosed = new AtomicBoolean(false);

    public DataClientImpl(DataClientConfig config) {
        configNettyLogging();
        this.config = requireNonNull(config, "config must be non-null");
        this.logger = getLogger(config);
        this.transportManager = new TransportManager(config, logger);
        this.executor = new RequestExecutor(config, transportManager, logger);
        LogUtil.logFine(logger, "Driver service URL: " +
                        config.getServiceURL());
    }

    /**
     * Returns the logger used for the driver. If no logger is specified
     * create one based on this class name.
     */
    private Logger getLogger(DataClientConfig cfg) {
        if (cfg.getLogger() != null) {
            return cfg.getLogger();
        }

        /*
         * The default logger logs at INFO. If this is too verbose users
         * must create a logger and pass it in.
         */
        return Logger.getLogger(getClass().getName());
    }

    /**
     * Configures the logging of Netty library.
     */
    private void configNettyLogging() {
        /*
         * Configure default Netty logging using Jdk Logger.
         */
        InternalLoggerFactory.setDefaultFactory(JdkLoggerFactory.INSTANCE);
    }

    @Override
    public CompletableFuture<DataResponse> execute(DataRequest request) {
        return execute(request, CancellationToken.NONE);
    }

    @Override
    public CompletableFuture<DataResponse> execute(DataRequest request,
                                                   CancellationToken token) {
        requireNonNull(request, "DataClient: request must be non-null");
        requireNonNull(token, "DataClient: token must be non-null");
        return executor.execute(request, token).toFuture();
    }

    @Override
    public Batch createBatch() {
        checkClient();
        return new BatchImpl(this);
    }

    @Override
    public DataClientConfig getConfig() {
        return config;
    }

    @Override
    public MetadataCache<?> getMetadataCache() {
        return config.getMetadataCache();
    }

    @Override
    public void close() {
        if (isClosed.compareAndSet(false, true)) {
            LogUtil.logFine(logger, "Closing client for " +
                            config.getServiceURL());
            transportManager.release();
            AuthorizationProvider ap = config.getAuthorizationProvider();
            if (ap != null) {
                ap.close();
            }
        }
    }

    /**
     * Ensures that the client is not closed.
     */
    void checkClient() {
        if (isClosed.get()) {
            throw new ClientClosedException("Client is closed");
        }
    }

    boolean isClosed() {
        return isClosed.get();
    }

    Logger getLogger() {
        return logger;
    }

    RequestExecutor getExecutor() {
        return executor;
    }

    /**
     * @hidden
     * For testing only
     */
    public TransportManager getTransportManager() {
        return transportManager;
    }
}
