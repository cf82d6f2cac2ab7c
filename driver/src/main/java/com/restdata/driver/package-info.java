/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Contains the public API of the RestData driver: the configuration, the
 * {@link com.restdata.driver.DataClient} and {@link com.restdata.driver.Batch}
 * interfaces, credentials, the metadata cache and the exception classes.
 * Request, response and result classes are in the
 * <a href="{@docRoot}/com/restdata/driver/ops/package-summary.html#package.description">
 * ops package.
 * </a>
 * <p>
 * The overall flow of a driver application is:
 * <ol>
 * <li>Configure the client, including the URL of the service. The
 * configuration object, {@link com.restdata.driver.DataClientConfig}, has
 * additional configuration options.</li>
 * <li>Use the configuration object to obtain a
 * {@link com.restdata.driver.DataClient} instance from
 * {@link com.restdata.driver.DataClientFactory}.</li>
 * <li>Build {@link com.restdata.driver.ops.DataRequest}s and execute them
 * with the client, one at a time or collected in a
 * {@link com.restdata.driver.Batch}. Each execution returns a
 * {@link java.util.concurrent.CompletableFuture} that completes with the
 * response or fails with a
 * {@link com.restdata.driver.DataServiceException}.</li>
 * <li>Close the client when done to release its connections.</li>
 * </ol>
 * <p>
 * The driver uses {@link java.util.logging}. The logger may be set with
 * {@link com.restdata.driver.DataClientConfig#setLogger}; requests are
 * traced at FINE, their bodies at FINEST.
 */
package com.restdata.driver;
