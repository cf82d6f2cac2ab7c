/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import com.restdata.driver.http.DataClientImpl;

/**
 * Factory class used to produce {@link DataClient} instances.
 */
public class DataClientFactory {

    /**
     * Creates a client for the service described by the configuration. The
     * configuration is copied. The application must invoke
     * {@link DataClient#close}, when it is done with the client, to free
     * up the resources associated with it.
     *
     * @param config the client configuration parameters
     *
     * @return a valid {@link DataClient} instance, ready for use
     *
     * @throws IllegalArgumentException if an illegal configuration parameter
     * is specified.
     *
     * @see DataClient#close
     */
    public static DataClient createClient(DataClientConfig config) {
        requireNonNull(
            config,
            "DataClientFactory.createClient: config cannot be null");
        return new DataClientImpl(config.clone());
    }
}
