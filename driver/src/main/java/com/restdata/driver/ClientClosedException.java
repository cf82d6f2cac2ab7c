/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * Thrown by any operation attempted on a {@link DataClient} after it was
 * closed. A closed client never opens a new transport.
 */
public class ClientClosedException extends DataServiceException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public ClientClosedException(String msg) {
        super(msg);
    }
}
