/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * Thrown when the HTTP exchange could not be completed, for example because
 * the connection was refused or the host name could not be resolved. The
 * underlying cause is available from {@link #getCause}. The driver does not
 * retry.
 */
public class TransportException extends DataServiceException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public TransportException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     * @param msg the message
     * @param cause the cause
     */
    public TransportException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
