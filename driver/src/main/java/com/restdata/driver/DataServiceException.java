/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * A base exception for the exceptions thrown by the driver. All of the
 * exceptions defined in this package extend this exception. The driver throws
 * Java exceptions such as {@link IllegalArgumentException} directly.
 * <p>
 * A failure is classified once, where it is detected, and reaches the
 * application as one of the subclasses below:
 * <ul>
 * <li>{@link TransportException}: the exchange failed on the wire</li>
 * <li>{@link UnsuccessfulResponseException}: the service answered with a
 * status outside of the 2xx range</li>
 * <li>{@link RequestCancelledException}: the caller cancelled</li>
 * <li>{@link ClientClosedException}: the client was already closed</li>
 * <li>{@link BatchStateException}: a batch was used out of order</li>
 * </ul>
 */
public class DataServiceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public DataServiceException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     *
     * @param msg the message
     * @param cause the cause
     */
    public DataServiceException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
