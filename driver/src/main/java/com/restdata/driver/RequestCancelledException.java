/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * Thrown when an operation was aborted through its
 * {@link CancellationToken}. No response is delivered for a cancelled
 * operation and it is not retried.
 */
public class RequestCancelledException extends DataServiceException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public RequestCancelledException(String msg) {
        super(msg);
    }
}
