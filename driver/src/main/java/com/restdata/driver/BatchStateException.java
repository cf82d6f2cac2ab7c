/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * Thrown when a {@link Batch} is used in a way its state does not allow:
 * adding to or committing a batch that was already committed, nesting
 * batches, or awaiting the result of a batch that was closed before commit.
 */
public class BatchStateException extends DataServiceException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public BatchStateException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     * @param msg the message
     * @param cause the cause
     */
    public BatchStateException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
