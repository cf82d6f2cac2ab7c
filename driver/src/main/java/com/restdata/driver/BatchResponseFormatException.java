/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * Thrown when the reply to a batch cannot be read. If the multipart envelope
 * itself is unreadable the whole commit fails with this exception; if only
 * one sub-response is missing or malformed, the result for that request
 * alone carries it.
 */
public class BatchResponseFormatException extends BatchStateException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     * @param msg the message
     */
    public BatchResponseFormatException(String msg) {
        super(msg);
    }

    /**
     * @hidden
     * @param msg the message
     * @param cause the cause
     */
    public BatchResponseFormatException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
