/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

/**
 * Thrown when no response arrived within the request timeout configured
 * with {@link DataClientConfig#setRequestTimeout}, or within the transport's
 * own timeout if none was configured.
 */
public class RequestTimeoutException extends TransportException {

    private static final long serialVersionUID = 1L;

    /**
     * @hidden
     */
    private final long timeoutMs;

    /**
     * @hidden
     * Internal use only.
     *
     * @param timeoutMs the timeout that was in effect, in milliseconds
     * @param msg the message string for the timeout
     * @param cause the cause of the exception
     */
    public RequestTimeoutException(long timeoutMs,
                                   String msg,
                                   Throwable cause) {
        super(msg, cause);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append(super.getMessage());
        if (timeoutMs != 0) {
            sb.append(" Timeout: ");
            sb.append(timeoutMs);
            sb.append("ms");
        }

        Throwable cause = getCause();
        if (cause != null) {
            sb.append("\nCaused by: ");
            sb.append(cause.getClass().getName());
            sb.append(": ");
            sb.append(cause.getMessage());
        }
        return sb.toString();
    }

    /**
     * Returns the timeout that was in effect for the operation.
     *
     * @return the timeout in milliseconds, 0 if the transport default was
     * in effect
     */
    public long getTimeoutMs() {
        return timeoutMs;
    }
}
