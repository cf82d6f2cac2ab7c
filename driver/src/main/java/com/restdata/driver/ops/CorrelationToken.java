/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops;

/**
 * Identifies a request added to a batch. The token is used to find the
 * result of that request once the batch is committed.
 */
public final class CorrelationToken {

    private final long batchId;
    private final int index;

    /**
     * @hidden
     * @param batchId the id of the batch the request was added to
     * @param index the position of the request in the batch
     */
    public CorrelationToken(long batchId, int index) {
        this.batchId = batchId;
        this.index = index;
    }

    /**
     * @hidden
     * @return the id of the batch
     */
    public long getBatchId() {
        return batchId;
    }

    /**
     * @return the zero based position of the request in its batch
     */
    public int getIndex() {
        return index;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CorrelationToken)) {
            return false;
        }
        CorrelationToken token = (CorrelationToken) other;
        return batchId == token.batchId && index == token.index;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(batchId) * 31 + index;
    }

    @Override
    public String toString() {
        return "CorrelationToken[" + batchId + ":" + index + "]";
    }
}
