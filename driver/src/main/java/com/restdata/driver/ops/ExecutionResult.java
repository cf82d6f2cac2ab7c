/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import com.restdata.driver.DataServiceException;
import com.restdata.driver.UnsuccessfulResponseException;

/**
 * The outcome of one request in a committed batch: either the response,
 * or the classified failure.
 */
public final class ExecutionResult {

    private final DataResponse response;
    private final DataServiceException failure;

    private ExecutionResult(DataResponse response,
                            DataServiceException failure) {
        this.response = response;
        this.failure = failure;
    }

    /**
     * @hidden
     * @param response the successful response
     * @return the result
     */
    public static ExecutionResult success(DataResponse response) {
        return new ExecutionResult(
            requireNonNull(response, "response must be non-null"), null);
    }

    /**
     * @hidden
     * @param failure the classified failure
     * @return the result
     */
    public static ExecutionResult failure(DataServiceException failure) {
        return new ExecutionResult(
            null, requireNonNull(failure, "failure must be non-null"));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * @return the response, or null if the request failed
     */
    public DataResponse getResponse() {
        return response;
    }

    /**
     * @return the failure, or null if the request succeeded
     */
    public DataServiceException getFailure() {
        return failure;
    }

    /**
     * Returns the status the service answered with. This is available for
     * successes and for {@link UnsuccessfulResponseException} failures.
     *
     * @return the status code, or 0 if no response was received
     */
    public int getStatusCode() {
        if (response != null) {
            return response.getStatusCode();
        }
        if (failure instanceof UnsuccessfulResponseException) {
            return ((UnsuccessfulResponseException) failure).getStatusCode();
        }
        return 0;
    }

    /**
     * @return the response
     * @throws DataServiceException the failure, if the request failed
     */
    public DataResponse getResponseOrThrow() {
        if (failure != null) {
            throw failure;
        }
        return response;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + response + "]" :
            "Failure[" + failure + "]";
    }
}
