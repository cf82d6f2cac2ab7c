/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.util.JsonErrorParser;
import com.restdata.driver.util.JsonErrorParser.ServiceError;

import io.netty.handler.codec.http.HttpHeaders;

/**
 * Thrown when the service answered with a status outside of the 2xx
 * range. The complete response is available, along with the error code and
 * message the service reported in its JSON error payload, if any.
 * <p>
 * Inside a committed batch a failed sub-request is reported with this
 * exception as its {@link com.restdata.driver.ops.ExecutionResult}, the
 * commit itself succeeds.
 */
public class UnsuccessfulResponseException extends DataServiceException {

    private static final long serialVersionUID = 1L;

    private final transient DataResponse response;
    private final String serviceCode;
    private final String serviceMessage;

    /**
     * @hidden
     * @param response the response received
     */
    public UnsuccessfulResponseException(DataResponse response) {
        this(response, JsonErrorParser.parse(response.getBody()));
    }

    private UnsuccessfulResponseException(DataResponse response,
                                          ServiceError error) {
        super(makeMessage(response, error));
        this.response = response;
        this.serviceCode = (error == null ? null : error.getCode());
        this.serviceMessage = (error == null ? null : error.getMessage());
    }

    private static String makeMessage(DataResponse response,
                                      ServiceError error) {
        StringBuilder sb = new StringBuilder();
        sb.append("Request failed with status ")
          .append(response.getStatusCode()).append(" ")
          .append(response.getReasonPhrase());
        if (error != null && error.getMessage() != null) {
            sb.append(": ").append(error.getMessage());
        }
        return sb.toString();
    }

    public DataResponse getResponse() {
        return response;
    }

    public int getStatusCode() {
        return response.getStatusCode();
    }

    public String getReasonPhrase() {
        return response.getReasonPhrase();
    }

    public HttpHeaders getHeaders() {
        return response.getHeaders();
    }

    public byte[] getBody() {
        return response.getBody();
    }

    /**
     * @return the error code from the service's error payload, or null
     */
    public String getServiceCode() {
        return serviceCode;
    }

    /**
     * @return the error message from the service's error payload, or null
     */
    public String getServiceMessage() {
        return serviceMessage;
    }
}
