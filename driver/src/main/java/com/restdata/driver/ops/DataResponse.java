/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.restdata.driver.util.HttpConstants;

import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.ReadOnlyHttpHeaders;

/**
 * A response received from the data service: status, reason phrase,
 * headers and the fully read body. Instances are immutable: the headers
 * are read-only and {@link #getBody} returns a copy.
 */
public class DataResponse {

    private static final byte[] EMPTY = new byte[0];

    private final int statusCode;
    private final String reasonPhrase;
    private final HttpHeaders headers;
    private final byte[] body;

    /**
     * @hidden
     * @param statusCode the status code
     * @param reasonPhrase the reason phrase, if null the standard phrase of
     * the status code is used
     * @param headers the headers, copied
     * @param body the body, copied, may be null
     */
    public DataResponse(int statusCode,
                        String reasonPhrase,
                        HttpHeaders headers,
                        byte[] body) {
        this.statusCode = statusCode;
        this.reasonPhrase = (reasonPhrase != null ? reasonPhrase :
            HttpResponseStatus.valueOf(statusCode).reasonPhrase());
        this.headers = readOnlyCopy(headers);
        this.body = (body == null ? EMPTY : body.clone());
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getReasonPhrase() {
        return reasonPhrase;
    }

    /**
     * @return the headers, read-only
     */
    public HttpHeaders getHeaders() {
        return headers;
    }

    /**
     * @param name the header name, matched without regard to case
     * @return the first value of the header or null
     */
    public String getHeader(String name) {
        return headers.get(name);
    }

    /**
     * @return a copy of the body, an empty array if the response had none
     */
    public byte[] getBody() {
        return body.clone();
    }

    /**
     * @return the body decoded as UTF-8
     */
    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return true if the status code is in the 2xx range
     */
    public boolean isSuccessStatusCode() {
        return HttpConstants.isSuccessStatus(statusCode);
    }

    private static HttpHeaders readOnlyCopy(HttpHeaders headers) {
        List<CharSequence> nameValuePairs = new ArrayList<>();
        if (headers != null) {
            for (Map.Entry<String, String> header : headers) {
                nameValuePairs.add(header.getKey());
                nameValuePairs.add(header.getValue());
            }
        }
        return new ReadOnlyHttpHeaders(
            false, nameValuePairs.toArray(new CharSequence[0]));
    }

    @Override
    public String toString() {
        return "DataResponse[" + statusCode + " " + reasonPhrase +
            ", " + body.length + " bytes]";
    }
}
