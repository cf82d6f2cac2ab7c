/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.httpclient;

import static com.restdata.driver.util.CheckNull.requireNonEmpty;
import static com.restdata.driver.util.CheckNull.requireNonNull;

import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.RestVerb;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;

/**
 * The request as it goes on the wire: absolute URI, every header the
 * driver added and the body. Unlike {@link DataRequest} it is mutable; the
 * pre-send hook of the client receives it and may change it.
 */
public class OutgoingRequest {

    private final DataRequest source;
    private RestVerb verb;
    private String uri;
    private final HttpHeaders headers = new DefaultHttpHeaders(false);
    private byte[] body;

    /**
     * @hidden
     * @param source the request this one was assembled from, may be null
     * for requests the driver makes on its own behalf
     * @param verb the verb
     * @param uri the absolute URI
     */
    public OutgoingRequest(DataRequest source, RestVerb verb, String uri) {
        this.source = source;
        this.verb = requireNonNull(verb, "verb must be non-null");
        this.uri = requireNonEmpty(uri, "uri must be non-empty");
    }

    /**
     * @return the request this one was assembled from, or null
     */
    public DataRequest getSource() {
        return source;
    }

    public RestVerb getVerb() {
        return verb;
    }

    public OutgoingRequest setVerb(RestVerb verb) {
        this.verb = requireNonNull(verb, "verb must be non-null");
        return this;
    }

    public String getUri() {
        return uri;
    }

    public OutgoingRequest setUri(String uri) {
        this.uri = requireNonEmpty(uri, "uri must be non-empty");
        return this;
    }

    /**
     * @return the headers, which may be modified in place
     */
    public HttpHeaders getHeaders() {
        return headers;
    }

    /**
     * @return the body, or null if there is none
     */
    public byte[] getBody() {
        return body;
    }

    public OutgoingRequest setBody(byte[] body) {
        this.body = body;
        return this;
    }

    @Override
    public String toString() {
        return verb + " " + uri;
    }
}
