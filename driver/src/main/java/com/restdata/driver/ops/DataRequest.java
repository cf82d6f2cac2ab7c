/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops;

import static com.restdata.driver.util.CheckNull.requireNonEmpty;
import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import com.restdata.driver.AuthorizationProvider;
import com.restdata.driver.util.HttpConstants;

/**
 * An immutable description of one operation against the data service: the
 * verb, the target URI, the headers, an optional body, optional credentials,
 * whether optimistic concurrency is requested and the accepted content
 * types.
 * <p>
 * The URI may be absolute or relative to the service URL of the client that
 * executes the request. Instances are created with {@link #builder}:
 * <pre>
 *    DataRequest req = DataRequest.builder(RestVerb.PATCH, "Products(1)")
 *        .contentType("application/json")
 *        .body("{\"Name\":\"Milk\"}")
 *        .checkOptimisticConcurrency(true)
 *        .build();
 * </pre>
 */
public class DataRequest {

    private final RestVerb verb;
    private final String uri;
    private final Map<String, String> headers;
    private final byte[] body;
    private final AuthorizationProvider credentials;
    private final boolean checkOptimisticConcurrency;
    private final List<String> acceptTypes;

    private DataRequest(Builder builder) {
        this.verb = builder.verb;
        this.uri = builder.uri;
        this.headers = Collections.unmodifiableMap(
            new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
        this.credentials = builder.credentials;
        this.checkOptimisticConcurrency = builder.checkOptimisticConcurrency;
        this.acceptTypes = Collections.unmodifiableList(
            new ArrayList<>(builder.acceptTypes));
    }

    /**
     * Starts building a request.
     *
     * @param verb the verb
     * @param uri the target URI, absolute or relative to the service URL
     * @return a new builder
     * @throws IllegalArgumentException if the uri is null or empty
     */
    public static Builder builder(RestVerb verb, String uri) {
        return new Builder(verb, uri);
    }

    public RestVerb getVerb() {
        return verb;
    }

    public String getUri() {
        return uri;
    }

    /**
     * Returns the caller supplied headers, in the order they were added.
     *
     * @return an unmodifiable map of header name to value
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Returns the value of a header, matching the name without regard to
     * case.
     *
     * @param name the header name
     * @return the value, or null if the header is not set
     */
    public String getHeader(String name) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) {
                return e.getValue();
            }
        }
        return null;
    }

    /**
     * @return a copy of the body, or null if the request has none
     */
    public byte[] getBody() {
        return (body == null ? null : body.clone());
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * @return the credentials of this request, or null to use the ones of
     * the client
     */
    public AuthorizationProvider getCredentials() {
        return credentials;
    }

    public boolean getCheckOptimisticConcurrency() {
        return checkOptimisticConcurrency;
    }

    /**
     * @return the accepted content types, in order of preference
     */
    public List<String> getAcceptTypes() {
        return acceptTypes;
    }

    @Override
    public String toString() {
        return verb + " " + uri;
    }

    /**
     * Builder for {@link DataRequest}. A header name may be set once; names
     * are compared without regard to case.
     */
    public static class Builder {
        private final RestVerb verb;
        private final String uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private final Set<String> headerNames =
            new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        private final List<String> acceptTypes = new ArrayList<>();
        private byte[] body;
        private AuthorizationProvider credentials;
        private boolean checkOptimisticConcurrency;

        private Builder(RestVerb verb, String uri) {
            this.verb = requireNonNull(verb, "verb must be non-null");
            this.uri = requireNonEmpty(uri, "uri must be non-empty");
        }

        /**
         * Adds a header. The value is sent as is.
         *
         * @param name the header name
         * @param value the header value
         * @return this
         * @throws IllegalArgumentException if a header with the same name,
         * ignoring case, was already added
         */
        public Builder header(String name, String value) {
            requireNonEmpty(name, "header name must be non-empty");
            requireNonNull(value, "header value must be non-null");
            if (!headerNames.add(name)) {
                throw new IllegalArgumentException(
                    "Duplicate header: " + name);
            }
            headers.put(name, value);
            return this;
        }

        /**
         * Sets the Content-Type header.
         *
         * @param contentType the content type of the body
         * @return this
         */
        public Builder contentType(String contentType) {
            return header(HttpConstants.CONTENT_TYPE, contentType);
        }

        /**
         * Appends accepted content types.
         *
         * @param types the content types
         * @return this
         */
        public Builder accept(String... types) {
            for (String type : types) {
                acceptTypes.add(
                    requireNonEmpty(type, "accept type must be non-empty"));
            }
            return this;
        }

        /**
         * Sets the body. The array is copied.
         *
         * @param bytes the body
         * @return this
         */
        public Builder body(byte[] bytes) {
            this.body = (bytes == null ? null : Arrays.copyOf(bytes,
                                                              bytes.length));
            return this;
        }

        /**
         * Sets the body from a string, encoded as UTF-8.
         *
         * @param text the body
         * @return this
         */
        public Builder body(String text) {
            this.body = (text == null ? null :
                         text.getBytes(StandardCharsets.UTF_8));
            return this;
        }

        /**
         * Sets credentials for this request only, overriding the ones of
         * the client.
         *
         * @param credentials the credentials
         * @return this
         */
        public Builder credentials(AuthorizationProvider credentials) {
            this.credentials = credentials;
            return this;
        }

        /**
         * Requests optimistic concurrency. PUT, PATCH, MERGE and DELETE
         * requests are then sent with "If-Match: *".
         *
         * @param value true to request the check
         * @return this
         */
        public Builder checkOptimisticConcurrency(boolean value) {
            this.checkOptimisticConcurrency = value;
            return this;
        }

        public DataRequest build() {
            return new DataRequest(this);
        }
    }
}
