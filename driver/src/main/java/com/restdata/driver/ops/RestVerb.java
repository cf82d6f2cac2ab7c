/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops;

import io.netty.handler.codec.http.HttpMethod;

/**
 * The HTTP verbs a {@link DataRequest} may use.
 */
public enum RestVerb {

    /** Reads an entity, a collection or a function result */
    GET(false, false),

    /** Creates an entity or invokes an action */
    POST(true, false),

    /** Replaces an entity */
    PUT(true, true),

    /** Partially updates an entity */
    PATCH(true, true),

    /** Partially updates an entity, protocol versions before PATCH */
    MERGE(true, true),

    /** Deletes an entity */
    DELETE(true, true);

    private final boolean write;
    private final boolean concurrencyChecked;
    private final HttpMethod method;

    RestVerb(boolean write, boolean concurrencyChecked) {
        this.write = write;
        this.concurrencyChecked = concurrencyChecked;
        this.method = HttpMethod.valueOf(name());
    }

    /**
     * Returns true if requests with this verb change the state of the
     * service. Writes added to a batch are grouped into changesets.
     *
     * @return true if the verb is a write
     */
    public boolean isWrite() {
        return write;
    }

    /**
     * Returns true if this verb receives an If-Match header when optimistic
     * concurrency is requested.
     *
     * @return true for PUT, PATCH, MERGE and DELETE
     */
    public boolean isConcurrencyChecked() {
        return concurrencyChecked;
    }

    /**
     * @hidden
     * @return the netty method used on the wire
     */
    public HttpMethod getHttpMethod() {
        return method;
    }
}
