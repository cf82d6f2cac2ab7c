/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.util;

import com.restdata.driver.DataClientConfig;

/**
 * Constants used for HTTP headers, content types and paths
 */
public class HttpConstants {

    /*
     * Header names
     */
    public static final String ACCEPT = "Accept";

    public static final String AUTHORIZATION = "Authorization";

    public static final String CONTENT_TYPE = "Content-Type";

    public static final String CONTENT_LENGTH = "Content-Length";

    public static final String USER_AGENT = "User-Agent";

    /**
     * The conditional header used for optimistic concurrency checks
     */
    public static final String IF_MATCH = "If-Match";

    /**
     * The entity tag that matches any current version of a resource
     */
    public static final String ETAG_ANY = "*";

    /**
     * Correlates a changeset part of a batch request with its response
     */
    public static final String CONTENT_ID = "Content-ID";

    public static final String CONTENT_TRANSFER_ENCODING =
        "Content-Transfer-Encoding";

    /*
     * Content type values
     */
    public static final String APPLICATION_HTTP = "application/http";

    public static final String MULTIPART_MIXED = "multipart/mixed";

    public static final String BINARY = "binary";

    public static final String BOUNDARY_PARAM = "boundary";

    /*
     * Boundary prefixes of the batch envelope and its changesets
     */
    public static final String BATCH_BOUNDARY_PREFIX = "batch_";

    public static final String CHANGESET_BOUNDARY_PREFIX = "changeset_";

    /**
     * The path segment, relative to the service URL, of batch requests
     */
    public static final String BATCH_PATH = "$batch";

    public static final String CRLF = "\r\n";

    /**
     * The full X.Y.Z version of the driver
     */
    public static final String DRIVER_VERSION = "1.0.0";

    public static final String userAgent = makeUserAgent();

    private static String makeUserAgent() {
        String os = System.getProperty("os.name");
        String osVersion = System.getProperty("os.version");
        String javaVersion = System.getProperty("java.version");
        String javaVmName = System.getProperty("java.vm.name");
        StringBuilder sb = new StringBuilder();
        sb.append("RestDataJavaDriver/").append(DRIVER_VERSION)
          .append(" (").append(os).append("/").append(osVersion)
          .append("; ").append(javaVersion).append("/").append(javaVmName)
          .append(")");
        return sb.toString();
    }

    /**
     * Returns the user agent for a client, including the extension set
     * with {@link DataClientConfig#setExtensionUserAgent}, if any.
     *
     * @param config the client configuration
     * @return the user agent string
     */
    public static String userAgent(DataClientConfig config) {
        String extension = config.getExtensionUserAgent();
        if (extension == null) {
            return userAgent;
        }
        return userAgent + " " + extension;
    }

    /**
     * Returns true if the status code is in the 2xx range.
     */
    public static boolean isSuccessStatus(int status) {
        return status >= 200 && status <= 299;
    }
}
