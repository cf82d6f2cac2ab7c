/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.util;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

/**
 * Internal use only
 *
 * Reads the error payload a data service returns with a non-success status.
 * Two shapes are recognized:
 * <pre>
 *  {"error": {"code": "...", "message": "..."}}
 *  {"odata.error": {"code": "...", "message": {"lang": "...", "value": "..."}}}
 * </pre>
 * @hidden
 */
public class JsonErrorParser {

    private static final JsonFactory factory = new JsonFactory();

    private JsonErrorParser() {}

    /**
     * Parses the body of an error response.
     *
     * @param body the response body, may be null
     * @return the error found, or null if the body does not hold a
     * recognized JSON error payload
     */
    public static ServiceError parse(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try (JsonParser parser = factory.createParser(body)) {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                return null;
            }
            while (parser.nextToken() == JsonToken.FIELD_NAME) {
                String name = parser.currentName();
                JsonToken token = parser.nextToken();
                if (("error".equals(name) || "odata.error".equals(name)) &&
                    token == JsonToken.START_OBJECT) {
                    return readError(parser);
                }
                parser.skipChildren();
            }
            return null;
        } catch (IOException ioe) {
            /* plain text or HTML error pages are common, not a failure */
            return null;
        }
    }

    private static ServiceError readError(JsonParser parser)
        throws IOException {

        String code = null;
        String message = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String name = parser.currentName();
            JsonToken token = parser.nextToken();
            if ("code".equals(name) && token.isScalarValue()) {
                code = parser.getText();
            } else if ("message".equals(name)) {
                if (token == JsonToken.START_OBJECT) {
                    message = readMessageValue(parser);
                } else if (token.isScalarValue()) {
                    message = parser.getText();
                } else {
                    parser.skipChildren();
                }
            } else {
                parser.skipChildren();
            }
        }
        if (code == null && message == null) {
            return null;
        }
        return new ServiceError(code, message);
    }

    /*
     * {"lang": "en-US", "value": "..."}
     */
    private static String readMessageValue(JsonParser parser)
        throws IOException {

        String value = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
            String name = parser.currentName();
            JsonToken token = parser.nextToken();
            if ("value".equals(name) && token.isScalarValue()) {
                value = parser.getText();
            } else {
                parser.skipChildren();
            }
        }
        return value;
    }

    /**
     * The code and message reported by the service. Either may be null.
     */
    public static class ServiceError {
        private final String code;
        private final String message;

        ServiceError(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public String toString() {
            return "ServiceError[code=" + code + ", message=" + message + "]";
        }
    }
}
