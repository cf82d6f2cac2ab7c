/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops.serde;

import static com.restdata.driver.util.HttpConstants.BOUNDARY_PARAM;
import static com.restdata.driver.util.HttpConstants.CONTENT_ID;
import static com.restdata.driver.util.HttpConstants.CONTENT_TYPE;
import static com.restdata.driver.util.HttpConstants.MULTIPART_MIXED;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.restdata.driver.BatchResponseFormatException;
import com.restdata.driver.ops.DataResponse;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.DecoderResult;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseDecoder;
import io.netty.util.ReferenceCountUtil;

/**
 * @hidden
 *
 * Reads the multipart/mixed reply to a batch. The reply holds one
 * top-level part per part of the request: an application/http part with
 * the response to a read, or a nested multipart/mixed part with the
 * responses to the operations of a changeset. A service that rejects a
 * changeset as a whole answers it with a single application/http part.
 * <p>
 * The multipart framing is read here; each application/http part is
 * decoded with netty's HTTP codec, so Content-Length and chunked bodies
 * are handled as on the wire. Both CRLF and bare LF line breaks are
 * accepted. The body is handled as ISO-8859-1 so every byte maps to one
 * char and response bodies are returned unchanged.
 * <p>
 * If the envelope cannot be read, {@link #read} throws
 * {@link BatchResponseFormatException}. If one application/http part
 * cannot be read, that part carries the exception and the other parts are
 * returned.
 */
public class BatchResponseReader {

    private static final int MAX_INITIAL_LINE_LENGTH = 4096;
    private static final int MAX_HEADER_SIZE = 65536;
    private static final int MAX_CHUNK_SIZE = 65536;

    private BatchResponseReader() {}

    /**
     * Reads a batch reply.
     *
     * @param contentType the Content-Type of the reply
     * @param body the body of the reply
     * @return the top-level parts, in the order of the reply
     * @throws BatchResponseFormatException if the envelope cannot be read
     */
    public static List<Part> read(String contentType, byte[] body) {
        String boundary = boundaryOf(contentType);
        if (boundary == null) {
            throw new BatchResponseFormatException(
                "Batch response is not multipart/mixed or has no boundary: " +
                contentType);
        }
        String text = new String(body == null ? new byte[0] : body,
                                 StandardCharsets.ISO_8859_1);
        List<Part> parts = new ArrayList<>();
        for (String content : split(text, boundary)) {
            parts.add(readPart(content, true));
        }
        return parts;
    }

    /**
     * Returns the boundary parameter of a multipart/mixed content type, or
     * null if the type is something else or has no boundary.
     *
     * @param contentType the content type
     * @return the boundary or null
     */
    public static String boundaryOf(String contentType) {
        if (contentType == null) {
            return null;
        }
        String[] params = contentType.split(";");
        if (!params[0].trim().equalsIgnoreCase(MULTIPART_MIXED)) {
            return null;
        }
        for (int i = 1; i < params.length; i++) {
            String param = params[i].trim();
            int eq = param.indexOf('=');
            if (eq > 0 &&
                param.substring(0, eq).trim().equalsIgnoreCase(
                    BOUNDARY_PARAM)) {
                String value = param.substring(eq + 1).trim();
                if (value.length() >= 2 && value.startsWith("\"") &&
                    value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    /*
     * Splits a multipart body into the content of its parts. The line break
     * before a delimiter belongs to the delimiter. The preamble before the
     * first delimiter and the epilogue after the closing one are ignored.
     */
    static List<String> split(String text, String boundary) {
        final String delimiter = "--" + boundary;
        List<String> contents = new ArrayList<>();
        int pos;
        if (text.startsWith(delimiter)) {
            pos = 0;
        } else {
            pos = text.indexOf("\n" + delimiter);
            if (pos < 0) {
                throw new BatchResponseFormatException(
                    "Multipart delimiter not found: " + delimiter);
            }
            pos++;
        }
        while (true) {
            int afterDelimiter = pos + delimiter.length();
            if (text.startsWith("--", afterDelimiter)) {
                return contents;
            }
            int lineEnd = text.indexOf('\n', afterDelimiter);
            if (lineEnd < 0) {
                throw new BatchResponseFormatException(
                    "Truncated multipart body, no content after " +
                    delimiter);
            }
            int start = lineEnd + 1;
            int next = text.indexOf("\n" + delimiter, lineEnd);
            if (next < 0) {
                throw new BatchResponseFormatException(
                    "Truncated multipart body, closing delimiter missing: " +
                    delimiter + "--");
            }
            int end = next;
            if (end > start && text.charAt(end - 1) == '\r') {
                end--;
            }
            contents.add(end > start ? text.substring(start, end) : "");
            pos = next + 1;
        }
    }

    private static Part readPart(String content, boolean topLevel) {
        Section section = Section.of(content);
        final HttpHeaders mimeHeaders;
        try {
            mimeHeaders = parseHeaders(section.head);
        } catch (BatchResponseFormatException bfe) {
            return Part.failure(null, bfe);
        }
        String contentId = mimeHeaders.get(CONTENT_ID);
        String changesetBoundary = boundaryOf(mimeHeaders.get(CONTENT_TYPE));
        if (changesetBoundary != null) {
            if (!topLevel) {
                throw new BatchResponseFormatException(
                    "Changesets cannot be nested");
            }
            List<Part> nested = new ArrayList<>();
            for (String inner : split(section.body, changesetBoundary)) {
                nested.add(readPart(inner, false));
            }
            return Part.changeset(nested);
        }
        try {
            DataResponse response = readResponse(section.body);
            if (contentId == null) {
                contentId = response.getHeader(CONTENT_ID);
            }
            return Part.response(contentId, response);
        } catch (BatchResponseFormatException bfe) {
            return Part.failure(contentId, bfe);
        }
    }

    /*
     * HTTP/1.1 201 Created
     * Content-Type: application/json
     *
     * {...}
     *
     * The message is decoded by the netty HTTP codec. Closing the channel
     * ends a body that has neither a Content-Length nor chunked framing.
     */
    private static DataResponse readResponse(String message) {
        byte[] bytes = terminateHead(message)
            .getBytes(StandardCharsets.ISO_8859_1);
        EmbeddedChannel channel = new EmbeddedChannel(
            new HttpResponseDecoder(MAX_INITIAL_LINE_LENGTH,
                                    MAX_HEADER_SIZE,
                                    MAX_CHUNK_SIZE),
            new HttpObjectAggregator(bytes.length));
        final FullHttpResponse response;
        try {
            channel.writeInbound(Unpooled.wrappedBuffer(bytes));
            channel.finish();
            Object msg = channel.readInbound();
            if (!(msg instanceof FullHttpResponse)) {
                ReferenceCountUtil.release(msg);
                throw new BatchResponseFormatException(
                    "Incomplete HTTP response in batch response");
            }
            response = (FullHttpResponse) msg;
        } catch (DecoderException de) {
            throw new BatchResponseFormatException(
                "Invalid HTTP response in batch response: " +
                de.getMessage(), de);
        } finally {
            channel.finishAndReleaseAll();
        }

        try {
            DecoderResult result = response.decoderResult();
            if (result.isFailure()) {
                throw new BatchResponseFormatException(
                    "Invalid HTTP response in batch response: " +
                    result.cause().getMessage(), result.cause());
            }
            int status = response.status().code();
            if (status < 100 || status > 599) {
                throw new BatchResponseFormatException(
                    "Invalid status code in batch response: " + status);
            }
            String reason = response.status().reasonPhrase();
            return new DataResponse(status,
                                    reason.isEmpty() ? null : reason,
                                    response.headers(),
                                    ByteBufUtil.getBytes(response.content()));
        } finally {
            response.release();
        }
    }

    /*
     * A message that ends right after its status line or headers is given
     * the empty line that closes the header block.
     */
    private static String terminateHead(String message) {
        if (message.contains("\r\n\r\n") || message.contains("\n\n")) {
            return message;
        }
        return message.endsWith("\n") ? message + "\r\n" :
            message + "\r\n\r\n";
    }

    /*
     * The MIME headers of a part: Content-Type, Content-ID and the like
     */
    private static HttpHeaders parseHeaders(String block) {
        HttpHeaders headers = new DefaultHttpHeaders(false);
        for (String line : block.split("\n")) {
            line = stripCR(line);
            if (line.isEmpty()) {
                continue;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new BatchResponseFormatException(
                    "Invalid header line in batch response: " + line);
            }
            headers.add(line.substring(0, colon).trim(),
                        line.substring(colon + 1).trim());
        }
        return headers;
    }

    private static String stripCR(String line) {
        return line.endsWith("\r") ?
            line.substring(0, line.length() - 1) : line;
    }

    /*
     * Headers and body of a MIME part, split at the first empty line.
     * Without an empty line the whole text is headers.
     */
    private static class Section {
        final String head;
        final String body;

        private Section(String head, String body) {
            this.head = head;
            this.body = body;
        }

        static Section of(String text) {
            if (text.startsWith("\r\n")) {
                return new Section("", text.substring(2));
            }
            if (text.startsWith("\n")) {
                return new Section("", text.substring(1));
            }
            int crlf = text.indexOf("\r\n\r\n");
            int lf = text.indexOf("\n\n");
            if (crlf >= 0 && (lf < 0 || crlf <= lf)) {
                return new Section(text.substring(0, crlf),
                                   text.substring(crlf + 4));
            }
            if (lf >= 0) {
                return new Section(text.substring(0, lf),
                                   text.substring(lf + 2));
            }
            return new Section(text, "");
        }
    }

    /**
     * A part of a batch reply: a response, a part that could not be read,
     * or a changeset holding parts of the first two kinds.
     */
    public static class Part {
        private final String contentId;
        private final DataResponse response;
        private final BatchResponseFormatException failure;
        private final List<Part> parts;

        private Part(String contentId,
                     DataResponse response,
                     BatchResponseFormatException failure,
                     List<Part> parts) {
            this.contentId = contentId;
            this.response = response;
            this.failure = failure;
            this.parts = parts;
        }

        static Part response(String contentId, DataResponse response) {
            return new Part(contentId, response, null, null);
        }

        static Part failure(String contentId,
                            BatchResponseFormatException failure) {
            return new Part(contentId, null, failure, null);
        }

        static Part changeset(List<Part> parts) {
            return new Part(null, null, null,
                            Collections.unmodifiableList(parts));
        }

        public boolean isChangeset() {
            return parts != null;
        }

        /**
         * @return the Content-ID of the part, or null
         */
        public String getContentId() {
            return contentId;
        }

        /**
         * @return the response, or null for a changeset or a part that
         * could not be read
         */
        public DataResponse getResponse() {
            return response;
        }

        /**
         * @return the reason the part could not be read, or null
         */
        public BatchResponseFormatException getFailure() {
            return failure;
        }

        /**
         * @return the parts of a changeset, or null
         */
        public List<Part> getParts() {
            return parts;
        }

        @Override
        public String toString() {
            if (parts != null) {
                return "Changeset" + parts;
            }
            return "Part[" + contentId + ", " +
                (response != null ? response : failure) + "]";
        }
    }
}
