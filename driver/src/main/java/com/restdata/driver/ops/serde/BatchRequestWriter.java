/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops.serde;

import static com.restdata.driver.util.HttpConstants.APPLICATION_HTTP;
import static com.restdata.driver.util.HttpConstants.BATCH_BOUNDARY_PREFIX;
import static com.restdata.driver.util.HttpConstants.BINARY;
import static com.restdata.driver.util.HttpConstants.BOUNDARY_PARAM;
import static com.restdata.driver.util.HttpConstants.CHANGESET_BOUNDARY_PREFIX;
import static com.restdata.driver.util.HttpConstants.CONTENT_ID;
import static com.restdata.driver.util.HttpConstants.CONTENT_LENGTH;
import static com.restdata.driver.util.HttpConstants.CONTENT_TRANSFER_ENCODING;
import static com.restdata.driver.util.HttpConstants.CONTENT_TYPE;
import static com.restdata.driver.util.HttpConstants.CRLF;
import static com.restdata.driver.util.HttpConstants.MULTIPART_MIXED;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.restdata.driver.ops.RestVerb;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequestEncoder;
import io.netty.handler.codec.http.HttpVersion;

/**
 * @hidden
 *
 * Writes the body of a batch request in the multipart/mixed format of the
 * OData batch protocol. Each read is a top-level application/http part.
 * Consecutive writes are grouped into one changeset, a nested
 * multipart/mixed part whose operations the service applies atomically.
 * Every operation is given a Content-ID, its position in the batch
 * counting from 1, used to match the responses. The request line, headers
 * and body of each operation are written with netty's HTTP request
 * encoder.
 * <p>
 * An example with a read followed by two writes:
 * <pre>
 * --batch_1
 * Content-Type: application/http
 * Content-Transfer-Encoding: binary
 * Content-ID: 1
 *
 * GET http://host/svc/Products(1) HTTP/1.1
 * Accept: application/json
 *
 * --batch_1
 * Content-Type: multipart/mixed; boundary=changeset_2
 *
 * --changeset_2
 * Content-Type: application/http
 * Content-Transfer-Encoding: binary
 * Content-ID: 2
 *
 * POST http://host/svc/Products HTTP/1.1
 * Content-Type: application/json
 * Content-Length: 15
 *
 * {"Name":"Milk"}
 * --changeset_2
 * ...
 * --changeset_2--
 * --batch_1--
 * </pre>
 */
public class BatchRequestWriter {

    private BatchRequestWriter() {}

    /**
     * Writes a batch with random boundaries.
     *
     * @param operations the operations, in order
     * @return the payload
     */
    public static Payload write(List<Operation> operations) {
        return write(operations, BATCH_BOUNDARY_PREFIX + UUID.randomUUID(),
                     CHANGESET_BOUNDARY_PREFIX);
    }

    static Payload write(List<Operation> operations,
                         String batchBoundary,
                         String changesetPrefix) {
        List<Group> groups = group(operations);
        ByteBuf buf = Unpooled.buffer();
        try {
            for (Group group : groups) {
                writeLine(buf, "--" + batchBoundary);
                if (!group.isChangeset()) {
                    int index = group.getIndexes().get(0);
                    writeOperation(buf, operations.get(index),
                                   contentIdOf(index));
                    continue;
                }
                String changesetBoundary = changesetPrefix + UUID.randomUUID();
                writeLine(buf, CONTENT_TYPE + ": " + MULTIPART_MIXED + "; " +
                          BOUNDARY_PARAM + "=" + changesetBoundary);
                writeLine(buf, "");
                for (int index : group.getIndexes()) {
                    writeLine(buf, "--" + changesetBoundary);
                    writeOperation(buf, operations.get(index),
                                   contentIdOf(index));
                }
                writeLine(buf, "--" + changesetBoundary + "--");
            }
            writeLine(buf, "--" + batchBoundary + "--");
            return new Payload(ByteBufUtil.getBytes(buf),
                               MULTIPART_MIXED + "; " + BOUNDARY_PARAM + "=" +
                               batchBoundary,
                               groups);
        } finally {
            buf.release();
        }
    }

    /**
     * Returns the Content-ID given to the operation at an index.
     *
     * @param index the zero based index of the operation
     * @return the Content-ID
     */
    public static String contentIdOf(int index) {
        return Integer.toString(index + 1);
    }

    /*
     * Reads are alone in their group, runs of consecutive writes share one
     */
    static List<Group> group(List<Operation> operations) {
        List<Group> groups = new ArrayList<>();
        List<Integer> writes = null;
        for (int i = 0; i < operations.size(); i++) {
            if (operations.get(i).getVerb().isWrite()) {
                if (writes == null) {
                    writes = new ArrayList<>();
                }
                writes.add(i);
                continue;
            }
            if (writes != null) {
                groups.add(new Group(true, writes));
                writes = null;
            }
            groups.add(new Group(false, Collections.singletonList(i)));
        }
        if (writes != null) {
            groups.add(new Group(true, writes));
        }
        return groups;
    }

    private static void writeOperation(ByteBuf buf,
                                       Operation op,
                                       String contentId) {
        writeLine(buf, CONTENT_TYPE + ": " + APPLICATION_HTTP);
        writeLine(buf, CONTENT_TRANSFER_ENCODING + ": " + BINARY);
        writeLine(buf, CONTENT_ID + ": " + contentId);
        writeLine(buf, "");
        encodeRequest(buf, op);
        /* the line break before the next delimiter is part of the delimiter */
        buf.writeCharSequence(CRLF, StandardCharsets.UTF_8);
    }

    /*
     * Request line, headers and body of an operation, written by the netty
     * HTTP codec
     */
    private static void encodeRequest(ByteBuf buf, Operation op) {
        byte[] body = op.getBody();
        FullHttpRequest request = new DefaultFullHttpRequest(
            HttpVersion.HTTP_1_1,
            HttpMethod.valueOf(op.getVerb().name()),
            op.getUri(),
            body == null ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(body),
            new DefaultHttpHeaders(false),
            new DefaultHttpHeaders(false));
        request.headers().set(op.getHeaders());
        if (body != null && !request.headers().contains(CONTENT_LENGTH)) {
            request.headers().set(CONTENT_LENGTH, body.length);
        }

        EmbeddedChannel channel = new EmbeddedChannel(new HttpRequestEncoder());
        try {
            channel.writeOutbound(request);
            ByteBuf encoded;
            while ((encoded = channel.readOutbound()) != null) {
                try {
                    buf.writeBytes(encoded);
                } finally {
                    encoded.release();
                }
            }
        } finally {
            channel.finishAndReleaseAll();
        }
    }

    private static void writeLine(ByteBuf buf, String line) {
        buf.writeCharSequence(line, StandardCharsets.UTF_8);
        buf.writeCharSequence(CRLF, StandardCharsets.UTF_8);
    }

    /**
     * One operation of a batch, as it is written: verb, absolute URI,
     * headers and body.
     */
    public static class Operation {
        private final RestVerb verb;
        private final String uri;
        private final HttpHeaders headers;
        private final byte[] body;

        public Operation(RestVerb verb,
                         String uri,
                         HttpHeaders headers,
                         byte[] body) {
            this.verb = verb;
            this.uri = uri;
            this.headers = headers;
            this.body = body;
        }

        public RestVerb getVerb() {
            return verb;
        }

        public String getUri() {
            return uri;
        }

        public HttpHeaders getHeaders() {
            return headers;
        }

        public byte[] getBody() {
            return body;
        }
    }

    /**
     * The operations sent as one top-level part: a single read, or the
     * writes of one changeset.
     */
    public static class Group {
        private final boolean changeset;
        private final List<Integer> indexes;

        Group(boolean changeset, List<Integer> indexes) {
            this.changeset = changeset;
            this.indexes = Collections.unmodifiableList(indexes);
        }

        public boolean isChangeset() {
            return changeset;
        }

        /**
         * @return the indexes of the operations, in order
         */
        public List<Integer> getIndexes() {
            return indexes;
        }

        @Override
        public String toString() {
            return (changeset ? "Changeset" : "Part") + indexes;
        }
    }

    /**
     * The written batch: body, the Content-Type carrying its boundary, and
     * the grouping of the operations into top-level parts.
     */
    public static class Payload {
        private final byte[] body;
        private final String contentType;
        private final List<Group> groups;

        Payload(byte[] body, String contentType, List<Group> groups) {
            this.body = body;
            this.contentType = contentType;
            this.groups = Collections.unmodifiableList(groups);
        }

        public byte[] getBody() {
            return body;
        }

        public String getContentType() {
            return contentType;
        }

        public List<Group> getGroups() {
            return groups;
        }
    }
}
