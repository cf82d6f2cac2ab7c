/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.ops.serde;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.restdata.driver.ops.RestVerb;
import com.restdata.driver.ops.serde.BatchRequestWriter.Group;
import com.restdata.driver.ops.serde.BatchRequestWriter.Operation;
import com.restdata.driver.ops.serde.BatchRequestWriter.Payload;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaders;
import org.junit.Test;

/**
 * Tests the multipart/mixed batch request format
 */
public class BatchRequestWriterTest {

    private static final String SVC = "http://localhost:8080/svc/";

    private static final Pattern CHANGESET_BOUNDARY =
        Pattern.compile("boundary=(changeset_[0-9a-f\\-]+)");

    @Test
    public void testGrouping() {
        List<Operation> ops = new ArrayList<>();
        for (RestVerb verb : new RestVerb[] {
                RestVerb.GET, RestVerb.POST, RestVerb.PUT, RestVerb.GET,
                RestVerb.DELETE, RestVerb.GET, RestVerb.GET,
                RestVerb.PATCH, RestVerb.MERGE}) {
            ops.add(op(verb, "Customers", null));
        }
        List<Group> groups = BatchRequestWriter.group(ops);
        assertEquals(6, groups.size());
        assertGroup(groups.get(0), false, 0);
        assertGroup(groups.get(1), true, 1, 2);
        assertGroup(groups.get(2), false, 3);
        assertGroup(groups.get(3), true, 4);
        assertGroup(groups.get(4), false, 5);
        assertGroup(groups.get(5), false, 6);

        groups = BatchRequestWriter.group(ops.subList(7, 9));
        assertEquals(1, groups.size());
        assertGroup(groups.get(0), true, 0, 1);

        assertTrue(BatchRequestWriter.group(new ArrayList<>()).isEmpty());
    }

    @Test
    public void testContentId() {
        assertEquals("1", BatchRequestWriter.contentIdOf(0));
        assertEquals("10", BatchRequestWriter.contentIdOf(9));
    }

    @Test
    public void testFormat() {
        HttpHeaders readHeaders = new DefaultHttpHeaders();
        readHeaders.add("Accept", "application/json");
        HttpHeaders writeHeaders = new DefaultHttpHeaders();
        writeHeaders.add("Content-Type", "application/json");

        List<Operation> ops = Arrays.asList(
            new Operation(RestVerb.GET, SVC + "Customers", readHeaders, null),
            new Operation(RestVerb.POST, SVC + "Customers", writeHeaders,
                          "{\"Name\":\"Milk\"}"
                          .getBytes(StandardCharsets.UTF_8)));

        Payload payload =
            BatchRequestWriter.write(ops, "batch_test", "changeset_");
        assertEquals("multipart/mixed; boundary=batch_test",
                     payload.getContentType());
        assertEquals(2, payload.getGroups().size());

        String text = new String(payload.getBody(), StandardCharsets.UTF_8);
        Matcher m = CHANGESET_BOUNDARY.matcher(text);
        assertTrue(text, m.find());
        String cs = m.group(1);

        String expected =
            "--batch_test\r\n" +
            "Content-Type: application/http\r\n" +
            "Content-Transfer-Encoding: binary\r\n" +
            "Content-ID: 1\r\n" +
            "\r\n" +
            "GET " + SVC + "Customers HTTP/1.1\r\n" +
            "Accept: application/json\r\n" +
            "\r\n" +
            "\r\n" +
            "--batch_test\r\n" +
            "Content-Type: multipart/mixed; boundary=" + cs + "\r\n" +
            "\r\n" +
            "--" + cs + "\r\n" +
            "Content-Type: application/http\r\n" +
            "Content-Transfer-Encoding: binary\r\n" +
            "Content-ID: 2\r\n" +
            "\r\n" +
            "POST " + SVC + "Customers HTTP/1.1\r\n" +
            "Content-Type: application/json\r\n" +
            "Content-Length: 15\r\n" +
            "\r\n" +
            "{\"Name\":\"Milk\"}\r\n" +
            "--" + cs + "--\r\n" +
            "--batch_test--\r\n";
        assertEquals(expected, text);
    }

    @Test
    public void testCallerContentLength() {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.add("Content-Length", "2");
        List<Operation> ops = Arrays.asList(
            new Operation(RestVerb.PUT, SVC + "Customers(1)", headers,
                          "{}".getBytes(StandardCharsets.UTF_8)));
        String text = new String(
            BatchRequestWriter.write(ops).getBody(), StandardCharsets.UTF_8);
        assertEquals(text.indexOf("Content-Length"),
                     text.lastIndexOf("Content-Length"));
    }

    @Test
    public void testRandomBoundaries() {
        List<Operation> ops = Arrays.asList(
            op(RestVerb.GET, "Customers", null),
            op(RestVerb.DELETE, "Customers(1)", null));
        Payload first = BatchRequestWriter.write(ops);
        Payload second = BatchRequestWriter.write(ops);
        String boundary =
            BatchResponseReader.boundaryOf(first.getContentType());
        assertNotNull(boundary);
        assertTrue(boundary.startsWith("batch_"));
        assertFalse(first.getContentType().equals(second.getContentType()));

        String text = new String(first.getBody(), StandardCharsets.UTF_8);
        assertTrue(text.startsWith("--" + boundary + "\r\n"));
        assertTrue(text.endsWith("--" + boundary + "--\r\n"));
        assertTrue(text.contains("Content-ID: 1\r\n"));
        assertTrue(text.contains("Content-ID: 2\r\n"));
    }

    private static Operation op(RestVerb verb, String uri, byte[] body) {
        return new Operation(verb, SVC + uri, new DefaultHttpHeaders(), body);
    }

    private static void assertGroup(Group group, boolean changeset,
                                    Integer... indexes) {
        assertEquals(group.toString(), changeset, group.isChangeset());
        assertEquals(Arrays.asList(indexes), group.getIndexes());
    }
}
