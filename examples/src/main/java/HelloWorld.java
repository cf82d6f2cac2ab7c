/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

import com.restdata.driver.Batch;
import com.restdata.driver.DataClient;
import com.restdata.driver.DataClientConfig;
import com.restdata.driver.DataClientFactory;
import com.restdata.driver.UnsuccessfulResponseException;
import com.restdata.driver.ops.BatchResult;
import com.restdata.driver.ops.CorrelationToken;
import com.restdata.driver.ops.DataRequest;
import com.restdata.driver.ops.DataResponse;
import com.restdata.driver.ops.RestVerb;
import com.restdata.driver.util.ConcurrentUtil;

/**
 * Reads an entity, then creates one and reads it back in a single batch.
 * <p>
 * To run:
 * <pre>
 *   java -cp .:restdata-driver-x.y.z.jar:lib/* HelloWorld
 *       http://localhost:8080/Northwind.svc [-batch]
 * </pre>
 */
public class HelloWorld {

    /* Name of the entity set */
    private static final String entitySet = "Customers";

    public static void main(String[] args) throws Exception {

        String endpoint = getEndpoint(args);
        System.out.println("Using service: " + endpoint);

        DataClientConfig config = new DataClientConfig(endpoint)
            .setAfterResponse(r -> System.out.println(
                "  <- " + r.getStatusCode() + " " + r.getReasonPhrase()));

        /* Be sure to close the client */
        try (DataClient client = DataClientFactory.createClient(config)) {
            if (isBatch(args)) {
                helloBatch(client);
            } else {
                helloWorld(client);
            }
        }
    }

    /**
     * Read one entity.
     */
    private static void helloWorld(DataClient client) {
        DataRequest get = DataRequest
            .builder(RestVerb.GET, entitySet + "('ALFKI')")
            .accept("application/json")
            .build();
        try {
            DataResponse response =
                ConcurrentUtil.awaitFuture(client.execute(get));
            System.out.println("Read " + response.getBodyAsString());
        } catch (UnsuccessfulResponseException ure) {
            System.out.println("Read failed with " + ure.getStatusCode() +
                               ": " + ure.getServiceMessage());
        }
    }

    /**
     * Create an entity and read it back in one round trip. The create is
     * sent in a changeset, the read after it.
     */
    private static void helloBatch(DataClient client) {
        try (Batch batch = client.createBatch()) {
            CorrelationToken create = batch.add(DataRequest
                .builder(RestVerb.POST, entitySet)
                .contentType("application/json")
                .accept("application/json")
                .body("{\"CustomerID\":\"HELLO\"," +
                      "\"CompanyName\":\"Hello World\"}")
                .build());
            CorrelationToken read = batch.add(DataRequest
                .builder(RestVerb.GET, entitySet + "('HELLO')")
                .accept("application/json")
                .build());

            BatchResult result = ConcurrentUtil.awaitFuture(batch.commit());
            System.out.println("Create: " + result.get(create));
            System.out.println("Read: " + result.get(read));
            if (result.get(read).isSuccess()) {
                System.out.println("Read " + result.get(read).getResponse()
                                   .getBodyAsString());
            }
        }
    }

    /** Get the endpoint from the arguments */
    private static String getEndpoint(String[] args) {
        if (args.length > 0) {
            return args[0];
        }

        System.err.println
            ("Usage: java -cp .:restdata-driver-x.y.z.jar:lib/* " +
             " HelloWorld <endpoint> [-batch]\n");
        System.exit(1);
        return null;
    }

    /** Return true if -batch is specified */
    private static boolean isBatch(String[] args) {
        if (args.length < 2) {
            return false;
        }
        return args[1].equalsIgnoreCase("-batch");
    }
}
