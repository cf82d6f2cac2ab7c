/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */
/**
 * Contains the classes describing requests to the data service and their
 * outcome: {@link com.restdata.driver.ops.DataRequest},
 * {@link com.restdata.driver.ops.DataResponse} and, for batches,
 * {@link com.restdata.driver.ops.BatchResult} with one
 * {@link com.restdata.driver.ops.ExecutionResult} per
 * {@link com.restdata.driver.ops.CorrelationToken}.
 */
package com.restdata.driver.ops;
