/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.util;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods to facilitate Logging. All methods accept a null logger,
 * in which case nothing is logged.
 */
public class LogUtil {

    public static boolean isFineEnabled(Logger logger) {
        return isLoggable(logger, Level.FINE);
    }

    public static boolean isLoggable(Logger logger, Level level) {
        return (logger != null && logger.isLoggable(level));
    }

    public static void logWarning(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.WARNING, msg);
        }
    }

    public static void logFine(Logger logger, String msg) {
        if (logger != null) {
            logger.log(Level.FINE, msg);
        }
    }

    /**
     * Trace == FINE. The message is only built if FINE is enabled.
     */
    public static void logTrace(Logger logger, Supplier<String> msg) {
        if (isFineEnabled(logger)) {
            logger.log(Level.FINE, msg.get());
        }
    }

    /**
     * Content tracing of request and response bodies, logged at FINEST.
     */
    public static void logContent(Logger logger, String what, byte[] content) {
        if (content == null || content.length == 0 ||
            !isLoggable(logger, Level.FINEST)) {
            return;
        }
        logger.log(Level.FINEST, what + " content:" +
                   System.lineSeparator() +
                   new String(content, StandardCharsets.UTF_8));
    }
}
