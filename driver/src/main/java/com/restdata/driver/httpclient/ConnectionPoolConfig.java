/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver.httpclient;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.time.Duration;

/**
 * Settings of the connection pool of the default transport. Each client
 * owns one pool, created with the transport and disposed when the client
 * is closed.
 */
public class ConnectionPoolConfig {

    /** Default maximum number of connections of a pool */
    public static final int DEFAULT_MAX_CONNECTIONS = 100;

    /** Default wait for a pooled connection */
    public static final Duration DEFAULT_PENDING_ACQUIRE_TIMEOUT =
        Duration.ofSeconds(45);

    /** Default idle time after which a connection is closed */
    public static final Duration DEFAULT_MAX_IDLE_TIME = Duration.ofSeconds(60);

    /** Default time after which a connection is closed */
    public static final Duration DEFAULT_MAX_LIFETIME = Duration.ofMinutes(5);

    private final int maxConnections;
    private final int maxPendingAcquires;
    private final Duration pendingAcquireTimeout;
    private final Duration maxIdleTime;
    private final Duration maxLifetime;

    private ConnectionPoolConfig(Builder builder) {
        this.maxConnections = builder.maxConnections;
        this.maxPendingAcquires = builder.maxPendingAcquires;
        this.pendingAcquireTimeout = builder.pendingAcquireTimeout;
        this.maxIdleTime = builder.maxIdleTime;
        this.maxLifetime = builder.maxLifetime;
    }

    /**
     * @return the maximum number of connections of the pool
     */
    public int getMaxConnections() {
        return maxConnections;
    }

    /**
     * @return the maximum number of requests waiting for a connection, -1
     * if unbounded
     */
    public int getMaxPendingAcquires() {
        return maxPendingAcquires;
    }

    /**
     * @return how long a request waits for a connection before failing
     */
    public Duration getPendingAcquireTimeout() {
        return pendingAcquireTimeout;
    }

    /**
     * @return how long a connection may stay idle before it is closed
     */
    public Duration getMaxIdleTime() {
        return maxIdleTime;
    }

    /**
     * @return how long a connection may live before it is closed
     */
    public Duration getMaxLifetime() {
        return maxLifetime;
    }

    @Override
    public String toString() {
        return "ConnectionPoolConfig[maxConnections=" + maxConnections +
            ", maxPendingAcquires=" + maxPendingAcquires +
            ", pendingAcquireTimeout=" + pendingAcquireTimeout +
            ", maxIdleTime=" + maxIdleTime +
            ", maxLifetime=" + maxLifetime + "]";
    }

    /**
     * Builder
     * @return Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxConnections = DEFAULT_MAX_CONNECTIONS;
        private int maxPendingAcquires = -1;
        private Duration pendingAcquireTimeout =
            DEFAULT_PENDING_ACQUIRE_TIMEOUT;
        private Duration maxIdleTime = DEFAULT_MAX_IDLE_TIME;
        private Duration maxLifetime = DEFAULT_MAX_LIFETIME;

        /**
         * Set the maximum number of connections of the pool.
         * Default to {@value ConnectionPoolConfig#DEFAULT_MAX_CONNECTIONS}
         *
         * @param maxConnections the maximum number of connections
         * @return this
         * @throws IllegalArgumentException if maxConnections is not positive
         */
        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) {
                throw new IllegalArgumentException("maxConnections must be " +
                        "positive, provided value is " + maxConnections);
            }
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Set the maximum number of requests waiting for a connection.
         * Default to -1 which means the pending queue has no upper limit.
         *
         * @param maxPendingAcquires the maximum number of waiting requests
         * @return this
         * @throws IllegalArgumentException If maxPendingAcquires is zero
         * or less than -1
         */
        public Builder maxPendingAcquires(int maxPendingAcquires) {
            if (maxPendingAcquires != -1 && maxPendingAcquires <= 0) {
                throw new IllegalArgumentException("maxPendingAcquires must " +
                    "be positive or -1, provided value is " +
                    maxPendingAcquires);
            }
            this.maxPendingAcquires = maxPendingAcquires;
            return this;
        }

        /**
         * Set the time a request waits for a connection. When it elapses
         * the request fails with a timeout.
         *
         * @param timeout the wait
         * @return this
         * @throws IllegalArgumentException If timeout is not positive
         */
        public Builder pendingAcquireTimeout(Duration timeout) {
            this.pendingAcquireTimeout =
                requirePositive(timeout, "pendingAcquireTimeout");
            return this;
        }

        /**
         * Set the time after which an idle connection is closed. The check
         * is made when the connection is selected for use.
         *
         * @param maxIdleTime the idle time
         * @return this
         * @throws IllegalArgumentException If maxIdleTime is not positive
         */
        public Builder maxIdleTime(Duration maxIdleTime) {
            this.maxIdleTime = requirePositive(maxIdleTime, "maxIdleTime");
            return this;
        }

        /**
         * Set the time after which a connection is closed. The check is
         * made when the connection is selected for use.
         *
         * @param maxLifetime the lifetime
         * @return this
         * @throws IllegalArgumentException If maxLifetime is not positive
         */
        public Builder maxLifetime(Duration maxLifetime) {
            this.maxLifetime = requirePositive(maxLifetime, "maxLifetime");
            return this;
        }

        /**
         * Build the {@link ConnectionPoolConfig} instance
         *
         * @return new {@link ConnectionPoolConfig}
         */
        public ConnectionPoolConfig build() {
            return new ConnectionPoolConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            requireNonNull(value, name + " must be non-null");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be " +
                    "positive, provided value is " + value);
            }
            return value;
        }
    }
}
