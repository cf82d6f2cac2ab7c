/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.restdata.driver.httpclient.ConnectionPoolConfig;
import com.restdata.driver.httpclient.OutgoingRequest;
import com.restdata.driver.httpclient.TransportFactory;
import com.restdata.driver.ops.DataResponse;

import reactor.netty.http.client.HttpClient;

/**
 * A configuration object used to create a {@link DataClient}. Most of
 * the parameters are optional and have defaults; only the service URL is
 * required. The configuration is copied when a client is created, so later
 * changes do not affect existing clients.
 * <p>
 * Two settings may also be given as system properties, read when the
 * configuration is created:
 * <ul>
 * <li>{@value #REQUEST_TIMEOUT_PROPERTY}: the request timeout in
 * milliseconds</li>
 * <li>{@value #OPTIMISTIC_CONCURRENCY_PROPERTY}: true to request
 * optimistic concurrency for every request</li>
 * </ul>
 */
public class DataClientConfig implements Cloneable {

    /**
     * System property setting the request timeout, in milliseconds
     */
    public static final String REQUEST_TIMEOUT_PROPERTY =
        "com.restdata.driver.request.timeout";

    /**
     * System property turning on optimistic concurrency for all requests
     */
    public static final String OPTIMISTIC_CONCURRENCY_PROPERTY =
        "com.restdata.driver.optimistic.concurrency";

    private static final int MAX_EXTENSION_USER_AGENT = 64;

    /**
     * The URL of the service root, always ending with "/"
     */
    private final URL serviceURL;

    /**
     * The request timeout. Below one millisecond the transport default
     * applies.
     */
    private Duration requestTimeout = Duration.ZERO;

    private TransportFactory transportFactory;
    private UnaryOperator<HttpClient> httpClientCustomizer;
    private ConnectionPoolConfig connectionPoolConfig =
        ConnectionPoolConfig.builder().build();
    private AuthorizationProvider authProvider;
    private Consumer<OutgoingRequest> beforeRequest;
    private Consumer<DataResponse> afterResponse;
    private Pluralizer pluralizer = Pluralizer.NONE;
    private Logger logger;
    private boolean checkOptimisticConcurrency;
    private String extensionUserAgent;

    /*
     * Shared, not copied, by clone() so that every client created from
     * this configuration uses the same cache
     */
    private MetadataCache<?> metadataCache = new MetadataCache<>();

    /**
     * Specifies the endpoint of the data service. A fully specified
     * endpoint is of the format:
     * <pre>    http[s]://host:port/path/</pre>
     * This interface accepts portions of a fully specified endpoint, with
     * the syntax [http[s]://]host[:port][/path].
     * <p>
     * For example, these are valid endpoint arguments:
     * <ul>
     * <li>services.example.com</li>
     * <li>https://services.example.com:443/odata/</li>
     * <li>localhost:8080/Northwind</li>
     * <li>http://localhost/Northwind.svc</li>
     * </ul>
     * <p>
     * If the port is omitted, it defaults to 443, or to 8080 if the
     * protocol is http. If the protocol is omitted, the endpoint uses https
     * if the port is 443, and http in all other cases. The path is kept and
     * relative request URIs are resolved against it; a "/" is appended if
     * it does not end with one.
     *
     * @param endpoint identifies the service. This is a required parameter.
     *
     * @throws IllegalArgumentException if the endpoint is null or malformed.
     */
    public DataClientConfig(String endpoint) {
        super();
        this.serviceURL = createURL(endpoint);
        setConfigFromEnvironment();
    }

    /**
     * Specifies the URL of the service root.
     *
     * @param serviceURL the URL. Its path is kept, a "/" is appended if it
     * does not end with one.
     *
     * @throws IllegalArgumentException if the URL is null or does not use
     * http or https
     */
    public DataClientConfig(URL serviceURL) {
        super();
        if (serviceURL == null) {
            throw new IllegalArgumentException(
                "DataClientConfig: serviceURL must be non-null");
        }
        checkProtocol(serviceURL.getProtocol(), serviceURL.toString());
        this.serviceURL = makeURL(serviceURL.getProtocol(),
                                  serviceURL.getHost(),
                                  serviceURL.getPort() < 0 ?
                                  serviceURL.getDefaultPort() :
                                  serviceURL.getPort(),
                                  serviceURL.getPath());
        setConfigFromEnvironment();
    }

    /**
     * @hidden
     *
     * @param endpoint the endpoint to use
     * @return the constructed URL
     * Return a URL from an endpoint string
     */
    public static URL createURL(String endpoint) {
        if (endpoint == null || endpoint.trim().isEmpty()) {
            throw new IllegalArgumentException(
                "Endpoint must be non-null and non-empty");
        }
        endpoint = endpoint.trim();

        /* The defaults for protocol and port */
        String protocol = "https";
        int port = 443;
        String host = null;

        /* Split off the path, which may not contain ":" before the host */
        String path = "/";
        int schemeEnd = endpoint.indexOf("://");
        int pathStart = endpoint.indexOf('/',
                                         schemeEnd < 0 ? 0 : schemeEnd + 3);
        if (pathStart >= 0) {
            path = endpoint.substring(pathStart);
            endpoint = endpoint.substring(0, pathStart);
        }

        /* Possible formats are:
         * - host
         * - protocol://host
         * - host:port
         * - protocol://host:port
         */
        String[] parts = endpoint.split(":");
        switch (parts.length) {
            case 1:
                /* endpoint is just <host> */
                host = parts[0];
                break;
            case 2:
                /* Could be <protocol>://<host>, or could be <host>:<port> */
                if (parts[1].startsWith("//")) {
                    protocol = parts[0].toLowerCase(Locale.ROOT);
                    host = parts[1];
                    if (protocol.equals("http")) {
                        /* Override the default of 443 */
                        port = 8080;
                    }
                } else {
                    host = parts[0];
                    port = validatePort(parts[1], endpoint);
                    if (port != 443) {
                        /* Override the default of https */
                        protocol = "http";
                    }
                }
                break;
            case 3:
                /* the full <protocol>://<host>:<port> */
                protocol = parts[0].toLowerCase(Locale.ROOT);
                host = parts[1];
                port = validatePort(parts[2], endpoint);
                break;
            default:
                throw new IllegalArgumentException("Invalid endpoint: " +
                                                   endpoint);
        }

        /* Strip out any slashes if the format was protocol://host */
        if (host.startsWith("//")) {
            host = host.substring(2);
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("Invalid endpoint, missing " +
                                               "host: " + endpoint);
        }
        checkProtocol(protocol, endpoint);
        return makeURL(protocol, host, port, path);
    }

    private static URL makeURL(String protocol,
                               String host,
                               int port,
                               String path) {
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (!path.endsWith("/")) {
            path = path + "/";
        }
        try {
            return new URL(protocol, host, port, path);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException(e);
        }
    }

    private static void checkProtocol(String protocol, String endpoint) {
        if (!("http".equalsIgnoreCase(protocol) ||
              "https".equalsIgnoreCase(protocol))) {
            throw new IllegalArgumentException("Unknown protocol " +
                protocol + " in endpoint: " + endpoint);
        }
    }

    /*
     * Check that a port is a valid, positive integer.
     */
    private static int validatePort(String portString, String endpoint) {
        final int port;
        try {
            port = Integer.parseInt(portString);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid port value for " +
                                               "endpoint:" + endpoint, e);
        }
        if (port <= 0) {
            throw new IllegalArgumentException
                ("invalid port value of " + port + " for endpoint:" +
                 endpoint);
        }
        return port;
    }

    /**
     * Returns the URL of the service root, ending with "/".
     *
     * @return the URL.
     */
    public URL getServiceURL() {
        return serviceURL;
    }

    /**
     * Returns the configured request timeout. A value below one
     * millisecond means the transport's own default applies.
     *
     * @return the timeout
     */
    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Sets the time to wait for the response to a request, including each
     * batch. A value below one millisecond, the default, leaves the timeout
     * to the transport. The timeout is fixed when the client opens its
     * transport.
     *
     * @param timeout the timeout
     *
     * @return this
     *
     * @throws IllegalArgumentException if the timeout is null or negative
     */
    public DataClientConfig setRequestTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException(
                "Request timeout must be non-null and not negative");
        }
        this.requestTimeout = timeout;
        return this;
    }

    /**
     * Returns the transport factory, or null if the default transport is
     * used.
     *
     * @return the factory
     */
    public TransportFactory getTransportFactory() {
        return transportFactory;
    }

    /**
     * Sets a factory building the transport of the client, replacing the
     * default reactor netty transport. The factory is called once per
     * client, on first use.
     *
     * @param factory the factory, or null for the default transport
     *
     * @return this
     */
    public DataClientConfig setTransportFactory(TransportFactory factory) {
        this.transportFactory = factory;
        return this;
    }

    public UnaryOperator<HttpClient> getHttpClientCustomizer() {
        return httpClientCustomizer;
    }

    /**
     * Sets a function applied to the reactor netty {@link HttpClient} of
     * the default transport, to configure a proxy, SSL or wiretap. Ignored
     * when a transport factory is set.
     *
     * @param customizer the function, or null
     *
     * @return this
     */
    public DataClientConfig setHttpClientCustomizer(
        UnaryOperator<HttpClient> customizer) {

        this.httpClientCustomizer = customizer;
        return this;
    }

    public ConnectionPoolConfig getConnectionPoolConfig() {
        return connectionPoolConfig;
    }

    /**
     * Sets the connection pool settings of the default transport.
     *
     * @param poolConfig the settings
     *
     * @return this
     */
    public DataClientConfig setConnectionPoolConfig(
        ConnectionPoolConfig poolConfig) {

        requireNonNull(poolConfig,
                       "DataClientConfig.setConnectionPoolConfig: " +
                       "poolConfig must be non-null");
        this.connectionPoolConfig = poolConfig;
        return this;
    }

    /**
     * Returns the {@link AuthorizationProvider} used for requests that do
     * not carry their own credentials, or null if none is set.
     *
     * @return the provider
     */
    public AuthorizationProvider getAuthorizationProvider() {
        return authProvider;
    }

    /**
     * Sets the {@link AuthorizationProvider} used for requests that do not
     * carry their own credentials.
     *
     * @param provider the provider, or null
     *
     * @return this
     */
    public DataClientConfig setAuthorizationProvider(
        AuthorizationProvider provider) {

        this.authProvider = provider;
        return this;
    }

    /**
     * Returns the hook run before each request is sent.
     *
     * @return the hook, if one is set
     */
    public Optional<Consumer<OutgoingRequest>> getBeforeRequest() {
        return Optional.ofNullable(beforeRequest);
    }

    /**
     * Sets a hook run with each request after the driver assembled it and
     * before it is sent. The hook may change the request. An exception
     * thrown by the hook fails the request with that exception.
     *
     * @param hook the hook, or null to remove it
     *
     * @return this
     */
    public DataClientConfig setBeforeRequest(
        Consumer<OutgoingRequest> hook) {

        this.beforeRequest = hook;
        return this;
    }

    /**
     * Returns the hook run with each response.
     *
     * @return the hook, if one is set
     */
    public Optional<Consumer<DataResponse>> getAfterResponse() {
        return Optional.ofNullable(afterResponse);
    }

    /**
     * Sets a hook run with each response as received, before its status is
     * checked, so the hook also sees responses that fail the request. For a
     * batch the hook sees the response to the batch as a whole.
     *
     * @param hook the hook, or null to remove it
     *
     * @return this
     */
    public DataClientConfig setAfterResponse(Consumer<DataResponse> hook) {
        this.afterResponse = hook;
        return this;
    }

    public Pluralizer getPluralizer() {
        return pluralizer;
    }

    /**
     * Sets the strategy converting resource names between singular and
     * plural. The default, {@link Pluralizer#NONE}, leaves names unchanged.
     *
     * @param pluralizer the pluralizer
     *
     * @return this
     */
    public DataClientConfig setPluralizer(Pluralizer pluralizer) {
        requireNonNull(pluralizer,
                       "DataClientConfig.setPluralizer: pluralizer must " +
                       "be non-null");
        this.pluralizer = pluralizer;
        return this;
    }

    /**
     * Sets the Logger used for the driver.
     *
     * @param logger the Logger.
     *
     * @return this
     */
    public DataClientConfig setLogger(Logger logger) {
        requireNonNull(logger,
                       "DataClientConfig.setLogger: logger must be non-null");

        this.logger = logger;
        return this;
    }

    /**
     * Returns the Logger, or null if not configured by user.
     *
     * @return the Logger
     */
    public Logger getLogger() {
        return logger;
    }

    public boolean getCheckOptimisticConcurrency() {
        return checkOptimisticConcurrency;
    }

    /**
     * Requests optimistic concurrency for every PUT, PATCH, MERGE and
     * DELETE request of the client, in addition to requests that ask for
     * it themselves. Such requests are sent with "If-Match: *".
     *
     * @param value true to request the check for all requests
     *
     * @return this
     */
    public DataClientConfig setCheckOptimisticConcurrency(boolean value) {
        this.checkOptimisticConcurrency = value;
        return this;
    }

    /**
     * Returns the metadata cache shared by the clients created from this
     * configuration and its copies.
     *
     * @return the cache
     */
    public MetadataCache<?> getMetadataCache() {
        return metadataCache;
    }

    /**
     * Sets the metadata cache. Configurations sharing a cache instance
     * share parsed metadata.
     *
     * @param cache the cache
     *
     * @return this
     */
    public DataClientConfig setMetadataCache(MetadataCache<?> cache) {
        requireNonNull(cache,
                       "DataClientConfig.setMetadataCache: cache must be " +
                       "non-null");
        this.metadataCache = cache;
        return this;
    }

    /**
     * Returns the set extension to the user agent http header or null if
     * unset.
     *
     * @return the extension
     */
    public String getExtensionUserAgent() {
        return extensionUserAgent;
    }

    /**
     * Sets an extension to the user agent http header. Extension must be
     * up to 64 chars long.
     *
     * @param extensionUserAgent the extension, or null
     *
     * @return this
     */
    public DataClientConfig setExtensionUserAgent(String extensionUserAgent) {
        if (extensionUserAgent != null &&
            extensionUserAgent.length() > MAX_EXTENSION_USER_AGENT) {
            throw new IllegalArgumentException("User agent extension too " +
                "long, must be up to " + MAX_EXTENSION_USER_AGENT +
                " chars long: " + extensionUserAgent.length());
        }
        this.extensionUserAgent = extensionUserAgent;
        return this;
    }

    @Override
    public DataClientConfig clone() {
        try {
            DataClientConfig clone = (DataClientConfig) super.clone();
            return clone;
        } catch (CloneNotSupportedException neverHappens) {
            return null;
        }
    }

    private void setConfigFromEnvironment() {
        String timeoutProp = System.getProperty(REQUEST_TIMEOUT_PROPERTY);
        if (timeoutProp != null) {
            try {
                setRequestTimeout(
                    Duration.ofMillis(Long.parseLong(timeoutProp.trim())));
            } catch (IllegalArgumentException iae) {
                /* NumberFormatException is an IllegalArgumentException */
                Logger.getLogger(getClass().getName()).log(Level.WARNING,
                    "Invalid value for system property " +
                    REQUEST_TIMEOUT_PROPERTY + ": " + timeoutProp);
            }
        }

        String occProp = System.getProperty(OPTIMISTIC_CONCURRENCY_PROPERTY);
        if (occProp != null) {
            String value = occProp.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(value) || "1".equals(value) ||
                "on".equals(value)) {
                checkOptimisticConcurrency = true;
            }
        }
    }
}
