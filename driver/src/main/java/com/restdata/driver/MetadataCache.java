/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import static com.restdata.driver.util.CheckNull.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import com.restdata.driver.util.ConcurrentUtil;

/**
 * A cache of parsed service metadata, keyed by a fingerprint of the service
 * URL or of the raw metadata document. The driver does not parse metadata;
 * the layer that does uses this cache so each document is parsed once for
 * all the clients sharing the cache.
 * <p>
 * A cache is shared by every client created from configurations holding
 * it, see {@link DataClientConfig#setMetadataCache}. Adding and clearing
 * entries are serialized by one lock; reading an entry that is present
 * takes no lock.
 *
 * @param <M> the type of the parsed model
 */
public class MetadataCache<M> {

    private static final char[] HEX_ARRAY = "0123456789abcdef".toCharArray();

    private final ConcurrentHashMap<String, M> entries =
        new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param fingerprint the fingerprint
     * @return the cached model, if any
     */
    public Optional<M> resolve(String fingerprint) {
        requireNonNull(fingerprint, "fingerprint must be non-null");
        return Optional.ofNullable(entries.get(fingerprint));
    }

    /**
     * Returns the cached model, running the loader and caching its result
     * if there is none. The loader runs under the cache lock, so a model is
     * loaded at most once however many threads miss at the same time.
     *
     * @param fingerprint the fingerprint
     * @param loader produces the model, must not return null
     * @return the cached model
     */
    public M getOrAdd(String fingerprint, Supplier<? extends M> loader) {
        requireNonNull(fingerprint, "fingerprint must be non-null");
        requireNonNull(loader, "loader must be non-null");
        M model = entries.get(fingerprint);
        if (model != null) {
            return model;
        }
        return ConcurrentUtil.synchronizedCall(lock, () -> {
            M existing = entries.get(fingerprint);
            if (existing != null) {
                return existing;
            }
            M loaded = requireNonNull(loader.get(),
                                      "loader returned null for " +
                                      fingerprint);
            entries.put(fingerprint, loaded);
            return loaded;
        });
    }

    /**
     * Removes every entry.
     */
    public void clear() {
        ConcurrentUtil.synchronizedCall(lock, () -> entries.clear());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns the fingerprint of a service URL. Surrounding white space and
     * trailing slashes are ignored, as is the case of the scheme and host.
     *
     * @param url the service URL
     * @return the fingerprint
     */
    public static String fingerprintOfUrl(String url) {
        requireNonNull(url, "url must be non-null");
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        int schemeEnd = normalized.indexOf("://");
        if (schemeEnd > 0) {
            int pathStart = normalized.indexOf('/', schemeEnd + 3);
            if (pathStart < 0) {
                pathStart = normalized.length();
            }
            normalized =
                normalized.substring(0, pathStart).toLowerCase(Locale.ROOT) +
                normalized.substring(pathStart);
        }
        return "url:" + sha256(normalized);
    }

    /**
     * Returns the fingerprint of a raw metadata document.
     *
     * @param metadata the document text
     * @return the fingerprint
     */
    public static String fingerprintOfMetadata(String metadata) {
        requireNonNull(metadata, "metadata must be non-null");
        return "metadata:" + sha256(metadata);
    }

    private static String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return getHex(md.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String getHex(byte bytes[]) {
        char[] hexChars = new char[bytes.length * 2];
        for (int j = 0; j < bytes.length; j++) {
            int v = bytes[j] & 0xFF;
            hexChars[j * 2] = HEX_ARRAY[v >>> 4];
            hexChars[j * 2 + 1] = HEX_ARRAY[v & 0x0F];
        }
        return new String(hexChars);
    }
}
