/*-
 * Copyright (c) 2011, 2025 Oracle and/or its affiliates. All rights reserved.
 *
 * Licensed under the Universal Permissive License v 1.0 as shown at
 *  https://oss.oracle.com/licenses/upl/
 */

package com.restdata.driver;

import java.util.concurrent.atomic.AtomicBoolean;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * A signal used to abort an operation. Pass the token to
 * {@link DataClient#execute(com.restdata.driver.ops.DataRequest,
 * CancellationToken)} or {@link Batch#commit(CancellationToken)} and call
 * {@link #cancel} from any thread. An exchange in flight is aborted and the
 * operation fails with {@link RequestCancelledException}; if the token was
 * cancelled before the operation started, nothing is sent.
 * <p>
 * A token may be shared by several operations and cancels all of them. It
 * cannot be reset.
 */
public final class CancellationToken {

    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Sinks.Empty<Void> signal = Sinks.empty();

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Requests cancellation. Calling this more than once has no further
     * effect.
     *
     * @throws IllegalStateException if called on {@link #NONE}
     */
    public void cancel() {
        if (!cancellable) {
            throw new IllegalStateException(
                "CancellationToken.NONE cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            signal.tryEmitEmpty();
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @return false for {@link #NONE}
     */
    public boolean canBeCancelled() {
        return cancellable;
    }

    /**
     * @hidden
     * @return a Mono that completes when the token is cancelled
     */
    public Mono<Void> whenCancelled() {
        return signal.asMono();
    }
}
