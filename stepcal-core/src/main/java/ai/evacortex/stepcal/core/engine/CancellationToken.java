/*
 * StepCal — Staircase Profile Calibration Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.stepcal.core.engine;

import ai.evacortex.stepcal.core.exceptions.AlignmentCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag checked by the long running alignment loops.
 * May be cancelled from another thread; an optional deadline cancels implicitly.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(null);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Instant deadline;

    private CancellationToken(Instant deadline) {
        this.deadline = deadline;
    }

    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken(null);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(Instant.now().plus(timeout));
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("the shared no-op token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && Instant.now().isAfter(deadline));
    }

    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new AlignmentCancelledException(stage);
        }
    }
}
