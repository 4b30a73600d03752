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
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancelIsVisibleAcrossThreads() throws InterruptedException {
        CancellationToken token = CancellationToken.create();
        assertFalse(token.isCancelled());
        Thread t = new Thread(token::cancel);
        t.start();
        t.join();
        assertTrue(token.isCancelled());
        assertThrows(AlignmentCancelledException.class, () -> token.throwIfCancelled("grid alignment"));
    }

    @Test
    void expiredDeadlineCancels() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(-1));
        assertTrue(token.isCancelled());
        assertFalse(CancellationToken.withTimeout(Duration.ofHours(1)).isCancelled());
    }

    @Test
    void sharedTokenStaysActive() {
        CancellationToken none = CancellationToken.none();
        assertThrows(UnsupportedOperationException.class, none::cancel);
        assertFalse(none.isCancelled());
        assertDoesNotThrow(() -> none.throwIfCancelled("fit"));
    }
}
