package com.purchasingpower.blamelens.service.resolution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Cancellation Token Tests")
class CancellationTokenTest {

    @Test
    @DisplayName("Should run listeners once, including ones added after cancellation")
    void testListeners() {
        CancellationToken token = new CancellationToken();
        AtomicInteger runs = new AtomicInteger();

        token.onCancellationRequested(runs::incrementAndGet);
        assertFalse(token.isCancellationRequested());
        assertEquals(0, runs.get());

        token.cancel();
        token.cancel();
        assertTrue(token.isCancellationRequested());
        assertEquals(1, runs.get());

        token.onCancellationRequested(runs::incrementAndGet);
        assertEquals(2, runs.get());
    }

    @Test
    @DisplayName("Should hand out independent never-cancelled tokens")
    void testNone() {
        CancellationToken first = CancellationToken.none();
        first.cancel();

        assertFalse(CancellationToken.none().isCancellationRequested());
    }
}
