package io.github.kemics.ebay;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CallContextTest {

    @Test
    void backgroundHasNoDeadline() {
        CallContext ctx = CallContext.background();

        assertTrue(ctx.deadline().isEmpty());
        assertNull(ctx.remaining());
        assertFalse(ctx.isDone());
    }

    @Test
    void cancelMarksContextDone() {
        CallContext ctx = CallContext.background();
        ctx.cancel();
        ctx.cancel();

        assertTrue(ctx.isCanceled());
        assertTrue(ctx.isDone());
        TransportException ex = assertThrows(TransportException.class, () -> ctx.throwIfDone("GET x"));
        assertTrue(ex.isCanceled());
    }

    @Test
    void pastDeadlineIsExceeded() {
        CallContext ctx = CallContext.withDeadline(Instant.now().minusSeconds(1));

        assertTrue(ctx.isDeadlineExceeded());
        assertEquals(Duration.ZERO, ctx.remaining());
        TransportException ex = assertThrows(TransportException.class, () -> ctx.throwIfDone("GET x"));
        assertTrue(ex.isDeadlineExceeded());
    }

    @Test
    void childKeepsEarlierParentDeadline() {
        CallContext parent = CallContext.withTimeout(Duration.ofSeconds(1));
        CallContext child = parent.childWithTimeout(Duration.ofMinutes(5));

        assertEquals(parent.deadline(), child.deadline());
    }

    @Test
    void childUsesOwnTimeoutWhenEarlier() {
        CallContext parent = CallContext.background();
        CallContext child = parent.childWithTimeout(Duration.ofSeconds(2));

        assertTrue(child.deadline().isPresent());
        assertFalse(child.remaining().compareTo(Duration.ofSeconds(2)) > 0);
    }

    @Test
    void cancelingParentCancelsChild() {
        CallContext parent = CallContext.background();
        CallContext child = parent.childWithTimeout(Duration.ofMinutes(1));

        parent.cancel();

        assertTrue(child.isCanceled());
    }

    @Test
    void cancelingChildLeavesParentRunning() {
        CallContext parent = CallContext.background();
        CallContext child = parent.childWithTimeout(Duration.ofMinutes(1));

        child.cancel();

        assertFalse(parent.isCanceled());
    }

    @Test
    void expiredChildrenAreNotRetainedByParent() throws Exception {
        CallContext parent = CallContext.background();
        for (int i = 0; i < 10_000; i++) {
            parent.childWithTimeout(Duration.ofMillis(1));
        }
        Thread.sleep(20);

        CallContext live = parent.childWithTimeout(Duration.ofMinutes(1));

        assertEquals(1, parent.childCount());
        parent.cancel();
        assertTrue(live.isCanceled());
    }

    @Test
    void canceledChildDetachesFromParent() {
        CallContext parent = CallContext.background();
        CallContext child = parent.childWithTimeout(Duration.ofMinutes(1));
        assertEquals(1, parent.childCount());

        child.cancel();

        assertEquals(0, parent.childCount());
    }

    @Test
    void cancellationReachesGrandchildren() {
        CallContext parent = CallContext.background();
        CallContext grandchild = parent.childWithTimeout(Duration.ofMinutes(1)).childWithTimeout(Duration.ofMinutes(1));

        parent.cancel();

        assertTrue(grandchild.isCanceled());
        assertTrue(grandchild.cancellation().isDone());
    }

    @Test
    void childOfCanceledParentStartsCanceled() {
        CallContext parent = CallContext.background();
        parent.cancel();

        assertTrue(parent.childWithTimeout(Duration.ofMinutes(1)).isCanceled());
        assertEquals(0, parent.childCount());
    }
}
