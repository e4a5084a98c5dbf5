package com.api.client.context;

import com.api.client.exception.RequestCancelledException;
import com.api.client.exception.RequestCancelledException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RequestContext Tests")
class RequestContextTest {

    @Nested
    @DisplayName("Background")
    class BackgroundTests {

        @Test
        @DisplayName("Background context is never done")
        void neverDone() {
            RequestContext ctx = RequestContext.background();
            assertFalse(ctx.isDone());
            assertNull(ctx.error());
            assertFalse(ctx.hasDeadline());
            assertEquals(Long.MAX_VALUE, ctx.remainingNanos());
            assertDoesNotThrow(ctx::throwIfDone);
        }

        @Test
        @DisplayName("Background context cannot be cancelled")
        void cannotCancel() {
            assertThrows(UnsupportedOperationException.class, () -> RequestContext.background().cancel());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancelTests {

        @Test
        @DisplayName("Cancel marks the context done with reason CANCELLED")
        void cancelSetsReason() {
            RequestContext ctx = RequestContext.withCancel();
            assertFalse(ctx.isDone());

            ctx.cancel();

            assertTrue(ctx.isDone());
            assertEquals(Reason.CANCELLED, ctx.error().getReason());
            assertEquals("context canceled", ctx.error().getMessage());
            RequestCancelledException e = assertThrows(RequestCancelledException.class, ctx::throwIfDone);
            assertEquals(Reason.CANCELLED, e.getReason());
        }

        @Test
        @DisplayName("Second cancel keeps the first reason")
        void cancelIsIdempotent() {
            RequestContext ctx = RequestContext.withTimeout(Duration.ZERO);
            assertTrue(ctx.isDone());
            ctx.cancel();
            assertEquals(Reason.DEADLINE_EXCEEDED, ctx.error().getReason());
        }

        @Test
        @DisplayName("Each call to error() returns a fresh exception")
        void freshErrors() {
            RequestContext ctx = RequestContext.withCancel();
            ctx.cancel();
            assertNotSame(ctx.error(), ctx.error());
        }

        @Test
        @DisplayName("Cancelling a parent cancels its children")
        void parentCancelsChildren() {
            RequestContext parent = RequestContext.withCancel();
            RequestContext child = parent.child();
            RequestContext grandChild = child.childWithTimeout(Duration.ofMinutes(1));

            parent.cancel();

            assertTrue(child.isDone());
            assertTrue(grandChild.isDone());
            assertEquals(Reason.CANCELLED, grandChild.error().getReason());
        }

        @Test
        @DisplayName("Cancelling a child leaves the parent live")
        void childDoesNotCancelParent() {
            RequestContext parent = RequestContext.withCancel();
            RequestContext child = parent.child();

            child.cancel();

            assertTrue(child.isDone());
            assertFalse(parent.isDone());
        }

        @Test
        @DisplayName("Child of an already cancelled parent starts done")
        void childOfDoneParent() {
            RequestContext parent = RequestContext.withCancel();
            parent.cancel();
            assertTrue(parent.child().isDone());
        }
    }

    @Nested
    @DisplayName("Deadlines")
    class DeadlineTests {

        @Test
        @DisplayName("Timeout expires with reason DEADLINE_EXCEEDED")
        void timeoutExpires() throws Exception {
            RequestContext ctx = RequestContext.withTimeout(Duration.ofMillis(200));
            assertTrue(ctx.hasDeadline());
            assertFalse(ctx.isDone());

            Thread.sleep(400);

            assertTrue(ctx.isDone());
            assertEquals(Reason.DEADLINE_EXCEEDED, ctx.error().getReason());
            assertTrue(ctx.remainingNanos() <= 0);
        }

        @Test
        @DisplayName("Deadline in the past is immediately done")
        void pastDeadline() {
            RequestContext ctx = RequestContext.withDeadline(Instant.now().minusSeconds(1));
            assertTrue(ctx.isDone());
            assertEquals(Reason.DEADLINE_EXCEEDED, ctx.error().getReason());
        }

        @Test
        @DisplayName("Child timeout cannot extend past the parent deadline")
        void childBoundedByParent() {
            RequestContext parent = RequestContext.withTimeout(Duration.ofMillis(200));
            RequestContext child = parent.childWithTimeout(Duration.ofMinutes(5));

            assertTrue(child.remainingNanos() <= parent.remainingNanos() + Duration.ofMillis(5).toNanos());
        }

        @Test
        @DisplayName("Child without its own timeout inherits the parent deadline")
        void childInheritsDeadline() {
            RequestContext parent = RequestContext.withTimeout(Duration.ofSeconds(10));
            RequestContext child = parent.child();

            assertTrue(child.hasDeadline());
            assertTrue(child.remainingNanos() <= Duration.ofSeconds(10).toNanos());
        }

        @Test
        @DisplayName("Null timeout is rejected")
        void nullTimeout() {
            assertThrows(NullPointerException.class, () -> RequestContext.withTimeout(null));
            assertThrows(NullPointerException.class, () -> RequestContext.withDeadline(null));
        }
    }
}
