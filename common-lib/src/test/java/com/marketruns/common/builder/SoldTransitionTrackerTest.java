package com.marketruns.common.builder;

import com.marketruns.common.exception.StructuralIntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SoldTransitionTrackerTest {

    private final SoldTransitionTracker tracker = new SoldTransitionTracker();

    @Nested
    @DisplayName("transition detection")
    class DetectionTests {

        @Test
        @DisplayName("sold=[0,1,1] → sale only in the second period")
        void firstIncrease() {
            assertFalse(tracker.observe("A", 1, 0, false, "ctx"));
            assertTrue(tracker.observe("A", 1, 1, false, "ctx"));
            assertFalse(tracker.observe("A", 1, 1, false, "ctx"));
        }

        @Test
        @DisplayName("sell timestamp marks the sale even when sold was already 1")
        void timestampWins() {
            assertTrue(tracker.observe("A", 1, 1, true, "ctx"));
            assertFalse(tracker.observe("A", 1, 1, false, "ctx"));
        }

        @Test
        @DisplayName("running max is per round: a new round can sell again")
        void resetsPerRound() {
            assertTrue(tracker.observe("A", 1, 1, false, "ctx"));
            assertFalse(tracker.observe("A", 2, 0, false, "ctx"));
            assertTrue(tracker.observe("A", 2, 1, false, "ctx"));
        }

        @Test
        @DisplayName("players are tracked independently")
        void perPlayer() {
            assertTrue(tracker.observe("A", 1, 1, false, "ctx"));
            assertTrue(tracker.observe("B", 1, 1, false, "ctx"));
        }
    }

    @Nested
    @DisplayName("integrity violations")
    class ViolationTests {

        @Test
        @DisplayName("sold dropping back to 0 within a round")
        void decrease() {
            tracker.observe("A", 1, 1, false, "ctx");
            assertThrows(StructuralIntegrityException.class, () -> tracker.observe("A", 1, 0, false, "ctx"));
        }

        @Test
        @DisplayName("second timestamped sale within a round")
        void secondTransition() {
            tracker.observe("A", 1, 1, true, "ctx");
            assertThrows(StructuralIntegrityException.class, () -> tracker.observe("A", 1, 1, true, "ctx"));
        }

        @Test
        @DisplayName("sell timestamp with sold=0")
        void timestampWithoutSale() {
            StructuralIntegrityException e = assertThrows(StructuralIntegrityException.class,
                () -> tracker.observe("A", 1, 0, true, "session=s1 segment=x"));
            assertTrue(e.getMessage().startsWith("[session=s1 segment=x]"));
        }

        @Test
        @DisplayName("sold outside {0,1}")
        void outOfDomain() {
            assertThrows(StructuralIntegrityException.class, () -> tracker.observe("A", 1, 2, false, "ctx"));
        }
    }
}
