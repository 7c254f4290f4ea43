package com.marketruns.common.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellsTest {

    @Nested
    @DisplayName("isMissing()")
    class MissingTests {

        @Test
        @DisplayName("null, blank and dataframe NaN markers are missing")
        void missingMarkers() {
            assertTrue(Cells.isMissing(null));
            assertTrue(Cells.isMissing("  "));
            assertTrue(Cells.isMissing("nan"));
            assertTrue(Cells.isMissing("NaN"));
            assertTrue(Cells.isMissing("None"));
        }

        @Test
        @DisplayName("zero is a value, not a missing marker")
        void zeroIsPresent() {
            assertFalse(Cells.isMissing("0"));
            assertFalse(Cells.isMissing("0.0"));
        }
    }

    @Nested
    @DisplayName("toDouble()")
    class DoubleTests {

        @Test
        void parsesNumbersAndBooleans() {
            assertEquals(4.25, Cells.toDouble("4.25"));
            assertEquals(1.0, Cells.toDouble("True"));
            assertEquals(0.0, Cells.toDouble("false"));
            assertNull(Cells.toDouble("nan"));
        }

        @Test
        void rejectsText() {
            assertThrows(IllegalArgumentException.class, () -> Cells.toDouble("abc"));
        }
    }

    @Nested
    @DisplayName("toInteger()")
    class IntegerTests {

        @Test
        @DisplayName("float-rendered integers are accepted")
        void floatRendered() {
            assertEquals(3, Cells.toInteger("3.0"));
            assertEquals(3, Cells.toInteger("3"));
        }

        @Test
        @DisplayName("fractional value is rejected")
        void fractional() {
            assertThrows(IllegalArgumentException.class, () -> Cells.toInteger("1.5"));
        }

        @Test
        void fallbackOnlyForMissing() {
            assertEquals(7, Cells.toInteger(null, 7));
            assertEquals(0, Cells.toInteger("0", 7));
        }
    }
}
