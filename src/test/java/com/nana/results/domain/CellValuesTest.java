package com.nana.results.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CellValuesTest {

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t"})
    @DisplayName("blank strings count as blank cells")
    void blankStrings(String value) {
        assertTrue(CellValues.isBlank(value));
        assertNull(CellValues.toOptionalNumber(value));
    }

    @Test
    @DisplayName("non-numeric text coerces to 0")
    void nonNumericText_isZero() {
        assertFalse(CellValues.isNumeric("AB"));
        assertEquals(0.0, CellValues.toNumber("AB"));
        assertEquals(0.0, CellValues.toOptionalNumber("AB"));
    }

    @Test
    @DisplayName("numeric text and numbers are read as doubles")
    void numericValues() {
        assertEquals(42.5, CellValues.toNumber(" 42.5 "));
        assertEquals(7.0, CellValues.toNumber(7));
        assertTrue(CellValues.isNumeric("1,200"));
        assertEquals(0.0, CellValues.toNumber(null));
    }

    @Test
    @DisplayName("integral numbers render without a fraction")
    void toText_integral() {
        assertEquals("1001", CellValues.toText(1001.0));
        assertEquals("12.5", CellValues.toText(12.5));
        assertEquals("abc", CellValues.toText("  abc "));
        assertEquals("", CellValues.toText(null));
    }
}
