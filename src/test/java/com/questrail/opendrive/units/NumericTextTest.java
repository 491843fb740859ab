package com.questrail.opendrive.units;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class NumericTextTest
{
    @Test
    void parsesDecimalAndScientificNotation()
    {
        assertEquals(1.5, NumericText.parse("1.5"));
        assertEquals(-2000.0, NumericText.parse("-2e3"));
        assertEquals(0.5, NumericText.parse("+.5"));
        assertEquals(7.0, NumericText.parse("7."));
        assertEquals(1.0e-5, NumericText.parse("1.0E-5"));
        assertEquals(3.0, NumericText.parse(" 3 "));
    }

    @Test
    void parsesSchemaSpecialValues()
    {
        assertEquals(Double.POSITIVE_INFINITY, NumericText.parse("INF"));
        assertEquals(Double.POSITIVE_INFINITY, NumericText.parse("+INF"));
        assertEquals(Double.NEGATIVE_INFINITY, NumericText.parse("-INF"));
        assertTrue(Double.isNaN(NumericText.parse("NaN")));
    }

    @Test
    void rejectsNonNumericText()
    {
        for (String raw : new String[] { "", "abc", "1.0m", "1e", "0x10", "1,5", "Infinity", "--1" }) {
            assertThrows(NumberFormatException.class, () -> NumericText.parse(raw), raw);
        }
    }

    @Test
    void rejectsMagnitudeBeyondDoubleRange()
    {
        assertThrows(NumberFormatException.class, () -> NumericText.parse("1e400"));
    }

    @Test
    void formattedValuesParseBackToTheSameDouble()
    {
        double[] values = { 0.1, 1.0 / 3.0, -1.0e-300, Double.MIN_VALUE, 123456789.123, -0.0, 6.02214076e23 };
        for (double value : values) {
            assertEquals(value, NumericText.parse(NumericText.format(value)));
        }
    }

    @Test
    void formatsNonFiniteValuesAsSchemaTokens()
    {
        assertEquals("INF", NumericText.format(Double.POSITIVE_INFINITY));
        assertEquals("-INF", NumericText.format(Double.NEGATIVE_INFINITY));
        assertEquals("NaN", NumericText.format(Double.NaN));
    }

    @Test
    void parsesSignedIntegers()
    {
        assertEquals(3, NumericText.parseInt("+3"));
        assertEquals(-2, NumericText.parseInt("-2"));
        assertThrows(NumberFormatException.class, () -> NumericText.parseInt("1.0"));
    }
}
