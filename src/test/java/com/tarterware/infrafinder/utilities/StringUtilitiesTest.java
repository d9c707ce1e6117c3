package com.tarterware.infrafinder.utilities;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringUtilitiesTest
{
    @Test
    void testIsNullEmptyOrBlank()
    {
        assertTrue(StringUtilities.isNullEmptyOrBlank(null));
        assertTrue(StringUtilities.isNullEmptyOrBlank(""));
        assertTrue(StringUtilities.isNullEmptyOrBlank(" \t"));
        assertFalse(StringUtilities.isNullEmptyOrBlank(" S "));
    }

    @Test
    void testNormalizeHeaderStripsByteOrderMark()
    {
        assertEquals("ID_BASE_TRECHO", StringUtilities.normalizeHeader("\uFEFFID_BASE_TRECHO"));
        assertEquals("IND_IP", StringUtilities.normalizeHeader("  IND_IP "));
        assertEquals("", StringUtilities.normalizeHeader(null));
    }

    @Test
    void testToToken()
    {
        assertEquals("SIM", StringUtilities.toToken("  sim "));
        assertEquals("NÃO", StringUtilities.toToken("não"));
        assertEquals("", StringUtilities.toToken(null));
    }

    @Test
    void testSanitizePostalCode()
    {
        assertEquals("30130010", StringUtilities.sanitizePostalCode("30130-010"));
        assertEquals("30130010", StringUtilities.sanitizePostalCode(" 30.130-010 "));
        assertNull(StringUtilities.sanitizePostalCode("3013001"));
        assertNull(StringUtilities.sanitizePostalCode("301300100"));
        assertNull(StringUtilities.sanitizePostalCode(null));
    }
}
