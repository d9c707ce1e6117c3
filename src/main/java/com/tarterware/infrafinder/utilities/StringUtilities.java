package com.tarterware.infrafinder.utilities;

import java.util.Locale;

public class StringUtilities
{
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Test if string is null, empty, or blank.
     * 
     * @param str String to be evaluated
     * @return true if the string is null, empty, or blank.
     */
    public static boolean isNullEmptyOrBlank(String str)
    {
        return str == null || str.trim().isEmpty();
    }

    /**
     * Trim a raw cell value, turning null into the empty string.
     * 
     * @param str Raw value.
     * @return Trimmed value, never null.
     */
    public static String normalizeValue(String str)
    {
        return str == null ? "" : str.trim();
    }

    /**
     * Normalize a header name: drop a leading byte order mark and surrounding blanks.
     * 
     * @param header Raw header as read from the file.
     * @return Cleaned header name.
     */
    public static String normalizeHeader(String header)
    {
        if (header == null)
        {
            return "";
        }
        String cleaned = header;
        if (!cleaned.isEmpty() && cleaned.charAt(0) == BYTE_ORDER_MARK)
        {
            cleaned = cleaned.substring(1);
        }
        return cleaned.trim();
    }

    /**
     * Canonical form used for token comparisons: trimmed and upper case.
     * 
     * @param str Value to normalize; null is treated as empty.
     * @return Upper-case trimmed token.
     */
    public static String toToken(String str)
    {
        return normalizeValue(str).toUpperCase(Locale.ROOT);
    }

    /**
     * Reduce a postal code (CEP) to its digits.
     * 
     * @param raw Postal code as typed, e.g. "30130-010".
     * @return The 8 digits, or null if the input does not contain exactly 8 digits.
     */
    public static String sanitizePostalCode(String raw)
    {
        if (raw == null)
        {
            return null;
        }
        String digits = raw.replaceAll("\\D", "");
        return digits.length() == 8 ? digits : null;
    }
}
