package com.tarterware.infrafinder.utilities;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

public class DateUtilities
{
    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("dd/MM/yyyy"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd"));

    /**
     * Parse a survey date as found in the datasets.
     * 
     * @param value Raw value, e.g. "2024-03-15", "15/03/2024" or an ISO date-time.
     * @return The date, or null if the value is blank or in no known format.
     */
    public static LocalDate parseDate(String value)
    {
        if (StringUtilities.isNullEmptyOrBlank(value))
        {
            return null;
        }
        String trimmed = value.trim();

        for (DateTimeFormatter format : DATE_FORMATS)
        {
            try
            {
                return LocalDate.parse(trimmed, format);
            }
            catch (DateTimeParseException e)
            {
                // Try the next format.
            }
        }

        try
        {
            return LocalDateTime.parse(trimmed, DateTimeFormatter.ISO_LOCAL_DATE_TIME).toLocalDate();
        }
        catch (DateTimeParseException e)
        {
            // Fall through to the offset form.
        }

        try
        {
            return OffsetDateTime.parse(trimmed).toLocalDate();
        }
        catch (DateTimeParseException e)
        {
            return null;
        }
    }

    /**
     * Pick the more recent of two date values. Parsable dates compare
     * chronologically, a parsable date beats an unparsable one, and two unparsable
     * values compare as strings. Blank values never win over non-blank ones.
     * 
     * @param current Value held so far; may be null or blank.
     * @param candidate Incoming value; may be null or blank.
     * @return The value to keep.
     */
    public static String mostRecent(String current, String candidate)
    {
        if (StringUtilities.isNullEmptyOrBlank(candidate))
        {
            return current;
        }
        if (StringUtilities.isNullEmptyOrBlank(current))
        {
            return candidate;
        }

        LocalDate currentDate = parseDate(current);
        LocalDate candidateDate = parseDate(candidate);

        if (currentDate != null && candidateDate != null)
        {
            return candidateDate.isAfter(currentDate) ? candidate : current;
        }
        if (currentDate != null)
        {
            return current;
        }
        if (candidateDate != null)
        {
            return candidate;
        }
        return candidate.compareTo(current) > 0 ? candidate : current;
    }
}
