package com.tarterware.infrafinder.components;

import java.util.Set;

import com.tarterware.infrafinder.models.Availability;
import com.tarterware.infrafinder.models.AvailabilityDescriptor;
import com.tarterware.infrafinder.models.CanonicalSegment;
import com.tarterware.infrafinder.models.SegmentField;
import com.tarterware.infrafinder.models.ServiceCategory;
import com.tarterware.infrafinder.models.ServiceCategory.DescriptorSlot;
import com.tarterware.infrafinder.utilities.StringUtilities;

/**
 * Stateless translation of a matched segment's raw fields into an
 * {@link AvailabilityDescriptor} for one service category.
 */
public final class IndicatorMapper
{
    static final Set<String> TRUTHY_TOKENS = Set.of("S", "SIM", "Y", "1", "TRUE");

    static final Set<String> FALSY_TOKENS = Set.of("N", "NAO", "NÃO", "0", "FALSE");

    static final Set<String> NOT_APPLICABLE_TOKENS = Set.of("NÃO SE APLICA", "NAO SE APLICA", "N/A", "NA");

    static final String NO_COLLECTION_MARKER = "SEM COLETA";

    private IndicatorMapper()
    {
    }

    /**
     * Map a binary indicator value. Total: every input, including null, maps to exactly
     * one state.
     *
     * @param value Raw value; null means the column is absent.
     * @return AVAILABLE or UNAVAILABLE for recognized tokens, UNKNOWN for blank, and
     *         NOT_FOUND for anything else.
     */
    public static Availability mapBinaryIndicator(String value)
    {
        if (value == null)
        {
            return Availability.NOT_FOUND;
        }

        String token = StringUtilities.toToken(value);
        if (token.isEmpty())
        {
            return Availability.UNKNOWN;
        }
        if (TRUTHY_TOKENS.contains(token))
        {
            return Availability.AVAILABLE;
        }
        if (FALSY_TOKENS.contains(token))
        {
            return Availability.UNAVAILABLE;
        }
        return Availability.NOT_FOUND;
    }

    /**
     * Describe the availability of a category given the segment matched for it.
     *
     * @param category Service category.
     * @param segment  Matched segment, or null when nothing matched.
     * @return The descriptor; pass-through slots are null when nothing matched.
     */
    public static AvailabilityDescriptor mapIndicator(ServiceCategory category, CanonicalSegment segment)
    {
        AvailabilityDescriptor.AvailabilityDescriptorBuilder builder = AvailabilityDescriptor.builder();
        if (segment == null)
        {
            return builder.availability(Availability.NOT_FOUND).build();
        }

        builder.availability(resolveAvailability(category, segment));

        for (DescriptorSlot slot : category.getReportedSlots())
        {
            String value = resolvePassThrough(segment, category.getSlotSource(slot));
            switch (slot)
            {
            case TYPE:
                builder.type(value);
                break;
            case DATE:
                builder.date(value);
                break;
            case SCHEDULE:
                builder.schedule(value);
                break;
            case SHIFT:
                builder.shift(value);
                break;
            case DISTRICT:
                builder.district(value);
                break;
            case RESPONSIBLE_PARTY:
                builder.responsibleParty(value);
                break;
            }
        }

        return builder.build();
    }

    /**
     * The one default-resolution rule for pass-through fields on a matched segment:
     * the trimmed value when non-blank, otherwise the "not informed" sentinel.
     *
     * @param segment Matched segment.
     * @param field   Source field, or null when no column backs the slot.
     */
    static String resolvePassThrough(CanonicalSegment segment, SegmentField field)
    {
        String value = field == null ? null : segment.getField(field);
        return StringUtilities.isNullEmptyOrBlank(value) ? Availability.NOT_INFORMED : value.trim();
    }

    static Availability resolveAvailability(ServiceCategory category, CanonicalSegment segment)
    {
        switch (category)
        {
        case SELECTIVE_COLLECTION:
            return resolveSelectiveCollection(segment);
        case PAVING:
            return resolvePaving(segment);
        default:
            return mapBinaryIndicator(segment.getField(category.getIndicatorField()));
        }
    }

    /**
     * A concrete paving type implies pavement exists, even when the explicit indicator
     * is missing or malformed.
     */
    static Availability resolvePaving(CanonicalSegment segment)
    {
        Availability availability = mapBinaryIndicator(segment.getField(SegmentField.PAVING_INDICATOR));
        if (!availability.isDecisive() && !StringUtilities.isNullEmptyOrBlank(segment.getField(SegmentField.PAVING_TYPE)))
        {
            return Availability.AVAILABLE;
        }
        return availability;
    }

    static Availability resolveSelectiveCollection(CanonicalSegment segment)
    {
        String program = segment.getField(SegmentField.COLLECTION_PROGRAM);
        if (StringUtilities.toToken(program).contains(NO_COLLECTION_MARKER))
        {
            return Availability.UNAVAILABLE;
        }

        if (isMeaningful(program)
                || isMeaningful(segment.getField(SegmentField.COLLECTION_SHIFT))
                || isMeaningful(segment.getField(SegmentField.COLLECTION_DISTRICT))
                || isMeaningful(segment.getField(SegmentField.COLLECTION_COOPERATIVE)))
        {
            return Availability.AVAILABLE;
        }
        return Availability.NOT_FOUND;
    }

    private static boolean isMeaningful(String value)
    {
        String token = StringUtilities.toToken(value);
        return !token.isEmpty() && !NOT_APPLICABLE_TOKENS.contains(token);
    }
}
