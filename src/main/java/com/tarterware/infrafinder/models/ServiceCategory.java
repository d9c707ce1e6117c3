package com.tarterware.infrafinder.models;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * A service reported by the lookup. Each category knows the dataset its segments come
 * from, the indicator field that drives its availability, the key it is published
 * under, and which pass-through slots it reports.
 */
public enum ServiceCategory
{
    LIGHTING("iluminacao", DatasetKind.LIGHTING, SegmentField.LIGHTING_INDICATOR),

    // The curb dataset has no type column, so a matched curb always reports the sentinel.
    CURB("meio_fio", DatasetKind.CURB, SegmentField.CURB_INDICATOR,
            DescriptorSlot.TYPE, null),

    PAVING("pavimentacao", DatasetKind.PAVING, SegmentField.PAVING_INDICATOR,
            DescriptorSlot.TYPE, SegmentField.PAVING_TYPE,
            DescriptorSlot.DATE, SegmentField.PAVING_DATE),

    WATER("rede_agua", DatasetKind.WATER, SegmentField.WATER_INDICATOR,
            DescriptorSlot.DATE, SegmentField.WATER_DATE),

    SEWAGE("rede_esgoto", DatasetKind.SEWAGE, SegmentField.SEWAGE_INDICATOR,
            DescriptorSlot.DATE, SegmentField.SEWAGE_DATE),

    // The electricity and telephony datasets carry no survey date.
    ELECTRICITY("rede_eletrica", DatasetKind.ELECTRICITY, SegmentField.ELECTRICITY_INDICATOR),

    TELEPHONY("telefone", DatasetKind.TELEPHONY, SegmentField.TELEPHONY_INDICATOR),

    // Availability comes from the collection fields, not from a binary indicator.
    SELECTIVE_COLLECTION("coleta_seletiva", DatasetKind.SELECTIVE_COLLECTION, null,
            DescriptorSlot.SCHEDULE, SegmentField.COLLECTION_PROGRAM,
            DescriptorSlot.SHIFT, SegmentField.COLLECTION_SHIFT,
            DescriptorSlot.DISTRICT, SegmentField.COLLECTION_DISTRICT,
            DescriptorSlot.RESPONSIBLE_PARTY, SegmentField.COLLECTION_COOPERATIVE);

    /**
     * Optional metadata carried next to the availability state.
     */
    public enum DescriptorSlot
    {
        TYPE,
        DATE,
        SCHEDULE,
        SHIFT,
        DISTRICT,
        RESPONSIBLE_PARTY
    }

    private final String responseKey;
    private final DatasetKind dataset;
    private final SegmentField indicatorField;
    private final Set<DescriptorSlot> reportedSlots;
    private final Map<DescriptorSlot, SegmentField> slotSources;

    ServiceCategory(String responseKey, DatasetKind dataset, SegmentField indicatorField, Object... slotsAndFields)
    {
        this.responseKey = responseKey;
        this.dataset = dataset;
        this.indicatorField = indicatorField;

        Set<DescriptorSlot> slots = EnumSet.noneOf(DescriptorSlot.class);
        Map<DescriptorSlot, SegmentField> sources = new EnumMap<>(DescriptorSlot.class);
        for (int i = 0; i < slotsAndFields.length; i += 2)
        {
            DescriptorSlot slot = (DescriptorSlot) slotsAndFields[i];
            slots.add(slot);
            if (slotsAndFields[i + 1] != null)
            {
                sources.put(slot, (SegmentField) slotsAndFields[i + 1]);
            }
        }
        this.reportedSlots = Collections.unmodifiableSet(slots);
        this.slotSources = Collections.unmodifiableMap(sources);
    }

    public String getResponseKey()
    {
        return responseKey;
    }

    public DatasetKind getDataset()
    {
        return dataset;
    }

    /**
     * @return the binary indicator field, or null for categories that derive their
     *         availability from other fields.
     */
    public SegmentField getIndicatorField()
    {
        return indicatorField;
    }

    public Set<DescriptorSlot> getReportedSlots()
    {
        return reportedSlots;
    }

    /**
     * @return the segment field feeding the slot, or null when the slot is reported but
     *         no dataset column backs it.
     */
    public SegmentField getSlotSource(DescriptorSlot slot)
    {
        return slotSources.get(slot);
    }
}
