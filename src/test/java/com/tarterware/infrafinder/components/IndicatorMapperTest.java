package com.tarterware.infrafinder.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.EnumMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.tarterware.infrafinder.models.Availability;
import com.tarterware.infrafinder.models.AvailabilityDescriptor;
import com.tarterware.infrafinder.models.CanonicalSegment;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.SegmentField;
import com.tarterware.infrafinder.models.ServiceCategory;

import utils.TestUtils;

class IndicatorMapperTest
{
    private static CanonicalSegment segmentWith(Object... fieldsAndValues)
    {
        Map<SegmentField, String> fields = new EnumMap<>(SegmentField.class);
        for (int i = 0; i < fieldsAndValues.length; i += 2)
        {
            fields.put((SegmentField) fieldsAndValues[i], (String) fieldsAndValues[i + 1]);
        }
        return TestUtils.segment("1", "LINESTRING (0 0, 1 0)", fields, DatasetKind.values());
    }

    @Test
    void testBinaryIndicatorTokens()
    {
        for (String value : new String[] { "S", "sim", " Sim ", "y", "1", "true", "TRUE" })
        {
            assertEquals(Availability.AVAILABLE, IndicatorMapper.mapBinaryIndicator(value), value);
        }
        for (String value : new String[] { "N", "nao", "Não", "NÃO", "0", "false" })
        {
            assertEquals(Availability.UNAVAILABLE, IndicatorMapper.mapBinaryIndicator(value), value);
        }
    }

    @Test
    void testBinaryIndicatorBlankAbsentAndUnknown()
    {
        assertEquals(Availability.UNKNOWN, IndicatorMapper.mapBinaryIndicator(""));
        assertEquals(Availability.UNKNOWN, IndicatorMapper.mapBinaryIndicator("   "));
        assertEquals(Availability.NOT_FOUND, IndicatorMapper.mapBinaryIndicator(null));
        assertEquals(Availability.NOT_FOUND, IndicatorMapper.mapBinaryIndicator("talvez"));
        assertEquals(Availability.NOT_FOUND, IndicatorMapper.mapBinaryIndicator("2"));
    }

    @Test
    void testNoMatchIsNotFoundWithoutSlots()
    {
        for (ServiceCategory category : ServiceCategory.values())
        {
            AvailabilityDescriptor descriptor = IndicatorMapper.mapIndicator(category, null);
            assertEquals(Availability.NOT_FOUND, descriptor.getAvailability());
            assertNull(descriptor.getType());
            assertNull(descriptor.getDate());
            assertNull(descriptor.getSchedule());
        }
    }

    @Test
    void testLightingReportsOnlyAvailability()
    {
        AvailabilityDescriptor descriptor = IndicatorMapper.mapIndicator(ServiceCategory.LIGHTING,
                segmentWith(SegmentField.LIGHTING_INDICATOR, "S", SegmentField.PAVING_DATE, "2020-01-01"));

        assertEquals(Availability.AVAILABLE, descriptor.getAvailability());
        assertNull(descriptor.getDate());
        assertNull(descriptor.getType());
    }

    @Test
    void testCurbTypeIsAlwaysNotInformed()
    {
        AvailabilityDescriptor descriptor = IndicatorMapper.mapIndicator(ServiceCategory.CURB,
                segmentWith(SegmentField.CURB_INDICATOR, "N"));

        assertEquals(Availability.UNAVAILABLE, descriptor.getAvailability());
        assertEquals(Availability.NOT_INFORMED, descriptor.getType());
    }

    @Test
    void testPavingTypeImpliesAvailability()
    {
        AvailabilityDescriptor fromType = IndicatorMapper.mapIndicator(ServiceCategory.PAVING,
                segmentWith(SegmentField.PAVING_INDICATOR, "", SegmentField.PAVING_TYPE, " ASFALTO "));
        assertEquals(Availability.AVAILABLE, fromType.getAvailability());
        assertEquals("ASFALTO", fromType.getType());
        assertEquals(Availability.NOT_INFORMED, fromType.getDate());

        // An explicit indicator is never overridden.
        AvailabilityDescriptor explicit = IndicatorMapper.mapIndicator(ServiceCategory.PAVING,
                segmentWith(SegmentField.PAVING_INDICATOR, "N", SegmentField.PAVING_TYPE, "ASFALTO",
                        SegmentField.PAVING_DATE, "15/03/2022"));
        assertEquals(Availability.UNAVAILABLE, explicit.getAvailability());
        assertEquals("15/03/2022", explicit.getDate());

        AvailabilityDescriptor noType = IndicatorMapper.mapIndicator(ServiceCategory.PAVING,
                segmentWith(SegmentField.PAVING_INDICATOR, "", SegmentField.PAVING_TYPE, ""));
        assertEquals(Availability.UNKNOWN, noType.getAvailability());
        assertEquals(Availability.NOT_INFORMED, noType.getType());
    }

    @Test
    void testNetworkCategoriesReportDate()
    {
        AvailabilityDescriptor water = IndicatorMapper.mapIndicator(ServiceCategory.WATER,
                segmentWith(SegmentField.WATER_INDICATOR, "S", SegmentField.WATER_DATE, "2021-06-01",
                        SegmentField.PAVING_DATE, "2024-06-30", SegmentField.SEWAGE_DATE, "2023-01-01"));
        assertEquals(Availability.AVAILABLE, water.getAvailability());
        assertEquals("2021-06-01", water.getDate());

        AvailabilityDescriptor sewage = IndicatorMapper.mapIndicator(ServiceCategory.SEWAGE,
                segmentWith(SegmentField.SEWAGE_INDICATOR, "N", SegmentField.WATER_DATE, "2021-06-01"));
        assertEquals(Availability.UNAVAILABLE, sewage.getAvailability());
        assertEquals(Availability.NOT_INFORMED, sewage.getDate());

        // Indicator column absent from the matched segment; telephony carries no date.
        AvailabilityDescriptor telephony = IndicatorMapper.mapIndicator(ServiceCategory.TELEPHONY,
                segmentWith(SegmentField.PAVING_DATE, "2024-06-30"));
        assertEquals(Availability.NOT_FOUND, telephony.getAvailability());
        assertNull(telephony.getDate());
    }

    @Test
    void testSelectiveCollection()
    {
        AvailabilityDescriptor served = IndicatorMapper.mapIndicator(ServiceCategory.SELECTIVE_COLLECTION,
                segmentWith(SegmentField.COLLECTION_PROGRAM, "SEGUNDA E QUINTA", SegmentField.COLLECTION_SHIFT,
                        "DIURNO", SegmentField.COLLECTION_DISTRICT, "", SegmentField.COLLECTION_COOPERATIVE,
                        "COOPERATIVA A"));
        assertEquals(Availability.AVAILABLE, served.getAvailability());
        assertEquals("SEGUNDA E QUINTA", served.getSchedule());
        assertEquals("DIURNO", served.getShift());
        assertEquals(Availability.NOT_INFORMED, served.getDistrict());
        assertEquals("COOPERATIVA A", served.getResponsibleParty());
        assertNull(served.getDate());

        AvailabilityDescriptor notServed = IndicatorMapper.mapIndicator(ServiceCategory.SELECTIVE_COLLECTION,
                segmentWith(SegmentField.COLLECTION_PROGRAM, "Sem coleta nesta via", SegmentField.COLLECTION_SHIFT,
                        "NOTURNO"));
        assertEquals(Availability.UNAVAILABLE, notServed.getAvailability());

        AvailabilityDescriptor notApplicable = IndicatorMapper.mapIndicator(ServiceCategory.SELECTIVE_COLLECTION,
                segmentWith(SegmentField.COLLECTION_PROGRAM, "N/A", SegmentField.COLLECTION_SHIFT, "não se aplica"));
        assertEquals(Availability.NOT_FOUND, notApplicable.getAvailability());
    }

    @Test
    void testSelectiveCollectionDistrictAloneMeansServed()
    {
        AvailabilityDescriptor descriptor = IndicatorMapper.mapIndicator(ServiceCategory.SELECTIVE_COLLECTION,
                segmentWith(SegmentField.COLLECTION_PROGRAM, "", SegmentField.COLLECTION_SHIFT, "",
                        SegmentField.COLLECTION_DISTRICT, "Centro", SegmentField.COLLECTION_COOPERATIVE, ""));

        assertEquals(Availability.AVAILABLE, descriptor.getAvailability());
        assertEquals(Availability.NOT_INFORMED, descriptor.getSchedule());
        assertEquals("Centro", descriptor.getDistrict());
    }

    @Test
    void testSelectiveCollectionNotApplicableProgramAloneIsNotFound()
    {
        AvailabilityDescriptor descriptor = IndicatorMapper.mapIndicator(ServiceCategory.SELECTIVE_COLLECTION,
                segmentWith(SegmentField.COLLECTION_PROGRAM, "NÃO SE APLICA", SegmentField.COLLECTION_SHIFT, "",
                        SegmentField.COLLECTION_DISTRICT, "", SegmentField.COLLECTION_COOPERATIVE, ""));

        assertEquals(Availability.NOT_FOUND, descriptor.getAvailability());
        assertEquals("NÃO SE APLICA", descriptor.getSchedule());
    }
}
