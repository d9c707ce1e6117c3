package com.tarterware.infrafinder.models;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * The per-service datasets that can be ingested. Every kind carries its default file
 * name and its own column to {@link SegmentField} extraction mapping, so nothing about
 * a row has to be inferred from the file it came from.
 */
public enum DatasetKind
{
    LIGHTING("20250801_trecho_ilum_publica.csv",
            "ID_BASE_IP", SegmentField.LIGHTING_ID,
            "IND_IP", SegmentField.LIGHTING_INDICATOR),

    CURB("20250801_trecho_meio_fio.csv",
            "ID_BASE_MF", SegmentField.CURB_ID,
            "IND_MF", SegmentField.CURB_INDICATOR),

    PAVING("20250801_trecho_pavimentacao.csv",
            "ID_PAV", SegmentField.PAVING_ID,
            "LARG_INICIO", SegmentField.PAVING_WIDTH_START,
            "LARG_FINAL", SegmentField.PAVING_WIDTH_END,
            "IND_PAV", SegmentField.PAVING_INDICATOR,
            "LADO_PAV", SegmentField.PAVING_SIDE,
            "TP_PAV", SegmentField.PAVING_TYPE,
            "DATA", SegmentField.PAVING_DATE),

    WATER("20250801_trecho_rede_agua.csv",
            "ID_RDAGU", SegmentField.WATER_ID,
            "LADO_RDAGU", SegmentField.WATER_SIDE,
            "IND_RDAGU", SegmentField.WATER_INDICATOR,
            "DATA", SegmentField.WATER_DATE),

    ELECTRICITY("20250801_trecho_rede_eletrica.csv",
            "ID_BASE_RE", SegmentField.ELECTRICITY_ID,
            "IND_RE", SegmentField.ELECTRICITY_INDICATOR),

    SEWAGE("20250801_trecho_rede_esgoto.csv",
            "ID_RDESG", SegmentField.SEWAGE_ID,
            "LADO_RDESG", SegmentField.SEWAGE_SIDE,
            "IND_RDESG", SegmentField.SEWAGE_INDICATOR,
            "DATA", SegmentField.SEWAGE_DATE),

    TELEPHONY("20250801_trecho_rede_telefonica.csv",
            "ID_BASE_RT", SegmentField.TELEPHONY_ID,
            "IND_RT", SegmentField.TELEPHONY_INDICATOR),

    SELECTIVE_COLLECTION("trecho_coleta_seletiva.csv",
            "PROGRAMACAO", SegmentField.COLLECTION_PROGRAM,
            "TURNO", SegmentField.COLLECTION_SHIFT,
            "DISTRITOS", SegmentField.COLLECTION_DISTRICT,
            "COOPERATIVA_RESPONSAVEL", SegmentField.COLLECTION_COOPERATIVE);

    public static final String SEGMENT_ID_COLUMN = "ID_BASE_TRECHO";
    public static final String GEOMETRY_COLUMN = "GEOMETRIA";

    private final String defaultFileName;

    // Column name -> canonical field, in declaration order.
    private final Map<String, SegmentField> columnMapping;

    DatasetKind(String defaultFileName, Object... columnsAndFields)
    {
        this.defaultFileName = defaultFileName;

        Map<String, SegmentField> mapping = new LinkedHashMap<>();
        for (int i = 0; i < columnsAndFields.length; i += 2)
        {
            mapping.put((String) columnsAndFields[i], (SegmentField) columnsAndFields[i + 1]);
        }
        this.columnMapping = Collections.unmodifiableMap(mapping);
    }

    public String getDefaultFileName()
    {
        return defaultFileName;
    }

    public Map<String, SegmentField> getColumnMapping()
    {
        return columnMapping;
    }

    /**
     * Key used to override the file name in configuration, e.g.
     * {@code com.tarterware.infrafinder.datasets.selective-collection}.
     */
    public String getPropertyKey()
    {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
