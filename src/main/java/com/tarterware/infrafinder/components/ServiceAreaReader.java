package com.tarterware.infrafinder.components;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.util.GeometryFixer;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.utilities.StringUtilities;

/**
 * Loads the region file: a delimited file whose {@code GEOMETRIA} column holds WKT
 * polygons in the planar CRS. Rows with a missing, malformed or non-polygonal geometry
 * are skipped.
 */
@Component
public class ServiceAreaReader
{
    private final GeometryFactory geometryFactory = new GeometryFactory();

    private final CsvMapper csvMapper;

    private final CsvSchema schema;

    private static final Logger logger = LoggerFactory.getLogger(ServiceAreaReader.class);

    public ServiceAreaReader(@Value("${com.tarterware.infrafinder.csv-separator:;}") char separator)
    {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(separator);
    }

    /**
     * @param path Region file.
     * @return The loaded area, or {@link ServiceArea#missing()} if the file does not
     *         exist or cannot be read.
     */
    public ServiceArea read(Path path)
    {
        if (!Files.isRegularFile(path))
        {
            logger.warn("Service area file {} not found; postal code lookups will fail", path);
            return ServiceArea.missing();
        }

        List<Geometry> polygons = new ArrayList<>();
        long skipped = 0;
        WKTReader wktReader = new WKTReader(geometryFactory);

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
                MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema)
                        .readValues(reader))
        {
            while (rows.hasNextValue())
            {
                Geometry polygon = toPolygon(wktReader, rows.nextValue());
                if (polygon == null)
                {
                    skipped++;
                    continue;
                }
                polygons.add(polygon);
            }
        }
        catch (IOException | RuntimeJsonMappingException e)
        {
            logger.warn("Unable to read service area file {}: {}", path, e.getMessage());
            return ServiceArea.missing();
        }

        logger.info("Service area loaded from {}: polygons={} skipped={}", path, polygons.size(), skipped);
        return ServiceArea.of(polygons);
    }

    private Geometry toPolygon(WKTReader wktReader, Map<String, String> row)
    {
        String wkt = null;
        for (Map.Entry<String, String> entry : row.entrySet())
        {
            if (DatasetKind.GEOMETRY_COLUMN.equals(StringUtilities.normalizeHeader(entry.getKey())))
            {
                wkt = StringUtilities.normalizeValue(entry.getValue());
            }
        }
        if (StringUtilities.isNullEmptyOrBlank(wkt))
        {
            return null;
        }

        try
        {
            Geometry geometry = wktReader.read(wkt);
            if (geometry == null || geometry.isEmpty() || !(geometry instanceof Polygonal))
            {
                return null;
            }
            if (!geometry.isValid())
            {
                geometry = GeometryFixer.fix(geometry);
            }
            return geometry.isEmpty() ? null : geometry;
        }
        catch (ParseException | IllegalArgumentException e)
        {
            logger.debug("Unparsable service area geometry: {}", e.getMessage());
            return null;
        }
    }
}
