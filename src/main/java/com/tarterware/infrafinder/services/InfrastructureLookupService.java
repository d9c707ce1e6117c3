package com.tarterware.infrafinder.services;

import java.util.Optional;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.proj4j.CoordinateTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import com.tarterware.infrafinder.components.InfrastructureRegistry;
import com.tarterware.infrafinder.components.InfrastructureSnapshot;
import com.tarterware.infrafinder.components.ServiceArea;
import com.tarterware.infrafinder.exceptions.LookupException;
import com.tarterware.infrafinder.models.DatasetKind;
import com.tarterware.infrafinder.models.GeoPosition;
import com.tarterware.infrafinder.models.InfrastructureResponse;
import com.tarterware.infrafinder.models.NearestMatch;
import com.tarterware.infrafinder.models.PostalAddress;
import com.tarterware.infrafinder.utilities.TopologyUtilities;

/**
 * Runs a complete lookup: postal code to address, address to position, position to
 * the planar CRS, a check that the position lies inside the area the datasets cover,
 * and finally availability of every service category.
 */
@Service
public class InfrastructureLookupService
{
    private final PostalCodeService postalCodeService;

    private final GeocodingService geocodingService;

    private final AvailabilityService availabilityService;

    private final InfrastructureRegistry registry;

    // proj4j transforms keep per-call state, so each thread gets its own.
    private final ThreadLocal<CoordinateTransform> wgs84ToPlanar;

    private static final Logger logger = LoggerFactory.getLogger(InfrastructureLookupService.class);

    public InfrastructureLookupService(PostalCodeService postalCodeService, GeocodingService geocodingService,
            AvailabilityService availabilityService, InfrastructureRegistry registry,
            @Value("${com.tarterware.infrafinder.planar-crs:" + TopologyUtilities.SIRGAS2000_UTM_23S + "}") String planarCrs)
    {
        this.postalCodeService = postalCodeService;
        this.geocodingService = geocodingService;
        this.availabilityService = availabilityService;
        this.registry = registry;

        // Fail at startup on a bad CRS rather than on the first request.
        TopologyUtilities.getWgs84ToPlanarCoordinateTransformer(planarCrs);
        this.wgs84ToPlanar = ThreadLocal
                .withInitial(() -> TopologyUtilities.getWgs84ToPlanarCoordinateTransformer(planarCrs));
    }

    public InfrastructureResponse lookupByPostalCode(String rawPostalCode)
    {
        PostalAddress address = postalCodeService.lookup(rawPostalCode);
        GeoPosition position = geocodingService.geocode(address);

        logger.info("CEP {} located at ({}, {})", address.getPostalCode(), position.getLatitude(),
                position.getLongitude());

        Coordinate planar = toPlanar(position);
        InfrastructureSnapshot snapshot = registry.current();
        ensureInsideServiceArea(snapshot.getServiceArea(), planar);

        return InfrastructureResponse.builder()
                .postalCode(address.getPostalCode())
                .street(address.getStreet())
                .neighborhood(address.getNeighborhood())
                .latitude(position.getLatitude())
                .longitude(position.getLongitude())
                .services(availabilityService.evaluateAll(snapshot, planar))
                .build();
    }

    /**
     * Lookup for a known position, skipping the postal code, geocoding and service
     * area steps.
     * 
     * @throws LookupException with {@link LookupException#INVALID_PARAMETER} if the
     *                         position is not a valid WGS84 location.
     */
    public InfrastructureResponse lookupByPosition(double latitude, double longitude)
    {
        if (!TopologyUtilities.isValidGeodetic(latitude, longitude))
        {
            throw new LookupException(HttpStatus.BAD_REQUEST, LookupException.INVALID_PARAMETER,
                    "Latitude/longitude inválidas: " + latitude + ", " + longitude);
        }

        GeoPosition position = new GeoPosition(latitude, longitude);
        return InfrastructureResponse.builder()
                .latitude(latitude)
                .longitude(longitude)
                .services(availabilityService.evaluateAll(toPlanar(position)))
                .build();
    }

    /**
     * Nearest segment to a point given directly in the planar CRS.
     */
    public Optional<NearestMatch> findNearest(double x, double y, DatasetKind dataset)
    {
        return availabilityService.resolveNearest(new Coordinate(x, y), dataset);
    }

    Coordinate toPlanar(GeoPosition position)
    {
        Coordinate planar = TopologyUtilities.toPlanar(wgs84ToPlanar.get(), position.getLongitude(),
                position.getLatitude());
        if (!TopologyUtilities.isValidCoordinate(planar))
        {
            throw new LookupException(HttpStatus.INTERNAL_SERVER_ERROR, LookupException.INTERNAL_ERROR,
                    "Falha na transformação de coordenadas");
        }
        return planar;
    }

    static void ensureInsideServiceArea(ServiceArea serviceArea, Coordinate planar)
    {
        if (!serviceArea.isPresent())
        {
            throw new LookupException(HttpStatus.INTERNAL_SERVER_ERROR, LookupException.SERVICE_AREA_MISSING,
                    "Base de centralidade ausente");
        }
        if (!serviceArea.contains(planar))
        {
            throw new LookupException(HttpStatus.NOT_FOUND, LookupException.OUTSIDE_SERVICE_AREA,
                    "Endereço fora da base de dados");
        }
    }
}
