package com.tarterware.infrafinder.services;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.tarterware.infrafinder.exceptions.LookupException;
import com.tarterware.infrafinder.models.GeoPosition;
import com.tarterware.infrafinder.models.NominatimPlace;
import com.tarterware.infrafinder.models.PostalAddress;
import com.tarterware.infrafinder.utilities.StringUtilities;

/**
 * Geocodes street addresses with the Nominatim search API.
 */
@Service
public class GeocodingService
{
    static final String CACHE_KEY_PREFIX = "nominatim/";

    @Value("${com.tarterware.infrafinder.nominatim.api.url:https://nominatim.openstreetmap.org}")
    private String _nominatimApiUrl;

    // Nominatim refuses requests without an identifying agent.
    @Value("${com.tarterware.infrafinder.nominatim.user-agent:infrafinder}")
    private String _userAgent;

    @Autowired
    RestTemplate restTemplate;

    @Autowired
    RedisTemplate<String, Object> redisTemplate;

    private static final Logger logger = LoggerFactory.getLogger(GeocodingService.class);

    /**
     * Build the free-form query for an address: street, city, state, country.
     */
    static public String buildQuery(PostalAddress address)
    {
        StringBuilder sb = new StringBuilder();
        sb.append(valueOrEmpty(address.getStreet())).append(", ");
        sb.append(valueOrEmpty(address.getCity())).append(", ");
        sb.append(valueOrEmpty(address.getState())).append(", ");
        sb.append("Brasil");
        return sb.toString();
    }

    /**
     * Geocode an address.
     * 
     * @param address Address from the postal code lookup.
     * @return Position of the first hit.
     * @throws LookupException 404 if nothing matched, 500 if the search failed or the
     *                         hit has no usable coordinates.
     */
    public GeoPosition geocode(PostalAddress address)
    {
        String query = buildQuery(address);
        String cacheKey = CACHE_KEY_PREFIX + query;

        NominatimPlace place = readCache(cacheKey);
        if (place != null)
        {
            logger.info("NominatimPlace via cache: " + cacheKey);
        }
        else
        {
            String url = UriComponentsBuilder.fromUriString(_nominatimApiUrl)
                    .path("/search")
                    .queryParam("q", query)
                    .queryParam("format", "json")
                    .queryParam("limit", 1)
                    .encode()
                    .toUriString();

            logger.info("NominatimPlace via REST: " + url);

            HttpHeaders headers = new HttpHeaders();
            headers.set(HttpHeaders.USER_AGENT, _userAgent);

            NominatimPlace[] places;
            try
            {
                ResponseEntity<NominatimPlace[]> resp = restTemplate.exchange(url, HttpMethod.GET,
                        new HttpEntity<>(headers), NominatimPlace[].class);
                places = resp.getBody();
            }
            catch (RestClientException e)
            {
                throw new LookupException(HttpStatus.INTERNAL_SERVER_ERROR, LookupException.INTERNAL_ERROR,
                        "Falha na geocodificação de: " + query, e);
            }

            if (places == null || places.length == 0)
            {
                logger.warn("Unable to get coordinate data for: " + query);
                throw new LookupException(HttpStatus.NOT_FOUND, LookupException.GEOCODE_NOT_FOUND,
                        "Geocodificação não encontrada");
            }

            place = places[0];
            writeCache(cacheKey, place);
        }

        double latitude = parseOrdinate(place.getLatitude());
        double longitude = parseOrdinate(place.getLongitude());
        if (!Double.isFinite(latitude) || !Double.isFinite(longitude))
        {
            throw new LookupException(HttpStatus.INTERNAL_SERVER_ERROR, LookupException.INTERNAL_ERROR,
                    "Coordenadas inválidas");
        }

        return new GeoPosition(latitude, longitude);
    }

    private static double parseOrdinate(String value)
    {
        if (StringUtilities.isNullEmptyOrBlank(value))
        {
            return Double.NaN;
        }
        try
        {
            return Double.parseDouble(value.trim());
        }
        catch (NumberFormatException e)
        {
            return Double.NaN;
        }
    }

    private static String valueOrEmpty(String value)
    {
        return value == null ? "" : value.trim();
    }

    private NominatimPlace readCache(String cacheKey)
    {
        try
        {
            return (NominatimPlace) redisTemplate.opsForValue().get(cacheKey);
        }
        catch (DataAccessException e)
        {
            logger.warn("Geocoding cache unavailable, querying Nominatim directly: " + e.getMessage());
            return null;
        }
    }

    private void writeCache(String cacheKey, NominatimPlace place)
    {
        try
        {
            redisTemplate.opsForValue().set(cacheKey, place, 100, TimeUnit.HOURS);
        }
        catch (DataAccessException e)
        {
            logger.warn("Unable to cache " + cacheKey + ": " + e.getMessage());
        }
    }
}
