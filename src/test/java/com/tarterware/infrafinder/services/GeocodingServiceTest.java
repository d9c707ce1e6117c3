package com.tarterware.infrafinder.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.client.RestTemplate;

import com.tarterware.infrafinder.exceptions.LookupException;
import com.tarterware.infrafinder.models.GeoPosition;
import com.tarterware.infrafinder.models.NominatimPlace;
import com.tarterware.infrafinder.models.PostalAddress;

class GeocodingServiceTest
{
    private static final String QUERY = "Rua da Bahia, Belo Horizonte, MG, Brasil";

    @Mock
    private RestTemplate restTemplate;

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    @InjectMocks
    private GeocodingService geocodingService;

    @BeforeEach
    void setup()
    {
        MockitoAnnotations.openMocks(this);
        ReflectionTestUtils.setField(geocodingService, "_nominatimApiUrl", "https://nominatim.example");
        ReflectionTestUtils.setField(geocodingService, "_userAgent", "infrafinder-test");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    private static PostalAddress address()
    {
        PostalAddress address = new PostalAddress();
        address.setStreet(" Rua da Bahia ");
        address.setCity("Belo Horizonte");
        address.setState("MG");
        return address;
    }

    private static NominatimPlace place(String lat, String lon)
    {
        NominatimPlace place = new NominatimPlace();
        place.setLatitude(lat);
        place.setLongitude(lon);
        return place;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private void stubSearch(NominatimPlace[] places)
    {
        when(restTemplate.exchange(anyString(), eq(HttpMethod.GET), any(HttpEntity.class),
                eq(NominatimPlace[].class))).thenReturn(new ResponseEntity(places, HttpStatus.OK));
    }

    @Test
    void testBuildQuery()
    {
        assertEquals(QUERY, GeocodingService.buildQuery(address()));
        assertEquals(", , , Brasil", GeocodingService.buildQuery(new PostalAddress()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGeocodeViaRest()
    {
        NominatimPlace hit = place("-19.9245", "-43.9352");
        stubSearch(new NominatimPlace[] { hit, place("0", "0") });

        GeoPosition position = geocodingService.geocode(address());

        assertEquals(-19.9245, position.getLatitude(), 1e-9);
        assertEquals(-43.9352, position.getLongitude(), 1e-9);

        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<HttpEntity<?>> entity = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate).exchange(url.capture(), eq(HttpMethod.GET), entity.capture(),
                eq(NominatimPlace[].class));
        assertTrue(url.getValue().startsWith("https://nominatim.example/search?q="));
        assertTrue(url.getValue().contains("format=json"));
        assertTrue(url.getValue().contains("limit=1"));
        assertEquals("infrafinder-test", entity.getValue().getHeaders().getFirst(HttpHeaders.USER_AGENT));

        verify(valueOperations).set(GeocodingService.CACHE_KEY_PREFIX + QUERY, hit, 100, TimeUnit.HOURS);
    }

    @Test
    void testGeocodeViaCache()
    {
        when(valueOperations.get(GeocodingService.CACHE_KEY_PREFIX + QUERY)).thenReturn(place("-19.9", "-43.9"));

        GeoPosition position = geocodingService.geocode(address());

        assertEquals(-19.9, position.getLatitude(), 1e-9);
        verify(restTemplate, never()).exchange(anyString(), any(HttpMethod.class), any(HttpEntity.class),
                eq(NominatimPlace[].class));
    }

    @Test
    void testNoHitIsGeocodeNotFound()
    {
        stubSearch(new NominatimPlace[0]);

        LookupException ex = assertThrows(LookupException.class, () -> geocodingService.geocode(address()));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatus());
        assertEquals(LookupException.GEOCODE_NOT_FOUND, ex.getCode());
    }

    @Test
    void testUnusableCoordinatesAreInternalError()
    {
        stubSearch(new NominatimPlace[] { place("abc", "-43.9") });

        LookupException ex = assertThrows(LookupException.class, () -> geocodingService.geocode(address()));
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, ex.getStatus());
        assertEquals(LookupException.INTERNAL_ERROR, ex.getCode());
    }
}
