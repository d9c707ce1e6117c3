package com.tarterware.infrafinder.services;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.tarterware.infrafinder.exceptions.LookupException;
import com.tarterware.infrafinder.models.PostalAddress;
import com.tarterware.infrafinder.utilities.StringUtilities;

/**
 * Resolves Brazilian postal codes (CEP) to street addresses through ViaCEP.
 */
@Service
public class PostalCodeService
{
    static final String CACHE_KEY_PREFIX = "viacep/";

    @Value("${com.tarterware.infrafinder.viacep.api.url:https://viacep.com.br}")
    private String _viaCepApiUrl;

    @Autowired
    RestTemplate restTemplate;

    @Autowired
    RedisTemplate<String, Object> redisTemplate;

    private static final Logger logger = LoggerFactory.getLogger(PostalCodeService.class);

    /**
     * Look up the address of a postal code.
     * 
     * @param rawPostalCode Postal code as typed by the caller; punctuation is ignored.
     * @return The address; never null.
     * @throws LookupException 400 if the code does not have 8 digits, 404 if ViaCEP does
     *                         not know it, 500 if ViaCEP could not be queried.
     */
    public PostalAddress lookup(String rawPostalCode)
    {
        String postalCode = StringUtilities.sanitizePostalCode(rawPostalCode);
        if (postalCode == null)
        {
            throw new LookupException(HttpStatus.BAD_REQUEST, LookupException.INVALID_POSTAL_CODE,
                    "Informe um CEP válido com 8 dígitos");
        }

        String cacheKey = CACHE_KEY_PREFIX + postalCode;
        PostalAddress address = readCache(cacheKey);

        if (address != null)
        {
            logger.info("PostalAddress via cache: " + cacheKey);
        }
        else
        {
            StringBuilder sb = new StringBuilder(_viaCepApiUrl);
            if (!_viaCepApiUrl.endsWith("/"))
            {
                sb.append("/");
            }
            sb.append("ws/").append(postalCode).append("/json/");

            logger.info("PostalAddress via REST: " + sb.toString());

            try
            {
                ResponseEntity<PostalAddress> resp = restTemplate.getForEntity(sb.toString(), PostalAddress.class);
                address = resp.getBody();
            }
            catch (RestClientException e)
            {
                throw new LookupException(HttpStatus.INTERNAL_SERVER_ERROR, LookupException.INTERNAL_ERROR,
                        "Falha ao consultar o CEP " + postalCode, e);
            }

            if (address == null)
            {
                throw new LookupException(HttpStatus.INTERNAL_SERVER_ERROR, LookupException.INTERNAL_ERROR,
                        "Resposta vazia ao consultar o CEP " + postalCode);
            }

            // Unknown codes are cached too; they do not start existing between reloads.
            writeCache(cacheKey, address);
        }

        if (address.isNotFound())
        {
            throw new LookupException(HttpStatus.NOT_FOUND, LookupException.POSTAL_CODE_NOT_FOUND,
                    "CEP não encontrado");
        }

        if (StringUtilities.isNullEmptyOrBlank(address.getPostalCode()))
        {
            address.setPostalCode(postalCode);
        }
        return address;
    }

    private PostalAddress readCache(String cacheKey)
    {
        try
        {
            return (PostalAddress) redisTemplate.opsForValue().get(cacheKey);
        }
        catch (DataAccessException e)
        {
            logger.warn("Postal code cache unavailable, querying ViaCEP directly: " + e.getMessage());
            return null;
        }
    }

    private void writeCache(String cacheKey, PostalAddress address)
    {
        try
        {
            redisTemplate.opsForValue().set(cacheKey, address, 100, TimeUnit.HOURS);
        }
        catch (DataAccessException e)
        {
            logger.warn("Unable to cache " + cacheKey + ": " + e.getMessage());
        }
    }
}
