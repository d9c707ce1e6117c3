package com.tarterware.infrafinder.configs;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client shared by the ViaCEP and Nominatim lookups.
 */
@Configuration
public class RestTemplateConfig
{
    @Value("${com.tarterware.infrafinder.http.connect-timeout:5s}")
    private Duration _connectTimeout;

    @Value("${com.tarterware.infrafinder.http.read-timeout:10s}")
    private Duration _readTimeout;

    @Bean
    RestTemplate restTemplate(RestTemplateBuilder builder)
    {
        return builder.connectTimeout(_connectTimeout).readTimeout(_readTimeout).build();
    }
}
