package com.tarterware.infrafinder.configs;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Redis connection backing the postal code and geocoding caches.
 */
@Configuration
@Profile("!test")
public class RedisConfig
{
    @Value("${com.tarterware.infrafinder.redis.host:localhost}")
    private String _redisHost;

    @Value("${com.tarterware.infrafinder.redis.port:6379}")
    private int _redisPort;

    @Value("${com.tarterware.infrafinder.redis.password:}")
    private String _redisPassword;

    @Bean
    LettuceConnectionFactory redisStandAloneConnectionFactory()
    {
        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(_redisHost, _redisPort);
        if (!_redisPassword.isEmpty())
        {
            configuration.setPassword(_redisPassword);
        }
        return new LettuceConnectionFactory(configuration);
    }

    @Bean
    RedisTemplate<String, Object> redisTemplate(
            @Qualifier("redisStandAloneConnectionFactory") LettuceConnectionFactory redisConnectionFactory)
    {
        RedisTemplate<String, Object> template = new RedisTemplate<>();
        template.setConnectionFactory(redisConnectionFactory);

        // Keys are readable strings, values are JSON with type information.
        template.setKeySerializer(new StringRedisSerializer());
        template.setValueSerializer(new GenericJackson2JsonRedisSerializer());
        template.setHashKeySerializer(new StringRedisSerializer());
        template.setHashValueSerializer(new GenericJackson2JsonRedisSerializer());

        template.afterPropertiesSet();
        return template;
    }
}
