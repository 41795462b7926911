package com.tinyurl.config;

import com.tinyurl.cache.CacheService;
import com.tinyurl.cache.FallbackCache;
import com.tinyurl.cache.TieredCacheService;
import io.lettuce.core.RedisURI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the tiered cache. Redis is only connected when {@code app.cache.redis-url} is set;
 * otherwise the service runs on the in-process tier alone.
 */
@Configuration
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    @ConditionalOnExpression("!'${app.cache.redis-url:}'.isBlank()")
    public LettuceConnectionFactory redisConnectionFactory(@Value("${app.cache.redis-url}") String redisUrl,
                                                           @Value("${app.cache.redis-timeout:500ms}") Duration timeout) {
        RedisURI uri = RedisURI.create(redisUrl);

        RedisStandaloneConfiguration server = new RedisStandaloneConfiguration(uri.getHost(), uri.getPort());
        server.setDatabase(uri.getDatabase());
        if (uri.getUsername() != null) {
            server.setUsername(uri.getUsername());
        }
        if (uri.getPassword() != null) {
            server.setPassword(RedisPassword.of(uri.getPassword()));
        }

        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .commandTimeout(timeout);
        if (uri.isSsl()) {
            client.useSsl();
        }

        log.info("Primary cache configured at {}:{}", uri.getHost(), uri.getPort());
        return new LettuceConnectionFactory(server, client.build());
    }

    @Bean
    public FallbackCache fallbackCache(Clock clock) {
        return new FallbackCache(clock);
    }

    @Bean
    public CacheService cacheService(ObjectProvider<LettuceConnectionFactory> connectionFactory,
                                     FallbackCache fallbackCache,
                                     @Value("${app.cache.fallback-ttl:1h}") Duration fallbackTtl) {
        LettuceConnectionFactory factory = connectionFactory.getIfAvailable();
        if (factory == null) {
            log.info("No Redis URL configured, caching in memory only");
            return new TieredCacheService(null, fallbackCache, fallbackTtl);
        }
        return new TieredCacheService(new StringRedisTemplate(factory), fallbackCache, fallbackTtl);
    }
}
