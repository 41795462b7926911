package com.tinyurl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

// Redis is optional here, CacheConfig builds the connection only when app.cache.redis-url is set
@SpringBootApplication(exclude = {RedisAutoConfiguration.class, RedisRepositoriesAutoConfiguration.class})
public class TinyUrlServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TinyUrlServiceApplication.class, args);
    }

}
