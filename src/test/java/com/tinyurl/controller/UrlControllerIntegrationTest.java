package com.tinyurl.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tinyurl.dto.CreateUrlRequest;
import com.tinyurl.dto.CreateUrlResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

// Full stack against a real Redis; skipped when no Docker daemon is available
@SpringBootTest(properties = {
        "spring.datasource.url=jdbc:h2:mem:tinyurl-redis;DB_CLOSE_DELAY=-1",
        "spring.datasource.username=sa",
        "spring.datasource.password=",
        "app.base-url=http://localhost:8081"
})
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureMockMvc
class UrlControllerIntegrationTest {

    @Container
    static GenericContainer<?> redisContainer =
            new GenericContainer<>(DockerImageName.parse("redis:7"))
                    .withExposedPorts(6379);

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("app.cache.redis-url",
                () -> "redis://" + redisContainer.getHost() + ":" + redisContainer.getMappedPort(6379));
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private RedisConnectionFactory redisConnectionFactory;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private StringRedisTemplate redisTemplate;

    @BeforeEach
    void cleanup() {
        redisTemplate = new StringRedisTemplate(redisConnectionFactory);
        redisTemplate.getConnectionFactory().getConnection().serverCommands().flushAll();
        jdbcTemplate.update("DELETE FROM short_links");
    }

    @Test
    void postShorten_whenValidRequest_shouldStoreMappingInRedis() throws Exception {
        String longUrl = "https://integration-test.com/path";
        String requestJson = objectMapper.writeValueAsString(new CreateUrlRequest(longUrl));

        MvcResult result = mockMvc.perform(post("/shorten")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestJson))
                .andExpect(status().isCreated())
                .andReturn();

        CreateUrlResponse response = objectMapper.readValue(result.getResponse().getContentAsString(), CreateUrlResponse.class);
        assertThat(response.shortCode()).hasSize(8);
        assertThat(response.shortUrl()).isEqualTo("http://localhost:8081/" + response.shortCode());

        assertThat(redisTemplate.opsForValue().get(response.shortCode())).isEqualTo(longUrl);
        assertThat(redisTemplate.getExpire(response.shortCode())).isPositive();
    }

    @Test
    void getShortCode_whenCached_shouldRedirectAndCountClickInRedis() throws Exception {
        redisTemplate.opsForValue().set("test1234", "https://redirect-test.com");
        jdbcTemplate.update("INSERT INTO short_links (short_code, long_url, click_count, created_at, updated_at) "
                + "VALUES ('test1234', 'https://redirect-test.com', 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)");

        mockMvc.perform(get("/test1234"))
                .andExpect(status().isMovedPermanently())
                .andExpect(header().string("Location", "https://redirect-test.com"));

        // the click is counted on a background thread
        long deadline = System.currentTimeMillis() + 5_000;
        while (redisTemplate.opsForValue().get("clicks:test1234") == null && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(redisTemplate.opsForValue().get("clicks:test1234")).isEqualTo("1");

        mockMvc.perform(get("/stats/test1234"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clicks", is(1)));
    }

    @Test
    void deleteShortCode_shouldClearRedisAndStore() throws Exception {
        String requestJson = objectMapper.writeValueAsString(new CreateUrlRequest("https://delete-me.com", "del-me"));
        mockMvc.perform(post("/shorten").contentType(MediaType.APPLICATION_JSON).content(requestJson))
                .andExpect(status().isCreated());
        redisTemplate.opsForValue().set("clicks:del-me", "3");

        mockMvc.perform(delete("/del-me"))
                .andExpect(status().isNoContent());

        assertThat(redisTemplate.hasKey("del-me")).isFalse();
        assertThat(redisTemplate.hasKey("clicks:del-me")).isFalse();
        mockMvc.perform(get("/del-me"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getShortCode_whenIdDoesNotExist_shouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/notThere"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getStats_whenIdDoesNotExist_shouldReturnNotFound() throws Exception {
        mockMvc.perform(get("/stats/noStats"))
                .andExpect(status().isNotFound());
    }
}
