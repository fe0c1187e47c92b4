package com.skillswap.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.skillswap.common.encryption.cipher.AeadCipherRegistry;
import com.skillswap.common.encryption.field.FieldEncryptionSchema;
import com.skillswap.common.encryption.field.FieldEncryptionSchemaRegistry;
import com.skillswap.common.encryption.store.InMemoryKeyStore;
import com.skillswap.common.encryption.store.KeyStore;
import com.skillswap.common.encryption.store.RedisKeyStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Wiring for the encryption core.
 *
 * Provides the beans the services need when the host application does not:
 * - key store (Redis when a {@link StringRedisTemplate} is available, in-memory otherwise)
 * - object mapper with Java time support
 * - UTC clock
 * - simple meter registry
 */
@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(EncryptionProperties.class)
@ComponentScan(basePackages = "com.skillswap.common.encryption")
public class EncryptionConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public KeyStore keyStore(ObjectProvider<StringRedisTemplate> redisTemplate, Clock clock) {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template != null) {
            log.info("Using Redis key store");
            return new RedisKeyStore(template);
        }
        log.warn("No Redis connection configured, keys are held in memory and will not survive a restart");
        return new InMemoryKeyStore(clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public AeadCipherRegistry aeadCipherRegistry() {
        return AeadCipherRegistry.withDefaults();
    }

    @Bean
    public FieldEncryptionSchemaRegistry fieldEncryptionSchemaRegistry(ObjectProvider<FieldEncryptionSchema<?>> schemas) {
        return new FieldEncryptionSchemaRegistry(schemas.orderedStream().collect(Collectors.toList()));
    }
}
