package com.flamingo.ai.contextengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/** Redis configuration for the external (warm) vector cache tier. */
@Configuration
public class RedisConfig {

  /**
   * Template storing raw byte payloads under string keys. Values are written as-is so the
   * compression flag byte survives the round trip.
   */
  @Bean
  public RedisTemplate<String, byte[]> vectorRedisTemplate(
      RedisConnectionFactory connectionFactory) {
    RedisTemplate<String, byte[]> template = new RedisTemplate<>();
    template.setConnectionFactory(connectionFactory);
    template.setKeySerializer(StringRedisSerializer.UTF_8);
    template.setValueSerializer(RedisSerializer.byteArray());
    template.setHashKeySerializer(StringRedisSerializer.UTF_8);
    template.setHashValueSerializer(RedisSerializer.byteArray());
    template.afterPropertiesSet();
    return template;
  }
}
