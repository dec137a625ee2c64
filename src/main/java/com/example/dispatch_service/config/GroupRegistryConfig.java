package com.example.dispatch_service.config;

import com.example.dispatch_service.group.GroupRegistry;
import com.example.dispatch_service.group.InMemoryGroupRegistry;
import com.example.dispatch_service.group.RedisGroupRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

@Configuration
public class GroupRegistryConfig {

    // 단일 인스턴스(및 테스트)용 기본 백엔드
    @Bean
    @ConditionalOnProperty(name = "dispatch.groups.backend", havingValue = "memory", matchIfMissing = true)
    public GroupRegistry inMemoryGroupRegistry() {
        return new InMemoryGroupRegistry();
    }

    @Configuration
    @ConditionalOnProperty(name = "dispatch.groups.backend", havingValue = "redis")
    static class RedisBackendConfig {

        @Bean
        public RedisGroupRegistry redisGroupRegistry(StringRedisTemplate redisTemplate,
                                                     ObjectMapper objectMapper,
                                                     DispatchProperties properties) {
            return new RedisGroupRegistry(new InMemoryGroupRegistry(), redisTemplate, objectMapper,
                    properties.getGroups().getChannelPrefix());
        }

        @Bean
        public RedisMessageListenerContainer groupRelayListenerContainer(RedisConnectionFactory connectionFactory,
                                                                         RedisGroupRegistry redisGroupRegistry,
                                                                         DispatchProperties properties) {
            RedisMessageListenerContainer container = new RedisMessageListenerContainer();
            container.setConnectionFactory(connectionFactory);
            container.addMessageListener(redisGroupRegistry,
                    new PatternTopic(properties.getGroups().getChannelPrefix() + "*"));
            return container;
        }
    }
}
