package com.example.dispatch_service.group;

import com.example.dispatch_service.message.OutboundMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * 다중 인스턴스 배포용 레지스트리.
 * 멤버십은 인스턴스 로컬에 두고, send 는 Redis 채널로 발행한다.
 * 모든 인스턴스가 채널 패턴을 구독하여 자기 로컬 멤버에게 전달한다.
 */
@Slf4j
public class RedisGroupRegistry implements GroupRegistry, MessageListener {

    private final InMemoryGroupRegistry local;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channelPrefix;

    public RedisGroupRegistry(InMemoryGroupRegistry local,
                              StringRedisTemplate redisTemplate,
                              ObjectMapper objectMapper,
                              String channelPrefix) {
        this.local = local;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.channelPrefix = channelPrefix;
    }

    @Override
    public void join(String group, Connection connection) {
        local.join(group, connection);
    }

    @Override
    public void leave(String group, Connection connection) {
        local.leave(group, connection);
    }

    @Override
    public void send(String group, OutboundMessage message) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("그룹 메시지 직렬화 실패: " + message.type(), e);
        }

        try {
            redisTemplate.convertAndSend(channelPrefix + group, payload);
        } catch (DataAccessException e) {
            log.error("Redis 발행 실패, 로컬 멤버에게만 전달합니다. group: {}, error: {}", group, e.getMessage());
            local.send(group, message);
        }
    }

    @Override
    public void sendToConnection(Connection connection, OutboundMessage message) {
        local.sendToConnection(connection, message);
    }

    @Override
    public Set<Connection> members(String group) {
        return local.members(group);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String channel = new String(message.getChannel(), StandardCharsets.UTF_8);
        if (!channel.startsWith(channelPrefix)) {
            log.warn("알 수 없는 채널 메시지 무시: {}", channel);
            return;
        }
        String group = channel.substring(channelPrefix.length());

        OutboundMessage outbound;
        try {
            outbound = objectMapper.readValue(message.getBody(), OutboundMessage.class);
        } catch (IOException e) {
            log.error("그룹 메시지 파싱 실패. 스킵합니다. channel: {}, payload: {}",
                    channel, new String(message.getBody(), StandardCharsets.UTF_8));
            return;
        }
        local.send(group, outbound);
    }
}
