package com.example.dispatch_service.group;

import com.example.dispatch_service.message.OutboundMessage;
import com.example.dispatch_service.support.RecordingConnection;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

@ExtendWith(MockitoExtension.class)
class RedisGroupRegistryTest {

    private static final String PREFIX = "dispatch:group:";

    @Mock
    private StringRedisTemplate redisTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryGroupRegistry local;
    private RedisGroupRegistry registry;

    @BeforeEach
    void setUp() {
        local = new InMemoryGroupRegistry();
        registry = new RedisGroupRegistry(local, redisTemplate, objectMapper, PREFIX);
    }

    @Test
    @DisplayName("그룹 메시지는 그룹 채널로 발행되고 로컬에 직접 전달되지 않는다")
    void send_PublishesToChannel() throws Exception {
        // given
        RecordingConnection connection = new RecordingConnection();
        registry.join("drivers", connection);

        // when
        registry.send("drivers", new OutboundMessage("create.trip", Map.of("id", "t-1")));

        // then
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        then(redisTemplate).should().convertAndSend(eq(PREFIX + "drivers"), payload.capture());
        assertThat(objectMapper.readTree(payload.getValue()).path("type").asText()).isEqualTo("create.trip");
        assertThat(connection.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Redis 발행 실패 시 로컬 멤버에게는 전달한다")
    void send_PublishFailure_FallsBackToLocal() throws InterruptedException {
        RecordingConnection connection = new RecordingConnection();
        registry.join("drivers", connection);
        given(redisTemplate.convertAndSend(anyString(), anyString()))
                .willThrow(new RedisConnectionFailureException("down"));

        registry.send("drivers", new OutboundMessage("echo.message", "hi"));

        assertThat(connection.receive().data()).isEqualTo("hi");
    }

    @Test
    @DisplayName("채널 메시지를 받으면 해당 그룹의 로컬 멤버에게 전달한다")
    void onMessage_DeliversToLocalMembers() throws InterruptedException {
        RecordingConnection member = new RecordingConnection();
        RecordingConnection other = new RecordingConnection();
        registry.join("trip-1", member);
        registry.join("trip-2", other);

        byte[] channel = (PREFIX + "trip-1").getBytes(StandardCharsets.UTF_8);
        byte[] body = "{\"type\":\"update.trip\",\"data\":{\"id\":\"trip-1\"}}".getBytes(StandardCharsets.UTF_8);
        registry.onMessage(new DefaultMessage(channel, body), null);

        assertThat(member.receive().type()).isEqualTo("update.trip");
        assertThat(other.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("파싱할 수 없는 채널 메시지는 무시한다")
    void onMessage_MalformedPayload_Ignored() {
        RecordingConnection member = new RecordingConnection();
        registry.join("trip-1", member);

        byte[] channel = (PREFIX + "trip-1").getBytes(StandardCharsets.UTF_8);
        registry.onMessage(new DefaultMessage(channel, "not-json".getBytes(StandardCharsets.UTF_8)), null);

        assertThat(member.isEmpty()).isTrue();
    }
}
