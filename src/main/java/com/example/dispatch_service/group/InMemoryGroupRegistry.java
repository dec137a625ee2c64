package com.example.dispatch_service.group;

import com.example.dispatch_service.message.OutboundMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 단일 프로세스용 레지스트리.
 * 멤버 집합은 불변 스냅샷으로 교체되며, 변경은 그룹 키 단위로 원자적이다 (전역 락 없음).
 * 멤버가 0명이 되면 엔트리를 제거한다.
 */
@Slf4j
public class InMemoryGroupRegistry implements GroupRegistry {

    private final ConcurrentMap<String, Set<Connection>> groups = new ConcurrentHashMap<>();

    @Override
    public void join(String group, Connection connection) {
        groups.compute(group, (name, members) -> {
            if (members == null) {
                return Set.of(connection);
            }
            if (members.contains(connection)) {
                return members;
            }
            Set<Connection> next = new HashSet<>(members);
            next.add(connection);
            return Collections.unmodifiableSet(next);
        });
        log.debug("그룹 가입: group={}, connection={}", group, connection.id());
    }

    @Override
    public void leave(String group, Connection connection) {
        groups.computeIfPresent(group, (name, members) -> {
            if (!members.contains(connection)) {
                return members;
            }
            if (members.size() == 1) {
                return null;
            }
            Set<Connection> next = new HashSet<>(members);
            next.remove(connection);
            return Collections.unmodifiableSet(next);
        });
        log.debug("그룹 탈퇴: group={}, connection={}", group, connection.id());
    }

    @Override
    public void send(String group, OutboundMessage message) {
        Set<Connection> members = groups.getOrDefault(group, Set.of());
        for (Connection member : members) {
            deliver(member, message);
        }
    }

    @Override
    public void sendToConnection(Connection connection, OutboundMessage message) {
        deliver(connection, message);
    }

    @Override
    public Set<Connection> members(String group) {
        return groups.getOrDefault(group, Set.of());
    }

    public int groupCount() {
        return groups.size();
    }

    // 한 연결의 전송 실패가 나머지 멤버 전송을 막지 않도록 함
    private void deliver(Connection connection, OutboundMessage message) {
        try {
            connection.deliver(message);
        } catch (RuntimeException e) {
            log.error("메시지 전달 실패. Connection ID: {}, type: {}", connection.id(), message.type(), e);
        }
    }
}
