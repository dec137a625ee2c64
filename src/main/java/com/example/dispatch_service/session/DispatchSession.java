package com.example.dispatch_service.session;

import com.example.dispatch_service.auth.UserPrincipal;
import com.example.dispatch_service.group.Connection;
import com.example.dispatch_service.group.GroupRegistry;
import com.example.dispatch_service.message.OutboundMessage;
import lombok.Getter;

import java.util.HashSet;
import java.util.Set;

/**
 * 연결 하나의 배차 상태. 가입한 그룹 목록을 기억했다가 종료 시 모두 탈퇴한다.
 * 종료 이후의 join 은 무시된다 (핸들러 실행 중 연결이 끊긴 경우).
 */
public class DispatchSession {

    @Getter
    private final Connection connection;
    @Getter
    private final UserPrincipal principal;
    private final GroupRegistry groupRegistry;

    private final Object membershipLock = new Object();
    private final Set<String> groups = new HashSet<>();
    private boolean closed;

    public DispatchSession(Connection connection, UserPrincipal principal, GroupRegistry groupRegistry) {
        this.connection = connection;
        this.principal = principal;
        this.groupRegistry = groupRegistry;
    }

    public String id() {
        return connection.id();
    }

    public void join(String group) {
        synchronized (membershipLock) {
            if (closed) {
                return;
            }
            groups.add(group);
            groupRegistry.join(group, connection);
        }
    }

    public boolean isMemberOf(String group) {
        synchronized (membershipLock) {
            return groups.contains(group);
        }
    }

    public Set<String> groups() {
        synchronized (membershipLock) {
            return Set.copyOf(groups);
        }
    }

    public void reply(OutboundMessage message) {
        groupRegistry.sendToConnection(connection, message);
    }

    public void broadcast(String group, OutboundMessage message) {
        groupRegistry.send(group, message);
    }

    public void close() {
        synchronized (membershipLock) {
            closed = true;
            for (String group : groups) {
                groupRegistry.leave(group, connection);
            }
            groups.clear();
        }
    }
}
