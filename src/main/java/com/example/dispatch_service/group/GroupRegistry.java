package com.example.dispatch_service.group;

import com.example.dispatch_service.message.OutboundMessage;

import java.util.Set;

/**
 * 그룹 이름 → 구독 중인 연결 집합.
 * 여러 연결에 메시지를 보내는 유일한 경로이며, 배차 코어는 이 인터페이스에만 의존한다.
 * 그룹은 첫 join 때 생기고 마지막 leave 때 사라진다.
 */
public interface GroupRegistry {

    /** 이미 가입된 연결이면 아무 일도 하지 않는다. */
    void join(String group, Connection connection);

    /** 가입하지 않은 그룹에서 나가는 것은 오류가 아니다. */
    void leave(String group, Connection connection);

    /** 호출 시점의 멤버 스냅샷 전체에 전달한다. 멤버가 없으면 무시. */
    void send(String group, OutboundMessage message);

    void sendToConnection(Connection connection, OutboundMessage message);

    Set<Connection> members(String group);
}
