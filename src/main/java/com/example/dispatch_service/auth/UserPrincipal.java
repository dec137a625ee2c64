package com.example.dispatch_service.auth;

import com.example.dispatch_service.entity.UserRole;

import java.security.Principal;

/**
 * 연결에 붙는 인증 결과. 연결이 살아있는 동안 바뀌지 않는다.
 * id 가 없으면 익명이다.
 */
public record UserPrincipal(String id, UserRole role, boolean active) implements Principal {

    private static final UserPrincipal ANONYMOUS = new UserPrincipal(null, null, false);

    public static UserPrincipal anonymous() {
        return ANONYMOUS;
    }

    public boolean isAnonymous() {
        return id == null;
    }

    public boolean hasRole(UserRole expected) {
        return role == expected;
    }

    @Override
    public String getName() {
        return isAnonymous() ? "anonymous" : id;
    }
}
