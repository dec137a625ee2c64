package com.example.dispatch_service.auth;

/**
 * 식별된 사용자를 배차 세션에 들일지 결정한다.
 */
public interface AdmissionPolicy {

    boolean admit(UserPrincipal principal);
}
