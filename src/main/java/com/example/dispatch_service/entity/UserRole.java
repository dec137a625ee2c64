package com.example.dispatch_service.entity;

public enum UserRole {
    DRIVER,  // 기사
    RIDER,   // 승객
    OWNER    // 택시 사업자 (관리자 권한)
}
