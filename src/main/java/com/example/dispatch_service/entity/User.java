package com.example.dispatch_service.entity;

import com.example.dispatch_service.auth.UserPrincipal;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, unique = true, length = 10, name = "phone_number")
    private String phoneNumber;

    @Column(length = 50, name = "first_name")
    private String firstName;

    @Column(length = 50, name = "last_name")
    private String lastName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role;

    @Column(nullable = false)
    private boolean staff;

    @Column(nullable = false)
    private boolean active;

    @Column(nullable = false, updatable = false, name = "date_joined")
    private LocalDateTime dateJoined;

    private User(String phoneNumber, UserRole role, boolean staff) {
        this.id = UUID.randomUUID().toString();
        this.phoneNumber = phoneNumber;
        this.role = role;
        this.staff = staff;
        this.active = false;
        this.dateJoined = LocalDateTime.now();
    }

    public static User driver(String phoneNumber) {
        return new User(phoneNumber, UserRole.DRIVER, false);
    }

    public static User rider(String phoneNumber) {
        return new User(phoneNumber, UserRole.RIDER, false);
    }

    // 사업자는 관리자 화면 접근이 가능해야 함
    public static User owner(String phoneNumber) {
        return new User(phoneNumber, UserRole.OWNER, true);
    }

    public User rename(String firstName, String lastName) {
        this.firstName = firstName;
        this.lastName = lastName;
        return this;
    }

    public User activate() {
        this.active = true;
        return this;
    }

    public UserPrincipal toPrincipal() {
        return new UserPrincipal(id, role, active);
    }
}
