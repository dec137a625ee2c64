package com.example.dispatch_service.storage;

import com.example.dispatch_service.auth.UserPrincipal;

import java.util.Optional;

public interface UserStorage {

    Optional<UserPrincipal> findPrincipal(String userId);
}
