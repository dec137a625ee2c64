package com.example.dispatch_service.storage;

import com.example.dispatch_service.auth.UserPrincipal;
import com.example.dispatch_service.entity.User;
import com.example.dispatch_service.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaUserStorage implements UserStorage {

    private final UserRepository userRepository;
    private final StorageCallExecutor executor;

    @Override
    public Optional<UserPrincipal> findPrincipal(String userId) {
        return executor.inTransaction("findPrincipal",
                status -> userRepository.findById(userId).map(User::toPrincipal));
    }
}
