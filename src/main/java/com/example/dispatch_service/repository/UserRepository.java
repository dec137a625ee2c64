package com.example.dispatch_service.repository;

import com.example.dispatch_service.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRepository extends JpaRepository<User, String> {
}
