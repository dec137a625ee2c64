package com.example.dispatch_service.dto;

import com.example.dispatch_service.entity.User;
import com.example.dispatch_service.entity.UserRole;

public record ParticipantRecord(
        String id,
        String phoneNumber,
        String firstName,
        String lastName,
        UserRole role
) {
    public static ParticipantRecord fromEntity(User user) {
        if (user == null) {
            return null;
        }
        return new ParticipantRecord(
                user.getId(),
                user.getPhoneNumber(),
                user.getFirstName(),
                user.getLastName(),
                user.getRole()
        );
    }
}
