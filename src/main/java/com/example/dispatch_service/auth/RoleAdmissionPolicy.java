package com.example.dispatch_service.auth;

import com.example.dispatch_service.config.DispatchProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoleAdmissionPolicy implements AdmissionPolicy {

    private final DispatchProperties properties;

    @Override
    public boolean admit(UserPrincipal principal) {
        DispatchProperties.Admission admission = properties.getAdmission();
        if (principal.isAnonymous()) {
            return admission.isAllowAnonymous();
        }
        return principal.active() && admission.getAllowedRoles().contains(principal.role());
    }
}
