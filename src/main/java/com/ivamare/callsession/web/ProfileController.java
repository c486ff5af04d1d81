package com.ivamare.callsession.web;

import com.ivamare.callsession.api.IdentityService;
import com.ivamare.callsession.model.User;
import com.ivamare.callsession.model.UserPrincipal;
import com.ivamare.callsession.model.UserRole;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * User lookups: the caller's own profile, and any user for admins.
 */
@RestController
@RequestMapping("/api")
public class ProfileController {

    private final IdentityService identityService;

    public ProfileController(IdentityService identityService) {
        this.identityService = identityService;
    }

    @GetMapping("/profile")
    public User profile(@AuthenticationPrincipal UserPrincipal principal) {
        return identityService.getUser(principal.userId());
    }

    @GetMapping("/admin/users/{userId}")
    public User user(@AuthenticationPrincipal UserPrincipal principal, @PathVariable UUID userId) {
        identityService.authorize(principal, UserRole.ADMIN);
        return identityService.getUser(userId);
    }
}
