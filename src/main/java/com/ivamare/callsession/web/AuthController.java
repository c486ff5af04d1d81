package com.ivamare.callsession.web;

import com.ivamare.callsession.api.IdentityService;
import com.ivamare.callsession.model.User;
import com.ivamare.callsession.web.dto.LoginRequest;
import com.ivamare.callsession.web.dto.LoginResponse;
import com.ivamare.callsession.web.dto.RegisterRequest;
import com.ivamare.callsession.web.dto.RegisterResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public registration and login endpoints.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final IdentityService identityService;

    public AuthController(IdentityService identityService) {
        this.identityService = identityService;
    }

    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = identityService.register(request.email(), request.password());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(new RegisterResponse("User registered successfully", user));
    }

    @PostMapping("/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest request) {
        IdentityService.LoginResult result = identityService.authenticateCredentials(
            request.email(), request.password());
        return new LoginResponse(result.token(), result.user());
    }
}
