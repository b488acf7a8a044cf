package com.nursery.controller;

import com.nursery.model.AccessToken;
import com.nursery.model.Credentials;
import com.nursery.service.AuthService;
import com.nursery.service.InvalidPayloadException;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
public class AuthApiController {

    private final AuthService authService;

    public AuthApiController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    public AccessToken register(@RequestBody Credentials credentials) {
        requireShape(credentials);
        return authService.register(credentials.username(), credentials.password());
    }

    @PostMapping("/login")
    public AccessToken login(@RequestBody Credentials credentials) {
        requireShape(credentials);
        return authService.login(credentials.username(), credentials.password());
    }

    private static void requireShape(Credentials credentials) {
        if (credentials.username() == null || credentials.password() == null) {
            throw new InvalidPayloadException("Fields 'username' and 'password' are required");
        }
    }
}
