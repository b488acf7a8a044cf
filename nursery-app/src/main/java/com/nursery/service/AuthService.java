package com.nursery.service;

import com.nursery.model.AccessToken;
import com.nursery.model.AppUser;
import com.nursery.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final Clock clock;

    // Compared against when the username is unknown so both failure paths hash once.
    private final String unknownUserHash;

    public AuthService(UserRepository userRepository, PasswordEncoder passwordEncoder,
                       TokenService tokenService, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.clock = clock;
        this.unknownUserHash = passwordEncoder.encode("unknown-user");
    }

    public AccessToken register(String username, String password) {
        if (userRepository.exists(username)) {
            throw new DuplicateUserException();
        }

        AppUser user = new AppUser(username, passwordEncoder.encode(password), clock.instant());
        try {
            userRepository.save(user);
        } catch (DuplicateKeyException e) {
            throw new DuplicateUserException(e);
        }

        log.info("Registered user {}", username);
        return AccessToken.bearer(tokenService.issueToken(username), username);
    }

    public AccessToken login(String username, String password) {
        Optional<AppUser> user = userRepository.findByUsername(username);
        String storedHash = user.map(AppUser::passwordHash).orElse(unknownUserHash);

        boolean matches = passwordEncoder.matches(password, storedHash);
        if (user.isEmpty() || !matches) {
            log.warn("Rejected login for {}", username);
            throw new InvalidCredentialsException();
        }
        return AccessToken.bearer(tokenService.issueToken(username), username);
    }
}
