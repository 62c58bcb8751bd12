package com.portfolio.backend.service;

import com.portfolio.backend.exception.BadRequestException;
import com.portfolio.backend.exception.UnauthorizedException;
import com.portfolio.backend.model.User;
import com.portfolio.backend.repository.UserRepository;
import com.portfolio.backend.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.AuthenticationException;
import org.springframework.stereotype.Service;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    public static final Set<String> SOCIAL_PROVIDERS = Set.of("google", "facebook");
    static final String INVALID_CREDENTIALS = "Incorrect email or password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AuthenticationManager authenticationManager;
    private final JwtTokenProvider jwtTokenProvider;

    /**
     * Checks the credentials and returns a signed access token.
     *
     * @throws UnauthorizedException for unknown emails, wrong passwords and inactive accounts
     */
    @Transactional(readOnly = true)
    public String login(String email, String password) {
        try {
            authenticationManager.authenticate(new UsernamePasswordAuthenticationToken(email, password));
        } catch (AuthenticationException e) {
            log.warn("Failed login attempt for: {} ({})", email, e.getClass().getSimpleName());
            throw new UnauthorizedException(INVALID_CREDENTIALS, e);
        }
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new UnauthorizedException(INVALID_CREDENTIALS));
        log.info("Successful login for user: {}", email);
        return jwtTokenProvider.generateToken(user.getId(), user.getEmail());
    }

    /**
     * Mock social sign-in: every provider maps to one fixed demo account, created on first use.
     */
    @Transactional
    public String socialLogin(String provider) {
        String normalized = normalizeProvider(provider);
        if (!SOCIAL_PROVIDERS.contains(normalized)) {
            throw new BadRequestException("Invalid provider. Must be 'google' or 'facebook'");
        }
        String email = "demo-" + normalized + "@example.com";
        User user = userRepository.findByEmail(email)
                .orElseGet(() -> {
                    User created = createUser(email, UUID.randomUUID().toString(), "Demo " + capitalize(normalized) + " User");
                    log.info("Created new user via {}: {}", normalized, email);
                    return created;
                });
        if (!user.isActiveUser()) {
            throw new UnauthorizedException("User is inactive");
        }
        log.info("Successful {} login for: {}", normalized, email);
        return jwtTokenProvider.generateToken(user.getId(), user.getEmail());
    }

    @Transactional
    public User createUser(String email, String password, String fullName) {
        if (userRepository.existsByEmail(email)) {
            throw new BadRequestException("Email already registered");
        }
        try {
            return userRepository.saveAndFlush(User.builder()
                    .email(email)
                    .passwordHash(passwordEncoder.encode(password))
                    .fullName(fullName)
                    .active(true)
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new BadRequestException("Email already registered");
        }
    }

    public static String normalizeProvider(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }

    private static String capitalize(String value) {
        return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1);
    }
}
