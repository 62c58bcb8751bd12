package com.portfolio.backend.controller;

import com.portfolio.backend.dto.LoginRequest;
import com.portfolio.backend.dto.SocialAuthResponse;
import com.portfolio.backend.dto.TokenResponse;
import com.portfolio.backend.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication Controller
 * Issues bearer tokens for password and mock social sign-in
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication")
public class AuthController {

    private final AuthService authService;

    @PostMapping("/login")
    @Operation(summary = "Login with email and password")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = TokenResponse.class)))
    @ApiResponse(responseCode = "401", description = "Incorrect email or password", content = @Content)
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login attempt for user: {}", request.getEmail());
        String token = authService.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(TokenResponse.bearer(token));
    }

    @PostMapping("/social")
    @Operation(summary = "Mock social login (google or facebook)")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = SocialAuthResponse.class)))
    @ApiResponse(responseCode = "400", description = "Unknown provider", content = @Content)
    public ResponseEntity<SocialAuthResponse> socialLogin(@RequestParam String provider) {
        log.info("Social login attempt with provider: {}", provider);
        String token = authService.socialLogin(provider);
        return ResponseEntity.ok(SocialAuthResponse.bearer(token, AuthService.normalizeProvider(provider)));
    }
}
