package com.portfolio.backend.security;

import com.portfolio.backend.model.User;
import com.portfolio.backend.repository.HoldingRepository;
import com.portfolio.backend.repository.UserRepository;
import com.portfolio.backend.service.AuthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SecurityIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private AuthService authService;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private HoldingRepository holdingRepository;

    private User user;

    @BeforeEach
    void setUp() {
        holdingRepository.deleteAll();
        userRepository.deleteAll();
        user = authService.createUser("carol@example.com", "secret-password", "Carol");
    }

    @Test
    void portfolioWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/portfolio"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.status").value(401))
                .andExpect(jsonPath("$.message").value("Invalid or expired token"))
                .andExpect(jsonPath("$.path").value("/portfolio"));
    }

    @Test
    void garbageTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/portfolio").header(HttpHeaders.AUTHORIZATION, "Bearer not.a.token"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void expiredTokenIsUnauthorized() throws Exception {
        String expired = new JwtTokenProvider("test-secret-key-0123456789-abcdefghijklmnop", -1_000)
                .generateToken(user.getId(), user.getEmail());

        mockMvc.perform(get("/portfolio").header(HttpHeaders.AUTHORIZATION, "Bearer " + expired))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void tokenForInactiveUserIsUnauthorized() throws Exception {
        String token = jwtTokenProvider.generateToken(user.getId(), user.getEmail());
        user.setActive(false);
        userRepository.save(user);

        mockMvc.perform(get("/portfolio").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void tokenForDeletedUserIsUnauthorized() throws Exception {
        String token = jwtTokenProvider.generateToken(user.getId() + 1000, "ghost@example.com");

        mockMvc.perform(get("/portfolio").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void validTokenIsAccepted() throws Exception {
        String token = jwtTokenProvider.generateToken(user.getId(), user.getEmail());

        mockMvc.perform(get("/portfolio").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk());
    }

    @Test
    void requestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/healthz").header("X-Request-Id", "req-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-123"))
                .andExpect(header().string("X-Correlation-Id", "req-123"));
    }

    @Test
    void apiDocsArePublic() throws Exception {
        mockMvc.perform(get("/v3/api-docs"))
                .andExpect(status().isOk());
    }
}
