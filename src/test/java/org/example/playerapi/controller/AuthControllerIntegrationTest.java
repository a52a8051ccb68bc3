package org.example.playerapi.controller;

import org.example.playerapi.security.JwtTokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AuthControllerIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private JwtTokenService jwtTokenService;

    @Test
    void signupReturnsPublicUserView() throws Exception {
        mockMvc.perform(post("/api/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "alice@example.com", "username", "alice", "password", "pw"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(notNullValue()))
                .andExpect(jsonPath("$.username").value("alice"))
                .andExpect(jsonPath("$.email").value("alice@example.com"))
                .andExpect(jsonPath("$.is_active").value(true))
                .andExpect(jsonPath("$.created_at").value(notNullValue()))
                .andExpect(jsonPath("$.hashed_password").doesNotExist())
                .andExpect(jsonPath("$.password").doesNotExist());
    }

    @Test
    void signupThenLoginWithSameCredentialsSucceeds() throws Exception {
        signup("alice", "s3cret");

        mockMvc.perform(post("/api/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "alice", "password", "s3cret"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").value(notNullValue()))
                .andExpect(jsonPath("$.token_type").value("bearer"));
    }

    @Test
    void issuedTokenCarriesTheLoginUsername() throws Exception {
        String token = signupAndLogin("alice");

        assertThat(jwtTokenService.verifyToken(token)).isEqualTo("alice");
    }

    @Test
    void duplicateUsernameIsRejectedAndNotStoredTwice() throws Exception {
        signup("alice", "pw");

        mockMvc.perform(post("/api/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "other@example.com", "username", "alice", "password", "pw2"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Username already registered"));

        assertThat(userRepository.count()).isEqualTo(1);
    }

    @Test
    void malformedEmailIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("email", "not-an-email", "username", "alice", "password", "pw"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.fields.email").exists());
        assertThat(userRepository.count()).isZero();
    }

    @Test
    void wrongPasswordIsUnauthorized() throws Exception {
        signup("alice", "s3cret");

        mockMvc.perform(post("/api/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "alice", "password", "wrong"))))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.detail").value("Incorrect username or password"));
    }

    @Test
    void unknownUserIsUnauthorized() throws Exception {
        mockMvc.perform(post("/api/token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("username", "ghost", "password", "pw"))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Incorrect username or password"));
    }

    @Test
    void logoutAcknowledgesAndTokenKeepsWorking() throws Exception {
        String token = signupAndLogin("alice");

        mockMvc.perform(post("/api/logout").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Successfully logged out"));

        // no revocation: the token is valid until it expires
        mockMvc.perform(get("/api/players").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isOk());
    }

    @Test
    void logoutRequiresToken() throws Exception {
        mockMvc.perform(post("/api/logout"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void missingTokenIsNotAuthenticated() throws Exception {
        mockMvc.perform(get("/api/players"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.detail").value("Not authenticated"));
    }

    @Test
    void garbageTokenIsRejected() throws Exception {
        mockMvc.perform(get("/api/players").header(HttpHeaders.AUTHORIZATION, bearer("garbage")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
    }

    @Test
    void expiredTokenIsRejected() throws Exception {
        signup("alice", "pw");
        String expired = jwtTokenService.issueToken("alice", Duration.ofSeconds(-5));

        mockMvc.perform(get("/api/players").header(HttpHeaders.AUTHORIZATION, bearer(expired)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
    }

    @Test
    void tokenOfUnknownUserGetsTheSameAnswerAsAnInvalidToken() throws Exception {
        String orphan = jwtTokenService.issueToken("nobody");

        mockMvc.perform(get("/api/players").header(HttpHeaders.AUTHORIZATION, bearer(orphan)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
    }

    @Test
    void tokenOfDeactivatedUserIsRejected() throws Exception {
        String token = signupAndLogin("alice");
        userRepository.findByUsername("alice").ifPresent(user -> {
            user.setActive(false);
            userRepository.save(user);
        });

        mockMvc.perform(get("/api/players").header(HttpHeaders.AUTHORIZATION, bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.detail").value("Could not validate credentials"));
    }
}
