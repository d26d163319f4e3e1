package com.hal9001.backend.modules.admin;

import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.hal9001.backend.modules.auth.application.TokenService;
import com.hal9001.backend.support.TestUserFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class AdminUserIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    TokenService tokenService;

    @Autowired
    TestUserFactory testUserFactory;

    private String bearer;

    @BeforeEach
    void setUp() {
        testUserFactory.deleteAll();
        testUserFactory.ensureFrankPoole();
        testUserFactory.ensureDaveBowman();
        bearer = "Bearer " + tokenService.issue("usr_001").token();
    }

    @Test
    void listsUsersOrderedByNameWithoutCredentialHash() throws Exception {
        mockMvc.perform(get("/api/v1/admin/users").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("Dave Bowman"))
                .andExpect(jsonPath("$[0].role").value("Data Editor"))
                .andExpect(jsonPath("$[1].id").value("usr_002"))
                .andExpect(jsonPath("$[0].credentialHash").doesNotExist());
    }

    @Test
    void provisionedUserGetsGeneratedIdAndCanLogIn() throws Exception {
        mockMvc.perform(post("/api/v1/admin/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Heywood Floyd", "role": "Data Viewer", "email": "h.floyd@clavius.moon", "password": "monolith-tma1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(header().exists(HttpHeaders.LOCATION))
                .andExpect(jsonPath("$.id").value(matchesPattern("usr_[0-9a-f]{12}")))
                .andExpect(jsonPath("$.email").value("h.floyd@clavius.moon"));

        mockMvc.perform(post("/api/v1/auth/token")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("username", "h.floyd@clavius.moon")
                        .param("password", "monolith-tma1"))
                .andExpect(status().isOk());
    }

    @Test
    void duplicateEmailIsConflict() throws Exception {
        mockMvc.perform(post("/api/v1/admin/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Dave Again", "role": "Data Editor", "email": "D.BOWMAN@discovery.co", "password": "another-password"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("user_email_taken"));
    }

    @Test
    void shortPasswordIsValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/admin/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Short", "role": "Data Viewer", "email": "short@discovery.co", "password": "hal"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void passwordOverBcryptByteLimitIsValidationError() throws Exception {
        String password = "한".repeat(24) + "ab";

        mockMvc.perform(post("/api/v1/admin/users")
                        .header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "Long", "role": "Data Viewer", "email": "long@discovery.co", "password": "%s"}
                                """.formatted(password)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.detail").value("password must be at most 72 bytes in UTF-8"));
    }

    @Test
    void usersEndpointRequiresBearerToken() throws Exception {
        mockMvc.perform(get("/api/v1/admin/users"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"));
    }
}
