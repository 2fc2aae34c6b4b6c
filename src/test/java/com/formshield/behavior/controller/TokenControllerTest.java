package com.formshield.behavior.controller;

import com.formshield.behavior.model.VerificationToken;
import com.formshield.behavior.service.VerificationTokenService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static com.formshield.behavior.testutil.TestDataFactory.T0;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TokenController.class)
class TokenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private VerificationTokenService tokenService;

    @Test
    void decode_success() throws Exception {
        when(tokenService.decode("abc=")).thenReturn(VerificationToken.builder()
                .timestamp(T0).score(87.5).confidence(0.92).sessionDurationMs(12_450).build());

        mockMvc.perform(post("/api/v1/tokens/decode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\": \"abc=\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timestamp").value(T0))
                .andExpect(jsonPath("$.score").value(87.5))
                .andExpect(jsonPath("$.sessionDurationMs").value(12450));
    }

    @Test
    void decode_invalidToken_badRequest() throws Exception {
        when(tokenService.decode("%%%")).thenThrow(new IllegalArgumentException("token is not valid Base64"));

        mockMvc.perform(post("/api/v1/tokens/decode")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\": \"%%%\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("token is not valid Base64"))
                .andExpect(jsonPath("$.field").value("token"));
    }
}
