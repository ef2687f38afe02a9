package uz.greenwhite.delegation.token;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import uz.greenwhite.delegation.delegation.DelegationService;
import uz.greenwhite.delegation.error.DelegationException;

import java.time.Instant;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TokenController.class)
@AutoConfigureMockMvc(addFilters = false)
class TokenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private DelegationService delegationService;

    @MockBean
    private TokenService tokenService;

    @Test
    void callbackStoresTokenAndReturnsUser() throws Exception {
        when(delegationService.complete("c0de", "st4te")).thenReturn(42L);

        mockMvc.perform(get("/api/v1/tokens").param("code", "c0de").param("state", "st4te"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.user_id").value(42));
    }

    @Test
    void callbackWithoutCodeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/tokens").param("state", "st4te"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("code not specified"));

        verifyNoInteractions(delegationService);
    }

    @Test
    void callbackWithBlankCodeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/tokens").param("code", " ").param("state", "st4te"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("code not specified"));

        verifyNoInteractions(delegationService);
    }

    @Test
    void callbackWithEmptyStateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/tokens").param("code", "c0de").param("state", ""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("state not specified"));

        verifyNoInteractions(delegationService);
    }

    @Test
    void callbackWithoutStateIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/tokens").param("code", "c0de"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("state not specified"));
    }

    @Test
    void callbackWithConsumedStateIsNotFound() throws Exception {
        when(delegationService.complete("c0de", "used")).thenThrow(DelegationException.notFound("exchange not found"));

        mockMvc.perform(get("/api/v1/tokens").param("code", "c0de").param("state", "used"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("exchange not found"));
    }

    @Test
    void getReturnsStoredToken() throws Exception {
        when(tokenService.get(42L, "yandex")).thenReturn(token());

        mockMvc.perform(get("/api/v1/tokens/42/yandex"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value(42))
                .andExpect(jsonPath("$.service").value("yandex"))
                .andExpect(jsonPath("$.access_token").value("at"))
                .andExpect(jsonPath("$.refresh_token").value("rt"))
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.expiry").value("2026-01-01T11:00:00Z"));
    }

    @Test
    void getOfMissingTokenIsNotFound() throws Exception {
        when(tokenService.get(7L, "vk")).thenThrow(DelegationException.notFound("token not found"));

        mockMvc.perform(get("/api/v1/tokens/7/vk"))
                .andExpect(status().isNotFound());
    }

    @Test
    void refreshReturnsRotatedToken() throws Exception {
        Token rotated = token().toBuilder().accessToken("at-2").build();
        when(tokenService.refresh(42L, "yandex")).thenReturn(rotated);

        mockMvc.perform(put("/api/v1/tokens/42/yandex"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").value("at-2"));
    }

    @Test
    void refreshFailureIsInternal() throws Exception {
        when(tokenService.refresh(42L, "yandex"))
                .thenThrow(DelegationException.internal("token expired and refresh token is not set", null));

        mockMvc.perform(put("/api/v1/tokens/42/yandex"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("internal error"));
    }

    private static Token token() {
        return Token.builder()
                .userId(42L)
                .service("yandex")
                .tokenType("bearer")
                .accessToken("at")
                .refreshToken("rt")
                .expiry(Instant.parse("2026-01-01T11:00:00Z"))
                .createdAt(Instant.parse("2026-01-01T10:00:00Z"))
                .build();
    }
}
