package com.givehub.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import com.givehub.backend.modules.auth.domain.OneTimeCode;
import com.givehub.backend.modules.auth.domain.OtpPurpose;
import com.givehub.backend.modules.auth.infrastructure.persistence.OneTimeCodeRepository;
import com.givehub.backend.support.AbstractPostgresIntegrationTest;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class OneTimeCodeIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String VERIFY_BODY = """
            {"email": "jane@givehub.test", "code": "424242", "purpose": "REGISTER"}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private OneTimeCodeRepository oneTimeCodeRepository;

    @Test
    void duplicateCodeValueIsVerifiedOnceAndThenRejected() throws Exception {
        OffsetDateTime expiresAt = OffsetDateTime.now(ZoneOffset.UTC).plusMinutes(10);
        oneTimeCodeRepository.save(new OneTimeCode(null, "jane@givehub.test", "424242", OtpPurpose.REGISTER, expiresAt));
        oneTimeCodeRepository.save(new OneTimeCode(null, "jane@givehub.test", "424242", OtpPurpose.REGISTER, expiresAt));

        mockMvc.perform(post("/auth/verify-otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VERIFY_BODY))
                .andExpect(status().isOk());

        List<OneTimeCode> codes = oneTimeCodeRepository.findAll();
        assertThat(codes).filteredOn(OneTimeCode::isUsed).hasSize(1);

        mockMvc.perform(post("/auth/verify-otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VERIFY_BODY))
                .andExpect(status().isOk());

        mockMvc.perform(post("/auth/verify-otp")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VERIFY_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("otp.invalid"));
    }
}
