package com.givehub.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.error.ProblemKind;
import com.givehub.backend.modules.auth.domain.OneTimeCode;
import com.givehub.backend.modules.auth.domain.OtpPurpose;
import com.givehub.backend.modules.auth.infrastructure.persistence.OneTimeCodeRepository;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.auth.presentation.dto.OtpIssuedResponse;
import com.givehub.backend.support.DirectUnitOfWork;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OneTimeCodeServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-02-01T08:00:00Z");

    @Mock
    private OneTimeCodeRepository oneTimeCodeRepository;

    @Mock
    private UserAccountRepository userAccountRepository;

    private Clock clock;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
    }

    @Test
    @DisplayName("issued code is six digits, expires after the TTL and is hidden by default")
    void issueCode_storesCode() {
        OneTimeCodeService service = service(false);
        when(userAccountRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.empty());

        OtpIssuedResponse response = service.issueCode(" Jane@Example.com", OtpPurpose.REGISTER);

        ArgumentCaptor<OneTimeCode> captor = ArgumentCaptor.forClass(OneTimeCode.class);
        verify(oneTimeCodeRepository).save(captor.capture());
        OneTimeCode saved = captor.getValue();
        assertThat(saved.getCode()).matches("\\d{6}");
        assertThat(saved.getEmail()).isEqualTo("jane@example.com");
        assertThat(saved.getExpiresAt()).isEqualTo(NOW.plusMinutes(10));
        assertThat(response.expiresAt()).isEqualTo(NOW.plusMinutes(10));
        assertThat(response.code()).isNull();
    }

    @Test
    @DisplayName("code is echoed back when exposure is enabled")
    void issueCode_exposesCode() {
        OneTimeCodeService service = service(true);
        when(userAccountRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.empty());

        OtpIssuedResponse response = service.issueCode("jane@example.com", OtpPurpose.FORGOT_PASSWORD);

        ArgumentCaptor<OneTimeCode> captor = ArgumentCaptor.forClass(OneTimeCode.class);
        verify(oneTimeCodeRepository).save(captor.capture());
        assertThat(response.code()).isEqualTo(captor.getValue().getCode());
    }

    @Test
    @DisplayName("matching unused code is consumed")
    void verifyCode_marksUsed() {
        OneTimeCodeService service = service(false);
        OneTimeCode otp = new OneTimeCode(null, "jane@example.com", "123456", OtpPurpose.REGISTER, NOW.plusMinutes(5));
        when(oneTimeCodeRepository.findUsableForUpdate("jane@example.com", "123456", OtpPurpose.REGISTER, NOW))
                .thenReturn(List.of(otp));

        service.verifyCode("jane@example.com", " 123456 ", OtpPurpose.REGISTER);

        assertThat(otp.isUsed()).isTrue();
    }

    @Test
    @DisplayName("same code issued twice consumes only the newest one")
    void verifyCode_duplicateValueConsumesNewest() {
        OneTimeCodeService service = service(false);
        OneTimeCode newest = new OneTimeCode(null, "jane@example.com", "123456", OtpPurpose.REGISTER, NOW.plusMinutes(9));
        OneTimeCode older = new OneTimeCode(null, "jane@example.com", "123456", OtpPurpose.REGISTER, NOW.plusMinutes(2));
        when(oneTimeCodeRepository.findUsableForUpdate("jane@example.com", "123456", OtpPurpose.REGISTER, NOW))
                .thenReturn(List.of(newest, older));

        service.verifyCode("jane@example.com", "123456", OtpPurpose.REGISTER);

        assertThat(newest.isUsed()).isTrue();
        assertThat(older.isUsed()).isFalse();
    }

    @Test
    @DisplayName("unknown or expired code fails validation")
    void verifyCode_rejectsInvalidCode() {
        OneTimeCodeService service = service(false);
        when(oneTimeCodeRepository.findUsableForUpdate(eq("jane@example.com"), anyString(), eq(OtpPurpose.REGISTER), any()))
                .thenReturn(List.of());

        ProblemException ex = assertThrows(ProblemException.class,
                () -> service.verifyCode("jane@example.com", "000000", OtpPurpose.REGISTER));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.VALIDATION);
        assertThat(ex.getCode()).isEqualTo("otp.invalid");
    }

    @Test
    void purgeExpired_deletesCodesPastExpiry() {
        OneTimeCodeService service = service(false);
        when(oneTimeCodeRepository.deleteExpired(NOW)).thenReturn(3);

        assertThat(service.purgeExpired()).isEqualTo(3);
    }

    private OneTimeCodeService service(boolean exposeCode) {
        return new OneTimeCodeService(oneTimeCodeRepository, userAccountRepository, new DirectUnitOfWork(), clock, 10, exposeCode);
    }
}
