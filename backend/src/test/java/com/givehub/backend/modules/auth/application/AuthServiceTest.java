package com.givehub.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.error.ProblemKind;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.auth.presentation.dto.AuthResponse;
import com.givehub.backend.modules.auth.presentation.dto.LoginRequest;
import com.givehub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.givehub.backend.support.DirectUnitOfWork;
import com.givehub.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String SECRET = "auth-service-test-secret-with-enough-bytes-0123456789";

    @Mock
    private UserAccountRepository userAccountRepository;

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private JwtTokenService jwtTokenService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        jwtTokenService = new JwtTokenService(new JwtTokenProvider(SECRET), 3_600_000L, clock);
        authService = new AuthService(userAccountRepository, passwordEncoder, jwtTokenService, new DirectUnitOfWork());
    }

    @Test
    @DisplayName("registration stores a hashed password, a lower-cased email and the DONOR role")
    void register_createsDonor() {
        when(userAccountRepository.existsByEmailIgnoreCase("jane@example.com")).thenReturn(false);
        when(userAccountRepository.save(any(UserAccount.class))).thenAnswer(invocation -> {
            UserAccount saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
            return saved;
        });

        AuthResponse response = authService.register(new RegisterRequest(" Jane ", " Jane@Example.com ", "secret123", null));

        assertThat(response.tokenType()).isEqualTo("Bearer");
        assertThat(response.expiresIn()).isEqualTo(3600L);
        assertThat(response.user().email()).isEqualTo("jane@example.com");
        assertThat(response.user().name()).isEqualTo("Jane");
        assertThat(response.user().role()).isEqualTo(UserRole.DONOR);
        assertThat(jwtTokenService.parseAccessToken(response.accessToken()).userId()).isEqualTo(response.user().id());
    }

    @Test
    @DisplayName("registration with a taken email conflicts")
    void register_rejectsDuplicateEmail() {
        when(userAccountRepository.existsByEmailIgnoreCase("jane@example.com")).thenReturn(true);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.register(new RegisterRequest("Jane", "JANE@example.com", "secret123", null)));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.CONFLICT);
        assertThat(ex.getCode()).isEqualTo("auth.email_taken");
        verify(userAccountRepository, never()).save(any());
    }

    @Test
    @DisplayName("registration without a password fails validation")
    void register_requiresFields() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.register(new RegisterRequest("Jane", "jane@example.com", " ", null)));

        assertThat(ex.getKind()).isEqualTo(ProblemKind.VALIDATION);
        verifyNoInteractions(userAccountRepository);
    }

    @Test
    @DisplayName("login with the right password issues a token")
    void login_success() {
        UserAccount user = TestEntities.user(UserRole.DONOR);
        user.setEmail("jane@example.com");
        user.setPasswordHash(passwordEncoder.encode("secret123"));
        when(userAccountRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));

        AuthResponse response = authService.login(new LoginRequest("Jane@example.com", "secret123"));

        assertThat(response.user().id()).isEqualTo(user.getId());
        assertThat(jwtTokenService.parseAccessToken(response.accessToken()).role()).isEqualTo("DONOR");
    }

    @Test
    @DisplayName("wrong password and unknown email both yield 401 INVALID_CREDENTIALS")
    void login_invalidCredentials() {
        UserAccount user = TestEntities.user(UserRole.DONOR);
        user.setPasswordHash(passwordEncoder.encode("secret123"));
        when(userAccountRepository.findByEmailIgnoreCase("jane@example.com")).thenReturn(Optional.of(user));
        when(userAccountRepository.findByEmailIgnoreCase("ghost@example.com")).thenReturn(Optional.empty());

        ResponseStatusException wrongPassword = assertThrows(ResponseStatusException.class,
                () -> authService.login(new LoginRequest("jane@example.com", "wrong-password")));
        ResponseStatusException unknown = assertThrows(ResponseStatusException.class,
                () -> authService.login(new LoginRequest("ghost@example.com", "secret123")));

        assertThat(wrongPassword.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(wrongPassword.getReason()).isEqualTo("INVALID_CREDENTIALS");
        assertThat(unknown.getReason()).isEqualTo("INVALID_CREDENTIALS");
    }
}
