package com.givehub.backend.modules.auth.application;

import java.util.Locale;
import java.util.UUID;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.modules.auth.application.JwtTokenService.IssuedToken;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.auth.presentation.dto.AuthResponse;
import com.givehub.backend.modules.auth.presentation.dto.LoginRequest;
import com.givehub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.givehub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.givehub.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ResponseStatusException;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserAccountRepository userAccountRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final UnitOfWork unitOfWork;

    public AuthService(
            UserAccountRepository userAccountRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            UnitOfWork unitOfWork
    ) {
        this.userAccountRepository = userAccountRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.unitOfWork = unitOfWork;
    }

    public AuthResponse register(RegisterRequest request) {
        if (!StringUtils.hasText(request.name())
                || !StringUtils.hasText(request.email())
                || !StringUtils.hasText(request.password())) {
            throw ProblemException.validation("auth.missing_fields", "Name, email and password are required");
        }
        String email = normalizeEmail(request.email());

        UserAccount user = unitOfWork.execute("auth.register", () -> {
            if (userAccountRepository.existsByEmailIgnoreCase(email)) {
                throw ProblemException.conflict("auth.email_taken", "User with this email already exists");
            }
            UserAccount account = new UserAccount();
            account.setName(request.name().trim());
            account.setEmail(email);
            account.setPasswordHash(passwordEncoder.encode(request.password()));
            account.setPhoneNumber(trimToNull(request.phoneNumber()));
            account.setRole(UserRole.DONOR);
            return userAccountRepository.save(account);
        });

        log.info("Registered account userId={}", user.getId());
        return buildAuthResponse(user);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        UserAccount user = userAccountRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }
        return buildAuthResponse(user);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        return UserProfileResponse.from(findUser(userId));
    }

    public UserProfileResponse updateProfile(UUID userId, UpdateProfileRequest request) {
        return unitOfWork.execute("auth.updateProfile", () -> {
            UserAccount user = userAccountRepository.findByIdForUpdate(userId)
                    .orElseThrow(() -> ProblemException.notFound("user.not_found", "User not found"));
            if (request.name() != null) {
                if (!StringUtils.hasText(request.name())) {
                    throw ProblemException.validation("auth.name_blank", "Name must not be blank");
                }
                user.setName(request.name().trim());
            }
            if (request.phoneNumber() != null) {
                user.setPhoneNumber(trimToNull(request.phoneNumber()));
            }
            if (request.imageUrl() != null) {
                user.setImageUrl(trimToNull(request.imageUrl()));
            }
            if (StringUtils.hasText(request.password())) {
                user.setPasswordHash(passwordEncoder.encode(request.password()));
            }
            return UserProfileResponse.from(user);
        });
    }

    private AuthResponse buildAuthResponse(UserAccount user) {
        IssuedToken token = jwtTokenService.issueAccessToken(user.getId(), user.getRole());
        return new AuthResponse(
                token.accessToken(),
                AuthResponse.DEFAULT_TOKEN_TYPE,
                token.expiresIn(),
                UserProfileResponse.from(user)
        );
    }

    private UserAccount findUser(UUID userId) {
        return userAccountRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("user.not_found", "User not found"));
    }

    static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
