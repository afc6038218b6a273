package com.givehub.backend.modules.auth.presentation;

import com.givehub.backend.global.security.JwtAuthenticationPrincipal;
import com.givehub.backend.modules.auth.application.AuthService;
import com.givehub.backend.modules.auth.application.OneTimeCodeService;
import com.givehub.backend.modules.auth.presentation.dto.AuthResponse;
import com.givehub.backend.modules.auth.presentation.dto.LoginRequest;
import com.givehub.backend.modules.auth.presentation.dto.MessageResponse;
import com.givehub.backend.modules.auth.presentation.dto.OtpIssuedResponse;
import com.givehub.backend.modules.auth.presentation.dto.OtpRequest;
import com.givehub.backend.modules.auth.presentation.dto.OtpVerifyRequest;
import com.givehub.backend.modules.auth.presentation.dto.RegisterRequest;
import com.givehub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.givehub.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@Tag(name = "Auth", description = "Registration, login, profile and one-time codes")
public class AuthController {

    private final AuthService authService;
    private final OneTimeCodeService oneTimeCodeService;

    public AuthController(AuthService authService, OneTimeCodeService oneTimeCodeService) {
        this.authService = authService;
        this.oneTimeCodeService = oneTimeCodeService;
    }

    @PostMapping("/register")
    @Operation(summary = "Register a donor account")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    @Operation(summary = "Log in with email and password")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @GetMapping("/profile")
    @Operation(summary = "Current user's profile")
    public ResponseEntity<UserProfileResponse> profile(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }

    @PutMapping("/profile")
    @Operation(summary = "Update the current user's profile")
    public ResponseEntity<UserProfileResponse> updateProfile(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody UpdateProfileRequest request
    ) {
        return ResponseEntity.ok(authService.updateProfile(principal.userId(), request));
    }

    @PostMapping("/request-otp")
    @Operation(summary = "Issue a one-time code")
    public ResponseEntity<OtpIssuedResponse> requestOtp(@Valid @RequestBody OtpRequest request) {
        return ResponseEntity.ok(oneTimeCodeService.issueCode(request.email(), request.purpose()));
    }

    @PostMapping("/verify-otp")
    @Operation(summary = "Verify and consume a one-time code")
    public ResponseEntity<MessageResponse> verifyOtp(@Valid @RequestBody OtpVerifyRequest request) {
        oneTimeCodeService.verifyCode(request.email(), request.code(), request.purpose());
        return ResponseEntity.ok(new MessageResponse("OTP verified successfully"));
    }
}
