package com.givehub.backend.modules.organizer.presentation;

import java.util.List;
import java.util.UUID;

import com.givehub.backend.global.security.JwtAuthenticationPrincipal;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.givehub.backend.modules.organizer.application.OrganizerAccountService;
import com.givehub.backend.modules.organizer.application.OrganizerApplicationService;
import com.givehub.backend.modules.organizer.application.OrganizerStatusFilter;
import com.givehub.backend.modules.organizer.domain.ApplicationStatus;
import com.givehub.backend.modules.organizer.presentation.dto.ApplicationResponse;
import com.givehub.backend.modules.organizer.presentation.dto.ReasonRequest;
import com.givehub.backend.modules.organizer.presentation.dto.RevocationResponse;
import com.givehub.backend.modules.organizer.presentation.dto.SubmitApplicationRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/organizers")
@Tag(name = "Organizers", description = "Organizer applications and account governance")
public class OrganizerController {

    private final OrganizerApplicationService applicationService;
    private final OrganizerAccountService accountService;

    public OrganizerController(OrganizerApplicationService applicationService, OrganizerAccountService accountService) {
        this.applicationService = applicationService;
        this.accountService = accountService;
    }

    @PostMapping("/apply")
    @Operation(summary = "Submit an organizer application")
    public ResponseEntity<ApplicationResponse> apply(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody SubmitApplicationRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(applicationService.submitApplication(principal.userId(), request));
    }

    @GetMapping("/my-applications")
    @Operation(summary = "Applications submitted by the current user")
    public ResponseEntity<List<ApplicationResponse>> myApplications(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(applicationService.listMyApplications(principal.userId()));
    }

    @GetMapping("/applications")
    @Operation(summary = "List organizer applications")
    public ResponseEntity<PageResponse<ApplicationResponse>> applications(
            @RequestParam(name = "status", required = false) ApplicationStatus status,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(applicationService.listApplications(status, PageQuery.of(page, limit)));
    }

    @GetMapping("/applications/{applicationId}")
    @Operation(summary = "Organizer application detail")
    public ResponseEntity<ApplicationResponse> application(@PathVariable UUID applicationId) {
        return ResponseEntity.ok(applicationService.getApplication(applicationId));
    }

    @PatchMapping("/applications/{applicationId}/approve")
    @Operation(summary = "Approve an application and promote the applicant")
    public ResponseEntity<ApplicationResponse> approve(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID applicationId
    ) {
        return ResponseEntity.ok(applicationService.approveApplication(applicationId, principal.userId()));
    }

    @PatchMapping("/applications/{applicationId}/reject")
    @Operation(summary = "Reject an application")
    public ResponseEntity<ApplicationResponse> reject(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID applicationId,
            @Valid @RequestBody(required = false) ReasonRequest request
    ) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(applicationService.rejectApplication(applicationId, principal.userId(), reason));
    }

    @GetMapping
    @Operation(summary = "List organizers")
    public ResponseEntity<PageResponse<UserProfileResponse>> organizers(
            @RequestParam(name = "status", required = false) OrganizerStatusFilter status,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(accountService.listOrganizers(status, PageQuery.of(page, limit)));
    }

    @PatchMapping("/{organizerId}/revoke")
    @Operation(summary = "Revoke an organizer, closing campaigns and rejecting pending withdrawals")
    public ResponseEntity<RevocationResponse> revoke(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID organizerId,
            @Valid @RequestBody(required = false) ReasonRequest request
    ) {
        String reason = request != null ? request.reason() : null;
        return ResponseEntity.ok(accountService.revokeOrganizer(organizerId, principal.userId(), reason));
    }

    @PatchMapping("/{organizerId}/reinstate")
    @Operation(summary = "Reinstate a revoked organizer")
    public ResponseEntity<UserProfileResponse> reinstate(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID organizerId
    ) {
        return ResponseEntity.ok(accountService.reinstateOrganizer(organizerId, principal.userId()));
    }
}
