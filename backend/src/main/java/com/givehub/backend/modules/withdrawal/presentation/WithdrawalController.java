package com.givehub.backend.modules.withdrawal.presentation;

import java.util.List;
import java.util.UUID;

import com.givehub.backend.global.security.JwtAuthenticationPrincipal;
import com.givehub.backend.global.security.OrganizerAccessGate;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.withdrawal.application.WithdrawalService;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus;
import com.givehub.backend.modules.withdrawal.presentation.dto.CreateWithdrawalRequest;
import com.givehub.backend.modules.withdrawal.presentation.dto.MarkPaidRequest;
import com.givehub.backend.modules.withdrawal.presentation.dto.RejectWithdrawalRequest;
import com.givehub.backend.modules.withdrawal.presentation.dto.WithdrawalResponse;

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
@RequestMapping("/withdrawals")
@Tag(name = "Withdrawals", description = "Organizer payouts")
public class WithdrawalController {

    private final WithdrawalService withdrawalService;
    private final OrganizerAccessGate organizerAccessGate;

    public WithdrawalController(WithdrawalService withdrawalService, OrganizerAccessGate organizerAccessGate) {
        this.withdrawalService = withdrawalService;
        this.organizerAccessGate = organizerAccessGate;
    }

    @PostMapping
    @Operation(summary = "Request a withdrawal from a campaign")
    public ResponseEntity<WithdrawalResponse> create(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateWithdrawalRequest request
    ) {
        organizerAccessGate.requireActiveOrganizer(principal);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(withdrawalService.createWithdrawalRequest(principal.userId(), request));
    }

    @GetMapping("/my-withdrawals")
    @Operation(summary = "Withdrawals requested by the current organizer")
    public ResponseEntity<List<WithdrawalResponse>> myWithdrawals(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(withdrawalService.listOrganizerWithdrawals(principal.userId()));
    }

    @GetMapping
    @Operation(summary = "List withdrawal requests")
    public ResponseEntity<PageResponse<WithdrawalResponse>> list(
            @RequestParam(name = "status", required = false) WithdrawalStatus status,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(withdrawalService.listWithdrawals(status, PageQuery.of(page, limit)));
    }

    @GetMapping("/{withdrawalId}")
    @Operation(summary = "Withdrawal request detail")
    public ResponseEntity<WithdrawalResponse> get(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID withdrawalId
    ) {
        return ResponseEntity.ok(withdrawalService.getWithdrawal(withdrawalId, principal.userId(), principal.role()));
    }

    @PatchMapping("/{withdrawalId}/approve")
    @Operation(summary = "Approve a pending withdrawal")
    public ResponseEntity<WithdrawalResponse> approve(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID withdrawalId
    ) {
        return ResponseEntity.ok(withdrawalService.approveWithdrawal(withdrawalId, principal.userId()));
    }

    @PatchMapping("/{withdrawalId}/reject")
    @Operation(summary = "Reject a pending withdrawal")
    public ResponseEntity<WithdrawalResponse> reject(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID withdrawalId,
            @Valid @RequestBody(required = false) RejectWithdrawalRequest request
    ) {
        String message = request != null ? request.adminMessage() : null;
        return ResponseEntity.ok(withdrawalService.rejectWithdrawal(withdrawalId, principal.userId(), message));
    }

    @PatchMapping("/{withdrawalId}/mark-paid")
    @Operation(summary = "Mark an approved withdrawal as paid")
    public ResponseEntity<WithdrawalResponse> markPaid(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID withdrawalId,
            @Valid @RequestBody(required = false) MarkPaidRequest request
    ) {
        String reference = request != null ? request.paymentReference() : null;
        return ResponseEntity.ok(withdrawalService.markAsPaid(withdrawalId, principal.userId(), reference));
    }
}
