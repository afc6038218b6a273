package com.givehub.backend.modules.donation.presentation;

import java.util.List;
import java.util.UUID;

import com.givehub.backend.global.security.JwtAuthenticationPrincipal;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.donation.application.DonationService;
import com.givehub.backend.modules.donation.domain.DonationMethod;
import com.givehub.backend.modules.donation.domain.DonationStatus;
import com.givehub.backend.modules.donation.presentation.dto.CreateDonationRequest;
import com.givehub.backend.modules.donation.presentation.dto.DonationResponse;
import com.givehub.backend.modules.donation.presentation.dto.DonationStatsResponse;
import com.givehub.backend.modules.donation.presentation.dto.PublicDonationResponse;
import com.givehub.backend.modules.donation.presentation.dto.UpdateDonationStatusRequest;

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
@RequestMapping("/donations")
@Tag(name = "Donations", description = "Donation intake and reconciliation")
public class DonationController {

    private final DonationService donationService;

    public DonationController(DonationService donationService) {
        this.donationService = donationService;
    }

    @PostMapping
    @Operation(summary = "Create a pending donation")
    public ResponseEntity<DonationResponse> create(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateDonationRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(donationService.createDonation(principal.userId(), request));
    }

    @PatchMapping("/{donationId}/status")
    @Operation(summary = "Reconcile a donation's payment status")
    public ResponseEntity<DonationResponse> updateStatus(
            @PathVariable UUID donationId,
            @Valid @RequestBody UpdateDonationStatusRequest request
    ) {
        return ResponseEntity.ok(donationService.updateDonationStatus(donationId, request.status(), request.paymentDetails()));
    }

    @GetMapping("/campaign/{campaignId}")
    @Operation(summary = "Completed donations of a campaign")
    public ResponseEntity<PageResponse<PublicDonationResponse>> campaignDonations(
            @PathVariable UUID campaignId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(donationService.listCampaignDonations(campaignId, PageQuery.of(page, limit)));
    }

    @GetMapping("/my-donations")
    @Operation(summary = "Donations made by the current user")
    public ResponseEntity<List<DonationResponse>> myDonations(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(donationService.listDonorDonations(principal.userId()));
    }

    @GetMapping("/stats")
    @Operation(summary = "Completed donation totals across all campaigns")
    public ResponseEntity<DonationStatsResponse> stats() {
        return ResponseEntity.ok(donationService.getDonationStats(null));
    }

    @GetMapping("/stats/{campaignId}")
    @Operation(summary = "Completed donation totals for one campaign")
    public ResponseEntity<DonationStatsResponse> campaignStats(@PathVariable UUID campaignId) {
        return ResponseEntity.ok(donationService.getDonationStats(campaignId));
    }

    @GetMapping
    @Operation(summary = "List donations")
    public ResponseEntity<PageResponse<DonationResponse>> list(
            @RequestParam(name = "status", required = false) DonationStatus status,
            @RequestParam(name = "method", required = false) DonationMethod method,
            @RequestParam(name = "campaign", required = false) UUID campaignId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return ResponseEntity.ok(donationService.listDonations(status, method, campaignId, PageQuery.of(page, limit)));
    }
}
