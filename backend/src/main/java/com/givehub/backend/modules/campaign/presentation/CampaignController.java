package com.givehub.backend.modules.campaign.presentation;

import java.util.Optional;
import java.util.UUID;

import com.givehub.backend.global.security.JwtAuthenticationPrincipal;
import com.givehub.backend.global.security.OrganizerAccessGate;
import com.givehub.backend.global.security.SecurityUtils;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.campaign.application.CampaignListFilter;
import com.givehub.backend.modules.campaign.application.CampaignService;
import com.givehub.backend.modules.campaign.presentation.dto.CampaignResponse;
import com.givehub.backend.modules.campaign.presentation.dto.CreateCampaignRequest;
import com.givehub.backend.modules.campaign.presentation.dto.UpdateCampaignRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/campaigns")
@Tag(name = "Campaigns", description = "Campaign lifecycle")
public class CampaignController {

    private final CampaignService campaignService;
    private final OrganizerAccessGate organizerAccessGate;

    public CampaignController(CampaignService campaignService, OrganizerAccessGate organizerAccessGate) {
        this.campaignService = campaignService;
        this.organizerAccessGate = organizerAccessGate;
    }

    @GetMapping
    @Operation(summary = "List campaigns visible to the caller")
    public ResponseEntity<PageResponse<CampaignResponse>> list(
            @RequestParam(name = "owner", required = false) UUID owner,
            @RequestParam(name = "approved", required = false) Boolean approved,
            @RequestParam(name = "closed", required = false) Boolean closed,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "limit", required = false) Integer limit
    ) {
        Optional<JwtAuthenticationPrincipal> caller = SecurityUtils.findCurrentPrincipal();
        CampaignListFilter filter = new CampaignListFilter(owner, approved, closed, search, PageQuery.of(page, limit));
        return ResponseEntity.ok(campaignService.listCampaigns(
                filter,
                caller.map(JwtAuthenticationPrincipal::userId).orElse(null),
                caller.map(JwtAuthenticationPrincipal::role).orElse(null)
        ));
    }

    @GetMapping("/{campaignId}")
    @Operation(summary = "Campaign detail")
    public ResponseEntity<CampaignResponse> get(@PathVariable UUID campaignId) {
        Optional<JwtAuthenticationPrincipal> caller = SecurityUtils.findCurrentPrincipal();
        return ResponseEntity.ok(campaignService.getCampaign(
                campaignId,
                caller.map(JwtAuthenticationPrincipal::userId).orElse(null),
                caller.map(JwtAuthenticationPrincipal::role).orElse(null)
        ));
    }

    @PostMapping
    @Operation(summary = "Create a campaign")
    public ResponseEntity<CampaignResponse> create(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateCampaignRequest request
    ) {
        organizerAccessGate.requireActiveOrganizer(principal);
        return ResponseEntity.status(HttpStatus.CREATED).body(campaignService.createCampaign(principal.userId(), request));
    }

    @PutMapping("/{campaignId}")
    @Operation(summary = "Update campaign details")
    public ResponseEntity<CampaignResponse> update(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID campaignId,
            @Valid @RequestBody UpdateCampaignRequest request
    ) {
        return ResponseEntity.ok(campaignService.updateCampaign(campaignId, principal.userId(), principal.role(), request));
    }

    @PatchMapping("/{campaignId}/approve")
    @Operation(summary = "Approve a campaign")
    public ResponseEntity<CampaignResponse> approve(@PathVariable UUID campaignId) {
        return ResponseEntity.ok(campaignService.approveCampaign(campaignId));
    }

    @PatchMapping("/{campaignId}/close")
    @Operation(summary = "Close a campaign")
    public ResponseEntity<CampaignResponse> close(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID campaignId
    ) {
        return ResponseEntity.ok(campaignService.closeCampaign(campaignId, principal.userId(), principal.role()));
    }

    @DeleteMapping("/{campaignId}")
    @Operation(summary = "Delete a campaign without donations")
    public ResponseEntity<Void> delete(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID campaignId
    ) {
        campaignService.deleteCampaign(campaignId, principal.userId(), principal.role());
        return ResponseEntity.noContent().build();
    }
}
