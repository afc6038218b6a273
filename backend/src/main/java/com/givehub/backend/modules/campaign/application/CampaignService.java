package com.givehub.backend.modules.campaign.application;

import java.math.BigDecimal;
import java.util.UUID;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.modules.campaign.infrastructure.persistence.CampaignRepository;
import com.givehub.backend.modules.campaign.infrastructure.persistence.CampaignSearchCondition;
import com.givehub.backend.modules.campaign.presentation.dto.CampaignResponse;
import com.givehub.backend.modules.campaign.presentation.dto.CreateCampaignRequest;
import com.givehub.backend.modules.campaign.presentation.dto.UpdateCampaignRequest;
import com.givehub.backend.modules.withdrawal.infrastructure.persistence.WithdrawalRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class CampaignService {

    private static final Logger log = LoggerFactory.getLogger(CampaignService.class);

    private final CampaignRepository campaignRepository;
    private final UserAccountRepository userAccountRepository;
    private final WithdrawalRequestRepository withdrawalRequestRepository;
    private final UnitOfWork unitOfWork;

    public CampaignService(
            CampaignRepository campaignRepository,
            UserAccountRepository userAccountRepository,
            WithdrawalRequestRepository withdrawalRequestRepository,
            UnitOfWork unitOfWork
    ) {
        this.campaignRepository = campaignRepository;
        this.userAccountRepository = userAccountRepository;
        this.withdrawalRequestRepository = withdrawalRequestRepository;
        this.unitOfWork = unitOfWork;
    }

    public CampaignResponse createCampaign(UUID organizerId, CreateCampaignRequest request) {
        if (request == null || !StringUtils.hasText(request.title())) {
            throw ProblemException.validation("campaign.title_required", "Title is required");
        }
        ensurePositiveTarget(request.target());

        return unitOfWork.execute("campaign.create", () -> {
            UserAccount owner = userAccountRepository.findById(organizerId)
                    .filter(user -> user.getRole() == UserRole.ORGANIZER && user.isOrganizerApproved())
                    .orElseThrow(() -> ProblemException.forbidden("campaign.organizer_required",
                            "Only approved organizers can create campaigns"));

            Campaign campaign = new Campaign();
            campaign.setOwner(owner);
            campaign.setTitle(request.title().trim());
            campaign.setDescription(request.description());
            campaign.setImages(request.images());
            campaign.setTarget(request.target());
            Campaign saved = campaignRepository.save(campaign);

            log.info("Campaign created campaignId={} ownerId={}", saved.getId(), organizerId);
            return CampaignResponse.from(saved);
        });
    }

    /**
     * Unapproved campaigns are reported as missing to everyone except their owner and admins.
     */
    @Transactional(readOnly = true)
    public CampaignResponse getCampaign(UUID campaignId, UUID callerId, UserRole callerRole) {
        Campaign campaign = campaignRepository.findWithOwnerById(campaignId)
                .orElseThrow(CampaignService::campaignNotFound);
        if (!campaign.isApproved() && callerRole != UserRole.ADMIN && !campaign.isOwnedBy(callerId)) {
            throw campaignNotFound();
        }
        return CampaignResponse.from(campaign);
    }

    public CampaignResponse updateCampaign(UUID campaignId, UUID callerId, UserRole callerRole, UpdateCampaignRequest patch) {
        return unitOfWork.execute("campaign.update", () -> {
            Campaign campaign = findCampaignForUpdate(campaignId);
            ensureOwnerOrAdmin(campaign, callerId, callerRole);

            if (patch.title() != null) {
                if (!StringUtils.hasText(patch.title())) {
                    throw ProblemException.validation("campaign.title_required", "Title must not be blank");
                }
                campaign.setTitle(patch.title().trim());
            }
            if (patch.description() != null) {
                campaign.setDescription(patch.description());
            }
            if (patch.images() != null) {
                campaign.setImages(patch.images());
            }
            if (patch.target() != null) {
                ensurePositiveTarget(patch.target());
                campaign.setTarget(patch.target());
            }
            return CampaignResponse.from(campaign);
        });
    }

    /**
     * Idempotent: approving an approved campaign succeeds without changes.
     */
    public CampaignResponse approveCampaign(UUID campaignId) {
        return unitOfWork.execute("campaign.approve", () -> {
            Campaign campaign = findCampaignForUpdate(campaignId);
            if (campaign.approve()) {
                log.info("Campaign approved campaignId={}", campaignId);
            } else {
                log.info("Campaign already approved campaignId={}", campaignId);
            }
            return CampaignResponse.from(campaign);
        });
    }

    public CampaignResponse closeCampaign(UUID campaignId, UUID callerId, UserRole callerRole) {
        return unitOfWork.execute("campaign.close", () -> {
            Campaign campaign = findCampaignForUpdate(campaignId);
            ensureOwnerOrAdmin(campaign, callerId, callerRole);
            if (campaign.isClosed()) {
                throw ProblemException.illegalState("campaign.already_closed", "Campaign is already closed");
            }
            campaign.close(null);
            log.info("Campaign closed campaignId={} callerId={}", campaignId, callerId);
            return CampaignResponse.from(campaign);
        });
    }

    public void deleteCampaign(UUID campaignId, UUID callerId, UserRole callerRole) {
        unitOfWork.run("campaign.delete", () -> {
            Campaign campaign = findCampaignForUpdate(campaignId);
            ensureOwnerOrAdmin(campaign, callerId, callerRole);
            if (campaign.getRaised().signum() > 0) {
                throw ProblemException.conflict("campaign.has_donations", "Cannot delete campaign with existing donations");
            }
            if (withdrawalRequestRepository.existsByCampaignId(campaignId)) {
                throw ProblemException.conflict("campaign.has_withdrawals", "Cannot delete campaign with withdrawal history");
            }
            campaignRepository.delete(campaign);
            log.info("Campaign deleted campaignId={} callerId={}", campaignId, callerId);
        });
    }

    @Transactional(readOnly = true)
    public PageResponse<CampaignResponse> listCampaigns(CampaignListFilter filter, UUID callerId, UserRole callerRole) {
        CampaignSearchCondition condition = resolveVisibility(filter, callerId, callerRole);
        return PageResponse.of(
                campaignRepository.search(condition, filter.pageQuery().newestFirst()),
                CampaignResponse::from
        );
    }

    static CampaignSearchCondition resolveVisibility(CampaignListFilter filter, UUID callerId, UserRole callerRole) {
        Boolean approved;
        if (callerRole == UserRole.ADMIN) {
            approved = filter.approved();
        } else if (callerId != null && callerId.equals(filter.owner())) {
            approved = null;
        } else {
            approved = Boolean.TRUE;
        }
        return new CampaignSearchCondition(filter.owner(), approved, filter.closed(), filter.search());
    }

    private Campaign findCampaignForUpdate(UUID campaignId) {
        return campaignRepository.findByIdForUpdate(campaignId)
                .orElseThrow(CampaignService::campaignNotFound);
    }

    private void ensureOwnerOrAdmin(Campaign campaign, UUID callerId, UserRole callerRole) {
        if (callerRole != UserRole.ADMIN && !campaign.isOwnedBy(callerId)) {
            throw ProblemException.forbidden("campaign.not_owner", "You are not authorized to modify this campaign");
        }
    }

    private void ensurePositiveTarget(BigDecimal target) {
        if (target == null || target.signum() <= 0) {
            throw ProblemException.validation("campaign.invalid_target", "Target must be greater than 0");
        }
    }

    private static ProblemException campaignNotFound() {
        return ProblemException.notFound("campaign.not_found", "Campaign not found");
    }
}
