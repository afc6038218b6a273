package com.givehub.backend.modules.organizer.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.givehub.backend.modules.campaign.infrastructure.persistence.CampaignRepository;
import com.givehub.backend.modules.organizer.presentation.dto.RevocationResponse;
import com.givehub.backend.modules.withdrawal.infrastructure.persistence.WithdrawalRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Admin governance of organizer accounts. Revocation closes the organizer's open campaigns and
 * rejects their pending withdrawals in the same transaction as the flag change.
 */
@Service
public class OrganizerAccountService {

    private static final Logger log = LoggerFactory.getLogger(OrganizerAccountService.class);

    static final int MIN_REVOCATION_REASON_LENGTH = 10;
    public static final String REVOKED_CAMPAIGN_REASON = "Organizer account revoked";
    public static final String REVOKED_WITHDRAWAL_MESSAGE = "Organizer account has been revoked";

    private final UserAccountRepository userAccountRepository;
    private final CampaignRepository campaignRepository;
    private final WithdrawalRequestRepository withdrawalRequestRepository;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public OrganizerAccountService(
            UserAccountRepository userAccountRepository,
            CampaignRepository campaignRepository,
            WithdrawalRequestRepository withdrawalRequestRepository,
            UnitOfWork unitOfWork,
            Clock clock
    ) {
        this.userAccountRepository = userAccountRepository;
        this.campaignRepository = campaignRepository;
        this.withdrawalRequestRepository = withdrawalRequestRepository;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    public RevocationResponse revokeOrganizer(UUID organizerId, UUID adminId, String reason) {
        if (reason == null || reason.trim().length() < MIN_REVOCATION_REASON_LENGTH) {
            throw ProblemException.validation("organizer.revocation_reason_too_short",
                    "Revocation reason must be at least " + MIN_REVOCATION_REASON_LENGTH + " characters");
        }
        String trimmedReason = reason.trim();

        return unitOfWork.execute("organizer.revoke", () -> {
            UserAccount organizer = findUserForUpdate(organizerId);
            ensureOrganizer(organizer);
            if (organizer.isOrganizerRevoked()) {
                throw ProblemException.illegalState("organizer.already_revoked", "Organizer is already revoked");
            }

            OffsetDateTime now = OffsetDateTime.now(clock);
            UserAccount admin = userAccountRepository.getReferenceById(adminId);
            organizer.revoke(admin, trimmedReason, now);
            UserProfileResponse profile = UserProfileResponse.from(organizer);

            int closedCampaigns = campaignRepository.closeOpenCampaignsByOwner(organizerId, REVOKED_CAMPAIGN_REASON, now);
            int rejectedWithdrawals = withdrawalRequestRepository.rejectPendingByOrganizer(
                    organizerId, admin, REVOKED_WITHDRAWAL_MESSAGE, now);

            log.info("Organizer revoked organizerId={} adminId={} closedCampaigns={} rejectedWithdrawals={}",
                    organizerId, adminId, closedCampaigns, rejectedWithdrawals);
            return new RevocationResponse(profile, closedCampaigns, rejectedWithdrawals);
        });
    }

    /**
     * Clears the revocation. Campaigns closed by the revocation stay closed.
     */
    public UserProfileResponse reinstateOrganizer(UUID organizerId, UUID adminId) {
        return unitOfWork.execute("organizer.reinstate", () -> {
            UserAccount organizer = findUserForUpdate(organizerId);
            ensureOrganizer(organizer);
            if (!organizer.isOrganizerRevoked()) {
                throw ProblemException.illegalState("organizer.not_revoked", "Organizer is not revoked");
            }
            organizer.reinstate();
            log.info("Organizer reinstated organizerId={} adminId={}", organizerId, adminId);
            return UserProfileResponse.from(organizer);
        });
    }

    @Transactional(readOnly = true)
    public PageResponse<UserProfileResponse> listOrganizers(OrganizerStatusFilter filter, PageQuery pageQuery) {
        Boolean approved = filter != null ? filter.approved() : null;
        Boolean revoked = filter != null ? filter.revoked() : null;
        return PageResponse.of(
                userAccountRepository.findByRoleAndFlags(UserRole.ORGANIZER, approved, revoked, pageQuery.newestFirst()),
                UserProfileResponse::from
        );
    }

    private UserAccount findUserForUpdate(UUID userId) {
        return userAccountRepository.findByIdForUpdate(userId)
                .orElseThrow(() -> ProblemException.notFound("user.not_found", "User not found"));
    }

    private void ensureOrganizer(UserAccount user) {
        if (user.getRole() != UserRole.ORGANIZER) {
            throw ProblemException.illegalState("organizer.not_organizer", "User is not an organizer");
        }
    }
}
