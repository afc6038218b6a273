package com.givehub.backend.modules.donation.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.modules.campaign.infrastructure.persistence.CampaignRepository;
import com.givehub.backend.modules.donation.domain.BalanceEffect;
import com.givehub.backend.modules.donation.domain.Donation;
import com.givehub.backend.modules.donation.domain.DonationMethod;
import com.givehub.backend.modules.donation.domain.DonationStatus;
import com.givehub.backend.modules.donation.domain.PaymentDetails;
import com.givehub.backend.modules.donation.infrastructure.persistence.DonationRepository;
import com.givehub.backend.modules.donation.infrastructure.persistence.DonationTotals;
import com.givehub.backend.modules.donation.presentation.dto.CreateDonationRequest;
import com.givehub.backend.modules.donation.presentation.dto.DonationResponse;
import com.givehub.backend.modules.donation.presentation.dto.DonationStatsResponse;
import com.givehub.backend.modules.donation.presentation.dto.PublicDonationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Donation intake and reconciliation. A campaign's raised total changes only through
 * {@link #updateDonationStatus}, by the delta {@link DonationStatus#balanceEffectOf} selects.
 */
@Service
public class DonationService {

    private static final Logger log = LoggerFactory.getLogger(DonationService.class);

    static final BigDecimal MIN_AMOUNT = new BigDecimal("0.01");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(Campaign.MONEY_SCALE);

    private final DonationRepository donationRepository;
    private final CampaignRepository campaignRepository;
    private final UserAccountRepository userAccountRepository;
    private final UnitOfWork unitOfWork;

    public DonationService(
            DonationRepository donationRepository,
            CampaignRepository campaignRepository,
            UserAccountRepository userAccountRepository,
            UnitOfWork unitOfWork
    ) {
        this.donationRepository = donationRepository;
        this.campaignRepository = campaignRepository;
        this.userAccountRepository = userAccountRepository;
        this.unitOfWork = unitOfWork;
    }

    public DonationResponse createDonation(UUID donorId, CreateDonationRequest request) {
        validateDonation(request);
        String donorEmail = request.donorEmail().trim().toLowerCase(Locale.ROOT);

        return unitOfWork.execute("donation.create", () -> {
            Campaign campaign = campaignRepository.findById(request.campaignId())
                    .orElseThrow(() -> ProblemException.notFound("campaign.not_found", "Campaign not found"));
            if (!campaign.isApproved()) {
                throw ProblemException.illegalState("donation.campaign_not_approved", "Campaign is not approved yet");
            }
            if (campaign.isClosed()) {
                throw ProblemException.illegalState("donation.campaign_closed", "Campaign is closed");
            }

            Donation donation = new Donation();
            donation.setCampaign(campaign);
            donation.setDonor(userAccountRepository.getReferenceById(donorId));
            donation.setDonorEmail(donorEmail);
            donation.setAmount(request.amount());
            donation.setMethod(request.method());
            if (request.method() == DonationMethod.CRYPTO) {
                donation.mergePaymentDetails(new PaymentDetails(null, null, null, null, null,
                        request.cryptoCurrency(), request.transactionHash(), request.network()));
            }
            Donation saved = donationRepository.save(donation);
            log.info("Donation created donationId={} campaignId={} amount={}", saved.getId(), campaign.getId(), saved.getAmount());
            return DonationResponse.from(saved);
        });
    }

    /**
     * Sets the status, merges payment metadata and applies the balance delta in one transaction.
     */
    public DonationResponse updateDonationStatus(UUID donationId, DonationStatus newStatus, PaymentDetails paymentDetails) {
        if (newStatus == null) {
            throw ProblemException.validation("donation.status_required", "Status is required");
        }
        return unitOfWork.execute("donation.updateStatus", () -> {
            Donation donation = donationRepository.findByIdForUpdate(donationId)
                    .orElseThrow(() -> ProblemException.notFound("donation.not_found", "Donation not found"));
            Campaign campaign = campaignRepository.findByIdForUpdate(donation.getCampaign().getId())
                    .orElseThrow(() -> ProblemException.notFound("campaign.not_found", "Campaign not found"));

            DonationStatus previous = donation.getStatus();
            BalanceEffect effect = donation.changeStatus(newStatus);
            donation.mergePaymentDetails(paymentDetails);
            switch (effect) {
                case CREDIT -> campaign.credit(donation.getAmount());
                case DEBIT -> campaign.debitFloored(donation.getAmount());
                case NONE -> {
                }
            }

            log.info("Donation status changed donationId={} {}->{} effect={} campaignRaised={}",
                    donationId, previous, newStatus, effect, campaign.getRaised());
            return DonationResponse.from(donation);
        });
    }

    @Transactional(readOnly = true)
    public DonationStatsResponse getDonationStats(UUID campaignId) {
        DonationTotals totals = campaignId != null
                ? donationRepository.summarizeCompleted(campaignId)
                : donationRepository.summarizeAllCompleted();
        long count = totals == null || totals.count() == null ? 0 : totals.count();
        if (count == 0) {
            return new DonationStatsResponse(ZERO, 0, ZERO, ZERO, ZERO);
        }
        BigDecimal total = totals.total().setScale(Campaign.MONEY_SCALE, RoundingMode.HALF_UP);
        return new DonationStatsResponse(
                total,
                count,
                total.divide(BigDecimal.valueOf(count), Campaign.MONEY_SCALE, RoundingMode.HALF_UP),
                totals.min().setScale(Campaign.MONEY_SCALE, RoundingMode.HALF_UP),
                totals.max().setScale(Campaign.MONEY_SCALE, RoundingMode.HALF_UP)
        );
    }

    @Transactional(readOnly = true)
    public PageResponse<PublicDonationResponse> listCampaignDonations(UUID campaignId, PageQuery pageQuery) {
        return PageResponse.of(
                donationRepository.findByCampaignIdAndStatus(campaignId, DonationStatus.COMPLETED, pageQuery.newestFirst()),
                PublicDonationResponse::from
        );
    }

    @Transactional(readOnly = true)
    public List<DonationResponse> listDonorDonations(UUID donorId) {
        return donationRepository.findByDonorIdOrderByCreatedAtDesc(donorId).stream()
                .map(DonationResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageResponse<DonationResponse> listDonations(
            DonationStatus status,
            DonationMethod method,
            UUID campaignId,
            PageQuery pageQuery
    ) {
        return PageResponse.of(
                donationRepository.search(status, method, campaignId, pageQuery.newestFirst()),
                DonationResponse::from
        );
    }

    private void validateDonation(CreateDonationRequest request) {
        if (request == null
                || request.campaignId() == null
                || request.amount() == null
                || request.method() == null
                || !StringUtils.hasText(request.donorEmail())) {
            throw ProblemException.validation("donation.missing_fields",
                    "Campaign, amount, method and donor email are required");
        }
        if (request.amount().compareTo(MIN_AMOUNT) < 0) {
            throw ProblemException.validation("donation.amount_too_small", "Amount must be at least 0.01");
        }
        if (!EMAIL_PATTERN.matcher(request.donorEmail().trim()).matches()) {
            throw ProblemException.validation("donation.invalid_email", "Donor email is invalid");
        }
    }
}
