package com.givehub.backend.modules.withdrawal.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.modules.campaign.infrastructure.persistence.CampaignRepository;
import com.givehub.backend.modules.withdrawal.domain.BankDetails;
import com.givehub.backend.modules.withdrawal.domain.CryptoPayoutDetails;
import com.givehub.backend.modules.withdrawal.domain.PayoutMethod;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalRequest;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus;
import com.givehub.backend.modules.withdrawal.infrastructure.persistence.WithdrawalRequestRepository;
import com.givehub.backend.modules.withdrawal.presentation.dto.CreateWithdrawalRequest;
import com.givehub.backend.modules.withdrawal.presentation.dto.CreateWithdrawalRequest.BankDetailsPayload;
import com.givehub.backend.modules.withdrawal.presentation.dto.CreateWithdrawalRequest.CryptoDetailsPayload;
import com.givehub.backend.modules.withdrawal.presentation.dto.WithdrawalResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Withdrawal payouts. Paying a request debits its campaign's raised total in the same
 * transaction.
 */
@Service
public class WithdrawalService {

    private static final Logger log = LoggerFactory.getLogger(WithdrawalService.class);

    static final String DEFAULT_REJECTION_MESSAGE = "Withdrawal request rejected";

    private final WithdrawalRequestRepository withdrawalRequestRepository;
    private final CampaignRepository campaignRepository;
    private final UserAccountRepository userAccountRepository;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public WithdrawalService(
            WithdrawalRequestRepository withdrawalRequestRepository,
            CampaignRepository campaignRepository,
            UserAccountRepository userAccountRepository,
            UnitOfWork unitOfWork,
            Clock clock
    ) {
        this.withdrawalRequestRepository = withdrawalRequestRepository;
        this.campaignRepository = campaignRepository;
        this.userAccountRepository = userAccountRepository;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    public WithdrawalResponse createWithdrawalRequest(UUID organizerId, CreateWithdrawalRequest request) {
        validateRequest(request);

        return unitOfWork.execute("withdrawal.create", () -> {
            Campaign campaign = campaignRepository.findByIdForUpdate(request.campaignId())
                    .orElseThrow(() -> ProblemException.notFound("campaign.not_found", "Campaign not found"));
            if (!campaign.isOwnedBy(organizerId)) {
                throw ProblemException.forbidden("withdrawal.not_campaign_owner",
                        "You can only request withdrawals for your own campaigns");
            }
            if (!campaign.isApproved()) {
                throw ProblemException.illegalState("withdrawal.campaign_not_approved", "Campaign must be approved");
            }
            if (request.amountRequested().compareTo(campaign.getRaised()) > 0) {
                throw ProblemException.validation("withdrawal.amount_exceeds_raised",
                        "Requested amount exceeds the amount raised");
            }
            if (withdrawalRequestRepository.existsByCampaignIdAndStatusIn(campaign.getId(), WithdrawalStatus.OUTSTANDING)) {
                throw ProblemException.conflict("withdrawal.outstanding_exists",
                        "A pending or approved withdrawal already exists for this campaign");
            }

            WithdrawalRequest withdrawal = new WithdrawalRequest();
            withdrawal.setOrganizer(userAccountRepository.getReferenceById(organizerId));
            withdrawal.setCampaign(campaign);
            withdrawal.setAmountRequested(request.amountRequested());
            withdrawal.setPayoutMethod(request.payoutMethod());
            withdrawal.setReason(trimToNull(request.reason()));
            applyPayoutDetails(withdrawal, request);
            WithdrawalRequest saved = withdrawalRequestRepository.save(withdrawal);

            log.info("Withdrawal requested withdrawalId={} campaignId={} amount={}",
                    saved.getId(), campaign.getId(), saved.getAmountRequested());
            return WithdrawalResponse.from(saved);
        });
    }

    public WithdrawalResponse approveWithdrawal(UUID withdrawalId, UUID adminId) {
        return unitOfWork.execute("withdrawal.approve", () -> {
            WithdrawalRequest withdrawal = findForUpdate(withdrawalId);
            ensureStatus(withdrawal, WithdrawalStatus.PENDING, "withdrawal.not_pending", "Withdrawal is not pending");
            withdrawal.approve(userAccountRepository.getReferenceById(adminId));
            log.info("Withdrawal approved withdrawalId={} adminId={}", withdrawalId, adminId);
            return WithdrawalResponse.from(withdrawal);
        });
    }

    public WithdrawalResponse rejectWithdrawal(UUID withdrawalId, UUID adminId, String adminMessage) {
        return unitOfWork.execute("withdrawal.reject", () -> {
            WithdrawalRequest withdrawal = findForUpdate(withdrawalId);
            ensureStatus(withdrawal, WithdrawalStatus.PENDING, "withdrawal.not_pending", "Withdrawal is not pending");
            String message = StringUtils.hasText(adminMessage) ? adminMessage.trim() : DEFAULT_REJECTION_MESSAGE;
            withdrawal.reject(userAccountRepository.getReferenceById(adminId), message);
            log.info("Withdrawal rejected withdrawalId={} adminId={}", withdrawalId, adminId);
            return WithdrawalResponse.from(withdrawal);
        });
    }

    /**
     * Marks an approved request paid and debits the campaign, never below zero.
     */
    public WithdrawalResponse markAsPaid(UUID withdrawalId, UUID adminId, String paymentReference) {
        return unitOfWork.execute("withdrawal.markPaid", () -> {
            WithdrawalRequest withdrawal = findForUpdate(withdrawalId);
            ensureStatus(withdrawal, WithdrawalStatus.APPROVED, "withdrawal.not_approved",
                    "Withdrawal must be approved before it can be paid");
            Campaign campaign = campaignRepository.findByIdForUpdate(withdrawal.getCampaign().getId())
                    .orElseThrow(() -> ProblemException.notFound("campaign.not_found", "Campaign not found"));

            withdrawal.markPaid(userAccountRepository.getReferenceById(adminId), trimToNull(paymentReference),
                    OffsetDateTime.now(clock));
            campaign.debitFloored(withdrawal.getAmountRequested());

            log.info("Withdrawal paid withdrawalId={} campaignId={} amount={} campaignRaised={}",
                    withdrawalId, campaign.getId(), withdrawal.getAmountRequested(), campaign.getRaised());
            return WithdrawalResponse.from(withdrawal);
        });
    }

    @Transactional(readOnly = true)
    public List<WithdrawalResponse> listOrganizerWithdrawals(UUID organizerId) {
        return withdrawalRequestRepository.findByOrganizerIdOrderByCreatedAtDesc(organizerId).stream()
                .map(WithdrawalResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageResponse<WithdrawalResponse> listWithdrawals(WithdrawalStatus status, PageQuery pageQuery) {
        return PageResponse.of(withdrawalRequestRepository.search(status, pageQuery.newestFirst()), WithdrawalResponse::from);
    }

    @Transactional(readOnly = true)
    public WithdrawalResponse getWithdrawal(UUID withdrawalId, UUID callerId, UserRole callerRole) {
        WithdrawalRequest withdrawal = withdrawalRequestRepository.findDetailedById(withdrawalId)
                .orElseThrow(WithdrawalService::withdrawalNotFound);
        if (callerRole != UserRole.ADMIN && !withdrawal.isRequestedBy(callerId)) {
            throw ProblemException.forbidden("withdrawal.not_owner", "You can only view your own withdrawal requests");
        }
        return WithdrawalResponse.from(withdrawal);
    }

    private void validateRequest(CreateWithdrawalRequest request) {
        if (request == null
                || request.campaignId() == null
                || request.amountRequested() == null
                || request.payoutMethod() == null) {
            throw ProblemException.validation("withdrawal.missing_fields",
                    "Campaign, amount requested and payout method are required");
        }
        if (request.amountRequested().signum() <= 0) {
            throw ProblemException.validation("withdrawal.invalid_amount", "Amount requested must be greater than 0");
        }
        switch (request.payoutMethod()) {
            case BANK -> {
                BankDetailsPayload bank = request.bankDetails();
                if (bank == null || !StringUtils.hasText(bank.accountHolderName()) || !StringUtils.hasText(bank.accountNumber())) {
                    throw ProblemException.validation("withdrawal.bank_details_required",
                            "Bank payouts require account holder name and account number");
                }
            }
            case PAYPAL -> {
                if (!StringUtils.hasText(request.paypalEmail())) {
                    throw ProblemException.validation("withdrawal.paypal_email_required", "PayPal payouts require a PayPal email");
                }
            }
            case CRYPTO -> {
                CryptoDetailsPayload crypto = request.cryptoDetails();
                if (crypto == null || !StringUtils.hasText(crypto.walletAddress())) {
                    throw ProblemException.validation("withdrawal.wallet_required", "Crypto payouts require a wallet address");
                }
            }
        }
    }

    private void applyPayoutDetails(WithdrawalRequest withdrawal, CreateWithdrawalRequest request) {
        if (request.payoutMethod() == PayoutMethod.BANK) {
            BankDetailsPayload bank = request.bankDetails();
            withdrawal.setBankDetails(new BankDetails(
                    bank.accountHolderName().trim(),
                    trimToNull(bank.bankName()),
                    bank.accountNumber().trim(),
                    trimToNull(bank.branchName()),
                    trimToNull(bank.swiftCode())
            ));
        } else if (request.payoutMethod() == PayoutMethod.PAYPAL) {
            withdrawal.setPaypalEmail(request.paypalEmail().trim());
        } else {
            CryptoDetailsPayload crypto = request.cryptoDetails();
            withdrawal.setCryptoDetails(new CryptoPayoutDetails(crypto.walletAddress().trim(), trimToNull(crypto.network())));
        }
    }

    private WithdrawalRequest findForUpdate(UUID withdrawalId) {
        return withdrawalRequestRepository.findByIdForUpdate(withdrawalId)
                .orElseThrow(WithdrawalService::withdrawalNotFound);
    }

    private void ensureStatus(WithdrawalRequest withdrawal, WithdrawalStatus expected, String code, String detail) {
        if (withdrawal.getStatus() != expected) {
            throw ProblemException.illegalState(code, detail + " (current status: " + withdrawal.getStatus() + ")");
        }
    }

    private static ProblemException withdrawalNotFound() {
        return ProblemException.notFound("withdrawal.not_found", "Withdrawal request not found");
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
