package com.givehub.backend.modules.withdrawal.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.modules.withdrawal.domain.BankDetails;
import com.givehub.backend.modules.withdrawal.domain.CryptoPayoutDetails;
import com.givehub.backend.modules.withdrawal.domain.PayoutMethod;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalRequest;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus;

public record WithdrawalResponse(
        UUID id,
        UUID campaignId,
        String campaignTitle,
        UUID organizerId,
        BigDecimal amountRequested,
        PayoutMethod payoutMethod,
        CreateWithdrawalRequest.BankDetailsPayload bankDetails,
        String paypalEmail,
        CreateWithdrawalRequest.CryptoDetailsPayload cryptoDetails,
        String reason,
        WithdrawalStatus status,
        UUID reviewedBy,
        String adminMessage,
        OffsetDateTime paidAt,
        String paymentReference,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static WithdrawalResponse from(WithdrawalRequest request) {
        Campaign campaign = request.getCampaign();
        UserAccount reviewer = request.getReviewedBy();
        BankDetails bank = request.getBankDetails();
        CryptoPayoutDetails crypto = request.getCryptoDetails();
        return new WithdrawalResponse(
                request.getId(),
                campaign.getId(),
                campaign.getTitle(),
                request.getOrganizer().getId(),
                request.getAmountRequested(),
                request.getPayoutMethod(),
                bank == null ? null : new CreateWithdrawalRequest.BankDetailsPayload(
                        bank.getAccountHolderName(), bank.getBankName(), bank.getAccountNumber(),
                        bank.getBranchName(), bank.getSwiftCode()),
                request.getPaypalEmail(),
                crypto == null ? null : new CreateWithdrawalRequest.CryptoDetailsPayload(
                        crypto.getWalletAddress(), crypto.getNetwork()),
                request.getReason(),
                request.getStatus(),
                reviewer != null ? reviewer.getId() : null,
                request.getAdminMessage(),
                request.getPaidAt(),
                request.getPaymentReference(),
                request.getCreatedAt(),
                request.getUpdatedAt()
        );
    }
}
