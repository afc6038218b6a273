package com.givehub.backend.modules.withdrawal.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import com.givehub.backend.modules.withdrawal.domain.PayoutMethod;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;

public record CreateWithdrawalRequest(
        UUID campaignId,
        @Digits(integer = 12, fraction = 2, message = "amountRequested must have at most 2 decimal places") BigDecimal amountRequested,
        PayoutMethod payoutMethod,
        @Valid BankDetailsPayload bankDetails,
        @Size(max = 320) String paypalEmail,
        @Valid CryptoDetailsPayload cryptoDetails,
        @Size(max = 1000) String reason
) {

    public record BankDetailsPayload(
            @Size(max = 200) String accountHolderName,
            @Size(max = 200) String bankName,
            @Size(max = 64) String accountNumber,
            @Size(max = 200) String branchName,
            @Size(max = 16) String swiftCode
    ) {
    }

    public record CryptoDetailsPayload(
            @Size(max = 128) String walletAddress,
            @Size(max = 32) String network
    ) {
    }
}
