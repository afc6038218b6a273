package com.givehub.backend.modules.withdrawal.presentation.dto;

import jakarta.validation.constraints.Size;

public record MarkPaidRequest(
        @Size(max = 200) String paymentReference
) {
}
