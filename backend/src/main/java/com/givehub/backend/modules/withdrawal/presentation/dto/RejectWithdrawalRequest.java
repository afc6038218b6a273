package com.givehub.backend.modules.withdrawal.presentation.dto;

import jakarta.validation.constraints.Size;

public record RejectWithdrawalRequest(
        @Size(max = 1000) String adminMessage
) {
}
