package com.givehub.backend.modules.withdrawal.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;

import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WithdrawalStatusTest {

    @Test
    @DisplayName("only PENDING to APPROVED/REJECTED and APPROVED to PAID are allowed")
    void canTransitionTo_allowsDocumentedPaths() {
        assertThat(WithdrawalStatus.PENDING.canTransitionTo(WithdrawalStatus.APPROVED)).isTrue();
        assertThat(WithdrawalStatus.PENDING.canTransitionTo(WithdrawalStatus.REJECTED)).isTrue();
        assertThat(WithdrawalStatus.APPROVED.canTransitionTo(WithdrawalStatus.PAID)).isTrue();

        assertThat(WithdrawalStatus.PENDING.canTransitionTo(WithdrawalStatus.PAID)).isFalse();
        assertThat(WithdrawalStatus.APPROVED.canTransitionTo(WithdrawalStatus.REJECTED)).isFalse();
        assertThat(WithdrawalStatus.REJECTED.canTransitionTo(WithdrawalStatus.APPROVED)).isFalse();
        assertThat(WithdrawalStatus.PAID.canTransitionTo(WithdrawalStatus.APPROVED)).isFalse();
    }

    @Test
    @DisplayName("REJECTED and PAID are terminal and do not count as outstanding")
    void terminalStatuses() {
        assertThat(WithdrawalStatus.REJECTED.isTerminal()).isTrue();
        assertThat(WithdrawalStatus.PAID.isTerminal()).isTrue();
        assertThat(WithdrawalStatus.OUTSTANDING).containsExactlyInAnyOrder(WithdrawalStatus.PENDING, WithdrawalStatus.APPROVED);
    }

    @Test
    @DisplayName("entity refuses to be paid before approval")
    void markPaid_requiresApproval() {
        Campaign campaign = TestEntities.campaign(TestEntities.organizer(true, false), "1000", "500", true);
        WithdrawalRequest withdrawal = TestEntities.withdrawal(campaign, "100", WithdrawalStatus.PENDING);

        assertThrows(IllegalStateException.class, () -> withdrawal.markPaid(null, "REF-1", null));
        assertThat(withdrawal.getStatus()).isEqualTo(WithdrawalStatus.PENDING);
        assertThat(withdrawal.getAmountRequested()).isEqualByComparingTo(new BigDecimal("100.00"));
    }
}
