package com.givehub.backend.modules.withdrawal.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.givehub.backend.global.jpa.AbstractTimestampedEntity;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.campaign.domain.Campaign;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "withdrawal_request")
public class WithdrawalRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "organizer_id", nullable = false)
    private UserAccount organizer;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @Column(name = "amount_requested", nullable = false, precision = 14, scale = 2)
    private BigDecimal amountRequested;

    @Enumerated(EnumType.STRING)
    @Column(name = "payout_method", nullable = false, length = 16)
    private PayoutMethod payoutMethod;

    @Embedded
    private BankDetails bankDetails;

    @Column(name = "paypal_email", length = 320)
    private String paypalEmail;

    @Embedded
    private CryptoPayoutDetails cryptoDetails;

    @Column(name = "reason", length = 1000)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private WithdrawalStatus status = WithdrawalStatus.PENDING;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reviewed_by")
    private UserAccount reviewedBy;

    @Column(name = "admin_message", length = 1000)
    private String adminMessage;

    @Column(name = "paid_at")
    private OffsetDateTime paidAt;

    @Column(name = "payment_reference", length = 200)
    private String paymentReference;

    public void approve(UserAccount admin) {
        moveTo(WithdrawalStatus.APPROVED, admin);
    }

    public void reject(UserAccount admin, String message) {
        moveTo(WithdrawalStatus.REJECTED, admin);
        this.adminMessage = message;
    }

    public void markPaid(UserAccount admin, String reference, OffsetDateTime now) {
        moveTo(WithdrawalStatus.PAID, admin);
        this.paidAt = now;
        this.paymentReference = reference;
    }

    private void moveTo(WithdrawalStatus next, UserAccount admin) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Withdrawal cannot move from " + status + " to " + next);
        }
        this.status = next;
        this.reviewedBy = admin;
    }

    public boolean isRequestedBy(UUID userId) {
        return organizer != null && organizer.getId() != null && organizer.getId().equals(userId);
    }

    public UUID getId() {
        return id;
    }

    public UserAccount getOrganizer() {
        return organizer;
    }

    public void setOrganizer(UserAccount organizer) {
        this.organizer = organizer;
    }

    public Campaign getCampaign() {
        return campaign;
    }

    public void setCampaign(Campaign campaign) {
        this.campaign = campaign;
    }

    public BigDecimal getAmountRequested() {
        return amountRequested;
    }

    public void setAmountRequested(BigDecimal amountRequested) {
        this.amountRequested = amountRequested.setScale(Campaign.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public PayoutMethod getPayoutMethod() {
        return payoutMethod;
    }

    public void setPayoutMethod(PayoutMethod payoutMethod) {
        this.payoutMethod = payoutMethod;
    }

    public BankDetails getBankDetails() {
        return bankDetails;
    }

    public void setBankDetails(BankDetails bankDetails) {
        this.bankDetails = bankDetails;
    }

    public String getPaypalEmail() {
        return paypalEmail;
    }

    public void setPaypalEmail(String paypalEmail) {
        this.paypalEmail = paypalEmail;
    }

    public CryptoPayoutDetails getCryptoDetails() {
        return cryptoDetails;
    }

    public void setCryptoDetails(CryptoPayoutDetails cryptoDetails) {
        this.cryptoDetails = cryptoDetails;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public WithdrawalStatus getStatus() {
        return status;
    }

    public UserAccount getReviewedBy() {
        return reviewedBy;
    }

    public String getAdminMessage() {
        return adminMessage;
    }

    public OffsetDateTime getPaidAt() {
        return paidAt;
    }

    public String getPaymentReference() {
        return paymentReference;
    }
}
