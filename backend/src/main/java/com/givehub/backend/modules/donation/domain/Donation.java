package com.givehub.backend.modules.donation.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.UUID;

import com.givehub.backend.global.jpa.AbstractTimestampedEntity;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.campaign.domain.Campaign;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "donation")
public class Donation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "campaign_id", nullable = false)
    private Campaign campaign;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "donor_id", nullable = false)
    private UserAccount donor;

    @Column(name = "donor_email", nullable = false, length = 320)
    private String donorEmail;

    @Column(name = "amount", nullable = false, precision = 14, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false, length = 16)
    private DonationMethod method = DonationMethod.PAYPAL;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private DonationStatus status = DonationStatus.PENDING;

    @Column(name = "transaction_id", length = 200)
    private String transactionId;

    @Column(name = "payer_email", length = 320)
    private String payerEmail;

    @Column(name = "payer_name", length = 200)
    private String payerName;

    @Column(name = "payer_country", length = 8)
    private String payerCountry;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "capture_details", columnDefinition = "jsonb")
    private Map<String, Object> captureDetails;

    @Enumerated(EnumType.STRING)
    @Column(name = "crypto_currency", length = 8)
    private CryptoCurrency cryptoCurrency;

    @Column(name = "transaction_hash", length = 200)
    private String transactionHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "network", length = 16)
    private CryptoNetwork network;

    /**
     * Sets the new status and reports what it means for the campaign balance.
     */
    public BalanceEffect changeStatus(DonationStatus next) {
        BalanceEffect effect = DonationStatus.balanceEffectOf(status, next);
        this.status = next;
        return effect;
    }

    public void mergePaymentDetails(PaymentDetails details) {
        if (details == null) {
            return;
        }
        if (details.transactionId() != null) {
            this.transactionId = details.transactionId();
        }
        if (details.payerEmail() != null) {
            this.payerEmail = details.payerEmail();
        }
        if (details.payerName() != null) {
            this.payerName = details.payerName();
        }
        if (details.payerCountry() != null) {
            this.payerCountry = details.payerCountry();
        }
        if (details.captureDetails() != null) {
            this.captureDetails = details.captureDetails();
        }
        if (details.cryptoCurrency() != null) {
            this.cryptoCurrency = details.cryptoCurrency();
        }
        if (details.transactionHash() != null) {
            this.transactionHash = details.transactionHash();
        }
        if (details.network() != null) {
            this.network = details.network();
        }
    }

    public UUID getId() {
        return id;
    }

    public Campaign getCampaign() {
        return campaign;
    }

    public void setCampaign(Campaign campaign) {
        this.campaign = campaign;
    }

    public UserAccount getDonor() {
        return donor;
    }

    public void setDonor(UserAccount donor) {
        this.donor = donor;
    }

    public String getDonorEmail() {
        return donorEmail;
    }

    public void setDonorEmail(String donorEmail) {
        this.donorEmail = donorEmail;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount.setScale(Campaign.MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public DonationMethod getMethod() {
        return method;
    }

    public void setMethod(DonationMethod method) {
        this.method = method;
    }

    public DonationStatus getStatus() {
        return status;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getPayerEmail() {
        return payerEmail;
    }

    public String getPayerName() {
        return payerName;
    }

    public String getPayerCountry() {
        return payerCountry;
    }

    public Map<String, Object> getCaptureDetails() {
        return captureDetails;
    }

    public CryptoCurrency getCryptoCurrency() {
        return cryptoCurrency;
    }

    public String getTransactionHash() {
        return transactionHash;
    }

    public CryptoNetwork getNetwork() {
        return network;
    }
}
