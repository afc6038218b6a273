package com.givehub.backend.modules.campaign.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.givehub.backend.global.jpa.AbstractTimestampedEntity;
import com.givehub.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Fundraising campaign. {@code raised} tracks completed donations minus paid withdrawals and
 * never drops below zero.
 */
@Entity
@Table(name = "campaign")
public class Campaign extends AbstractTimestampedEntity {

    public static final int MONEY_SCALE = 2;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "title", nullable = false, length = 150)
    private String title;

    @Column(name = "description", length = 2000)
    private String description;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "images", nullable = false, columnDefinition = "jsonb")
    private List<String> images = new ArrayList<>();

    @Column(name = "target", nullable = false, precision = 14, scale = 2)
    private BigDecimal target;

    @Column(name = "raised", nullable = false, precision = 14, scale = 2)
    private BigDecimal raised = BigDecimal.ZERO.setScale(MONEY_SCALE);

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false)
    private UserAccount owner;

    @Column(name = "approved", nullable = false)
    private boolean approved;

    @Column(name = "closed", nullable = false)
    private boolean closed;

    @Column(name = "closed_reason", length = 200)
    private String closedReason;

    public boolean isOwnedBy(UUID userId) {
        return owner != null && owner.getId() != null && owner.getId().equals(userId);
    }

    public void credit(BigDecimal amount) {
        this.raised = raised.add(amount).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Subtracts {@code amount} from the raised total, stopping at zero.
     */
    public void debitFloored(BigDecimal amount) {
        BigDecimal next = raised.subtract(amount);
        this.raised = (next.signum() < 0 ? BigDecimal.ZERO : next).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @return {@code true} when the flag changed
     */
    public boolean approve() {
        if (approved) {
            return false;
        }
        this.approved = true;
        return true;
    }

    public void close(String reason) {
        this.closed = true;
        this.closedReason = reason;
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getImages() {
        return images;
    }

    public void setImages(List<String> images) {
        this.images = new ArrayList<>();
        if (images != null) {
            images.stream()
                    .filter(image -> image != null && !image.isBlank())
                    .map(String::trim)
                    .forEach(this.images::add);
        }
    }

    public BigDecimal getTarget() {
        return target;
    }

    public void setTarget(BigDecimal target) {
        this.target = target.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public BigDecimal getRaised() {
        return raised;
    }

    public UserAccount getOwner() {
        return owner;
    }

    public void setOwner(UserAccount owner) {
        this.owner = owner;
    }

    public boolean isApproved() {
        return approved;
    }

    public boolean isClosed() {
        return closed;
    }

    public String getClosedReason() {
        return closedReason;
    }
}
