package com.givehub.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.givehub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Platform account. Approval and revocation flags only carry meaning while the role is
 * {@link UserRole#ORGANIZER}.
 */
@Entity
@Table(name = "app_user")
public class UserAccount extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "email", nullable = false, unique = true, length = 320)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private UserRole role = UserRole.DONOR;

    @Column(name = "phone_number", length = 40)
    private String phoneNumber;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "organizer_approved", nullable = false)
    private boolean organizerApproved;

    @Column(name = "organizer_revoked", nullable = false)
    private boolean organizerRevoked;

    @Column(name = "revoked_at")
    private OffsetDateTime revokedAt;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "revoked_by")
    private UserAccount revokedBy;

    @Column(name = "revocation_reason", length = 500)
    private String revocationReason;

    public void promoteToOrganizer() {
        this.role = UserRole.ORGANIZER;
        this.organizerApproved = true;
    }

    public void revoke(UserAccount admin, String reason, OffsetDateTime now) {
        this.organizerRevoked = true;
        this.revokedAt = now;
        this.revokedBy = admin;
        this.revocationReason = reason;
    }

    public void reinstate() {
        this.organizerRevoked = false;
        this.revokedAt = null;
        this.revokedBy = null;
        this.revocationReason = null;
    }

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public void setPasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    public UserRole getRole() {
        return role;
    }

    public void setRole(UserRole role) {
        this.role = role;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public void setPhoneNumber(String phoneNumber) {
        this.phoneNumber = phoneNumber;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public boolean isOrganizerApproved() {
        return organizerApproved;
    }

    public void setOrganizerApproved(boolean organizerApproved) {
        this.organizerApproved = organizerApproved;
    }

    public boolean isOrganizerRevoked() {
        return organizerRevoked;
    }

    public OffsetDateTime getRevokedAt() {
        return revokedAt;
    }

    public UserAccount getRevokedBy() {
        return revokedBy;
    }

    public String getRevocationReason() {
        return revocationReason;
    }
}
