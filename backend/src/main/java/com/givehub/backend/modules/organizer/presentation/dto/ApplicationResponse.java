package com.givehub.backend.modules.organizer.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.organizer.domain.ApplicationStatus;
import com.givehub.backend.modules.organizer.domain.OrganizationType;
import com.givehub.backend.modules.organizer.domain.OrganizerApplication;

public record ApplicationResponse(
        UUID id,
        ApplicantSummary applicant,
        String organizationName,
        String description,
        String contactEmail,
        String phoneNumber,
        String website,
        OrganizationType organizationType,
        Map<String, Object> documents,
        boolean documentsVerified,
        ApplicationStatus status,
        UUID reviewedBy,
        OffsetDateTime reviewedAt,
        String rejectionReason,
        String adminNotes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static ApplicationResponse from(OrganizerApplication application) {
        UserAccount user = application.getUser();
        UserAccount reviewer = application.getReviewedBy();
        return new ApplicationResponse(
                application.getId(),
                new ApplicantSummary(user.getId(), user.getName(), user.getEmail()),
                application.getOrganizationName(),
                application.getDescription(),
                application.getContactEmail(),
                application.getPhoneNumber(),
                application.getWebsite(),
                application.getOrganizationType(),
                application.getDocuments(),
                application.isDocumentsVerified(),
                application.getStatus(),
                reviewer != null ? reviewer.getId() : null,
                application.getReviewedAt(),
                application.getRejectionReason(),
                application.getAdminNotes(),
                application.getCreatedAt(),
                application.getUpdatedAt()
        );
    }

    public record ApplicantSummary(UUID id, String name, String email) {
    }
}
