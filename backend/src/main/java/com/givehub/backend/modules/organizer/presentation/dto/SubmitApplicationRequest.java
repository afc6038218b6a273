package com.givehub.backend.modules.organizer.presentation.dto;

import java.util.Map;

import com.givehub.backend.modules.organizer.domain.OrganizationType;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;

public record SubmitApplicationRequest(
        @Size(max = 200, message = "organizationName must be at most 200 characters") String organizationName,
        @Size(max = 2000, message = "description must be at most 2000 characters") String description,
        @Email(message = "contactEmail must be a valid address") String contactEmail,
        @Size(max = 40) String phoneNumber,
        @Size(max = 500) String website,
        OrganizationType organizationType,
        Map<String, Object> documents
) {
}
