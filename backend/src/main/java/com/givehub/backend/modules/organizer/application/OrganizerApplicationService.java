package com.givehub.backend.modules.organizer.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

import com.givehub.backend.global.error.ProblemException;
import com.givehub.backend.global.transaction.UnitOfWork;
import com.givehub.backend.global.web.PageQuery;
import com.givehub.backend.global.web.PageResponse;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.organizer.domain.ApplicationStatus;
import com.givehub.backend.modules.organizer.domain.OrganizationType;
import com.givehub.backend.modules.organizer.domain.OrganizerApplication;
import com.givehub.backend.modules.organizer.infrastructure.persistence.OrganizerApplicationRepository;
import com.givehub.backend.modules.organizer.presentation.dto.ApplicationResponse;
import com.givehub.backend.modules.organizer.presentation.dto.SubmitApplicationRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Organizer vetting: users apply, admins approve or reject. Approval promotes the applicant to
 * organizer in the same transaction.
 */
@Service
public class OrganizerApplicationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizerApplicationService.class);

    static final int MIN_ORGANIZATION_NAME_LENGTH = 3;
    static final int MIN_DESCRIPTION_LENGTH = 20;
    static final String DEFAULT_REJECTION_REASON = "Application rejected by admin";

    private final OrganizerApplicationRepository applicationRepository;
    private final UserAccountRepository userAccountRepository;
    private final UnitOfWork unitOfWork;
    private final Clock clock;

    public OrganizerApplicationService(
            OrganizerApplicationRepository applicationRepository,
            UserAccountRepository userAccountRepository,
            UnitOfWork unitOfWork,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.userAccountRepository = userAccountRepository;
        this.unitOfWork = unitOfWork;
        this.clock = clock;
    }

    public ApplicationResponse submitApplication(UUID userId, SubmitApplicationRequest request) {
        validateSubmission(request);

        return unitOfWork.execute("organizer.submitApplication", () -> {
            UserAccount user = userAccountRepository.findByIdForUpdate(userId)
                    .orElseThrow(() -> ProblemException.notFound("user.not_found", "User not found"));
            if (applicationRepository.existsByUserIdAndStatusIn(userId, ApplicationStatus.OPEN_STATUSES)) {
                throw ProblemException.conflict("organizer.application_exists",
                        "You already have a pending or approved application");
            }

            OrganizerApplication application = new OrganizerApplication();
            application.setUser(user);
            application.setOrganizationName(request.organizationName().trim());
            application.setDescription(request.description().trim());
            application.setContactEmail(trimToNull(request.contactEmail()));
            application.setPhoneNumber(trimToNull(request.phoneNumber()));
            application.setWebsite(trimToNull(request.website()));
            application.setOrganizationType(request.organizationType() != null
                    ? request.organizationType()
                    : OrganizationType.OTHER);
            if (request.documents() != null) {
                application.setDocuments(new HashMap<>(request.documents()));
            }
            OrganizerApplication saved = applicationRepository.save(application);
            log.info("Organizer application submitted userId={} applicationId={}", userId, saved.getId());
            return ApplicationResponse.from(saved);
        });
    }

    public ApplicationResponse approveApplication(UUID applicationId, UUID adminId) {
        return unitOfWork.execute("organizer.approveApplication", () -> {
            OrganizerApplication application = findApplicationForUpdate(applicationId);
            ensurePending(application);

            UserAccount applicant = userAccountRepository.findByIdForUpdate(application.getUser().getId())
                    .orElseThrow(() -> ProblemException.notFound("user.not_found", "Applicant not found"));
            OffsetDateTime now = OffsetDateTime.now(clock);
            application.approve(userAccountRepository.getReferenceById(adminId), now);
            applicant.promoteToOrganizer();

            log.info("Organizer application approved applicationId={} userId={} adminId={}",
                    applicationId, applicant.getId(), adminId);
            return ApplicationResponse.from(application);
        });
    }

    public ApplicationResponse rejectApplication(UUID applicationId, UUID adminId, String reason) {
        return unitOfWork.execute("organizer.rejectApplication", () -> {
            OrganizerApplication application = findApplicationForUpdate(applicationId);
            ensurePending(application);

            String effectiveReason = StringUtils.hasText(reason) ? reason.trim() : DEFAULT_REJECTION_REASON;
            application.reject(userAccountRepository.getReferenceById(adminId), effectiveReason, OffsetDateTime.now(clock));

            log.info("Organizer application rejected applicationId={} adminId={}", applicationId, adminId);
            return ApplicationResponse.from(application);
        });
    }

    @Transactional(readOnly = true)
    public List<ApplicationResponse> listMyApplications(UUID userId) {
        return applicationRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(ApplicationResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageResponse<ApplicationResponse> listApplications(ApplicationStatus status, PageQuery pageQuery) {
        return PageResponse.of(applicationRepository.search(status, pageQuery.newestFirst()), ApplicationResponse::from);
    }

    @Transactional(readOnly = true)
    public ApplicationResponse getApplication(UUID applicationId) {
        return applicationRepository.findDetailedById(applicationId)
                .map(ApplicationResponse::from)
                .orElseThrow(() -> ProblemException.notFound("organizer.application_not_found", "Application not found"));
    }

    private void validateSubmission(SubmitApplicationRequest request) {
        if (request == null || request.organizationName() == null || request.description() == null) {
            throw ProblemException.validation("organizer.missing_fields", "Organization name and description are required");
        }
        if (request.organizationName().trim().length() < MIN_ORGANIZATION_NAME_LENGTH) {
            throw ProblemException.validation("organizer.organization_name_too_short",
                    "Organization name must be at least " + MIN_ORGANIZATION_NAME_LENGTH + " characters");
        }
        if (request.description().trim().length() < MIN_DESCRIPTION_LENGTH) {
            throw ProblemException.validation("organizer.description_too_short",
                    "Description must be at least " + MIN_DESCRIPTION_LENGTH + " characters");
        }
    }

    private OrganizerApplication findApplicationForUpdate(UUID applicationId) {
        return applicationRepository.findByIdForUpdate(applicationId)
                .orElseThrow(() -> ProblemException.notFound("organizer.application_not_found", "Application not found"));
    }

    private void ensurePending(OrganizerApplication application) {
        if (application.getStatus() != ApplicationStatus.PENDING) {
            throw ProblemException.illegalState("organizer.application_already_reviewed",
                    "Application has already been " + application.getStatus().name().toLowerCase());
        }
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
