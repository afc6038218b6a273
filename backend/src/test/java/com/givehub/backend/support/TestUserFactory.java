package com.givehub.backend.support;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import com.givehub.backend.modules.auth.application.JwtTokenService;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.auth.infrastructure.persistence.UserAccountRepository;
import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.modules.campaign.infrastructure.persistence.CampaignRepository;
import com.givehub.backend.modules.withdrawal.domain.PayoutMethod;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalRequest;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus;
import com.givehub.backend.modules.withdrawal.infrastructure.persistence.WithdrawalRequestRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    public static final String DEFAULT_PASSWORD = "secret123!";

    private final UserAccountRepository userAccountRepository;
    private final CampaignRepository campaignRepository;
    private final WithdrawalRequestRepository withdrawalRequestRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public TestUserFactory(
            UserAccountRepository userAccountRepository,
            CampaignRepository campaignRepository,
            WithdrawalRequestRepository withdrawalRequestRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.userAccountRepository = userAccountRepository;
        this.campaignRepository = campaignRepository;
        this.withdrawalRequestRepository = withdrawalRequestRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public String bearer(UserAccount user) {
        return "Bearer " + jwtTokenService.issueAccessToken(user.getId(), user.getRole()).accessToken();
    }

    public UserAccount createAdmin(String email) {
        return createUser(email, "Admin User", UserRole.ADMIN, false);
    }

    public UserAccount createDonor(String email) {
        return createUser(email, "Donor " + email, UserRole.DONOR, false);
    }

    public UserAccount createApprovedOrganizer(String email) {
        return createUser(email, "Organizer " + email, UserRole.ORGANIZER, true);
    }

    public UserAccount createPendingOrganizer(String email) {
        return createUser(email, "Organizer " + email, UserRole.ORGANIZER, false);
    }

    public UserAccount createRevokedOrganizer(String email) {
        UserAccount organizer = createApprovedOrganizer(email);
        organizer.revoke(null, "Repeated policy violations", OffsetDateTime.now());
        return userAccountRepository.save(organizer);
    }

    public Campaign createCampaign(UserAccount owner, String title, String raised, boolean approved, boolean closed) {
        Campaign campaign = new Campaign();
        campaign.setOwner(owner);
        campaign.setTitle(title);
        campaign.setTarget(new BigDecimal("10000.00"));
        ReflectionTestUtils.setField(campaign, "raised", new BigDecimal(raised).setScale(Campaign.MONEY_SCALE));
        if (approved) {
            campaign.approve();
        }
        if (closed) {
            campaign.close("Goal reached");
        }
        return campaignRepository.save(campaign);
    }

    public WithdrawalRequest createWithdrawal(Campaign campaign, String amount, WithdrawalStatus status) {
        WithdrawalRequest withdrawal = new WithdrawalRequest();
        withdrawal.setOrganizer(campaign.getOwner());
        withdrawal.setCampaign(campaign);
        withdrawal.setAmountRequested(new BigDecimal(amount));
        withdrawal.setPayoutMethod(PayoutMethod.PAYPAL);
        withdrawal.setPaypalEmail("payouts@example.com");
        ReflectionTestUtils.setField(withdrawal, "status", status);
        return withdrawalRequestRepository.save(withdrawal);
    }

    private UserAccount createUser(String email, String name, UserRole role, boolean organizerApproved) {
        UserAccount user = new UserAccount();
        user.setEmail(email);
        user.setName(name);
        user.setPasswordHash(passwordEncoder.encode(DEFAULT_PASSWORD));
        user.setRole(role);
        user.setOrganizerApproved(organizerApproved);
        return userAccountRepository.save(user);
    }
}
