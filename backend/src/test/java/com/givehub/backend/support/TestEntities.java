package com.givehub.backend.support;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.modules.auth.domain.UserRole;
import com.givehub.backend.modules.campaign.domain.Campaign;
import com.givehub.backend.modules.donation.domain.Donation;
import com.givehub.backend.modules.donation.domain.DonationMethod;
import com.givehub.backend.modules.donation.domain.DonationStatus;
import com.givehub.backend.modules.organizer.domain.ApplicationStatus;
import com.givehub.backend.modules.organizer.domain.OrganizerApplication;
import com.givehub.backend.modules.withdrawal.domain.PayoutMethod;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalRequest;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus;

import org.springframework.test.util.ReflectionTestUtils;

/**
 * Builds detached entities with ids for service unit tests.
 */
public final class TestEntities {

    private TestEntities() {
    }

    public static UserAccount user(UserRole role) {
        UserAccount user = new UserAccount();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setName(role.name().toLowerCase() + " user");
        user.setEmail(role.name().toLowerCase() + "-" + UUID.randomUUID() + "@example.com");
        user.setPasswordHash("hash");
        user.setRole(role);
        return user;
    }

    public static UserAccount organizer(boolean approved, boolean revoked) {
        UserAccount organizer = user(UserRole.ORGANIZER);
        organizer.setOrganizerApproved(approved);
        if (revoked) {
            organizer.revoke(null, "Repeated policy violations", OffsetDateTime.parse("2024-01-01T00:00:00Z"));
        }
        return organizer;
    }

    public static Campaign campaign(UserAccount owner, String target, String raised, boolean approved) {
        Campaign campaign = new Campaign();
        ReflectionTestUtils.setField(campaign, "id", UUID.randomUUID());
        campaign.setOwner(owner);
        campaign.setTitle("Clean water for Riverside");
        campaign.setDescription("Wells and filters for the riverside villages");
        campaign.setTarget(new BigDecimal(target));
        ReflectionTestUtils.setField(campaign, "raised", new BigDecimal(raised).setScale(Campaign.MONEY_SCALE));
        if (approved) {
            campaign.approve();
        }
        return campaign;
    }

    public static OrganizerApplication application(UserAccount applicant, ApplicationStatus status) {
        OrganizerApplication application = new OrganizerApplication();
        ReflectionTestUtils.setField(application, "id", UUID.randomUUID());
        application.setUser(applicant);
        application.setOrganizationName("Helping Hands");
        application.setDescription("Community food bank serving the east district");
        ReflectionTestUtils.setField(application, "status", status);
        return application;
    }

    public static Donation donation(Campaign campaign, UserAccount donor, String amount, DonationStatus status) {
        Donation donation = new Donation();
        ReflectionTestUtils.setField(donation, "id", UUID.randomUUID());
        donation.setCampaign(campaign);
        donation.setDonor(donor);
        donation.setDonorEmail(donor.getEmail());
        donation.setAmount(new BigDecimal(amount));
        donation.setMethod(DonationMethod.PAYPAL);
        ReflectionTestUtils.setField(donation, "status", status);
        return donation;
    }

    public static WithdrawalRequest withdrawal(Campaign campaign, String amount, WithdrawalStatus status) {
        WithdrawalRequest withdrawal = new WithdrawalRequest();
        ReflectionTestUtils.setField(withdrawal, "id", UUID.randomUUID());
        withdrawal.setOrganizer(campaign.getOwner());
        withdrawal.setCampaign(campaign);
        withdrawal.setAmountRequested(new BigDecimal(amount));
        withdrawal.setPayoutMethod(PayoutMethod.PAYPAL);
        withdrawal.setPaypalEmail("payouts@example.com");
        ReflectionTestUtils.setField(withdrawal, "status", status);
        return withdrawal;
    }
}
