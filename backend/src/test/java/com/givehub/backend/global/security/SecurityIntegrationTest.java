package com.givehub.backend.global.security;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.givehub.backend.global.web.RequestIdFilter;
import com.givehub.backend.modules.auth.domain.UserAccount;
import com.givehub.backend.support.AbstractPostgresIntegrationTest;
import com.givehub.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class SecurityIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TestUserFactory testUserFactory;

    @Test
    void publicCampaignListingNeedsNoToken() throws Exception {
        UserAccount organizer = testUserFactory.createApprovedOrganizer("organizer@givehub.test");
        testUserFactory.createCampaign(organizer, "Visible", "0", true, false);
        testUserFactory.createCampaign(organizer, "Hidden", "0", false, false);

        mockMvc.perform(get("/campaigns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.total").value(1))
                .andExpect(jsonPath("$.items[0].title").value("Visible"));
    }

    @Test
    void missingTokenIsRejectedWithProblemBody() throws Exception {
        mockMvc.perform(get("/auth/profile"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists(RequestIdFilter.REQUEST_ID_HEADER))
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void malformedTokenIsRejected() throws Exception {
        mockMvc.perform(get("/auth/profile")
                        .header("Authorization", "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void donorCannotListWithdrawals() throws Exception {
        UserAccount donor = testUserFactory.createDonor("donor@givehub.test");

        mockMvc.perform(get("/withdrawals")
                        .header("Authorization", testUserFactory.bearer(donor)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("access_denied"));
    }

    @Test
    void pendingOrganizerCannotCreateCampaign() throws Exception {
        UserAccount pending = testUserFactory.createPendingOrganizer("pending@givehub.test");

        mockMvc.perform(post("/campaigns")
                        .header("Authorization", testUserFactory.bearer(pending))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Too early", "target": 100}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("organizer.pending_approval"));
    }

    @Test
    void revokedOrganizerCannotRequestWithdrawal() throws Exception {
        UserAccount revoked = testUserFactory.createRevokedOrganizer("revoked@givehub.test");

        mockMvc.perform(post("/withdrawals")
                        .header("Authorization", testUserFactory.bearer(revoked))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"amountRequested": 10, "payoutMethod": "PAYPAL", "paypalEmail": "me@givehub.test"}
                                """))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("organizer.revoked"));
    }

    @Test
    void inboundRequestIdIsEchoed() throws Exception {
        mockMvc.perform(get("/healthz")
                        .header(RequestIdFilter.REQUEST_ID_HEADER, "trace-abc-123"))
                .andExpect(status().isOk())
                .andExpect(header().string(RequestIdFilter.REQUEST_ID_HEADER, "trace-abc-123"));
    }

    @Test
    void profileIsReturnedForValidToken() throws Exception {
        UserAccount donor = testUserFactory.createDonor("profile@givehub.test");

        mockMvc.perform(get("/auth/profile")
                        .header("Authorization", testUserFactory.bearer(donor)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("profile@givehub.test"))
                .andExpect(jsonPath("$.role").value("DONOR"));
    }
}
