package com.givehub.backend.modules.withdrawal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.UUID;

import com.givehub.backend.modules.campaign.infrastructure.persistence.CampaignRepository;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalRequest;
import com.givehub.backend.modules.withdrawal.domain.WithdrawalStatus;
import com.givehub.backend.modules.withdrawal.infrastructure.persistence.WithdrawalRequestRepository;
import com.givehub.backend.support.AbstractPostgresIntegrationTest;
import com.givehub.backend.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultMatcher;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
class PayoutFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestUserFactory testUserFactory;

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private WithdrawalRequestRepository withdrawalRequestRepository;

    @Test
    void donationsFundCampaignAndPaidWithdrawalDebitsIt() throws Exception {
        testUserFactory.createAdmin("admin@givehub.test");
        String adminToken = login("admin@givehub.test", TestUserFactory.DEFAULT_PASSWORD);
        String donorToken = register("Dana Donor", "dana@givehub.test");
        String organizerToken = register("Omar Organizer", "omar@givehub.test");

        JsonNode application = readJson(perform(post("/organizers/apply"), organizerToken, """
                {
                  "organizationName": "Helping Hands",
                  "description": "Community food bank serving the east district",
                  "contactEmail": "omar@givehub.test"
                }
                """, status().isCreated()));
        perform(patch("/organizers/applications/" + application.path("id").asText() + "/approve"),
                adminToken, null, status().isOk());

        JsonNode campaign = readJson(perform(post("/campaigns"), organizerToken, """
                {"title": "Clean water for Riverside", "description": "Wells and filters", "target": 1000}
                """, status().isCreated()));
        UUID campaignId = UUID.fromString(campaign.path("id").asText());
        assertThat(campaign.path("approved").asBoolean()).isFalse();

        String donationBody = """
                {"campaignId": "%s", "amount": 500, "method": "PAYPAL", "donorEmail": "Dana@GiveHub.test"}
                """.formatted(campaignId);
        perform(post("/donations"), donorToken, donationBody, status().isUnprocessableEntity());

        perform(patch("/campaigns/" + campaignId + "/approve"), adminToken, null, status().isOk());

        JsonNode donation = readJson(perform(post("/donations"), donorToken, donationBody, status().isCreated()));
        assertThat(donation.path("status").asText()).isEqualTo("PENDING");
        assertThat(donation.path("donorEmail").asText()).isEqualTo("dana@givehub.test");
        assertRaised(campaignId, "0");

        String completeBody = """
                {"status": "COMPLETED", "transactionId": "PAY-7781"}
                """;
        String statusPath = "/donations/" + donation.path("id").asText() + "/status";
        perform(patch(statusPath), adminToken, completeBody, status().isOk());
        perform(patch(statusPath), adminToken, completeBody, status().isOk());
        assertRaised(campaignId, "500");

        perform(post("/withdrawals"), organizerToken, withdrawalBody(campaignId, 600), status().isBadRequest());

        JsonNode withdrawal = readJson(perform(post("/withdrawals"), organizerToken,
                withdrawalBody(campaignId, 200), status().isCreated()));
        assertThat(withdrawal.path("status").asText()).isEqualTo("PENDING");

        MvcResult duplicate = perform(post("/withdrawals"), organizerToken,
                withdrawalBody(campaignId, 100), status().isConflict());
        assertThat(readJson(duplicate).path("code").asText()).isEqualTo("withdrawal.outstanding_exists");

        String withdrawalId = withdrawal.path("id").asText();
        perform(patch("/withdrawals/" + withdrawalId + "/approve"), adminToken, null, status().isOk());
        assertRaised(campaignId, "500");
        perform(patch("/withdrawals/" + withdrawalId + "/mark-paid"), adminToken, """
                {"paymentReference": "  WIRE-2024-0042  "}
                """, status().isOk());

        assertRaised(campaignId, "300");
        WithdrawalRequest paid = withdrawalRequestRepository.findById(UUID.fromString(withdrawalId)).orElseThrow();
        assertThat(paid.getStatus()).isEqualTo(WithdrawalStatus.PAID);
        assertThat(paid.getPaymentReference()).isEqualTo("WIRE-2024-0042");
        assertThat(paid.getPaidAt()).isNotNull();

        JsonNode stats = readJson(mockMvc.perform(get("/donations/stats/{campaignId}", campaignId)
                        .header("Authorization", organizerToken))
                .andExpect(status().isOk())
                .andReturn());
        assertThat(stats.path("count").asLong()).isEqualTo(1);
        assertThat(stats.path("totalAmount").decimalValue()).isEqualByComparingTo("500");

        mockMvc.perform(get("/donations/campaign/{campaignId}", campaignId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1))
                .andExpect(jsonPath("$.items[0].donorEmail").doesNotExist());
    }

    private String withdrawalBody(UUID campaignId, int amount) {
        return """
                {
                  "campaignId": "%s",
                  "amountRequested": %d,
                  "payoutMethod": "BANK",
                  "bankDetails": {"accountHolderName": "Omar Organizer", "bankName": "First Bank", "accountNumber": "00123456"}
                }
                """.formatted(campaignId, amount);
    }

    private void assertRaised(UUID campaignId, String expected) {
        BigDecimal raised = campaignRepository.findById(campaignId).orElseThrow().getRaised();
        assertThat(raised).isEqualByComparingTo(expected);
    }

    private String register(String name, String email) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name": "%s", "email": "%s", "password": "%s"}
                                """.formatted(name, email, TestUserFactory.DEFAULT_PASSWORD)))
                .andExpect(status().isCreated())
                .andReturn();
        return "Bearer " + readJson(result).path("accessToken").asText();
    }

    private String login(String email, String password) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "%s", "password": "%s"}
                                """.formatted(email, password)))
                .andExpect(status().isOk())
                .andReturn();
        return "Bearer " + readJson(result).path("accessToken").asText();
    }

    private MvcResult perform(
            MockHttpServletRequestBuilder builder,
            String token,
            String body,
            ResultMatcher expectedStatus
    ) throws Exception {
        builder.header("Authorization", token);
        if (body != null) {
            builder.contentType(MediaType.APPLICATION_JSON).content(body);
        }
        return mockMvc.perform(builder).andExpect(expectedStatus).andReturn();
    }

    private JsonNode readJson(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
