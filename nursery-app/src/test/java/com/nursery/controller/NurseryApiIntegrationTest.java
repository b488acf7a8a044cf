package com.nursery.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.matchesPattern;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class NurseryApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String register(String username, String password) throws Exception {
        String response = mockMvc.perform(post("/api/auth/register")
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(Map.of("username", username, "password", password))))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("access_token").asText();
    }

    private String createRecord(String token, String resource, Map<String, Object> body) throws Exception {
        String response = mockMvc.perform(post("/api/" + resource)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .contentType(MediaType.APPLICATION_JSON)
                .content(json(body)))
            .andExpect(status().isOk())
            .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("_id").asText();
    }

    private String json(Object value) throws Exception {
        return objectMapper.writeValueAsString(value);
    }

    private static Map<String, Object> quantityRecord(String type, int quantity) {
        return Map.of("date", "2024-05-01", "type", type, "quantity", quantity);
    }

    private static Map<String, Object> receivedRecord(int quantity) {
        return Map.of("date", "2024-05-01", "type", "Oak", "supplier", "Green Ltd",
            "price", 1.5, "lot_number", "L-1", "quantity", quantity);
    }

    @Nested
    @DisplayName("auth")
    class Auth {

        @Test
        void registerReturnsBearerToken() throws Exception {
            mockMvc.perform(post("/api/auth/register")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "grower", "password", "s3cret"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.token_type").value("bearer"))
                .andExpect(jsonPath("$.username").value("grower"))
                .andExpect(jsonPath("$.access_token").isNotEmpty());
        }

        @Test
        void duplicateRegistrationIsBadRequest() throws Exception {
            register("grower", "s3cret");

            mockMvc.perform(post("/api/auth/register")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "grower", "password", "other"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("DuplicateUser"));
        }

        @Test
        void longUsernameCanRegisterAndLogIn() throws Exception {
            String username = "u".repeat(300);
            register(username, "s3cret");

            mockMvc.perform(post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", username, "password", "s3cret"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.username").value(username));
        }

        @Test
        void loginTokenOpensProtectedRoutes() throws Exception {
            register("grower", "s3cret");

            String response = mockMvc.perform(post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "grower", "password", "s3cret"))))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
            String token = objectMapper.readTree(response).get("access_token").asText();

            mockMvc.perform(get("/api/dead-seedlings").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk());
        }

        @Test
        void badPasswordAndUnknownUserGetTheSameResponse() throws Exception {
            register("grower", "s3cret");

            String wrongPassword = mockMvc.perform(post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "grower", "password", "nope"))))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();
            String unknownUser = mockMvc.perform(post("/api/auth/login")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "nobody", "password", "s3cret"))))
                .andExpect(status().isUnauthorized())
                .andReturn().getResponse().getContentAsString();

            assertThat(wrongPassword).isEqualTo(unknownUser);
            assertThat(objectMapper.readTree(wrongPassword).get("code").asText()).isEqualTo("InvalidCredentials");
        }

        @Test
        void missingFieldsAreRejected() throws Exception {
            mockMvc.perform(post("/api/auth/register")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("username", "grower"))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("InvalidPayload"));
        }
    }

    @Nested
    @DisplayName("bearer token enforcement")
    class BearerEnforcement {

        @Test
        void missingTokenIsUnauthorized() throws Exception {
            mockMvc.perform(get("/api/seedlings-received"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
                .andExpect(jsonPath("$.code").value("TokenMissing"));
        }

        @Test
        void malformedTokenIsUnauthorized() throws Exception {
            mockMvc.perform(get("/api/dashboard/stats").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("TokenInvalid"));
        }

        @Test
        void rejectedTokenNeverReachesTheHandler() throws Exception {
            String token = register("grower", "s3cret");

            mockMvc.perform(post("/api/dead-seedlings")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token + "x")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(quantityRecord("Oak", 1))))
                .andExpect(status().isUnauthorized());

            mockMvc.perform(get("/api/dead-seedlings").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(jsonPath("$", hasSize(0)));
        }
    }

    @Nested
    @DisplayName("records")
    class Records {

        @Test
        void createdRecordCarriesIdentityOwnerAndFields() throws Exception {
            String token = register("grower", "s3cret");

            mockMvc.perform(post("/api/distributed-seedlings")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("date", "2024-05-01", "type", "Oak", "quantity", 7,
                        "destination", "School", "location", "North field", "user_id", "someone-else"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$._id").isNotEmpty())
                .andExpect(jsonPath("$.user_id").value("grower"))
                .andExpect(jsonPath("$.created_at").isNotEmpty())
                .andExpect(jsonPath("$.destination").value("School"))
                .andExpect(jsonPath("$.quantity").value(7));
        }

        @Test
        void longTextFieldsAreStoredUntruncated() throws Exception {
            String token = register("grower", "s3cret");
            String supplier = "S".repeat(300);

            mockMvc.perform(post("/api/seedlings-received")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("date", "2024-05-01", "type", "Oak", "supplier", supplier,
                        "price", 1.5, "lot_number", "L-1", "quantity", 3))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.supplier").value(supplier));

            mockMvc.perform(get("/api/seedlings-received").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(jsonPath("$[0].supplier").value(supplier));
        }

        @Test
        void listIsNewestFirst() throws Exception {
            String token = register("grower", "s3cret");
            createRecord(token, "dead-seedlings", quantityRecord("first", 1));
            createRecord(token, "dead-seedlings", quantityRecord("second", 2));

            mockMvc.perform(get("/api/dead-seedlings").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].type").value("second"))
                .andExpect(jsonPath("$[1].type").value("first"));
        }

        @Test
        void deleteRemovesOwnRecord() throws Exception {
            String token = register("grower", "s3cret");
            String id = createRecord(token, "nursery-produced", Map.of("date", "2024-05-01", "type", "Willow",
                "quantity", 3, "parent_plant", "W-1", "propagation_method", "cutting"));

            mockMvc.perform(delete("/api/nursery-produced/" + id).header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Deleted successfully"));

            mockMvc.perform(get("/api/nursery-produced").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(jsonPath("$", hasSize(0)));
        }

        @Test
        void ownersCannotSeeOrDeleteEachOthersRecords() throws Exception {
            String alice = register("alice", "pw-alice");
            String bob = register("bob", "pw-bob");
            String bobsRecord = createRecord(bob, "discarded-seedlings", quantityRecord("Ash", 4));

            mockMvc.perform(get("/api/discarded-seedlings").header(HttpHeaders.AUTHORIZATION, "Bearer " + alice))
                .andExpect(jsonPath("$", hasSize(0)));

            mockMvc.perform(delete("/api/discarded-seedlings/" + bobsRecord)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + alice))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NotFound"))
                .andExpect(jsonPath("$.detail").value("Item not found"));

            mockMvc.perform(get("/api/discarded-seedlings").header(HttpHeaders.AUTHORIZATION, "Bearer " + bob))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0]._id").value(bobsRecord));
        }

        @Test
        void unknownIdIsNotFound() throws Exception {
            String token = register("grower", "s3cret");

            mockMvc.perform(delete("/api/delivery-notes/does-not-exist")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Item not found"));
        }

        @Test
        void unknownResourceIsNotFound() throws Exception {
            String token = register("grower", "s3cret");

            mockMvc.perform(get("/api/watering-logs").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NotFound"));
        }

        @Test
        void wrongFieldTypeIsUnprocessable() throws Exception {
            String token = register("grower", "s3cret");

            mockMvc.perform(post("/api/delivery-notes")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json(Map.of("date", "2024-05-01", "type", "Oak",
                        "expected_quantity", "many", "actual_quantity", 9))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("InvalidPayload"))
                .andExpect(jsonPath("$.detail", containsString("expected_quantity")));
        }

        @Test
        void malformedJsonIsUnprocessable() throws Exception {
            String token = register("grower", "s3cret");

            mockMvc.perform(post("/api/dead-seedlings")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{not json"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("InvalidPayload"));
        }
    }

    @Nested
    @DisplayName("dashboard")
    class Dashboard {

        @Test
        void aggregatesTheOwnersStreams() throws Exception {
            String token = register("grower", "s3cret");
            createRecord(token, "seedlings-received", receivedRecord(10));
            createRecord(token, "seedlings-received", receivedRecord(5));
            createRecord(token, "nursery-produced", Map.of("date", "2024-05-01", "type", "Willow",
                "quantity", 3, "parent_plant", "W-1", "propagation_method", "cutting"));
            createRecord(token, "dead-seedlings", quantityRecord("Oak", 2));
            createRecord(token, "discarded-seedlings", quantityRecord("Oak", 1));
            createRecord(token, "distributed-seedlings", Map.of("date", "2024-05-01", "type", "Oak",
                "quantity", 50, "destination", "School", "location", "North"));

            String other = register("neighbour", "pw");
            createRecord(other, "dead-seedlings", quantityRecord("Oak", 99));

            mockMvc.perform(get("/api/dashboard/stats").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_received").value(15))
                .andExpect(jsonPath("$.total_produced").value(3))
                .andExpect(jsonPath("$.total_dead").value(2))
                .andExpect(jsonPath("$.total_discarded").value(1))
                .andExpect(jsonPath("$.total_in_nursery").value(15))
                .andExpect(jsonPath("$.survival_rate").value(83.33));
        }

        @Test
        void emptyOwnerGetsZeros() throws Exception {
            String token = register("grower", "s3cret");

            mockMvc.perform(get("/api/dashboard/stats").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_received").value(0))
                .andExpect(jsonPath("$.total_in_nursery").value(0))
                .andExpect(jsonPath("$.survival_rate").value(0.0));
        }
    }

    @Nested
    @DisplayName("export")
    class Export {

        @Test
        void servesCsvAttachment() throws Exception {
            String token = register("grower", "s3cret");
            createRecord(token, "dead-seedlings", quantityRecord("Oak", 2));

            mockMvc.perform(get("/api/export/csv").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                    matchesPattern("attachment; filename=\"nursery_data_\\d{8}\\.csv\"")))
                .andExpect(content().string(containsString("=== DEAD SEEDLINGS ===\ndate,type,quantity\r\n2024-05-01,Oak,2\r\n")));
        }

        @Test
        void emptyExportStillHasEveryHeader() throws Exception {
            String token = register("grower", "s3cret");

            String csv = mockMvc.perform(get("/api/export/csv").header(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

            assertThat(csv).contains(
                "=== SEEDLINGS RECEIVED ===",
                "=== DELIVERY NOTES ===",
                "=== DEAD SEEDLINGS ===",
                "=== DISCARDED SEEDLINGS ===",
                "=== NURSERY PRODUCED ===");
            assertThat(csv).doesNotContain("date,", "DISTRIBUTED");
        }
    }

    @Test
    void corsPreflightAllowsAnyOrigin() throws Exception {
        mockMvc.perform(options("/api/seedlings-received")
                .header(HttpHeaders.ORIGIN, "https://app.example.org")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "DELETE")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_HEADERS, "Authorization"))
            .andExpect(status().isOk())
            .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "https://app.example.org"));
    }
}
