package io.crisisintel.coordination.request;

import static io.crisisintel.coordination.testutil.TestCallers.callerJwt;
import static io.crisisintel.coordination.testutil.TestCallers.seedAccount;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.crisisintel.coordination.TestcontainersConfiguration;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class RequestControllerTest {

  private static final UUID HOSPITAL_ID = UUID.randomUUID();
  private static final UUID BANK_ID = UUID.randomUUID();
  private static final UUID REGULAR_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  @BeforeAll
  void seedAccounts() {
    seedAccount(jdbcTemplate, HOSPITAL_ID, "hospital");
    seedAccount(jdbcTemplate, BANK_ID, "blood_bank");
    seedAccount(jdbcTemplate, REGULAR_ID, "regular");
  }

  @Test
  void shouldCreateInventoryRequestAndReturnDuplicateOnRepeat() throws Exception {
    var target = Instant.now().plus(Duration.ofDays(2)).truncatedTo(ChronoUnit.SECONDS);
    var body = inventoryBody(target, 4);

    var created =
        mockMvc
            .perform(
                post("/api/requests")
                    .with(hospitalJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.kind").value("inventory"))
            .andExpect(jsonPath("$.status").value("PENDING"))
            .andExpect(jsonPath("$.resourceType").value("O-"))
            .andExpect(jsonPath("$.duplicate").value(false))
            .andReturn();
    String id = idOf(created);

    mockMvc
        .perform(
            post("/api/requests")
                .with(hospitalJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(id))
        .andExpect(jsonPath("$.duplicate").value(true));
  }

  @Test
  void shouldRejectInventoryRequestToNonBloodBank() throws Exception {
    var target = Instant.now().plus(Duration.ofDays(1)).truncatedTo(ChronoUnit.SECONDS);

    mockMvc
        .perform(
            post("/api/requests")
                .with(hospitalJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"kind": "inventory", "counterpartyId": "%s", "targetAt": "%s",
                     "resourceType": "O-", "quantity": 1}
                    """
                        .formatted(REGULAR_ID, target)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("validation"));
  }

  @Test
  void shouldAcceptAndCancelWellBeforeTarget() throws Exception {
    var target = Instant.now().plus(Duration.ofDays(3)).truncatedTo(ChronoUnit.SECONDS);
    String id = createRequest(target, 2);

    mockMvc
        .perform(post("/api/requests/" + id + "/accept").with(bankJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ACCEPTED"));

    mockMvc
        .perform(post("/api/requests/" + id + "/cancel").with(bankJwt()))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(post("/api/requests/" + id + "/cancel").with(hospitalJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"));
  }

  @Test
  void shouldRefuseCancelInsideWindowButAllowCompletion() throws Exception {
    var target = Instant.now().plus(Duration.ofHours(1)).truncatedTo(ChronoUnit.SECONDS);
    String id = createRequest(target, 1);

    mockMvc
        .perform(post("/api/requests/" + id + "/accept").with(bankJwt()))
        .andExpect(status().isOk());

    mockMvc
        .perform(post("/api/requests/" + id + "/cancel").with(hospitalJwt()))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("too_late_to_cancel"));

    mockMvc
        .perform(post("/api/requests/" + id + "/complete").with(bankJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.closedAt").exists());

    mockMvc
        .perform(post("/api/requests/" + id + "/complete").with(bankJwt()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("immutable"));
  }

  @Test
  void shouldRejectWithReasonButKeepRejectedRequestVisible() throws Exception {
    var target = Instant.now().plus(Duration.ofDays(4)).truncatedTo(ChronoUnit.SECONDS);
    String id = createRequest(target, 7);

    mockMvc
        .perform(
            post("/api/requests/" + id + "/reject")
                .with(bankJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"reason": "stock reserved for surgery"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("REJECTED"))
        .andExpect(jsonPath("$.rejectReason").value("stock reserved for surgery"));

    mockMvc
        .perform(post("/api/requests/" + id + "/hide").with(hospitalJwt()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("invalid_status"));

    mockMvc
        .perform(get("/api/requests").param("status", "rejected").with(hospitalJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[?(@.id == '" + id + "')]").isNotEmpty());
  }

  @Test
  void shouldHideCancelledRequestFromRequesterOnly() throws Exception {
    var target = Instant.now().plus(Duration.ofDays(6)).truncatedTo(ChronoUnit.SECONDS);
    String id = createRequest(target, 6);

    mockMvc
        .perform(post("/api/requests/" + id + "/cancel").with(hospitalJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"));

    mockMvc
        .perform(post("/api/requests/" + id + "/hide").with(hospitalJwt()))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/requests").param("status", "cancelled").with(hospitalJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[?(@.id == '" + id + "')]").isEmpty());

    mockMvc
        .perform(get("/api/requests").param("status", "cancelled").with(bankJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[?(@.id == '" + id + "')]").isNotEmpty());
  }

  @Test
  void shouldForbidReadingByStranger() throws Exception {
    var target = Instant.now().plus(Duration.ofDays(5)).truncatedTo(ChronoUnit.SECONDS);
    String id = createRequest(target, 3);

    mockMvc
        .perform(get("/api/requests/" + id).with(callerJwt(UUID.randomUUID(), "regular")))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldRequireAuthentication() throws Exception {
    mockMvc.perform(get("/api/requests")).andExpect(status().isUnauthorized());
  }

  // --- Helpers ---

  private JwtRequestPostProcessor hospitalJwt() {
    return callerJwt(HOSPITAL_ID, "hospital");
  }

  private JwtRequestPostProcessor bankJwt() {
    return callerJwt(BANK_ID, "blood_bank");
  }

  private String inventoryBody(Instant target, int quantity) {
    return """
        {"kind": "inventory", "counterpartyId": "%s", "targetAt": "%s",
         "resourceType": "o-", "quantity": %d}
        """
        .formatted(BANK_ID, target, quantity);
  }

  private String createRequest(Instant target, int quantity) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/requests")
                    .with(hospitalJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(inventoryBody(target, quantity)))
            .andExpect(status().isCreated())
            .andReturn();
    return idOf(result);
  }

  private static String idOf(MvcResult result) throws Exception {
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }
}
