package io.crisisintel.coordination.inventory;

import static io.crisisintel.coordination.testutil.TestCallers.addParticipant;
import static io.crisisintel.coordination.testutil.TestCallers.callerJwt;
import static io.crisisintel.coordination.testutil.TestCallers.declareCrisis;
import static io.crisisintel.coordination.testutil.TestCallers.platformAdminJwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.crisisintel.coordination.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class InventoryControllerTest {

  private static final UUID ADMIN_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;

  private String crisisId;

  @BeforeAll
  void declareCrisisForLedger() throws Exception {
    crisisId = declareCrisis(mockMvc, ADMIN_ID, "Ledger test crisis");
  }

  @Test
  void shouldSetAndListStock() throws Exception {
    var bankId = participatingBank();
    setStock(bankId, "AB-", 9);

    mockMvc
        .perform(get("/api/inventory/" + bankId).with(callerJwt(bankId, "hospital")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].resourceType").value("AB-"))
        .andExpect(jsonPath("$[0].quantity").value(9));
  }

  @Test
  void shouldRejectStockSetByAnotherUser() throws Exception {
    var bankId = UUID.randomUUID();

    mockMvc
        .perform(
            put("/api/inventory/" + bankId)
                .with(callerJwt(UUID.randomUUID(), "blood_bank"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"resourceType": "O-", "quantity": 4}
                    """))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("forbidden"));
  }

  @Test
  void shouldAllocateRevertAndRestock() throws Exception {
    var bankId = participatingBank();
    setStock(bankId, "O-", 5);

    var allocationId = allocate(bankId, "O-", 3);
    expectStock(bankId, 2);

    mockMvc
        .perform(post("/api/allocations/" + allocationId + "/revert").with(bankJwt(bankId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("REVERTED"))
        .andExpect(jsonPath("$.revertedAt").exists());
    expectStock(bankId, 5);

    mockMvc
        .perform(post("/api/allocations/" + allocationId + "/revert").with(bankJwt(bankId)))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("invalid_status"));
    expectStock(bankId, 5);
  }

  @Test
  void shouldRejectAllocationBeyondStock() throws Exception {
    var bankId = participatingBank();
    setStock(bankId, "O-", 2);

    mockMvc
        .perform(
            post("/api/crises/" + crisisId + "/allocations")
                .with(bankJwt(bankId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"providerId": "%s", "resourceType": "O-", "quantity": 3}
                    """
                        .formatted(bankId)))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("insufficient_inventory"));
    expectStock(bankId, 2);
  }

  @Test
  void shouldRevertWhenDeletingAllocationInEffect() throws Exception {
    var bankId = participatingBank();
    setStock(bankId, "O-", 6);
    var allocationId = allocate(bankId, "O-", 4);

    mockMvc
        .perform(delete("/api/allocations/" + allocationId).with(bankJwt(bankId)))
        .andExpect(status().isNoContent());

    expectStock(bankId, 6);
    mockMvc
        .perform(get("/api/allocations/" + allocationId).with(bankJwt(bankId)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("not_found"));
  }

  @Test
  void shouldForbidAllocationByNonParticipatingBank() throws Exception {
    var bankId = UUID.randomUUID();
    setStock(bankId, "A+", 10);

    mockMvc
        .perform(
            post("/api/crises/" + crisisId + "/allocations")
                .with(bankJwt(bankId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"providerId": "%s", "resourceType": "A+", "quantity": 1}
                    """
                        .formatted(bankId)))
        .andExpect(status().isForbidden());
  }

  @Test
  void shouldLetCrisisAdministratorAllocateFromAnyBank() throws Exception {
    var bankId = UUID.randomUUID();
    setStock(bankId, "B+", 3);

    mockMvc
        .perform(
            post("/api/crises/" + crisisId + "/allocations")
                .with(platformAdminJwt(ADMIN_ID))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"providerId": "%s", "resourceType": "B+", "quantity": 3, "purpose": "ICU"}
                    """
                        .formatted(bankId)))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.status").value("ALLOCATED"))
        .andExpect(jsonPath("$.allocatedBy").value(ADMIN_ID.toString()));
  }

  // --- Helpers ---

  private UUID participatingBank() throws Exception {
    var bankId = UUID.randomUUID();
    addParticipant(mockMvc, ADMIN_ID, crisisId, bankId);
    return bankId;
  }

  private static JwtRequestPostProcessor bankJwt(UUID bankId) {
    return callerJwt(bankId, "blood_bank");
  }

  private void setStock(UUID bankId, String type, int quantity) throws Exception {
    mockMvc
        .perform(
            put("/api/inventory/" + bankId)
                .with(bankJwt(bankId))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"resourceType": "%s", "quantity": %d}
                    """
                        .formatted(type, quantity)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.quantity").value(quantity));
  }

  private String allocate(UUID bankId, String type, int quantity) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/crises/" + crisisId + "/allocations")
                    .with(bankJwt(bankId))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"providerId": "%s", "resourceType": "%s", "quantity": %d}
                        """
                            .formatted(bankId, type, quantity)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("ALLOCATED"))
            .andReturn();
    return JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  private void expectStock(UUID bankId, int quantity) throws Exception {
    mockMvc
        .perform(get("/api/inventory/" + bankId).with(bankJwt(bankId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].quantity").value(quantity));
  }
}
