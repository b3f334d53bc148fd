package io.crisisintel.coordination.deployment;

import static io.crisisintel.coordination.testutil.TestCallers.addParticipant;
import static io.crisisintel.coordination.testutil.TestCallers.callerJwt;
import static io.crisisintel.coordination.testutil.TestCallers.declareCrisis;
import static io.crisisintel.coordination.testutil.TestCallers.seedAccount;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
class DeploymentControllerTest {

  private static final UUID ADMIN_ID = UUID.randomUUID();
  private static final UUID CHIEF_ID = UUID.randomUUID();
  private static final UUID DEPARTMENT_ID = UUID.randomUUID();

  @Autowired private MockMvc mockMvc;
  @Autowired private JdbcTemplate jdbcTemplate;

  private String crisisId;
  private String incidentId;

  @BeforeAll
  void setup() throws Exception {
    seedAccount(jdbcTemplate, CHIEF_ID, "fire_service");
    jdbcTemplate.update(
        "INSERT INTO fire_departments (id, owner_user_id, name) VALUES (?, ?, ?)",
        DEPARTMENT_ID,
        CHIEF_ID,
        "Central Station");
    crisisId = declareCrisis(mockMvc, ADMIN_ID, "Deployment crisis");
    addParticipant(mockMvc, ADMIN_ID, crisisId, CHIEF_ID);
    var result =
        mockMvc
            .perform(get("/api/crises/" + crisisId).with(callerJwt(ADMIN_ID, "regular")))
            .andExpect(status().isOk())
            .andReturn();
    incidentId = JsonPath.read(result.getResponse().getContentAsString(), "$.crisis.incidentId");
  }

  @Test
  void shouldDeployFireTeamAndComplete() throws Exception {
    var teamId = seedTeam("available");

    var result =
        mockMvc
            .perform(
                post("/api/incidents/" + incidentId + "/deployments")
                    .with(callerJwt(CHIEF_ID, "fire_service"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"unitType": "fire_team", "unitId": "%s", "headcount": 6}
                        """
                            .formatted(teamId)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.unitType").value("fire_team"))
            .andExpect(jsonPath("$.ownerUserId").value(CHIEF_ID.toString()))
            .andExpect(jsonPath("$.headcount").value(6))
            .andReturn();
    String deploymentId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(
            get("/api/incidents/" + incidentId + "/deployments")
                .param("status", "active")
                .with(callerJwt(ADMIN_ID, "regular")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[?(@.id == '" + deploymentId + "')]").exists());

    updateStatus(deploymentId, "completed")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("COMPLETED"))
        .andExpect(jsonPath("$.endedAt").isNotEmpty());

    updateStatus(deploymentId, "withdrawn")
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("immutable"));
  }

  @Test
  void shouldRejectUnavailableFireTeam() throws Exception {
    var teamId = seedTeam("busy");

    mockMvc
        .perform(
            post("/api/incidents/" + incidentId + "/deployments")
                .with(callerJwt(CHIEF_ID, "fire_service"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"unitType": "fire_team", "unitId": "%s"}
                    """
                        .formatted(teamId)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("validation"));
  }

  @Test
  void shouldForbidDeployingAnotherServicesTeam() throws Exception {
    var teamId = seedTeam("available");
    var stranger = UUID.randomUUID();
    seedAccount(jdbcTemplate, stranger, "fire_service");

    mockMvc
        .perform(
            post("/api/incidents/" + incidentId + "/deployments")
                .with(callerJwt(stranger, "fire_service"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"unitType": "fire_team", "unitId": "%s"}
                    """
                        .formatted(teamId)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("forbidden"));
  }

  @Test
  void shouldRejectUnknownUnitType() throws Exception {
    mockMvc
        .perform(
            post("/api/incidents/" + incidentId + "/deployments")
                .with(callerJwt(CHIEF_ID, "fire_service"))
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"unitType": "helicopter", "unitId": "%s"}
                    """
                        .formatted(UUID.randomUUID())))
        .andExpect(status().isBadRequest());
  }

  private UUID seedTeam(String teamStatus) {
    var teamId = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO fire_teams (id, department_id, name, status) VALUES (?, ?, ?, ?)",
        teamId,
        DEPARTMENT_ID,
        "Engine " + teamId.toString().substring(0, 4),
        teamStatus);
    return teamId;
  }

  private ResultActions updateStatus(String deploymentId, String target) throws Exception {
    return mockMvc.perform(
        patch("/api/deployments/" + deploymentId + "/status")
            .with(callerJwt(CHIEF_ID, "fire_service"))
            .contentType(MediaType.APPLICATION_JSON)
            .content(
                """
                {"status": "%s"}
                """
                    .formatted(target)));
  }
}
