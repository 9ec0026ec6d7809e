package io.b2mash.kpi.kpidashboard.whatif;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class WhatIfControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;

  private String taskId;

  @BeforeAll
  void setUp() throws Exception {
    for (var name : new String[] {"WhatIf Leaving", "WhatIf Staying"}) {
      mockMvc
          .perform(
              post("/api/resources")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"name\": \"%s\"}".formatted(name)))
          .andExpect(status().isCreated());
    }
    var result =
        mockMvc
            .perform(
                post("/api/tasks")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"name": "WhatIf task", "resource": "WhatIf Leaving", "workHours": 100,
                         "percentComplete": 50, "startDate": "2025-03-03",
                         "finishDate": "2025-03-28"}
                        """))
            .andExpect(status().isCreated())
            .andReturn();
    taskId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");
  }

  @Test
  void shouldProposeRedistributionForRemovedResource() throws Exception {
    mockMvc
        .perform(
            post("/api/what-if/remove-resource")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"resource": "WhatIf Leaving", "redistribute": true}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.removedResource").value("WhatIf Leaving"))
        .andExpect(jsonPath("$.affectedTasks").value(1))
        .andExpect(jsonPath("$.redistribution[0].from").value("WhatIf Leaving"))
        .andExpect(jsonPath("$.redistribution[0].hours").value(50.0));
  }

  @Test
  void shouldProjectAddedHoursWithoutPersisting() throws Exception {
    mockMvc
        .perform(
            post("/api/what-if/add-hours")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"taskId\": \"%s\", \"extraHours\": 20}".formatted(taskId)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.currentWorkHours").value(100.0))
        .andExpect(jsonPath("$.projectedWorkHours").value(120.0))
        .andExpect(jsonPath("$.projectedRemaining").value(60.0));

    var task = mockMvc.perform(get("/api/tasks/" + taskId)).andReturn();
    Double workHours = JsonPath.read(task.getResponse().getContentAsString(), "$.workHours");
    assertThat(workHours).isEqualTo(100.0);
  }

  @Test
  void shouldSlipOpenTasks() throws Exception {
    mockMvc
        .perform(
            post("/api/what-if/slip-schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"weeks": 2}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.weeksSlipped").value(2));
  }

  @Test
  void shouldRejectNegativeSlip() throws Exception {
    mockMvc
        .perform(
            post("/api/what-if/slip-schedule")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"weeks": -1}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void shouldReturn404ForUnknownResource() throws Exception {
    mockMvc
        .perform(
            post("/api/what-if/remove-resource")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"resource": "Nobody"}
                    """))
        .andExpect(status().isNotFound());
  }
}
