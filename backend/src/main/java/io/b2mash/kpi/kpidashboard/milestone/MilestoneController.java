package io.b2mash.kpi.kpidashboard.milestone;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MilestoneController {

  private final MilestoneService milestoneService;

  public MilestoneController(MilestoneService milestoneService) {
    this.milestoneService = milestoneService;
  }

  @GetMapping("/api/milestones")
  public ResponseEntity<List<Milestone>> listMilestones() {
    return ResponseEntity.ok(milestoneService.listMilestones());
  }

  @PostMapping("/api/milestones")
  public ResponseEntity<Milestone> addMilestone(
      @Valid @RequestBody CreateMilestoneRequest request) {
    var milestone =
        milestoneService.addMilestone(
            request.name(), request.date(), request.color(), request.description());
    return ResponseEntity.created(URI.create("/api/milestones/" + milestone.id())).body(milestone);
  }

  @DeleteMapping("/api/milestones/{milestoneId}")
  public ResponseEntity<Void> removeMilestone(@PathVariable UUID milestoneId) {
    milestoneService.removeMilestone(milestoneId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateMilestoneRequest(
      @NotBlank @Size(max = 200) String name,
      @NotNull LocalDate date,
      @Pattern(regexp = "^#[0-9a-fA-F]{6}$") String color,
      @Size(max = 2000) String description) {}
}
