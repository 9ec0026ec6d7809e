package io.b2mash.kpi.kpidashboard.baseline;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
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
public class BaselineController {

  private final BaselineService baselineService;

  public BaselineController(BaselineService baselineService) {
    this.baselineService = baselineService;
  }

  @GetMapping("/api/baselines")
  public ResponseEntity<List<BaselineSummaryResponse>> listBaselines() {
    return ResponseEntity.ok(
        baselineService.listBaselines().stream().map(BaselineSummaryResponse::from).toList());
  }

  @PostMapping("/api/baselines")
  public ResponseEntity<BaselineSnapshot> createBaseline(
      @Valid @RequestBody CreateBaselineRequest request) {
    var baseline = baselineService.createBaseline(request.name(), request.type());
    return ResponseEntity.created(URI.create("/api/baselines/" + baseline.id())).body(baseline);
  }

  @GetMapping("/api/baselines/{baselineId}")
  public ResponseEntity<BaselineSnapshot> getBaseline(@PathVariable UUID baselineId) {
    return ResponseEntity.ok(baselineService.getBaseline(baselineId));
  }

  @DeleteMapping("/api/baselines/{baselineId}")
  public ResponseEntity<Void> deleteBaseline(@PathVariable UUID baselineId) {
    baselineService.deleteBaseline(baselineId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/api/baselines/{baselineId}/compare")
  public ResponseEntity<BaselineComparison> compare(@PathVariable UUID baselineId) {
    return ResponseEntity.ok(baselineService.compare(baselineId));
  }

  // --- DTOs ---

  public record CreateBaselineRequest(@NotBlank @Size(max = 200) String name, BaselineType type) {}

  public record BaselineSummaryResponse(
      UUID id, String name, BaselineType type, Instant capturedAt, int taskCount) {

    public static BaselineSummaryResponse from(BaselineSnapshot baseline) {
      return new BaselineSummaryResponse(
          baseline.id(),
          baseline.name(),
          baseline.type(),
          baseline.capturedAt(),
          baseline.tasks().size());
    }
  }
}
