package io.b2mash.kpi.kpidashboard.resource;

import io.b2mash.kpi.kpidashboard.phase.PhaseRatios;
import io.b2mash.kpi.kpidashboard.task.TaskPhase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/resources")
public class ResourceController {

  private final ResourceService resourceService;

  public ResourceController(ResourceService resourceService) {
    this.resourceService = resourceService;
  }

  @GetMapping
  public ResponseEntity<List<Resource>> listResources() {
    return ResponseEntity.ok(resourceService.listResources());
  }

  @GetMapping("/{name}")
  public ResponseEntity<Resource> getResource(@PathVariable String name) {
    return ResponseEntity.ok(resourceService.getResource(name));
  }

  @PostMapping
  public ResponseEntity<Resource> createResource(
      @Valid @RequestBody CreateResourceRequest request) {
    var resource =
        resourceService.createResource(
            request.name(), request.capacityHoursPerWeek(), toPreference(request.leadPreference()));
    return ResponseEntity.created(URI.create("/api/resources/" + resource.name())).body(resource);
  }

  @PutMapping("/{name}")
  public ResponseEntity<Resource> updateResource(
      @PathVariable String name, @Valid @RequestBody UpdateResourceRequest request) {
    var resource =
        resourceService.updateResource(
            name,
            request.capacityHoursPerWeek(),
            request.active(),
            toPreference(request.leadPreference()));
    return ResponseEntity.ok(resource);
  }

  private static LeadPreference toPreference(LeadPreferenceRequest request) {
    if (request == null) {
      return null;
    }
    PhaseRatios ratios =
        request.developmentRatio() != null
            ? new PhaseRatios(
                request.developmentRatio(), request.testingRatio(), request.reviewRatio())
            : null;
    return new LeadPreference(request.mode(), request.targetPhase(), ratios);
  }

  // --- DTOs ---

  public record LeadPreferenceRequest(
      AdjustmentMode mode,
      TaskPhase targetPhase,
      BigDecimal developmentRatio,
      BigDecimal testingRatio,
      BigDecimal reviewRatio) {}

  public record CreateResourceRequest(
      @NotBlank String name,
      @Positive BigDecimal capacityHoursPerWeek,
      LeadPreferenceRequest leadPreference) {}

  public record UpdateResourceRequest(
      @Positive BigDecimal capacityHoursPerWeek,
      Boolean active,
      LeadPreferenceRequest leadPreference) {}
}
