package io.b2mash.kpi.kpidashboard.whatif;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WhatIfController {

  private final WhatIfService whatIfService;

  public WhatIfController(WhatIfService whatIfService) {
    this.whatIfService = whatIfService;
  }

  @PostMapping("/api/what-if/remove-resource")
  public ResponseEntity<ResourceRemovalImpact> removeResource(
      @Valid @RequestBody RemoveResourceRequest request) {
    boolean redistribute = request.redistribute() == null || request.redistribute();
    return ResponseEntity.ok(whatIfService.removeResource(request.resource(), redistribute));
  }

  @PostMapping("/api/what-if/slip-schedule")
  public ResponseEntity<ScheduleSlipImpact> slipSchedule(
      @Valid @RequestBody SlipScheduleRequest request) {
    return ResponseEntity.ok(whatIfService.slipSchedule(request.weeks()));
  }

  @PostMapping("/api/what-if/add-hours")
  public ResponseEntity<AddHoursImpact> addHours(@Valid @RequestBody AddHoursRequest request) {
    return ResponseEntity.ok(whatIfService.addHours(request.taskId(), request.extraHours()));
  }

  // --- DTOs ---

  public record RemoveResourceRequest(@NotBlank String resource, Boolean redistribute) {}

  public record SlipScheduleRequest(@NotNull @Min(0) @Max(520) Integer weeks) {}

  public record AddHoursRequest(
      @NotNull UUID taskId, @NotNull @DecimalMax("1000000") BigDecimal extraHours) {}
}
