package io.b2mash.kpi.kpidashboard.dashboard;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DashboardController {

  private final DashboardService dashboardService;

  public DashboardController(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  @GetMapping("/api/summary")
  public ResponseEntity<PortfolioSummary> getSummary() {
    return ResponseEntity.ok(dashboardService.summary());
  }

  @GetMapping("/api/timeline")
  public ResponseEntity<Timeline> getTimeline() {
    return ResponseEntity.ok(dashboardService.timeline());
  }
}
