package io.b2mash.kpi.kpidashboard.scurve;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scurve")
public class SCurveController {

  private final SCurveService sCurveService;

  public SCurveController(SCurveService sCurveService) {
    this.sCurveService = sCurveService;
  }

  @GetMapping
  public ResponseEntity<SCurve> getPortfolioCurve(
      @RequestParam(required = false) Integer binDays) {
    return ResponseEntity.ok(sCurveService.portfolioCurve(binDays));
  }

  @GetMapping("/{projectId}")
  public ResponseEntity<SCurve> getProjectCurve(
      @PathVariable UUID projectId, @RequestParam(required = false) Integer binDays) {
    return ResponseEntity.ok(sCurveService.projectCurve(projectId, binDays));
  }
}
