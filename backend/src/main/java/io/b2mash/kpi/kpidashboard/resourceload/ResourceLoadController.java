package io.b2mash.kpi.kpidashboard.resourceload;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ResourceLoadController {

  private final ResourceLoadService resourceLoadService;

  public ResourceLoadController(ResourceLoadService resourceLoadService) {
    this.resourceLoadService = resourceLoadService;
  }

  @GetMapping("/api/resource-load")
  public ResponseEntity<ResourceLoadReport> getResourceLoad(
      @RequestParam(required = false) Integer weeks) {
    return ResponseEntity.ok(resourceLoadService.load(LoadPeriod.WEEK, weeks));
  }

  @GetMapping("/api/resource-allocation")
  public ResponseEntity<ResourceLoadReport> getResourceAllocation(
      @RequestParam(required = false) Integer weeks) {
    return ResponseEntity.ok(resourceLoadService.allocation(LoadPeriod.WEEK, weeks));
  }

  @GetMapping("/api/labor-forecast")
  public ResponseEntity<ResourceLoadReport> getLaborForecast(
      @RequestParam(required = false, defaultValue = "12") int months) {
    return ResponseEntity.ok(resourceLoadService.load(LoadPeriod.MONTH, months));
  }
}
