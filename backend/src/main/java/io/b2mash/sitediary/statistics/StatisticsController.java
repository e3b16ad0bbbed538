package io.b2mash.sitediary.statistics;

import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatisticsController {

  private final StatisticsService statisticsService;

  public StatisticsController(StatisticsService statisticsService) {
    this.statisticsService = statisticsService;
  }

  @GetMapping("/api/projects/{projectId}/stats")
  public ResponseEntity<ProjectStatistics> getStatistics(@PathVariable UUID projectId) {
    return ResponseEntity.ok(statisticsService.computeStatistics(projectId));
  }
}
