package bio.terra.iamdrift.app.runner;

import bio.terra.iamdrift.service.report.DriftReporter;
import bio.terra.iamdrift.service.statefile.EmptyStateFileDetector;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Profile("DetectEmptyStateFiles")
@Component
public class DetectEmptyStateFilesRunner implements ApplicationRunner {
  private final EmptyStateFileDetector emptyStateFileDetector;
  private final DriftReporter driftReporter;

  public DetectEmptyStateFilesRunner(
      EmptyStateFileDetector emptyStateFileDetector, DriftReporter driftReporter) {
    this.emptyStateFileDetector = emptyStateFileDetector;
    this.driftReporter = driftReporter;
  }

  @Override
  public void run(ApplicationArguments args) {
    driftReporter.reportStateFilesWithoutResources(
        emptyStateFileDetector.stateFilesWithoutResources());
  }
}
