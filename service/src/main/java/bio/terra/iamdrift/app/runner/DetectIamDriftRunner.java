package bio.terra.iamdrift.app.runner;

import bio.terra.iamdrift.service.drift.IamDriftDetector;
import bio.terra.iamdrift.service.drift.model.IamDrift;
import bio.terra.iamdrift.service.report.DriftReporter;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Profile("DetectIamDrift")
@Component
public class DetectIamDriftRunner implements ApplicationRunner {
  private final IamDriftDetector iamDriftDetector;
  private final DriftReporter driftReporter;

  public DetectIamDriftRunner(IamDriftDetector iamDriftDetector, DriftReporter driftReporter) {
    this.iamDriftDetector = iamDriftDetector;
    this.driftReporter = driftReporter;
  }

  @Override
  public void run(ApplicationArguments args) {
    IamDrift drift = iamDriftDetector.detectDrift();
    driftReporter.report(drift);
  }
}
