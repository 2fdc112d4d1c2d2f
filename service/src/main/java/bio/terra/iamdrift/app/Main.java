package bio.terra.iamdrift.app;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Command line entry point. The command is picked with the Spring profile: DetectIamDrift (the
 * default) or DetectEmptyStateFiles. Settings come from application.yml and can be overridden
 * with --iamdrift.detection.organization-id=... style arguments or environment variables.
 */
@SpringBootApplication(scanBasePackages = "bio.terra.iamdrift")
public class Main {
  public static void main(String[] args) {
    new SpringApplicationBuilder(Main.class).web(WebApplicationType.NONE).run(args);
  }
}
