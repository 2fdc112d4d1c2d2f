package bio.terra.iamdrift.service.report;

import bio.terra.iamdrift.app.configuration.external.DriftDetectionConfiguration;
import bio.terra.iamdrift.app.configuration.external.DriftReportConfiguration;
import bio.terra.iamdrift.common.exception.DriftReportException;
import bio.terra.iamdrift.service.drift.model.IamDrift;
import bio.terra.iamdrift.service.report.model.DriftReport;
import bio.terra.iamdrift.service.report.model.DriftReportEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Prints detected drift and optionally writes it to a JSON file. */
@Component
public class DriftReporter {
  private static final Logger logger = LoggerFactory.getLogger(DriftReporter.class);

  static final String CLICK_OPS_HEADER = "Found Click Ops Changes \n> ";
  static final String MISSING_TERRAFORM_HEADER = "Found Missing Terraform Changes \n> ";
  static final String EMPTY_STATE_FILES_HEADER =
      "Found Terraform State Files Without Resources \n> ";
  private static final String ENTRY_SEPARATOR = "\n> ";

  private final DriftReportConfiguration reportConfiguration;
  private final DriftDetectionConfiguration detectionConfiguration;
  private final ObjectMapper objectMapper;
  private final PrintStream out;

  @Autowired
  public DriftReporter(
      DriftReportConfiguration reportConfiguration,
      DriftDetectionConfiguration detectionConfiguration,
      ObjectMapper objectMapper) {
    this(reportConfiguration, detectionConfiguration, objectMapper, System.out);
  }

  DriftReporter(
      DriftReportConfiguration reportConfiguration,
      DriftDetectionConfiguration detectionConfiguration,
      ObjectMapper objectMapper,
      PrintStream out) {
    this.reportConfiguration = reportConfiguration;
    this.detectionConfiguration = detectionConfiguration;
    this.objectMapper = objectMapper;
    this.out = out;
  }

  public void report(IamDrift drift) {
    String message = formatMessage(drift, reportConfiguration.getMessageAppend());
    if (message.isEmpty()) {
      logger.info("No IAM drift found");
    } else {
      out.println(message);
      out.flush();
    }
    if (StringUtils.isNotBlank(reportConfiguration.getOutputFile())) {
      writeJson(drift, Path.of(reportConfiguration.getOutputFile()));
    }
  }

  public void reportStateFilesWithoutResources(Collection<String> uris) {
    if (uris.isEmpty()) {
      logger.info("No terraform state files without resources found");
      return;
    }
    out.println(EMPTY_STATE_FILES_HEADER + sortedJoin(uris));
    out.flush();
  }

  /**
   * Render drift the way it is shown to users: each non-empty section is a header followed by one
   * sorted URI per line, with a blank line between the sections. No drift renders as "".
   */
  public static String formatMessage(IamDrift drift, String messageAppend) {
    StringBuilder message = new StringBuilder();
    if (!drift.clickOpsChanges().isEmpty()) {
      message.append(CLICK_OPS_HEADER).append(sortedJoin(drift.clickOpsChanges().keySet()));
      if (!drift.missingTerraformChanges().isEmpty()) {
        message.append("\n\n");
      }
    }
    if (!drift.missingTerraformChanges().isEmpty()) {
      message
          .append(MISSING_TERRAFORM_HEADER)
          .append(sortedJoin(drift.missingTerraformChanges().keySet()));
    }
    if (message.length() > 0 && StringUtils.isNotBlank(messageAppend)) {
      message.append("\n\n").append(messageAppend);
    }
    return message.toString();
  }

  DriftReport toReport(IamDrift drift) {
    List<DriftReportEntry> clickOps =
        drift.clickOpsChanges().entrySet().stream()
            .map(e -> DriftReportEntry.of(e.getKey(), e.getValue(), null))
            .collect(Collectors.toList());
    List<DriftReportEntry> missing =
        drift.missingTerraformChanges().entrySet().stream()
            .map(
                e ->
                    DriftReportEntry.of(
                        e.getKey(), e.getValue().assetIam(), e.getValue().stateFileUri()))
            .collect(Collectors.toList());
    return new DriftReport(detectionConfiguration.getOrganizationId(), clickOps, missing);
  }

  private void writeJson(IamDrift drift, Path file) {
    try {
      objectMapper.writeValue(file.toFile(), toReport(drift));
      logger.info("Wrote drift report to {}", file);
    } catch (IOException e) {
      throw new DriftReportException("failed to write drift report to " + file, e);
    }
  }

  private static String sortedJoin(Collection<String> uris) {
    return uris.stream().sorted().collect(Collectors.joining(ENTRY_SEPARATOR));
  }
}
