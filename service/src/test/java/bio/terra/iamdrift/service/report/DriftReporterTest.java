package bio.terra.iamdrift.service.report;

import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.FOLDER_VIEWER;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.FOLDER_VIEWER_URI;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_ID;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_SA_BROWSER;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_SA_BROWSER_URI;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_USER_BROWSER;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_USER_BROWSER_URI;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.STATE_FILE_URI;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import bio.terra.iamdrift.app.configuration.external.DriftDetectionConfiguration;
import bio.terra.iamdrift.app.configuration.external.DriftReportConfiguration;
import bio.terra.iamdrift.app.configuration.spring.BeanConfig;
import bio.terra.iamdrift.common.BaseUnitTest;
import bio.terra.iamdrift.common.exception.DriftReportException;
import bio.terra.iamdrift.service.drift.model.IamDrift;
import bio.terra.iamdrift.service.drift.model.TerraformStateIamSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class DriftReporterTest extends BaseUnitTest {
  private static final IamDrift DRIFT =
      new IamDrift(
          Map.of(ORG_USER_BROWSER_URI, ORG_USER_BROWSER, ORG_SA_BROWSER_URI, ORG_SA_BROWSER),
          Map.of(FOLDER_VIEWER_URI, new TerraformStateIamSource(FOLDER_VIEWER, STATE_FILE_URI)));

  private final ObjectMapper objectMapper = new BeanConfig().objectMapper();
  private DriftReportConfiguration reportConfiguration;
  private ByteArrayOutputStream output;
  private DriftReporter reporter;

  @BeforeEach
  void setup() {
    reportConfiguration = new DriftReportConfiguration();
    DriftDetectionConfiguration detectionConfiguration = new DriftDetectionConfiguration();
    detectionConfiguration.setOrganizationId(ORG_ID);
    output = new ByteArrayOutputStream();
    reporter =
        new DriftReporter(
            reportConfiguration,
            detectionConfiguration,
            objectMapper,
            new PrintStream(output, true, StandardCharsets.UTF_8));
  }

  @Test
  void formatMessage_bothSectionsSorted() {
    String message = DriftReporter.formatMessage(DRIFT, "See the runbook.");

    assertThat(
        message,
        equalTo(
            "Found Click Ops Changes \n> "
                + ORG_SA_BROWSER_URI
                + "\n> "
                + ORG_USER_BROWSER_URI
                + "\n\nFound Missing Terraform Changes \n> "
                + FOLDER_VIEWER_URI
                + "\n\nSee the runbook."));
  }

  @Test
  void formatMessage_singleSectionWithoutAppend() {
    IamDrift missingOnly =
        new IamDrift(
            Map.of(),
            Map.of(FOLDER_VIEWER_URI, new TerraformStateIamSource(FOLDER_VIEWER, STATE_FILE_URI)));

    assertThat(
        DriftReporter.formatMessage(missingOnly, null),
        equalTo("Found Missing Terraform Changes \n> " + FOLDER_VIEWER_URI));
  }

  @Test
  void formatMessage_noDrift_isEmptyEvenWithAppend() {
    assertThat(
        DriftReporter.formatMessage(new IamDrift(Map.of(), Map.of()), "See the runbook."),
        equalTo(""));
  }

  @Test
  void report_printsMessageAndWritesJson(@TempDir Path tempDir) throws Exception {
    Path reportFile = tempDir.resolve("drift.json");
    reportConfiguration.setOutputFile(reportFile.toString());

    reporter.report(DRIFT);

    assertThat(
        output.toString(StandardCharsets.UTF_8).trim(),
        equalTo(DriftReporter.formatMessage(DRIFT, null)));

    JsonNode json = objectMapper.readTree(reportFile.toFile());
    assertThat(json.get("organizationId").asText(), equalTo(ORG_ID));
    assertThat(json.get("clickOpsChanges").size(), equalTo(2));
    JsonNode clickOps = json.get("clickOpsChanges").get(0);
    assertThat(clickOps.get("uri").asText(), equalTo(ORG_SA_BROWSER_URI));
    assertThat(clickOps.get("resourceType").asText(), equalTo("Organization"));
    assertFalse(clickOps.has("stateFileUri"));
    JsonNode missing = json.get("missingTerraformChanges").get(0);
    assertThat(missing.get("resourceId").asText(), equalTo(FOLDER_VIEWER.resourceId()));
    assertThat(missing.get("stateFileUri").asText(), equalTo(STATE_FILE_URI));
  }

  @Test
  void report_unwritableOutputFile_throws(@TempDir Path tempDir) {
    reportConfiguration.setOutputFile(tempDir.resolve("missing-dir/drift.json").toString());

    assertThrows(DriftReportException.class, () -> reporter.report(DRIFT));
  }

  @Test
  void reportStateFilesWithoutResources() {
    reporter.reportStateFilesWithoutResources(
        List.of("gs://b/z/default.tfstate", "gs://b/a/default.tfstate"));

    assertThat(
        output.toString(StandardCharsets.UTF_8).trim(),
        equalTo(
            "Found Terraform State Files Without Resources \n> gs://b/a/default.tfstate"
                + "\n> gs://b/z/default.tfstate"));
  }
}
