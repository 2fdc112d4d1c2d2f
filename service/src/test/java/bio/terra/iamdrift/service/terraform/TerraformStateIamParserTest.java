package bio.terra.iamdrift.service.terraform;

import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.FOLDER_VIEWER;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_GROUP_BROWSER;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_SA_BROWSER;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.ORG_USER_BROWSER;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.PROJECT_ADMIN;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.STATE_FILE_URI;
import static bio.terra.iamdrift.common.fixtures.HierarchyFixtures.defaultLookup;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import bio.terra.iamdrift.app.configuration.external.GcsConfiguration;
import bio.terra.iamdrift.app.configuration.spring.BeanConfig;
import bio.terra.iamdrift.common.BaseUnitTest;
import bio.terra.iamdrift.common.exception.ObjectStorageException;
import bio.terra.iamdrift.common.exception.TerraformStateException;
import bio.terra.iamdrift.common.fixtures.InMemoryObjectStorage;
import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TerraformStateIamParserTest extends BaseUnitTest {
  private InMemoryObjectStorage storage;
  private GcsConfiguration gcsConfiguration;

  @BeforeEach
  void setup() {
    storage = new InMemoryObjectStorage();
    gcsConfiguration = new GcsConfiguration();
  }

  private TerraformStateIamParser parser() {
    return new TerraformStateIamParser(storage, new BeanConfig().objectMapper(), gcsConfiguration);
  }

  @Test
  void stateFileUris_onlyDefaultStateFiles() {
    storage
        .put("gs://my-bucket/envs/prod/default.tfstate", new byte[0])
        .put("gs://my-bucket/envs/prod/notdefault.tfstate", new byte[0])
        .put("gs://my-bucket/default.tfstate", new byte[0])
        .put("gs://other-bucket/default.tfstate", new byte[0]);

    assertThat(
        parser().stateFileUris(List.of("my-bucket")),
        containsInAnyOrder(
            "gs://my-bucket/envs/prod/default.tfstate", "gs://my-bucket/default.tfstate"));
  }

  @Test
  void processStates_extractsIamResources() {
    storage.putResource(STATE_FILE_URI, "terraform/valid.tfstate");

    Map<String, List<AssetIam>> grants =
        parser().processStates(List.of(STATE_FILE_URI), defaultLookup());

    // the storage bucket resource is skipped
    assertThat(
        grants.get(STATE_FILE_URI),
        contains(
            ORG_GROUP_BROWSER, ORG_SA_BROWSER, ORG_USER_BROWSER, FOLDER_VIEWER, PROJECT_ADMIN));
  }

  @Test
  void processStates_unresolvedFolderIsUnknown() {
    storage.putResource(STATE_FILE_URI, "terraform/unknown-folder.tfstate");

    Map<String, List<AssetIam>> grants =
        parser().processStates(List.of(STATE_FILE_URI), defaultLookup());

    assertThat(
        grants.get(STATE_FILE_URI),
        contains(
            new AssetIam("999", NodeType.UNKNOWN, "group:editors@google.com", "roles/editor"),
            new AssetIam("1231232222", NodeType.PROJECT, "user:owner@google.com", "roles/owner")));
  }

  @Test
  void processStates_emptyState() {
    storage.putResource(STATE_FILE_URI, "terraform/empty.tfstate");

    Map<String, List<AssetIam>> grants =
        parser().processStates(List.of(STATE_FILE_URI), defaultLookup());

    assertThat(grants.get(STATE_FILE_URI), empty());
  }

  @Test
  void processStates_malformedState_throws() {
    storage.putResource(STATE_FILE_URI, "terraform/malformed.tfstate");
    TerraformStateIamParser parser = parser();

    assertThrows(
        TerraformStateException.class,
        () -> parser.processStates(List.of(STATE_FILE_URI), defaultLookup()));
  }

  @Test
  void processStates_stateLargerThanLimit_throws() {
    gcsConfiguration.setStateFileSizeLimitBytes(64);
    storage.putResource(STATE_FILE_URI, "terraform/valid.tfstate");
    TerraformStateIamParser parser = parser();

    assertThrows(
        TerraformStateException.class,
        () -> parser.processStates(List.of(STATE_FILE_URI), defaultLookup()));
  }

  @Test
  void processStates_readFailure_throwsWithStateUri() {
    storage.putUnreadable(STATE_FILE_URI);
    TerraformStateIamParser parser = parser();

    TerraformStateException e =
        assertThrows(
            TerraformStateException.class,
            () -> parser.processStates(List.of(STATE_FILE_URI), defaultLookup()));
    assertThat(e.getMessage(), containsString(STATE_FILE_URI));
  }

  @Test
  void stateWithoutResources_readFailure_throwsWithStateUri() {
    storage.putUnreadable(STATE_FILE_URI);
    TerraformStateIamParser parser = parser();

    TerraformStateException e =
        assertThrows(
            TerraformStateException.class, () -> parser.stateWithoutResources(STATE_FILE_URI));
    assertThat(e.getMessage(), containsString(STATE_FILE_URI));
    assertThat(e.getCause(), instanceOf(ObjectStorageException.class));
  }

  @Test
  void stateWithoutResources() {
    storage
        .putResource("gs://my-bucket/empty/default.tfstate", "terraform/empty.tfstate")
        .putResource(STATE_FILE_URI, "terraform/valid.tfstate")
        .put(
            "gs://my-bucket/compact/default.tfstate",
            "{\"resources\":[]}".getBytes(StandardCharsets.UTF_8));
    TerraformStateIamParser parser = parser();

    assertTrue(parser.stateWithoutResources("gs://my-bucket/empty/default.tfstate"));
    assertFalse(parser.stateWithoutResources(STATE_FILE_URI));
    // only the formatting Terraform writes is recognized
    assertFalse(parser.stateWithoutResources("gs://my-bucket/compact/default.tfstate"));
  }
}
