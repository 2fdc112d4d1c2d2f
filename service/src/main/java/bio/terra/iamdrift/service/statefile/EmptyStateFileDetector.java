package bio.terra.iamdrift.service.statefile;

import bio.terra.iamdrift.app.configuration.external.DriftDetectionConfiguration;
import bio.terra.iamdrift.common.utils.WorkerPool;
import bio.terra.iamdrift.service.assetinventory.AssetInventory;
import bio.terra.iamdrift.service.terraform.TerraformStateParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Finds Terraform state files that declare no resources. These are left behind when a
 * configuration is destroyed or never applied, and can be deleted.
 */
@Component
public class EmptyStateFileDetector {
  private static final Logger logger = LoggerFactory.getLogger(EmptyStateFileDetector.class);

  private final AssetInventory assetInventory;
  private final TerraformStateParser terraformStateParser;
  private final DriftDetectionConfiguration configuration;

  @Autowired
  public EmptyStateFileDetector(
      AssetInventory assetInventory,
      TerraformStateParser terraformStateParser,
      DriftDetectionConfiguration configuration) {
    this.assetInventory = assetInventory;
    this.terraformStateParser = terraformStateParser;
    this.configuration = configuration;
  }

  /** gs:// URIs of the state files without resources, in bucket listing order. */
  public List<String> stateFilesWithoutResources() {
    String organizationId = configuration.getOrganizationId();
    List<String> buckets =
        assetInventory.buckets(organizationId, configuration.getGcsBucketQuery());
    List<String> stateFiles = terraformStateParser.stateFileUris(buckets);
    logger.info("Checking {} state files in {} buckets", stateFiles.size(), buckets.size());

    List<Optional<String>> checked;
    try (WorkerPool<Optional<String>> pool =
        new WorkerPool<>("state-file-check", configuration.getMaxConcurrentRequests(), true)) {
      for (String uri : stateFiles) {
        pool.submit(
            "check " + uri,
            () ->
                terraformStateParser.stateWithoutResources(uri)
                    ? Optional.of(uri)
                    : Optional.empty());
      }
      checked = pool.done();
    }

    List<String> empty = new ArrayList<>();
    checked.forEach(result -> result.ifPresent(empty::add));
    logger.debug("{} of {} state files have no resources", empty.size(), stateFiles.size());
    return empty;
  }
}
