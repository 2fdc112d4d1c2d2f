package bio.terra.iamdrift.service.drift;

import bio.terra.iamdrift.app.configuration.external.DriftDetectionConfiguration;
import bio.terra.iamdrift.common.exception.MissingHierarchyReferenceException;
import bio.terra.iamdrift.common.utils.WorkerPool;
import bio.terra.iamdrift.service.assetinventory.AssetInventory;
import bio.terra.iamdrift.service.assetinventory.HierarchyAssets;
import bio.terra.iamdrift.service.assetinventory.HierarchyGraph;
import bio.terra.iamdrift.service.assetinventory.HierarchyLookup;
import bio.terra.iamdrift.service.assetinventory.IamSearchOptions;
import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import bio.terra.iamdrift.service.drift.model.IamDrift;
import bio.terra.iamdrift.service.drift.model.IgnoredAssets;
import bio.terra.iamdrift.service.drift.model.TerraformStateIamSource;
import bio.terra.iamdrift.service.terraform.TerraformStateParser;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Compares the IAM grants live in a Google Cloud organization with the grants declared in its
 * Terraform state files.
 *
 * <p>A run lists folders, projects and state buckets concurrently, builds the resource hierarchy,
 * loads and expands the driftignore file, then fetches live IAM while the state files are parsed
 * on the worker pool. Both sides are keyed by {@link IamUriCanonicalizer} URIs. Ignored grants are
 * removed before diffing; after diffing, literal driftignore lines and default service agent
 * grants are removed from the differences. Any failure aborts the run.
 */
@Component
public class IamDriftDetector {
  private static final Logger logger = LoggerFactory.getLogger(IamDriftDetector.class);

  private static final List<String> IAM_ASSET_TYPES =
      ImmutableList.of(
          NodeType.ORGANIZATION.getAssetType(),
          NodeType.FOLDER.getAssetType(),
          NodeType.PROJECT.getAssetType());

  private final AssetInventory assetInventory;
  private final TerraformStateParser terraformStateParser;
  private final DefaultServiceAgentFilter defaultServiceAgentFilter;
  private final DriftDetectionConfiguration configuration;

  @Autowired
  public IamDriftDetector(
      AssetInventory assetInventory,
      TerraformStateParser terraformStateParser,
      DefaultServiceAgentFilter defaultServiceAgentFilter,
      DriftDetectionConfiguration configuration) {
    this.assetInventory = assetInventory;
    this.terraformStateParser = terraformStateParser;
    this.defaultServiceAgentFilter = defaultServiceAgentFilter;
    this.configuration = configuration;
  }

  /** Detect drift using the configured bucket query and driftignore file. */
  public IamDrift detectDrift() {
    return detectDrift(configuration.getGcsBucketQuery(), configuration.getDriftignoreFile());
  }

  /**
   * Detect drift for the configured organization.
   *
   * @param bucketQuery asset query selecting the buckets holding Terraform state
   * @param driftignoreFile path of the driftignore file; it need not exist
   * @return the drift, empty when live IAM matches Terraform
   */
  public IamDrift detectDrift(@Nullable String bucketQuery, String driftignoreFile) {
    String organizationId = configuration.getOrganizationId();
    logger.info("Detecting IAM drift in organization {}", organizationId);

    AtomicReference<List<HierarchyNode>> folders = new AtomicReference<>();
    AtomicReference<List<HierarchyNode>> projects = new AtomicReference<>();
    AtomicReference<List<String>> buckets = new AtomicReference<>();
    try (WorkerPool<Void> pool = newPool("asset-listing")) {
      pool.submit(
          "list folders",
          () -> {
            folders.set(assetInventory.hierarchyAssets(organizationId, NodeType.FOLDER));
            return null;
          });
      pool.submit(
          "list projects",
          () -> {
            projects.set(assetInventory.hierarchyAssets(organizationId, NodeType.PROJECT));
            return null;
          });
      pool.submit(
          "list terraform state buckets",
          () -> {
            buckets.set(assetInventory.buckets(organizationId, bucketQuery));
            return null;
          });
      pool.done();
    }

    Map<String, HierarchyNode> foldersById = HierarchyAssets.byId(folders.get());
    Map<String, HierarchyNode> projectsById = HierarchyAssets.byId(projects.get());
    HierarchyLookup hierarchy = new HierarchyLookup(organizationId, foldersById, projectsById);
    HierarchyGraph graph;
    try {
      graph = HierarchyGraph.build(organizationId, foldersById, projectsById);
    } catch (MissingHierarchyReferenceException e) {
      throw new MissingHierarchyReferenceException(
          "failed to construct graph from GCP assets", e);
    }

    IgnoredAssets ignored = DriftIgnore.load(Path.of(driftignoreFile), hierarchy);
    IgnoredAssets ignoredExpanded = DriftIgnore.expandGraph(ignored, graph);

    IamUriCanonicalizer canonicalizer = new IamUriCanonicalizer(hierarchy);
    Map<String, AssetIam> gcpIam;
    Map<String, TerraformStateIamSource> tfIam;
    logger.debug("Fetching terraform state from {} buckets", buckets.get().size());
    try (WorkerPool<Map<String, List<AssetIam>>> pool = newPool("terraform-state")) {
      for (String bucket : buckets.get()) {
        pool.submit(
            "parse terraform state in bucket " + bucket,
            () ->
                terraformStateParser.processStates(
                    terraformStateParser.stateFileUris(List.of(bucket)), hierarchy));
      }
      logger.debug("Fetching all IAM for organization {}", organizationId);
      gcpIam = actualGcpIam(organizationId, canonicalizer);
      tfIam = terraformStateIam(pool.done(), canonicalizer);
    }

    Map<String, AssetIam> gcpIamInScope =
        filterValues(gcpIam, iam -> !ignoredExpanded.isIgnored(iam));
    Map<String, TerraformStateIamSource> tfIamInScope =
        filterValues(tfIam, source -> !ignoredExpanded.isIgnored(source.assetIam()));
    logger.debug(
        "GCP IAM entries: {} total, {} in scope, {} ignored",
        gcpIam.size(),
        gcpIamInScope.size(),
        gcpIam.size() - gcpIamInScope.size());
    logger.debug(
        "Terraform IAM entries: {} total, {} in scope, {} ignored",
        tfIam.size(),
        tfIamInScope.size(),
        tfIam.size() - tfIamInScope.size());

    Set<String> clickOps = Sets.difference(gcpIamInScope.keySet(), tfIamInScope.keySet());
    Set<String> missingTerraform = Sets.difference(tfIamInScope.keySet(), gcpIamInScope.keySet());

    List<String> finalClickOps = withoutIgnoredUris(clickOps, ignored);
    List<String> finalMissingTerraform = withoutIgnoredUris(missingTerraform, ignored);
    logger.debug(
        "Click ops changes: {} found, {} reported, {} ignored",
        clickOps.size(),
        finalClickOps.size(),
        clickOps.size() - finalClickOps.size());
    logger.debug(
        "Missing terraform changes: {} found, {} reported, {} ignored",
        missingTerraform.size(),
        finalMissingTerraform.size(),
        missingTerraform.size() - finalMissingTerraform.size());

    logger.info(
        "Found {} click ops changes and {} missing terraform changes in organization {}",
        finalClickOps.size(),
        finalMissingTerraform.size(),
        organizationId);
    return new IamDrift(
        selectFrom(finalClickOps, gcpIam), selectFrom(finalMissingTerraform, tfIam));
  }

  private Map<String, AssetIam> actualGcpIam(
      String organizationId, IamUriCanonicalizer canonicalizer) {
    List<AssetIam> results =
        assetInventory.iam(
            new IamSearchOptions("organizations/" + organizationId, null, IAM_ASSET_TYPES));
    Map<String, AssetIam> gcpIam = new LinkedHashMap<>();
    for (AssetIam iam : results) {
      gcpIam.put(canonicalizer.uri(iam), iam);
    }
    return gcpIam;
  }

  private static Map<String, TerraformStateIamSource> terraformStateIam(
      List<Map<String, List<AssetIam>>> bucketResults, IamUriCanonicalizer canonicalizer) {
    Map<String, TerraformStateIamSource> tfIam = new LinkedHashMap<>();
    for (Map<String, List<AssetIam>> stateFiles : bucketResults) {
      stateFiles.forEach(
          (stateFileUri, grants) -> {
            for (AssetIam iam : grants) {
              tfIam.put(canonicalizer.uri(iam), new TerraformStateIamSource(iam, stateFileUri));
            }
          });
    }
    return tfIam;
  }

  private List<String> withoutIgnoredUris(Set<String> uris, IgnoredAssets ignored) {
    Set<String> notIgnored = Sets.difference(uris, ignored.iamAssets());
    return defaultServiceAgentFilter.withoutDefaultGrants(notIgnored);
  }

  private <T> WorkerPool<T> newPool(String name) {
    return new WorkerPool<>(name, configuration.getMaxConcurrentRequests(), true);
  }

  private static <T> Map<String, T> filterValues(Map<String, T> values, Predicate<T> keep) {
    Map<String, T> filtered = new LinkedHashMap<>();
    values.forEach(
        (uri, value) -> {
          if (keep.test(value)) {
            filtered.put(uri, value);
          }
        });
    return filtered;
  }

  private static <T> Map<String, T> selectFrom(List<String> uris, Map<String, T> from) {
    Map<String, T> selected = new LinkedHashMap<>();
    for (String uri : uris) {
      T value = from.get(uri);
      if (value != null) {
        selected.put(uri, value);
      }
    }
    return selected;
  }
}
