package bio.terra.iamdrift.service.drift.model;

import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import com.google.common.collect.ImmutableSet;
import java.util.Set;

/**
 * What a driftignore file excludes from the drift report.
 *
 * @param iamAssets every line of the file, matched literally against drift URIs
 * @param projectIds ids of projects whose grants are ignored
 * @param folderIds ids of folders whose grants are ignored
 * @param roles "/role/member" strings ignored on any resource
 */
public record IgnoredAssets(
    Set<String> iamAssets, Set<String> projectIds, Set<String> folderIds, Set<String> roles) {

  public IgnoredAssets {
    iamAssets = ImmutableSet.copyOf(iamAssets);
    projectIds = ImmutableSet.copyOf(projectIds);
    folderIds = ImmutableSet.copyOf(folderIds);
    roles = ImmutableSet.copyOf(roles);
  }

  public static IgnoredAssets empty() {
    return new IgnoredAssets(Set.of(), Set.of(), Set.of(), Set.of());
  }

  /**
   * Whether a grant is ignored by its role and member, or because the project or folder holding
   * it is ignored. Organization and unknown grants are only ignored by role.
   */
  public boolean isIgnored(AssetIam iam) {
    if (roles.contains(iam.roleUri())) {
      return true;
    }
    switch (iam.resourceType()) {
      case PROJECT:
        return projectIds.contains(iam.resourceId());
      case FOLDER:
        return folderIds.contains(iam.resourceId());
      default:
        return false;
    }
  }
}
