package bio.terra.iamdrift.service.drift;

import bio.terra.iamdrift.service.assetinventory.HierarchyLookup;
import bio.terra.iamdrift.service.assetinventory.model.AssetIam;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps an IAM grant to the string used both as its identity when comparing live IAM with
 * Terraform state and as the text shown to users, e.g.
 * /organizations/123/projects/my-project/roles/owner/user:me@example.com
 *
 * <p>Folders and projects are shown by name when known and by id otherwise. Grants on resources
 * that could not be resolved are prefixed with {@code unknownParent:} so they never collide with
 * resolved ones.
 */
public class IamUriCanonicalizer {
  private final HierarchyLookup hierarchy;

  public IamUriCanonicalizer(HierarchyLookup hierarchy) {
    this.hierarchy = hierarchy;
  }

  public String uri(AssetIam iam) {
    String organizationId = hierarchy.getOrganizationId();
    String role = canonicalRole(iam.role(), organizationId);
    switch (iam.resourceType()) {
      case FOLDER:
        return String.format(
            "/organizations/%s/folders/%s/%s/%s",
            organizationId, hierarchy.folderNameOrId(iam.resourceId()), role, iam.member());
      case PROJECT:
        return String.format(
            "/organizations/%s/projects/%s/%s/%s",
            organizationId, hierarchy.projectNameOrId(iam.resourceId()), role, iam.member());
      case ORGANIZATION:
        return String.format("/organizations/%s/%s/%s", organizationId, role, iam.member());
      default:
        return String.format(
            "unknownParent:/organizations/%s/%s/%s/%s/%s",
            organizationId, iam.resourceType(), iam.resourceId(), role, iam.member());
    }
  }

  /** Drops the organization scoping of custom roles: organizations/123/roles/x becomes roles/x. */
  static String canonicalRole(String role, String organizationId) {
    String withoutOrganizations = StringUtils.replaceOnce(role, "organizations/", "");
    return StringUtils.replaceOnce(withoutOrganizations, organizationId + "/", "");
  }
}
