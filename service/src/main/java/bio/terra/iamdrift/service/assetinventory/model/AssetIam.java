package bio.terra.iamdrift.service.assetinventory.model;

import javax.annotation.Nullable;

/**
 * A single IAM grant: one member holding one role on an organization, folder or project.
 *
 * @param resourceId id of the resource holding the binding (org, folder or project id)
 * @param resourceType type of the resource
 * @param member the principal, e.g. group:my-group@google.com
 * @param role the role, e.g. roles/owner
 * @param condition the binding condition, if the binding is conditional
 */
public record AssetIam(
    String resourceId,
    NodeType resourceType,
    String member,
    String role,
    @Nullable IamCondition condition) {

  public AssetIam(String resourceId, NodeType resourceType, String member, String role) {
    this(resourceId, resourceType, member, role, null);
  }

  /** The role and member as "/role/member", the form used by role ignore entries. */
  public String roleUri() {
    return String.format("/%s/%s", role, member);
  }
}
