package bio.terra.iamdrift.service.assetinventory.model;

import javax.annotation.Nullable;

/**
 * One organization, folder or project in the resource hierarchy.
 *
 * @param id numeric identifier, e.g. 123123423423
 * @param name unique display name of the folder or project id of the project, e.g.
 *     my-project-1234
 * @param parentId id of the folder or organization containing this node; null for the root
 * @param parentType type of the parent node; null for the root
 * @param nodeType type of this node
 */
public record HierarchyNode(
    String id,
    String name,
    @Nullable String parentId,
    @Nullable NodeType parentType,
    NodeType nodeType) {

  public static HierarchyNode organization(String organizationId) {
    return new HierarchyNode(organizationId, "Organization", null, null, NodeType.ORGANIZATION);
  }
}
