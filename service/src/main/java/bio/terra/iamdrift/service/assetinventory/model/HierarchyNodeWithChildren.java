package bio.terra.iamdrift.service.assetinventory.model;

import java.util.List;

/**
 * A hierarchy node together with the ids of its immediate children.
 *
 * @param node the node itself
 * @param projectIds projects directly beneath this node, in insertion order
 * @param folderIds folders directly beneath this node, in insertion order
 */
public record HierarchyNodeWithChildren(
    HierarchyNode node, List<String> projectIds, List<String> folderIds) {}
