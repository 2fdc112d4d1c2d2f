package bio.terra.iamdrift.service.assetinventory;

import bio.terra.iamdrift.common.exception.MissingHierarchyReferenceException;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNodeWithChildren;
import bio.terra.iamdrift.service.assetinventory.model.NodeType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * The resource hierarchy of one organization: the organization itself, all of its folders and all
 * of its projects, keyed by node id. Every node except the organization root is reachable from the
 * root; a graph that would violate that is rejected at construction.
 *
 * <p>Instances are immutable.
 */
public class HierarchyGraph {
  private final String organizationId;
  private final Map<String, HierarchyNodeWithChildren> idToNodes;

  private HierarchyGraph(String organizationId, Map<String, HierarchyNodeWithChildren> idToNodes) {
    this.organizationId = organizationId;
    this.idToNodes = idToNodes;
  }

  /**
   * Build the graph for an organization.
   *
   * <p>Folders are inserted parent first, following parent references through the folder set. A
   * folder whose parent is neither in the graph nor in the folder set, or whose parent chain loops
   * back on itself, is a missing reference. Projects are attached to their parent afterwards.
   *
   * @param organizationId the organization, which becomes the root
   * @param folders folders keyed by id
   * @param projects projects keyed by id
   * @return the graph
   * @throws MissingHierarchyReferenceException if a parent reference cannot be resolved
   */
  public static HierarchyGraph build(
      String organizationId,
      Map<String, HierarchyNode> folders,
      Map<String, HierarchyNode> projects) {
    Map<String, MutableNode> graph = new LinkedHashMap<>();
    graph.put(organizationId, new MutableNode(HierarchyNode.organization(organizationId)));

    for (HierarchyNode folder : folders.values()) {
      addFolder(graph, folder, folders, new HashSet<>());
    }

    for (HierarchyNode project : projects.values()) {
      MutableNode parent = graph.get(project.parentId());
      if (parent == null) {
        String parentType =
            Optional.ofNullable(project.parentType()).orElse(NodeType.UNKNOWN).getValue();
        throw new MissingHierarchyReferenceException(
            String.format(
                "missing reference for %s with ID %s",
                StringUtils.lowerCase(parentType), project.parentId()));
      }
      parent.projectIds.add(project.id());
    }

    ImmutableMap.Builder<String, HierarchyNodeWithChildren> frozen = ImmutableMap.builder();
    graph.forEach((id, node) -> frozen.put(id, node.freeze()));
    return new HierarchyGraph(organizationId, frozen.build());
  }

  private static void addFolder(
      Map<String, MutableNode> graph,
      HierarchyNode folder,
      Map<String, HierarchyNode> folders,
      Set<String> visiting) {
    if (graph.containsKey(folder.id())) {
      return;
    }
    visiting.add(folder.id());

    if (!graph.containsKey(folder.parentId())) {
      HierarchyNode parent = folders.get(folder.parentId());
      if (parent == null || visiting.contains(parent.id())) {
        throw MissingHierarchyReferenceException.forFolder(folder.parentId(), folder.name());
      }
      addFolder(graph, parent, folders, visiting);
    }

    graph.put(folder.id(), new MutableNode(folder));
    graph.get(folder.parentId()).folderIds.add(folder.id());
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public Optional<HierarchyNodeWithChildren> getNode(String id) {
    return Optional.ofNullable(idToNodes.get(id));
  }

  /** Ids of the projects directly beneath the node, or empty if the node is not in the graph. */
  public List<String> projectsDirectlyBeneath(String id) {
    return getNode(id).map(HierarchyNodeWithChildren::projectIds).orElse(ImmutableList.of());
  }

  public Map<String, HierarchyNodeWithChildren> getIdToNodes() {
    return idToNodes;
  }

  /**
   * All folders anywhere beneath a folder, not including the folder itself.
   *
   * @param folderId the folder to start from
   * @return descendant folder ids
   * @throws MissingHierarchyReferenceException if the folder is not in the graph
   */
  public Set<String> foldersBeneath(String folderId) {
    HierarchyNodeWithChildren start = idToNodes.get(folderId);
    if (start == null) {
      throw MissingHierarchyReferenceException.forFolder(folderId);
    }
    Set<String> found = new LinkedHashSet<>();
    Deque<String> pending = new ArrayDeque<>(start.folderIds());
    while (!pending.isEmpty()) {
      String id = pending.pop();
      HierarchyNodeWithChildren node = idToNodes.get(id);
      if (node == null) {
        throw MissingHierarchyReferenceException.forFolder(id);
      }
      if (found.add(id)) {
        node.folderIds().forEach(pending::push);
      }
    }
    return ImmutableSet.copyOf(found);
  }

  private static class MutableNode {
    private final HierarchyNode node;
    private final List<String> projectIds = new ArrayList<>();
    private final List<String> folderIds = new ArrayList<>();

    MutableNode(HierarchyNode node) {
      this.node = node;
    }

    HierarchyNodeWithChildren freeze() {
      return new HierarchyNodeWithChildren(
          node, ImmutableList.copyOf(projectIds), ImmutableList.copyOf(folderIds));
    }
  }
}
