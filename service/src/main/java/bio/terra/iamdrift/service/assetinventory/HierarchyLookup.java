package bio.terra.iamdrift.service.assetinventory;

import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Id and name lookups over the folders and projects of one organization, as listed at the start
 * of a detection run.
 */
public class HierarchyLookup {
  private final String organizationId;
  private final Map<String, HierarchyNode> foldersById;
  private final Map<String, HierarchyNode> projectsById;
  private final Map<String, HierarchyNode> assetsById;
  private final Map<String, HierarchyNode> foldersByName;
  private final Map<String, HierarchyNode> projectsByName;

  public HierarchyLookup(
      String organizationId,
      Map<String, HierarchyNode> foldersById,
      Map<String, HierarchyNode> projectsById) {
    this.organizationId = organizationId;
    this.foldersById = ImmutableMap.copyOf(foldersById);
    this.projectsById = ImmutableMap.copyOf(projectsById);
    this.assetsById = ImmutableMap.copyOf(HierarchyAssets.merge(foldersById, projectsById));
    this.foldersByName = ImmutableMap.copyOf(HierarchyAssets.byName(foldersById));
    this.projectsByName = ImmutableMap.copyOf(HierarchyAssets.byName(projectsById));
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public Map<String, HierarchyNode> getFoldersById() {
    return foldersById;
  }

  public Map<String, HierarchyNode> getProjectsById() {
    return projectsById;
  }

  /** Folder with the given id, falling back to a folder with the given name. */
  public Optional<HierarchyNode> findFolder(String idOrName) {
    return Optional.ofNullable(foldersById.get(idOrName))
        .or(() -> Optional.ofNullable(foldersByName.get(idOrName)));
  }

  /** Project with the given id, falling back to a project with the given name. */
  public Optional<HierarchyNode> findProject(String idOrName) {
    return Optional.ofNullable(projectsById.get(idOrName))
        .or(() -> Optional.ofNullable(projectsByName.get(idOrName)));
  }

  /**
   * Resolve a reference that may be a folder or a project. Numeric references are looked up by id
   * among folders and projects; anything else by folder name, then project name.
   */
  public Optional<HierarchyNode> resolve(String reference) {
    if (StringUtils.isNumeric(reference)) {
      return Optional.ofNullable(assetsById.get(reference));
    }
    return Optional.ofNullable(foldersByName.get(reference))
        .or(() -> Optional.ofNullable(projectsByName.get(reference)));
  }

  /** Display name of a folder, or the id itself when the folder is not known. */
  public String folderNameOrId(String folderId) {
    HierarchyNode folder = foldersById.get(folderId);
    return folder == null ? folderId : folder.name();
  }

  /** Display name of a project, or the id itself when the project is not known. */
  public String projectNameOrId(String projectId) {
    HierarchyNode project = projectsById.get(projectId);
    return project == null ? projectId : project.name();
  }
}
