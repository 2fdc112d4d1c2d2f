package bio.terra.iamdrift.service.drift;

import bio.terra.iamdrift.common.exception.DriftIgnoreException;
import bio.terra.iamdrift.common.exception.MissingHierarchyReferenceException;
import bio.terra.iamdrift.service.assetinventory.HierarchyGraph;
import bio.terra.iamdrift.service.assetinventory.HierarchyLookup;
import bio.terra.iamdrift.service.assetinventory.model.HierarchyNode;
import bio.terra.iamdrift.service.drift.model.IgnoredAssets;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads driftignore files and expands their folder entries through the resource hierarchy.
 *
 * <p>A driftignore file has one entry per line. Every line is kept for literal matching against
 * drift URIs. Lines of the following shapes additionally ignore whole resources or role grants:
 *
 * <pre>
 * /organizations/&lt;org&gt;/projects/&lt;name-or-id&gt;
 * /organizations/&lt;org&gt;/folders/&lt;name-or-id&gt;
 * /roles/&lt;role&gt;/serviceAccount:&lt;email&gt;   (also group: and user:)
 * </pre>
 */
public class DriftIgnore {
  private static final Logger logger = LoggerFactory.getLogger(DriftIgnore.class);

  private static final Pattern IGNORED_PROJECT_PATTERN =
      Pattern.compile("^/organizations/(?:\\d*)/projects/([^/]*)$");
  private static final Pattern IGNORED_FOLDER_PATTERN =
      Pattern.compile("^/organizations/(?:\\d*)/folders/([^/]*)$");
  // e.g. /roles/resourcemanager.folderEditor/serviceAccount:sa@my-project.iam.gserviceaccount.com
  private static final Pattern IGNORED_ROLE_PATTERN =
      Pattern.compile("^/roles/([^/\\s]*)/(serviceAccount|group|user):([^/\\s]*)$");

  private DriftIgnore() {}

  /**
   * Parse a driftignore file. A missing file ignores nothing. Project and folder entries are
   * resolved by id, then by name; entries that match neither are logged and left out of the
   * project and folder sets.
   *
   * @param file the driftignore file
   * @param hierarchy the live folders and projects
   * @throws DriftIgnoreException if the file exists but cannot be read
   */
  public static IgnoredAssets load(Path file, HierarchyLookup hierarchy) {
    List<String> lines;
    try {
      lines = Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      logger.debug("No driftignore file at {}", file);
      return IgnoredAssets.empty();
    } catch (IOException e) {
      throw new DriftIgnoreException("failed to read driftignore file " + file, e);
    }
    return parse(lines, hierarchy);
  }

  static IgnoredAssets parse(List<String> lines, HierarchyLookup hierarchy) {
    Set<String> iamAssets = new LinkedHashSet<>();
    Set<String> projects = new LinkedHashSet<>();
    Set<String> folders = new LinkedHashSet<>();
    Set<String> roles = new LinkedHashSet<>();

    for (String rawLine : lines) {
      String line = rawLine.trim();
      iamAssets.add(line);

      Matcher projectMatch = IGNORED_PROJECT_PATTERN.matcher(line);
      if (projectMatch.matches()) {
        resolve(hierarchy.findProject(projectMatch.group(1)), "project", line)
            .ifPresent(projects::add);
      }

      Matcher folderMatch = IGNORED_FOLDER_PATTERN.matcher(line);
      if (folderMatch.matches()) {
        resolve(hierarchy.findFolder(folderMatch.group(1)), "folder", line)
            .ifPresent(folders::add);
      }

      if (IGNORED_ROLE_PATTERN.matcher(line).matches()) {
        roles.add(line);
      }
    }
    return new IgnoredAssets(iamAssets, projects, folders, roles);
  }

  private static Optional<String> resolve(Optional<HierarchyNode> node, String kind, String line) {
    if (node.isEmpty()) {
      logger.warn("Failed to identify ignored {} for driftignore entry {}", kind, line);
    }
    return node.map(HierarchyNode::id);
  }

  /**
   * Extend the ignored folders with every folder beneath them, then the ignored projects with
   * every project directly beneath an ignored folder. The literal lines and roles are unchanged.
   *
   * @throws MissingHierarchyReferenceException if an ignored folder is not in the graph
   */
  public static IgnoredAssets expandGraph(IgnoredAssets ignored, HierarchyGraph graph) {
    Set<String> folders = new LinkedHashSet<>(ignored.folderIds());
    for (String folderId : ignored.folderIds()) {
      try {
        folders.addAll(graph.foldersBeneath(folderId));
      } catch (MissingHierarchyReferenceException e) {
        throw new MissingHierarchyReferenceException(
            "failed to traverse hierarchy for folder with ID " + folderId, e);
      }
    }

    Set<String> projects = new LinkedHashSet<>(ignored.projectIds());
    for (String folderId : folders) {
      projects.addAll(graph.projectsDirectlyBeneath(folderId));
    }
    return new IgnoredAssets(ignored.iamAssets(), projects, folders, ignored.roles());
  }
}
