package bio.terra.iamdrift.common.exception;

/**
 * Thrown when a folder or project points at a parent that is not part of the resource hierarchy,
 * or when a traversal starts from a node the hierarchy does not contain.
 */
public class MissingHierarchyReferenceException extends ErrorReportException {
  public MissingHierarchyReferenceException(String message) {
    super(message);
  }

  public MissingHierarchyReferenceException(String message, Throwable cause) {
    super(message, cause);
  }

  public static MissingHierarchyReferenceException forFolder(String folderId) {
    return new MissingHierarchyReferenceException(
        String.format("missing reference for folder with ID %s", folderId));
  }

  public static MissingHierarchyReferenceException forFolder(String folderId, String folderName) {
    return new MissingHierarchyReferenceException(
        String.format("missing reference for folder with ID %s and Name %s", folderId, folderName));
  }
}
