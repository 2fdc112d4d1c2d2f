package bio.terra.iamdrift.common.exception;

/** Wraps failures talking to the Cloud Asset Inventory or interpreting its results. */
public class AssetInventoryException extends ErrorReportException {
  public AssetInventoryException(String message) {
    super(message);
  }

  public AssetInventoryException(String message, Throwable cause) {
    super(message, cause);
  }
}
