package bio.terra.iamdrift.common.exception;

public class ObjectStorageException extends ErrorReportException {
  public ObjectStorageException(String message) {
    super(message);
  }

  public ObjectStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
