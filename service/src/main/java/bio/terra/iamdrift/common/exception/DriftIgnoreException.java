package bio.terra.iamdrift.common.exception;

/** The driftignore file exists but could not be read. */
public class DriftIgnoreException extends ErrorReportException {
  public DriftIgnoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
