package bio.terra.iamdrift.common.exception;

public class DriftReportException extends ErrorReportException {
  public DriftReportException(String message, Throwable cause) {
    super(message, cause);
  }
}
