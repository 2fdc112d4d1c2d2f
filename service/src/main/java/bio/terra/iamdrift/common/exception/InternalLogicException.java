package bio.terra.iamdrift.common.exception;

/** When you can't get there from here, but somehow end up there */
public class InternalLogicException extends ErrorReportException {
  public InternalLogicException(String message) {
    super(message);
  }

  public InternalLogicException(String message, Throwable e) {
    super(message, e);
  }
}
