package bio.terra.iamdrift.common.exception;

/** A Terraform state file could not be downloaded or decoded. */
public class TerraformStateException extends ErrorReportException {
  public TerraformStateException(String message) {
    super(message);
  }

  public TerraformStateException(String message, Throwable cause) {
    super(message, cause);
  }
}
