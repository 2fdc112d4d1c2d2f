package bio.terra.iamdrift.common.exception;

import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Base class for the exceptions raised by drift detection. Carries an optional list of causes so
 * that a failure collected from several concurrent tasks can be reported as a single error.
 */
public abstract class ErrorReportException extends RuntimeException {
  private final List<String> causes;

  public ErrorReportException(String message) {
    super(message);
    this.causes = ImmutableList.of();
  }

  public ErrorReportException(String message, Throwable cause) {
    super(message, cause);
    this.causes = ImmutableList.of();
  }

  public ErrorReportException(String message, @Nullable List<String> causes) {
    super(message);
    this.causes = causes == null ? ImmutableList.of() : ImmutableList.copyOf(causes);
  }

  public ErrorReportException(String message, Throwable cause, @Nullable List<String> causes) {
    super(message, cause);
    this.causes = causes == null ? ImmutableList.of() : ImmutableList.copyOf(causes);
  }

  public List<String> getCauses() {
    return causes;
  }
}
