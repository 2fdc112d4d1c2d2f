package bio.terra.iamdrift.common.exception;

import java.util.List;

/**
 * Raised from {@link bio.terra.iamdrift.common.utils.WorkerPool#done()} when a submitted task
 * failed. The cause is the first failure; {@link #getCauses()} lists every failed task.
 */
public class WorkerPoolException extends ErrorReportException {
  public WorkerPoolException(String message, Throwable cause, List<String> causes) {
    super(message, cause, causes);
  }
}
