package bio.terra.iamdrift.common.utils;

import bio.terra.iamdrift.common.exception.InternalLogicException;

/**
 * Drift detection is a batch run with no caller that could handle an interruption, so an
 * InterruptedException is surfaced as an unchecked exception that aborts the run.
 */
public class Rethrow {

  /**
   * For use with onInterrupted.
   *
   * @param <R> return parameter from the implementation
   */
  @FunctionalInterface
  public interface InterruptedSupplier<R> {
    R apply() throws InterruptedException;
  }

  /**
   * Usage: Rethrow.onInterrupted(() -> executor.awaitTermination(...), "awaitTermination")
   *
   * @param function the blocking call
   * @param operation name of the call, used in the error message
   * @param <T> return type of the call
   * @return the return value of the call
   */
  public static <T> T onInterrupted(InterruptedSupplier<T> function, String operation) {
    try {
      return function.apply();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InternalLogicException("Interrupted during operation " + operation, e);
    }
  }
}
