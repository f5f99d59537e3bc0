package io.mixforge.transform;

import io.mixforge.exception.TransformationException;

/**
 * The audio extension algorithm, treated as an opaque and potentially minutes-long call. Callers
 * only look at the outcome and at whether the output file exists afterwards.
 */
public interface TransformationExecutor {

  /**
   * Run the transformation to completion.
   *
   * @throws TransformationException when the transformation reports failure or cannot be started
   * @throws java.util.concurrent.CancellationException when it was stopped through {@link
   *     TransformationListener#isCancelled()}
   * @throws InterruptedException when the calling thread is interrupted while waiting
   */
  TransformationOutcome run(TransformationRequest request, TransformationListener listener)
      throws InterruptedException;
}
