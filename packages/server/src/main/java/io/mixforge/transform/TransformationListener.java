package io.mixforge.transform;

/** Callbacks an executor uses while a transformation is running. */
public interface TransformationListener {

  /** Called for each line the transformation writes to its standard output. */
  void onOutput(String line);

  /** Abort hook: executors that can stop early should do so once this returns true. */
  boolean isCancelled();
}
