package com.shelfscan.stream;

import com.shelfscan.model.StreamEvent;
import java.util.Iterator;

/**
 * Lazy, finite, single-consumer sequence of a job's stream events. Iteration ends right after the
 * first terminal event. {@link #close()} may be called from any thread and aborts a blocked read.
 */
public interface EventStream extends Iterator<StreamEvent>, AutoCloseable {

  /** Number of connection attempts made so far. */
  int attempts();

  @Override
  void close();
}
