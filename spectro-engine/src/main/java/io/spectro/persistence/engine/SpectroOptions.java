package io.spectro.persistence.engine;

import io.spectro.persistence.exec.IsolationLevel;
import io.spectro.persistence.exec.Propagation;

/**
 * Engine tuning.
 *
 * @param batchSize          maximum number of keys per {@code IN (...)} lookup and rows per multi-row insert
 * @param preloadParallelism worker threads for concurrent preloads; 0 means an unbounded cached pool
 * @param defaultIsolation   isolation for {@code transaction(work)}; null uses the server default
 * @param defaultPropagation propagation for {@code transaction(work)}
 */
public record SpectroOptions(int batchSize, int preloadParallelism, IsolationLevel defaultIsolation, Propagation defaultPropagation) {
  public static final int DEFAULT_BATCH_SIZE = 1000;

  public SpectroOptions {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0: " + batchSize);
    if (preloadParallelism < 0) throw new IllegalArgumentException("preloadParallelism must be >= 0: " + preloadParallelism);
    defaultPropagation = (defaultPropagation == null) ? Propagation.REQUIRED : defaultPropagation;
  }

  public static SpectroOptions defaults() {
    return new SpectroOptions(DEFAULT_BATCH_SIZE, 0, null, Propagation.REQUIRED);
  }

  public SpectroOptions withBatchSize(int n) {
    return new SpectroOptions(n, preloadParallelism, defaultIsolation, defaultPropagation);
  }

  public SpectroOptions withPreloadParallelism(int n) {
    return new SpectroOptions(batchSize, n, defaultIsolation, defaultPropagation);
  }

  public SpectroOptions withDefaultIsolation(IsolationLevel level) {
    return new SpectroOptions(batchSize, preloadParallelism, level, defaultPropagation);
  }

  public SpectroOptions withDefaultPropagation(Propagation p) {
    return new SpectroOptions(batchSize, preloadParallelism, defaultIsolation, p);
  }
}
