package io.syncbridge.trigger;

import io.syncbridge.dispatch.QueueProcessor;
import io.syncbridge.spi.ProcessorTrigger;
import io.syncbridge.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs {@link QueueProcessor#process} on a background thread of this JVM.
 *
 * <p>Fires that arrive while a run is queued but not yet started collapse into that run.
 * A fire during a run queues exactly one follow-up run.
 */
public final class LocalProcessorTrigger implements ProcessorTrigger, AutoCloseable {
  private static final Logger logger = Logger.getLogger(LocalProcessorTrigger.class.getName());

  private final QueueProcessor processor;
  private final ExecutorService executor;
  private final AtomicBoolean queued = new AtomicBoolean();

  public LocalProcessorTrigger(QueueProcessor processor) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory("syncbridge-trigger-"));
  }

  @Override
  public void fire(int batchSize) {
    if (!queued.compareAndSet(false, true)) {
      return;
    }
    executor.execute(() -> {
      queued.set(false);
      try {
        processor.process(batchSize);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Triggered queue processing failed", e);
      }
    });
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
