package com.codeheadsystems.veil.client.model;

import com.codeheadsystems.veil.exceptions.ProofGenerationException;
import com.codeheadsystems.veil.exceptions.VeilException;
import java.time.Clock;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Handle on one asynchronous proof generation.
 * <p>
 * Progress is published to {@link #events()} and, if given, to a listener. The result completes
 * with a {@link ProofOutcome}, or exceptionally with a {@link VeilException}.
 */
public class ProofJob {

  private final String jobId;
  private final CancellationToken token;
  private final BlockingQueue<ProofProgressEvent> events = new LinkedBlockingQueue<>();
  private final CompletableFuture<ProofOutcome> result = new CompletableFuture<>();
  private final Consumer<ProofProgressEvent> listener;
  private final Clock clock;

  /**
   * Instantiates a new Proof job.
   *
   * @param jobId    the job id
   * @param token    the token
   * @param listener the listener, may be null
   * @param clock    the clock
   */
  public ProofJob(final String jobId, final CancellationToken token,
                  final Consumer<ProofProgressEvent> listener, final Clock clock) {
    this.jobId = jobId;
    this.token = token;
    this.listener = listener;
    this.clock = clock;
  }

  public String jobId() {
    return jobId;
  }

  public CancellationToken token() {
    return token;
  }

  /**
   * Event stream. Ends with exactly one terminal event.
   *
   * @return the blocking queue
   */
  public BlockingQueue<ProofProgressEvent> events() {
    return events;
  }

  public CompletableFuture<ProofOutcome> result() {
    return result;
  }

  /**
   * Requests cancellation; the job stops at its next check point.
   */
  public void cancel() {
    token.cancel();
  }

  /**
   * Publishes a stage.
   *
   * @param stage  the stage
   * @param detail the detail
   */
  public void publish(final ProofStage stage, final String detail) {
    final ProofProgressEvent event = new ProofProgressEvent(stage, clock.instant(), detail);
    events.add(event);
    if (listener != null) {
      listener.accept(event);
    }
  }

  /**
   * Completes the job successfully.
   *
   * @param outcome the outcome
   */
  public void complete(final ProofOutcome outcome) {
    publish(outcome.aborted() ? ProofStage.ABORTED : ProofStage.DONE, outcome.fromCache() ? "cached" : "");
    result.complete(outcome);
  }

  /**
   * Completes the job with a failure.
   *
   * @param failure the failure
   */
  public void fail(final VeilException failure) {
    publish(ProofStage.FAILED, failure.kind().name());
    result.completeExceptionally(failure);
  }

  /**
   * Blocks until the job ends.
   *
   * @return the proof outcome
   * @throws VeilException the failure the job ended with
   */
  public ProofOutcome await() {
    try {
      return result.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProofGenerationException("Interrupted waiting for proof job " + jobId, e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof VeilException veilException) {
        throw veilException;
      }
      throw new ProofGenerationException("Proof job " + jobId + " failed", e.getCause());
    }
  }
}
