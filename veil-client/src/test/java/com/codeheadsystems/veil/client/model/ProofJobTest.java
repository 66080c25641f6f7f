package com.codeheadsystems.veil.client.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.exceptions.ErrorKind;
import com.codeheadsystems.veil.exceptions.ProofGenerationException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProofJobTest {

  @Test
  void complete_publishesDoneAsTheLastEvent() {
    List<ProofProgressEvent> heard = new ArrayList<>();
    ProofJob job = new ProofJob("job-1", new CancellationToken(), heard::add, Clock.systemUTC());

    job.publish(ProofStage.SETUP, "withdraw");
    job.complete(ProofOutcome.ABORTED);

    assertThat(job.events()).extracting(ProofProgressEvent::stage)
        .containsExactly(ProofStage.SETUP, ProofStage.ABORTED);
    assertThat(heard).hasSize(2);
    assertThat(job.await().aborted()).isTrue();
  }

  @Test
  void cancel_setsTheSharedToken() {
    CancellationToken token = new CancellationToken();
    ProofJob job = new ProofJob("job-2", token, null, Clock.systemUTC());

    job.cancel();

    assertThat(token.isCancelled()).isTrue();
  }

  @Test
  void await_failedJob_rethrowsTheFailure() {
    ProofJob job = new ProofJob("job-3", new CancellationToken(), null, Clock.systemUTC());
    job.fail(new ProofGenerationException("prover crashed", null));

    assertThat(job.events()).extracting(ProofProgressEvent::stage).containsExactly(ProofStage.FAILED);
    assertThatThrownBy(job::await)
        .isInstanceOf(ProofGenerationException.class)
        .extracting(e -> ((ProofGenerationException) e).kind())
        .isEqualTo(ErrorKind.PROOF_GENERATION_FAILED);
  }

  @Test
  void await_interrupted_restoresInterruptFlag() {
    ProofJob job = new ProofJob("job-4", new CancellationToken(), null, Clock.systemUTC());
    Thread.currentThread().interrupt();

    assertThatThrownBy(job::await)
        .isInstanceOf(ProofGenerationException.class)
        .hasCauseInstanceOf(InterruptedException.class);
    assertThat(Thread.interrupted()).isTrue();
  }
}
