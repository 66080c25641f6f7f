package com.codeheadsystems.veil.client.manager;

import static com.codeheadsystems.veil.client.VeilTestHarness.randomAddress;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.codeheadsystems.veil.client.VeilTestHarness;
import com.codeheadsystems.veil.client.accessor.InMemoryLedgerAccessor;
import com.codeheadsystems.veil.client.accessor.LedgerAccessor;
import com.codeheadsystems.veil.client.config.VeilClientConfig;
import com.codeheadsystems.veil.exceptions.RelayerUnavailableException;
import com.codeheadsystems.veil.ledger.RelayerAccountLayout;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.relayer.Relayer;
import com.codeheadsystems.veil.relayer.RelayerFilter;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelayerManagerTest {

  private VeilTestHarness harness;
  private InMemoryLedgerAccessor ledger;
  private RelayerManager manager;
  private Relayer fast;
  private Relayer cheap;
  private Relayer retired;

  @BeforeEach
  void setUp() {
    harness = new VeilTestHarness();
    ledger = harness.ledger();
    manager = harness.client().relayerManager();
    fast = new Relayer(randomAddress(), 1.0, true, 3.0, 0, 95.0, 40);
    cheap = new Relayer(randomAddress(), 0.25, true, 0.0, 0, null, null);
    retired = new Relayer(randomAddress(), 0.1, false, 50.0, 0, 100.0, 10);
    ledger.putRelayer(fast);
    ledger.putRelayer(cheap);
    ledger.putRelayer(retired);
  }

  @AfterEach
  void tearDown() {
    harness.close();
  }

  @Test
  void refresh_decodesEveryRelayerAccount() {
    assertThat(manager.refresh(false)).extracting(Relayer::address)
        .containsExactlyInAnyOrder(fast.address(), cheap.address(), retired.address());
  }

  @Test
  void getActiveRelayers_excludesInactive() {
    assertThat(manager.getActiveRelayers()).extracting(Relayer::address)
        .containsExactlyInAnyOrder(fast.address(), cheap.address());
  }

  @Test
  void refresh_withinTtl_doesNotSeeNewRelayers() {
    manager.refresh(false);
    ledger.putRelayer(new Relayer(randomAddress(), 0.5, true, 0, 0, null, null));

    assertThat(manager.refresh(false)).hasSize(3);
    assertThat(manager.refresh(true)).hasSize(4);
  }

  @Test
  void refresh_ledgerDown_servesLastGoodList() {
    manager.refresh(false);
    ledger.failNext(InMemoryLedgerAccessor.Call.PROGRAM_ACCOUNTS, 3);

    assertThat(manager.refresh(true)).hasSize(3);
  }

  @Test
  void getBestRelayer_highestScoreWins() {
    // fast: 100 - 10 + 95 - 2 + 3 = 186; cheap: 100 - 2.5 + 90 - 25 + 0 = 162.5
    Relayer best = manager.getBestRelayer(RelayerFilter.NONE);

    assertThat(best.address()).isEqualTo(fast.address());
    assertThat(manager.score(best)).isEqualTo(186.0);
  }

  @Test
  void getBestRelayer_filterExcludesEveryone_throwsRelayerUnavailable() {
    assertThatThrownBy(() -> manager.getBestRelayer(new RelayerFilter(0.1, null, null)))
        .isInstanceOf(RelayerUnavailableException.class);
  }

  @Test
  void getLowestFeeRelayers_sortsActiveSetByFee() {
    assertThat(manager.getLowestFeeRelayers(RelayerFilter.NONE, 10)).extracting(Relayer::address)
        .containsExactly(cheap.address(), fast.address());
    assertThat(manager.getFastestRelayers(RelayerFilter.NONE, 1)).extracting(Relayer::address)
        .containsExactly(fast.address());
  }

  @Test
  void getRelayer_nonRelayerAccount_empty() {
    assertThat(manager.getRelayer(harness.pool().poolId(), false)).isEmpty();
    assertThat(manager.getRelayer(randomAddress(), false)).isEmpty();
    assertThat(manager.getRelayer(cheap.address(), false)).map(Relayer::feePercent).contains(0.25);
  }

  @Test
  void pingRelayer_activeRelayer_reportsElapsedTime() {
    assertThat(manager.pingRelayer(fast.address())).isPresent();
  }

  @Test
  void pingRelayer_inactiveOrUnknown_empty() {
    assertThat(manager.pingRelayer(retired.address())).isEmpty();
    assertThat(manager.pingRelayer(randomAddress())).isEmpty();
  }

  @Test
  void pingRelayer_slowLedger_timesOut() {
    LedgerAccessor slow = mock(LedgerAccessor.class);
    when(slow.getAccount(any())).thenAnswer(invocation -> {
      Thread.sleep(5_000);
      return Optional.of(RelayerAccountLayout.encode(fast));
    });
    ExecutorService pings = Executors.newCachedThreadPool();
    try {
      RelayerManager slowManager = new RelayerManager(slow, VeilClientConfig.forTesting(), pings, Clock.systemUTC());

      assertThat(slowManager.pingRelayer(fast.address())).isEmpty();
    } finally {
      pings.shutdownNow();
    }
  }

  @Test
  void pingRelayer_afterClose_empty() {
    Address address = fast.address();
    harness.client().close();

    assertThat(manager.pingRelayer(address)).isEmpty();
  }
}
