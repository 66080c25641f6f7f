package com.codeheadsystems.veil.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.circuit.PublicSignals;
import com.codeheadsystems.veil.client.model.SubmissionReceipt;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.common.RandomProvider;
import com.codeheadsystems.veil.exceptions.LedgerAccessException;
import com.codeheadsystems.veil.exceptions.LedgerRejectionException;
import com.codeheadsystems.veil.exceptions.RejectionReason;
import com.codeheadsystems.veil.ledger.DepositOperation;
import com.codeheadsystems.veil.ledger.PoolAccount;
import com.codeheadsystems.veil.ledger.PoolAccountLayout;
import com.codeheadsystems.veil.ledger.RelayerAccountLayout;
import com.codeheadsystems.veil.ledger.WithdrawOperation;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.TokenType;
import com.codeheadsystems.veil.relayer.Relayer;
import java.time.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryLedgerAccessorTest {

  private static final long ONE_SOL = 1_000_000_000L;
  private static final RandomProvider RANDOM = new RandomProvider();

  private final CommitmentScheme scheme = CommitmentScheme.DEFAULT;
  private InMemoryLedgerAccessor ledger;
  private PoolAccount pool;
  private Address recipient;
  private Address relayer;

  @BeforeEach
  void setUp() {
    ledger = new InMemoryLedgerAccessor(scheme, DeterministicProverAccessor::accepts, Clock.systemUTC());
    pool = ledger.createPool(TokenType.SOL, ONE_SOL, 4);
    recipient = new Address(RANDOM.randomBytes(32));
    relayer = new Address(RANDOM.randomBytes(32));
  }

  @Test
  void getProgramAccounts_poolFilter_returnsOnlyPools() {
    ledger.putRelayer(new Relayer(relayer, 0.5, true, 0, 0, null, null));

    assertThat(ledger.getProgramAccounts(PoolAccountLayout.FILTER))
        .extracting(PoolAccountLayout::decode)
        .extracting(PoolAccount::poolId)
        .containsExactly(pool.poolId());
    assertThat(ledger.getProgramAccounts(RelayerAccountLayout.FILTER)).hasSize(1);
  }

  @Test
  void deposit_appendsLeafAndCountsIt() {
    byte[] commitment = RANDOM.randomBytes(32);

    SubmissionReceipt receipt = ledger.submitAndConfirm(deposit(ONE_SOL, commitment));

    assertThat(receipt.transactionId()).isEqualTo("tx-1");
    assertThat(ledger.findMerkleProof(pool.treeId(), commitment)).isPresent();
    assertThat(ledger.getTreeState(pool.treeId()).leafCount()).isEqualTo(1);
    assertThat(PoolAccountLayout.decode(ledger.getAccount(pool.poolId()).orElseThrow()).totalDeposits())
        .isEqualTo(1);
  }

  @Test
  void deposit_wrongAmount_rejected() {
    assertThatThrownBy(() -> ledger.submitAndConfirm(deposit(ONE_SOL / 2, RANDOM.randomBytes(32))))
        .isInstanceOf(LedgerRejectionException.class)
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.INVALID_DENOMINATION);
  }

  @Test
  void deposit_inactivePool_rejected() {
    ledger.putPool(new PoolAccount(pool.poolId(), ONE_SOL, pool.treeId(), false, 0, 0, TokenType.SOL,
        PoolAccount.DEFAULT_MAX_FEE_BPS));

    assertThatThrownBy(() -> ledger.submitAndConfirm(deposit(ONE_SOL, RANDOM.randomBytes(32))))
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.POOL_INACTIVE);
  }

  @Test
  void deposit_fullTree_rejected() {
    Address smallTree = ledger.addTree(pool.poolId(), 1);
    ledger.appendLeaf(smallTree, RANDOM.randomBytes(32));
    ledger.appendLeaf(smallTree, RANDOM.randomBytes(32));

    assertThatThrownBy(() -> ledger.submitAndConfirm(
        new DepositOperation(ONE_SOL, RANDOM.randomBytes(32), smallTree, pool.poolId())))
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.MERKLE_TREE_FULL);
  }

  @Test
  void withdraw_validProof_recordsNullifierOnce() {
    byte[] nullifierHash = RANDOM.randomBytes(32);
    WithdrawOperation withdraw = withdraw(currentRoot(), nullifierHash, relayer, 1_000_000L);

    ledger.submitAndConfirm(withdraw);

    assertThat(ledger.isNullifierSpent(nullifierHash)).isTrue();
    assertThatThrownBy(() -> ledger.submitAndConfirm(withdraw))
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.NULLIFIER_ALREADY_SPENT);
  }

  @Test
  void withdraw_rootNoLongerCurrent_rejected() {
    byte[] staleRoot = currentRoot();
    ledger.appendLeaf(pool.treeId(), RANDOM.randomBytes(32));

    assertThatThrownBy(() -> ledger.submitAndConfirm(withdraw(staleRoot, RANDOM.randomBytes(32), relayer, 0L)))
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.INVALID_MERKLE_ROOT);
  }

  @Test
  void withdraw_feeAbovePoolMaximum_rejected() {
    long fee = pool.maxFee() + 1;

    assertThatThrownBy(() -> ledger.submitAndConfirm(withdraw(currentRoot(), RANDOM.randomBytes(32), relayer, fee)))
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.FEE_TOO_HIGH);
  }

  @Test
  void withdraw_feeWithoutRelayer_rejected() {
    assertThatThrownBy(() -> ledger.submitAndConfirm(
        withdraw(currentRoot(), RANDOM.randomBytes(32), recipient, 1_000L)))
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.FEE_TOO_HIGH);
  }

  @Test
  void withdraw_badProof_rejectedWithoutRecordingNullifier() {
    byte[] nullifierHash = RANDOM.randomBytes(32);
    WithdrawOperation forged = new WithdrawOperation(pool.poolId(), currentRoot(), nullifierHash, recipient,
        relayer, 0L, 0L, new byte[]{9, 9, 9});

    assertThatThrownBy(() -> ledger.submitAndConfirm(forged))
        .extracting(e -> ((LedgerRejectionException) e).reason())
        .isEqualTo(RejectionReason.INVALID_PROOF);
    assertThat(ledger.isNullifierSpent(nullifierHash)).isFalse();
  }

  @Test
  void failNext_failsThenRecovers() {
    ledger.failNext(InMemoryLedgerAccessor.Call.TREE_STATE, 1);

    assertThatThrownBy(() -> ledger.getTreeState(pool.treeId()))
        .isInstanceOf(LedgerAccessException.class)
        .hasMessageContaining("TREE_STATE");
    assertThat(ledger.getTreeState(pool.treeId()).leafCount()).isZero();
  }

  @Test
  void beforeSubmit_runsBeforeTheOperationIsApplied() {
    byte[] commitment = RANDOM.randomBytes(32);
    ledger.beforeSubmit(op -> assertThat(ledger.findMerkleProof(pool.treeId(), commitment)).isEmpty());

    ledger.submitAndConfirm(deposit(ONE_SOL, commitment));

    MerkleProof proof = ledger.findMerkleProof(pool.treeId(), commitment).orElseThrow();
    assertThat(proof.leafIndex()).isZero();
  }

  private DepositOperation deposit(final long amount, final byte[] commitment) {
    return new DepositOperation(amount, commitment, pool.treeId(), pool.poolId());
  }

  private byte[] currentRoot() {
    return ledger.getTreeState(pool.treeId()).root();
  }

  private WithdrawOperation withdraw(final byte[] root, final byte[] nullifierHash, final Address relayerSlot,
                                     final long fee) {
    PublicSignals signals = new PublicSignals(root, nullifierHash, recipient, relayerSlot, fee);
    return new WithdrawOperation(pool.poolId(), root, nullifierHash, recipient, relayerSlot, fee, 0L,
        DeterministicProverAccessor.proofFor(signals));
  }
}
