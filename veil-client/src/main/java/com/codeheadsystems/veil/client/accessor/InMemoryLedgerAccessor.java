package com.codeheadsystems.veil.client.accessor;

import com.codeheadsystems.veil.circuit.PublicSignals;
import com.codeheadsystems.veil.client.model.SubmissionReceipt;
import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.common.RandomProvider;
import com.codeheadsystems.veil.exceptions.LedgerAccessException;
import com.codeheadsystems.veil.exceptions.LedgerRejectionException;
import com.codeheadsystems.veil.exceptions.RejectionReason;
import com.codeheadsystems.veil.ledger.AccountFilter;
import com.codeheadsystems.veil.ledger.AccountRecord;
import com.codeheadsystems.veil.ledger.DepositOperation;
import com.codeheadsystems.veil.ledger.LedgerOperation;
import com.codeheadsystems.veil.ledger.PoolAccount;
import com.codeheadsystems.veil.ledger.PoolAccountLayout;
import com.codeheadsystems.veil.ledger.RelayerAccountLayout;
import com.codeheadsystems.veil.ledger.WithdrawOperation;
import com.codeheadsystems.veil.merkle.IncrementalMerkleTree;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.merkle.MerkleTreeState;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.TokenType;
import com.codeheadsystems.veil.relayer.Relayer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link LedgerAccessor} that enforces the same spend rules as the
 * on-ledger program: pool must be active, deposit amount must equal the denomination, withdraw
 * root must equal a current tree root, fee bounded by the pool maximum, nullifier recorded at
 * most once.
 * <p>
 * Submissions are serialized, so check-then-record of a nullifier is atomic. Failure injection
 * hooks let tests simulate outages and root drift. Suitable for development and integration
 * testing only.
 */
public class InMemoryLedgerAccessor implements LedgerAccessor {

  private static final Logger log = LoggerFactory.getLogger(InMemoryLedgerAccessor.class);

  /**
   * Ledger calls that can be made to fail.
   */
  public enum Call {
    PROGRAM_ACCOUNTS, ACCOUNT, TREE_IDS, TREE_STATE, MERKLE_PROOF, NULLIFIER, SUBMIT
  }

  private final CommitmentScheme scheme;
  private final RandomProvider randomProvider;
  private final BiPredicate<byte[], PublicSignals> proofCheck;
  private final Clock clock;
  private final Map<Address, PoolAccount> pools = new ConcurrentHashMap<>();
  private final Map<Address, List<Address>> poolTrees = new ConcurrentHashMap<>();
  private final Map<Address, IncrementalMerkleTree> trees = new ConcurrentHashMap<>();
  private final Map<Address, Relayer> relayers = new ConcurrentHashMap<>();
  private final Set<String> spentNullifiers = ConcurrentHashMap.newKeySet();
  private final Map<Call, AtomicInteger> pendingFailures = new EnumMap<>(Call.class);
  private final List<Consumer<LedgerOperation>> beforeSubmitHooks = new CopyOnWriteArrayList<>();
  private final AtomicLong transactionCounter = new AtomicLong();

  /**
   * Instantiates a new In memory ledger accessor.
   *
   * @param scheme     the scheme used for tree nodes
   * @param proofCheck decides whether a withdraw proof is valid for its public signals
   * @param clock      the clock
   */
  public InMemoryLedgerAccessor(final CommitmentScheme scheme,
                                final BiPredicate<byte[], PublicSignals> proofCheck,
                                final Clock clock) {
    log.info("InMemoryLedgerAccessor({})", scheme);
    this.scheme = scheme;
    this.randomProvider = new RandomProvider();
    this.proofCheck = proofCheck;
    this.clock = clock;
    for (Call call : Call.values()) {
      pendingFailures.put(call, new AtomicInteger());
    }
  }

  // ─── Provisioning ───────────────────────────────────────────────────────────

  /**
   * Creates a pool with one empty tree.
   *
   * @param tokenType    the token type
   * @param denomination the denomination
   * @param treeDepth    the tree depth
   * @return the pool account
   */
  public PoolAccount createPool(final TokenType tokenType, final long denomination, final int treeDepth) {
    final Address poolId = new Address(randomProvider.randomBytes(32));
    final Address treeId = new Address(randomProvider.randomBytes(32));
    trees.put(treeId, new IncrementalMerkleTree(treeId, treeDepth, scheme));
    poolTrees.put(poolId, new CopyOnWriteArrayList<>(List.of(treeId)));
    final PoolAccount pool = new PoolAccount(poolId, denomination, treeId, true, 0L, 0L, tokenType,
        PoolAccount.DEFAULT_MAX_FEE_BPS);
    pools.put(poolId, pool);
    log.debug("createPool(poolId={}, token={}, denomination={})", poolId, tokenType, denomination);
    return pool;
  }

  /**
   * Adds another tree to an existing pool.
   *
   * @param poolId    the pool id
   * @param treeDepth the tree depth
   * @return the tree id
   */
  public Address addTree(final Address poolId, final int treeDepth) {
    final Address treeId = new Address(randomProvider.randomBytes(32));
    trees.put(treeId, new IncrementalMerkleTree(treeId, treeDepth, scheme));
    poolTrees.get(poolId).add(treeId);
    return treeId;
  }

  /**
   * Replaces a pool's flags, for tests of inactive pools.
   *
   * @param pool the pool
   */
  public void putPool(final PoolAccount pool) {
    pools.put(pool.poolId(), pool);
  }

  /**
   * Registers or replaces a relayer account.
   *
   * @param relayer the relayer
   */
  public void putRelayer(final Relayer relayer) {
    relayers.put(relayer.address(), relayer);
  }

  /**
   * Appends a leaf outside any deposit, advancing the root.
   *
   * @param treeId the tree id
   * @param leaf   the leaf
   */
  public void appendLeaf(final Address treeId, final byte[] leaf) {
    trees.get(treeId).append(leaf);
  }

  // ─── Failure injection ──────────────────────────────────────────────────────

  /**
   * Makes the next {@code times} invocations of {@code call} throw {@link LedgerAccessException}.
   *
   * @param call  the call
   * @param times the times
   */
  public void failNext(final Call call, final int times) {
    pendingFailures.get(call).set(times);
  }

  /**
   * Runs the hook just before each submission is applied.
   *
   * @param hook the hook
   */
  public void beforeSubmit(final Consumer<LedgerOperation> hook) {
    beforeSubmitHooks.add(hook);
  }

  // ─── LedgerAccessor ─────────────────────────────────────────────────────────

  @Override
  public List<AccountRecord> getProgramAccounts(final AccountFilter filter) {
    maybeFail(Call.PROGRAM_ACCOUNTS);
    final List<AccountRecord> out = new ArrayList<>();
    pools.values().stream().map(PoolAccountLayout::encode).filter(a -> filter.matches(a.data())).forEach(out::add);
    relayers.values().stream().map(RelayerAccountLayout::encode).filter(a -> filter.matches(a.data()))
        .forEach(out::add);
    return out;
  }

  @Override
  public Optional<AccountRecord> getAccount(final Address address) {
    maybeFail(Call.ACCOUNT);
    final PoolAccount pool = pools.get(address);
    if (pool != null) {
      return Optional.of(PoolAccountLayout.encode(pool));
    }
    return Optional.ofNullable(relayers.get(address)).map(RelayerAccountLayout::encode);
  }

  @Override
  public List<Address> getTreeIds(final Address poolId) {
    maybeFail(Call.TREE_IDS);
    return List.copyOf(poolTrees.getOrDefault(poolId, List.of()));
  }

  @Override
  public MerkleTreeState getTreeState(final Address treeId) {
    maybeFail(Call.TREE_STATE);
    return requireTree(treeId).state();
  }

  @Override
  public Optional<MerkleProof> findMerkleProof(final Address treeId, final byte[] commitment) {
    maybeFail(Call.MERKLE_PROOF);
    final IncrementalMerkleTree tree = requireTree(treeId);
    synchronized (tree) {
      final OptionalLong index = tree.indexOf(commitment);
      return index.isPresent() ? Optional.of(tree.proof(index.getAsLong())) : Optional.empty();
    }
  }

  @Override
  public boolean isNullifierSpent(final byte[] nullifierHash) {
    maybeFail(Call.NULLIFIER);
    return spentNullifiers.contains(Hex.toHexString(nullifierHash));
  }

  @Override
  public synchronized SubmissionReceipt submitAndConfirm(final LedgerOperation operation) {
    maybeFail(Call.SUBMIT);
    beforeSubmitHooks.forEach(hook -> hook.accept(operation));
    if (operation instanceof DepositOperation deposit) {
      applyDeposit(deposit);
    } else if (operation instanceof WithdrawOperation withdraw) {
      applyWithdraw(withdraw);
    } else {
      throw new LedgerRejectionException(RejectionReason.OTHER, "Unknown operation: " + operation);
    }
    final SubmissionReceipt receipt =
        new SubmissionReceipt("tx-" + transactionCounter.incrementAndGet(), clock.instant());
    log.debug("submitAndConfirm(op={}) -> {}", operation.opcode(), receipt.transactionId());
    return receipt;
  }

  // ─── Helpers ────────────────────────────────────────────────────────────────

  private void applyDeposit(final DepositOperation deposit) {
    final PoolAccount pool = requireActivePool(deposit.poolId());
    if (deposit.amount() != pool.denomination()) {
      throw new LedgerRejectionException(RejectionReason.INVALID_DENOMINATION,
          "Deposit amount " + deposit.amount() + " does not match denomination " + pool.denomination());
    }
    if (!poolTrees.get(pool.poolId()).contains(deposit.treeId())) {
      throw new LedgerRejectionException(RejectionReason.OTHER, "Tree does not belong to pool");
    }
    final IncrementalMerkleTree tree = requireTree(deposit.treeId());
    if (tree.state().isFull()) {
      throw new LedgerRejectionException(RejectionReason.MERKLE_TREE_FULL, "Merkle tree is full");
    }
    tree.append(deposit.commitment());
    pools.put(pool.poolId(), pool.withCounters(pool.totalDeposits() + 1, pool.totalWithdrawals()));
  }

  private void applyWithdraw(final WithdrawOperation withdraw) {
    final PoolAccount pool = requireActivePool(withdraw.poolId());
    final String nullifierHex = Hex.toHexString(withdraw.nullifierHash());
    if (spentNullifiers.contains(nullifierHex)) {
      throw new LedgerRejectionException(RejectionReason.NULLIFIER_ALREADY_SPENT,
          "Nullifier already spent: " + nullifierHex);
    }
    final boolean currentRoot = poolTrees.get(pool.poolId()).stream()
        .map(trees::get)
        .anyMatch(tree -> tree.state().hasRoot(withdraw.root()));
    if (!currentRoot) {
      throw new LedgerRejectionException(RejectionReason.INVALID_MERKLE_ROOT, "Root is not a current tree root");
    }
    if (withdraw.fee() > pool.maxFee() || withdraw.fee() > pool.denomination()) {
      throw new LedgerRejectionException(RejectionReason.FEE_TOO_HIGH, "Fee too high: " + withdraw.fee());
    }
    if (withdraw.fee() > 0 && withdraw.relayer().equals(withdraw.recipient())) {
      throw new LedgerRejectionException(RejectionReason.FEE_TOO_HIGH, "Fee requires a relayer");
    }
    final PublicSignals signals = new PublicSignals(withdraw.root(), withdraw.nullifierHash(),
        withdraw.recipient(), withdraw.relayer(), withdraw.fee());
    if (!proofCheck.test(withdraw.proof(), signals)) {
      throw new LedgerRejectionException(RejectionReason.INVALID_PROOF, "Proof verification failed");
    }
    spentNullifiers.add(nullifierHex);
    pools.put(pool.poolId(), pool.withCounters(pool.totalDeposits(), pool.totalWithdrawals() + 1));
  }

  private PoolAccount requireActivePool(final Address poolId) {
    final PoolAccount pool = pools.get(poolId);
    if (pool == null) {
      throw new LedgerRejectionException(RejectionReason.OTHER, "Unknown pool: " + poolId);
    }
    if (!pool.active()) {
      throw new LedgerRejectionException(RejectionReason.POOL_INACTIVE, "Pool is inactive: " + poolId);
    }
    return pool;
  }

  private IncrementalMerkleTree requireTree(final Address treeId) {
    final IncrementalMerkleTree tree = trees.get(treeId);
    if (tree == null) {
      throw new IllegalArgumentException("Unknown tree: " + treeId);
    }
    return tree;
  }

  private void maybeFail(final Call call) {
    final AtomicInteger remaining = pendingFailures.get(call);
    if (remaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
      throw new LedgerAccessException("Injected failure: " + call, null);
    }
  }
}
