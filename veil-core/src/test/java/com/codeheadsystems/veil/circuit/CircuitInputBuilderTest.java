package com.codeheadsystems.veil.circuit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.commitment.CommitmentScheme;
import com.codeheadsystems.veil.common.RandomProvider;
import com.codeheadsystems.veil.exceptions.InvalidCircuitInputException;
import com.codeheadsystems.veil.merkle.IncrementalMerkleTree;
import com.codeheadsystems.veil.merkle.MerkleProof;
import com.codeheadsystems.veil.model.Address;
import com.codeheadsystems.veil.model.DepositNote;
import com.codeheadsystems.veil.model.TokenType;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CircuitInputBuilderTest {

  private static final int DEPTH = 4;
  private static final RandomProvider RANDOM = new RandomProvider();

  private final CommitmentScheme scheme = CommitmentScheme.DEFAULT;
  private final CircuitInputBuilder builder = new CircuitInputBuilder(scheme);
  private DepositNote note;
  private MerkleProof proof;
  private Address recipient;
  private Address relayer;

  @BeforeEach
  void setUp() {
    note = new DepositNote(new Address(RANDOM.randomBytes(32)), TokenType.SOL, 1_000_000_000L,
        RANDOM.randomBytes(32), RANDOM.randomBytes(32), 0L, null);
    IncrementalMerkleTree tree = new IncrementalMerkleTree(Address.ZERO, DEPTH, scheme);
    for (int i = 0; i < 5; i++) {
      tree.append(RANDOM.randomBytes(32));
    }
    tree.append(scheme.commitment(note));
    proof = tree.proof(5);
    recipient = new Address(RANDOM.randomBytes(32));
    relayer = new Address(RANDOM.randomBytes(32));
  }

  @Test
  void build_assemblesPositionalVector() {
    CircuitInputs inputs = builder.build(note, proof, DEPTH, recipient, relayer, 10_000_000L);

    assertThat(inputs.siblings()).hasSize(DEPTH);
    assertThat(inputs.pathBits()).containsExactly(1, 0, 1, 0);
    assertThat(inputs.root()).isEqualTo(proof.root());
    assertThat(inputs.nullifierHash()).isEqualTo(scheme.nullifierHash(note));
    assertThat(inputs.relayer()).isEqualTo(relayer);
    assertThat(inputs.expectedSignals().fee()).isEqualTo(10_000_000L);
  }

  @Test
  void build_withoutRelayer_usesRecipientInRelayerSlot() {
    CircuitInputs inputs = builder.build(note, proof, DEPTH, recipient, null, 0L);
    assertThat(inputs.relayer()).isEqualTo(recipient);
  }

  @Test
  void canonicalEncoding_differsWhenFeeDiffers() {
    CircuitInputs a = builder.build(note, proof, DEPTH, recipient, relayer, 1L);
    CircuitInputs b = builder.build(note, proof, DEPTH, recipient, relayer, 2L);
    assertThat(a.canonicalEncoding()).isNotEqualTo(b.canonicalEncoding());
    assertThat(a.canonicalEncoding()).isEqualTo(builder.build(note, proof, DEPTH, recipient, relayer, 1L)
        .canonicalEncoding());
  }

  @Test
  void build_siblingCountMismatch_throws() {
    assertThatThrownBy(() -> builder.build(note, proof, DEPTH + 1, recipient, relayer, 0L))
        .isInstanceOf(InvalidCircuitInputException.class)
        .hasMessageContaining("siblings");
  }

  @Test
  void build_leafIndexBeyondCapacity_throws() {
    MerkleProof bad = new MerkleProof(Address.ZERO, proof.root(), Collections.nCopies(2, new byte[32]), 4);
    assertThatThrownBy(() -> builder.build(note, bad, 2, recipient, relayer, 0L))
        .isInstanceOf(InvalidCircuitInputException.class)
        .hasMessageContaining("leafIndex");
  }

  @Test
  void build_feeAboveDenomination_throws() {
    assertThatThrownBy(() -> builder.build(note, proof, DEPTH, recipient, relayer, note.denomination() + 1))
        .isInstanceOf(InvalidCircuitInputException.class)
        .hasMessageContaining("fee");
  }

  @Test
  void build_feeWithoutRelayer_throws() {
    assertThatThrownBy(() -> builder.build(note, proof, DEPTH, recipient, null, 5L))
        .isInstanceOf(InvalidCircuitInputException.class)
        .hasMessageContaining("relayer");
  }

  @Test
  void build_recipientDiffersFromBoundRecipient_throws() {
    DepositNote bound = new DepositNote(note.poolId(), note.tokenType(), note.denomination(), note.secret(),
        note.nullifierPreimage(), 0L, new Address(RANDOM.randomBytes(32)));
    assertThatThrownBy(() -> builder.build(bound, proof, DEPTH, recipient, null, 0L))
        .isInstanceOf(InvalidCircuitInputException.class)
        .hasMessageContaining("recipient");
  }

  @Test
  void build_missingRecipient_throws() {
    assertThatThrownBy(() -> builder.build(note, proof, DEPTH, null, null, 0L))
        .isInstanceOf(InvalidCircuitInputException.class);
  }
}
