package com.codeheadsystems.veil.merkle;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.veil.model.Address;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class MerkleProofTest {

  @Test
  void pathBits_index5Depth4_isLsbFirst() {
    assertThat(MerkleProof.pathBits(5, 4)).containsExactly(1, 0, 1, 0);
  }

  @Test
  void pathBits_fromProof_matchesSiblingCount() {
    MerkleProof proof = new MerkleProof(Address.ZERO, new byte[32], Collections.nCopies(4, new byte[32]), 5);
    assertThat(proof.depth()).isEqualTo(4);
    assertThat(proof.pathBits()).containsExactly(1, 0, 1, 0);
  }

  @Test
  void pathBits_index0_isAllZero() {
    assertThat(MerkleProof.pathBits(0, 3)).containsExactly(0, 0, 0);
  }
}
