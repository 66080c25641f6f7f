package com.codeheadsystems.veil.exceptions;

import java.util.Map;

/**
 * Every known Merkle tree is at capacity. Needs external provisioning.
 */
public class NoAvailableTreeException extends VeilException {

  /**
   * Instantiates a new No available tree exception.
   *
   * @param treesInspected the number of trees inspected
   */
  public NoAvailableTreeException(final int treesInspected) {
    super(ErrorKind.NO_AVAILABLE_TREE, "No available (non-full) Merkle tree among " + treesInspected,
        Map.of("treesInspected", Integer.toString(treesInspected)), null);
  }
}
