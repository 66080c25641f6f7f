package com.codeheadsystems.veil.exceptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for all protocol failures. Carries an {@link ErrorKind} and a small map of
 * structured context (note id, nullifier hash, tree id, attempt number) so callers can decide on
 * a retry without parsing messages.
 * <p>
 * Context values must never contain secret note material.
 */
public class VeilException extends RuntimeException {

  /** Context key for the nullifier hash (hex). */
  public static final String NULLIFIER_HASH = "nullifierHash";
  /** Context key for the commitment (hex). */
  public static final String COMMITMENT = "commitment";
  /** Context key for a tree id (hex). */
  public static final String TREE_ID = "treeId";
  /** Context key for a pool id (hex). */
  public static final String POOL_ID = "poolId";
  /** Context key for a retry attempt number. */
  public static final String ATTEMPT = "attempt";

  private final ErrorKind kind;
  private final Map<String, String> context;

  /**
   * Instantiates a new Veil exception.
   *
   * @param kind    the kind
   * @param message the message
   * @param context the context
   * @param cause   the cause
   */
  public VeilException(final ErrorKind kind,
                       final String message,
                       final Map<String, String> context,
                       final Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  /**
   * Instantiates a new Veil exception without context.
   *
   * @param kind    the kind
   * @param message the message
   */
  public VeilException(final ErrorKind kind, final String message) {
    this(kind, message, Map.of(), null);
  }

  /**
   * The kind.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Structured context for this failure.
   *
   * @return an unmodifiable map
   */
  public Map<String, String> context() {
    return context;
  }

  /**
   * Shorthand for {@code kind().retryable()}.
   *
   * @return the boolean
   */
  public boolean isRetryable() {
    return kind.retryable();
  }
}
