package br.com.maike.ledger.api;

/**
 * <strong>What:</strong> Exit codes shared by the ledger commands.
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Separate item-level failures reported by a completed run from failures that stopped the command.</li>
 *   <li>Expose the numeric value consumed by schedulers and scripts.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** The run completed but reported errors for some documents, or the store was unavailable. */
  ITEM_FAILURES(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while running the CLI. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
