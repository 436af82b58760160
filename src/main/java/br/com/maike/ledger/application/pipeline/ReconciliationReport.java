package br.com.maike.ledger.application.pipeline;

import java.util.List;

/**
 * Totals of a process reconciliation run.
 *
 * @param processes processes examined
 * @param discovered document numbers discovered
 * @param documentsWritten snapshots created or updated
 * @param unchanged documents whose snapshot needed no write
 * @param valuesWritten merchandise value rows written or refreshed
 * @param taxesWritten tax payment rows written or refreshed
 * @param skipped discovered documents without authoritative data
 * @param errors failures
 * @param dryRun whether only discovery ran
 * @param unavailable whether the run stopped because a store could not be reached
 * @since 0.1.0
 */
public record ReconciliationReport(
    int processes,
    int discovered,
    int documentsWritten,
    int unchanged,
    int valuesWritten,
    int taxesWritten,
    int skipped,
    int errors,
    boolean dryRun,
    boolean unavailable) {

  /**
   * Returns the explicit report of a run that could not reach its stores.
   *
   * @param dryRun whether the run was a dry run
   * @return report flagged unavailable
   */
  public static ReconciliationReport unavailable(boolean dryRun) {
    return new ReconciliationReport(0, 0, 0, 0, 0, 0, 0, 0, dryRun, true);
  }

  /**
   * Indicates whether the run finished without failures.
   *
   * @return {@code true} when no errors were counted and the stores were reachable
   */
  public boolean success() {
    return errors == 0 && !unavailable;
  }

  /**
   * Renders the operator summary.
   *
   * @return summary lines
   */
  public List<String> summaryLines() {
    String prefix = dryRun ? "[DRY-RUN] " : "";
    return List.of(
        prefix + "Reconciliation summary" + (unavailable ? " (store unavailable)" : ""),
        "  processes:         " + processes,
        "  discovered:        " + discovered,
        "  documents written: " + documentsWritten,
        "  unchanged:         " + unchanged,
        "  values written:    " + valuesWritten,
        "  taxes written:     " + taxesWritten,
        "  skipped:           " + skipped,
        "  errors:            " + errors);
  }
}
