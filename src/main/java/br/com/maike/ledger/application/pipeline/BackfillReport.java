package br.com.maike.ledger.application.pipeline;

import java.util.List;

/**
 * Totals of a backfill run.
 *
 * @param enumerated rows returned by the bulk sources
 * @param unique distinct document numbers after deduplication
 * @param migrated documents written, or that would be written in a dry run
 * @param skipped documents already present
 * @param unknown documents left alone because their existence could not be determined
 * @param errors documents that failed
 * @param dryRun whether writes were suppressed
 * @param unavailable whether the run stopped because the store could not be reached
 * @since 0.1.0
 */
public record BackfillReport(
    int enumerated,
    int unique,
    int migrated,
    int skipped,
    int unknown,
    int errors,
    boolean dryRun,
    boolean unavailable) {

  /**
   * Indicates whether the run finished without item failures.
   *
   * @return {@code true} when no errors were counted and the store was reachable
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
    String migratedLabel = dryRun ? "would migrate" : "migrated";
    return List.of(
        prefix + "Backfill summary" + (unavailable ? " (store unavailable)" : ""),
        "  enumerated: " + enumerated,
        "  unique:     " + unique,
        "  " + migratedLabel + ": " + migrated,
        "  skipped:    " + skipped,
        "  unknown:    " + unknown,
        "  errors:     " + errors);
  }
}
