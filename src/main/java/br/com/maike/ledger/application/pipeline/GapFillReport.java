package br.com.maike.ledger.application.pipeline;

import java.util.List;

/**
 * Totals of a gap-fill run.
 *
 * @param examined incomplete rows examined
 * @param updated rows updated, or that would be updated in a dry run
 * @param skipped rows with nothing to fill
 * @param malformed rows whose best payload was not a JSON object
 * @param errors rows that failed
 * @param dryRun whether writes were suppressed
 * @param unavailable whether the run stopped because the store could not be reached
 * @since 0.1.0
 */
public record GapFillReport(
    int examined, int updated, int skipped, int malformed, int errors, boolean dryRun, boolean unavailable) {

  /**
   * Indicates whether the run finished without failures.
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
    return List.of(
        prefix + "Gap-fill summary" + (unavailable ? " (store unavailable)" : ""),
        "  examined:  " + examined,
        "  " + (dryRun ? "would update" : "updated") + ": " + updated,
        "  skipped:   " + skipped,
        "  malformed: " + malformed,
        "  errors:    " + errors);
  }
}
