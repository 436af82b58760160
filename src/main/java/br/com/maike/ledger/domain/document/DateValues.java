package br.com.maike.ledger.domain.document;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Parses the date shapes delivered by the live API, the replicated tables and the legacy cache.
 *
 * <p>All values are truncated to whole seconds so that sources with different fractional precision compare
 * equal.</p>
 *
 * @since 0.1.0
 */
public final class DateValues {
  private static final DateTimeFormatter RENDER = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
  private static final List<DateTimeFormatter> LOCAL_PATTERNS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      new DateTimeFormatterBuilder()
          .appendPattern("uuuu-MM-dd HH:mm:ss")
          .optionalStart()
          .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
          .optionalEnd()
          .toFormatter(),
      DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm"),
      DateTimeFormatter.ofPattern("dd/MM/uuuu HH:mm:ss"),
      DateTimeFormatter.ofPattern("dd/MM/uuuu HH:mm"));
  private static final List<DateTimeFormatter> DATE_PATTERNS = List.of(
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("dd/MM/uuuu"));

  private DateValues() {
    // Utility
  }

  /**
   * Converts a raw payload or column value into a local date-time.
   *
   * @param raw string, {@link LocalDateTime}, {@link LocalDate}, {@link OffsetDateTime}, {@link java.util.Date}
   *     or {@code null}
   * @return parsed value truncated to seconds; empty when absent or unparseable
   */
  public static Optional<LocalDateTime> parse(Object raw) {
    if (raw == null) {
      return Optional.empty();
    }
    if (raw instanceof LocalDateTime value) {
      return Optional.of(value.truncatedTo(ChronoUnit.SECONDS));
    }
    if (raw instanceof java.sql.Timestamp value) {
      return Optional.of(value.toLocalDateTime().truncatedTo(ChronoUnit.SECONDS));
    }
    if (raw instanceof java.sql.Date value) {
      return Optional.of(value.toLocalDate().atStartOfDay());
    }
    if (raw instanceof java.util.Date value) {
      return Optional.of(LocalDateTime.ofInstant(value.toInstant(), ZoneId.systemDefault())
          .truncatedTo(ChronoUnit.SECONDS));
    }
    if (raw instanceof LocalDate value) {
      return Optional.of(value.atStartOfDay());
    }
    if (raw instanceof OffsetDateTime value) {
      return Optional.of(value.toLocalDateTime().truncatedTo(ChronoUnit.SECONDS));
    }
    if (raw instanceof ZonedDateTime value) {
      return Optional.of(value.toLocalDateTime().truncatedTo(ChronoUnit.SECONDS));
    }
    if (raw instanceof Instant value) {
      return Optional.of(LocalDateTime.ofInstant(value, ZoneId.systemDefault())
          .truncatedTo(ChronoUnit.SECONDS));
    }
    return parseText(raw.toString());
  }

  /**
   * Indicates whether a raw value is present but cannot be read as a date.
   *
   * @param raw raw value
   * @return {@code true} when the value is non-blank and {@link #parse(Object)} yields nothing
   */
  public static boolean isUnparseable(Object raw) {
    if (raw == null || raw.toString().isBlank()) {
      return false;
    }
    return parse(raw).isEmpty();
  }

  /**
   * Renders a date-time in the canonical form used for change comparison and history values.
   *
   * @param value value to render, possibly {@code null}
   * @return {@code uuuu-MM-dd'T'HH:mm:ss} text or {@code null}
   */
  public static String render(LocalDateTime value) {
    return value == null ? null : RENDER.format(value);
  }

  private static Optional<LocalDateTime> parseText(String text) {
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(trimmed).toLocalDateTime().truncatedTo(ChronoUnit.SECONDS));
    } catch (DateTimeParseException ignored) {
      // not an offset timestamp; fall through to local patterns
    }
    for (DateTimeFormatter pattern : LOCAL_PATTERNS) {
      try {
        return Optional.of(LocalDateTime.parse(trimmed, pattern).truncatedTo(ChronoUnit.SECONDS));
      } catch (DateTimeParseException ignored) {
        // try next pattern
      }
    }
    for (DateTimeFormatter pattern : DATE_PATTERNS) {
      try {
        return Optional.of(LocalDate.parse(trimmed, pattern).atStartOfDay());
      } catch (DateTimeParseException ignored) {
        // try next pattern
      }
    }
    return Optional.empty();
  }
}
