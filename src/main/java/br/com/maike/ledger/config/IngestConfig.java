package br.com.maike.ledger.config;

import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.SourceDescriptor;
import br.com.maike.ledger.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of a single payload ingestion.
 *
 * @param kind document kind
 * @param number document number, empty to read it from the payload
 * @param payloadFile JSON payload file
 * @param processReference shipment reference, if known
 * @param source provenance recorded with the snapshot and history rows
 * @since 0.1.0
 */
public record IngestConfig(
    DocumentKind kind,
    Optional<String> number,
    Path payloadFile,
    Optional<String> processReference,
    SourceDescriptor source) {

  /** Source tag used when none is configured. */
  public static final String DEFAULT_SOURCE_TAG = "MANUAL_INGEST";

  public IngestConfig {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(payloadFile, "payloadFile");
    Objects.requireNonNull(source, "source");
    number = Objects.requireNonNullElse(number, Optional.<String>empty()).map(String::trim)
        .filter(value -> !value.isEmpty());
    processReference = Objects.requireNonNullElse(processReference, Optional.<String>empty()).map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  /**
   * Parses ingestion settings.
   *
   * @param options effective configuration with {@code kind}, {@code payload} and optional {@code number},
   *     {@code process}, {@code source}, {@code endpoint}
   * @return ingestion settings
   * @throws IllegalArgumentException when a required value is missing or invalid
   */
  public static IngestConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    DocumentKind kind = DocumentKind.fromCode(options.get("kind"));
    String payload = ConfigValues.optionalString(options, "payload")
        .orElseThrow(() -> new IllegalArgumentException("payload is required"));
    Path payloadFile;
    try {
      payloadFile = Path.of(payload);
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("payload must be a valid path (was '" + payload + "')", ex);
    }
    String tag = Strings.requirePrintableAscii(
        "source", ConfigValues.string(options, "source", DEFAULT_SOURCE_TAG), 50);
    return new IngestConfig(
        kind,
        ConfigValues.optionalString(options, "number"),
        payloadFile,
        ConfigValues.optionalString(options, "process"),
        new SourceDescriptor(tag, ConfigValues.optionalString(options, "endpoint").orElse(null)));
  }
}
