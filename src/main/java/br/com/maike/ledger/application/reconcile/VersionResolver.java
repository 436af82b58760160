package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.domain.document.DocumentKind;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the optional revision key that separates re-certified documents.
 *
 * <p>Import declarations read their retification number from several spellings; every other kind only
 * carries an explicit version field when the payload holds one verbatim. Blank values resolve to empty.</p>
 *
 * @since 0.1.0
 */
public final class VersionResolver {
  private static final Logger log = LoggerFactory.getLogger(VersionResolver.class);

  static final List<String> DECLARATION_KEYS = List.of(
      "numeroRetificacao",
      "numero_retificacao",
      "retificacao",
      "sequencialRetificacao",
      "versaoDocumento",
      "versao_documento");
  static final List<String> EXPLICIT_KEYS = List.of("versaoDocumento", "versao_documento");

  private final MetricsPort metrics;

  /**
   * Creates a resolver that does not emit metrics.
   */
  public VersionResolver() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a resolver.
   *
   * @param metrics metrics sink for {@code extract.version.unparseable}; must not be {@code null}
   */
  public VersionResolver(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Resolves the version of a payload.
   *
   * @param kind document kind; must not be {@code null}
   * @param payload raw payload, may be {@code null}
   * @return trimmed version, or empty when absent, blank or not a scalar
   */
  public Optional<String> resolve(DocumentKind kind, Map<String, ?> payload) {
    Objects.requireNonNull(kind, "kind");
    List<String> keys = kind.supportsRevisions() ? DECLARATION_KEYS : EXPLICIT_KEYS;
    PayloadValues.Hit hit = PayloadValues.first(payload, keys);
    if (!hit.found()) {
      return Optional.empty();
    }
    if (!PayloadValues.isScalar(hit.value())) {
      log.warn("{} payload carries a non-scalar version under '{}'; treating as absent", kind.code(), hit.key());
      metrics.increment("extract.version.unparseable");
      return Optional.empty();
    }
    return Optional.ofNullable(PayloadValues.text(hit.value()));
  }
}
