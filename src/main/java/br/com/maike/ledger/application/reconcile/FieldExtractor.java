package br.com.maike.ledger.application.reconcile;

import br.com.maike.ledger.application.port.MetricsPort;
import br.com.maike.ledger.domain.document.CargoManifestPayload;
import br.com.maike.ledger.domain.document.DateValues;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.document.DocumentPayload;
import br.com.maike.ledger.domain.document.ImportDeclarationPayload;
import br.com.maike.ledger.domain.document.TerminalControlPayload;
import br.com.maike.ledger.domain.document.UnifiedDeclarationPayload;
import br.com.maike.ledger.logging.Logs;
import br.com.maike.ledger.validation.Strings;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps live-API and legacy-cache key/value payloads onto the typed payload of each
 * document kind.
 * <p><strong>Why:</strong> Upstream origins spell the same field differently; the alias lists below are the
 * upstream contract, and the first non-empty candidate wins.</p>
 * <p><strong>Role:</strong> Leaf of the reconciliation pipeline, invoked by {@link DocumentReconciler}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; safe to share.</p>
 * <p><strong>Observability:</strong> Logs a warning and increments {@code extract.date.unparseable} for dates
 * that are present but cannot be parsed.</p>
 *
 * @since 0.1.0
 */
public final class FieldExtractor {
  private static final Logger log = LoggerFactory.getLogger(FieldExtractor.class);

  private static final List<String> CODE_FALLBACK = List.of("statusDocumentoCodigo", "codigoSituacao");

  private static final List<String> CE_NUMBER = List.of("numero", "numeroCE", "numeroCe", "numero_ce");
  private static final List<String> CE_STATUS = List.of("situacaoCarga", "situacao_carga");
  private static final List<String> CE_CODE = withFallback("situacaoCargaCodigo");
  private static final List<String> CE_SITUATION_DATE = List.of("dataSituacaoCarga", "data_situacao_carga");
  private static final List<String> CE_CLEARANCE = List.of("dataDesembaraco", "data_desembaraco");
  private static final List<String> CE_REGISTRATION =
      List.of("dataRegistro", "data_registro", "dataEmissao", "data_emissao");

  private static final List<String> CCT_NUMBER = List.of("numero", "numeroCct", "numero_cct", "ruc");
  private static final List<String> CCT_STATUS = List.of("situacaoAtual", "situacao_atual");
  private static final List<String> CCT_CODE = withFallback("situacaoAtualCodigo");
  private static final List<String> CCT_SITUATION_DATE =
      List.of("dataHoraSituacaoAtual", "data_hora_situacao_atual");
  private static final List<String> CCT_ARRIVAL = List.of("dataChegadaEfetiva", "data_chegada_efetiva");

  private static final List<String> DI_NUMBER = List.of("numeroDi", "numero_di", "numero");
  private static final List<String> DI_STATUS = List.of("situacaoDi", "situacao_di");
  private static final List<String> DI_CODE = withFallback("situacaoDiCodigo");
  private static final List<String> DI_CHANNEL = List.of(
      "canal", "canalDi", "canal_di", "canalSelecaoParametrizada", "canal_selecao_parametrizada");
  private static final List<String> DI_REGISTRATION = List.of("dataHoraRegistro", "data_hora_registro");
  private static final List<String> DI_SITUATION_DATE =
      List.of("dataHoraSituacao", "data_hora_situacao", "dataHoraSituacaoDi");
  private static final List<String> DI_CLEARANCE = List.of("dataHoraDesembaraco", "data_hora_desembaraco");

  private static final List<String> DUIMP_NUMBER =
      List.of("numero", "numeroDuimp", "numero_duimp", "identificacao.numero");
  private static final List<String> DUIMP_STATUS = List.of("situacao", "ultimaSituacao");
  private static final List<String> DUIMP_CODE = withFallback("situacaoCodigo");
  private static final List<String> DUIMP_CHANNEL =
      List.of("canal", "canalDuimp", "canal_duimp", "canalConsolidado", "canal_consolidado");
  private static final List<String> DUIMP_REGISTRATION = List.of("dataRegistro", "identificacao.dataRegistro");
  private static final List<String> DUIMP_SITUATION_DATE = List.of("dataSituacao", "ultimaSituacaoData");

  private final VersionResolver versions;
  private final MetricsPort metrics;

  /**
   * Creates an extractor without metrics.
   */
  public FieldExtractor() {
    this(new VersionResolver(), MetricsPort.NO_OP);
  }

  /**
   * Creates an extractor.
   *
   * @param versions resolver for the revision key; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public FieldExtractor(VersionResolver versions, MetricsPort metrics) {
    this.versions = Objects.requireNonNull(versions, "versions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the typed payload for a kind.
   *
   * @param kind document kind; must not be {@code null}
   * @param number known document number, or {@code null} to read it from the payload
   * @param payload raw payload, may be {@code null} or empty
   * @return typed payload with every unmatched field absent
   */
  public DocumentPayload extract(DocumentKind kind, String number, Map<String, ?> payload) {
    Objects.requireNonNull(kind, "kind");
    Map<String, ?> raw = payload == null ? Map.of() : payload;
    String version = versions.resolve(kind, raw).orElse(null);
    return switch (kind) {
      case CARGO_MANIFEST -> new CargoManifestPayload(
          number(number, raw, CE_NUMBER),
          version,
          text(raw, CE_STATUS),
          text(raw, CE_CODE),
          date(kind, raw, CE_REGISTRATION),
          date(kind, raw, CE_SITUATION_DATE),
          date(kind, raw, CE_CLEARANCE));
      case IMPORT_DECLARATION -> new ImportDeclarationPayload(
          number(number, raw, DI_NUMBER),
          version,
          text(raw, DI_STATUS),
          text(raw, DI_CODE),
          text(raw, DI_CHANNEL),
          date(kind, raw, DI_REGISTRATION),
          date(kind, raw, DI_SITUATION_DATE),
          date(kind, raw, DI_CLEARANCE));
      case UNIFIED_IMPORT_DECLARATION -> new UnifiedDeclarationPayload(
          number(number, raw, DUIMP_NUMBER),
          version,
          text(raw, DUIMP_STATUS),
          text(raw, DUIMP_CODE),
          text(raw, DUIMP_CHANNEL),
          date(kind, raw, DUIMP_REGISTRATION),
          date(kind, raw, DUIMP_SITUATION_DATE));
      case TERMINAL_CONTROL -> new TerminalControlPayload(
          number(number, raw, CCT_NUMBER),
          version,
          text(raw, CCT_STATUS),
          text(raw, CCT_CODE),
          date(kind, raw, CCT_SITUATION_DATE),
          date(kind, raw, CCT_ARRIVAL));
    };
  }

  private static String number(String known, Map<String, ?> raw, List<String> aliases) {
    String trimmed = Strings.trimToNull(known);
    return trimmed != null ? trimmed : text(raw, aliases);
  }

  private static String text(Map<String, ?> raw, List<String> aliases) {
    PayloadValues.Hit hit = PayloadValues.first(raw, aliases);
    return hit.found() ? PayloadValues.text(hit.value()) : null;
  }

  private LocalDateTime date(DocumentKind kind, Map<String, ?> raw, List<String> aliases) {
    PayloadValues.Hit hit = PayloadValues.first(raw, aliases);
    if (!hit.found()) {
      return null;
    }
    if (DateValues.isUnparseable(hit.value()) || !PayloadValues.isScalar(hit.value())) {
      log.warn("{} payload field '{}' holds an unparseable date '{}'; treating as absent",
          kind.code(), hit.key(), Logs.truncate(String.valueOf(hit.value()), 64));
      metrics.increment("extract.date.unparseable");
      return null;
    }
    return DateValues.parse(hit.value()).orElse(null);
  }

  private static List<String> withFallback(String primary) {
    return List.of(primary, CODE_FALLBACK.get(0), CODE_FALLBACK.get(1));
  }
}
