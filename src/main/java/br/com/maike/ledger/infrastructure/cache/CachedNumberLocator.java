package br.com.maike.ledger.infrastructure.cache;

import br.com.maike.ledger.application.port.DocumentNumberLocator;
import br.com.maike.ledger.domain.document.DocumentKind;
import br.com.maike.ledger.domain.process.ProcessRecord;
import java.util.Objects;
import java.util.Optional;

/**
 * Fast-path locator answering from the document numbers cached on the process row itself.
 *
 * @since 0.1.0
 */
public final class CachedNumberLocator implements DocumentNumberLocator {

  @Override
  public String name() {
    return "kanban-cache";
  }

  @Override
  public boolean supports(DocumentKind kind) {
    return kind != DocumentKind.TERMINAL_CONTROL;
  }

  @Override
  public Optional<String> locate(ProcessRecord process, DocumentKind kind) {
    Objects.requireNonNull(process, "process");
    Objects.requireNonNull(kind, "kind");
    return process.cachedNumber(kind);
  }
}
