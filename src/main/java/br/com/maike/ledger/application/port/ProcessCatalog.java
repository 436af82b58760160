package br.com.maike.ledger.application.port;

import br.com.maike.ledger.domain.process.ProcessRecord;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the locally cached shipment list.
 *
 * @since 0.1.0
 */
public interface ProcessCatalog {

  /**
   * Lists the most recently updated processes.
   *
   * @param limit maximum number of processes
   * @return processes, newest first; rows without a reference are skipped
   * @throws StoreException when the cache cannot be read
   */
  List<ProcessRecord> recent(int limit) throws StoreException;

  /**
   * Finds one process by reference.
   *
   * @param reference shipment reference, case-insensitive
   * @return process or empty
   * @throws StoreException when the cache cannot be read
   */
  Optional<ProcessRecord> find(String reference) throws StoreException;
}
