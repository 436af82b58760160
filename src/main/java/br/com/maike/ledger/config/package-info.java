/**
 * Typed run settings, layered configuration loading and the composition root.
 * <p>Defaults come from {@link br.com.maike.ledger.config.DefaultsForMode}, are overridden by the optional YAML
 * file and finally by {@code key=value} arguments.</p>
 */
package br.com.maike.ledger.config;
