/**
 * OpenTelemetry-backed implementation of the metrics port.
 * <p><strong>Role:</strong> Adapter layer; wired by the composition root.</p>
 * <p><strong>Configuration:</strong> {@code metricsExporter=otlp|none}, {@code otelEndpoint} and
 * {@code otelResourceAttributes}.</p>
 */
package br.com.maike.ledger.infrastructure.metrics;
