/**
 * Buffer configuration records, YAML/properties loaders, and composition root wiring.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Identifiers are validated through {@code ca.gc.cra.eventbuffer.validation}.</p>
 */
package ca.gc.cra.eventbuffer.config;
