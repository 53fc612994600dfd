/**
 * <strong>What:</strong> Immutable bioacoustic domain model exchanged through AOEF documents.
 * <p><strong>Why:</strong> Gives the exchange engine a typed, already-validated object graph to flatten and rebuild.</p>
 * <p><strong>Role:</strong> Domain layer; no dependency on JSON, files, or adapters.</p>
 * <p><strong>Thread-safety:</strong> All types are immutable and safe to share across threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.domain;
