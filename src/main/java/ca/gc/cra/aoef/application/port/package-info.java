/**
 * Ports consumed by the AOEF application layer: document codec, collection store, metrics, and clock.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.application.port;
