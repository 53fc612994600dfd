/**
 * Flat exchange records: the reference-by-id shape of each domain entity inside an AOEF document.
 *
 * <p>Tags and users are referenced by small integer ids; every other entity by its uuid. Optional
 * fields are {@code null} and optional lists are empty when absent.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.application.exchange.record;
