/**
 * Collection adapters: one per document kind, each exporting its root objects through a shared
 * {@link ca.gc.cra.aoef.application.exchange.AdapterTree} and rebuilding them after the tree hydrates.
 *
 * <p>Subclass adapters extend their base adapter and reuse its collect and hydrate steps, mirroring
 * the domain collection hierarchy.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.application.exchange.collection;
