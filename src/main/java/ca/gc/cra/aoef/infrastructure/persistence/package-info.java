/**
 * File-system persistence for AOEF documents.
 *
 * <p>{@link ca.gc.cra.aoef.infrastructure.persistence.AoefFileStore} is the only component that touches the
 * disk. It reads or writes one whole file per call and delegates everything else to the converter and codec.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.infrastructure.persistence;
