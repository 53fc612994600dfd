/**
 * Public entry points: the {@link ca.gc.cra.aoef.api.Aoef} library facade and the {@code aoef} command line.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.api;
