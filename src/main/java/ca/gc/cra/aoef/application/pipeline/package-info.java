/**
 * Use cases behind the CLI commands.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.application.pipeline;
