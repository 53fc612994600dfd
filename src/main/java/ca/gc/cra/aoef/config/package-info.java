/**
 * Configuration for the AOEF command-line tools.
 *
 * <p>Values come from three layers merged with precedence CLI over YAML over {@link
 * ca.gc.cra.aoef.config.DefaultsForMode defaults}, then bind to immutable per-command records.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoef.config;
