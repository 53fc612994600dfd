/**
 * Clock adapters.
 */
package ca.gc.cra.aoef.infrastructure.time;
