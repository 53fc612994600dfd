package ca.gc.cra.aoef.error;

/**
 * Base exception for every failure raised by the AOEF exchange engine.
 *
 * <p>Callers can catch this type to handle any fatal engine condition in one place; the engine
 * never retries and never returns a partially converted document.</p>
 *
 * @since 0.1.0
 */
public class AoefException extends RuntimeException {

  public AoefException(String message) {
    super(message);
  }

  public AoefException(String message, Throwable cause) {
    super(message, cause);
  }
}
