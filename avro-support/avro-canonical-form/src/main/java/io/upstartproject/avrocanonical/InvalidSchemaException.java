package io.upstartproject.avrocanonical;

/**
 * Thrown when a schema document cannot be reduced to its parsing canonical form.
 */
public abstract class InvalidSchemaException extends RuntimeException {
  protected InvalidSchemaException(String message) {
    super(message);
  }

  protected InvalidSchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
