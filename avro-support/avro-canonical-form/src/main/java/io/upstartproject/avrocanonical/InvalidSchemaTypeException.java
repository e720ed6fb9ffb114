package io.upstartproject.avrocanonical;

/**
 * The schema document contains a value which no schema construct accepts (a boolean, a null, or some node a JSON
 * decoder produced that has no {@link SchemaValue} counterpart).
 */
public class InvalidSchemaTypeException extends InvalidSchemaException {
  private final Object offendingValue;

  public InvalidSchemaTypeException(Object offendingValue) {
    super(String.format(
            "Cannot canonicalize schema with invalid schema type; expected object, array, string, or number; received: %s: %s",
            offendingValue.getClass().getSimpleName(),
            offendingValue
    ));
    this.offendingValue = offendingValue;
  }

  public Object getOffendingValue() {
    return offendingValue;
  }
}
