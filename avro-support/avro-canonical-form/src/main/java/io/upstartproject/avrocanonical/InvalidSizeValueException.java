package io.upstartproject.avrocanonical;

public class InvalidSizeValueException extends InvalidSchemaException {
  private final String sizeText;

  public InvalidSizeValueException(String sizeText) {
    super(message(sizeText));
    this.sizeText = sizeText;
  }

  public InvalidSizeValueException(String sizeText, NumberFormatException cause) {
    super(message(sizeText), cause);
    this.sizeText = sizeText;
  }

  public String getSizeText() {
    return sizeText;
  }

  private static String message(String sizeText) {
    return String.format("Fixed size ought to be a non-negative base-10 integer: \"%s\"", sizeText);
  }
}
