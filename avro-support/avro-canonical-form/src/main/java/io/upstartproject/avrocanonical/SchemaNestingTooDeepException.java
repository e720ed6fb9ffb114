package io.upstartproject.avrocanonical;

public class SchemaNestingTooDeepException extends InvalidSchemaException {
  private final int maxNestingDepth;

  public SchemaNestingTooDeepException(int maxNestingDepth) {
    super(String.format("Schema is nested more than %d levels deep", maxNestingDepth));
    this.maxNestingDepth = maxNestingDepth;
  }

  public int getMaxNestingDepth() {
    return maxNestingDepth;
  }
}
