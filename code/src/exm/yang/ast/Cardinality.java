package exm.yang.ast;

import exm.yang.common.exceptions.YangRuntimeError;

/**
 * How many times a substatement may appear in its parent
 */
public enum Cardinality {
  ONE("exactly one"),
  ZERO_OR_ONE("at most one"),
  ZERO_OR_MORE("any number of"),
  ONE_OR_MORE("at least one");

  private final String description;

  private Cardinality(String description) {
    this.description = description;
  }

  public boolean allows(int count) {
    switch (this) {
      case ONE:
        return count == 1;
      case ZERO_OR_ONE:
        return count <= 1;
      case ZERO_OR_MORE:
        return true;
      case ONE_OR_MORE:
        return count >= 1;
      default:
        throw new YangRuntimeError("Unknown cardinality " + this);
    }
  }

  public String description() {
    return description;
  }
}
