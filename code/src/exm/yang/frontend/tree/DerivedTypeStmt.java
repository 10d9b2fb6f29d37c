package exm.yang.frontend.tree;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

/**
 * Reference to a typedef, possibly in another module.  Which restrictions
 * are legal depends on the base type, so the substatements are kept
 * untyped until the typedef is resolved.
 */
public class DerivedTypeStmt extends TypeStmt {

  /** null for a typedef in the same module */
  private final String prefix;
  private final String name;
  /** Substatements of the type statement, detached from the source tree */
  private final UnprocessedStatement restrictions;

  public DerivedTypeStmt(String prefix, String name,
                         UnprocessedStatement restrictions) {
    this.prefix = prefix;
    this.name = name;
    this.restrictions = restrictions;
  }

  public String getPrefix() {
    return prefix;
  }

  public String getName() {
    return name;
  }

  public UnprocessedStatement getRestrictions() {
    return restrictions;
  }

  @Override
  public String typeName() {
    return prefix == null ? name : prefix + ":" + name;
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return null;
  }

  public static DerivedTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    String typeName = stmt.takeArgumentOrError();
    int colon = typeName.indexOf(':');
    String prefix = null;
    String name = typeName;
    if (colon >= 0) {
      prefix = typeName.substring(0, colon);
      name = typeName.substring(colon + 1);
    }
    if (name.isEmpty() || (prefix != null && prefix.isEmpty())) {
      throw new ParserException(stmt.getPosition(), "invalid type name '"
                                                    + typeName + "'");
    }
    return new DerivedTypeStmt(prefix, name, stmt.detach());
  }
}
