package exm.yang.frontend.tree;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class InstanceIdentifierTypeStmt extends TypeStmt {

  /** null if not given, which means true */
  private final Boolean requireInstance;

  public InstanceIdentifierTypeStmt(Boolean requireInstance) {
    this.requireInstance = requireInstance;
  }

  public Boolean getRequireInstance() {
    return requireInstance;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.INSTANCE_IDENTIFIER.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.INSTANCE_IDENTIFIER;
  }

  public static InstanceIdentifierTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.INSTANCE_IDENTIFIER);
    InstanceIdentifierTypeStmt result = new InstanceIdentifierTypeStmt(
        stmt.takeOptional("require-instance", Conversions.BOOLEAN));
    stmt.ensureEmpty();
    return result;
  }
}
