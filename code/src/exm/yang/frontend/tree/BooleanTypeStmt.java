package exm.yang.frontend.tree;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class BooleanTypeStmt extends TypeStmt {

  @Override
  public String typeName() {
    return TypeIdentifier.BOOLEAN.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.BOOLEAN;
  }

  public static BooleanTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.BOOLEAN);
    stmt.ensureEmpty();
    return new BooleanTypeStmt();
  }
}
