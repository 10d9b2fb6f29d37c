package exm.yang.frontend.tree;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class EmptyTypeStmt extends TypeStmt {

  @Override
  public String typeName() {
    return TypeIdentifier.EMPTY.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.EMPTY;
  }

  public static EmptyTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.EMPTY);
    stmt.ensureEmpty();
    return new EmptyTypeStmt();
  }
}
