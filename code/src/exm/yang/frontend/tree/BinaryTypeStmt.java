package exm.yang.frontend.tree;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class BinaryTypeStmt extends TypeStmt {

  /** null if unrestricted */
  private final LengthStmt length;

  public BinaryTypeStmt(LengthStmt length) {
    this.length = length;
  }

  public LengthStmt getLength() {
    return length;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.BINARY.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.BINARY;
  }

  public static BinaryTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.BINARY);
    BinaryTypeStmt result = new BinaryTypeStmt(
        stmt.takeOptional("length", LengthStmt.PARSER));
    stmt.ensureEmpty();
    return result;
  }
}
