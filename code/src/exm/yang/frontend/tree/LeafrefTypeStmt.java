package exm.yang.frontend.tree;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class LeafrefTypeStmt extends TypeStmt {

  /** Path expression, not resolved */
  private final String path;
  /** null if not given */
  private final Boolean requireInstance;

  public LeafrefTypeStmt(String path, Boolean requireInstance) {
    this.path = path;
    this.requireInstance = requireInstance;
  }

  public String getPath() {
    return path;
  }

  public Boolean getRequireInstance() {
    return requireInstance;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.LEAFREF.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.LEAFREF;
  }

  public static LeafrefTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.LEAFREF);
    LeafrefTypeStmt result = new LeafrefTypeStmt(
        stmt.takeOne("path", Conversions.ARGUMENT),
        stmt.takeOptional("require-instance", Conversions.BOOLEAN));
    stmt.ensureEmpty();
    return result;
  }
}
