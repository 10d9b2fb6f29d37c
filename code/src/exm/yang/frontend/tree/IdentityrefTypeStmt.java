package exm.yang.frontend.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class IdentityrefTypeStmt extends TypeStmt {

  /** Base identity names, possibly prefixed, not resolved */
  private final ImmutableList<String> bases;

  public IdentityrefTypeStmt(List<String> bases) {
    this.bases = ImmutableList.copyOf(bases);
  }

  public List<String> getBases() {
    return bases;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.IDENTITYREF.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.IDENTITYREF;
  }

  public static IdentityrefTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.IDENTITYREF);
    IdentityrefTypeStmt result = new IdentityrefTypeStmt(
        stmt.takeOneOrMore("base", Conversions.ARGUMENT));
    stmt.ensureEmpty();
    return result;
  }
}
