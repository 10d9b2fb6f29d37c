package exm.yang.frontend.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class UnionTypeStmt extends TypeStmt {

  /** Member types in order of preference */
  private final ImmutableList<TypeStmt> types;

  public UnionTypeStmt(List<TypeStmt> types) {
    this.types = ImmutableList.copyOf(types);
  }

  public List<TypeStmt> getTypes() {
    return types;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.UNION.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.UNION;
  }

  public static UnionTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.UNION);
    UnionTypeStmt result = new UnionTypeStmt(
        stmt.takeOneOrMore("type", TypeStmt.PARSER));
    stmt.ensureEmpty();
    return result;
  }
}
