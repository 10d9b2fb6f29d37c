package exm.yang.frontend.tree;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;
import exm.yang.common.exceptions.YangRuntimeError;

/**
 * One of the eight built-in integer types, with an optional range
 */
public class IntegerTypeStmt extends TypeStmt {

  private final TypeIdentifier type;
  /** null if unrestricted */
  private final RangeStmt range;

  public IntegerTypeStmt(TypeIdentifier type, RangeStmt range) {
    assert(type.isInteger());
    this.type = type;
    this.range = range;
  }

  public RangeStmt getRange() {
    return range;
  }

  @Override
  public String typeName() {
    return type.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return type;
  }

  public static IntegerTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    String name = stmt.takeArgumentOrError();
    TypeIdentifier type = TypeIdentifier.fromString(name);
    if (type == null || !type.isInteger()) {
      throw new YangRuntimeError("internal: integer type statement parsed "
                                 + "with identifier " + name);
    }
    IntegerTypeStmt result = new IntegerTypeStmt(type,
        stmt.takeOptional("range", RangeStmt.parser(type)));
    stmt.ensureEmpty();
    return result;
  }
}
