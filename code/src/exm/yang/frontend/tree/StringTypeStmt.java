package exm.yang.frontend.tree;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class StringTypeStmt extends TypeStmt {

  /** null if unrestricted */
  private final LengthStmt length;
  private final ImmutableList<PatternStmt> patterns;

  public StringTypeStmt(LengthStmt length, List<PatternStmt> patterns) {
    this.length = length;
    this.patterns = ImmutableList.copyOf(patterns);
  }

  public LengthStmt getLength() {
    return length;
  }

  public List<PatternStmt> getPatterns() {
    return patterns;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.STRING.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.STRING;
  }

  public static StringTypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.STRING);
    StringTypeStmt result = new StringTypeStmt(
        stmt.takeOptional("length", LengthStmt.PARSER),
        stmt.takeZeroOrMore("pattern", PatternStmt.PARSER));
    stmt.ensureEmpty();
    return result;
  }
}
