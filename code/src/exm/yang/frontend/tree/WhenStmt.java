package exm.yang.frontend.tree;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class WhenStmt {

  /** XPath expression, not parsed */
  private final String condition;
  private final String description;
  private final String reference;

  public WhenStmt(String condition, String description, String reference) {
    super();
    this.condition = condition;
    this.description = description;
    this.reference = reference;
  }

  public String getCondition() {
    return condition;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public static WhenStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    String condition = stmt.takeArgumentOrError();
    WhenStmt result = new WhenStmt(condition,
        stmt.takeOptional("description", Conversions.TEXT),
        stmt.takeOptional("reference", Conversions.TEXT));
    stmt.ensureEmpty();
    return result;
  }

  public static final StatementParser<WhenStmt> PARSER =
      new StatementParser<WhenStmt>() {
    @Override
    public WhenStmt parse(UnprocessedStatement stmt) throws ParserException {
      return WhenStmt.parse(stmt);
    }
  };
}
