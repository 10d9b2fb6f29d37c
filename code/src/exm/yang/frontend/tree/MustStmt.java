package exm.yang.frontend.tree;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

/**
 * A must constraint.  The XPath expression is kept as text.
 */
public class MustStmt {

  private final String condition;
  private final String errorMessage;
  private final String errorAppTag;
  private final String description;
  private final String reference;

  public MustStmt(String condition, String errorMessage, String errorAppTag,
                  String description, String reference) {
    super();
    this.condition = condition;
    this.errorMessage = errorMessage;
    this.errorAppTag = errorAppTag;
    this.description = description;
    this.reference = reference;
  }

  public String getCondition() {
    return condition;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public String getErrorAppTag() {
    return errorAppTag;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public static MustStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    String condition = stmt.takeArgumentOrError();
    MustStmt result = new MustStmt(condition,
        stmt.takeOptional("error-message", Conversions.TEXT),
        stmt.takeOptional("error-app-tag", Conversions.TEXT),
        stmt.takeOptional("description", Conversions.TEXT),
        stmt.takeOptional("reference", Conversions.TEXT));
    stmt.ensureEmpty();
    return result;
  }

  public static final StatementParser<MustStmt> PARSER =
      new StatementParser<MustStmt>() {
    @Override
    public MustStmt parse(UnprocessedStatement stmt) throws ParserException {
      return MustStmt.parse(stmt);
    }
  };
}
