package exm.yang.frontend.tree;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

public class LengthStmt {

  private final LengthRestriction restriction;
  private final String errorMessage;
  private final String errorAppTag;
  private final String description;
  private final String reference;

  public LengthStmt(LengthRestriction restriction, String errorMessage,
      String errorAppTag, String description, String reference) {
    super();
    this.restriction = restriction;
    this.errorMessage = errorMessage;
    this.errorAppTag = errorAppTag;
    this.description = description;
    this.reference = reference;
  }

  public LengthRestriction getRestriction() {
    return restriction;
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

  public static LengthStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    LengthRestriction restriction = LengthRestriction.parse(
        stmt.getPosition(), stmt.takeArgumentOrError());
    LengthStmt result = new LengthStmt(restriction,
        stmt.takeOptional("error-message", Conversions.TEXT),
        stmt.takeOptional("error-app-tag", Conversions.TEXT),
        stmt.takeOptional("description", Conversions.TEXT),
        stmt.takeOptional("reference", Conversions.TEXT));
    stmt.ensureEmpty();
    return result;
  }

  public static final StatementParser<LengthStmt> PARSER =
      new StatementParser<LengthStmt>() {
    @Override
    public LengthStmt parse(UnprocessedStatement stmt) throws ParserException {
      return LengthStmt.parse(stmt);
    }
  };
}
