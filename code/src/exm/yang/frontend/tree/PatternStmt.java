package exm.yang.frontend.tree;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

/**
 * Pattern restriction of a string type.  The regular expression is kept
 * as text.
 */
public class PatternStmt {

  public static final String INVERT_MATCH = "invert-match";

  private final String pattern;
  private final boolean invertMatch;
  private final String errorMessage;
  private final String errorAppTag;
  private final String description;
  private final String reference;

  public PatternStmt(String pattern, boolean invertMatch,
      String errorMessage, String errorAppTag, String description,
      String reference) {
    super();
    this.pattern = pattern;
    this.invertMatch = invertMatch;
    this.errorMessage = errorMessage;
    this.errorAppTag = errorAppTag;
    this.description = description;
    this.reference = reference;
  }

  public String getPattern() {
    return pattern;
  }

  public boolean isInvertMatch() {
    return invertMatch;
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

  public static PatternStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    String pattern = stmt.takeArgumentOrError();

    boolean invertMatch = false;
    UnprocessedStatement modifier = stmt.takeOptional("modifier");
    if (modifier != null) {
      String text = modifier.takeArgumentOrError(true);
      if (!text.equals(INVERT_MATCH)) {
        throw new ParserException(modifier.getPosition(),
            "invalid pattern modifier '" + text + "', expected '"
            + INVERT_MATCH + "'");
      }
      invertMatch = true;
    }

    PatternStmt result = new PatternStmt(pattern, invertMatch,
        stmt.takeOptional("error-message", Conversions.TEXT),
        stmt.takeOptional("error-app-tag", Conversions.TEXT),
        stmt.takeOptional("description", Conversions.TEXT),
        stmt.takeOptional("reference", Conversions.TEXT));
    stmt.ensureEmpty();
    return result;
  }

  public static final StatementParser<PatternStmt> PARSER =
      new StatementParser<PatternStmt>() {
    @Override
    public PatternStmt parse(UnprocessedStatement stmt)
        throws ParserException {
      return PatternStmt.parse(stmt);
    }
  };

  @Override
  public String toString() {
    return "pattern " + pattern + (invertMatch ? " (inverted)" : "");
  }
}
