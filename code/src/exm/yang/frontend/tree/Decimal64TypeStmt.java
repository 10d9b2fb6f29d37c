package exm.yang.frontend.tree;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

public class Decimal64TypeStmt extends TypeStmt {

  public static final int MIN_FRACTION_DIGITS = 1;
  public static final int MAX_FRACTION_DIGITS = 18;

  private final int fractionDigits;
  /** null if unrestricted */
  private final LengthRestriction range;

  public Decimal64TypeStmt(int fractionDigits, LengthRestriction range) {
    this.fractionDigits = fractionDigits;
    this.range = range;
  }

  public int getFractionDigits() {
    return fractionDigits;
  }

  public LengthRestriction getRange() {
    return range;
  }

  @Override
  public String typeName() {
    return TypeIdentifier.DECIMAL64.keyword();
  }

  @Override
  public TypeIdentifier typeIdentifier() {
    return TypeIdentifier.DECIMAL64;
  }

  public static Decimal64TypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    takeTypeName(stmt, TypeIdentifier.DECIMAL64);
    Decimal64TypeStmt result = new Decimal64TypeStmt(
        stmt.takeOne("fraction-digits", FRACTION_DIGITS),
        stmt.takeOptional("range", LengthRestriction.CLOSED_PARSER));
    stmt.ensureEmpty();
    return result;
  }

  public static int convertFractionDigits(SourcePosition errPos, String text)
      throws ParserException {
    long num = Conversions.convertNonNegativeInteger(errPos, text);
    if (num < MIN_FRACTION_DIGITS || num > MAX_FRACTION_DIGITS) {
      throw new ParserException(errPos, "fraction-digits must be between "
          + MIN_FRACTION_DIGITS + " and " + MAX_FRACTION_DIGITS
          + " (inclusive), but found '" + text + "'");
    }
    return (int)num;
  }

  private static final StatementParser<Integer> FRACTION_DIGITS =
      new StatementParser<Integer>() {
    @Override
    public Integer parse(UnprocessedStatement stmt) throws ParserException {
      return convertFractionDigits(stmt.getPosition(),
                                   stmt.takeArgumentOrError(true));
    }
  };
}
