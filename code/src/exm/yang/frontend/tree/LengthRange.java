package exm.yang.frontend.tree;

import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

/**
 * One part of a length restriction: a single value or lower..upper,
 * both inclusive.
 */
public class LengthRange {
  private final long lowerBound;
  private final long upperBound;

  public LengthRange(long lowerBound, long upperBound) {
    super();
    this.lowerBound = lowerBound;
    this.upperBound = upperBound;
  }

  public long getLowerBound() {
    return lowerBound;
  }

  public long getUpperBound() {
    return upperBound;
  }

  public boolean contains(long value) {
    return value >= lowerBound && value <= upperBound;
  }

  /**
   * @param text "n" or "lower..upper", surrounding whitespace allowed
   */
  public static LengthRange parse(SourcePosition errPos, String text)
      throws ParserException {
    text = text.trim();
    int dots = text.indexOf("..");
    if (dots < 0) {
      long num = Conversions.convertNonNegativeInteger(errPos, text);
      return new LengthRange(num, num);
    }

    long lower = Conversions.convertNonNegativeInteger(errPos,
                                      text.substring(0, dots).trim());
    long upper = Conversions.convertNonNegativeInteger(errPos,
                                      text.substring(dots + 2).trim());
    if (lower > upper) {
      throw new ParserException(errPos, "lower bound of range '" + text
                                + "' is greater than its upper bound");
    }
    return new LengthRange(lower, upper);
  }

  @Override
  public int hashCode() {
    return (int)(lowerBound * 31 + upperBound);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof LengthRange))
      return false;
    LengthRange other = (LengthRange) obj;
    return lowerBound == other.lowerBound && upperBound == other.upperBound;
  }

  @Override
  public String toString() {
    if (lowerBound == upperBound) {
      return Long.toString(lowerBound);
    }
    return lowerBound + ".." + upperBound;
  }
}
