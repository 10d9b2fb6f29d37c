package exm.yang.frontend.tree;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

/**
 * A "|" separated list of {@link LengthRange}s in ascending order
 */
public class LengthRestriction {
  private final ImmutableList<LengthRange> ranges;

  public LengthRestriction(List<LengthRange> ranges) {
    this.ranges = ImmutableList.copyOf(ranges);
  }

  public List<LengthRange> getRanges() {
    return ranges;
  }

  public boolean allows(long length) {
    for (LengthRange range: ranges) {
      if (range.contains(length)) {
        return true;
      }
    }
    return false;
  }

  public static LengthRestriction parse(SourcePosition errPos, String text)
      throws ParserException {
    ImmutableList.Builder<LengthRange> ranges = ImmutableList.builder();
    LengthRange prev = null;
    for (String part: text.split("\\|", -1)) {
      LengthRange range = LengthRange.parse(errPos, part);
      // RFC 7950 9.4.4
      if (prev != null && range.getLowerBound() <= prev.getUpperBound()) {
        throw new ParserException(errPos, "ranges in '" + text
                              + "' must be disjoint and in ascending order");
      }
      ranges.add(range);
      prev = range;
    }
    return new LengthRestriction(ranges.build());
  }

  /**
   * Restriction statement with no substatements, e.g. range of decimal64
   */
  public static final StatementParser<LengthRestriction> CLOSED_PARSER =
      new StatementParser<LengthRestriction>() {
    @Override
    public LengthRestriction parse(UnprocessedStatement stmt)
        throws ParserException {
      return LengthRestriction.parse(stmt.getPosition(),
                                     stmt.takeArgumentOrError(true));
    }
  };

  @Override
  public String toString() {
    return StringUtils.join(ranges, " | ");
  }
}
