package exm.yang.ast;

import exm.yang.common.exceptions.ParserException;

/**
 * Runs a typed parser without touching the original node.
 *
 * The parser works on a deep copy.  The caller gets the typed value together
 * with what the parser left of the copy, and checks that residual with
 * {@link #ensureConsumed(UnprocessedStatement)}.
 */
public class Extraction {

  public static <T> Extracted<T> extract(UnprocessedStatement stmt,
      StatementParser<T> parser) throws ParserException {
    UnprocessedStatement residual = stmt.copy();
    T value = parser.parse(residual);
    return new Extracted<T>(value, residual);
  }

  /**
   * Closed-world check: no argument and no substatement may be left
   */
  public static void ensureConsumed(UnprocessedStatement residual)
      throws ParserException {
    residual.ensureEmpty();
  }

  /**
   * Extract and check the residual in one step
   */
  public static <T> T extractAll(UnprocessedStatement stmt,
      StatementParser<T> parser) throws ParserException {
    Extracted<T> result = extract(stmt, parser);
    ensureConsumed(result.residual());
    return result.value();
  }

  /**
   * A typed value and the node it was taken from
   */
  public static class Extracted<T> {
    private final T value;
    private final UnprocessedStatement residual;

    public Extracted(T value, UnprocessedStatement residual) {
      this.value = value;
      this.residual = residual;
    }

    public T value() {
      return value;
    }

    public UnprocessedStatement residual() {
      return residual;
    }
  }
}
