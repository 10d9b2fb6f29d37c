package exm.yang.ast;

import exm.yang.common.exceptions.ParserException;

/**
 * Converts one statement node into a typed value, consuming what it
 * recognizes from the node.
 * @param <T> the typed result
 */
public interface StatementParser<T> {
  public T parse(UnprocessedStatement stmt) throws ParserException;
}
