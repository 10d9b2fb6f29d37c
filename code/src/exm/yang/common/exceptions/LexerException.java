package exm.yang.common.exceptions;

import exm.yang.lexer.SourcePosition;

/**
 * Malformed token-level input: unterminated quotes or comments, bad
 * escapes, misplaced + symbols.
 */
public class LexerException extends UserException {

  private static final long serialVersionUID = 4120582377650981133L;

  public LexerException(SourcePosition position, String message) {
    super(position, message);
  }

}
