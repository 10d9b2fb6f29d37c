package exm.yang.lexer;

/**
 * Token types.  Only the kinds marked as semantic are ever returned from
 * {@link Lexer#next()}; the others are raw lexical units consumed inside the
 * lexer.
 */
public enum TokenKind {
  PLUS(false),
  COMMENT(false),
  WHITESPACE(false),
  QUOTED_STRING(false),
  /** { */
  BLOCK_BEGIN(true),
  /** } */
  BLOCK_END(true),
  /** Quoted or unquoted string with concatenation resolved */
  STRING(true),
  /** ; */
  STATEMENT_END(true),
  END_OF_INPUT(true);

  private final boolean semantic;

  private TokenKind(boolean semantic) {
    this.semantic = semantic;
  }

  public boolean isSemantic() {
    return semantic;
  }
}
