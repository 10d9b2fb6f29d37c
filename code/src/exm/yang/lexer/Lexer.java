/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.yang.lexer;

import org.apache.commons.lang3.StringUtils;

import exm.yang.common.exceptions.LexerException;
import exm.yang.common.util.StringUtil;

/**
 * Tokenizer for YANG source text (RFC 7950 section 6).
 *
 * Whitespace and comments are dropped, quoted strings are unescaped and
 * re-indented, and quoted strings joined with + are merged into a single
 * {@link TokenKind#STRING} token.  Only semantic token kinds are returned.
 *
 * A lexer instance is single-use and not thread-safe.
 */
public class Lexer {

  public static final String DEFAULT_INPUT_NAME = "<input>";
  public static final int DEFAULT_TAB_WIDTH = 8;

  private final String input;
  private final String inputName;
  private final int tabWidth;

  private int pos = 0;
  /** 1-based line of pos */
  private int line = 1;
  /** 0-based character column of pos */
  private int col = 0;
  /** Offset of the first character of the current line */
  private int lineStart = 0;

  /** Raw unit read past the end of the previous token */
  private Token saved = null;
  /** Token returned by peek() and not yet consumed */
  private Token peeked = null;

  public Lexer(String input) {
    this(input, DEFAULT_INPUT_NAME, DEFAULT_TAB_WIDTH);
  }

  public Lexer(String input, String inputName, int tabWidth) {
    assert(input != null);
    assert(tabWidth > 0);
    this.input = input;
    this.inputName = inputName;
    this.tabWidth = tabWidth;
  }

  /**
   * Look at the next token without consuming it
   */
  public Token peek() throws LexerException {
    if (peeked == null) {
      peeked = readToken();
    }
    return peeked;
  }

  /**
   * Consume the next token.  Once the input is exhausted, END_OF_INPUT is
   * returned on every call.
   */
  public Token next() throws LexerException {
    if (peeked != null) {
      Token token = peeked;
      peeked = null;
      return token;
    }
    return readToken();
  }

  public SourcePosition currentPosition() {
    return new SourcePosition(inputName, line, col + 1);
  }

  private Token readToken() throws LexerException {
    StringBuilder str = new StringBuilder();
    // Whether at least one quoted string was accumulated in str
    boolean fragment = false;
    // Whether a + was seen after the last fragment
    boolean concat = false;
    SourcePosition start = null;

    if (saved != null) {
      Token token = saved;
      saved = null;
      if (token.kind() != TokenKind.QUOTED_STRING) {
        return token;
      }
      // A pushed back quoted string starts the next string
      str.append(token.content());
      fragment = true;
      start = token.position();
    }

    while (true) {
      if (pos >= input.length()) {
        if (concat) {
          throw new LexerException(currentPosition(), "eof after + symbol");
        } else if (fragment) {
          return new Token(TokenKind.STRING, str.toString(), start);
        }
        return new Token(TokenKind.END_OF_INPUT, null, currentPosition());
      }

      Token token = scanUnit(fragment);
      switch (token.kind()) {
        case WHITESPACE:
        case COMMENT:
          break;
        case PLUS:
          if (concat) {
            throw new LexerException(token.position(),
                                  "unexpected + symbol after + symbol");
          }
          concat = true;
          break;
        case QUOTED_STRING:
          if (!concat && fragment) {
            // Adjacent quoted strings are only joined with +
            saved = token;
            return new Token(TokenKind.STRING, str.toString(), start);
          }
          if (start == null) {
            start = token.position();
          }
          str.append(token.content());
          fragment = true;
          concat = false;
          break;
        default:
          if (concat) {
            throw new LexerException(token.position(),
                                  "expected quoted string after + symbol");
          }
          if (fragment) {
            saved = token;
            return new Token(TokenKind.STRING, str.toString(), start);
          }
          return token;
      }
    }
  }

  /**
   * Scan a single lexical unit at pos.
   * @param plusIsOperator if false, + starts an unquoted string
   */
  private Token scanUnit(boolean plusIsOperator) throws LexerException {
    SourcePosition start = currentPosition();
    char c = input.charAt(pos);

    if (Character.isWhitespace(c)) {
      int end = pos;
      while (end < input.length() && Character.isWhitespace(input.charAt(end))) {
        end++;
      }
      advanceTo(end);
      return new Token(TokenKind.WHITESPACE, null, start);
    } else if (input.startsWith("//", pos)) {
      // Newline is left to be scanned as whitespace
      int end = input.indexOf('\n', pos);
      advanceTo(end == -1 ? input.length() : end);
      return new Token(TokenKind.COMMENT, null, start);
    } else if (input.startsWith("/*", pos)) {
      int end = input.indexOf("*/", pos + 2);
      if (end == -1) {
        throw new LexerException(start, "missing end of block comment");
      }
      advanceTo(end + 2);
      return new Token(TokenKind.COMMENT, null, start);
    }

    switch (c) {
      case ';':
        advanceTo(pos + 1);
        return new Token(TokenKind.STATEMENT_END, null, start);
      case '{':
        advanceTo(pos + 1);
        return new Token(TokenKind.BLOCK_BEGIN, null, start);
      case '}':
        advanceTo(pos + 1);
        return new Token(TokenKind.BLOCK_END, null, start);
      case '\'':
        return scanSingleQuoted(start);
      case '"':
        return scanDoubleQuoted(start);
      case '+':
        if (plusIsOperator) {
          advanceTo(pos + 1);
          return new Token(TokenKind.PLUS, null, start);
        }
        // Otherwise first character of an unquoted string, e.g. +32
      default:
        return scanUnquoted(start);
    }
  }

  /**
   * Single quoted strings are taken literally
   */
  private Token scanSingleQuoted(SourcePosition start) throws LexerException {
    int end = input.indexOf('\'', pos + 1);
    if (end == -1) {
      throw new LexerException(start, "missing end of single quoted string");
    }
    String content = input.substring(pos + 1, end);
    advanceTo(end + 1);
    return new Token(TokenKind.QUOTED_STRING, content, start);
  }

  private Token scanDoubleQuoted(SourcePosition start) throws LexerException {
    int quoteColumn = visualColumn(pos);
    StringBuilder sb = new StringBuilder();
    int i = pos + 1;
    while (true) {
      if (i >= input.length()) {
        throw new LexerException(start, "missing end of double quoted string");
      }
      char c = input.charAt(i);
      if (c == '\\') {
        if (i + 1 >= input.length()) {
          throw new LexerException(positionAt(i),
                                   "\\ symbol just before end of input");
        }
        char escaped = input.charAt(i + 1);
        switch (escaped) {
          case 'n':
            sb.append('\n');
            break;
          case 't':
            sb.append('\t');
            break;
          case '"':
            sb.append('"');
            break;
          case '\\':
            sb.append('\\');
            break;
          default:
            throw new LexerException(positionAt(i),
                "Invalid escaped character '\\" + escaped + "'");
        }
        i += 2;
      } else if (c == '"') {
        break;
      } else {
        sb.append(c);
        i++;
      }
    }
    advanceTo(i + 1);

    // Columns up to and including the quote are indentation
    String content = normalizeIndent(sb.toString(), quoteColumn + 1, tabWidth);
    return new Token(TokenKind.QUOTED_STRING, content, start);
  }

  private Token scanUnquoted(SourcePosition start) {
    int end = pos;
    while (end < input.length()) {
      char c = input.charAt(end);
      if (Character.isWhitespace(c) || c == '"' || c == '\'' ||
          c == ';' || c == '{' || c == '}') {
        break;
      }
      if (input.startsWith("//", end) || input.startsWith("/*", end)) {
        break;
      }
      end++;
    }
    assert(end > pos) : "empty unquoted string at " + start;
    String content = input.substring(pos, end);
    advanceTo(end);
    return new Token(TokenKind.STRING, content, start);
  }

  /**
   * Re-indent a multi-line double quoted string as described in
   * RFC 7950 section 6.1.3.  Lines after the first lose leading whitespace
   * up to the given indent, and every line loses trailing whitespace.
   * @param indent number of columns to strip
   * @param tabWidth columns counted for a tab
   */
  public static String normalizeIndent(String raw, int indent, int tabWidth) {
    String[] lines = raw.split("\n", -1);
    StringBuilder sb = new StringBuilder(raw.length());
    for (int i = 0; i < lines.length; i++) {
      String text = lines[i];
      if (i > 0) {
        sb.append('\n');
        int width = StringUtil.indentWidth(text, tabWidth);
        if (width > indent) {
          StringUtil.spaces(sb, width - indent);
        }
        text = text.substring(StringUtil.skipIndent(text));
      }
      sb.append(StringUtils.stripEnd(text, null));
    }
    return sb.toString();
  }

  /**
   * Move forward to offset end, keeping line and column up to date
   */
  private void advanceTo(int end) {
    for (int i = pos; i < end; i++) {
      if (input.charAt(i) == '\n') {
        line++;
        col = 0;
        lineStart = i + 1;
      } else {
        col++;
      }
    }
    pos = end;
  }

  /**
   * @return 0-based column of offset with tabs expanded
   */
  private int visualColumn(int offset) {
    int column = 0;
    for (int i = lineStart; i < offset; i++) {
      column += input.charAt(i) == '\t' ? tabWidth : 1;
    }
    return column;
  }

  /**
   * @param offset an offset at or after pos
   */
  private SourcePosition positionAt(int offset) {
    int l = line;
    int c = col;
    for (int i = pos; i < offset; i++) {
      if (input.charAt(i) == '\n') {
        l++;
        c = 0;
      } else {
        c++;
      }
    }
    return new SourcePosition(inputName, l, c + 1);
  }
}
