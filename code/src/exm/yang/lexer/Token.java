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

/**
 * Immutable token.  Equality is by kind and content only, so that tokens
 * from different places in the input compare equal.
 */
public class Token {
  private final TokenKind kind;
  /** Non-null only for STRING and QUOTED_STRING */
  private final String content;
  private final SourcePosition position;

  public Token(TokenKind kind, String content, SourcePosition position) {
    super();
    assert(content == null || kind == TokenKind.STRING ||
           kind == TokenKind.QUOTED_STRING) : kind + " with content";
    this.kind = kind;
    this.content = content;
    this.position = position;
  }

  public static Token of(TokenKind kind) {
    return new Token(kind, null, null);
  }

  public static Token string(String content) {
    return new Token(TokenKind.STRING, content, null);
  }

  public TokenKind kind() {
    return kind;
  }

  public String content() {
    return content;
  }

  /**
   * @return position of first character of the token, null if not from
   *          a lexer
   */
  public SourcePosition position() {
    return position;
  }

  public boolean isString() {
    return kind == TokenKind.STRING;
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + (content == null ? 0 : content.hashCode());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Token))
      return false;
    Token other = (Token) obj;
    if (kind != other.kind)
      return false;
    if (content == null) {
      return other.content == null;
    }
    return content.equals(other.content);
  }

  @Override
  public String toString() {
    if (content == null) {
      return kind.toString();
    }
    return kind + "(\"" + content + "\")";
  }
}
