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
package exm.yang.ast;

import exm.yang.common.exceptions.ParserException;
import exm.yang.common.exceptions.UserException;
import exm.yang.frontend.LogHelper;
import exm.yang.lexer.Lexer;
import exm.yang.lexer.Token;
import exm.yang.lexer.TokenKind;

/**
 * Builds the untyped statement tree from the token stream:
 * <pre>
 *   statement = keyword [argument] (";" / "{" *statement "}")
 * </pre>
 */
public class StatementTreeParser {

  public static final int DEFAULT_MAX_DEPTH = 1000;

  public static UnprocessedStatement parseStatement(Lexer lexer)
      throws UserException {
    return parseStatement(lexer, DEFAULT_MAX_DEPTH);
  }

  /**
   * Parse one statement and all its substatements.
   * @param maxDepth deepest block nesting allowed below this statement
   * @return the statement, or null if the next token cannot start a
   *          statement (end of block or end of input), in which case
   *          nothing is consumed
   * @throws UserException on lexical errors or malformed statements
   */
  public static UnprocessedStatement parseStatement(Lexer lexer,
      int maxDepth) throws UserException {
    return parseStatement(lexer, 0, maxDepth);
  }

  private static UnprocessedStatement parseStatement(Lexer lexer, int depth,
      int maxDepth) throws UserException {
    // keyword
    Token token = lexer.peek();
    if (!token.isString()) {
      return null;
    }
    Token keyword = lexer.next();
    if (depth > maxDepth) {
      throw new ParserException(keyword.position(), "statement '"
          + keyword.content() + "' is nested deeper than " + maxDepth
          + " levels");
    }

    // [argument]
    String argument = null;
    if (lexer.peek().isString()) {
      argument = lexer.next().content();
    }
    UnprocessedStatement result = newStatement(keyword, argument);
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(depth * 2, result.getPosition() + " " + result);
    }

    // (";" / "{" *statement "}")
    token = lexer.next();
    if (token.kind() == TokenKind.STATEMENT_END) {
      return result;
    } else if (token.kind() != TokenKind.BLOCK_BEGIN) {
      throw new ParserException(token.position(),
          "unexpected end of statement '" + result.keyword() + "': expected"
          + " ';' or '{' but found " + token);
    }

    while (true) {
      UnprocessedStatement child = parseStatement(lexer, depth + 1,
                                                   maxDepth);
      if (child == null) {
        break;
      }
      result.add(child);
    }

    token = lexer.next();
    if (token.kind() != TokenKind.BLOCK_END) {
      throw new ParserException(token.position(), "expected '}' to close '"
          + result.keyword() + "' started at " + result.getPosition()
          + " but found " + token);
    }
    return result;
  }

  /**
   * Split keyword into prefix and identifier on the first ':'
   */
  private static UnprocessedStatement newStatement(Token keyword,
      String argument) throws ParserException {
    String text = keyword.content();
    String prefix = null;
    String identifier = text;
    int colon = text.indexOf(':');
    if (colon >= 0) {
      prefix = text.substring(0, colon);
      identifier = text.substring(colon + 1);
      if (prefix.isEmpty()) {
        throw new ParserException(keyword.position(),
                    "empty prefix in keyword '" + text + "'");
      }
    }
    if (identifier.isEmpty()) {
      throw new ParserException(keyword.position(),
                  "empty keyword '" + text + "'");
    }
    return new UnprocessedStatement(new Identifier(identifier), prefix,
                                    argument, keyword.position());
  }

  /**
   * Parse exactly one statement covering the whole input.
   * @throws ParserException if the input is empty, or has anything after
   *          the statement
   */
  public static UnprocessedStatement parseDocument(Lexer lexer)
      throws UserException {
    return parseDocument(lexer, DEFAULT_MAX_DEPTH);
  }

  public static UnprocessedStatement parseDocument(Lexer lexer, int maxDepth)
      throws UserException {
    UnprocessedStatement root = parseStatement(lexer, maxDepth);
    Token next = lexer.next();
    if (root == null) {
      throw new ParserException(next.position(),
              "expected a statement but found " + next);
    }
    if (next.kind() != TokenKind.END_OF_INPUT) {
      throw new ParserException(next.position(),
          "unexpected " + next + " after end of '" + root.keyword() + "'");
    }
    return root;
  }

  /**
   * @return number of statements in tree, including the root
   */
  public static int treeSize(UnprocessedStatement stmt) {
    int n = 1;
    for (UnprocessedStatement child: stmt.subStatements()) {
      n += treeSize(child);
    }
    return n;
  }
}
