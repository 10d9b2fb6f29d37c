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
package exm.yang.frontend.tree;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

/**
 * Conversions of statement arguments to values, and parsers for the simple
 * statements whose argument is their whole value.
 */
public class Conversions {

  /** Argument of a statement that must not have substatements */
  public static final StatementParser<String> ARGUMENT =
      new StatementParser<String>() {
    @Override
    public String parse(UnprocessedStatement stmt) throws ParserException {
      return stmt.takeArgumentOrError(true);
    }
  };

  /**
   * Argument of a free-text statement that must not have substatements.
   * Unlike {@link #ARGUMENT}, the empty string is accepted.
   */
  public static final StatementParser<String> TEXT =
      new StatementParser<String>() {
    @Override
    public String parse(UnprocessedStatement stmt) throws ParserException {
      return stmt.takeTextArgument();
    }
  };

  public static final StatementParser<Boolean> BOOLEAN =
      new StatementParser<Boolean>() {
    @Override
    public Boolean parse(UnprocessedStatement stmt) throws ParserException {
      return convertBoolean(stmt.getPosition(), stmt.takeArgumentOrError(true));
    }
  };

  public static final StatementParser<Long> NON_NEGATIVE_INTEGER =
      new StatementParser<Long>() {
    @Override
    public Long parse(UnprocessedStatement stmt) throws ParserException {
      return convertNonNegativeInteger(stmt.getPosition(),
                                       stmt.takeArgumentOrError(true));
    }
  };

  public static final StatementParser<Status> STATUS =
      new StatementParser<Status>() {
    @Override
    public Status parse(UnprocessedStatement stmt) throws ParserException {
      return convertStatus(stmt.getPosition(), stmt.takeArgumentOrError(true));
    }
  };

  public static final StatementParser<OrderedBy> ORDERED_BY =
      new StatementParser<OrderedBy>() {
    @Override
    public OrderedBy parse(UnprocessedStatement stmt) throws ParserException {
      return convertOrderedBy(stmt.getPosition(),
                              stmt.takeArgumentOrError(true));
    }
  };

  /**
   * Leaves the statement as it is, for sections that are refined later
   */
  public static final StatementParser<UnprocessedStatement> UNTYPED =
      new StatementParser<UnprocessedStatement>() {
    @Override
    public UnprocessedStatement parse(UnprocessedStatement stmt) {
      return stmt;
    }
  };

  public static boolean convertBoolean(SourcePosition errPos, String text)
      throws ParserException {
    if (text.equals("true")) {
      return true;
    } else if (text.equals("false")) {
      return false;
    }
    throw new ParserException(errPos, "invalid boolean format: '" + text
                                      + "'");
  }

  /**
   * Parse a decimal integer.  A leading + or - is accepted.
   */
  public static long convertInteger(SourcePosition errPos, String text)
      throws ParserException {
    try {
      return Long.parseLong(text);
    } catch (NumberFormatException e) {
      throw new ParserException(errPos, "expected the string '" + text
                                        + "' to be an integer");
    }
  }

  public static long convertNonNegativeInteger(SourcePosition errPos,
      String text) throws ParserException {
    long num = convertInteger(errPos, text);
    if (num < 0) {
      throw new ParserException(errPos, "expected a non-negative integer,"
                                        + " but found '" + text + "'");
    }
    return num;
  }

  /**
   * @param text null if no status statement was given
   */
  public static Status convertStatus(SourcePosition errPos, String text)
      throws ParserException {
    if (text == null) {
      return Status.CURRENT;
    }
    return Status.fromString(errPos, text);
  }

  /**
   * @param text null if no ordered-by statement was given
   */
  public static OrderedBy convertOrderedBy(SourcePosition errPos, String text)
      throws ParserException {
    if (text == null) {
      return OrderedBy.SYSTEM;
    }
    return OrderedBy.fromString(errPos, text);
  }
}
