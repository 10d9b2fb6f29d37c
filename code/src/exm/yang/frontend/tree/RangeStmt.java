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

import java.math.BigInteger;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

/**
 * Range restriction of an integer type (RFC 7950 9.2.4).  Bounds may be
 * "min" or "max", which stand for the limits of the restricted type.
 */
public class RangeStmt {

  public static final String MIN = "min";
  public static final String MAX = "max";

  private final ImmutableList<RangePart> parts;
  private final String errorMessage;
  private final String errorAppTag;
  private final String description;
  private final String reference;

  public RangeStmt(List<RangePart> parts, String errorMessage,
      String errorAppTag, String description, String reference) {
    super();
    this.parts = ImmutableList.copyOf(parts);
    this.errorMessage = errorMessage;
    this.errorAppTag = errorAppTag;
    this.description = description;
    this.reference = reference;
  }

  public List<RangePart> getParts() {
    return parts;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public String getErrorAppTag() {
    return errorAppTag;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public boolean allows(BigInteger value) {
    for (RangePart part: parts) {
      if (part.contains(value)) {
        return true;
      }
    }
    return false;
  }

  public static RangeStmt parse(UnprocessedStatement stmt,
      TypeIdentifier type) throws ParserException {
    String text = stmt.takeArgumentOrError();
    List<RangePart> parts = parseParts(stmt.getPosition(), text, type);
    RangeStmt result = new RangeStmt(parts,
        stmt.takeOptional("error-message", Conversions.TEXT),
        stmt.takeOptional("error-app-tag", Conversions.TEXT),
        stmt.takeOptional("description", Conversions.TEXT),
        stmt.takeOptional("reference", Conversions.TEXT));
    stmt.ensureEmpty();
    return result;
  }

  public static StatementParser<RangeStmt> parser(final TypeIdentifier type) {
    return new StatementParser<RangeStmt>() {
      @Override
      public RangeStmt parse(UnprocessedStatement stmt)
          throws ParserException {
        return RangeStmt.parse(stmt, type);
      }
    };
  }

  public static List<RangePart> parseParts(SourcePosition errPos, String text,
      TypeIdentifier type) throws ParserException {
    assert(type.isInteger());
    ImmutableList.Builder<RangePart> parts = ImmutableList.builder();
    RangePart prev = null;
    for (String partText: text.split("\\|", -1)) {
      partText = partText.trim();
      int dots = partText.indexOf("..");
      RangePart part;
      if (dots < 0) {
        BigInteger value = convertBound(errPos, partText, type);
        part = new RangePart(value, value);
      } else {
        BigInteger lower = convertBound(errPos,
                          partText.substring(0, dots).trim(), type);
        BigInteger upper = convertBound(errPos,
                          partText.substring(dots + 2).trim(), type);
        if (lower.compareTo(upper) > 0) {
          throw new ParserException(errPos, "lower bound of range '"
                    + partText + "' is greater than its upper bound");
        }
        part = new RangePart(lower, upper);
      }
      if (prev != null && part.lower.compareTo(prev.upper) <= 0) {
        throw new ParserException(errPos, "ranges in '" + text
                              + "' must be disjoint and in ascending order");
      }
      parts.add(part);
      prev = part;
    }
    return parts.build();
  }

  private static BigInteger convertBound(SourcePosition errPos, String text,
      TypeIdentifier type) throws ParserException {
    if (text.equals(MIN)) {
      return type.min();
    } else if (text.equals(MAX)) {
      return type.max();
    }
    BigInteger value;
    try {
      value = new BigInteger(text);
    } catch (NumberFormatException e) {
      throw new ParserException(errPos, "expected the string '" + text
                                        + "' to be an integer, min or max");
    }
    if (value.compareTo(type.min()) < 0 || value.compareTo(type.max()) > 0) {
      throw new ParserException(errPos, "range bound " + value + " is outside"
          + " of " + type + " values " + type.min() + ".." + type.max());
    }
    return value;
  }

  public static class RangePart {
    public final BigInteger lower;
    public final BigInteger upper;

    public RangePart(BigInteger lower, BigInteger upper) {
      this.lower = lower;
      this.upper = upper;
    }

    public boolean contains(BigInteger value) {
      return value.compareTo(lower) >= 0 && value.compareTo(upper) <= 0;
    }

    @Override
    public String toString() {
      return lower.equals(upper) ? lower.toString() : lower + ".." + upper;
    }
  }
}
