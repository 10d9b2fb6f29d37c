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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;
import exm.yang.common.util.StringUtil;
import exm.yang.lexer.SourcePosition;

/**
 * An assigned name of an enumeration type (RFC 7950 9.6.4)
 */
public class EnumStmt {

  private final String name;
  private final ImmutableList<String> ifFeatures;
  /** null if not given */
  private final Integer value;
  private final Status status;
  private final String description;
  private final String reference;

  public EnumStmt(String name, List<String> ifFeatures, Integer value,
      Status status, String description, String reference) {
    super();
    this.name = name;
    this.ifFeatures = ImmutableList.copyOf(ifFeatures);
    this.value = value;
    this.status = status;
    this.description = description;
    this.reference = reference;
  }

  public String getName() {
    return name;
  }

  public List<String> getIfFeatures() {
    return ifFeatures;
  }

  public Integer getValue() {
    return value;
  }

  public Status getStatus() {
    return status;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public static EnumStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    String name = stmt.takeArgumentOrError();
    checkName(stmt.getPosition(), name);
    List<String> ifFeatures = stmt.takeZeroOrMore("if-feature",
                                                  Conversions.ARGUMENT);
    String description = stmt.takeOptional("description",
                                           Conversions.TEXT);
    String reference = stmt.takeOptional("reference", Conversions.TEXT);
    Status status = stmt.takeOptional("status", Conversions.STATUS);
    if (status == null) {
      status = Status.CURRENT;
    }
    Integer value = stmt.takeOptional("value", VALUE);
    stmt.ensureEmpty();
    return new EnumStmt(name, ifFeatures, value, status, description,
                        reference);
  }

  private static void checkName(SourcePosition errPos, String name)
      throws ParserException {
    if (StringUtil.hasSurroundingWhitespace(name)) {
      throw new ParserException(errPos, "enum name '" + name + "' must not "
                    + "have leading or trailing whitespace");
    }
  }

  private static final StatementParser<Integer> VALUE =
      new StatementParser<Integer>() {
    @Override
    public Integer parse(UnprocessedStatement stmt) throws ParserException {
      long value = Conversions.convertInteger(stmt.getPosition(),
                                    stmt.takeArgumentOrError(true));
      if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
        throw new ParserException(stmt.getPosition(), "enum value " + value
                                  + " is outside of the int32 range");
      }
      return (int)value;
    }
  };

  public static final StatementParser<EnumStmt> PARSER =
      new StatementParser<EnumStmt>() {
    @Override
    public EnumStmt parse(UnprocessedStatement stmt) throws ParserException {
      return EnumStmt.parse(stmt);
    }
  };

  @Override
  public String toString() {
    return "enum " + name + (value != null ? " " + value : "");
  }
}
