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

import exm.yang.ast.Identifier;
import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;

/**
 * A bit of a bits type (RFC 7950 9.7.4.2)
 */
public class BitStmt {

  public static final long MAX_POSITION = 4294967295L;

  private final Identifier name;
  private final ImmutableList<String> ifFeatures;
  /** null if not given */
  private final Long position;
  private final Status status;
  private final String description;
  private final String reference;

  public BitStmt(Identifier name, List<String> ifFeatures, Long position,
      Status status, String description, String reference) {
    super();
    this.name = name;
    this.ifFeatures = ImmutableList.copyOf(ifFeatures);
    this.position = position;
    this.status = status;
    this.description = description;
    this.reference = reference;
  }

  public Identifier getName() {
    return name;
  }

  public List<String> getIfFeatures() {
    return ifFeatures;
  }

  public Long getPosition() {
    return position;
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

  public static BitStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    Identifier name = new Identifier(stmt.takeArgumentOrError());
    List<String> ifFeatures = stmt.takeZeroOrMore("if-feature",
                                                  Conversions.ARGUMENT);
    String description = stmt.takeOptional("description",
                                           Conversions.TEXT);
    String reference = stmt.takeOptional("reference", Conversions.TEXT);
    Long position = stmt.takeOptional("position", POSITION);
    Status status = stmt.takeOptional("status", Conversions.STATUS);
    if (status == null) {
      status = Status.CURRENT;
    }
    stmt.ensureEmpty();
    return new BitStmt(name, ifFeatures, position, status, description,
                       reference);
  }

  private static final StatementParser<Long> POSITION =
      new StatementParser<Long>() {
    @Override
    public Long parse(UnprocessedStatement stmt) throws ParserException {
      long pos = Conversions.convertNonNegativeInteger(stmt.getPosition(),
                                          stmt.takeArgumentOrError(true));
      if (pos > MAX_POSITION) {
        throw new ParserException(stmt.getPosition(), "bit position " + pos
                                  + " is greater than " + MAX_POSITION);
      }
      return pos;
    }
  };

  public static final StatementParser<BitStmt> PARSER =
      new StatementParser<BitStmt>() {
    @Override
    public BitStmt parse(UnprocessedStatement stmt) throws ParserException {
      return BitStmt.parse(stmt);
    }
  };

  @Override
  public String toString() {
    return "bit " + name + (position != null ? " " + position : "");
  }
}
