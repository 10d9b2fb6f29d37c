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
import exm.yang.frontend.LogHelper;

/**
 * Parsed leaf statement.  Optional substatements that are absent are
 * represented by null.
 */
public class LeafStmt {

  private final Identifier identifier;
  private final ImmutableList<String> ifFeatures;
  private final ImmutableList<MustStmt> musts;
  /** Type statement, typed later by TypeStmt.parse */
  private final UnprocessedStatement type;
  private final Status status;
  private final WhenStmt when;
  private final String units;
  private final String defaultValue;
  private final Boolean config;
  private final Boolean mandatory;
  private final String description;
  private final String reference;

  public LeafStmt(Identifier identifier, List<String> ifFeatures,
      List<MustStmt> musts, UnprocessedStatement type, Status status,
      WhenStmt when, String units, String defaultValue, Boolean config,
      Boolean mandatory, String description, String reference) {
    super();
    this.identifier = identifier;
    this.ifFeatures = ImmutableList.copyOf(ifFeatures);
    this.musts = ImmutableList.copyOf(musts);
    this.type = type;
    this.status = status;
    this.when = when;
    this.units = units;
    this.defaultValue = defaultValue;
    this.config = config;
    this.mandatory = mandatory;
    this.description = description;
    this.reference = reference;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public List<String> getIfFeatures() {
    return ifFeatures;
  }

  public List<MustStmt> getMusts() {
    return musts;
  }

  public UnprocessedStatement getType() {
    return type;
  }

  /**
   * Parse a copy of the type statement, leaving this leaf unchanged
   */
  public TypeStmt parseType() throws ParserException {
    return TypeStmt.parse(type.copy());
  }

  public Status getStatus() {
    return status;
  }

  public WhenStmt getWhen() {
    return when;
  }

  public String getUnits() {
    return units;
  }

  public String getDefault() {
    return defaultValue;
  }

  public Boolean getConfig() {
    return config;
  }

  public Boolean getMandatory() {
    return mandatory;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public static LeafStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    Identifier identifier = new Identifier(stmt.takeArgumentOrError());

    List<String> ifFeatures = stmt.takeZeroOrMore("if-feature",
                                                  Conversions.ARGUMENT);
    List<MustStmt> musts = stmt.takeZeroOrMore("must", MustStmt.PARSER);
    UnprocessedStatement type = stmt.takeOne("type", Conversions.UNTYPED);
    Status status = stmt.takeOptional("status", Conversions.STATUS);
    WhenStmt when = stmt.takeOptional("when", WhenStmt.PARSER);
    String units = stmt.takeOptional("units", Conversions.TEXT);
    String defaultValue = stmt.takeOptional("default", Conversions.TEXT);
    Boolean config = stmt.takeOptional("config", Conversions.BOOLEAN);
    Boolean mandatory = stmt.takeOptional("mandatory", Conversions.BOOLEAN);
    String description = stmt.takeOptional("description",
                                           Conversions.TEXT);
    String reference = stmt.takeOptional("reference", Conversions.TEXT);
    stmt.ensureEmpty();

    // RFC 7950 7.6.4
    if (defaultValue != null && Boolean.TRUE.equals(mandatory)) {
      throw new ParserException(stmt.getPosition(), "leaf '" + identifier
          + "' cannot have both a default and mandatory true");
    }

    LogHelper.trace(stmt.getPosition(), "leaf " + identifier);
    return new LeafStmt(identifier, ifFeatures, musts, type,
        status == null ? Status.CURRENT : status, when, units, defaultValue,
        config, mandatory, description, reference);
  }

  public static final StatementParser<LeafStmt> PARSER =
      new StatementParser<LeafStmt>() {
    @Override
    public LeafStmt parse(UnprocessedStatement stmt) throws ParserException {
      return LeafStmt.parse(stmt);
    }
  };
}
