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
 * Parsed leaf-list statement.  Like {@link LeafStmt}, but with any number
 * of defaults and element count bounds.
 */
public class LeafListStmt {

  public static final String UNBOUNDED = "unbounded";

  private final Identifier identifier;
  private final ImmutableList<String> ifFeatures;
  private final ImmutableList<MustStmt> musts;
  private final ImmutableList<String> defaults;
  private final UnprocessedStatement type;
  private final OrderedBy orderedBy;
  private final Status status;
  private final WhenStmt when;
  private final String units;
  private final Boolean config;
  private final Long minElements;
  /** null if absent or unbounded */
  private final Long maxElements;
  private final String description;
  private final String reference;

  public LeafListStmt(Identifier identifier, List<String> ifFeatures,
      List<MustStmt> musts, List<String> defaults, UnprocessedStatement type,
      OrderedBy orderedBy, Status status, WhenStmt when, String units,
      Boolean config, Long minElements, Long maxElements, String description,
      String reference) {
    super();
    this.identifier = identifier;
    this.ifFeatures = ImmutableList.copyOf(ifFeatures);
    this.musts = ImmutableList.copyOf(musts);
    this.defaults = ImmutableList.copyOf(defaults);
    this.type = type;
    this.orderedBy = orderedBy;
    this.status = status;
    this.when = when;
    this.units = units;
    this.config = config;
    this.minElements = minElements;
    this.maxElements = maxElements;
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

  public List<String> getDefaults() {
    return defaults;
  }

  public UnprocessedStatement getType() {
    return type;
  }

  public TypeStmt parseType() throws ParserException {
    return TypeStmt.parse(type.copy());
  }

  public OrderedBy getOrderedBy() {
    return orderedBy;
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

  public Boolean getConfig() {
    return config;
  }

  public Long getMinElements() {
    return minElements;
  }

  public Long getMaxElements() {
    return maxElements;
  }

  public String getDescription() {
    return description;
  }

  public String getReference() {
    return reference;
  }

  public static LeafListStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    Identifier identifier = new Identifier(stmt.takeArgumentOrError());

    List<String> ifFeatures = stmt.takeZeroOrMore("if-feature",
                                                  Conversions.ARGUMENT);
    List<MustStmt> musts = stmt.takeZeroOrMore("must", MustStmt.PARSER);
    List<String> defaults = stmt.takeZeroOrMore("default",
                                                Conversions.TEXT);
    UnprocessedStatement type = stmt.takeOne("type", Conversions.UNTYPED);
    OrderedBy orderedBy = stmt.takeOptional("ordered-by",
                                            Conversions.ORDERED_BY);
    Status status = stmt.takeOptional("status", Conversions.STATUS);
    WhenStmt when = stmt.takeOptional("when", WhenStmt.PARSER);
    String units = stmt.takeOptional("units", Conversions.TEXT);
    Boolean config = stmt.takeOptional("config", Conversions.BOOLEAN);
    Long minElements = stmt.takeOptional("min-elements",
                                         Conversions.NON_NEGATIVE_INTEGER);
    UnprocessedStatement maxStmt = stmt.takeOptional("max-elements");
    Long maxElements = maxStmt == null ? null : convertMaxElements(maxStmt);
    String description = stmt.takeOptional("description",
                                           Conversions.TEXT);
    String reference = stmt.takeOptional("reference", Conversions.TEXT);
    stmt.ensureEmpty();

    if (minElements != null && maxElements != null &&
        minElements > maxElements) {
      throw new ParserException(stmt.getPosition(), "leaf-list '"
          + identifier + "' has min-elements " + minElements
          + " greater than max-elements " + maxElements);
    }

    LogHelper.trace(stmt.getPosition(), "leaf-list " + identifier);
    return new LeafListStmt(identifier, ifFeatures, musts, defaults, type,
        orderedBy == null ? OrderedBy.SYSTEM : orderedBy,
        status == null ? Status.CURRENT : status, when, units, config,
        minElements, maxElements, description, reference);
  }

  /**
   * @return bound, or null for unbounded
   */
  private static Long convertMaxElements(UnprocessedStatement stmt)
      throws ParserException {
    String text = stmt.takeArgumentOrError(true);
    if (text.equals(UNBOUNDED)) {
      return null;
    }
    return Conversions.convertNonNegativeInteger(stmt.getPosition(), text);
  }

  public static final StatementParser<LeafListStmt> PARSER =
      new StatementParser<LeafListStmt>() {
    @Override
    public LeafListStmt parse(UnprocessedStatement stmt)
        throws ParserException {
      return LeafListStmt.parse(stmt);
    }
  };
}
