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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;

import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

/**
 * Untyped statement tree node: keyword, optional argument and the
 * substatements grouped by key, where the key is the identifier, or
 * "identifier:prefix" for prefixed keywords.
 *
 * Typed parsers consume a node with the take functions, which remove what
 * they return, and finish with {@link #ensureEmpty()}.  Anything left over
 * at that point was not recognized by the typed parser.
 *
 * Document order is kept both across keys and within each key.
 */
public class UnprocessedStatement {

  private final Identifier identifier;
  private final String prefix;
  private String argument;
  private final LinkedListMultimap<String, UnprocessedStatement> subStatements;
  private final SourcePosition position;

  public UnprocessedStatement(Identifier identifier) {
    this(identifier, null, null, null);
  }

  public UnprocessedStatement(Identifier identifier, String prefix,
                              String argument) {
    this(identifier, prefix, argument, null);
  }

  /**
   * @param prefix null if keyword has no prefix
   * @param argument null if statement has no argument
   * @param position null if not built from source text
   */
  public UnprocessedStatement(Identifier identifier, String prefix,
                              String argument, SourcePosition position) {
    assert(identifier != null);
    this.identifier = identifier;
    this.prefix = prefix;
    this.argument = argument;
    this.position = position;
    this.subStatements = LinkedListMultimap.create();
  }

  public static String key(String identifier, String prefix) {
    if (prefix == null) {
      return identifier;
    }
    return identifier + ":" + prefix;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public String getPrefix() {
    return prefix;
  }

  public boolean hasPrefix() {
    return prefix != null;
  }

  public SourcePosition getPosition() {
    return position;
  }

  /**
   * @return key under which this statement is stored in its parent
   */
  public String getKey() {
    return key(identifier.content(), prefix);
  }

  /**
   * @return keyword as written in source, e.g. "yang:date-and-time"
   */
  public String keyword() {
    if (prefix == null) {
      return identifier.content();
    }
    return prefix + ":" + identifier.content();
  }

  /**
   * @return argument not yet taken, or null
   */
  public String getArgument() {
    return argument;
  }

  public boolean hasArgument() {
    return argument != null;
  }

  public void add(UnprocessedStatement child) {
    subStatements.put(child.getKey(), child);
  }

  /**
   * @return read-only view of remaining substatements, in document order
   */
  public List<UnprocessedStatement> subStatements() {
    return Collections.unmodifiableList(subStatements.values());
  }

  /**
   * @return read-only view of remaining substatements with the given key
   */
  public List<UnprocessedStatement> subStatements(String key) {
    return Collections.unmodifiableList(subStatements.get(key));
  }

  /**
   * @return true if no argument and no substatements remain
   */
  public boolean isEmpty() {
    return argument == null && subStatements.isEmpty();
  }

  /**
   * @throws ParserException if the argument is missing or empty
   */
  public String peekArgumentOrError() throws ParserException {
    if (argument == null) {
      throw new ParserException(position, "missing argument for '"
                                          + keyword() + "'");
    }
    if (argument.isEmpty()) {
      throw new ParserException(position, "empty argument for '"
                                          + keyword() + "'");
    }
    return argument;
  }

  public String takeArgumentOrError() throws ParserException {
    return takeArgumentOrError(false);
  }

  /**
   * Take the argument.
   * @param noSubstatements if true, also check that the statement has no
   *        substatements, for statements whose argument is their whole value
   * @throws ParserException if there is no argument or it is empty
   */
  public String takeArgumentOrError(boolean noSubstatements)
      throws ParserException {
    String result = peekArgumentOrError();
    checkNoSubstatements(noSubstatements);
    argument = null;
    return result;
  }

  /**
   * Take the argument of a free-text statement with no substatements,
   * such as description or units, where the empty string is a valid value.
   * @throws ParserException if there is no argument or there are
   *          substatements
   */
  public String takeTextArgument() throws ParserException {
    if (argument == null) {
      throw new ParserException(position, "missing argument for '"
                                          + keyword() + "'");
    }
    String result = argument;
    checkNoSubstatements(true);
    argument = null;
    return result;
  }

  private void checkNoSubstatements(boolean noSubstatements)
      throws ParserException {
    if (noSubstatements && !subStatements.isEmpty()) {
      throw new ParserException(position, "'" + keyword() + "' cannot have"
          + " substatements, but found: " + remainingKeys());
    }
  }

  /**
   * Remove and return all substatements with a key, checking their count.
   */
  public List<UnprocessedStatement> take(String identifier, String prefix,
      Cardinality cardinality) throws ParserException {
    String key = key(identifier, prefix);
    List<UnprocessedStatement> matches = subStatements.removeAll(key);
    if (!cardinality.allows(matches.size())) {
      throw new ParserException(position, "expected " +
          cardinality.description() + " '" + key + "' in '" + keyword() +
          "' but found " + matches.size());
    }
    return matches;
  }

  /**
   * Remove all substatements with a key, check their count and convert each
   * in document order.
   */
  public <T> ImmutableList<T> take(String identifier, String prefix,
      Cardinality cardinality, StatementParser<T> parser)
          throws ParserException {
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (UnprocessedStatement match: take(identifier, prefix, cardinality)) {
      result.add(parser.parse(match));
    }
    return result.build();
  }

  public UnprocessedStatement takeOne(String identifier)
      throws ParserException {
    return takeOne(identifier, (String)null);
  }

  public UnprocessedStatement takeOne(String identifier, String prefix)
      throws ParserException {
    return take(identifier, prefix, Cardinality.ONE).get(0);
  }

  /**
   * @return the substatement, or null if not present
   */
  public UnprocessedStatement takeOptional(String identifier)
      throws ParserException {
    return takeOptional(identifier, (String)null);
  }

  public UnprocessedStatement takeOptional(String identifier, String prefix)
      throws ParserException {
    List<UnprocessedStatement> result =
        take(identifier, prefix, Cardinality.ZERO_OR_ONE);
    return result.isEmpty() ? null : result.get(0);
  }

  public List<UnprocessedStatement> takeZeroOrMore(String identifier)
      throws ParserException {
    return take(identifier, null, Cardinality.ZERO_OR_MORE);
  }

  public List<UnprocessedStatement> takeOneOrMore(String identifier)
      throws ParserException {
    return take(identifier, null, Cardinality.ONE_OR_MORE);
  }

  public <T> T takeOne(String identifier, StatementParser<T> parser)
      throws ParserException {
    return take(identifier, null, Cardinality.ONE, parser).get(0);
  }

  /**
   * @return converted substatement, or null if not present
   */
  public <T> T takeOptional(String identifier, StatementParser<T> parser)
      throws ParserException {
    List<T> result = take(identifier, null, Cardinality.ZERO_OR_ONE, parser);
    return result.isEmpty() ? null : result.get(0);
  }

  public <T> ImmutableList<T> takeZeroOrMore(String identifier,
      StatementParser<T> parser) throws ParserException {
    return take(identifier, null, Cardinality.ZERO_OR_MORE, parser);
  }

  public <T> ImmutableList<T> takeOneOrMore(String identifier,
      StatementParser<T> parser) throws ParserException {
    return take(identifier, null, Cardinality.ONE_OR_MORE, parser);
  }

  /**
   * Check that the typed parser consumed everything.
   * @throws ParserException naming the leftover argument or keys
   */
  public void ensureEmpty() throws ParserException {
    if (argument != null) {
      throw new ParserException(position, "unexpected argument '" + argument
                                + "' for '" + keyword() + "'");
    }
    if (!subStatements.isEmpty()) {
      throw new ParserException(position, "unexpected substatements in '"
                          + keyword() + "': " + remainingKeys());
    }
  }

  private String remainingKeys() {
    return StringUtils.join(subStatements.keySet(), ", ");
  }

  /**
   * @return deep copy with the same remaining contents
   */
  /**
   * Move the remaining argument and substatements into a new statement
   * with the same keyword and position, leaving this one empty.
   */
  public UnprocessedStatement detach() {
    UnprocessedStatement result = new UnprocessedStatement(identifier, prefix,
                                                    argument, position);
    result.subStatements.putAll(subStatements);
    subStatements.clear();
    argument = null;
    return result;
  }

  public UnprocessedStatement copy() {
    UnprocessedStatement result = new UnprocessedStatement(identifier, prefix,
                                                    argument, position);
    for (Map.Entry<String, UnprocessedStatement> e: subStatements.entries()) {
      result.subStatements.put(e.getKey(), e.getValue().copy());
    }
    return result;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
    writer.print(keyword());
    if (argument != null) {
      writer.print(" \"" + argument + "\"");
    }
    writer.println();
    for (UnprocessedStatement child: subStatements.values()) {
      child.printTree(writer, indent + 2);
    }
  }

  /**
   * @return keys of all remaining substatements, in order of first
   *          appearance
   */
  public List<String> remainingKeyList() {
    return new ArrayList<String>(subStatements.keySet());
  }

  @Override
  public String toString() {
    return argument == null ? keyword() : keyword() + " " + argument;
  }
}
