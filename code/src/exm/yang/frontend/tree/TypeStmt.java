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
import exm.yang.common.exceptions.YangRuntimeError;
import exm.yang.frontend.LogHelper;

/**
 * A parsed type statement.  {@link #parse(UnprocessedStatement)} picks the
 * subclass from the type name.
 */
public abstract class TypeStmt {

  /**
   * @return type name as written, including any prefix
   */
  public abstract String typeName();

  /**
   * @return the built-in type, or null for a derived type
   */
  public abstract TypeIdentifier typeIdentifier();

  public boolean isBuiltIn() {
    return typeIdentifier() != null;
  }

  public static TypeStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    // Left in place for the chosen parser
    String name = stmt.peekArgumentOrError();

    // Prefixed names always refer to typedefs
    TypeIdentifier id = null;
    if (name.indexOf(':') < 0) {
      id = TypeIdentifier.fromString(name);
    }
    if (id == null) {
      LogHelper.trace(stmt.getPosition(), "derived type " + name);
      return DerivedTypeStmt.parse(stmt);
    }

    switch (id) {
      case BINARY:
        return BinaryTypeStmt.parse(stmt);
      case BITS:
        return BitsTypeStmt.parse(stmt);
      case BOOLEAN:
        return BooleanTypeStmt.parse(stmt);
      case DECIMAL64:
        return Decimal64TypeStmt.parse(stmt);
      case EMPTY:
        return EmptyTypeStmt.parse(stmt);
      case ENUMERATION:
        return EnumerationTypeStmt.parse(stmt);
      case IDENTITYREF:
        return IdentityrefTypeStmt.parse(stmt);
      case INSTANCE_IDENTIFIER:
        return InstanceIdentifierTypeStmt.parse(stmt);
      case INT8:
      case INT16:
      case INT32:
      case INT64:
      case UINT8:
      case UINT16:
      case UINT32:
      case UINT64:
        return IntegerTypeStmt.parse(stmt);
      case LEAFREF:
        return LeafrefTypeStmt.parse(stmt);
      case STRING:
        return StringTypeStmt.parse(stmt);
      case UNION:
        return UnionTypeStmt.parse(stmt);
      default:
        throw new YangRuntimeError("Unhandled built-in type " + id);
    }
  }

  /**
   * Take the type name for a subclass parser.
   * @throws YangRuntimeError if the parser was picked for another type
   */
  protected static String takeTypeName(UnprocessedStatement stmt,
      TypeIdentifier expected) throws ParserException {
    String name = stmt.takeArgumentOrError();
    if (!name.equals(expected.keyword())) {
      throw new YangRuntimeError("internal: " + expected + " statement "
                                 + "parsed with wrong identifier " + name);
    }
    return name;
  }

  @Override
  public String toString() {
    return "type " + typeName();
  }

  public static final StatementParser<TypeStmt> PARSER =
      new StatementParser<TypeStmt>() {
    @Override
    public TypeStmt parse(UnprocessedStatement stmt) throws ParserException {
      return TypeStmt.parse(stmt);
    }
  };
}
