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

import exm.yang.ast.Identifier;
import exm.yang.ast.StatementParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.exceptions.ParserException;
import exm.yang.frontend.LogHelper;

/**
 * Top level module statement.  The sections are kept untyped for now and
 * refined by later passes.
 */
public class ModuleStmt {

  private final Identifier identifier;
  private final UnprocessedStatement moduleHeader;
  private final UnprocessedStatement linkage;
  private final UnprocessedStatement meta;
  private final UnprocessedStatement revision;
  private final UnprocessedStatement body;

  public ModuleStmt(Identifier identifier, UnprocessedStatement moduleHeader,
      UnprocessedStatement linkage, UnprocessedStatement meta,
      UnprocessedStatement revision, UnprocessedStatement body) {
    super();
    this.identifier = identifier;
    this.moduleHeader = moduleHeader;
    this.linkage = linkage;
    this.meta = meta;
    this.revision = revision;
    this.body = body;
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public UnprocessedStatement getModuleHeader() {
    return moduleHeader;
  }

  public UnprocessedStatement getLinkage() {
    return linkage;
  }

  public UnprocessedStatement getMeta() {
    return meta;
  }

  public UnprocessedStatement getRevision() {
    return revision;
  }

  public UnprocessedStatement getBody() {
    return body;
  }

  public static ModuleStmt parse(UnprocessedStatement stmt)
      throws ParserException {
    Identifier identifier = new Identifier(stmt.takeArgumentOrError());

    ModuleStmt result = new ModuleStmt(identifier,
        stmt.takeOne("module-header", Conversions.UNTYPED),
        stmt.takeOne("linkage", Conversions.UNTYPED),
        stmt.takeOne("meta", Conversions.UNTYPED),
        stmt.takeOne("revision", Conversions.UNTYPED),
        stmt.takeOne("body", Conversions.UNTYPED));
    stmt.ensureEmpty();

    LogHelper.trace(stmt.getPosition(), "module " + identifier);
    return result;
  }

  public static final StatementParser<ModuleStmt> PARSER =
      new StatementParser<ModuleStmt>() {
    @Override
    public ModuleStmt parse(UnprocessedStatement stmt) throws ParserException {
      return ModuleStmt.parse(stmt);
    }
  };
}
