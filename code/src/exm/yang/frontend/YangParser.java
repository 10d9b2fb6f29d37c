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
package exm.yang.frontend;

import org.apache.log4j.Logger;

import exm.yang.ast.Extraction;
import exm.yang.ast.StatementTreeParser;
import exm.yang.ast.UnprocessedStatement;
import exm.yang.common.Settings;
import exm.yang.common.exceptions.InvalidOptionException;
import exm.yang.common.exceptions.UserException;
import exm.yang.frontend.tree.ModuleStmt;
import exm.yang.lexer.Lexer;

/**
 * This is the main entry point to the parser: YANG source text in,
 * statement tree or typed module out.
 */
public class YangParser {

  private final Logger logger;

  /**
   * Applies any Java system property overrides of {@link Settings} and
   * validates them, so that options such as {@link Settings#TAB_WIDTH}
   * may be given with -D on the host's command line.
   * @throws InvalidOptionException if a setting has an invalid value
   */
  public YangParser(Logger logger) throws InvalidOptionException {
    super();
    this.logger = logger;
    Settings.initProperties();
  }

  /**
   * Parse source text into an untyped statement tree.  Positions are
   * reported against the {@link Settings#INPUT_NAME} option.
   * @throws UserException on lexical errors, malformed statements, or
   *          anything other than exactly one top-level statement
   */
  public UnprocessedStatement parseTree(String source) throws UserException {
    return parseTree(source, Settings.get(Settings.INPUT_NAME));
  }

  public UnprocessedStatement parseTree(String source, String inputName)
      throws UserException {
    Lexer lexer = new Lexer(source, inputName, Settings.getTabWidth());
    UnprocessedStatement root = StatementTreeParser.parseDocument(lexer,
                                              Settings.getMaxDepth());
    if (logger.isDebugEnabled()) {
      logger.debug("Parsed " + StatementTreeParser.treeSize(root)
                 + " statements from " + inputName);
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Statement tree:\n" + root.printTree());
    }
    return root;
  }

  /**
   * Parse source text that holds a single module statement
   */
  public ModuleStmt parseModule(String source) throws UserException {
    UnprocessedStatement root = parseTree(source);
    ModuleStmt module = Extraction.extractAll(root, ModuleStmt.PARSER);
    logger.debug("Parsed module " + module.getIdentifier());
    return module;
  }
}
