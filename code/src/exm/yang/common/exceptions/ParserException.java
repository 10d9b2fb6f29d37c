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
package exm.yang.common.exceptions;

import exm.yang.lexer.SourcePosition;

/**
 * Grammar violation in the statement tree or in a typed statement:
 * missing, duplicated or unrecognized substatements, bad argument values.
 */
public class ParserException extends UserException {

  private static final long serialVersionUID = 1L;

  public ParserException(String message) {
    super(message);
  }

  /**
   * @param position may be null if the statement was built by hand
   */
  public ParserException(SourcePosition position, String message) {
    super(position, message);
  }
}
