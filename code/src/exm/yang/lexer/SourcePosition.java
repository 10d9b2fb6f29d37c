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
package exm.yang.lexer;

/**
 * Simple immutable class to record input name, line and column
 */
public class SourcePosition {
  public final String file;
  /** 1-based */
  public final int line;
  /** 1-based */
  public final int column;

  public SourcePosition(String file, int line, int column) {
    super();
    this.file = file;
    this.line = line;
    this.column = column;
  }

  /**
   * @return "file:line:column:" for prefixing error messages
   */
  public String prefix() {
    return toString() + ":";
  }

  @Override
  public String toString() {
    return file + ":" + line + ":" + column;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((file == null) ? 0 : file.hashCode());
    result = prime * result + line;
    result = prime * result + column;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourcePosition))
      return false;
    SourcePosition other = (SourcePosition) obj;
    if (file == null) {
      if (other.file != null)
        return false;
    } else if (!file.equals(other.file))
      return false;
    return line == other.line && column == other.column;
  }
}
