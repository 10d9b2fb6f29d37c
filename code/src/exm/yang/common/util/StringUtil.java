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
package exm.yang.common.util;

public class StringUtil {

  /**
   * Append the given number of spaces into given StringBuilder
   */
  public static void spaces(StringBuilder sb, int c) {
    for (int i = 0; i < c; i++)
      sb.append(' ');
  }

  /**
   * Count the columns taken by leading spaces and tabs.
   * @param tabWidth columns counted for each tab
   * @return the width, or -1 if the line is entirely spaces and tabs
   */
  public static int indentWidth(String line, int tabWidth) {
    int width = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (c == ' ') {
        width++;
      } else if (c == '\t') {
        width += tabWidth;
      } else {
        return width;
      }
    }
    return -1;
  }

  /**
   * @return index of first character that is not a space or tab
   */
  public static int skipIndent(String line) {
    int i = 0;
    while (i < line.length() &&
          (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
      i++;
    }
    return i;
  }

  /**
   * Unicode White_Space property.  Character.isWhitespace() leaves out
   * the no-break spaces and NEL.
   */
  public static boolean isUnicodeWhitespace(int codePoint) {
    return Character.isWhitespace(codePoint) ||
           Character.isSpaceChar(codePoint) ||
           codePoint == 0x85;
  }

  /**
   * @return true if the string starts or ends with a Unicode whitespace
   *        character
   */
  public static boolean hasSurroundingWhitespace(String s) {
    if (s.isEmpty()) {
      return false;
    }
    int first = s.codePointAt(0);
    int last = s.codePointBefore(s.length());
    return isUnicodeWhitespace(first) || isUnicodeWhitespace(last);
  }
}
