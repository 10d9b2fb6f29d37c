package exm.yang.frontend.tree;

import java.util.LinkedHashMap;
import java.util.Map;

import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

/**
 * Argument of the status statement.  Absent status means CURRENT.
 */
public enum Status {
  CURRENT("current"),
  DEPRECATED("deprecated"),
  OBSOLETE("obsolete");

  private final String keyword;

  private static final Map<String, Status> nameMap =
                          new LinkedHashMap<String, Status>();
  static {
    for (Status s: values()) {
      nameMap.put(s.keyword, s);
    }
  }

  private Status(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  public static Status fromString(SourcePosition errPos, String text)
                                          throws ParserException {
    Status result = nameMap.get(text);
    if (result == null) {
      throw new ParserException(errPos, "invalid status '" + text
          + "', valid options are: " + nameMap.keySet());
    }
    return result;
  }
}
