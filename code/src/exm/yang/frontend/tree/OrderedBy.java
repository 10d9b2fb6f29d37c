package exm.yang.frontend.tree;

import java.util.LinkedHashMap;
import java.util.Map;

import exm.yang.common.exceptions.ParserException;
import exm.yang.lexer.SourcePosition;

/**
 * Argument of ordered-by.  Absent ordered-by means SYSTEM.
 */
public enum OrderedBy {
  SYSTEM("system"),
  USER("user");

  private final String keyword;

  private static final Map<String, OrderedBy> nameMap =
                          new LinkedHashMap<String, OrderedBy>();
  static {
    for (OrderedBy o: values()) {
      nameMap.put(o.keyword, o);
    }
  }

  private OrderedBy(String keyword) {
    this.keyword = keyword;
  }

  public String keyword() {
    return keyword;
  }

  public static OrderedBy fromString(SourcePosition errPos, String text)
                                          throws ParserException {
    OrderedBy result = nameMap.get(text);
    if (result == null) {
      throw new ParserException(errPos, "invalid ordered-by '" + text
          + "', valid options are: " + nameMap.keySet());
    }
    return result;
  }
}
