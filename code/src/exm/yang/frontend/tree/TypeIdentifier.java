package exm.yang.frontend.tree;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Names of the built-in YANG types (RFC 7950 section 4.2.4)
 */
public enum TypeIdentifier {
  BINARY("binary"),
  BITS("bits"),
  BOOLEAN("boolean"),
  DECIMAL64("decimal64"),
  EMPTY("empty"),
  ENUMERATION("enumeration"),
  IDENTITYREF("identityref"),
  INSTANCE_IDENTIFIER("instance-identifier"),
  INT8("int8", "-128", "127"),
  INT16("int16", "-32768", "32767"),
  INT32("int32", "-2147483648", "2147483647"),
  INT64("int64", "-9223372036854775808", "9223372036854775807"),
  LEAFREF("leafref"),
  STRING("string"),
  UINT8("uint8", "0", "255"),
  UINT16("uint16", "0", "65535"),
  UINT32("uint32", "0", "4294967295"),
  UINT64("uint64", "0", "18446744073709551615"),
  UNION("union");

  private final String keyword;
  /** Value space of integer types, null for other types */
  private final BigInteger min;
  private final BigInteger max;

  private static final Map<String, TypeIdentifier> nameMap =
                          new HashMap<String, TypeIdentifier>();
  static {
    for (TypeIdentifier id: values()) {
      nameMap.put(id.keyword, id);
    }
  }

  private TypeIdentifier(String keyword) {
    this.keyword = keyword;
    this.min = null;
    this.max = null;
  }

  private TypeIdentifier(String keyword, String min, String max) {
    this.keyword = keyword;
    this.min = new BigInteger(min);
    this.max = new BigInteger(max);
  }

  public String keyword() {
    return keyword;
  }

  public boolean isInteger() {
    return min != null;
  }

  public BigInteger min() {
    return min;
  }

  public BigInteger max() {
    return max;
  }

  /**
   * @return the built-in type, or null if name is not one
   */
  public static TypeIdentifier fromString(String name) {
    return nameMap.get(name);
  }

  @Override
  public String toString() {
    return keyword;
  }
}
