package exm.yang.ast;

/**
 * A YANG keyword or argument name.  No syntax checking is done here:
 * callers validate where the RFC requires it.
 */
public class Identifier {
  private final String content;

  public Identifier(String content) {
    assert(content != null);
    this.content = content;
  }

  public String content() {
    return content;
  }

  @Override
  public int hashCode() {
    return content.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Identifier))
      return false;
    return content.equals(((Identifier)obj).content);
  }

  @Override
  public String toString() {
    return content;
  }
}
