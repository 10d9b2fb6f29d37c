
package exm.yang.common.exceptions;

/**
 * This represents a parser internal error.
 * These always indicate a parser bug (or missing feature).
 * */
public class YangRuntimeError extends RuntimeException
{
  public YangRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
