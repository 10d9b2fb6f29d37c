package exm.yang.common.exceptions;

public class InvalidOptionException extends UserException {

  private static final long serialVersionUID = 1L;

  public InvalidOptionException(String message) {
    super(message);
  }

}
