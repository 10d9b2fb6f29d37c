package exm.yang.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.yang.common.Logging;
import exm.yang.lexer.SourcePosition;

/**
 * Helper functions to augment log messages with contextual information about
 * the current statement.
 *
 */
public class LogHelper {
  static final Logger logger = Logging.getYangLogger();

  public static void trace(SourcePosition position, String msg) {
    log(0, Level.TRACE, position, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, null, msg);
  }

  /**
   * @param position printed before the message if not null
   */
  public static void log(int indent, Level level, SourcePosition position,
                         String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    StringBuilder sb = new StringBuilder(256);
    if (position != null) {
      sb.append(position.prefix());
      sb.append(' ');
    }
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb.toString());
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}
