package net.fabricspark.client.core;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import net.fabricspark.client.jdbc.ErrorCode;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

/**
 * Exception raised by the session and statement protocol. It is converted to {@link
 * net.fabricspark.client.jdbc.LivySQLException} at the cursor / connection surface.
 */
public class LivyException extends Exception {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivyException.class);

  private static final long serialVersionUID = 1L;

  private static final ResourceBundle errorMessages =
      ResourceBundle.getBundle(ErrorCode.errorMessageResource);

  private final ErrorCode errorCode;
  private final transient Object[] params;

  public LivyException(ErrorCode errorCode, Object... params) {
    this(null, errorCode, params);
  }

  public LivyException(Throwable cause, ErrorCode errorCode, Object... params) {
    super(formatMessage(errorCode, params), cause);
    this.errorCode = errorCode;
    this.params = params;
    logger.debug("Livy exception: {}, errorCode: {}", getMessage(), errorCode);
  }

  static String formatMessage(ErrorCode errorCode, Object... params) {
    try {
      String pattern = errorMessages.getString(String.valueOf(errorCode.getMessageCode()));
      return MessageFormat.format(pattern, params);
    } catch (MissingResourceException ex) {
      return errorCode.name();
    }
  }

  public ErrorCode getErrorCode() {
    return errorCode;
  }

  public int getVendorCode() {
    return errorCode.getMessageCode();
  }

  public String getSqlState() {
    return errorCode.getSqlState();
  }

  public Object[] getParams() {
    return params;
  }
}
