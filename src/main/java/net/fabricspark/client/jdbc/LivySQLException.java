package net.fabricspark.client.jdbc;

import java.sql.SQLException;
import net.fabricspark.client.core.LivyException;
import net.fabricspark.client.log.LivyLogger;
import net.fabricspark.client.log.LivyLoggerFactory;

public class LivySQLException extends SQLException {
  private static final LivyLogger logger = LivyLoggerFactory.getLogger(LivySQLException.class);

  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;

  /**
   * @param ex the protocol level exception; message, SQL state and vendor code are taken from it
   */
  public LivySQLException(LivyException ex) {
    super(ex.getMessage(), ex.getSqlState(), ex.getVendorCode(), ex);
    this.errorCode = ex.getErrorCode();
  }

  /**
   * @param errorCode the error code
   * @param message exception reason
   */
  public LivySQLException(ErrorCode errorCode, String message) {
    super(message, errorCode.getSqlState(), errorCode.getMessageCode());
    this.errorCode = errorCode;
    logger.debug(
        "Livy SQL exception: {}, sqlState: {}, vendorCode: {}",
        message,
        errorCode.getSqlState(),
        errorCode.getMessageCode());
  }

  public ErrorCode getLivyErrorCode() {
    return errorCode;
  }
}
