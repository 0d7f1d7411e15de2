package net.fabricspark.client.jdbc;

import java.util.HashMap;
import java.util.Map;

/**
 * Internal driver error codes. The message for each code lives in {@link #errorMessageResource}
 * under the numeric code as key.
 */
public enum ErrorCode {
  INTERNAL_ERROR(200001, SqlState.INTERNAL_ERROR),
  CONNECTION_ERROR(200002, SqlState.SQLCLIENT_UNABLE_TO_ESTABLISH_SQLCONNECTION),
  INTERRUPTED(200003, SqlState.QUERY_CANCELED),
  NETWORK_ERROR(200004, SqlState.IO_ERROR),
  BAD_RESPONSE(200005, SqlState.INTERNAL_ERROR),
  MISSING_CONNECTION_PROPERTY(200006, SqlState.INVALID_AUTHORIZATION_SPECIFICATION),
  INVALID_CONNECTION_PROPERTY(200007, SqlState.INVALID_AUTHORIZATION_SPECIFICATION),
  TOKEN_ACQUISITION_ERROR(200008, SqlState.INVALID_AUTHORIZATION_SPECIFICATION),
  SUBMIT_RETRIES_EXHAUSTED(200009, SqlState.SYSTEM_ERROR),
  STATEMENT_FAILED(200010, SqlState.SYSTEM_ERROR),
  UNEXPECTED_STATEMENT_STATUS(200011, SqlState.INTERNAL_ERROR),
  QUERY_EXECUTION_ERROR(200012, SqlState.SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION),
  POLL_TIMEOUT(200013, SqlState.TIMEOUT_EXPIRED),
  INVALID_PARAMETER_BINDING(200014, SqlState.WRONG_NUMBER_OF_PARAMETERS),
  SESSION_NOT_AVAILABLE(200015, SqlState.CONNECTION_FAILURE);

  public static final String errorMessageResource =
      "net.fabricspark.client.jdbc.jdbc_error_messages";

  private static final Map<Integer, ErrorCode> errorCodeMap = new HashMap<>();

  static {
    for (ErrorCode errorCode : ErrorCode.values()) {
      errorCodeMap.put(errorCode.getMessageCode(), errorCode);
    }
  }

  private final int messageCode;

  private final String sqlState;

  ErrorCode(int messageCode, String sqlState) {
    this.messageCode = messageCode;
    this.sqlState = sqlState;
  }

  public int getMessageCode() {
    return messageCode;
  }

  public String getSqlState() {
    return sqlState;
  }

  public static ErrorCode getByMessageCode(int messageCode) {
    return errorCodeMap.get(messageCode);
  }

  @Override
  public String toString() {
    return "ErrorCode{" + "messageCode=" + messageCode + ", sqlState=" + sqlState + '}';
  }
}
