package net.fabricspark.client.jdbc;

/** SQLSTATE values reported through {@link LivySQLException#getSQLState()}. */
public final class SqlState {
  public static final String WRONG_NUMBER_OF_PARAMETERS = "07001";
  public static final String SQLCLIENT_UNABLE_TO_ESTABLISH_SQLCONNECTION = "08001";
  public static final String CONNECTION_FAILURE = "08006";
  public static final String INVALID_AUTHORIZATION_SPECIFICATION = "28000";
  public static final String SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION = "42000";
  public static final String QUERY_CANCELED = "57014";
  public static final String SYSTEM_ERROR = "58000";
  public static final String IO_ERROR = "58030";
  public static final String TIMEOUT_EXPIRED = "HYT00";
  public static final String INTERNAL_ERROR = "XX000";

  private SqlState() {}
}
