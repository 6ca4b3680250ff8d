package org.waabox.chorus.feed.db;

import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

import javax.sql.DataSource;

/**
 * Configuration for the JDBC change-feed.
 *
 * <p>Holds the {@link DataSource}, the name of the change-log table, and
 * the interval at which the table is polled.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and
 * {@link #create(DataSource, String, Duration)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcChangeFeedConfig {

  /** Default name of the change-log table. */
  private static final String DEFAULT_TABLE_NAME = "chorus_change_log";

  /** Default poll interval (2 seconds). */
  private static final Duration DEFAULT_POLL_INTERVAL =
      Duration.ofSeconds(2);

  /** Table names are concatenated into SQL, so only identifiers pass. */
  private static final Pattern TABLE_NAME =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The change-log table name, never null. */
  private final String tableName;

  /** The polling interval, never null. */
  private final Duration pollInterval;

  /** Private constructor; use static factories.
   *
   * @param theDataSource   the JDBC data source
   * @param theTableName    the change-log table name
   * @param thePollInterval the poll interval
   */
  private JdbcChangeFeedConfig(final DataSource theDataSource,
      final String theTableName, final Duration thePollInterval) {
    dataSource = theDataSource;
    tableName = theTableName;
    pollInterval = thePollInterval;
  }

  /**
   * Creates a configuration with all custom values.
   *
   * @param dataSource   the JDBC data source, never null
   * @param tableName    the change-log table name, a plain SQL identifier
   * @param pollInterval the polling interval, must be positive
   *
   * @return a new configuration instance, never null
   */
  public static JdbcChangeFeedConfig create(final DataSource dataSource,
      final String tableName, final Duration pollInterval) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(tableName, "tableName cannot be null");
    Objects.requireNonNull(pollInterval, "pollInterval cannot be null");

    if (!TABLE_NAME.matcher(tableName).matches()) {
      throw new IllegalArgumentException(
          "tableName must be a plain SQL identifier, got: '" + tableName
              + "'");
    }
    if (pollInterval.isZero() || pollInterval.isNegative()) {
      throw new IllegalArgumentException(
          "pollInterval must be positive, got: " + pollInterval);
    }

    return new JdbcChangeFeedConfig(dataSource, tableName, pollInterval);
  }

  /**
   * Creates a configuration with default table name and poll interval.
   *
   * <p>Defaults:
   * <ul>
   *   <li>Table name: {@code chorus_change_log}</li>
   *   <li>Poll interval: 2 seconds</li>
   * </ul>
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcChangeFeedConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_TABLE_NAME, DEFAULT_POLL_INTERVAL);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the change-log table name.
   *
   * @return the table name, never null
   */
  public String tableName() {
    return tableName;
  }

  /**
   * Returns the polling interval.
   *
   * @return the poll interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }
}
