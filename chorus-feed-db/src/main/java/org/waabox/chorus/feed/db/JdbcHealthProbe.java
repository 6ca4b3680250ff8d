package org.waabox.chorus.feed.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;

import javax.sql.DataSource;

import org.waabox.chorus.health.HealthProbe;

/**
 * A {@link HealthProbe} that runs {@code SELECT 1} against a database.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcHealthProbe implements HealthProbe {

  /** Seconds before the probe query gives up. */
  private static final int QUERY_TIMEOUT_SECONDS = 5;

  /** The probed data source, never null. */
  private final DataSource dataSource;

  /**
   * Creates a new probe.
   *
   * @param theDataSource the data source to probe, never null
   */
  public JdbcHealthProbe(final DataSource theDataSource) {
    dataSource = Objects.requireNonNull(theDataSource,
        "dataSource cannot be null");
  }

  /** {@inheritDoc} */
  @Override
  public boolean probe() throws SQLException {
    try (final Connection conn = dataSource.getConnection();
         final PreparedStatement ps = conn.prepareStatement("SELECT 1")) {
      ps.setQueryTimeout(QUERY_TIMEOUT_SECONDS);
      try (final ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
