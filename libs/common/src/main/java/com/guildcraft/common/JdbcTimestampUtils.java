/*
 * Where: shared JDBC helpers
 * What: Converts Instant values to and from java.sql.Timestamp
 * Why: The PostgreSQL driver cannot infer a SQL type for a bare Instant parameter
 */
package com.guildcraft.common;

import java.sql.Timestamp;
import java.time.Instant;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Assumption: an Instant is a UTC point in time and Timestamp.from passes it through unchanged.
  // Trade-off: a non-UTC database session zone is ignored; the application stays on UTC.
  // Reason: binding an explicit type avoids depending on the driver's inference.
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }
}
