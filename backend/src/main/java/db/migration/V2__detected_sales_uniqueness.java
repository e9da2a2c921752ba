package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/** Collapses repeated sale rows for one listing and day, then enforces it in the schema. */
public class V2__detected_sales_uniqueness extends BaseJavaMigration {
  private static final String CONSTRAINT_NAME = "detected_sales_platform_listing_date_uniq";

  @Override
  public void migrate(Context context) throws Exception {
    try (Statement statement = context.getConnection().createStatement()) {
      statement.executeUpdate(
          "DELETE FROM detected_sales d "
              + "WHERE EXISTS (SELECT 1 FROM detected_sales k "
              + "WHERE k.platform = d.platform "
              + "AND k.listing_id = d.listing_id "
              + "AND k.detection_date = d.detection_date "
              + "AND k.id < d.id)");
    }

    if (!constraintExists(context.getConnection())) {
      try (Statement statement = context.getConnection().createStatement()) {
        statement.executeUpdate(
            "ALTER TABLE detected_sales "
                + "ADD CONSTRAINT "
                + CONSTRAINT_NAME
                + " UNIQUE (platform, listing_id, detection_date)");
      }
    }
  }

  private boolean constraintExists(Connection connection) throws SQLException {
    String sql =
        "SELECT 1 FROM information_schema.table_constraints "
            + "WHERE LOWER(table_name) = 'detected_sales' "
            + "AND LOWER(constraint_name) = ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, CONSTRAINT_NAME.toLowerCase());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
