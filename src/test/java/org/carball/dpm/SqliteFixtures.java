package org.carball.dpm;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds small SQLite databases that stand in for the Access source in tests.
 */
public final class SqliteFixtures {

    private SqliteFixtures() {
    }

    public static Path createDatabase(Path file, String... statements) throws SQLException {
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        }
        return file;
    }

    /**
     * The two-table source used across the integration tests: a category table keyed by
     * GUID and an item table referencing it and itself.
     */
    public static Path createCategoryItemDatabase(Path file) throws SQLException {
        return createDatabase(file,
                "CREATE TABLE Category (CategoryGUID TEXT PRIMARY KEY, CategoryType TEXT)",
                "CREATE TABLE Item (ItemID INTEGER PRIMARY KEY, "
                        + "CategoryGUID TEXT REFERENCES Category (CategoryGUID), "
                        + "ParentItemID INTEGER REFERENCES Item (ItemID))",
                "INSERT INTO Category VALUES ('c-1', 'Metric')",
                "INSERT INTO Item VALUES (1, 'c-1', NULL)");
    }

    public static List<Map<String, Object>> query(Path file, String sql) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + file.toAbsolutePath());
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            int columns = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columns; i++) {
                    row.put(rs.getMetaData().getColumnLabel(i), rs.getObject(i));
                }
                rows.add(row);
            }
        }
        return rows;
    }
}
