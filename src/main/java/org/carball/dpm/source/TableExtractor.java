package org.carball.dpm.source;

import org.carball.dpm.model.schema.Column;
import org.carball.dpm.model.schema.Table;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads the complete row set of a table in one query.
 */
public class TableExtractor {

    public List<Map<String, Object>> readRows(Connection connection, Table table) throws SQLException {
        String quote = identifierQuote(connection);
        List<Column> columns = table.getColumns();
        String sql = "SELECT "
                + columns.stream().map(c -> quote + c.getName() + quote).collect(Collectors.joining(", "))
                + " FROM " + quote + table.getName() + quote;

        List<Map<String, Object>> rows = new ArrayList<>();
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(sql)) {
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i).getName(), rs.getObject(i + 1));
                }
                rows.add(row);
            }
        }
        return rows;
    }

    private static String identifierQuote(Connection connection) throws SQLException {
        String quote = connection.getMetaData().getIdentifierQuoteString();
        return quote == null || quote.isBlank() ? "" : quote.trim();
    }
}
