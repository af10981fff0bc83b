package org.carball.dpm.source;

import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Opens read-only JDBC connections to source databases. Access files go through
 * UCanAccess; SQLite files are accepted too, which keeps the pipeline usable on
 * machines without Access data.
 */
@Slf4j
public class SourceConnectionFactory {

    public Connection open(Path database) throws SQLException {
        String url = jdbcUrl(database);
        log.debug("Opening source {}", url);

        if (url.startsWith("jdbc:sqlite:")) {
            SQLiteConfig config = new SQLiteConfig();
            config.setReadOnly(true);
            return DriverManager.getConnection(url, config.toProperties());
        }

        Connection connection = DriverManager.getConnection(url);
        connection.setReadOnly(true);
        return connection;
    }

    static String jdbcUrl(Path database) {
        String name = database.getFileName().toString().toLowerCase(Locale.ROOT);
        String path = database.toAbsolutePath().toString();
        if (name.endsWith(".accdb") || name.endsWith(".mdb")) {
            return "jdbc:ucanaccess://" + path + ";memory=false";
        } else if (name.endsWith(".sqlite") || name.endsWith(".sqlite3") || name.endsWith(".db")) {
            return "jdbc:sqlite:" + path;
        }
        throw new IllegalArgumentException("Unsupported source database type: " + database);
    }
}
