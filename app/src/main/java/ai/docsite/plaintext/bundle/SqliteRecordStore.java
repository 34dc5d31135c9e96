package ai.docsite.plaintext.bundle;

import ai.docsite.plaintext.convert.ConversionException;
import ai.docsite.plaintext.convert.FailureKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

/**
 * {@link RecordStore} over a bundle SQLite database with a {@code kv_table(key, val)} table.
 */
public class SqliteRecordStore implements RecordStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(SqliteRecordStore.class);
    private static final String QUERY = "SELECT val FROM kv_table WHERE key = ?";

    private final Path path;
    private final Connection connection;

    private SqliteRecordStore(Path path, Connection connection) {
        this.path = path;
        this.connection = connection;
    }

    public static SqliteRecordStore open(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConversionException(FailureKind.INPUT, "Missing record store: " + path);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setReadOnly(true);
        try {
            Connection connection = DriverManager.getConnection("jdbc:sqlite:" + path.toAbsolutePath(), config.toProperties());
            return new SqliteRecordStore(path, connection);
        } catch (SQLException ex) {
            throw new ConversionException(FailureKind.INPUT, "Failed to open record store: " + path, ex);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try (PreparedStatement statement = connection.prepareStatement(QUERY)) {
            statement.setString(1, key);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.ofNullable(resultSet.getString(1)) : Optional.empty();
            }
        } catch (SQLException ex) {
            throw new ConversionException(FailureKind.INPUT, "Failed to read '" + key + "' from " + path, ex);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException ex) {
            LOGGER.warn("Failed to close record store {}: {}", path, ex.getMessage());
        }
    }
}
