package co.fanki.codeintel.config;

import co.fanki.codeintel.shared.Preconditions;
import org.flywaydb.core.Flyway;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.sqlite3.SQLitePlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens the embedded SQLite database files used by the stores.
 *
 * <p>Each store owns one database file. Opening a file creates its parent
 * directory, configures WAL journaling, applies the Flyway migrations of
 * the store, and returns a JDBI instance. Handles are short-lived (one per
 * call), so several JDBI instances may safely point at the same file;
 * SQLite's own locking serializes writers.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SqliteDatabases {

    private static final Logger LOG = LoggerFactory.getLogger(
            SqliteDatabases.class);

    /** Migrations of the project graph database. */
    public static final String GRAPH_MIGRATIONS = "classpath:db/migration/graph";

    /** Migrations of the checkpoint database. */
    public static final String CHECKPOINT_MIGRATIONS =
            "classpath:db/migration/checkpoint";

    private static final int BUSY_TIMEOUT_MILLIS = 5_000;

    private SqliteDatabases() {
    }

    /**
     * Opens (creating if needed) and migrates a database file.
     *
     * @param file the database file
     * @param migrationLocation the Flyway location holding its schema
     * @return a JDBI instance bound to the file
     */
    public static Jdbi open(final Path file, final String migrationLocation) {
        Preconditions.requireNonNull(file, "Database file is required");
        Preconditions.requireNonBlank(migrationLocation,
                "Migration location is required");

        final Path absolute = file.toAbsolutePath().normalize();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (final IOException e) {
            throw new UncheckedIOException(
                    "Cannot create database directory for " + absolute, e);
        }

        final SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);

        final SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + absolute);

        Flyway.configure()
                .dataSource(dataSource)
                .locations(migrationLocation)
                .load()
                .migrate();

        LOG.debug("Opened SQLite database {} ({})", absolute, migrationLocation);

        return Jdbi.create(dataSource).installPlugin(new SQLitePlugin());
    }

}
