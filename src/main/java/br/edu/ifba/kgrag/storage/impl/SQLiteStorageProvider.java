package br.edu.ifba.kgrag.storage.impl;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import br.edu.ifba.kgrag.storage.GraphStorage;
import br.edu.ifba.kgrag.storage.GraphStoreException;
import br.edu.ifba.kgrag.storage.VectorStorage;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;

/**
 * CDI producer that creates the SQLite graph and vector stores.
 *
 * <p>Active when {@code kgrag.storage.backend=sqlite}. Opens the database,
 * runs schema migrations on startup and fails the application when they
 * cannot be applied.</p>
 *
 * <pre>
 * kgrag.storage.backend=sqlite
 * kgrag.storage.sqlite.path=data/kgrag.db
 * </pre>
 */
@ApplicationScoped
@IfBuildProperty(name = "kgrag.storage.backend", stringValue = "sqlite", enableIfMissing = true)
public class SQLiteStorageProvider {

    private static final Logger LOG = Logger.getLogger(SQLiteStorageProvider.class);

    @ConfigProperty(name = "kgrag.storage.sqlite.path", defaultValue = "data/kgrag.db")
    String databasePath;

    @ConfigProperty(name = "kgrag.storage.sqlite.read-pool-size", defaultValue = "4")
    int readPoolSize;

    @ConfigProperty(name = "kgrag.storage.sqlite.busy-timeout", defaultValue = "30000")
    long busyTimeoutMs;

    @ConfigProperty(name = "kgrag.storage.sqlite.wal-mode", defaultValue = "true")
    boolean walMode;

    private SQLiteConnectionManager connectionManager;
    private SQLiteGraphStorage graphStorage;
    private SQLiteVectorStorage vectorStorage;

    @PostConstruct
    void initialize() {
        LOG.infof("Initializing SQLite storage with database: %s", databasePath);
        connectionManager = new SQLiteConnectionManager(
            databasePath,
            Duration.ofMillis(busyTimeoutMs),
            walMode,
            readPoolSize
        );
        try {
            runMigrations();
        } catch (SQLException e) {
            throw new GraphStoreException("Failed to run SQLite schema migrations", e);
        }
        LOG.info("SQLite storage initialized successfully");
    }

    @PreDestroy
    void shutdown() {
        LOG.info("Shutting down SQLite storage");
        closeQuietly(graphStorage);
        closeQuietly(vectorStorage);
        if (connectionManager != null) {
            connectionManager.close();
        }
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "kgrag.storage.backend", stringValue = "sqlite", enableIfMissing = true)
    public GraphStorage produceGraphStorage() {
        if (graphStorage == null) {
            graphStorage = new SQLiteGraphStorage(connectionManager);
            graphStorage.initialize().join();
        }
        return graphStorage;
    }

    @Produces
    @ApplicationScoped
    @IfBuildProperty(name = "kgrag.storage.backend", stringValue = "sqlite", enableIfMissing = true)
    public VectorStorage produceVectorStorage() {
        if (vectorStorage == null) {
            vectorStorage = new SQLiteVectorStorage(connectionManager);
            vectorStorage.initialize().join();
        }
        return vectorStorage;
    }

    private void runMigrations() throws SQLException {
        SQLiteSchemaMigrator migrator = new SQLiteSchemaMigrator();
        Connection conn = connectionManager.getWriteConnection();
        try {
            int version = migrator.migrateToLatest(conn);
            LOG.infof("Schema at version %d", version);
        } finally {
            connectionManager.releaseWriteConnection(conn);
        }
    }

    private void closeQuietly(AutoCloseable closeable) {
        if (closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                LOG.warnf("Failed to close storage: %s", e.getMessage());
            }
        }
    }
}
