package dk.cloudcreate.projections.checkpoint.postgresql;

import dk.cloudcreate.projections.common.types.ProjectorId;
import dk.cloudcreate.projections.tracking.*;
import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link CheckpointStore} that keeps one row per projector in a Postgresql table.<br>
 * The table is created (if it doesn't already exist) when the store is created.
 */
public class PostgresqlCheckpointStore implements CheckpointStore {
    private static final Logger  log                  = LoggerFactory.getLogger(PostgresqlCheckpointStore.class);
    private static final Pattern VALID_SQL_IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]{0,62}$");

    public static final String DEFAULT_CHECKPOINTS_TABLE_NAME = "projector_checkpoints";

    private final Jdbi   jdbi;
    private final String checkpointsTableName;

    /**
     * Create a checkpoint store using the {@link #DEFAULT_CHECKPOINTS_TABLE_NAME}
     */
    public PostgresqlCheckpointStore(Jdbi jdbi) {
        this(jdbi, Optional.empty());
    }

    /**
     * @param jdbi                 the jdbi instance
     * @param checkpointsTableName the name of the table where the checkpoints are stored. Defaults to {@link #DEFAULT_CHECKPOINTS_TABLE_NAME}
     */
    public PostgresqlCheckpointStore(Jdbi jdbi, Optional<String> checkpointsTableName) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
        requireNonNull(checkpointsTableName, "No checkpointsTableName option provided");
        this.checkpointsTableName = checkpointsTableName.orElse(DEFAULT_CHECKPOINTS_TABLE_NAME);
        requireTrue(VALID_SQL_IDENTIFIER.matcher(this.checkpointsTableName).matches(),
                    msg("'{}' is not a valid table name", this.checkpointsTableName));
        initializeCheckpointsTable();
    }

    protected void initializeCheckpointsTable() {
        try {
            jdbi.useTransaction(handle -> {
                var rowsUpdated = handle.execute("CREATE TABLE IF NOT EXISTS " + checkpointsTableName + " (\n" +
                                                         "projector_id TEXT NOT NULL,\n" +
                                                         "last_checkpoint bigint NOT NULL,\n" +
                                                         "last_updated_ts TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                                         "PRIMARY KEY (projector_id)\n" +
                                                         ")");
                if (rowsUpdated == 1) {
                    log.info("Created the '{}' checkpoints table", checkpointsTableName);
                }
            });
        } catch (JdbiException e) {
            throw new CheckpointStoreException(null, msg("Failed to create the '{}' checkpoints table", checkpointsTableName), e);
        }
    }

    public String getCheckpointsTableName() {
        return checkpointsTableName;
    }

    @Override
    public Optional<Long> loadCheckpoint(ProjectorId projectorId) {
        requireNonNull(projectorId, "No projectorId provided");
        try {
            var checkpoint = jdbi.withHandle(handle -> handle.createQuery("SELECT last_checkpoint FROM " + checkpointsTableName + " WHERE projector_id = :projector_id")
                                                             .bind("projector_id", projectorId.value())
                                                             .mapTo(Long.class)
                                                             .findOne());
            log.trace("[{}] Loaded checkpoint {}", projectorId, checkpoint);
            return checkpoint;
        } catch (JdbiException e) {
            throw new CheckpointStoreException(projectorId, "Failed to load the checkpoint", e);
        }
    }

    @Override
    public void saveCheckpoint(ProjectorId projectorId, long checkpoint) {
        requireNonNull(projectorId, "No projectorId provided");
        try {
            jdbi.useTransaction(handle -> {
                var rowsUpdated = handle.createUpdate("INSERT INTO " + checkpointsTableName + " (projector_id, last_checkpoint, last_updated_ts) " +
                                                              "VALUES (:projector_id, :last_checkpoint, :last_updated_ts) " +
                                                              "ON CONFLICT (projector_id) DO UPDATE SET " +
                                                              "last_checkpoint = EXCLUDED.last_checkpoint, " +
                                                              "last_updated_ts = EXCLUDED.last_updated_ts")
                                        .bind("projector_id", projectorId.value())
                                        .bind("last_checkpoint", checkpoint)
                                        .bind("last_updated_ts", OffsetDateTime.now(ZoneOffset.UTC))
                                        .execute();
                if (rowsUpdated != 1) {
                    throw new CheckpointStoreException(projectorId, msg("Expected to save checkpoint {} in a single row, but {} rows were updated", checkpoint, rowsUpdated));
                }
            });
            log.trace("[{}] Saved checkpoint {}", projectorId, checkpoint);
        } catch (JdbiException e) {
            throw new CheckpointStoreException(projectorId, msg("Failed to save checkpoint {}", checkpoint), e);
        }
    }

    @Override
    public void resetCheckpoint(ProjectorId projectorId) {
        requireNonNull(projectorId, "No projectorId provided");
        try {
            var rowsUpdated = jdbi.withHandle(handle -> handle.createUpdate("DELETE FROM " + checkpointsTableName + " WHERE projector_id = :projector_id")
                                                              .bind("projector_id", projectorId.value())
                                                              .execute());
            log.debug("[{}] Reset checkpoint ({} row(s) deleted)", projectorId, rowsUpdated);
        } catch (JdbiException e) {
            throw new CheckpointStoreException(projectorId, "Failed to reset the checkpoint", e);
        }
    }
}
