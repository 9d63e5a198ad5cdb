package dk.cloudcreate.projections.mapping;

/**
 * Result of a {@link ProjectionStorage} create or update
 */
public enum ProjectionOutcome {
    CREATED,
    UPDATED,
    /**
     * The duplicate/miss was ignored, the mutation wasn't applied
     */
    SKIPPED,
    /**
     * The duplicate/miss was rejected, the mutation wasn't applied
     */
    REJECTED
}
