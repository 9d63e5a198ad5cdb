package dk.cloudcreate.projections.mapping;

/**
 * What {@link ProjectionStorage#update} should do when the projection doesn't exist
 */
public enum MissResolution {
    CREATE,
    IGNORE,
    REJECT
}
