package dk.cloudcreate.projections.mapping;

/**
 * What {@link ProjectionStorage#create} should do when the projection already exists
 */
public enum DuplicateResolution {
    OVERWRITE,
    IGNORE,
    REJECT
}
