package dk.cloudcreate.projections.mapping;

/**
 * Custom miss policy for an update mapping
 */
@FunctionalInterface
public interface UpdateMissHandler<C> {
    /**
     * @param key the key of the missing projection
     * @return true if the projection should be created (and then updated), false to ignore the event
     */
    boolean shouldCreate(String key, C context);
}
