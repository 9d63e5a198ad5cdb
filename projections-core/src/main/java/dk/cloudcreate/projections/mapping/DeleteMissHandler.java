package dk.cloudcreate.projections.mapping;

/**
 * Custom miss policy for a delete mapping
 */
@FunctionalInterface
public interface DeleteMissHandler<C> {
    void handleMiss(String key, C context);
}
