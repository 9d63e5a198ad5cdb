package dk.cloudcreate.projections.mapping;

/**
 * Custom duplicate policy for a create mapping
 */
@FunctionalInterface
public interface DuplicateHandler<P, E, C> {
    /**
     * @param existingProjection the projection that already exists
     * @return true if the create mutation should be applied to the existing projection, false to ignore the event
     */
    boolean shouldOverwrite(P existingProjection, E event, C context);
}
