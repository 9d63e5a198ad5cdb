package dk.cloudcreate.projections.mapping;

/**
 * Resolves the key of the projection an event applies to
 */
@FunctionalInterface
public interface KeySelector<E> {
    String keyOf(E event);
}
