package dk.cloudcreate.projections.mapping;

@FunctionalInterface
public interface EventPredicate<E, C> {
    boolean test(E event, C context);
}
