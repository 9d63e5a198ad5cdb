package dk.cloudcreate.projections.mapping;

@FunctionalInterface
public interface ProjectionMutator<P, E, C> {
    void mutate(P projection, E event, C context);
}
