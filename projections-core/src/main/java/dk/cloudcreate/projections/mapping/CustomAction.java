package dk.cloudcreate.projections.mapping;

@FunctionalInterface
public interface CustomAction<E, C> {
    void handle(E event, C context);
}
