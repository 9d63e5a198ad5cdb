package dk.cloudcreate.projections.test_data;

import dk.cloudcreate.projections.ProjectionContext;
import dk.cloudcreate.projections.mapping.*;

import java.util.*;
import java.util.function.Consumer;

/**
 * {@link ProjectionStorage} backed by a map that records every primitive operation it's asked to perform
 */
public class RecordingProjectionStorage implements ProjectionStorage<ProductCatalogEntry, ProjectionContext> {
    public final Map<String, ProductCatalogEntry> projections = new LinkedHashMap<>();
    public final List<String>                     calls       = new ArrayList<>();
    public final List<ProjectionOutcome>          outcomes    = new ArrayList<>();

    public ProductCatalogEntry add(String key, String category) {
        var entry = new ProductCatalogEntry(key);
        entry.category = category;
        projections.put(key, entry);
        return entry;
    }

    @Override
    public ProjectionOutcome create(String key, ProjectionContext context, Consumer<ProductCatalogEntry> mutation, DuplicateResolver<ProductCatalogEntry> onDuplicate) {
        calls.add("create:" + key);
        var existing = projections.get(key);
        if (existing != null) {
            var resolution = onDuplicate.resolve(existing);
            if (resolution == DuplicateResolution.OVERWRITE) {
                mutation.accept(existing);
                return record(ProjectionOutcome.UPDATED);
            }
            return record(resolution == DuplicateResolution.IGNORE ? ProjectionOutcome.SKIPPED : ProjectionOutcome.REJECTED);
        }
        var entry = new ProductCatalogEntry(key);
        mutation.accept(entry);
        projections.put(key, entry);
        return record(ProjectionOutcome.CREATED);
    }

    @Override
    public ProjectionOutcome update(String key, ProjectionContext context, Consumer<ProductCatalogEntry> mutation, MissResolver onMissing) {
        calls.add("update:" + key);
        var existing = projections.get(key);
        if (existing != null) {
            mutation.accept(existing);
            return record(ProjectionOutcome.UPDATED);
        }
        var resolution = onMissing.resolve(key);
        if (resolution == MissResolution.CREATE) {
            var entry = new ProductCatalogEntry(key);
            mutation.accept(entry);
            projections.put(key, entry);
            return record(ProjectionOutcome.CREATED);
        }
        return record(resolution == MissResolution.IGNORE ? ProjectionOutcome.SKIPPED : ProjectionOutcome.REJECTED);
    }

    @Override
    public boolean delete(String key, ProjectionContext context) {
        calls.add("delete:" + key);
        return projections.remove(key) != null;
    }

    @Override
    public void custom(ProjectionContext context, Runnable action) {
        calls.add("custom");
        action.run();
    }

    private ProjectionOutcome record(ProjectionOutcome outcome) {
        outcomes.add(outcome);
        return outcome;
    }
}
