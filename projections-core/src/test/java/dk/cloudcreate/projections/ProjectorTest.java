package dk.cloudcreate.projections;

import dk.cloudcreate.projections.mapping.EventMapBuilder;
import dk.cloudcreate.projections.test_data.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ProjectorTest {
    @Test
    void events_are_projected_in_transaction_and_event_order() {
        // Given
        var handled = new ArrayList<String>();
        var builder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        builder.map(ProductAdded.class).as((event, context) -> handled.add(context.checkpoint() + ":" + event.productKey));
        var projector = new Projector(builder.build());
        var transactions = List.of(Transaction.builder().checkpoint(1).event(new ProductAdded("A", "X")).event(new ProductAdded("B", "X")).build(),
                                   Transaction.builder().checkpoint(2).event(new ProductAdded("C", "X")).build());

        // When
        projector.handle(transactions);

        // Then
        assertThat(handled).containsExactly("1:A", "1:B", "2:C");
    }

    @Test
    void every_event_gets_a_context_describing_its_transaction() {
        // Given
        var contexts = new ArrayList<ProjectionContext>();
        var builder  = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        builder.map(ProductAdded.class).as((event, context) -> contexts.add(context));
        var projector = new Projector(builder.build());
        var transaction = Transaction.builder()
                                     .id("tx-1")
                                     .checkpoint(7)
                                     .streamId("products")
                                     .header("user", "jane")
                                     .event(new ProductAdded("A", "X"), Map.of("origin", "import"))
                                     .build();

        // When
        projector.handle(List.of(transaction));

        // Then
        assertThat(contexts).hasSize(1);
        var context = contexts.get(0);
        assertThat(context.transactionId()).isEqualTo("tx-1");
        assertThat(context.checkpoint()).isEqualTo(7);
        assertThat(context.streamId()).isEqualTo("products");
        assertThat(context.timestamp()).isEqualTo(transaction.timestamp());
        assertThat(context.eventHeaders()).containsEntry("origin", "import");
        assertThat(context.transactionHeaders()).containsEntry("user", "jane");
    }

    @Test
    void a_failing_handler_is_reported_with_the_event_the_transaction_and_the_batch() {
        // Given
        var builder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        builder.map(ProductDiscontinued.class).as((event, context) -> {
            throw new IllegalArgumentException("Broken handler");
        });
        var projector    = new Projector("Catalog", builder.build(), List.of());
        var failingEvent = new ProductDiscontinued("A");
        var transactions = List.of(Transaction.builder().id("tx-1").checkpoint(1).event(new ProductAdded("A", "X")).build(),
                                   Transaction.builder().id("tx-2").checkpoint(2).event(failingEvent).build());

        // When
        var exception = catchThrowableOfType(() -> projector.handle(transactions), ProjectionException.class);

        // Then
        assertThat(exception).isNotNull();
        assertThat(exception.getCause()).isInstanceOf(IllegalArgumentException.class);
        assertThat(exception.getProjector()).contains("Catalog");
        assertThat(exception.getTransactionId()).contains("tx-2");
        assertThat(exception.getCurrentEvent().map(EventEnvelope::body)).contains(failingEvent);
        assertThat(exception.getTransactionBatch()).isEqualTo(transactions);
        assertThat(exception.getChildProjector()).isEmpty();
    }

    @Test
    void projection_exceptions_raised_by_the_event_map_keep_their_message() {
        // Given
        var storage = new RecordingProjectionStorage();
        var builder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        builder.map(ProductDiscontinued.class).asDeleteOf(event -> event.productKey).throwingIfMissing();
        var projector   = new Projector(builder.build(storage));
        var transaction = Transaction.builder().id("tx-1").checkpoint(1).event(new ProductDiscontinued("B")).build();

        // When
        var exception = catchThrowableOfType(() -> projector.handle(List.of(transaction)), ProjectionException.class);

        // Then
        assertThat(exception.getMessage()).contains("'B'");
        assertThat(exception.getTransactionId()).contains("tx-1");
        assertThat(exception.getProjector()).contains(Projector.class.getSimpleName());
    }

    @Test
    void child_projectors_handle_each_event_before_the_parent() {
        // Given
        var handled      = new ArrayList<String>();
        var childBuilder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        childBuilder.map(ProductAdded.class).as((event, context) -> handled.add("child:" + event.productKey));
        var parentBuilder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        parentBuilder.map(ProductAdded.class).as((event, context) -> handled.add("parent:" + event.productKey));
        var projector = new Projector(parentBuilder.build(), new Projector(childBuilder.build()));

        // When
        projector.handle(List.of(Transaction.builder().checkpoint(1).event(new ProductAdded("A", "X")).event(new ProductAdded("B", "X")).build()));

        // Then
        assertThat(handled).containsExactly("child:A", "parent:A", "child:B", "parent:B");
    }

    @Test
    void a_failing_child_projector_is_identified_in_the_exception() {
        // Given
        var childBuilder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        childBuilder.map(ProductAdded.class).as((event, context) -> {
            throw new IllegalStateException("Child failed");
        });
        var parentHandled = new ArrayList<Object>();
        var parentBuilder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        parentBuilder.map(ProductAdded.class).as((event, context) -> parentHandled.add(event));
        var child     = new Projector("Lookup", childBuilder.build(), List.of());
        var projector = new Projector("Catalog", parentBuilder.build(), List.of(child));

        // When
        var exception = catchThrowableOfType(() -> projector.handle(List.of(Transaction.builder().checkpoint(1).event(new ProductAdded("A", "X")).build())),
                                             ProjectionException.class);

        // Then
        assertThat(exception.getChildProjector()).contains("Lookup");
        assertThat(exception.getProjector()).contains("Catalog");
        assertThat(exception.getMessage()).contains("childProjector: 'Lookup'");
        assertThat(parentHandled).isEmpty();
    }

    @Test
    void child_projectors_cannot_be_null() {
        // Given
        var builder = new EventMapBuilder<ProductCatalogEntry, ProjectionContext>();
        var eventMap = builder.build();

        // Then
        assertThatThrownBy(() -> new Projector(eventMap, (Projector) null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
