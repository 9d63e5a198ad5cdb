package dk.cloudcreate.projections.common.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventTypeTest {
    @Test
    void test_creating_an_EventType_from_a_Class_value() {
        // Given
        var type = ProductAdded.class;

        // When
        var eventType = EventType.of(type);

        // Then
        assertThat(eventType.getJavaTypeName()).isEqualTo(type.getName());
        assertThat((CharSequence) eventType).isEqualTo(EventType.of(type.getName()));
    }

    @Test
    void test_creating_an_EventType_from_an_event_instance() {
        // When
        var eventType = EventType.of(new ProductAdded());

        // Then
        assertThat((CharSequence) eventType).isEqualTo(EventType.of(ProductAdded.class));
    }

    @Test
    void test_sub_types_do_not_share_the_EventType_of_their_super_type() {
        // When
        var superType = EventType.of(ProductAdded.class);
        var subType   = EventType.of(new SpecialProductAdded());

        // Then
        assertThat((CharSequence) subType).isNotEqualTo(superType);
        assertThat(subType.getJavaTypeName()).isNotEqualTo(superType.getJavaTypeName());
    }

    private static class ProductAdded {
    }

    private static class SpecialProductAdded extends ProductAdded {
    }
}
