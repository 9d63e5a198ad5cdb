package dk.cloudcreate.projections.common.types;

import dk.cloudcreate.essentials.types.*;

import java.util.UUID;

/**
 * Identifies a subscription on an event source. Only used for diagnostics and to correlate log statements
 */
public class SubscriptionId extends CharSequenceType<SubscriptionId> implements Identifier {
    public SubscriptionId(CharSequence value) {
        super(value);
    }

    public static SubscriptionId of(CharSequence value) {
        return new SubscriptionId(value);
    }

    public static SubscriptionId random() {
        return new SubscriptionId(UUID.randomUUID().toString());
    }
}
