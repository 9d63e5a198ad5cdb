package dk.cloudcreate.projections.common.types;

import dk.cloudcreate.essentials.types.*;

/**
 * Identifies a projector. The checkpoint a projector has reached is persisted under its {@link ProjectorId}
 */
public class ProjectorId extends CharSequenceType<ProjectorId> implements Identifier {
    public ProjectorId(CharSequence value) {
        super(value);
    }

    public static ProjectorId of(CharSequence value) {
        return new ProjectorId(value);
    }
}
