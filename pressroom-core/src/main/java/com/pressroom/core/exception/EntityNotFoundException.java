package com.pressroom.core.exception;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Thrown when a referenced primary or foreign key does not resolve.
 * <p>
 * Carries more than one kind when the caller deliberately does not distinguish
 * which of several lookups failed (content/tag association checks).
 */
public class EntityNotFoundException extends PressroomException {

    private final Set<EntityKind> kinds;

    public EntityNotFoundException(EntityKind kind) {
        this(EnumSet.of(kind));
    }

    public EntityNotFoundException(EntityKind first, EntityKind... rest) {
        this(EnumSet.of(first, rest));
    }

    private EntityNotFoundException(EnumSet<EntityKind> kinds) {
        super(describe(kinds));
        this.kinds = Collections.unmodifiableSet(kinds);
    }

    public Set<EntityKind> getKinds() {
        return kinds;
    }

    private static String describe(Set<EntityKind> kinds) {
        return kinds.stream()
                .map(EntityKind::getDisplayName)
                .collect(Collectors.joining(" or ")) + " not found";
    }
}
