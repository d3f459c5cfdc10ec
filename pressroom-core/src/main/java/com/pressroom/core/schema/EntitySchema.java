package com.pressroom.core.schema;

import java.util.List;
import java.util.Optional;

/**
 * Ordered attribute schema of an entity type, in declaration order.
 */
public record EntitySchema(Class<?> entityType, List<AttributeSchema> attributes) {

    public EntitySchema {
        attributes = List.copyOf(attributes);
    }

    public Optional<AttributeSchema> attribute(String name) {
        return attributes.stream().filter(a -> a.name().equals(name)).findFirst();
    }

    public List<String> attributeNames() {
        return attributes.stream().map(AttributeSchema::name).toList();
    }

    /**
     * Position of an attribute in the schema, or {@link Integer#MAX_VALUE} if unknown.
     */
    public int indexOf(String name) {
        for (int i = 0; i < attributes.size(); i++) {
            if (attributes.get(i).name().equals(name)) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }
}
