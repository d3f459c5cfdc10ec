package com.pressroom.core.schema;

import java.util.List;

/**
 * One attribute of an entity schema.
 *
 * @param name         attribute name as declared on the entity
 * @param type         Java type of the attribute
 * @param nullable     whether the attribute may be absent
 * @param defaultValue value a freshly constructed entity carries, or {@code null}
 * @param rules        validation rules, e.g. {@code NotBlank} or {@code Size(max=255)}
 */
public record AttributeSchema(
        String name,
        Class<?> type,
        boolean nullable,
        Object defaultValue,
        List<String> rules
) {
    public AttributeSchema {
        rules = List.copyOf(rules);
    }
}
