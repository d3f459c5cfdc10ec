package com.pressroom.core.schema;

import com.pressroom.core.domain.Content;
import com.pressroom.core.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import jakarta.validation.metadata.BeanDescriptor;
import jakarta.validation.metadata.ConstraintDescriptor;
import jakarta.validation.metadata.PropertyDescriptor;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates entities against the Bean Validation constraints declared on their
 * fields, and exposes those constraints as an {@link EntitySchema}.
 * 
 * Every write path calls {@link #validate(Object)} before handing an entity to a
 * repository, so a rejected entity never reaches the database.
 */
public class EntityValidator {

    // Defaults applied by entity factories when a value is omitted.
    private static final Map<Class<?>, Map<String, Object>> DECLARED_DEFAULTS = Map.of(
            Content.class, Map.of("status", Content.DEFAULT_STATUS));

    private final Validator validator;
    private final Map<Class<?>, EntitySchema> schemas = new ConcurrentHashMap<>();

    public EntityValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Creates a validator backed by the default Hibernate Validator factory.
     */
    public static EntityValidator createDefault() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return new EntityValidator(factory.getValidator());
    }

    /**
     * Checks an entity against its schema.
     *
     * @throws ValidationException for the first violated attribute in schema order
     */
    public <T> T validate(T entity) {
        Set<ConstraintViolation<T>> violations = validator.validate(entity);
        if (violations.isEmpty()) {
            return entity;
        }
        EntitySchema schema = describe(entity.getClass());
        ConstraintViolation<T> first = violations.stream()
                .min(Comparator.<ConstraintViolation<T>>comparingInt(
                                v -> schema.indexOf(v.getPropertyPath().toString()))
                        .thenComparing(ConstraintViolation::getMessage))
                .orElseThrow();
        throw new ValidationException(first.getPropertyPath().toString(), first.getMessage());
    }

    /**
     * Describes the persisted attributes of an entity type in declaration order.
     */
    public EntitySchema describe(Class<?> entityType) {
        return schemas.computeIfAbsent(entityType, this::buildSchema);
    }

    private EntitySchema buildSchema(Class<?> entityType) {
        BeanDescriptor bean = validator.getConstraintsForClass(entityType);
        Map<String, Object> defaults = DECLARED_DEFAULTS.getOrDefault(entityType, Map.of());
        List<AttributeSchema> attributes = new ArrayList<>();
        for (Field field : entityType.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                continue;
            }
            Set<ConstraintDescriptor<?>> constraints = constraintsOf(bean, field.getName());
            attributes.add(new AttributeSchema(
                    field.getName(),
                    field.getType(),
                    isNullable(constraints, field.getAnnotation(Column.class)),
                    defaults.get(field.getName()),
                    constraints.stream().map(EntityValidator::describeRule).sorted().toList()));
        }
        return new EntitySchema(entityType, attributes);
    }

    private static Set<ConstraintDescriptor<?>> constraintsOf(BeanDescriptor bean, String property) {
        PropertyDescriptor descriptor = bean.getConstraintsForProperty(property);
        return descriptor == null ? Set.of() : descriptor.getConstraintDescriptors();
    }

    private static String describeRule(ConstraintDescriptor<?> descriptor) {
        String name = descriptor.getAnnotation().annotationType().getSimpleName();
        if (descriptor.getAnnotation() instanceof Size size) {
            return size.min() == 0
                    ? name + "(max=" + size.max() + ")"
                    : name + "(min=" + size.min() + ", max=" + size.max() + ")";
        }
        return name;
    }

    private static boolean isNullable(Set<ConstraintDescriptor<?>> constraints, Column column) {
        boolean required = constraints.stream()
                .map(c -> c.getAnnotation().annotationType())
                .anyMatch(t -> t == NotNull.class || t == NotBlank.class);
        if (required) {
            return false;
        }
        return column == null || column.nullable();
    }
}
