package io.spectro.persistence.schema;

/** Reads a declared field's value from an entity. */
@FunctionalInterface
public interface FieldAccessor<T> {
  Object get(T entity, String field);
}
