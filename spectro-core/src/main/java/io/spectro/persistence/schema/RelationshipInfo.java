package io.spectro.persistence.schema;

import java.util.Objects;

/**
 * A named edge from an owner table to a related table.
 * <p>
 * Key convention:
 * <ul>
 *   <li>{@code HAS_MANY}/{@code HAS_ONE}: {@code localKey} is the owner's column (usually its primary key),
 *       {@code foreignKey} the related table's column that references it.</li>
 *   <li>{@code BELONGS_TO}: {@code foreignKey} is the owner's column holding the reference,
 *       {@code localKey} the related table's referenced column.</li>
 * </ul>
 */
public record RelationshipInfo(String name, RelationshipKind kind, String relatedTable, String localKey, String foreignKey) {
  public RelationshipInfo {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(relatedTable, "relatedTable");
    Objects.requireNonNull(localKey, "localKey");
    Objects.requireNonNull(foreignKey, "foreignKey");
  }

  public static RelationshipInfo hasMany(String name, String relatedTable, String foreignKey) {
    return new RelationshipInfo(name, RelationshipKind.HAS_MANY, relatedTable, "id", foreignKey);
  }

  public static RelationshipInfo hasOne(String name, String relatedTable, String foreignKey) {
    return new RelationshipInfo(name, RelationshipKind.HAS_ONE, relatedTable, "id", foreignKey);
  }

  public static RelationshipInfo belongsTo(String name, String relatedTable, String foreignKey) {
    return new RelationshipInfo(name, RelationshipKind.BELONGS_TO, relatedTable, "id", foreignKey);
  }

  /** Column on the owner rows whose values select related rows. */
  public String ownerKey() {
    return kind.ownerHoldsKey() ? foreignKey : localKey;
  }

  /** Column on the related rows that matches {@link #ownerKey()}. */
  public String relatedKey() {
    return kind.ownerHoldsKey() ? localKey : foreignKey;
  }
}
