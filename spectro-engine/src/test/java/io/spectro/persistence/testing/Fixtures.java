package io.spectro.persistence.testing;

import io.spectro.persistence.row.Row;
import io.spectro.persistence.schema.EntitySchema;
import io.spectro.persistence.schema.FieldDef;
import io.spectro.persistence.schema.FieldType;
import io.spectro.persistence.schema.InMemorySchemaRegistry;
import io.spectro.persistence.schema.RelationshipInfo;
import io.spectro.persistence.schema.RelationshipKind;

/** Blog-style schemas over {@link Row}: users, posts, comments, profiles. */
public final class Fixtures {
  private Fixtures() {}

  public static final EntitySchema<Row> USERS = EntitySchema.<Row>builder("users")
      .id("id", FieldType.LONG)
      .required("name", FieldType.STRING)
      .field("email", FieldType.STRING)
      .field("age", FieldType.INT)
      .field(new FieldDef("displayName", "display_name", FieldType.STRING, false, false))
      .relationship(RelationshipInfo.hasMany("posts", "posts", "user_id"))
      .relationship(RelationshipInfo.hasOne("profile", "profiles", "user_id"))
      .relationship(new RelationshipInfo("friends", RelationshipKind.MANY_TO_MANY, "users", "id", "friend_id"))
      .reader(r -> r)
      .build();

  public static final EntitySchema<Row> POSTS = EntitySchema.<Row>builder("posts")
      .id("id", FieldType.LONG)
      .field("user_id", FieldType.LONG)
      .required("title", FieldType.STRING)
      .field("published", FieldType.BOOLEAN)
      .relationship(RelationshipInfo.belongsTo("author", "users", "user_id"))
      .relationship(RelationshipInfo.hasMany("comments", "comments", "post_id"))
      .reader(r -> r)
      .build();

  public static final EntitySchema<Row> COMMENTS = EntitySchema.<Row>builder("comments")
      .id("id", FieldType.LONG)
      .field("post_id", FieldType.LONG)
      .field("body", FieldType.STRING)
      .reader(r -> r)
      .build();

  public static final EntitySchema<Row> PROFILES = EntitySchema.<Row>builder("profiles")
      .id("id", FieldType.LONG)
      .field("user_id", FieldType.LONG)
      .field("bio", FieldType.STRING)
      .reader(r -> r)
      .build();

  public static InMemorySchemaRegistry registry() {
    return InMemorySchemaRegistry.of(USERS, POSTS, COMMENTS, PROFILES);
  }
}
