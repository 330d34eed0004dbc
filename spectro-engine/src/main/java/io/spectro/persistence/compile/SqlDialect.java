package io.spectro.persistence.compile;

import io.spectro.persistence.dmlast.DmlAst;
import io.spectro.persistence.query.Query;
import io.spectro.persistence.schema.SchemaRegistry;

/** Pure translation of queries and write ASTs into parameterized SQL. */
public interface SqlDialect {
  String id();

  SqlStatement compileSelect(Query query, SchemaRegistry schemas);

  /** {@code SELECT COUNT(*)} over the query's filters; ordering and paging are ignored. */
  SqlStatement compileCount(Query query, SchemaRegistry schemas);

  SqlStatement renderDml(DmlAst dml);
}
