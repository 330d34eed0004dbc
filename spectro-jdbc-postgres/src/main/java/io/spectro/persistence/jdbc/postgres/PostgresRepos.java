package io.spectro.persistence.jdbc.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.spectro.persistence.engine.SpectroOptions;
import io.spectro.persistence.jdbc.JdbcSqlClient;
import io.spectro.persistence.repo.SqlRepo;
import io.spectro.persistence.schema.SchemaRegistry;

import javax.sql.DataSource;

/** Wires a {@link SqlRepo} to a PostgreSQL {@link DataSource}, sharing one {@link ObjectMapper} for jsonb. */
public final class PostgresRepos {
  private PostgresRepos() {}

  public static SqlRepo create(DataSource ds, SchemaRegistry schemas) {
    return create(ds, schemas, SpectroOptions.defaults());
  }

  public static SqlRepo create(DataSource ds, SchemaRegistry schemas, SpectroOptions options) {
    return create(ds, schemas, options, new ObjectMapper());
  }

  public static SqlRepo create(DataSource ds, SchemaRegistry schemas, SpectroOptions options, ObjectMapper mapper) {
    JdbcSqlClient client = new JdbcSqlClient(ds, new PostgresValueBinder(mapper));
    return SqlRepo.builder(client, schemas)
        .options(options)
        .valueDecoder(PostgresValueDecoder.withDefaults(mapper))
        .build();
  }
}
