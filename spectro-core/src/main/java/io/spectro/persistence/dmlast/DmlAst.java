package io.spectro.persistence.dmlast;

/** Backend-agnostic write statement, rendered to SQL by the engine. */
public interface DmlAst {
  String table();
}
