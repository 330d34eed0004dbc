package io.spectro.persistence.exec;

/**
 * How {@code Repo.transaction(Propagation, work)} relates to a transaction already open on the
 * repository. {@link #REQUIRED} is the default.
 */
public enum Propagation {
  /** Support a current transaction, create a new one if none exists. */
  REQUIRED,

  /** Support a current transaction, execute non-transactionally if none exists. */
  SUPPORTS,

  /** Support a current transaction, throw an exception if none exists. */
  MANDATORY,

  /** Run the work in an independent transaction on a fresh session. */
  REQUIRES_NEW,

  /** Execute non-transactionally, throw an exception if a transaction exists. */
  NEVER,

  /** Not supported; use {@code Repo.savepoint} for partial rollback. */
  NESTED
}
