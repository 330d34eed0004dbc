package io.spectro.persistence.tx;

public enum TransactionState {
  IDLE,
  ACTIVE,
  COMMITTED,
  ROLLED_BACK;

  public boolean terminal() { return this == COMMITTED || this == ROLLED_BACK; }
}
