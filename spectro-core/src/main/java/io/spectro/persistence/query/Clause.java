package io.spectro.persistence.query;

public enum Clause { AND, OR }
