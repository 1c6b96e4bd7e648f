package io.intellixity.tabula.jdbc;

public enum BindType { TEXT, INT, LONG, DOUBLE, TIMESTAMP, JSON }
