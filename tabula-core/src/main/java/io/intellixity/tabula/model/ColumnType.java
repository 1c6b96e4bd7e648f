package io.intellixity.tabula.model;

public enum ColumnType { TEXT, NUMBER }
