package com.gentoro.usml.ast;

public enum MappingKind {
  SCALAR,
  ARRAY
}
