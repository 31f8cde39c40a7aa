package io.intellixity.ybadapter.relation;

public enum RelationConfigChangeAction {
  ALTER,
  CREATE,
  DROP
}
