package org.obligato.binder;

/** The region a scope covers. */
public enum ScopeKind {
  FUNCTION,
  BLOCK,
  BRANCH,
  LOOP,
  ARM
}
