package org.obligato.binder;

/** How a binding was introduced. */
public enum BindingKind {
  PARAMETER,
  LET,
  FOR,
  MATCH
}
