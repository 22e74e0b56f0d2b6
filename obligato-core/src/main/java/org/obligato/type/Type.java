package org.obligato.type;

import com.google.errorprone.annotations.Immutable;
import org.jspecify.annotations.Nullable;
import org.obligato.tree.Pretty;
import org.obligato.tree.Tree.Expression;

/** A resolved semantic type. */
@Immutable
public abstract class Type {

  /** Type kinds. */
  public enum Kind {
    INT,
    REAL,
    BOOL,
    STRING,
    UNIT,
    LIST,
    LINEAR,
    RECORD,
    ENUM,
    OPAQUE,
    REFINED,
    ERROR,
    ANY
  }

  public static final Type INT = new PrimType(Kind.INT, "Int");
  public static final Type REAL = new PrimType(Kind.REAL, "Real");
  public static final Type BOOL = new PrimType(Kind.BOOL, "Bool");
  public static final Type STRING = new PrimType(Kind.STRING, "String");
  public static final Type UNIT = new PrimType(Kind.UNIT, "Unit");

  /** The type of an erroneous expression; compatible with everything so errors do not cascade. */
  public static final Type ERROR = new PrimType(Kind.ERROR, "<error>");

  /** The element type of the generic built-ins. */
  public static final Type ANY = new PrimType(Kind.ANY, "Any");

  public abstract Kind kind();

  /** The type with all refinements stripped. */
  public Type base() {
    return this;
  }

  public boolean isNumeric() {
    Kind k = base().kind();
    return k == Kind.INT || k == Kind.REAL;
  }

  public boolean isLinear() {
    return base().kind() == Kind.LINEAR;
  }

  /** Base-level assignability; refinements are checked by obligations, not here. */
  public boolean isAssignableTo(Type target) {
    Type from = base();
    Type to = target.base();
    if (from.kind() == Kind.ERROR
        || to.kind() == Kind.ERROR
        || from.kind() == Kind.ANY
        || to.kind() == Kind.ANY) {
      return true;
    }
    if (from.kind() != to.kind()) {
      return false;
    }
    switch (from.kind()) {
      case LIST:
      case LINEAR:
        return ((ElemType) from).elem().isAssignableTo(((ElemType) to).elem());
      case RECORD:
      case ENUM:
      case OPAQUE:
        return ((NamedType) from).name().equals(((NamedType) to).name());
      default:
        return true;
    }
  }

  @Override
  public abstract String toString();

  @Override
  public int hashCode() {
    return toString().hashCode();
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return obj instanceof Type && toString().equals(obj.toString());
  }

  public static Type list(Type elem) {
    return new ElemType(Kind.LIST, elem);
  }

  public static Type linear(Type elem) {
    return new ElemType(Kind.LINEAR, elem);
  }

  public static Type record(String name) {
    return new NamedType(Kind.RECORD, name);
  }

  public static Type enumType(String name) {
    return new NamedType(Kind.ENUM, name);
  }

  public static Type opaque(String name) {
    return new NamedType(Kind.OPAQUE, name);
  }

  public static RefinedType refined(Type base, String var, Expression predicate) {
    return new RefinedType(base, var, predicate);
  }

  /** A primitive type. */
  @Immutable
  public static final class PrimType extends Type {
    private final Kind kind;
    private final String name;

    private PrimType(Kind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** {@code List[T]} or {@code Linear[T]}. */
  @Immutable
  public static final class ElemType extends Type {
    private final Kind kind;
    private final Type elem;

    private ElemType(Kind kind, Type elem) {
      this.kind = kind;
      this.elem = elem;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    public Type elem() {
      return elem;
    }

    @Override
    public String toString() {
      return (kind == Kind.LIST ? "List[" : "Linear[") + elem + "]";
    }
  }

  /** A record, enum or opaque type, identified by name. */
  @Immutable
  public static final class NamedType extends Type {
    private final Kind kind;
    private final String name;

    private NamedType(Kind kind, String name) {
      this.kind = kind;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    public String name() {
      return name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** A refinement type {@code {var: base | predicate}}. */
  @Immutable
  public static final class RefinedType extends Type {
    private final Type base;
    private final String var;
    private final Expression predicate;

    private RefinedType(Type base, String var, Expression predicate) {
      this.base = base;
      this.var = var;
      this.predicate = predicate;
    }

    @Override
    public Kind kind() {
      return Kind.REFINED;
    }

    @Override
    public Type base() {
      return base.base();
    }

    /** The directly refined type, which may itself be refined. */
    public Type refinedBase() {
      return base;
    }

    public String var() {
      return var;
    }

    public Expression predicate() {
      return predicate;
    }

    @Override
    public String toString() {
      return "{" + var + ": " + base + " | " + Pretty.pretty(predicate) + "}";
    }
  }
}
