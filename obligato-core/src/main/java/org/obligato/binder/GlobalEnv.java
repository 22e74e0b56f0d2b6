package org.obligato.binder;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.obligato.diag.DiagnosticKind;
import org.obligato.diag.DiagnosticLog;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.CompUnit;
import org.obligato.tree.Tree.Decl;
import org.obligato.tree.Tree.EnumDecl;
import org.obligato.tree.Tree.FieldDecl;
import org.obligato.tree.Tree.FnDecl;
import org.obligato.tree.Tree.Param;
import org.obligato.tree.Tree.RecordDecl;
import org.obligato.tree.Tree.Ty;
import org.obligato.type.Type;
import org.obligato.type.TypeResolver;

/** The top-level declarations visible from every function: user declarations and the prelude. */
public final class GlobalEnv implements TypeResolver.TypeScope {

  private static final ImmutableSet<String> BUILTIN_TYPES =
      ImmutableSet.of("Int", "Real", "Bool", "String", "Unit", "List", "Linear");

  public static GlobalEnv create(CompUnit unit, DiagnosticLog log) {
    return new GlobalEnv(unit, log);
  }

  private final ImmutableMap<String, Decl> types;
  private final ImmutableMap<String, EnumDecl> variants;
  private final ImmutableMap<String, FnSignature> functions;
  private final TypeResolver resolver;

  private GlobalEnv(CompUnit unit, DiagnosticLog log) {
    Map<String, Decl> types = new LinkedHashMap<>();
    Map<String, EnumDecl> variants = new LinkedHashMap<>();
    for (Decl decl : unit.decls()) {
      switch (decl.kind()) {
        case RECORD_DECL:
        case ENUM_DECL:
          if (BUILTIN_TYPES.contains(decl.name())
              || decl.name().equals(Prelude.FILE_HANDLE)
              || types.containsKey(decl.name())) {
            duplicate(log, decl, types.get(decl.name()));
            continue;
          }
          types.put(decl.name(), decl);
          if (decl.kind() == Tree.Kind.ENUM_DECL) {
            for (String variant : ((EnumDecl) decl).variants()) {
              variants.putIfAbsent(variant, (EnumDecl) decl);
            }
          } else {
            checkFields((RecordDecl) decl, log);
          }
          break;
        default:
          break;
      }
    }
    this.types = ImmutableMap.copyOf(types);
    this.variants = ImmutableMap.copyOf(variants);
    this.resolver = new TypeResolver(this, log);

    Map<String, FnSignature> functions = new LinkedHashMap<>();
    TypeResolver preludeResolver =
        new TypeResolver(
            name -> name.equals(Prelude.TYPE_VAR) ? Optional.of(Type.ANY) : lookupType(name),
            log);
    for (FnDecl decl : Prelude.decls()) {
      functions.put(decl.name(), signature(decl, preludeResolver, true));
    }
    for (Decl decl : unit.decls()) {
      if (decl.kind() != Tree.Kind.FN_DECL) {
        continue;
      }
      FnSignature existing = functions.get(decl.name());
      if (existing != null) {
        duplicate(log, decl, existing.builtin() ? null : existing.declaration());
        continue;
      }
      functions.put(decl.name(), signature((FnDecl) decl, resolver, false));
    }
    this.functions = ImmutableMap.copyOf(functions);
  }

  private static void duplicate(DiagnosticLog log, Decl decl, @Nullable Decl previous) {
    ImmutableList<NodeId> secondary =
        previous == null ? ImmutableList.of() : ImmutableList.of(previous.id());
    log.report(
        DiagnosticKind.DUPLICATE_DECLARATION,
        decl.id(),
        secondary,
        ImmutableMap.of("name", decl.name()),
        decl.name());
  }

  private static void checkFields(RecordDecl decl, DiagnosticLog log) {
    Set<String> seen = new HashSet<>();
    for (FieldDecl field : decl.fields()) {
      if (!seen.add(field.name())) {
        log.report(
            DiagnosticKind.DUPLICATE_FIELD,
            field.id(),
            ImmutableList.of(decl.id()),
            ImmutableMap.of("name", field.name(), "record", decl.name()),
            field.name());
      }
    }
  }

  private static FnSignature signature(FnDecl decl, TypeResolver resolver, boolean builtin) {
    ImmutableList.Builder<Type> params = ImmutableList.builder();
    for (Param param : decl.params()) {
      params.add(resolver.resolve(param.type()));
    }
    return FnSignature.create(decl, params.build(), resolver.resolve(decl.returnType()), builtin);
  }

  @Override
  public Optional<Type> lookupType(String name) {
    if (name.equals(Prelude.FILE_HANDLE)) {
      return Optional.of(Type.opaque(name));
    }
    Decl decl = types.get(name);
    if (decl == null) {
      return Optional.empty();
    }
    return Optional.of(
        decl.kind() == Tree.Kind.RECORD_DECL ? Type.record(name) : Type.enumType(name));
  }

  public Type resolve(Ty ty) {
    return resolver.resolve(ty);
  }

  public Optional<FnSignature> function(String name) {
    return Optional.ofNullable(functions.get(name));
  }

  public Optional<RecordDecl> record(String name) {
    Decl decl = types.get(name);
    return decl != null && decl.kind() == Tree.Kind.RECORD_DECL
        ? Optional.of((RecordDecl) decl)
        : Optional.empty();
  }

  public Optional<EnumDecl> enumDecl(String name) {
    Decl decl = types.get(name);
    return decl != null && decl.kind() == Tree.Kind.ENUM_DECL
        ? Optional.of((EnumDecl) decl)
        : Optional.empty();
  }

  /** The enum declaring the given variant. */
  public Optional<EnumDecl> enumOfVariant(String variant) {
    return Optional.ofNullable(variants.get(variant));
  }

  public Optional<FieldDecl> field(String record, String field) {
    Optional<RecordDecl> decl = record(record);
    if (decl.isEmpty()) {
      return Optional.empty();
    }
    for (FieldDecl f : decl.get().fields()) {
      if (f.name().equals(field)) {
        return Optional.of(f);
      }
    }
    return Optional.empty();
  }

  public ImmutableSet<String> functionNames() {
    return functions.keySet();
  }

  public ImmutableSet<String> typeNames() {
    return types.keySet();
  }

  public ImmutableSet<String> variantNames() {
    return variants.keySet();
  }

  /** User-declared functions, in declaration order. */
  public ImmutableList<FnSignature> userFunctions() {
    ImmutableList.Builder<FnSignature> result = ImmutableList.builder();
    for (FnSignature signature : functions.values()) {
      if (!signature.builtin()) {
        result.add(signature);
      }
    }
    return result.build();
  }
}
