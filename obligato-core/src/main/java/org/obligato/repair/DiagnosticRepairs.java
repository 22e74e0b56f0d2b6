package org.obligato.repair;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiFunction;
import org.obligato.binder.FnSignature;
import org.obligato.diag.Diagnostic;
import org.obligato.diag.DiagnosticKind;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Trees;
import org.obligato.type.Type;

/** Repair templates for static diagnostics. */
final class DiagnosticRepairs {

  private static final ImmutableSet<String> BUILTIN_TYPES =
      ImmutableSet.of("Int", "Real", "Bool", "String", "Unit", "List", "Linear");

  private final RepairContext cx;

  DiagnosticRepairs(RepairContext cx) {
    this.cx = cx;
  }

  List<RepairCandidate.Builder> repairs(Diagnostic d) {
    switch (d.kind()) {
      case UNRESOLVED_NAME:
      case UNKNOWN_FUNCTION:
        return renames(d, d.structured().get("name"), candidates(d), PatchOp::renameSymbol);
      case UNKNOWN_TYPE:
        return renames(d, d.structured().get("name"), typeCandidates(d), PatchOp::renameSymbol);
      case UNKNOWN_FIELD:
        return unknownField(d);
      case MISSING_FIELD:
        return missingField(d);
      case DUPLICATE_FIELD:
        return duplicateField(d);
      case ARITY_MISMATCH:
        return arity(d);
      case NON_EXHAUSTIVE_MATCH:
        return wildcardArm(d);
      case IMMUTABLE_ASSIGNMENT:
        return mutable(d);
      case TYPE_MISMATCH:
        return conversion(d);
      case DUPLICATE_DECLARATION:
        return renameDuplicate(d);
      case UNREACHABLE_CODE:
        return deleteUnreachable(d);
    }
    throw new AssertionError(d.kind());
  }

  // names

  private static ImmutableList<String> candidates(Diagnostic d) {
    String joined = d.structured().getOrDefault("candidates", "");
    return ImmutableList.copyOf(Splitter.on(',').omitEmptyStrings().split(joined));
  }

  private ImmutableList<String> typeCandidates(Diagnostic d) {
    Set<String> names = new TreeSet<>(candidates(d));
    names.addAll(cx.env.typeNames());
    if (cx.ast.node(d.primaryNode()).kind() == Tree.Kind.NAMED_TY) {
      names.addAll(BUILTIN_TYPES);
    }
    return ImmutableList.copyOf(names);
  }

  private List<RepairCandidate.Builder> renames(
      Diagnostic d,
      String name,
      Iterable<String> candidates,
      BiFunction<NodeId, String, PatchOp> op) {
    String template = d.kind() == DiagnosticKind.UNKNOWN_FIELD ? "rename_field" : "rename_symbol";
    List<RepairCandidate.Builder> result = new ArrayList<>();
    for (EditDistance.Suggestion suggestion :
        EditDistance.suggest(
            name,
            candidates,
            cx.options.maxRenameDistance(),
            cx.options.maxRenameCandidates())) {
      ImmutableList<PatchOp> edits = ImmutableList.of(op.apply(d.primaryNode(), suggestion.name()));
      result.add(
          cx.forDiagnostic(d, template)
              .setTitle("rename " + name + " to " + suggestion.name())
              .setConfidence(
                  suggestion.distance() <= cx.options.highConfidenceDistance()
                      ? Confidence.HIGH
                      : Confidence.MEDIUM)
              .setSafety(Safety.BEHAVIOR_CHANGING)
              .setKind(RepairKind.LOCAL_FIX)
              .setScope(RepairContext.scope(edits, false))
              .setEdits(edits)
              .setRationale(
                  suggestion.name() + " is " + suggestion.distance() + " edit(s) from " + name));
    }
    return result;
  }

  // fields

  private List<RepairCandidate.Builder> unknownField(Diagnostic d) {
    Tree node = cx.ast.node(d.primaryNode());
    String field = d.structured().get("field");
    String record = d.structured().get("record");
    Set<String> taken = new TreeSet<>();
    if (node.kind() == Tree.Kind.FIELD_INIT) {
      Tree.RecordLit lit = (Tree.RecordLit) cx.ast.node(cx.ast.parent(node.id()).get());
      lit.fields().forEach(f -> taken.add(f.name()));
    }
    List<String> candidates = new ArrayList<>(candidates(d));
    candidates.removeAll(taken);
    List<RepairCandidate.Builder> result =
        renames(d, field, candidates, PatchOp::renameField);
    if (node.kind() == Tree.Kind.FIELD_INIT) {
      Optional<Tree.RecordDecl> decl = cx.env.record(record);
      Optional<Tree.Ty> type =
          RepairContext.literalType(((Tree.FieldInit) node).value()).flatMap(RepairContext::ty);
      if (decl.isPresent() && type.isPresent()) {
        ImmutableList<PatchOp> edits =
            ImmutableList.of(PatchOp.addField(decl.get().id(), Trees.fieldDecl(field, type.get())));
        result.add(
            cx.forDiagnostic(d, "add_record_field")
                .setTitle("declare field " + field + " in " + record)
                .setConfidence(Confidence.LOW)
                .setSafety(Safety.BEHAVIOR_CHANGING)
                .setKind(RepairKind.REFACTOR)
                .setScope(RepairContext.scope(edits, true))
                .setEdits(edits)
                .setRationale(
                    "every other construction of " + record + " will need a value for " + field));
      }
    }
    return result;
  }

  private List<RepairCandidate.Builder> missingField(Diagnostic d) {
    String field = d.structured().get("field");
    Tree.FieldDecl decl = (Tree.FieldDecl) cx.ast.node(d.secondaryNodes().get(0));
    Optional<Expression> value = RepairContext.defaultValue(decl.type());
    ImmutableList<PatchOp> edits =
        ImmutableList.of(
            PatchOp.addField(
                d.primaryNode(), Trees.init(field, value.orElseGet(() -> Trees.hole(field)))));
    return ImmutableList.of(
        cx.forDiagnostic(d, "add_field")
            .setTitle("initialize " + field)
            .setConfidence(value.isPresent() ? Confidence.MEDIUM : Confidence.LOW)
            .setSafety(Safety.LIKELY_PRESERVING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(edits, false))
            .setEdits(edits)
            .setRationale(
                value.isPresent()
                    ? field + " gets the default value of its type"
                    : field + " is left as a hole to fill in"));
  }

  private List<RepairCandidate.Builder> duplicateField(Diagnostic d) {
    Tree node = cx.ast.node(d.primaryNode());
    boolean literal = node.kind() == Tree.Kind.FIELD_INIT;
    ImmutableList<PatchOp> edits = ImmutableList.of(PatchOp.delete(d.primaryNode()));
    return ImmutableList.of(
        cx.forDiagnostic(d, "drop_duplicate_field")
            .setTitle("remove the second " + d.structured().get("name"))
            .setConfidence(literal ? Confidence.HIGH : Confidence.MEDIUM)
            .setSafety(literal ? Safety.LIKELY_PRESERVING : Safety.BEHAVIOR_CHANGING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(edits, !literal))
            .setEdits(edits)
            .setRationale("only the first occurrence of a field is used"));
  }

  // calls

  private List<RepairCandidate.Builder> arity(Diagnostic d) {
    Tree.Call call = (Tree.Call) cx.ast.node(d.primaryNode());
    Optional<FnSignature> sig = cx.env.function(call.callee());
    if (sig.isEmpty()) {
      return ImmutableList.of();
    }
    int expected = sig.get().arity();
    List<RepairCandidate.Builder> result = new ArrayList<>();
    if (call.args().size() < expected) {
      ImmutableList.Builder<Expression> args = ImmutableList.builder();
      args.addAll(call.args());
      for (int i = call.args().size(); i < expected; i++) {
        args.add(Trees.hole(sig.get().paramNames().get(i)));
      }
      ImmutableList<PatchOp> edits =
          ImmutableList.of(
              PatchOp.replace(
                  call.id(),
                  new Tree.Call(NodeId.UNASSIGNED, call.position(), call.callee(), args.build())));
      result.add(
          cx.forDiagnostic(d, "fill_args")
              .setTitle("add the missing arguments of " + call.callee() + " as holes")
              .setConfidence(Confidence.MEDIUM)
              .setSafety(Safety.LIKELY_PRESERVING)
              .setKind(RepairKind.LOCAL_FIX)
              .setScope(RepairContext.scope(edits, false))
              .setEdits(edits)
              .setRationale(call.callee() + " expects " + expected + " argument(s)"));
      return result;
    }
    ImmutableList<PatchOp> drop =
        ImmutableList.of(
            PatchOp.replace(
                call.id(),
                new Tree.Call(
                    NodeId.UNASSIGNED,
                    call.position(),
                    call.callee(),
                    call.args().subList(0, expected))));
    result.add(
        cx.forDiagnostic(d, "drop_args")
            .setTitle("drop the extra arguments of " + call.callee())
            .setConfidence(Confidence.MEDIUM)
            .setSafety(Safety.BEHAVIOR_CHANGING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(drop, false))
            .setEdits(drop)
            .setRationale("the extra arguments are no longer evaluated"));
    if (!sig.get().builtin()) {
      addParams(d, call, sig.get()).ifPresent(result::add);
    }
    return result;
  }

  private Optional<RepairCandidate.Builder> addParams(
      Diagnostic d, Tree.Call call, FnSignature sig) {
    Set<String> names = new TreeSet<>(sig.paramNames());
    ImmutableList.Builder<PatchOp> edits = ImmutableList.builder();
    for (int i = sig.arity(); i < call.args().size(); i++) {
      Optional<Tree.Ty> type =
          RepairContext.literalType(call.args().get(i)).flatMap(RepairContext::ty);
      if (type.isEmpty()) {
        return Optional.empty();
      }
      String name = "arg" + i;
      for (int k = 2; names.contains(name); k++) {
        name = "arg" + i + "_" + k;
      }
      names.add(name);
      edits.add(PatchOp.addParam(sig.declaration().id(), Trees.param(name, type.get())));
    }
    ImmutableList<PatchOp> ops = edits.build();
    return Optional.of(
        cx.forDiagnostic(d, "add_param")
            .setTitle("add parameters to " + sig.name())
            .setConfidence(Confidence.LOW)
            .setSafety(Safety.BEHAVIOR_CHANGING)
            .setKind(RepairKind.REFACTOR)
            .setScope(RepairContext.scope(ops, true))
            .setEdits(ops)
            .setRationale("every other call of " + sig.name() + " will need the new arguments"));
  }

  // statements and expressions

  private List<RepairCandidate.Builder> wildcardArm(Diagnostic d) {
    Tree.Match match = (Tree.Match) cx.ast.node(d.primaryNode());
    Tree.MatchArm arm =
        Trees.arm(
            Trees.wild(),
            Trees.valueBlock(Trees.fail("unmatched " + d.structured().get("missing"))));
    PatchOp op =
        match.arms().isEmpty()
            ? PatchOp.replace(
                match.id(),
                new Tree.Match(
                    NodeId.UNASSIGNED, match.position(), match.scrutinee(), ImmutableList.of(arm)))
            : PatchOp.insertAfter(match.arms().get(match.arms().size() - 1).id(), arm);
    ImmutableList<PatchOp> edits = ImmutableList.of(op);
    return ImmutableList.of(
        cx.forDiagnostic(d, "wildcard_arm")
            .setTitle("add a failing wildcard arm")
            .setConfidence(Confidence.HIGH)
            .setSafety(Safety.BEHAVIOR_PRESERVING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(edits, false))
            .setEdits(edits)
            .setRationale("the new arm only runs for values no existing arm matches"));
  }

  private List<RepairCandidate.Builder> mutable(Diagnostic d) {
    String name = d.structured().get("name");
    Tree declaration = cx.ast.node(d.secondaryNodes().get(0));
    if (declaration.kind() == Tree.Kind.LET) {
      Tree.Let let = (Tree.Let) declaration;
      ImmutableList<PatchOp> edits =
          ImmutableList.of(
              PatchOp.replace(
                  let.id(),
                  new Tree.Let(
                      NodeId.UNASSIGNED,
                      let.position(),
                      let.name(),
                      true,
                      let.type(),
                      let.init())));
      return ImmutableList.of(
          cx.forDiagnostic(d, "make_mutable")
              .setTitle("declare " + name + " mutable")
              .setConfidence(Confidence.HIGH)
              .setSafety(Safety.BEHAVIOR_PRESERVING)
              .setKind(RepairKind.LOCAL_FIX)
              .setScope(RepairContext.scope(edits, false))
              .setEdits(edits)
              .setRationale("no existing read of " + name + " changes"));
    }
    if (declaration.kind() != Tree.Kind.PARAM) {
      return ImmutableList.of();
    }
    Optional<Tree.Block> body = cx.enclosingFn(d.primaryNode()).flatMap(Tree.FnDecl::body);
    if (body.isEmpty()) {
      return ImmutableList.of();
    }
    NodeId first;
    if (!body.get().stmts().isEmpty()) {
      first = body.get().stmts().get(0).id();
    } else if (body.get().tail().isPresent()) {
      first = body.get().tail().get().id();
    } else {
      return ImmutableList.of();
    }
    ImmutableList<PatchOp> edits =
        ImmutableList.of(PatchOp.insertBefore(first, Trees.letMut(name, Trees.ident(name))));
    return ImmutableList.of(
        cx.forDiagnostic(d, "shadow_mutable")
            .setTitle("shadow parameter " + name + " with a mutable copy")
            .setConfidence(Confidence.HIGH)
            .setSafety(Safety.BEHAVIOR_PRESERVING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(edits, false))
            .setEdits(edits)
            .setRationale("the copy starts with the parameter's value"));
  }

  private List<RepairCandidate.Builder> conversion(Diagnostic d) {
    if (!(cx.ast.node(d.primaryNode()) instanceof Expression)) {
      return ImmutableList.of();
    }
    String expected = d.structured().get("expected");
    String found = d.structured().get("found");
    boolean widening;
    if (expected.equals(Type.REAL.toString()) && found.equals(Type.INT.toString())) {
      widening = true;
    } else if (expected.equals(Type.INT.toString()) && found.equals(Type.REAL.toString())) {
      widening = false;
    } else {
      return ImmutableList.of();
    }
    String fn = widening ? "to_real" : "round";
    ImmutableList<PatchOp> edits =
        ImmutableList.of(
            PatchOp.wrap(d.primaryNode(), Trees.call(fn, Trees.hole(PatchOp.ORIGINAL))));
    return ImmutableList.of(
        cx.forDiagnostic(d, fn)
            .setTitle("convert with " + fn)
            .setConfidence(widening ? Confidence.HIGH : Confidence.MEDIUM)
            .setSafety(widening ? Safety.LIKELY_PRESERVING : Safety.BEHAVIOR_CHANGING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(edits, false))
            .setEdits(edits)
            .setRationale(
                widening ? "every Int is exactly representable" : "rounding loses the fraction"));
  }

  // declarations

  private List<RepairCandidate.Builder> renameDuplicate(Diagnostic d) {
    String name = d.structured().get("name");
    Set<String> taken = new TreeSet<>();
    taken.addAll(cx.env.functionNames());
    taken.addAll(cx.env.typeNames());
    taken.addAll(cx.env.variantNames());
    String fresh = name + "_2";
    for (int k = 3; taken.contains(fresh); k++) {
      fresh = name + "_" + k;
    }
    ImmutableList<PatchOp> edits = ImmutableList.of(PatchOp.rename(d.primaryNode(), fresh));
    return ImmutableList.of(
        cx.forDiagnostic(d, "rename_duplicate")
            .setTitle("rename the second " + name + " to " + fresh)
            .setConfidence(Confidence.MEDIUM)
            .setSafety(Safety.BEHAVIOR_CHANGING)
            .setKind(RepairKind.REFACTOR)
            .setScope(RepairContext.scope(edits, true))
            .setEdits(edits)
            .setRationale("references to " + name + " keep resolving to the first declaration"));
  }

  private List<RepairCandidate.Builder> deleteUnreachable(Diagnostic d) {
    ImmutableList<PatchOp> edits = ImmutableList.of(PatchOp.delete(d.primaryNode()));
    return ImmutableList.of(
        cx.forDiagnostic(d, "delete_unreachable")
            .setTitle("delete unreachable code")
            .setConfidence(Confidence.HIGH)
            .setSafety(Safety.BEHAVIOR_PRESERVING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(edits, false))
            .setEdits(edits)
            .setRationale("no path reaches it"));
  }
}
