package org.obligato.repair;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.obligato.binder.Binding;
import org.obligato.binder.BindingKind;
import org.obligato.binder.FnSignature;
import org.obligato.binder.Prelude;
import org.obligato.extract.LinearityAnalysis;
import org.obligato.extract.Obligation;
import org.obligato.extract.ObligationKind;
import org.obligato.model.EffectSet;
import org.obligato.solver.SolverResult;
import org.obligato.solver.UnknownCategory;
import org.obligato.tree.Children;
import org.obligato.tree.FreeNames;
import org.obligato.tree.NodeId;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Tree.Stmt;
import org.obligato.tree.Trees;
import org.obligato.type.Type;

/** Repair templates for obligations the solver could not discharge. */
final class ObligationRepairs {

  private final RepairContext cx;

  ObligationRepairs(RepairContext cx) {
    this.cx = cx;
  }

  List<RepairCandidate.Builder> repairs(Obligation o) {
    if (o.isDischarged()) {
      return ImmutableList.of();
    }
    List<RepairCandidate.Builder> result = new ArrayList<>();
    switch (o.kind()) {
      case REFINEMENT:
      case PRECONDITION:
      case POSTCONDITION:
        if (!mentions(o.goal(), Tree.Kind.QUANTIFIED) && !mentions(o.goal(), Tree.Kind.HOLE)) {
          guard(o).ifPresent(result::add);
          strengthen(o).ifPresent(result::add);
        }
        break;
      case EFFECT:
        widen(o).ifPresent(result::add);
        break;
      case LINEARITY:
        close(o).ifPresent(result::add);
        break;
    }
    return result;
  }

  // guard

  /** Where a guard goes: the expression it wraps, or the statement it is inserted before. */
  private static final class Anchor {
    final NodeId node;
    final boolean insert;

    Anchor(NodeId node, boolean insert) {
      this.node = node;
      this.insert = insert;
    }
  }

  /**
   * Finds the lowest expression in statement position that contains the obligation's node. A
   * precondition wraps it; a refinement of the whole expression gets a guard statement in front
   * of it instead, so that the expression stays where the refinement expects it.
   */
  private Optional<Anchor> anchor(Obligation o) {
    NodeId current = o.primaryNode();
    Tree primary = cx.ast.node(current);
    if (primary.kind() == Tree.Kind.RETURN) {
      return Optional.of(new Anchor(current, true));
    }
    while (true) {
      Tree tree = cx.ast.node(current);
      Tree.Category category = tree.kind().category();
      if (category != Tree.Category.EXPR
          && category != Tree.Category.FIELD_INIT
          && category != Tree.Category.ARM) {
        return Optional.empty();
      }
      Optional<NodeId> parentId = cx.ast.parent(current);
      if (parentId.isEmpty()) {
        return Optional.empty();
      }
      Tree parent = cx.ast.node(parentId.get());
      boolean statement;
      switch (parent.kind()) {
        case EXPR_STMT:
        case LET:
        case ASSIGN:
        case RETURN:
        case BLOCK:
          statement = tree instanceof Expression;
          break;
        default:
          statement = false;
      }
      if (statement) {
        boolean whole = current.equals(o.primaryNode()) && o.kind() != ObligationKind.PRECONDITION;
        if (!whole) {
          return Optional.of(new Anchor(current, false));
        }
        return Optional.of(
            new Anchor(parent.kind() == Tree.Kind.BLOCK ? current : parent.id(), true));
      }
      current = parentId.get();
    }
  }

  private Optional<RepairCandidate.Builder> guard(Obligation o) {
    Optional<Anchor> anchor = anchor(o);
    // a second evaluation of an effectful goal proves nothing about the first
    if (anchor.isEmpty() || !isPure(o.goal())) {
      return Optional.empty();
    }
    Expression goal = o.goal();
    Expression failure = Trees.fail(o.origin() + " violated: " + o.goalText());
    PatchOp op;
    if (anchor.get().insert) {
      op =
          PatchOp.insertBefore(
              anchor.get().node,
              Trees.exprStmt(Trees.ifThen(Trees.not(goal), Trees.valueBlock(failure))));
    } else {
      op =
          PatchOp.wrap(
              anchor.get().node,
              Trees.ifElse(
                  goal,
                  Trees.valueBlock(Trees.hole(PatchOp.ORIGINAL)),
                  Trees.valueBlock(failure)));
    }
    boolean unknown = o.result() == SolverResult.UNKNOWN;
    Confidence confidence = Confidence.MEDIUM;
    if (unknown
        && o.outcome().get().unknownReason().get().category()
            == UnknownCategory.INCOMPLETE_FACTS) {
      confidence = Confidence.HIGH;
    }
    ImmutableList<PatchOp> edits = ImmutableList.of(op);
    return Optional.of(
        cx.forObligation(o, "guard")
            .setTitle("check " + o.goalText() + " at run time")
            .setConfidence(confidence)
            .setSafety(unknown ? Safety.LIKELY_PRESERVING : Safety.BEHAVIOR_CHANGING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(edits, false))
            .setEdits(edits)
            .setRationale(o.origin() + " is " + o.outcome().get()));
  }

  // contracts

  /** Moves the goal into the refinement of the last parameter it mentions. */
  private Optional<RepairCandidate.Builder> strengthen(Obligation o) {
    Optional<Tree.FnDecl> fn = cx.enclosingFn(o.primaryNode());
    if (fn.isEmpty() || !isPure(o.goal())) {
      return Optional.empty();
    }
    List<String> names = new ArrayList<>(FreeNames.of(o.goal()));
    names.removeAll(cx.env.variantNames());
    if (names.isEmpty()) {
      return Optional.empty();
    }
    int last = -1;
    for (String name : names) {
      int index = paramIndex(fn.get(), name);
      if (index < 0 || !isParameter(o, fn.get().params().get(index))) {
        return Optional.empty();
      }
      last = Math.max(last, index);
    }
    Tree.Param param = fn.get().params().get(last);
    ImmutableList<PatchOp> edits =
        ImmutableList.of(PatchOp.addRefinement(param.id(), param.name(), o.goal()));
    return Optional.of(
        cx.forObligation(o, "strengthen_contract")
            .setTitle("require " + o.goalText() + " of callers of " + fn.get().name())
            .setConfidence(
                o.result() == SolverResult.UNKNOWN ? Confidence.MEDIUM : Confidence.LOW)
            .setSafety(Safety.LIKELY_PRESERVING)
            .setKind(RepairKind.BOUNDARY_VALIDATION)
            .setScope(RepairContext.scope(edits, true))
            .setEdits(edits)
            .setRationale("callers of " + fn.get().name() + " must then prove it"));
  }

  private static int paramIndex(Tree.FnDecl fn, String name) {
    for (int i = 0; i < fn.params().size(); i++) {
      if (fn.params().get(i).name().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /** The name still refers to the parameter where the obligation arises. */
  private static boolean isParameter(Obligation o, Tree.Param param) {
    Binding visible = null;
    for (Binding binding : o.context().bindings()) {
      if (binding.name().equals(param.name())) {
        visible = binding;
      }
    }
    return visible != null
        && visible.kind() == BindingKind.PARAMETER
        && visible.declaration().equals(param.id());
  }

  // effects

  private Optional<RepairCandidate.Builder> widen(Obligation o) {
    Tree node = cx.ast.node(o.primaryNode());
    Optional<Tree.FnDecl> fn = cx.enclosingFn(o.primaryNode());
    if (node.kind() != Tree.Kind.CALL || fn.isEmpty()) {
      return Optional.empty();
    }
    Optional<FnSignature> callee = cx.env.function(((Tree.Call) node).callee());
    if (callee.isEmpty()) {
      return Optional.empty();
    }
    EffectSet missing = callee.get().effects().missingFrom(EffectSet.copyOf(fn.get().effects()));
    if (missing.isPure()) {
      return Optional.empty();
    }
    ImmutableList<PatchOp> edits = ImmutableList.of(PatchOp.widenEffect(fn.get().id(), missing));
    return Optional.of(
        cx.forObligation(o, "widen_effect")
            .setTitle("declare " + missing + " on " + fn.get().name())
            .setConfidence(missing.size() == 1 ? Confidence.HIGH : Confidence.MEDIUM)
            .setSafety(Safety.LIKELY_PRESERVING)
            .setKind(RepairKind.REFACTOR)
            .setScope(RepairContext.scope(edits, true))
            .setEdits(edits)
            .setRationale(callee.get().name() + " performs " + missing));
  }

  // linearity

  /** Consumes a linear binding that is never used, at the end of its scope. */
  private Optional<RepairCandidate.Builder> close(Obligation o) {
    if (!"0".equals(o.outcome().get().counterexample().values().iterator().next())) {
      return Optional.empty();
    }
    Tree declaration = cx.ast.node(o.primaryNode());
    Optional<Tree.FnDecl> fn = cx.enclosingFn(o.primaryNode());
    if (fn.isEmpty() || fn.get().body().isEmpty()) {
      return Optional.empty();
    }
    String name;
    List<Stmt> rest;
    Optional<Expression> tail;
    if (declaration.kind() == Tree.Kind.PARAM) {
      name = ((Tree.Param) declaration).name();
      rest = fn.get().body().get().stmts();
      tail = fn.get().body().get().tail();
    } else if (declaration.kind() == Tree.Kind.LET) {
      name = ((Tree.Let) declaration).name();
      Tree.Block block = (Tree.Block) cx.ast.node(cx.ast.parent(declaration.id()).get());
      int index = 0;
      while (!block.stmts().get(index).id().equals(declaration.id())) {
        index++;
      }
      rest = block.stmts().subList(index + 1, block.stmts().size());
      tail = block.tail();
    } else {
      return Optional.empty();
    }
    Optional<String> consumer = consumer(o, name);
    if (consumer.isEmpty()) {
      return Optional.empty();
    }
    Optional<NodeId> before = Optional.empty();
    Optional<NodeId> after = Optional.empty();
    Stmt last = rest.isEmpty() ? null : Iterables.getLast(rest);
    if (tail.isEmpty() && last != null && last.kind() == Tree.Kind.RETURN) {
      Optional<Expression> value = ((Tree.Return) last).expr();
      if (value.isPresent() && FreeNames.mentions(value.get(), name)) {
        return Optional.empty();
      }
      if (!LinearityAnalysis.analyze(name, rest.subList(0, rest.size() - 1), Optional.empty())
          .closableAtEnd()) {
        return Optional.empty();
      }
      before = Optional.of(last.id());
    } else {
      if (!LinearityAnalysis.analyze(name, rest, tail).closableAtEnd()) {
        return Optional.empty();
      }
      if (tail.isPresent()) {
        before = Optional.of(tail.get().id());
      } else if (last != null) {
        after = Optional.of(last.id());
      } else if (declaration.kind() == Tree.Kind.LET) {
        after = Optional.of(declaration.id());
      } else {
        return Optional.empty();
      }
    }
    Stmt use = Trees.exprStmt(Trees.call(consumer.get(), Trees.ident(name)));
    ImmutableList.Builder<PatchOp> edits = ImmutableList.builder();
    edits.add(
        before.isPresent()
            ? PatchOp.insertBefore(before.get(), use)
            : PatchOp.insertAfter(after.get(), use));
    ImmutableList.Builder<PatchOp> prerequisites = ImmutableList.builder();
    EffectSet missing =
        cx.env
            .function(consumer.get())
            .get()
            .effects()
            .missingFrom(EffectSet.copyOf(fn.get().effects()));
    if (!missing.isPure()) {
      PatchOp widen = PatchOp.widenEffect(fn.get().id(), missing);
      if (hasOpenEffectObligation(fn.get())) {
        prerequisites.add(widen);
      } else {
        edits.add(widen);
      }
    }
    ImmutableList<PatchOp> ops = edits.build();
    return Optional.of(
        cx.forObligation(o, "close_linear")
            .setTitle("consume " + name + " with " + consumer.get())
            .setConfidence(Confidence.HIGH)
            .setSafety(Safety.LIKELY_PRESERVING)
            .setKind(RepairKind.LOCAL_FIX)
            .setScope(RepairContext.scope(ops, false))
            .setEdits(ops)
            .setPrerequisites(prerequisites.build())
            .setRationale(name + " is never used before the end of its scope"));
  }

  private static Optional<String> consumer(Obligation o, String name) {
    Binding visible = null;
    for (Binding binding : o.context().bindings()) {
      if (binding.name().equals(name)) {
        visible = binding;
      }
    }
    if (visible == null || !visible.type().isLinear()) {
      return Optional.empty();
    }
    Type elem = ((Type.ElemType) visible.type().base()).elem().base();
    return Prelude.consumerOf(elem.toString());
  }

  /**
   * Another obligation of the function already asks for wider effects, so its repair is the one
   * that widens them.
   */
  private boolean hasOpenEffectObligation(Tree.FnDecl fn) {
    for (Obligation other : cx.obligations) {
      if (other.kind() == ObligationKind.EFFECT
          && !other.isDischarged()
          && cx.enclosingFn(other.primaryNode()).map(f -> f.id().equals(fn.id())).orElse(false)) {
        return true;
      }
    }
    return false;
  }

  // helpers

  private boolean isPure(Tree tree) {
    if (tree.kind() == Tree.Kind.CALL) {
      Optional<FnSignature> sig = cx.env.function(((Tree.Call) tree).callee());
      if (sig.isEmpty() || !sig.get().isPure()) {
        return false;
      }
    }
    for (Children.Child child : Children.of(tree)) {
      if (!isPure(child.tree())) {
        return false;
      }
    }
    return true;
  }

  private static boolean mentions(Tree tree, Tree.Kind kind) {
    if (tree.kind() == kind) {
      return true;
    }
    for (Children.Child child : Children.of(tree)) {
      if (mentions(child.tree(), kind)) {
        return true;
      }
    }
    return false;
  }
}
