package org.obligato.apply;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.obligato.diag.StructuralError;
import org.obligato.model.Effect;
import org.obligato.model.EffectSet;
import org.obligato.repair.PatchOp;
import org.obligato.repair.PatchOpKind;
import org.obligato.tree.Ast;
import org.obligato.tree.NodeId;
import org.obligato.tree.OperatorKind;
import org.obligato.tree.Pretty;
import org.obligato.tree.Substitution;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Block;
import org.obligato.tree.Tree.CompUnit;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.TreeCopier;
import org.obligato.tree.Trees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies patch ops to an AST, then canonicalizes the result and gives ids to the nodes that lack
 * one. Ops are applied in node-id order; each one is skipped if the node it would create is
 * already present, so applying a batch to its own output changes nothing.
 */
public final class PatchApplier {

  private static final Logger logger = LoggerFactory.getLogger(PatchApplier.class);

  private static final Comparator<PatchOp> ORDER =
      Comparator.comparing(PatchOp::target)
          .thenComparing(PatchOp::kind)
          .thenComparing(Ordering.usingToString());

  public static Ast apply(Ast ast, List<PatchOp> ops) {
    List<PatchOp> sorted = new ArrayList<>(ops);
    sorted.sort(ORDER);
    Ast current = ast;
    for (PatchOp op : sorted) {
      current = applyOne(current, op);
    }
    return Canonicalizer.canonicalize(current);
  }

  private static Ast applyOne(Ast ast, PatchOp op) {
    if (!ast.contains(op.target())) {
      if (op.kind() == PatchOpKind.DELETE_NODE) {
        logger.debug("{} already applied", op);
        return ast;
      }
      throw StructuralError.unknownNode(op.target());
    }
    if (alreadyApplied(ast, op)) {
      logger.debug("{} already applied", op);
      return ast;
    }
    CompUnit unit = (CompUnit) new Edit(op).copy(ast.root());
    return Ast.of(unit, ast.seed());
  }

  private static boolean alreadyApplied(Ast ast, PatchOp op) {
    switch (op.kind()) {
      case WRAP:
      case INSERT_BEFORE:
      case INSERT_AFTER:
        return ast.contains(op.createdId());
      case ADD_FIELD:
        {
          String name = fieldName(op.payload().get());
          Tree target = ast.node(op.target());
          if (target.kind() == Tree.Kind.RECORD_DECL) {
            return ((Tree.RecordDecl) target)
                .fields().stream().anyMatch(f -> f.name().equals(name));
          }
          if (target.kind() == Tree.Kind.RECORD_LIT) {
            return ((Tree.RecordLit) target)
                .fields().stream().anyMatch(f -> f.name().equals(name));
          }
          return false;
        }
      case ADD_PARAM:
        {
          Tree target = ast.node(op.target());
          String name = ((Tree.Param) op.payload().get()).name();
          return target.kind() == Tree.Kind.FN_DECL
              && ((Tree.FnDecl) target).params().stream().anyMatch(p -> p.name().equals(name));
        }
      case ADD_REFINEMENT:
        {
          Tree target = ast.node(op.target());
          if (target.kind() != Tree.Kind.PARAM) {
            return false;
          }
          Tree.Ty type = ((Tree.Param) target).type();
          if (type.kind() != Tree.Kind.REFINED_TY) {
            return false;
          }
          Tree.RefinedTy refined = (Tree.RefinedTy) type;
          String wanted = Pretty.pretty(renameVar(op, refined.var()));
          return conjuncts(refined.predicate()).contains(wanted);
        }
      default:
        return false;
    }
  }

  private static String fieldName(Tree field) {
    return field.kind() == Tree.Kind.FIELD_DECL
        ? ((Tree.FieldDecl) field).name()
        : ((Tree.FieldInit) field).name();
  }

  /** The predicate of an add-refinement op, restated over {@code var}. */
  private static Expression renameVar(PatchOp op, String var) {
    Expression predicate = (Expression) op.payload().get();
    return op.name().equals(var)
        ? predicate
        : Substitution.apply(predicate, op.name(), Trees.ident(var));
  }

  private static List<String> conjuncts(Expression e) {
    List<String> result = new ArrayList<>();
    if (e.kind() == Tree.Kind.BINARY && ((Tree.Binary) e).op() == OperatorKind.AND) {
      result.addAll(conjuncts(((Tree.Binary) e).lhs()));
      result.addAll(conjuncts(((Tree.Binary) e).rhs()));
    } else {
      result.add(Pretty.pretty(e));
    }
    return result;
  }

  /** Rebuilds the tree with one op applied. */
  private static final class Edit extends TreeCopier {
    private final PatchOp op;

    Edit(PatchOp op) {
      this.op = op;
    }

    @Override
    protected <T extends Tree> T sub(
        Class<T> type, T child, NodeId parent, String slot, int index) {
      if (!child.id().equals(op.target())) {
        return super.sub(type, child, parent, slot, index);
      }
      switch (op.kind()) {
        case REPLACE_NODE:
          return checkCategory(type, Trees.withId(op.payload().get(), op.target()), slot);
        case WRAP:
          return checkCategory(type, wrap(child), slot);
        case INSERT_BEFORE:
        case INSERT_AFTER:
        case DELETE_NODE:
          // handled by the enclosing list, or by the enclosing block for a tail
          return super.sub(type, child, parent, slot, index);
        default:
          Tree copied = super.sub(Tree.class, child, parent, slot, index);
          return checkCategory(type, modify(copied), slot);
      }
    }

    @Override
    protected <T extends Tree> ImmutableList<T> copyList(
        Class<T> type, ImmutableList<T> list, NodeId parent, String slot) {
      boolean listEdit =
          op.kind() == PatchOpKind.INSERT_BEFORE
              || op.kind() == PatchOpKind.INSERT_AFTER
              || op.kind() == PatchOpKind.DELETE_NODE;
      ImmutableList<T> copied = super.copyList(type, list, parent, slot);
      if (!listEdit) {
        return copied;
      }
      ImmutableList.Builder<T> result = ImmutableList.builder();
      for (T element : copied) {
        boolean target = element.id().equals(op.target());
        if (target && op.kind() == PatchOpKind.INSERT_BEFORE) {
          result.add(checkCategory(type, inserted(), slot));
        }
        if (!target || op.kind() != PatchOpKind.DELETE_NODE) {
          result.add(element);
        }
        if (target && op.kind() == PatchOpKind.INSERT_AFTER) {
          result.add(checkCategory(type, inserted(), slot));
        }
      }
      return result.build();
    }

    @Override
    public Tree visitBlock(Block t, Slot slot) {
      Block block = (Block) super.visitBlock(t, slot);
      if (block.tail().isEmpty() || !block.tail().get().id().equals(op.target())) {
        return block;
      }
      switch (op.kind()) {
        case INSERT_BEFORE:
          return new Block(
              block.id(),
              block.position(),
              ImmutableList.<Tree.Stmt>builder()
                  .addAll(block.stmts())
                  .add(checkCategory(Tree.Stmt.class, inserted(), "stmts"))
                  .build(),
              block.tail());
        case DELETE_NODE:
          return new Block(block.id(), block.position(), block.stmts(), Optional.empty());
        case INSERT_AFTER:
          throw invalid("cannot insert after the tail of a block");
        default:
          return block;
      }
    }

    private Tree inserted() {
      return Trees.withId(op.payload().get(), op.createdId());
    }

    private Tree wrap(Tree original) {
      Tree copiedOriginal = copy(original);
      int[] holes = {0};
      Tree wrapped =
          new TreeCopier() {
            @Override
            protected NodeId enter(Tree t, Slot slot) {
              return slot.isRoot() ? op.createdId() : NodeId.UNASSIGNED;
            }

            @Override
            public Tree visitHole(Tree.Hole hole, Slot slot) {
              if (hole.name().equals(PatchOp.ORIGINAL)) {
                holes[0]++;
                return copiedOriginal;
              }
              return super.visitHole(hole, slot);
            }
          }.copy(op.payload().get());
      if (holes[0] != 1) {
        throw invalid("wrap template must mark the original exactly once");
      }
      return wrapped;
    }

    private Tree modify(Tree t) {
      switch (op.kind()) {
        case WIDEN_EFFECT:
          if (t.kind() == Tree.Kind.FN_DECL) {
            Tree.FnDecl fn = (Tree.FnDecl) t;
            EffectSet widened = EffectSet.copyOf(fn.effects()).union(op.effects());
            return withFn(fn, fn.name(), fn.params(), widened.effects().asList());
          }
          break;
        case RENAME_SYMBOL:
          return renameSymbol(t);
        case RENAME:
          return renameDeclaration(t);
        case RENAME_FIELD:
          if (t.kind() == Tree.Kind.FIELD_ACCESS) {
            Tree.FieldAccess access = (Tree.FieldAccess) t;
            return new Tree.FieldAccess(access.id(), access.position(), access.expr(), op.name());
          }
          if (t.kind() == Tree.Kind.FIELD_INIT) {
            Tree.FieldInit init = (Tree.FieldInit) t;
            return new Tree.FieldInit(init.id(), init.position(), op.name(), init.value());
          }
          break;
        case ADD_FIELD:
          if (t.kind() == Tree.Kind.RECORD_DECL) {
            Tree.RecordDecl decl = (Tree.RecordDecl) t;
            return new Tree.RecordDecl(
                decl.id(),
                decl.position(),
                decl.name(),
                ImmutableList.<Tree.FieldDecl>builder()
                    .addAll(decl.fields())
                    .add(checkCategory(Tree.FieldDecl.class, inserted(), "fields"))
                    .build());
          }
          if (t.kind() == Tree.Kind.RECORD_LIT) {
            Tree.RecordLit lit = (Tree.RecordLit) t;
            return new Tree.RecordLit(
                lit.id(),
                lit.position(),
                lit.typeName(),
                ImmutableList.<Tree.FieldInit>builder()
                    .addAll(lit.fields())
                    .add(checkCategory(Tree.FieldInit.class, inserted(), "fields"))
                    .build());
          }
          break;
        case ADD_PARAM:
          if (t.kind() == Tree.Kind.FN_DECL) {
            Tree.FnDecl fn = (Tree.FnDecl) t;
            ImmutableList<Tree.Param> params =
                ImmutableList.<Tree.Param>builder()
                    .addAll(fn.params())
                    .add(checkCategory(Tree.Param.class, inserted(), "params"))
                    .build();
            return withFn(fn, fn.name(), params, fn.effects());
          }
          break;
        case ADD_REFINEMENT:
          if (t.kind() == Tree.Kind.PARAM) {
            return refine((Tree.Param) t);
          }
          break;
        default:
          break;
      }
      throw invalid(op.kind() + " does not apply to " + t.kind());
    }

    private Tree refine(Tree.Param param) {
      Tree.Ty type = param.type();
      Tree.RefinedTy refined;
      if (type.kind() == Tree.Kind.REFINED_TY) {
        Tree.RefinedTy existing = (Tree.RefinedTy) type;
        Expression predicate = Trees.and(existing.predicate(), renameVar(op, existing.var()));
        refined =
            new Tree.RefinedTy(
                existing.id(), existing.position(), existing.base(), existing.var(), predicate);
      } else {
        refined = new Tree.RefinedTy(op.createdId(), -1, type, op.name(), renameVar(op, op.name()));
      }
      return new Tree.Param(param.id(), param.position(), param.name(), refined);
    }

    private Tree renameSymbol(Tree t) {
      switch (t.kind()) {
        case IDENT:
          return new Tree.Ident(t.id(), t.position(), op.name());
        case CALL:
          {
            Tree.Call call = (Tree.Call) t;
            return new Tree.Call(call.id(), call.position(), op.name(), call.args());
          }
        case NAMED_TY:
          {
            Tree.NamedTy ty = (Tree.NamedTy) t;
            return new Tree.NamedTy(ty.id(), ty.position(), op.name(), ty.args());
          }
        case RECORD_LIT:
          {
            Tree.RecordLit lit = (Tree.RecordLit) t;
            return new Tree.RecordLit(lit.id(), lit.position(), op.name(), lit.fields());
          }
        case PAT_VARIANT:
          return new Tree.VariantPat(t.id(), t.position(), op.name());
        default:
          throw invalid("cannot rename the symbol of " + t.kind());
      }
    }

    private Tree renameDeclaration(Tree t) {
      switch (t.kind()) {
        case FN_DECL:
          {
            Tree.FnDecl fn = (Tree.FnDecl) t;
            return withFn(fn, op.name(), fn.params(), fn.effects());
          }
        case RECORD_DECL:
          {
            Tree.RecordDecl decl = (Tree.RecordDecl) t;
            return new Tree.RecordDecl(decl.id(), decl.position(), op.name(), decl.fields());
          }
        case ENUM_DECL:
          {
            Tree.EnumDecl decl = (Tree.EnumDecl) t;
            return new Tree.EnumDecl(decl.id(), decl.position(), op.name(), decl.variants());
          }
        case FIELD_DECL:
          {
            Tree.FieldDecl decl = (Tree.FieldDecl) t;
            return new Tree.FieldDecl(decl.id(), decl.position(), op.name(), decl.type());
          }
        case PARAM:
          {
            Tree.Param param = (Tree.Param) t;
            return new Tree.Param(param.id(), param.position(), op.name(), param.type());
          }
        case LET:
          {
            Tree.Let let = (Tree.Let) t;
            return new Tree.Let(
                let.id(), let.position(), op.name(), let.mutable(), let.type(), let.init());
          }
        case PAT_BIND:
          return new Tree.BindPat(t.id(), t.position(), op.name());
        default:
          throw invalid("cannot rename a " + t.kind());
      }
    }

    private static Tree.FnDecl withFn(
        Tree.FnDecl fn,
        String name,
        ImmutableList<Tree.Param> params,
        ImmutableList<Effect> effects) {
      return new Tree.FnDecl(
          fn.id(),
          fn.position(),
          name,
          params,
          fn.returnType(),
          effects,
          fn.requires(),
          fn.ensures(),
          fn.body());
    }

    private StructuralError invalid(String message) {
      return StructuralError.create(StructuralError.Kind.INVALID_PATCH, "%s: %s", op, message);
    }
  }

  private PatchApplier() {}
}
