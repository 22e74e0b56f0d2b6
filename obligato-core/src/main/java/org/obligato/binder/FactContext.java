package org.obligato.binder;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.obligato.model.Const;
import org.obligato.tree.FreeNames;
import org.obligato.tree.NodeId;
import org.obligato.tree.OperatorKind;
import org.obligato.tree.Tree;
import org.obligato.tree.Tree.Expression;
import org.obligato.tree.Trees;
import org.obligato.type.Type;

/**
 * The bindings and facts known at the current point of a walk over one function.
 *
 * <p>Scopes are strictly nested. Facts recorded in a scope are dropped when it exits. Assigning
 * to a binding bumps its generation, which hides every fact that mentions it; generations are
 * never rolled back, so an assignment inside a branch or loop also hides the outer facts about
 * that binding.
 */
public final class FactContext {

  private static final class Version {
    final int serial;
    final int generation;

    Version(int serial, int generation) {
      this.serial = serial;
      this.generation = generation;
    }
  }

  private static final class Recorded {
    final Fact fact;
    final ImmutableMap<String, Version> deps;

    Recorded(Fact fact, ImmutableMap<String, Version> deps) {
      this.fact = fact;
      this.deps = deps;
    }
  }

  private static final class Scope {
    final ScopeKind kind;
    final Map<String, Binding> bindings = new LinkedHashMap<>();
    final List<Recorded> facts = new ArrayList<>();

    Scope(ScopeKind kind) {
      this.kind = kind;
    }
  }

  private final Deque<Scope> scopes = new ArrayDeque<>();
  private final Map<Integer, Integer> generations = new HashMap<>();
  private int nextSerial = 0;

  public void enterScope(ScopeKind kind) {
    scopes.push(new Scope(kind));
  }

  public void exitScope() {
    checkState(!scopes.isEmpty(), "no scope to exit");
    scopes.pop();
  }

  public int depth() {
    return scopes.size();
  }

  public ScopeKind currentScope() {
    checkState(!scopes.isEmpty(), "no scope");
    return scopes.peek().kind;
  }

  @CanIgnoreReturnValue
  public Binding bind(
      String name, Type type, boolean mutable, BindingKind kind, NodeId declaration) {
    checkState(!scopes.isEmpty(), "no scope");
    Binding binding = Binding.create(name, type, mutable, kind, declaration, nextSerial++);
    generations.put(binding.serial(), 0);
    scopes.peek().bindings.put(name, binding);
    return binding;
  }

  /** Returns the innermost binding of {@code name}. */
  public Optional<Binding> lookup(String name) {
    for (Scope scope : scopes) {
      Binding binding = scope.bindings.get(name);
      if (binding != null) {
        return Optional.of(binding);
      }
    }
    return Optional.empty();
  }

  /** Forgets everything known about the binding {@code name} currently resolves to. */
  public void invalidate(String name) {
    lookup(name).ifPresent(b -> generations.merge(b.serial(), 1, Integer::sum));
  }

  /**
   * Records a proposition. Conjunctions are split so that merges keep as much as possible;
   * propositions that are already visible are not recorded twice.
   */
  public void assume(Expression prop, Provenance provenance, NodeId origin) {
    checkState(!scopes.isEmpty(), "no scope");
    if (prop.kind() == Tree.Kind.BINARY && ((Tree.Binary) prop).op() == OperatorKind.AND) {
      assume(((Tree.Binary) prop).lhs(), provenance, origin);
      assume(((Tree.Binary) prop).rhs(), provenance, origin);
      return;
    }
    if (prop.kind() == Tree.Kind.LITERAL && ((Tree.Literal) prop).value().equals(Const.of(true))) {
      return;
    }
    Fact fact = Fact.create(Trees.detach(prop), provenance, origin);
    if (isVisible(fact.text())) {
      return;
    }
    ImmutableMap.Builder<String, Version> deps = ImmutableMap.builder();
    for (String name : FreeNames.of(prop)) {
      Optional<Binding> binding = lookup(name);
      if (binding.isPresent()) {
        int serial = binding.get().serial();
        deps.put(name, new Version(serial, generations.get(serial)));
      }
    }
    scopes.peek().facts.add(new Recorded(fact, deps.buildOrThrow()));
  }

  private boolean isValid(Recorded recorded) {
    for (Map.Entry<String, Version> dep : recorded.deps.entrySet()) {
      Optional<Binding> binding = lookup(dep.getKey());
      if (binding.isEmpty()) {
        return false;
      }
      int serial = binding.get().serial();
      if (serial != dep.getValue().serial
          || generations.get(serial) != dep.getValue().generation) {
        return false;
      }
    }
    return true;
  }

  private boolean isVisible(String text) {
    for (Fact fact : visibleFacts()) {
      if (fact.text().equals(text)) {
        return true;
      }
    }
    return false;
  }

  /** The facts that hold here, outermost first. */
  public ImmutableList<Fact> visibleFacts() {
    ImmutableList.Builder<Fact> result = ImmutableList.builder();
    Iterator<Scope> outermostFirst = scopes.descendingIterator();
    while (outermostFirst.hasNext()) {
      for (Recorded recorded : outermostFirst.next().facts) {
        if (isValid(recorded)) {
          result.add(recorded.fact);
        }
      }
    }
    return result.build();
  }

  /** The innermost binding of every visible name, sorted by name. */
  public ImmutableList<Binding> visibleBindings() {
    Map<String, Binding> result = new TreeMap<>();
    for (Scope scope : scopes) {
      for (Binding binding : scope.bindings.values()) {
        result.putIfAbsent(binding.name(), binding);
      }
    }
    return ImmutableList.copyOf(result.values());
  }

  /**
   * Exits a branch scope and returns the facts that held at its end and may outlive it: those
   * that do not mention a binding declared in the branch.
   */
  public ImmutableList<Fact> exitBranch() {
    checkState(!scopes.isEmpty(), "no scope to exit");
    Scope branch = scopes.peek();
    Set<Integer> local = new LinkedHashSet<>();
    for (Binding binding : branch.bindings.values()) {
      local.add(binding.serial());
    }
    ImmutableList.Builder<Fact> surviving = ImmutableList.builder();
    for (Scope scope : scopes) {
      for (Recorded recorded : scope.facts) {
        if (isValid(recorded) && !mentionsAny(recorded, local)) {
          surviving.add(recorded.fact);
        }
      }
    }
    exitScope();
    return surviving.build();
  }

  private static boolean mentionsAny(Recorded recorded, Set<Integer> serials) {
    for (Version version : recorded.deps.values()) {
      if (serials.contains(version.serial)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Joins control flow after a branching construct. {@code branches} holds, for each branch that
   * can reach the join point, the facts returned by {@link #exitBranch}; only facts present in
   * all of them survive. Branches that diverge must not be passed, so a guard whose failing
   * branch returns leaves the negated guard condition behind.
   */
  public void merge(Collection<ImmutableList<Fact>> branches, boolean guarded, NodeId origin) {
    if (branches.isEmpty()) {
      return;
    }
    Iterator<ImmutableList<Fact>> it = branches.iterator();
    Map<String, Fact> common = new LinkedHashMap<>();
    for (Fact fact : it.next()) {
      common.putIfAbsent(fact.text(), fact);
    }
    while (it.hasNext()) {
      ImmutableSet.Builder<String> texts = ImmutableSet.builder();
      for (Fact fact : it.next()) {
        texts.add(fact.text());
      }
      common.keySet().retainAll(texts.build());
    }
    Provenance provenance = guarded ? Provenance.GUARD : Provenance.BRANCH_MERGE;
    for (Fact fact : common.values()) {
      assume(fact.prop(), provenance, origin);
    }
  }
}
