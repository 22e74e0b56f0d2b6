package org.obligato.binder;

import static org.obligato.tree.Trees.and;
import static org.obligato.tree.Trees.boolTy;
import static org.obligato.tree.Trees.fn;
import static org.obligato.tree.Trees.ge;
import static org.obligato.tree.Trees.gt;
import static org.obligato.tree.Trees.ident;
import static org.obligato.tree.Trees.intTy;
import static org.obligato.tree.Trees.linearTy;
import static org.obligato.tree.Trees.listTy;
import static org.obligato.tree.Trees.lit;
import static org.obligato.tree.Trees.lt;
import static org.obligato.tree.Trees.realTy;
import static org.obligato.tree.Trees.refined;
import static org.obligato.tree.Trees.stringTy;
import static org.obligato.tree.Trees.ty;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Optional;
import org.obligato.model.Effect;
import org.obligato.tree.Tree.FnDecl;
import org.obligato.tree.Tree.Ty;

/** The built-in functions, declared as bodiless functions. */
public final class Prelude {

  /** The element type variable of the generic built-ins. */
  static final String TYPE_VAR = "T";

  /** The opaque type of file handles. */
  public static final String FILE_HANDLE = "FileHandle";

  public static final Effect IO = Effect.of("IO");
  public static final Effect RANDOM = Effect.of("Random");

  private static Ty handle() {
    return linearTy(ty(FILE_HANDLE));
  }

  private static final ImmutableList<FnDecl> DECLS =
      ImmutableList.of(
          fn("print").param("s", stringTy()).effect(IO).extern(),
          fn("read_line").returns(stringTy()).effect(IO).extern(),
          fn("open_file").param("path", stringTy()).returns(handle()).effect(IO).extern(),
          fn("write_line")
              .param("h", handle())
              .param("s", stringTy())
              .returns(handle())
              .effect(IO)
              .extern(),
          fn("close_file").param("h", handle()).effect(IO).extern(),
          fn("random_int")
              .param("lo", intTy())
              .param("hi", refined(intTy(), "v", gt(ident("v"), ident("lo"))))
              .returns(
                  refined(
                      intTy(),
                      "v",
                      and(ge(ident("v"), ident("lo")), lt(ident("v"), ident("hi")))))
              .effect(RANDOM)
              .extern(),
          fn("len")
              .param("xs", listTy(ty(TYPE_VAR)))
              .returns(refined(intTy(), "v", ge(ident("v"), lit(0))))
              .extern(),
          fn("contains")
              .param("xs", listTy(ty(TYPE_VAR)))
              .param("x", ty(TYPE_VAR))
              .returns(boolTy())
              .extern(),
          fn("to_real").param("i", intTy()).returns(realTy()).extern(),
          fn("round").param("r", realTy()).returns(intTy()).extern(),
          fn("abs")
              .param("i", intTy())
              .returns(refined(intTy(), "v", ge(ident("v"), lit(0))))
              .extern(),
          fn("sqrt")
              .param("x", refined(realTy(), "v", ge(ident("v"), lit(0))))
              .returns(refined(realTy(), "v", ge(ident("v"), lit(0))))
              .extern());

  /**
   * Built-ins that consume a linear argument, keyed by the name of the handle type they accept.
   */
  static final ImmutableMap<String, String> CONSUMERS = ImmutableMap.of(FILE_HANDLE, "close_file");

  public static ImmutableList<FnDecl> decls() {
    return DECLS;
  }

  /** The built-in that consumes a linear value of the given inner type, if any. */
  public static Optional<String> consumerOf(String innerType) {
    return Optional.ofNullable(CONSUMERS.get(innerType));
  }

  private Prelude() {}
}
