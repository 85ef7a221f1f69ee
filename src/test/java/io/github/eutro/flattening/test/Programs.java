package io.github.eutro.flattening.test;

import io.github.eutro.flattening.ops.CommonOps;
import io.github.eutro.flattening.ops.JavaOps;
import io.github.eutro.flattening.ops.JavaOps.JumpType;
import io.github.eutro.flattening.ssa.*;
import org.objectweb.asm.Type;

import java.util.Arrays;

import static io.github.eutro.flattening.ops.CommonOps.constant;

/**
 * Small functions used as inputs across the tests.
 */
public class Programs {
    static Var arg(IRBuilder ib, int n, String name) {
        return ib.insert(CommonOps.ARG.create(n).insn(), name);
    }

    static Var call(IRBuilder ib, String fn, Var... args) {
        return ib.insert(CommonOps.CALL.create(fn).insn(args), fn);
    }

    static Control ret(Var v) {
        return CommonOps.RETURN.insn(v).jumpsTo();
    }

    static Insn phi(BasicBlock[] preds, Var... values) {
        return CommonOps.PHI.create(Arrays.asList(preds)).insn(values);
    }

    /**
     * <pre>
     * entry: a = arg 0; br b1
     * b1:    x = call f(a); br b2
     * b2:    return x
     * </pre>
     */
    public static Function straightLine() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), b1 = f.newBb(), b2 = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var a = arg(ib, 0, "a");
        ib.insertCtrl(Control.br(b1));
        ib.setBlock(b1);
        Var x = call(ib, "f", a);
        ib.insertCtrl(Control.br(b2));
        ib.setBlock(b2);
        ib.insertCtrl(ret(x));
        return f;
    }

    /**
     * <pre>
     * entry: a = arg 0; br_cond ifne a -> t f
     * t:     x = call left(a); br m
     * f:     y = call right(a); br m
     * m:     p = phi t:x f:y; r = call join(p, a); return r
     * </pre>
     */
    public static Function diamond() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), t = f.newBb(), fb = f.newBb(), m = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var a = arg(ib, 0, "a");
        ib.insertCtrl(JavaOps.BR_COND.create(JumpType.IFNE).insn(a).jumpsTo(t, fb));
        ib.setBlock(t);
        Var x = call(ib, "left", a);
        ib.insertCtrl(Control.br(m));
        ib.setBlock(fb);
        Var y = call(ib, "right", a);
        ib.insertCtrl(Control.br(m));
        ib.setBlock(m);
        Var p = ib.insert(phi(new BasicBlock[]{t, fb}, x, y), "p");
        Var r = call(ib, "join", p, a);
        ib.insertCtrl(ret(r));
        return f;
    }

    /**
     * Sums the integers below its argument, calling {@code tick} with each.
     * <pre>
     * entry:  n = arg 0; zero = const 0; one = const 1; br header
     * header: i = phi entry:zero body:i2; s = phi entry:zero body:s2
     *         br_cond if_icmplt i n -> body exit
     * body:   call tick(i); s2 = iadd s i; i2 = iadd i one; br header
     * exit:   return s
     * </pre>
     */
    public static Function sumLoop() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), header = f.newBb(), body = f.newBb(), exit = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var n = arg(ib, 0, "n");
        Var zero = ib.insert(constant(0), "zero");
        Var one = ib.insert(constant(1), "one");
        ib.insertCtrl(Control.br(header));

        Var i = f.newVar("i"), s = f.newVar("s"), i2 = f.newVar("i2"), s2 = f.newVar("s2");
        BasicBlock[] preds = {entry, body};
        ib.setBlock(header);
        ib.insert(phi(preds, zero, i2), i);
        ib.insert(phi(preds, zero, s2), s);
        ib.insertCtrl(JavaOps.BR_COND.create(JumpType.IF_ICMPLT).insn(i, n).jumpsTo(body, exit));

        ib.setBlock(body);
        ib.insert(CommonOps.CALL.create("tick").insn(i).assignTo());
        ib.insert(JavaOps.IADD.insn(s, i), s2);
        ib.insert(JavaOps.IADD.insn(i, one), i2);
        ib.insertCtrl(Control.br(header));

        ib.setBlock(exit);
        ib.insertCtrl(ret(s));
        return f;
    }

    /**
     * Swaps its first two arguments as many times as its third, in a self-loop
     * whose phis read each other.
     * <pre>
     * entry:  x = arg 0; y = arg 1; k0 = arg 2; one = const 1; br header
     * header: a = phi entry:x header:b; b = phi entry:y header:a; k = phi entry:k0 header:k2
     *         k2 = isub k one; br_cond ifgt k2 -> header exit
     * exit:   r = call result(a, b); return r
     * </pre>
     */
    public static Function swapLoop() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), header = f.newBb(), exit = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var x = arg(ib, 0, "x");
        Var y = arg(ib, 1, "y");
        Var k0 = arg(ib, 2, "k0");
        Var one = ib.insert(constant(1), "one");
        ib.insertCtrl(Control.br(header));

        Var a = f.newVar("a"), b = f.newVar("b"), k = f.newVar("k"), k2 = f.newVar("k2");
        BasicBlock[] preds = {entry, header};
        ib.setBlock(header);
        ib.insert(phi(preds, x, b), a);
        ib.insert(phi(preds, y, a), b);
        ib.insert(phi(preds, k0, k2), k);
        ib.insert(JavaOps.ISUB.insn(k, one), k2);
        ib.insertCtrl(JavaOps.BR_COND.create(JumpType.IFGT).insn(k2).jumpsTo(header, exit));

        ib.setBlock(exit);
        Var r = call(ib, "result", a, b);
        ib.insertCtrl(ret(r));
        return f;
    }

    /**
     * An entry block that jumps past the block after it.
     * <pre>
     * entry: v = arg 0; br b2
     * b1:    r = call end(v); return r
     * b2:    w = iadd v v; call mid(w); br b1
     * </pre>
     */
    public static Function outOfOrder() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), b1 = f.newBb(), b2 = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var v = arg(ib, 0, "v");
        ib.insertCtrl(Control.br(b2));
        ib.setBlock(b1);
        Var r = call(ib, "end", v);
        ib.insertCtrl(ret(r));
        ib.setBlock(b2);
        Var w = ib.insert(JavaOps.IADD.insn(v, v), "w");
        call(ib, "mid", w);
        ib.insertCtrl(Control.br(b1));
        return f;
    }

    /**
     * An entry block that computes its condition with a call, which must still happen once.
     * <pre>
     * entry: a = arg 0; c = call check(a); br_cond ifeq c -> t f
     * t:     return a
     * f:     r = call other(a); return r
     * </pre>
     */
    public static Function branchingEntry() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), t = f.newBb(), fb = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var a = arg(ib, 0, "a");
        Var c = call(ib, "check", a);
        ib.insertCtrl(JavaOps.BR_COND.create(JumpType.IFEQ).insn(c).jumpsTo(t, fb));
        ib.setBlock(t);
        ib.insertCtrl(ret(a));
        ib.setBlock(fb);
        Var r = call(ib, "other", a);
        ib.insertCtrl(ret(r));
        return f;
    }

    /**
     * <pre>
     * entry:   br body
     * body:    try java/lang/RuntimeException -> handler next
     * handler: return
     * next:    return
     * </pre>
     */
    public static Function withTry() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), body = f.newBb(), handler = f.newBb(), next = f.newBb();
        entry.setControl(Control.br(body));
        body.setControl(JavaOps.TRY.create(Type.getType(RuntimeException.class)).insn().jumpsTo(handler, next));
        handler.setControl(CommonOps.RETURN.insn().jumpsTo());
        next.setControl(CommonOps.RETURN.insn().jumpsTo());
        return f;
    }

    /**
     * <pre>
     * entry: a = arg 0; r = call f(a); return r
     * </pre>
     */
    public static Function singleBlock() {
        Function f = new Function();
        IRBuilder ib = new IRBuilder(f, f.newBb());
        Var a = arg(ib, 0, "a");
        Var r = call(ib, "f", a);
        ib.insertCtrl(ret(r));
        return f;
    }

    /**
     * <pre>
     * entry: a = arg 0; br b0
     * b0:    tableswitch a -> b1 b2 b3
     * bN:    k = const N; return k
     * </pre>
     */
    public static Function wideBranch() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), b0 = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var a = arg(ib, 0, "a");
        ib.insertCtrl(Control.br(b0));
        BasicBlock[] targets = new BasicBlock[3];
        for (int i = 0; i < targets.length; i++) {
            targets[i] = f.newBb();
            ib.setBlock(targets[i]);
            ib.insertCtrl(ret(ib.insert(constant(i + 1), "k")));
        }
        b0.setControl(JavaOps.TABLESWITCH.insn(a).jumpsTo(targets));
        return f;
    }

    /**
     * A loop back to the entry block.
     * <pre>
     * entry: c = call again(); br_cond ifne c -> entry exit
     * exit:  return c
     * </pre>
     */
    public static Function entryLoop() {
        Function f = new Function();
        BasicBlock entry = f.newBb(), exit = f.newBb();
        IRBuilder ib = new IRBuilder(f, entry);
        Var c = call(ib, "again");
        ib.insertCtrl(JavaOps.BR_COND.create(JumpType.IFNE).insn(c).jumpsTo(entry, exit));
        ib.setBlock(exit);
        ib.insertCtrl(ret(c));
        return f;
    }
}
