package com.dynamics.sfg.io;

import com.dynamics.sfg.fn.BinaryOp;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.UnaryFn;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.Reference;

import java.util.List;

/**
 * Prints expression trees as canonical equation text, the inverse of
 * {@link EquationParser}: parsing the printed text against the same scope
 * yields an equal tree.
 */
public final class ExprFormatter {
    private ExprFormatter() {
        // Utility class
    }

    /**
     * @param scope model the printed names are relative to; references outside
     *              it are printed with their full qualified name.
     */
    public static String format(Expr expr, Model scope) {
        StringBuilder sb = new StringBuilder();
        write(expr, scope, sb);
        return sb.toString();
    }

    private static void write(Expr expr, Model scope, StringBuilder sb) {
        switch (expr.kind()) {
            case CONSTANT -> constant((Expr.Constant) expr, sb);
            case REF -> sb.append(name(((Expr.Ref) expr).ref(), scope));
            case TIME -> sb.append(Model.TIME_NAME);
            case BINARY -> binary((Expr.Binary) expr, scope, sb);
            case UNARY -> {
                var u = (Expr.Unary) expr;
                sb.append(u.fn() == UnaryFn.NEG ? "-" : u.fn().symbol()).append('(');
                write(u.arg(), scope, sb);
                sb.append(')');
            }
            case PIECEWISE -> {
                var pw = (Expr.Piecewise) expr;
                sb.append("piecewise(");
                list(pw.branches(), scope, sb);
                sb.append(", ");
                list(pw.conditions(), scope, sb);
                sb.append(')');
            }
            case INTERPOLATE -> {
                var in = (Expr.Interpolate) expr;
                sb.append("interpolate(");
                write(in.x(), scope, sb);
                sb.append(", ");
                numbers(in.xs(), sb);
                sb.append(", ");
                numbers(in.ys(), sb);
                sb.append(')');
            }
            case PULSE -> {
                var p = (Expr.Pulse) expr;
                sb.append("pulse(");
                write(p.start(), scope, sb);
                sb.append(", ");
                write(p.interval(), scope, sb);
                sb.append(", ");
                write(p.magnitude(), scope, sb);
                sb.append(')');
            }
            case LAG -> {
                var lag = (Expr.Lag) expr;
                sb.append("lag(").append(name(lag.ref(), scope)).append(", ").append(lag.steps()).append(')');
            }
            case REDUCE -> {
                var r = (Expr.Reduce) expr;
                sb.append(r.op().vectorName()).append('(');
                write(r.arg(), scope, sb);
                sb.append(')');
            }
            case SERIES_INDEX -> {
                var s = (Expr.SeriesIndex) expr;
                sb.append("index(").append(name(s.ref(), scope)).append(", ").append(s.index()).append(')');
            }
            case SERIES_REDUCE -> {
                var s = (Expr.SeriesReduce) expr;
                sb.append(s.op().seriesName()).append('(').append(name(s.ref(), scope)).append(')');
            }
        }
    }

    private static void binary(Expr.Binary b, Model scope, StringBuilder sb) {
        BinaryOp op = b.op();
        if (!op.isInfix()) {
            sb.append(op.symbol()).append('(');
            write(b.left(), scope, sb);
            sb.append(", ");
            write(b.right(), scope, sb);
            sb.append(')');
            return;
        }
        // Left-associative except ^, which binds to the right
        boolean rightAssoc = op == BinaryOp.POW;
        operand(b.left(), op, rightAssoc, scope, sb);
        sb.append(' ').append(op.symbol()).append(' ');
        operand(b.right(), op, !rightAssoc, scope, sb);
    }

    private static void operand(Expr child, BinaryOp parent, boolean tieNeedsParens, Model scope,
            StringBuilder sb) {
        if (needsParens(child, parent, tieNeedsParens)) {
            sb.append('(');
            write(child, scope, sb);
            sb.append(')');
        } else {
            write(child, scope, sb);
        }
    }

    private static boolean needsParens(Expr child, BinaryOp parent, boolean tieNeedsParens) {
        if (child instanceof Expr.Constant c)
            return c.dim() == 1 && (c.value(0) < 0 || 1.0 / c.value(0) < 0);
        if (child instanceof Expr.Unary u)
            return u.fn() == UnaryFn.NEG || u.fn() == UnaryFn.NOT;
        if (child instanceof Expr.Binary cb && cb.op().isInfix()) {
            int cp = cb.op().precedence();
            int pp = parent.precedence();
            return cp < pp || (cp == pp && tieNeedsParens);
        }
        return false;
    }

    private static void list(List<Expr> exprs, Model scope, StringBuilder sb) {
        sb.append('[');
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0)
                sb.append(", ");
            write(exprs.get(i), scope, sb);
        }
        sb.append(']');
    }

    private static void constant(Expr.Constant c, StringBuilder sb) {
        if (c.dim() == 1)
            sb.append(c.value(0));
        else
            numbers(c.values(), sb);
    }

    private static void numbers(double[] values, StringBuilder sb) {
        sb.append('[');
        for (int i = 0; i < values.length; i++) {
            if (i > 0)
                sb.append(", ");
            sb.append(values[i]);
        }
        sb.append(']');
    }

    private static String name(Reference ref, Model scope) {
        String n = scope == null ? null : scope.nameOf(ref);
        return n != null ? n : ref.qualifiedName();
    }
}
