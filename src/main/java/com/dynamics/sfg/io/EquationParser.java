package com.dynamics.sfg.io;

import com.dynamics.sfg.api.ModelDefinitionException;
import com.dynamics.sfg.fn.BinaryOp;
import com.dynamics.sfg.fn.Distribution;
import com.dynamics.sfg.fn.Expr;
import com.dynamics.sfg.fn.ReduceOp;
import com.dynamics.sfg.fn.UnaryFn;
import com.dynamics.sfg.node.Model;
import com.dynamics.sfg.node.Reference;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for equation text.
 *
 * <p>
 * Implements a recursive descent parser over the equation language used by
 * model definition files and by {@link Model#applyConfig}. Names resolve
 * relative to the model passed in; dotted names address nested models.
 *
 * <p>
 * Precedence, loosest first:
 * <ul>
 * <li>{@code or}</li>
 * <li>{@code and}</li>
 * <li>{@code < <= > >= == !=}</li>
 * <li>{@code + -}</li>
 * <li>{@code * / %}</li>
 * <li>unary {@code -} and {@code not}</li>
 * <li>{@code ^} (right associative)</li>
 * </ul>
 * A minus directly followed by a number literal is folded into a negative
 * constant. Function calls: the math functions, {@code min/max},
 * {@code sum/mean/vmin/vmax}, {@code piecewise([branches], [conditions])},
 * {@code interpolate(x, [xs], [ys])}, {@code pulse(start, interval[, magnitude])},
 * {@code lag(ref, k)}, {@code index(ref, i)} and
 * {@code series_min/series_max/series_sum/series_mean(ref)}.
 */
public final class EquationParser {
    private EquationParser() {
        // Utility class
    }

    /**
     * Parses an equation.
     *
     * @throws ModelDefinitionException on syntax errors and unknown names.
     */
    public static Expr parse(String text, Model scope) {
        var cursor = new Cursor(text, scope);
        Expr e = cursor.parseExpr();
        cursor.expectEnd();
        return e;
    }

    /**
     * Parses prior text such as {@code Uniform(0, 1)}.
     *
     * @return the distribution, or null if the text is not a prior call.
     * @throws ModelDefinitionException when it is a prior call with bad arguments.
     */
    public static Distribution parsePrior(String text) {
        var cursor = new Cursor(text, null);
        cursor.skipWS();
        int start = cursor.pos;
        String name = cursor.identifier();
        Distribution.Family family = name == null ? null : Distribution.Family.byName(name);
        if (family == null || !cursor.peek('(')) {
            cursor.pos = start;
            return null;
        }
        Distribution d = cursor.prior(family);
        cursor.expectEnd();
        return d;
    }

    private static final class Cursor {
        private final String input;
        private final Model scope;
        private int pos;

        Cursor(String input, Model scope) {
            this.input = input;
            this.scope = scope;
        }

        Expr parseExpr() {
            return parseOr();
        }

        private Expr parseOr() {
            Expr left = parseAnd();
            while (keyword("or"))
                left = new Expr.Binary(BinaryOp.OR, left, parseAnd());
            return left;
        }

        private Expr parseAnd() {
            Expr left = parseComparison();
            while (keyword("and"))
                left = new Expr.Binary(BinaryOp.AND, left, parseComparison());
            return left;
        }

        private Expr parseComparison() {
            Expr left = parseAdditive();
            while (true) {
                BinaryOp op;
                if (symbol("<="))
                    op = BinaryOp.LE;
                else if (symbol(">="))
                    op = BinaryOp.GE;
                else if (symbol("=="))
                    op = BinaryOp.EQ;
                else if (symbol("!="))
                    op = BinaryOp.NE;
                else if (symbol("<"))
                    op = BinaryOp.LT;
                else if (symbol(">"))
                    op = BinaryOp.GT;
                else
                    return left;
                left = new Expr.Binary(op, left, parseAdditive());
            }
        }

        private Expr parseAdditive() {
            Expr left = parseTerm();
            while (true) {
                if (symbol("+"))
                    left = new Expr.Binary(BinaryOp.ADD, left, parseTerm());
                else if (symbol("-"))
                    left = new Expr.Binary(BinaryOp.SUB, left, parseTerm());
                else
                    return left;
            }
        }

        private Expr parseTerm() {
            Expr left = parseUnary();
            while (true) {
                if (symbol("*"))
                    left = new Expr.Binary(BinaryOp.MUL, left, parseUnary());
                else if (symbol("/"))
                    left = new Expr.Binary(BinaryOp.DIV, left, parseUnary());
                else if (symbol("%"))
                    left = new Expr.Binary(BinaryOp.MOD, left, parseUnary());
                else
                    return left;
            }
        }

        private Expr parseUnary() {
            if (symbol("-")) {
                skipWS();
                boolean literal = pos < input.length() && isNumberStart(input.charAt(pos));
                Expr arg = literal ? parsePower() : parseUnary();
                if (literal && arg instanceof Expr.Constant c && c.dim() == 1)
                    return new Expr.Constant(new double[] { -c.value(0) });
                return new Expr.Unary(UnaryFn.NEG, arg);
            }
            if (keyword("not"))
                return new Expr.Unary(UnaryFn.NOT, parseUnary());
            return parsePower();
        }

        private Expr parsePower() {
            Expr base = parsePrimary();
            if (symbol("^"))
                return new Expr.Binary(BinaryOp.POW, base, parseUnary());
            return base;
        }

        private Expr parsePrimary() {
            skipWS();
            if (pos >= input.length())
                throw err("Unexpected end");
            char c = input.charAt(pos);
            if (c == '(') {
                pos++;
                Expr inner = parseExpr();
                expect(')');
                return inner;
            }
            if (c == '[')
                return new Expr.Constant(numberList());
            if (isNumberStart(c))
                return new Expr.Constant(new double[] { number() });
            int start = pos;
            String name = identifier();
            if (name == null)
                throw err("Unexpected: " + c);
            if (peek('('))
                return call(name, start);
            if (Model.TIME_NAME.equals(name))
                return new Expr.Time();
            return new Expr.Ref(reference(name, start));
        }

        private Expr call(String name, int start) {
            expect('(');
            UnaryFn fn = UnaryFn.byName(name);
            if (fn != null) {
                Expr arg = parseExpr();
                expect(')');
                return new Expr.Unary(fn, arg);
            }
            ReduceOp vector = ReduceOp.byVectorName(name);
            if (vector != null) {
                Expr arg = parseExpr();
                expect(')');
                return new Expr.Reduce(vector, arg);
            }
            ReduceOp series = ReduceOp.bySeriesName(name);
            if (series != null) {
                Reference ref = referenceArg();
                expect(')');
                return new Expr.SeriesReduce(series, ref);
            }
            switch (name) {
                case "min", "max" -> {
                    BinaryOp op = name.equals("min") ? BinaryOp.MIN : BinaryOp.MAX;
                    Expr acc = parseExpr();
                    expect(',');
                    acc = new Expr.Binary(op, acc, parseExpr());
                    while (optional(','))
                        acc = new Expr.Binary(op, acc, parseExpr());
                    expect(')');
                    return acc;
                }
                case "piecewise" -> {
                    List<Expr> branches = exprList();
                    expect(',');
                    List<Expr> conditions = exprList();
                    expect(')');
                    try {
                        return new Expr.Piecewise(branches, conditions);
                    } catch (IllegalArgumentException e) {
                        throw err(e.getMessage());
                    }
                }
                case "interpolate" -> {
                    Expr x = parseExpr();
                    expect(',');
                    double[] xs = numberList();
                    expect(',');
                    double[] ys = numberList();
                    expect(')');
                    return new Expr.Interpolate(x, xs, ys);
                }
                case "pulse" -> {
                    Expr startAt = parseExpr();
                    expect(',');
                    Expr interval = parseExpr();
                    Expr magnitude = optional(',') ? parseExpr() : new Expr.Constant(new double[] { 1.0 });
                    expect(')');
                    return new Expr.Pulse(startAt, interval, magnitude);
                }
                case "lag" -> {
                    Reference ref = referenceArg();
                    expect(',');
                    int k = integer();
                    expect(')');
                    return new Expr.Lag(ref, k);
                }
                case "index" -> {
                    Reference ref = referenceArg();
                    expect(',');
                    int i = integer();
                    expect(')');
                    return new Expr.SeriesIndex(ref, i);
                }
                default -> {
                    if (Distribution.Family.byName(name) != null)
                        throw err("Prior " + name + " is not an expression; bind it as a prior");
                    pos = start;
                    throw err("Unknown function '" + name + "'");
                }
            }
        }

        Distribution prior(Distribution.Family family) {
            expect('(');
            List<Double> args = new ArrayList<>();
            if (!optional(')')) {
                do {
                    args.add(signedNumber());
                } while (optional(','));
                expect(')');
            }
            double[] params = new double[args.size()];
            for (int i = 0; i < params.length; i++)
                params[i] = args.get(i);
            return new Distribution(family, params);
        }

        private List<Expr> exprList() {
            expect('[');
            List<Expr> out = new ArrayList<>();
            if (optional(']'))
                return out;
            do {
                out.add(parseExpr());
            } while (optional(','));
            expect(']');
            return out;
        }

        private double[] numberList() {
            expect('[');
            List<Double> out = new ArrayList<>();
            if (!optional(']')) {
                do {
                    out.add(signedNumber());
                } while (optional(','));
                expect(']');
            }
            if (out.isEmpty())
                throw err("Empty list");
            double[] arr = new double[out.size()];
            for (int i = 0; i < arr.length; i++)
                arr[i] = out.get(i);
            return arr;
        }

        private Reference referenceArg() {
            skipWS();
            int start = pos;
            String name = identifier();
            if (name == null)
                throw err("Expected a reference name");
            return reference(name, start);
        }

        private Reference reference(String name, int start) {
            Reference r = scope == null ? null : scope.find(name);
            if (r == null) {
                pos = start;
                throw err("Unknown reference '" + name + "'");
            }
            return r;
        }

        private int integer() {
            double v = signedNumber();
            if (v != Math.rint(v))
                throw err("Expected an integer, got " + v);
            return (int) v;
        }

        private double signedNumber() {
            skipWS();
            boolean negative = false;
            if (pos < input.length() && (input.charAt(pos) == '-' || input.charAt(pos) == '+')) {
                negative = input.charAt(pos) == '-';
                pos++;
                skipWS();
            }
            double v = number();
            return negative ? -v : v;
        }

        private double number() {
            skipWS();
            int s = pos;
            while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                pos++;
            if (pos < input.length() && input.charAt(pos) == '.') {
                pos++;
                while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                    pos++;
            }
            if (pos < input.length() && (input.charAt(pos) == 'e' || input.charAt(pos) == 'E')) {
                pos++;
                if (pos < input.length() && (input.charAt(pos) == '+' || input.charAt(pos) == '-'))
                    pos++;
                while (pos < input.length() && Character.isDigit(input.charAt(pos)))
                    pos++;
            }
            if (s == pos)
                throw err("Expected a number");
            try {
                return Double.parseDouble(input.substring(s, pos));
            } catch (NumberFormatException e) {
                pos = s;
                throw err("Malformed number");
            }
        }

        /** Dotted identifier, or null (position unchanged) if none starts here. */
        String identifier() {
            skipWS();
            int s = pos;
            if (pos >= input.length() || !isIdentStart(input.charAt(pos)))
                return null;
            while (pos < input.length()
                    && (isIdentPart(input.charAt(pos)) || input.charAt(pos) == '.'))
                pos++;
            return input.substring(s, pos);
        }

        private boolean keyword(String word) {
            skipWS();
            int end = pos + word.length();
            if (input.startsWith(word, pos) && (end >= input.length() || !isIdentPart(input.charAt(end)))) {
                pos = end;
                return true;
            }
            return false;
        }

        private boolean symbol(String s) {
            skipWS();
            if (!input.startsWith(s, pos))
                return false;
            // "<" and ">" must not eat the first half of "<=" and ">="
            if (s.length() == 1 && (s.equals("<") || s.equals(">")) && input.startsWith("=", pos + 1))
                return false;
            pos += s.length();
            return true;
        }

        boolean peek(char c) {
            skipWS();
            return pos < input.length() && input.charAt(pos) == c;
        }

        private boolean optional(char c) {
            if (peek(c)) {
                pos++;
                return true;
            }
            return false;
        }

        private void expect(char c) {
            skipWS();
            if (pos >= input.length() || input.charAt(pos) != c)
                throw err("Expected '" + c + "'");
            pos++;
        }

        void expectEnd() {
            skipWS();
            if (pos < input.length())
                throw err("Unexpected trailing input");
        }

        void skipWS() {
            while (pos < input.length() && Character.isWhitespace(input.charAt(pos)))
                pos++;
        }

        private static boolean isNumberStart(char c) {
            return Character.isDigit(c) || c == '.';
        }

        private static boolean isIdentStart(char c) {
            return Character.isLetter(c) || c == '_';
        }

        private static boolean isIdentPart(char c) {
            return Character.isLetterOrDigit(c) || c == '_';
        }

        private ModelDefinitionException err(String msg) {
            return new ModelDefinitionException(msg + " at pos " + pos + " in '" + input + "'");
        }
    }
}
