package com.gaming.rewire.api;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Boolean gating formula over named propositions (areas, key items or config
 * variables).
 *
 * An expression is either a {@link Named} leaf or a {@link Combinator}. A
 * combinator with {@code every = true} is a conjunction; otherwise it is an
 * "OR-k" disjunction that needs at least {@code max(1, count)} of its terms.
 * The empty conjunction is {@link #TRUE} and the empty disjunction is
 * {@link #FALSE}.
 *
 * Instances are immutable records, so equality and hashing are structural and
 * results of {@link #substitute(Map)} and {@link #simplify()} can be cached by
 * key.
 */
public interface Expr {

    Expr TRUE = new Combinator(true, 0, List.of());
    Expr FALSE = new Combinator(false, 0, List.of());

    static Expr named(String name) {
        return new Named(name);
    }

    static Expr and(List<Expr> terms) {
        return new Combinator(true, 0, terms);
    }

    static Expr or(List<Expr> terms) {
        return new Combinator(false, 0, terms);
    }

    static Expr atLeast(int count, List<Expr> terms) {
        return new Combinator(false, count, terms);
    }

    boolean isTrue();

    boolean isFalse();

    /** All variable names mentioned anywhere in the tree, sorted. */
    SortedSet<String> freeVars();

    /**
     * Replaces every variable found in {@code config} by its expression,
     * recursively.
     */
    Expr substitute(Map<String, Expr> config);

    /**
     * Flattens nested same-kind combinators, drops satisfied or impossible
     * terms and deduplicates leaves.
     */
    Expr simplify();

    /**
     * Computes when this expression becomes satisfiable given the time each
     * variable becomes available ({@code Double.POSITIVE_INFINITY} for never),
     * together with the variables that were used to satisfy it.
     */
    Unlock unlock(ToDoubleFunction<String> readyAt);

    /** Whether every way of satisfying this expression requires {@code var}. */
    default boolean needs(String var) {
        if (this instanceof Named n) {
            return n.name().equals(var);
        }
        Combinator c = (Combinator) this;
        if (c.every()) {
            return c.terms().stream().anyMatch(t -> t.needs(var));
        }
        if (c.terms().isEmpty()) {
            return false;
        }
        // Satisfiable without var iff enough terms remain that do not need it
        long free = c.terms().stream().filter(t -> !t.needs(var)).count();
        return free < c.needed();
    }

    /** Time at which this expression unlocks, {@code POSITIVE_INFINITY} for never. */
    default double cost(ToDoubleFunction<String> readyAt) {
        return unlock(readyAt).at();
    }

    /** Result of {@link #unlock(ToDoubleFunction)}. */
    record Unlock(double at, List<String> vars) {
        public static final Unlock NEVER = new Unlock(Double.POSITIVE_INFINITY, List.of());
        public static final Unlock ALWAYS = new Unlock(0, List.of());

        public boolean satisfiable() {
            return at != Double.POSITIVE_INFINITY;
        }
    }

    /** A single named proposition. */
    record Named(String name) implements Expr {
        public Named {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Variable name must not be blank");
            }
        }

        @Override
        public boolean isTrue() {
            return false;
        }

        @Override
        public boolean isFalse() {
            return false;
        }

        @Override
        public SortedSet<String> freeVars() {
            return new TreeSet<>(List.of(name));
        }

        @Override
        public Expr substitute(Map<String, Expr> config) {
            Expr replacement = config.get(name);
            return replacement == null ? this : replacement.substitute(config);
        }

        @Override
        public Expr simplify() {
            return this;
        }

        @Override
        public Unlock unlock(ToDoubleFunction<String> readyAt) {
            double at = readyAt.applyAsDouble(name);
            return at == Double.POSITIVE_INFINITY ? Unlock.NEVER : new Unlock(at, List.of(name));
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** AND, OR or OR-k over a list of terms. */
    record Combinator(boolean every, int count, List<Expr> terms) implements Expr {
        public Combinator {
            if (count < 0) {
                throw new IllegalArgumentException("Negative expression count " + count);
            }
            if (count > 0 && every) {
                throw new IllegalArgumentException("Given an expression count alongside a conjunction");
            }
            // OR1 and OR are the same thing
            if (count == 1) {
                count = 0;
            }
            terms = List.copyOf(terms);
        }

        /** Number of terms an OR needs. */
        int needed() {
            return Math.max(1, count);
        }

        @Override
        public boolean isTrue() {
            return every && terms.isEmpty();
        }

        @Override
        public boolean isFalse() {
            return !every && terms.isEmpty();
        }

        @Override
        public SortedSet<String> freeVars() {
            SortedSet<String> vars = new TreeSet<>();
            for (Expr term : terms) {
                vars.addAll(term.freeVars());
            }
            return vars;
        }

        @Override
        public Expr substitute(Map<String, Expr> config) {
            List<Expr> out = new ArrayList<>(terms.size());
            for (Expr term : terms) {
                out.add(term.substitute(config));
            }
            return new Combinator(every, count, out);
        }

        @Override
        public Expr simplify() {
            if (terms.isEmpty()) {
                return this;
            }
            Set<Expr> out = new LinkedHashSet<>();
            int needed = every ? 0 : needed();
            for (Expr term : terms) {
                Expr s = term.simplify();
                if (s.isTrue()) {
                    if (every) {
                        continue;
                    }
                    if (--needed == 0) {
                        return TRUE;
                    }
                } else if (s.isFalse()) {
                    if (every) {
                        return FALSE;
                    }
                } else if (s instanceof Combinator c && c.every == every && (every || (needed == 1 && c.count == 0))) {
                    out.addAll(c.terms);
                } else {
                    out.add(s);
                }
            }
            if (every) {
                if (out.isEmpty()) {
                    return TRUE;
                }
                return out.size() == 1 ? out.iterator().next() : new Combinator(true, 0, new ArrayList<>(out));
            }
            if (out.size() < needed) {
                return FALSE;
            }
            if (out.size() == 1) {
                return out.iterator().next();
            }
            return new Combinator(false, needed, new ArrayList<>(out));
        }

        @Override
        public Unlock unlock(ToDoubleFunction<String> readyAt) {
            if (every) {
                double at = 0;
                List<String> vars = new ArrayList<>();
                for (Expr term : terms) {
                    Unlock u = term.unlock(readyAt);
                    if (!u.satisfiable()) {
                        return Unlock.NEVER;
                    }
                    at = Math.max(at, u.at());
                    vars.addAll(u.vars());
                }
                return new Unlock(at, vars);
            }
            List<Unlock> options = new ArrayList<>(terms.size());
            for (Expr term : terms) {
                Unlock u = term.unlock(readyAt);
                if (u.satisfiable()) {
                    options.add(u);
                }
            }
            int needed = needed();
            if (options.size() < needed) {
                return Unlock.NEVER;
            }
            options.sort(Comparator.comparingDouble(Unlock::at));
            double at = 0;
            List<String> vars = new ArrayList<>();
            for (Unlock u : options.subList(0, needed)) {
                at = Math.max(at, u.at());
                vars.addAll(u.vars());
            }
            return new Unlock(at, vars);
        }

        @Override
        public String toString() {
            if (terms.isEmpty()) {
                return every ? "true" : "false";
            }
            String op = every ? "AND" : (count == 0 ? "OR" : "OR" + count);
            return terms.stream().map(Expr::toString).collect(Collectors.joining(" " + op + " ", "(", ")"));
        }
    }
}
