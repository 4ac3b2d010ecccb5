/*
 * Copyright 2018,2019, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Holds a table of named rules, and compiles it into a target notation.
 * 
 * <p>
 * Rules are added with {@link #define(String, Symbol)}. A rule may be
 * referred to with {@link #reference(String)} before it is defined, so
 * recursive and mutually recursive rules are expressed by name. The
 * quantifiers {@link #some(Symbol, Symbol)} and
 * {@link #any(Symbol, Symbol)} add rules of their own, named
 * <samp>_some_1</samp>, <samp>_some_2</samp>, and so on.
 * 
 * <p>
 * {@link #compile(String)} validates that every reference resolves,
 * then passes the rules to a renderer, the root rule first and the rest
 * in the order they were first defined. Compilation does not modify the
 * table, so compiling an unchanged grammar twice yields identical text.
 * 
 * <p>
 * Instances are not thread-safe.
 * 
 * @author simpsons
 */
public final class Grammar {
    /**
     * The name of the root rule unless {@link #setRoot(String)} is
     * called
     */
    public static final String DEFAULT_ROOT = "root";

    /**
     * The format used by {@link #compile()}
     */
    public static final String DEFAULT_FORMAT = "gbnf";

    /**
     * The prefix of names assigned to synthesized rules
     */
    public static final String SYNTHETIC_MARKER = "_";

    private static final String SOME_KIND = "some";

    private final Map<String, Symbol> rules = new LinkedHashMap<>();
    private final Set<String> synthetic = new HashSet<>();
    private final Map<String, Integer> counters = new HashMap<>();
    private final Renderers renderers;
    private String root = DEFAULT_ROOT;

    /**
     * Create an empty grammar with the standard renderers.
     */
    public Grammar() {
        this(Renderers.standard());
    }

    /**
     * Create an empty grammar with a given set of renderers.
     * 
     * @param renderers the renderers to be available to
     * {@link #compile(String)}; registrations through
     * {@link #registerRenderer(String, Renderer)} are added to this
     * object
     */
    public Grammar(Renderers renderers) {
        this.renderers = Objects.requireNonNull(renderers, "renderers");
    }

    /**
     * Define or redefine a rule. A redefined rule keeps the position of
     * its first definition.
     * 
     * @param name the rule name
     * 
     * @param body the rule body
     * 
     * @return a reference to the rule
     */
    public NonTerminal define(String name, Symbol body) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        if (name.isEmpty())
            throw new IllegalArgumentException("empty rule name");
        Symbol old = rules.put(name, body);
        synthetic.remove(name);
        if (old != null) logger.redefined(name, old, body);
        return reference(name);
    }

    /**
     * Define or redefine a rule matching literal text.
     * 
     * @param name the rule name
     * 
     * @param text the literal text
     * 
     * @return a reference to the rule
     */
    public NonTerminal define(String name, CharSequence text) {
        return define(name, Symbol.literal(text));
    }

    /**
     * Refer to a rule, whether or not it is yet defined.
     * 
     * @param name the rule name
     * 
     * @return a reference to the rule
     */
    public NonTerminal reference(String name) {
        return Symbol.reference(name);
    }

    /**
     * Designate the root rule.
     * 
     * @param name the name of the root rule; it need not be defined yet
     */
    public void setRoot(String name) {
        this.root = Objects.requireNonNull(name, "name");
    }

    /**
     * Get the name of the root rule.
     * 
     * @return the root rule's name
     */
    public String root() {
        return root;
    }

    /**
     * Get the body of a rule.
     * 
     * @param name the rule name
     * 
     * @return the rule's body, or {@code null} if not defined
     */
    public Symbol get(String name) {
        return rules.get(name);
    }

    /**
     * Determine whether a rule is defined.
     * 
     * @param name the rule name
     * 
     * @return {@code true} if the rule is defined
     */
    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    /**
     * Determine whether a rule was synthesized by a quantifier.
     * 
     * @param name the rule name
     * 
     * @return {@code true} if the rule exists and its name was assigned
     * by this grammar
     */
    public boolean isSynthetic(String name) {
        return synthetic.contains(name);
    }

    /**
     * Get the number of defined rules.
     * 
     * @return the number of rules, including synthesized ones
     */
    public int size() {
        return rules.size();
    }

    /**
     * Get the names of all defined rules.
     * 
     * @return an immutable view of the names in order of first
     * definition
     */
    public Collection<String> names() {
        return Collections.unmodifiableSet(rules.keySet());
    }

    /**
     * Make a symbol optional. No rule is created.
     * 
     * @param item the symbol
     * 
     * @return a choice of the symbol and {@link Symbol#EPSILON}
     */
    public Symbol maybe(Symbol item) {
        return Symbol.choice(Objects.requireNonNull(item, "item"),
                             Symbol.EPSILON);
    }

    /**
     * Make literal text optional.
     * 
     * @param text the text
     * 
     * @return a choice of the text and {@link Symbol#EPSILON}
     */
    public Symbol maybe(CharSequence text) {
        return maybe(Symbol.literal(text));
    }

    /**
     * Repeat a symbol one or more times.
     * 
     * @param item the repeated symbol
     * 
     * @return a reference to a new synthesized rule
     */
    public NonTerminal some(Symbol item) {
        return some(item, (Symbol) null, null);
    }

    /**
     * Repeat literal text one or more times.
     * 
     * @param text the repeated text
     * 
     * @return a reference to a new synthesized rule
     */
    public NonTerminal some(CharSequence text) {
        return some(Symbol.literal(text));
    }

    /**
     * Repeat literal text one or more times, with literal separators.
     * 
     * @param text the repeated text
     * 
     * @param separator the text between repetitions
     * 
     * @return a reference to a new synthesized rule
     */
    public NonTerminal some(CharSequence text, CharSequence separator) {
        return some(Symbol.literal(text), separator);
    }

    /**
     * Repeat a symbol one or more times, separated by literal text.
     * 
     * @param item the repeated symbol
     * 
     * @param separator the text between repetitions
     * 
     * @return a reference to a new synthesized rule
     */
    public NonTerminal some(Symbol item, CharSequence separator) {
        return some(item, Symbol.literal(separator), null);
    }

    /**
     * Repeat a symbol one or more times, with a separator.
     * 
     * @param item the repeated symbol
     * 
     * @param separator the symbol between repetitions, or {@code null}
     * for none
     * 
     * @return a reference to a new synthesized rule
     */
    public NonTerminal some(Symbol item, Symbol separator) {
        return some(item, separator, null);
    }

    /**
     * Repeat a symbol one or more times, with a separator, defining a
     * rule <var>R</var> as <var>item</var> <samp>|</samp> <var>item</var>
     * <var>separator</var> <var>R</var>.
     * 
     * @param item the repeated symbol
     * 
     * @param separator the symbol between repetitions, or {@code null}
     * for none
     * 
     * @param name the name of the new rule, or {@code null} to assign
     * the next name of the form <samp>_some_<var>N</var></samp>
     * 
     * @return a reference to the new rule
     * 
     * @throws IllegalArgumentException if a rule with the given name
     * already exists
     * 
     * @throws IllegalStateException if the assigned name is already
     * used by a user rule
     */
    public NonTerminal some(Symbol item, Symbol separator, String name) {
        Objects.requireNonNull(item, "item");
        final boolean assigned = name == null;
        if (assigned) {
            name = nextName(SOME_KIND);
            if (rules.containsKey(name))
                throw new IllegalStateException("synthetic name " + name
                    + " already in use");
        } else if (rules.containsKey(name)) {
            throw new IllegalArgumentException("rule " + name
                + " already exists");
        }

        NonTerminal self = reference(name);
        Symbol recursion = separator == null ? Symbol.sequence(item, self)
            : Symbol.sequence(item, separator, self);
        Symbol body = Symbol.choice(item, recursion);
        rules.put(name, body);
        if (assigned) synthetic.add(name);
        logger.synthesized(name, body);
        return self;
    }

    /**
     * Repeat a symbol zero or more times.
     * 
     * @param item the repeated symbol
     * 
     * @return a choice of a reference to a new synthesized rule and
     * {@link Symbol#EPSILON}
     */
    public Symbol any(Symbol item) {
        return any(item, (Symbol) null, null);
    }

    /**
     * Repeat literal text zero or more times.
     * 
     * @param text the repeated text
     * 
     * @return a choice of a reference to a new synthesized rule and
     * {@link Symbol#EPSILON}
     */
    public Symbol any(CharSequence text) {
        return any(Symbol.literal(text));
    }

    /**
     * Repeat literal text zero or more times, with literal separators.
     * 
     * @param text the repeated text
     * 
     * @param separator the text between repetitions
     * 
     * @return a choice of a reference to a new synthesized rule and
     * {@link Symbol#EPSILON}
     */
    public Symbol any(CharSequence text, CharSequence separator) {
        return any(Symbol.literal(text), separator);
    }

    /**
     * Repeat a symbol zero or more times, separated by literal text.
     * 
     * @param item the repeated symbol
     * 
     * @param separator the text between repetitions
     * 
     * @return a choice of a reference to a new synthesized rule and
     * {@link Symbol#EPSILON}
     */
    public Symbol any(Symbol item, CharSequence separator) {
        return any(item, Symbol.literal(separator), null);
    }

    /**
     * Repeat a symbol zero or more times, with a separator.
     * 
     * @param item the repeated symbol
     * 
     * @param separator the symbol between repetitions, or {@code null}
     * for none
     * 
     * @return a choice of a reference to a new synthesized rule and
     * {@link Symbol#EPSILON}
     */
    public Symbol any(Symbol item, Symbol separator) {
        return any(item, separator, null);
    }

    /**
     * Repeat a symbol zero or more times, with a separator. Only the
     * rule created by {@link #some(Symbol, Symbol, String)} is added;
     * the optionality is expressed in the returned symbol.
     * 
     * @param item the repeated symbol
     * 
     * @param separator the symbol between repetitions, or {@code null}
     * for none
     * 
     * @param name the name of the repeating rule, or {@code null} to
     * assign one
     * 
     * @return a choice of a reference to the repeating rule and
     * {@link Symbol#EPSILON}
     * 
     * @throws IllegalArgumentException if a rule with the given name
     * already exists
     */
    public Symbol any(Symbol item, Symbol separator, String name) {
        return maybe(some(item, separator, name));
    }

    /**
     * Build a sequence from a template. Text outside braces becomes
     * literal; <samp>{<var>name</var>}</samp> is replaced by the symbol
     * bound to <var>name</var>, or by a reference to the rule
     * <var>name</var> if unbound. <samp>{{</samp> and <samp>}}</samp>
     * stand for literal braces.
     * 
     * @param format the template
     * 
     * @param bindings symbols to substitute by name
     * 
     * @return the resulting sequence
     * 
     * @throws IllegalArgumentException if a brace is unmatched or a
     * placeholder is empty
     */
    public Symbol template(String format,
                           Map<String, ? extends Symbol> bindings) {
        List<Symbol> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        final int len = format.length();
        for (int i = 0; i < len; i++) {
            char c = format.charAt(i);
            if (c == '}') {
                if (i + 1 < len && format.charAt(i + 1) == '}') {
                    text.append('}');
                    i++;
                    continue;
                }
                throw new IllegalArgumentException("single '}' at " + i
                    + " in template: " + format);
            }
            if (c != '{') {
                text.append(c);
                continue;
            }
            if (i + 1 < len && format.charAt(i + 1) == '{') {
                text.append('{');
                i++;
                continue;
            }
            int end = format.indexOf('}', i + 1);
            if (end < 0) throw new IllegalArgumentException("unterminated"
                + " placeholder at " + i + " in template: " + format);
            String name = format.substring(i + 1, end);
            if (name.isEmpty()) throw new IllegalArgumentException("empty"
                + " placeholder at " + i + " in template: " + format);
            if (text.length() > 0) {
                parts.add(Symbol.literal(text));
                text.setLength(0);
            }
            Symbol bound = bindings.get(name);
            parts.add(bound != null ? bound : reference(name));
            i = end;
        }
        if (text.length() > 0) parts.add(Symbol.literal(text));
        return Symbol.sequence(parts);
    }

    /**
     * Build a sequence from a template, resolving every placeholder as
     * a rule reference.
     * 
     * @param format the template
     * 
     * @return the resulting sequence
     * 
     * @see #template(String, Map)
     */
    public Symbol template(String format) {
        return template(format, Collections.emptyMap());
    }

    private String nextName(String kind) {
        int next = counters.merge(kind, 1, Integer::sum);
        return SYNTHETIC_MARKER + kind + "_" + next;
    }

    /**
     * Check that the root rule is defined, and that every reference in
     * every rule resolves. Rules are checked in definition order, and
     * each body depth-first from left to right, so the reported
     * reference is always the same for the same table. Recursion is
     * permitted.
     * 
     * @throws UndefinedRuleException if the root or a referenced rule
     * is not defined
     */
    public void validate() throws UndefinedRuleException {
        if (!rules.containsKey(root))
            throw new UndefinedRuleException(root, null);
        for (Map.Entry<String, Symbol> entry : rules.entrySet()) {
            String missing = entry.getValue().accept(unresolved);
            if (missing != null)
                throw new UndefinedRuleException(missing, entry.getKey());
        }
    }

    private final SymbolVisitor<String, RuntimeException> unresolved =
        new SymbolVisitor<String, RuntimeException>() {
            @Override
            public String visitLiteral(Literal symbol) {
                return null;
            }

            @Override
            public String visitRegex(Regex symbol) {
                return null;
            }

            @Override
            public String visitSequence(Sequence symbol) {
                return first(symbol.items());
            }

            @Override
            public String visitChoice(Choice symbol) {
                return first(symbol.alternatives());
            }

            @Override
            public String visitEpsilon(Epsilon symbol) {
                return null;
            }

            @Override
            public String visitReference(NonTerminal symbol) {
                return rules.containsKey(symbol.name()) ? null
                    : symbol.name();
            }

            private String first(List<Symbol> parts) {
                for (Symbol part : parts) {
                    String missing = part.accept(this);
                    if (missing != null) return missing;
                }
                return null;
            }
        };

    /**
     * Get the rules in emission order. The root rule comes first, if
     * defined, followed by all other rules in order of first
     * definition.
     * 
     * @return an immutable list of the rules
     */
    public List<Rule> orderedRules() {
        List<Rule> result = new ArrayList<>(rules.size());
        Symbol rootBody = rules.get(root);
        if (rootBody != null)
            result.add(new Rule(root, rootBody, synthetic.contains(root)));
        for (Map.Entry<String, Symbol> entry : rules.entrySet()) {
            String name = entry.getKey();
            if (name.equals(root)) continue;
            result.add(new Rule(name, entry.getValue(),
                                synthetic.contains(name)));
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Compile the grammar with a given renderer.
     * 
     * @param renderer the renderer
     * 
     * @return the rendered grammar
     * 
     * @throws UndefinedRuleException if the root or a referenced rule
     * is not defined
     * 
     * @throws RendererRejectedException if the renderer cannot express
     * the grammar
     */
    public String compile(Renderer renderer)
        throws UndefinedRuleException,
            RendererRejectedException {
        Objects.requireNonNull(renderer, "renderer");
        validate();
        List<Rule> ordered = orderedRules();
        String result = renderer.render(ordered, root);
        logger.compiled(ordered.size(), renderer);
        return result;
    }

    /**
     * Compile the grammar into a registered format.
     * 
     * @param format the format identifier
     * 
     * @return the rendered grammar
     * 
     * @throws UnknownFormatException if no renderer is registered for
     * the format
     * 
     * @throws UndefinedRuleException if the root or a referenced rule
     * is not defined
     * 
     * @throws RendererRejectedException if the renderer cannot express
     * the grammar
     */
    public String compile(String format)
        throws UnknownFormatException,
            UndefinedRuleException,
            RendererRejectedException {
        return compile(renderers.get(format));
    }

    /**
     * Compile the grammar into the {@linkplain #DEFAULT_FORMAT default
     * format}.
     * 
     * @return the rendered grammar
     * 
     * @throws GrammarException if the grammar could not be compiled
     */
    public String compile() throws GrammarException {
        return compile(DEFAULT_FORMAT);
    }

    /**
     * Make a renderer available to {@link #compile(String)}, replacing
     * any already registered under the same identifier.
     * 
     * @param format the format identifier
     * 
     * @param renderer the renderer
     */
    public void registerRenderer(String format, Renderer renderer) {
        renderers.register(format, renderer);
    }

    /**
     * Get the renderers available to {@link #compile(String)}.
     * 
     * @return the renderer registry
     */
    public Renderers renderers() {
        return renderers;
    }

    /**
     * Remove rules that can only match the empty string. References to
     * them are replaced by {@link Symbol#EPSILON}, and the remaining
     * bodies are simplified: a choice keeps at most one empty
     * alternative, placed last. The root rule is never removed, but may
     * be reduced to {@link Symbol#EPSILON}.
     * 
     * @return the names of the removed rules, in definition order
     */
    public Set<String> pruneEmptyRules() {
        Set<String> empty = new LinkedHashSet<>();
        for (boolean changed = true; changed;) {
            changed = false;
            for (Map.Entry<String, Symbol> entry : rules.entrySet()) {
                if (empty.contains(entry.getKey())) continue;
                if (matchesOnlyEmpty(entry.getValue(), empty)) {
                    empty.add(entry.getKey());
                    changed = true;
                }
            }
        }

        Map<String, Symbol> kept = new LinkedHashMap<>();
        Set<String> removed = new LinkedHashSet<>();
        for (Map.Entry<String, Symbol> entry : rules.entrySet()) {
            String name = entry.getKey();
            if (name.equals(root)) {
                kept.put(name, empty.contains(name) ? Symbol.EPSILON
                    : prune(entry.getValue(), empty));
            } else if (empty.contains(name)) {
                removed.add(name);
            } else {
                kept.put(name, prune(entry.getValue(), empty));
            }
        }
        rules.clear();
        rules.putAll(kept);
        synthetic.removeAll(removed);
        if (!removed.isEmpty()) logger.pruned(removed);
        return removed;
    }

    private static boolean matchesOnlyEmpty(Symbol symbol,
                                            Set<String> empty) {
        if (symbol instanceof Epsilon) return true;
        if (symbol instanceof NonTerminal)
            return empty.contains(((NonTerminal) symbol).name());
        if (symbol instanceof Sequence) {
            for (Symbol item : ((Sequence) symbol).items())
                if (!matchesOnlyEmpty(item, empty)) return false;
            return true;
        }
        if (symbol instanceof Choice) {
            for (Symbol alt : ((Choice) symbol).alternatives())
                if (!matchesOnlyEmpty(alt, empty)) return false;
            return true;
        }
        return false;
    }

    private static Symbol prune(Symbol symbol, Set<String> empty) {
        if (symbol instanceof NonTerminal) {
            if (empty.contains(((NonTerminal) symbol).name()))
                return Symbol.EPSILON;
            return symbol;
        }
        if (symbol instanceof Sequence) {
            List<Symbol> items = new ArrayList<>();
            for (Symbol item : ((Sequence) symbol).items())
                items.add(prune(item, empty));
            return Symbol.sequence(items);
        }
        if (symbol instanceof Choice) {
            List<Symbol> alts = new ArrayList<>();
            boolean optional = false;
            for (Symbol alt : ((Choice) symbol).alternatives()) {
                Symbol pruned = prune(alt, empty);
                if (pruned instanceof Epsilon) {
                    optional = true;
                } else if (pruned instanceof Choice) {
                    /* An alternative may collapse to an optional choice,
                     * whose epsilon must still end up last. */
                    for (Symbol inner : ((Choice) pruned).alternatives()) {
                        if (inner instanceof Epsilon)
                            optional = true;
                        else
                            alts.add(inner);
                    }
                } else {
                    alts.add(pruned);
                }
            }
            if (alts.isEmpty()) return Symbol.EPSILON;
            if (optional) alts.add(Symbol.EPSILON);
            return Symbol.choice(alts);
        }
        return symbol;
    }

    @Detail(ShadowLevel.FINE)
    private interface Pretty extends FormattedLogger {
        @Format("rule %s synthesized as %s")
        void synthesized(String name, Symbol body);

        @Format("rule %s redefined from %s to %s")
        void redefined(String name, Symbol old, Symbol body);

        @Format("compiled %d rules with %s")
        void compiled(int count, Renderer renderer);

        @Format("rules matching only the empty string removed: %s")
        void pruned(Collection<String> names);
    }

    private static final Pretty logger =
        FormattedLogger.get(Grammar.class.getName(), Pretty.class);
}
