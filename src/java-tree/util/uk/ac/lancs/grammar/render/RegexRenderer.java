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

package uk.ac.lancs.grammar.render;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import uk.ac.lancs.grammar.Choice;
import uk.ac.lancs.grammar.Epsilon;
import uk.ac.lancs.grammar.Literal;
import uk.ac.lancs.grammar.NonTerminal;
import uk.ac.lancs.grammar.Regex;
import uk.ac.lancs.grammar.Renderer;
import uk.ac.lancs.grammar.RendererRejectedException;
import uk.ac.lancs.grammar.Rule;
import uk.ac.lancs.grammar.Sequence;
import uk.ac.lancs.grammar.Symbol;
import uk.ac.lancs.grammar.SymbolVisitor;

/**
 * Renders a grammar as a single Java regular expression matching the
 * root rule. References are expanded in place, so rules not reachable
 * from the root are ignored, and recursive rules are rejected.
 * Alternatives are grouped with <samp>(?:&hellip;)</samp>, as are
 * patterns, so that their own alternatives do not escape. Literal text
 * has its metacharacters escaped.
 * 
 * @author simpsons
 */
public final class RegexRenderer implements Renderer {
    private static final String METACHARACTERS = "\\^$.|?*+()[]{}";

    @Override
    public String render(List<Rule> rules, String root)
        throws RendererRejectedException {
        Map<String, Symbol> bodies = new HashMap<>();
        for (Rule rule : rules)
            bodies.put(rule.name(), rule.body());

        StringBuilder result = new StringBuilder();
        new Writer(result, bodies).expand(root);
        String text = result.toString();
        try {
            Pattern.compile(text);
        } catch (PatternSyntaxException ex) {
            throw new RendererRejectedException("not a valid pattern: "
                + text, ex);
        }
        return text;
    }

    /**
     * Escape metacharacters in literal text.
     * 
     * @param text the literal text
     * 
     * @return a pattern matching exactly the text
     */
    static String escape(String text) {
        StringBuilder result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (METACHARACTERS.indexOf(c) >= 0) result.append('\\');
            result.append(c);
        }
        return result.toString();
    }

    private static final class Writer
        implements SymbolVisitor<Void, RendererRejectedException> {
        private final StringBuilder out;
        private final Map<String, Symbol> bodies;
        private final Set<String> expanding = new LinkedHashSet<>();

        Writer(StringBuilder out, Map<String, Symbol> bodies) {
            this.out = out;
            this.bodies = bodies;
        }

        void expand(String name) throws RendererRejectedException {
            NonTerminal ref = Symbol.reference(name);
            if (!expanding.add(name)) {
                List<String> cycle = new ArrayList<>(expanding);
                cycle = cycle.subList(cycle.indexOf(name), cycle.size());
                throw new RendererRejectedException("recursion through "
                    + String.join(" -> ", cycle) + " -> " + name
                    + " cannot be expressed as a regular expression", ref);
            }
            Symbol body = bodies.get(name);
            if (body == null)
                throw new RendererRejectedException("no rule " + name, ref);
            body.accept(this);
            expanding.remove(name);
        }

        @Override
        public Void visitLiteral(Literal symbol) {
            out.append(escape(symbol.text()));
            return null;
        }

        @Override
        public Void visitRegex(Regex symbol) {
            out.append("(?:").append(symbol.pattern()).append(')');
            return null;
        }

        @Override
        public Void visitSequence(Sequence symbol)
            throws RendererRejectedException {
            for (Symbol item : symbol.items())
                item.accept(this);
            return null;
        }

        @Override
        public Void visitChoice(Choice symbol)
            throws RendererRejectedException {
            String sep = "(?:";
            for (Symbol alt : symbol.alternatives()) {
                out.append(sep);
                alt.accept(this);
                sep = "|";
            }
            out.append(')');
            return null;
        }

        @Override
        public Void visitEpsilon(Epsilon symbol) {
            return null;
        }

        @Override
        public Void visitReference(NonTerminal symbol)
            throws RendererRejectedException {
            expand(symbol.name());
            return null;
        }
    }

    @Override
    public String toString() {
        return "regex";
    }
}
