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

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import uk.ac.lancs.grammar.Choice;
import uk.ac.lancs.grammar.Epsilon;
import uk.ac.lancs.grammar.Literal;
import uk.ac.lancs.grammar.NonTerminal;
import uk.ac.lancs.grammar.Regex;
import uk.ac.lancs.grammar.Renderer;
import uk.ac.lancs.grammar.Rule;
import uk.ac.lancs.grammar.Sequence;
import uk.ac.lancs.grammar.Symbol;
import uk.ac.lancs.grammar.SymbolVisitor;

/**
 * Renders grammars in Lark notation. The first line
 * <samp>start: <var>root</var></samp> provides Lark's entry point, and
 * each rule follows as <samp><var>name</var>: <var>body</var></samp>.
 * Rule names are lower-cased, as Lark treats upper-case names as
 * terminals. Patterns are enclosed in slashes.
 * 
 * @author simpsons
 */
public final class LarkRenderer implements Renderer {
    /**
     * Lower-cases all names.
     */
    public static final NamingPolicy LOWER_CASE =
        (name, synthetic) -> name.toLowerCase(Locale.ROOT);

    private final NamingPolicy naming;

    /**
     * Create a renderer that lower-cases rule names.
     */
    public LarkRenderer() {
        this(LOWER_CASE);
    }

    /**
     * Create a renderer.
     * 
     * @param naming the policy for translating rule names
     */
    public LarkRenderer(NamingPolicy naming) {
        this.naming = Objects.requireNonNull(naming, "naming");
    }

    @Override
    public String render(List<Rule> rules, String root) {
        Set<String> synthetic = new HashSet<>();
        for (Rule rule : rules)
            if (rule.isSynthetic()) synthetic.add(rule.name());
        Writer writer = new Writer(synthetic);

        StringBuilder result = new StringBuilder();
        result.append("start: ")
            .append(naming.translate(root, synthetic.contains(root)));
        for (Rule rule : rules) {
            result.append('\n')
                .append(naming.translate(rule.name(), rule.isSynthetic()))
                .append(": ").append(rule.body().accept(writer));
        }
        return result.toString();
    }

    private final class Writer
        implements SymbolVisitor<String, RuntimeException> {
        private final Set<String> synthetic;

        Writer(Set<String> synthetic) {
            this.synthetic = synthetic;
        }

        @Override
        public String visitLiteral(Literal symbol) {
            return '"' + symbol.text().replace("\\", "\\\\")
                .replace("\"", "\\\"") + '"';
        }

        @Override
        public String visitRegex(Regex symbol) {
            return '/' + symbol.pattern().replace("/", "\\/") + '/';
        }

        @Override
        public String visitSequence(Sequence symbol) {
            StringBuilder result = new StringBuilder();
            for (Symbol item : symbol.items()) {
                if (result.length() > 0) result.append(' ');
                String part = item.accept(this);
                if (item instanceof Choice)
                    result.append('(').append(part).append(')');
                else
                    result.append(part);
            }
            return result.toString();
        }

        @Override
        public String visitChoice(Choice symbol) {
            StringBuilder result = new StringBuilder();
            for (Symbol alt : symbol.alternatives()) {
                if (result.length() > 0) result.append(" | ");
                result.append(alt.accept(this));
            }
            return result.toString();
        }

        @Override
        public String visitEpsilon(Epsilon symbol) {
            return "\"\"";
        }

        @Override
        public String visitReference(NonTerminal symbol) {
            return naming.translate(symbol.name(),
                                    synthetic.contains(symbol.name()));
        }
    }

    @Override
    public String toString() {
        return "lark";
    }
}
