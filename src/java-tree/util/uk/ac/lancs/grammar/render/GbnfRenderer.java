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
 * Renders grammars in the BNF-like constraint notation accepted by
 * text-generation engines. Each rule yields one line
 * <samp><var>name</var> ::= <var>body</var></samp>. Literals are
 * double-quoted, patterns are copied verbatim, sequence items are
 * separated by spaces, and alternatives by <samp>|</samp>, with
 * parentheses around a choice within a sequence. The empty string is
 * written as <samp>""</samp>.
 * 
 * @author simpsons
 */
public final class GbnfRenderer implements Renderer {
    private final NamingPolicy naming;

    /**
     * Create a renderer with the default naming policy.
     */
    public GbnfRenderer() {
        this(SeparatorNamingPolicy.DEFAULT);
    }

    /**
     * Create a renderer.
     * 
     * @param naming the policy for translating rule names
     */
    public GbnfRenderer(NamingPolicy naming) {
        this.naming = Objects.requireNonNull(naming, "naming");
    }

    @Override
    public String render(List<Rule> rules, String root) {
        Set<String> synthetic = new HashSet<>();
        for (Rule rule : rules)
            if (rule.isSynthetic()) synthetic.add(rule.name());

        StringBuilder result = new StringBuilder();
        for (Rule rule : rules) {
            if (result.length() > 0) result.append('\n');
            result.append(naming.translate(rule.name(), rule.isSynthetic()))
                .append(" ::= ");
            rule.body().accept(new Writer(result, synthetic, false));
        }
        return result.toString();
    }

    /**
     * Escape literal text and enclose it in double quotes.
     * 
     * @param text the literal text
     * 
     * @return the quoted text
     */
    static String quote(String text) {
        StringBuilder result = new StringBuilder(text.length() + 2);
        result.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
            case '"':
            case '\\':
                result.append('\\').append(c);
                break;

            case '\n':
                result.append("\\n");
                break;

            case '\r':
                result.append("\\r");
                break;

            case '\t':
                result.append("\\t");
                break;

            default:
                result.append(c);
                break;
            }
        }
        return result.append('"').toString();
    }

    private final class Writer
        implements SymbolVisitor<Void, RuntimeException> {
        private final StringBuilder out;
        private final Set<String> synthetic;
        private final boolean nested;

        Writer(StringBuilder out, Set<String> synthetic, boolean nested) {
            this.out = out;
            this.synthetic = synthetic;
            this.nested = nested;
        }

        @Override
        public Void visitLiteral(Literal symbol) {
            out.append(quote(symbol.text()));
            return null;
        }

        @Override
        public Void visitRegex(Regex symbol) {
            out.append(symbol.pattern());
            return null;
        }

        @Override
        public Void visitSequence(Sequence symbol) {
            Writer inner = new Writer(out, synthetic, true);
            String sep = "";
            for (Symbol item : symbol.items()) {
                out.append(sep);
                item.accept(inner);
                sep = " ";
            }
            return null;
        }

        @Override
        public Void visitChoice(Choice symbol) {
            Writer inner = new Writer(out, synthetic, true);
            if (nested) out.append("( ");
            String sep = "";
            for (Symbol alt : symbol.alternatives()) {
                out.append(sep);
                alt.accept(inner);
                sep = " | ";
            }
            if (nested) out.append(" )");
            return null;
        }

        @Override
        public Void visitEpsilon(Epsilon symbol) {
            out.append("\"\"");
            return null;
        }

        @Override
        public Void visitReference(NonTerminal symbol) {
            out.append(naming.translate(symbol.name(),
                                        synthetic.contains(symbol.name())));
            return null;
        }
    }

    @Override
    public String toString() {
        return "gbnf " + naming;
    }
}
