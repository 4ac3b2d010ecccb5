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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Represents part of a grammar structurally. Start with
 * {@link #literal(CharSequence)}, {@link #regex(CharSequence)} or
 * {@link #reference(String)}, then append with
 * {@link #then(Symbol)} or {@link #then(CharSequence)}, and offer
 * alternatives with {@link #or(Symbol)} or {@link #or(CharSequence)}.
 * Finally, assign the result to a rule with
 * {@link Grammar#define(String, Symbol)}.
 * 
 * <p>
 * Symbols are immutable. Sequences and choices are flattened as they
 * are built, so <code>a.then(b).then(c)</code> and
 * <code>a.then(b.then(c))</code> yield equal sequences of three items.
 * A sequence or choice of one item is that item, and a sequence of none
 * is {@link #EPSILON}.
 * 
 * <p>
 * The set of subclasses is closed: {@link Literal}, {@link Regex},
 * {@link Sequence}, {@link Choice}, {@link Epsilon} and
 * {@link NonTerminal}. Use {@link #accept(SymbolVisitor)} to act on
 * them.
 * 
 * @author simpsons
 */
public abstract class Symbol {
    Symbol() {}

    /**
     * A symbol matching the empty string
     */
    public static final Epsilon EPSILON = new Epsilon();

    /**
     * Create a symbol matching literal text.
     * 
     * @param text the literal text to match
     * 
     * @return a symbol matching the literal text
     */
    public static Literal literal(CharSequence text) {
        return new Literal(text.toString());
    }

    /**
     * Create a symbol matching a regular expression. The pattern is not
     * inspected; it must be acceptable to whichever renderer is
     * eventually used.
     * 
     * @param pattern the pattern in the target notation's syntax
     * 
     * @return a symbol matching the pattern
     */
    public static Regex regex(CharSequence pattern) {
        return new Regex(pattern.toString());
    }

    /**
     * Create a reference to a named rule. The rule need not be defined
     * yet.
     * 
     * @param name the rule name
     * 
     * @return a reference to the rule
     */
    public static NonTerminal reference(String name) {
        return new NonTerminal(name);
    }

    /**
     * Create a sequence of symbols.
     * 
     * @param items the symbols in order
     * 
     * @return a symbol matching each item in turn
     */
    public static Symbol sequence(Symbol... items) {
        return Sequence.of(Arrays.asList(items));
    }

    /**
     * Create a sequence of symbols.
     * 
     * @param items the symbols in order
     * 
     * @return a symbol matching each item in turn
     */
    public static Symbol sequence(List<? extends Symbol> items) {
        return Sequence.of(items);
    }

    /**
     * Create a choice of symbols.
     * 
     * @param alternatives the alternatives in order
     * 
     * @return a symbol matching any of the alternatives
     */
    public static Symbol choice(Symbol... alternatives) {
        return Choice.of(Arrays.asList(alternatives));
    }

    /**
     * Create a choice of symbols.
     * 
     * @param alternatives the alternatives in order
     * 
     * @return a symbol matching any of the alternatives
     */
    public static Symbol choice(List<? extends Symbol> alternatives) {
        return Choice.of(alternatives);
    }

    /**
     * Append a symbol to this one.
     * 
     * @param next the following symbol
     * 
     * @return a symbol equivalent to this one followed by the next one
     */
    public final Symbol then(Symbol next) {
        return sequence(this, Objects.requireNonNull(next, "next"));
    }

    /**
     * Append literal text to this symbol.
     * 
     * @param text the literal text
     * 
     * @return a symbol equivalent to this one followed by the text
     */
    public final Symbol then(CharSequence text) {
        return then(literal(text));
    }

    /**
     * Offer an alternative to this symbol.
     * 
     * @param alternative the alternative
     * 
     * @return a symbol matching either this one or the alternative
     */
    public final Symbol or(Symbol alternative) {
        return choice(this,
                      Objects.requireNonNull(alternative, "alternative"));
    }

    /**
     * Offer literal text as an alternative to this symbol.
     * 
     * @param text the alternative text
     * 
     * @return a symbol matching either this one or the text
     */
    public final Symbol or(CharSequence text) {
        return or(literal(text));
    }

    /**
     * Invoke the visitor method appropriate to this symbol's kind.
     * 
     * @param <R> the visitor's result type
     * 
     * @param <X> the exception type the visitor may throw
     * 
     * @param visitor the visitor
     * 
     * @return the visitor's result
     * 
     * @throws X if the visitor fails
     */
    public abstract <R, X extends Exception> R
        accept(SymbolVisitor<R, X> visitor) throws X;

    /**
     * Write a debugging representation of this symbol.
     * 
     * @param buf the destination
     */
    abstract void describe(StringBuilder buf);

    /**
     * Create a debugging representation of this symbol. Literals are
     * double-quoted, patterns are enclosed in slashes, references are
     * enclosed in angle brackets, compound symbols are parenthesized,
     * and the empty string is <samp>()</samp>.
     * 
     * @return a string representation of this symbol
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        describe(result);
        return result.toString();
    }
}
