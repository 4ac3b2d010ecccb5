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

/**
 * Builds context-free grammars from combinators, and compiles them into
 * grammar notations.
 * 
 * <p>
 * Create a {@link Grammar}, and define its rules from
 * {@link Symbol}s:
 * 
 * <pre>
 * Grammar g = new Grammar();
 * g.define("digits", Symbol.regex("(0|[1-9][0-9]*)"));
 * g.define("root", Symbol.literal("v").then(g.reference("digits"))
 *     .then(g.maybe(Symbol.literal("-").then(Symbol.regex("[a-z]+")))));
 * String text = g.compile("gbnf");
 * </pre>
 * 
 * <p>
 * This yields:
 * 
 * <pre>
 * root ::= "v" digits ( "-" [a-z]+ | "" )
 * digits ::= (0|[1-9][0-9]*)
 * </pre>
 * 
 * <p>
 * {@link Grammar#some(Symbol, Symbol)} and
 * {@link Grammar#any(Symbol, Symbol)} express repetition by adding a
 * right-recursive rule to the grammar. {@link Grammar#maybe(Symbol)}
 * adds no rule.
 * 
 * <p>
 * Output formats are provided by {@link Renderer}s, registered by name
 * in {@link Renderers}. Further formats can be plugged in by
 * implementing {@link RendererFactory} and listing the implementation
 * in
 * <samp>META-INF/services/uk.ac.lancs.grammar.RendererFactory</samp>.
 * 
 * @resume Combinator-built grammars and their compilation
 * 
 * @author simpsons
 */
package uk.ac.lancs.grammar;
