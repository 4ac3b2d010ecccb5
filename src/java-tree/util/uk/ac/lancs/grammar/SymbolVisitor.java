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

/**
 * Acts on each kind of symbol.
 * 
 * @param <R> the result type
 * 
 * @param <X> the exception type that the visitor may throw; use
 * {@link RuntimeException} if it throws none
 * 
 * @author simpsons
 */
public interface SymbolVisitor<R, X extends Exception> {
    /**
     * Act on literal text.
     * 
     * @param symbol the symbol
     * 
     * @return the result
     * 
     * @throws X if the visitor fails
     */
    R visitLiteral(Literal symbol) throws X;

    /**
     * Act on an opaque pattern.
     * 
     * @param symbol the symbol
     * 
     * @return the result
     * 
     * @throws X if the visitor fails
     */
    R visitRegex(Regex symbol) throws X;

    /**
     * Act on a sequence.
     * 
     * @param symbol the symbol
     * 
     * @return the result
     * 
     * @throws X if the visitor fails
     */
    R visitSequence(Sequence symbol) throws X;

    /**
     * Act on a choice.
     * 
     * @param symbol the symbol
     * 
     * @return the result
     * 
     * @throws X if the visitor fails
     */
    R visitChoice(Choice symbol) throws X;

    /**
     * Act on the empty string.
     * 
     * @param symbol the symbol
     * 
     * @return the result
     * 
     * @throws X if the visitor fails
     */
    R visitEpsilon(Epsilon symbol) throws X;

    /**
     * Act on a reference to a rule.
     * 
     * @param symbol the symbol
     * 
     * @return the result
     * 
     * @throws X if the visitor fails
     */
    R visitReference(NonTerminal symbol) throws X;
}
