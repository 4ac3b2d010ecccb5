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
 * Indicates that a renderer cannot express part of a grammar in its
 * target notation.
 * 
 * @author simpsons
 */
public class RendererRejectedException extends GrammarException {
    private static final long serialVersionUID = 1L;

    private final Symbol symbol;

    /**
     * Create an exception with a detail message.
     * 
     * @param message the detail message
     */
    public RendererRejectedException(String message) {
        this(message, (Symbol) null);
    }

    /**
     * Create an exception identifying the offending symbol.
     * 
     * @param message the detail message
     * 
     * @param symbol the symbol that could not be expressed, or
     * {@code null} if not applicable
     */
    public RendererRejectedException(String message, Symbol symbol) {
        super(message);
        this.symbol = symbol;
    }

    /**
     * Create an exception with a detail message and cause.
     * 
     * @param message the detail message
     * 
     * @param cause the cause
     */
    public RendererRejectedException(String message, Throwable cause) {
        super(message, cause);
        this.symbol = null;
    }

    /**
     * Get the symbol that could not be expressed.
     * 
     * @return the offending symbol, or {@code null} if not known
     */
    public Symbol symbol() {
        return symbol;
    }
}
