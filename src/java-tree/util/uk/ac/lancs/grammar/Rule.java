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

import java.util.Objects;

/**
 * Pairs a rule name with its body.
 * 
 * @author simpsons
 */
public final class Rule {
    private final String name;
    private final Symbol body;
    private final boolean synthetic;

    /**
     * Create a rule.
     * 
     * @param name the rule name
     * 
     * @param body the rule body
     * 
     * @param synthetic whether the name was assigned by the grammar
     * rather than by the user
     */
    public Rule(String name, Symbol body, boolean synthetic) {
        this.name = Objects.requireNonNull(name, "name");
        this.body = Objects.requireNonNull(body, "body");
        this.synthetic = synthetic;
    }

    /**
     * Get the rule name.
     * 
     * @return the rule name
     */
    public String name() {
        return name;
    }

    /**
     * Get the rule body.
     * 
     * @return the rule body
     */
    public Symbol body() {
        return body;
    }

    /**
     * Determine whether the rule's name was assigned by the grammar.
     * 
     * @return {@code true} if the rule was synthesized by a quantifier
     */
    public boolean isSynthetic() {
        return synthetic;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rule)) return false;
        Rule other = (Rule) obj;
        return name.equals(other.name) && body.equals(other.body)
            && synthetic == other.synthetic;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, body, synthetic);
    }

    @Override
    public String toString() {
        return name + " = " + body;
    }
}
