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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Matches any one of several symbols. A choice always has at least two
 * alternatives, none of which is itself a choice. Their order is
 * preserved in rendered output.
 * 
 * @author simpsons
 */
public final class Choice extends Symbol {
    private final List<Symbol> alternatives;

    static Symbol of(List<? extends Symbol> options) {
        List<Symbol> alternatives = new ArrayList<>(options.size());
        for (Symbol option : options) {
            Objects.requireNonNull(option, "choice alternative");
            if (option instanceof Choice)
                alternatives.addAll(((Choice) option).alternatives);
            else
                alternatives.add(option);
        }
        if (alternatives.isEmpty()) return Symbol.EPSILON;
        if (alternatives.size() == 1) return alternatives.get(0);
        return new Choice(alternatives);
    }

    private Choice(List<Symbol> alternatives) {
        assert alternatives.size() >= 2;
        this.alternatives = Collections.unmodifiableList(alternatives);
    }

    /**
     * Get the alternatives of the choice.
     * 
     * @return an immutable list of the alternatives in order
     */
    public List<Symbol> alternatives() {
        return alternatives;
    }

    @Override
    public <R, X extends Exception> R accept(SymbolVisitor<R, X> visitor)
        throws X {
        return visitor.visitChoice(this);
    }

    @Override
    void describe(StringBuilder buf) {
        buf.append('(');
        String sep = "";
        for (Symbol alt : alternatives) {
            buf.append(sep);
            alt.describe(buf);
            sep = " | ";
        }
        buf.append(')');
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Choice)) return false;
        return alternatives.equals(((Choice) obj).alternatives);
    }

    @Override
    public int hashCode() {
        return ~alternatives.hashCode();
    }
}
