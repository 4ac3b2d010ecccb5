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
 * Matches several symbols in turn. A sequence always has at least two
 * items, none of which is itself a sequence or {@link Symbol#EPSILON}.
 * 
 * @author simpsons
 */
public final class Sequence extends Symbol {
    private final List<Symbol> items;

    static Symbol of(List<? extends Symbol> parts) {
        List<Symbol> items = new ArrayList<>(parts.size());
        for (Symbol part : parts) {
            Objects.requireNonNull(part, "sequence item");
            if (part instanceof Sequence)
                items.addAll(((Sequence) part).items);
            else if (!(part instanceof Epsilon)) items.add(part);
        }
        if (items.isEmpty()) return Symbol.EPSILON;
        if (items.size() == 1) return items.get(0);
        return new Sequence(items);
    }

    private Sequence(List<Symbol> items) {
        assert items.size() >= 2;
        this.items = Collections.unmodifiableList(items);
    }

    /**
     * Get the items of the sequence.
     * 
     * @return an immutable list of the items in order
     */
    public List<Symbol> items() {
        return items;
    }

    @Override
    public <R, X extends Exception> R accept(SymbolVisitor<R, X> visitor)
        throws X {
        return visitor.visitSequence(this);
    }

    @Override
    void describe(StringBuilder buf) {
        buf.append('(');
        String sep = "";
        for (Symbol item : items) {
            buf.append(sep);
            item.describe(buf);
            sep = " ";
        }
        buf.append(')');
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Sequence)) return false;
        return items.equals(((Sequence) obj).items);
    }

    @Override
    public int hashCode() {
        return items.hashCode();
    }
}
