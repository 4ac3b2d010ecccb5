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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.ac.lancs.grammar.Symbol.choice;
import static uk.ac.lancs.grammar.Symbol.literal;
import static uk.ac.lancs.grammar.Symbol.reference;
import static uk.ac.lancs.grammar.Symbol.regex;
import static uk.ac.lancs.grammar.Symbol.sequence;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

class TestSymbol {
    private final Symbol a = literal("a");
    private final Symbol b = literal("b");
    private final Symbol c = regex("[0-9]+");

    @Test
    void sequence_flattens_nested_sequences() {
        Symbol left = a.then(b).then(c);
        Symbol right = a.then(b.then(c));

        assertThat(left).isInstanceOf(Sequence.class);
        assertThat(((Sequence) left).items()).containsExactly(a, b, c);
        assertThat(left).isEqualTo(right);
    }

    @Test
    void choice_flattens_nested_choices() {
        Symbol left = a.or(b).or(c);
        Symbol right = a.or(b.or(c));

        assertThat(left).isInstanceOf(Choice.class);
        assertThat(((Choice) left).alternatives()).containsExactly(a, b, c);
        assertThat(left).isEqualTo(right);
    }

    @Test
    void choice_within_sequence_is_kept_as_a_unit() {
        Symbol seq = a.then(b.or(c));

        assertThat(((Sequence) seq).items()).containsExactly(a, choice(b, c));
    }

    @Test
    void text_operands_become_literals() {
        assertThat(a.then("x")).isEqualTo(sequence(a, literal("x")));
        assertThat(a.or("x")).isEqualTo(choice(a, literal("x")));
    }

    @Test
    void degenerate_compounds_collapse() {
        assertThat(sequence(a)).isSameAs(a);
        assertThat(choice(a)).isSameAs(a);
        assertThat(sequence(Collections.<Symbol>emptyList()))
            .isSameAs(Symbol.EPSILON);
        assertThat(choice(Collections.<Symbol>emptyList()))
            .isSameAs(Symbol.EPSILON);
    }

    @Test
    void sequence_drops_empty_items_but_choice_keeps_them() {
        assertThat(sequence(a, Symbol.EPSILON, b)).isEqualTo(sequence(a, b));
        assertThat(((Choice) choice(a, Symbol.EPSILON)).alternatives())
            .containsExactly(a, Symbol.EPSILON);
    }

    @Test
    void items_cannot_be_modified() {
        Sequence seq = (Sequence) sequence(Arrays.asList(a, b));

        assertThatThrownBy(() -> seq.items().add(c))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void leaves_compare_by_content() {
        assertThat(literal("x")).isEqualTo(literal(new StringBuilder("x")));
        assertThat(literal("x")).isNotEqualTo(regex("x"));
        assertThat(reference("r")).isEqualTo(reference("r"))
            .hasSameHashCodeAs(reference("r"));
    }

    @Test
    void description_shows_structure() {
        Symbol sym = a.then(c.or(reference("r"))).then(Symbol.EPSILON);

        assertThat(sym.toString()).isEqualTo("(\"a\" (/[0-9]+/ | <r>))");
        assertThat(choice(a, Symbol.EPSILON).toString())
            .isEqualTo("(\"a\" | ())");
    }
}
