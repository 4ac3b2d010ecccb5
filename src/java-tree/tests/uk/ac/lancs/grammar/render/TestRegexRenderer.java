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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.ac.lancs.grammar.Symbol.literal;
import static uk.ac.lancs.grammar.Symbol.reference;
import static uk.ac.lancs.grammar.Symbol.regex;

import java.util.regex.Pattern;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.grammar.Grammar;
import uk.ac.lancs.grammar.NonTerminal;
import uk.ac.lancs.grammar.RendererRejectedException;

class TestRegexRenderer {
    @Test
    void references_are_expanded_in_place() throws Exception {
        Grammar g = new Grammar();
        NonTerminal digits = g.define("digits", regex("[0-9]+"));
        g.define("root", literal("v").then(digits)
            .then(g.maybe(literal(".").then(digits))));

        String pattern = g.compile("regex");
        assertThat(pattern).isEqualTo("v(?:[0-9]+)(?:\\.(?:[0-9]+)|)");
        assertThat(Pattern.matches(pattern, "v1.20")).isTrue();
        assertThat(Pattern.matches(pattern, "v1")).isTrue();
        assertThat(Pattern.matches(pattern, "v1.")).isFalse();
    }

    @Test
    void metacharacters_in_literals_are_escaped() {
        assertThat(RegexRenderer.escape("a.b*(c)")).isEqualTo("a\\.b\\*\\(c\\)");
        assertThat(Pattern.matches(RegexRenderer.escape("[x]{1}|$"),
                                   "[x]{1}|$")).isTrue();
    }

    @Test
    void alternatives_are_grouped() throws Exception {
        Grammar g = new Grammar();
        g.define("root", literal("a").or("b").then("c"));

        assertThat(g.compile("regex")).isEqualTo("(?:a|b)c");
    }

    @Test
    void recursion_is_rejected_with_cycle() {
        Grammar g = new Grammar();
        g.define("root", literal("<").then(reference("inner")));
        g.define("inner", literal("x").or(reference("root")));

        assertThatThrownBy(() -> g.compile("regex"))
            .isInstanceOfSatisfying(RendererRejectedException.class, ex -> {
                assertThat(ex.getMessage())
                    .contains("root -> inner -> root");
                assertThat(ex.symbol()).isEqualTo(reference("root"));
            });
    }

    @Test
    void quantifiers_are_rejected() {
        Grammar g = new Grammar();
        g.define("root", g.some("a"));

        assertThatThrownBy(() -> g.compile("regex"))
            .isInstanceOf(RendererRejectedException.class)
            .hasMessageContaining("_some_1 -> _some_1");
    }

    @Test
    void invalid_pattern_is_rejected() {
        Grammar g = new Grammar();
        g.define("root", regex("[unclosed"));

        assertThatThrownBy(() -> g.compile("regex"))
            .isInstanceOf(RendererRejectedException.class)
            .hasCauseInstanceOf(java.util.regex.PatternSyntaxException.class);
    }
}
