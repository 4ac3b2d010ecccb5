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
import static uk.ac.lancs.grammar.Symbol.choice;
import static uk.ac.lancs.grammar.Symbol.literal;
import static uk.ac.lancs.grammar.Symbol.reference;
import static uk.ac.lancs.grammar.Symbol.regex;
import static uk.ac.lancs.grammar.Symbol.sequence;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.grammar.Rule;
import uk.ac.lancs.grammar.Symbol;

class TestGbnfRenderer {
    private final GbnfRenderer renderer = new GbnfRenderer();

    @Test
    void literals_are_quoted_and_escaped() {
        assertThat(GbnfRenderer.quote("say \"hi\"\n\\"))
            .isEqualTo("\"say \\\"hi\\\"\\n\\\\\"");
        assertThat(GbnfRenderer.quote("a\tb\rc")).isEqualTo("\"a\\tb\\rc\"");
        assertThat(GbnfRenderer.quote("")).isEqualTo("\"\"");
    }

    @Test
    void top_level_choice_is_not_parenthesized() {
        Rule rule = new Rule("root", literal("a").or(regex("[b]")), false);

        assertThat(renderer.render(Collections.singletonList(rule), "root"))
            .isEqualTo("root ::= \"a\" | [b]");
    }

    @Test
    void nested_choices_are_parenthesized() {
        Symbol body = sequence(literal("a"),
                               choice(sequence(literal("b"), literal("c")),
                                      Symbol.EPSILON));
        Rule rule = new Rule("root", body, false);

        assertThat(renderer.render(Collections.singletonList(rule), "root"))
            .isEqualTo("root ::= \"a\" ( \"b\" \"c\" | \"\" )");
    }

    @Test
    void user_names_use_hyphens_and_synthetic_names_are_kept() {
        Rule root = new Rule("root", reference("my_rule")
            .then(reference("_some_1")), false);
        Rule mine = new Rule("my_rule", literal("m"), false);
        Rule some = new Rule("_some_1", literal("s"), true);

        assertThat(renderer.render(Arrays.asList(root, mine, some), "root"))
            .isEqualTo("root ::= my-rule _some_1\n" + "my-rule ::= \"m\"\n"
                + "_some_1 ::= \"s\"");
    }

    @Test
    void naming_policy_is_replaceable() {
        GbnfRenderer plain = new GbnfRenderer(NamingPolicy.IDENTITY);
        Rule rule = new Rule("my_root", reference("my_root"), false);

        assertThat(plain.render(Collections.singletonList(rule), "my_root"))
            .isEqualTo("my_root ::= my_root");
    }

    @Test
    void separator_policy_replaces_each_listed_character() {
        SeparatorNamingPolicy policy = new SeparatorNamingPolicy("_.", "-");

        assertThat(policy.translate("a_b.c", false)).isEqualTo("a-b-c");
        assertThat(policy.translate("_x_1", true)).isEqualTo("_x_1");
        assertThat(new SeparatorNamingPolicy("", "-").translate("a_b", false))
            .isEqualTo("a_b");
    }
}
