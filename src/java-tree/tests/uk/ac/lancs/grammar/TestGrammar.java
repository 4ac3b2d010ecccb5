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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestGrammar {
    private Grammar g;

    @BeforeEach
    void setUp() {
        g = new Grammar();
    }

    @Test
    void optional_version_suffix_compiles_to_two_lines() throws Exception {
        NonTerminal digits =
            g.define("digits", regex("(0|[1-9][0-9]*)"));
        g.define("root", literal("v").then(digits)
            .then(g.maybe(literal("-").then(regex("[a-z]+")))));

        assertThat(g.compile())
            .isEqualTo("root ::= \"v\" digits ( \"-\" [a-z]+ | \"\" )\n"
                + "digits ::= (0|[1-9][0-9]*)");
    }

    @Test
    void argument_list_uses_one_synthetic_rule_rendered_last()
        throws Exception {
        Symbol identifier = regex("[a-zA-Z_][a-zA-Z0-9_]*");
        NonTerminal arg =
            g.define("arg", identifier.then("=").then(regex("[0-9]+")));
        g.define("root", identifier.then("(").then(g.any(arg, ", "))
            .then(")"));

        String[] lines = g.compile("gbnf").split("\n");
        assertThat(lines).containsExactly(
            "root ::= [a-zA-Z_][a-zA-Z0-9_]* \"(\" ( _some_1 | \"\" ) \")\"",
            "arg ::= [a-zA-Z_][a-zA-Z0-9_]* \"=\" [0-9]+",
            "_some_1 ::= arg | arg \", \" _some_1");
        assertThat(g.isSynthetic("_some_1")).isTrue();
        assertThat(g.isSynthetic("arg")).isFalse();
    }

    @Test
    void maybe_adds_no_rule() {
        Symbol opt = g.maybe("x");

        assertThat(opt).isEqualTo(choice(literal("x"), Symbol.EPSILON));
        assertThat(g.size()).isZero();
    }

    @Test
    void some_adds_one_recursive_rule() {
        NonTerminal ref = g.some(literal("a"));

        assertThat(ref.name()).isEqualTo("_some_1");
        assertThat(g.size()).isEqualTo(1);
        assertThat(g.get("_some_1")).isEqualTo(choice(literal("a"),
                                                     sequence(literal("a"),
                                                              ref)));
    }

    @Test
    void some_with_separator_places_it_before_recursion() {
        NonTerminal ref = g.some(literal("a"), ",");

        assertThat(g.get(ref.name()))
            .isEqualTo(choice(literal("a"),
                              sequence(literal("a"), literal(","), ref)));
    }

    @Test
    void text_items_and_separators_are_coerced() {
        Symbol list = g.any("x", ";");

        assertThat(list).isEqualTo(choice(reference("_some_1"),
                                          Symbol.EPSILON));
        assertThat(g.get("_some_1"))
            .isEqualTo(choice(literal("x"),
                              sequence(literal("x"), literal(";"),
                                       reference("_some_1"))));
    }

    @Test
    void any_wraps_a_new_rule_inline() {
        Symbol many = g.any("a");

        assertThat(many).isEqualTo(choice(reference("_some_1"),
                                          Symbol.EPSILON));
        assertThat(g.names()).containsExactly("_some_1");
    }

    @Test
    void synthetic_names_are_numbered_in_order() {
        NonTerminal first = g.some("a");
        NonTerminal second = g.some("b");

        assertThat(first.name()).isEqualTo("_some_1");
        assertThat(second.name()).isEqualTo("_some_2");
    }

    @Test
    void explicit_quantifier_name_is_not_synthetic() {
        NonTerminal named = g.some(literal("a"), (Symbol) null, "items");
        NonTerminal counted = g.some("b");

        assertThat(named.name()).isEqualTo("items");
        assertThat(g.isSynthetic("items")).isFalse();
        assertThat(counted.name()).isEqualTo("_some_1");
    }

    @Test
    void explicit_quantifier_name_must_be_unused() {
        g.define("items", "x");

        assertThatThrownBy(() -> g.some(literal("a"), (Symbol) null,
                                        "items"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void synthetic_name_clashing_with_user_rule_is_rejected() {
        g.define("_some_1", "x");

        assertThatThrownBy(() -> g.some("a"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("_some_1");
    }

    @Test
    void redefinition_replaces_body_in_place() {
        g.define("a", "1");
        g.define("b", "2");
        g.define("a", "3");

        assertThat(g.get("a")).isEqualTo(literal("3"));
        assertThat(g.names()).containsExactly("a", "b");
    }

    @Test
    void root_is_ordered_first_then_definition_order() {
        g.define("x", "1");
        g.define("root", reference("x").then(reference("y")));
        g.define("y", "2");

        List<String> names = new ArrayList<>();
        for (Rule rule : g.orderedRules())
            names.add(rule.name());
        assertThat(names).containsExactly("root", "x", "y");
    }

    @Test
    void alternative_root_is_used() throws Exception {
        g.define("start", "s");
        g.define("other", "o");
        g.setRoot("start");

        assertThat(g.root()).isEqualTo("start");
        assertThat(g.compile()).isEqualTo("start ::= \"s\"\nother ::= \"o\"");
    }

    @Test
    void compilation_is_repeatable() throws Exception {
        g.define("root", g.any(literal("a"), ",").then("."));

        String first = g.compile();
        assertThat(g.compile()).isEqualTo(first);
        assertThat(g.size()).isEqualTo(2);
    }

    @Test
    void undefined_reference_is_reported_with_referrer() {
        g.define("root", literal("a").then(reference("missing")));

        assertThatThrownBy(() -> g.compile())
            .isInstanceOfSatisfying(UndefinedRuleException.class, ex -> {
                assertThat(ex.ruleName()).isEqualTo("missing");
                assertThat(ex.referrer()).isEqualTo("root");
            });
    }

    @Test
    void undefined_root_is_reported() {
        g.define("other", "x");

        assertThatThrownBy(() -> g.validate())
            .isInstanceOfSatisfying(UndefinedRuleException.class, ex -> {
                assertThat(ex.ruleName()).isEqualTo("root");
                assertThat(ex.referrer()).isNull();
            });
    }

    @Test
    void unreachable_rules_must_also_resolve() {
        g.define("root", "x");
        g.define("orphan", literal("y").then(reference("nowhere")));

        assertThatThrownBy(() -> g.compile())
            .isInstanceOfSatisfying(UndefinedRuleException.class, ex -> {
                assertThat(ex.ruleName()).isEqualTo("nowhere");
                assertThat(ex.referrer()).isEqualTo("orphan");
            });
    }

    @Test
    void first_undefined_reference_in_definition_order_is_reported() {
        g.define("first", sequence(choice(literal("a"), reference("m1")),
                                   reference("m2")));
        g.define("root", reference("m0").then(reference("first")));
        g.define("last", reference("m3"));

        assertThatThrownBy(() -> g.validate())
            .isInstanceOfSatisfying(UndefinedRuleException.class, ex -> {
                assertThat(ex.ruleName()).isEqualTo("m1");
                assertThat(ex.referrer()).isEqualTo("first");
            });
    }

    @Test
    void self_reference_is_valid() throws Exception {
        g.define("root", literal("(").then(g.maybe(reference("root")))
            .then(")"));

        g.validate();
        assertThat(g.compile()).isEqualTo("root ::= \"(\" ( root | \"\" ) \")\"");
    }

    @Test
    void unknown_format_is_reported_before_validation() {
        g.define("root", reference("missing"));

        assertThatThrownBy(() -> g.compile("cobol"))
            .isInstanceOfSatisfying(UnknownFormatException.class,
                                    ex -> assertThat(ex.format())
                                        .isEqualTo("cobol"))
            .hasMessageContaining("gbnf");
    }

    @Test
    void registered_renderer_replaces_earlier_one() throws Exception {
        List<Rule> seen = new ArrayList<>();
        g.registerRenderer("gbnf", (rules, root) -> {
            seen.addAll(rules);
            return "custom " + root;
        });
        g.define("root", g.some("a"));

        assertThat(g.compile()).isEqualTo("custom root");
        assertThat(seen).extracting(Rule::name)
            .containsExactly("root", "_some_1");
        assertThat(seen).extracting(Rule::isSynthetic)
            .containsExactly(false, true);
    }

    @Test
    void template_interleaves_text_and_bindings() {
        Symbol t = g.template("f({x}, {{y}})",
                              Collections.singletonMap("x", regex("[0-9]")));

        assertThat(t).isEqualTo(sequence(literal("f("), regex("[0-9]"),
                                         literal(", {y})")));
    }

    @Test
    void template_refers_to_unbound_names() {
        assertThat(g.template("<{tag}>"))
            .isEqualTo(sequence(literal("<"), reference("tag"),
                                literal(">")));
    }

    @Test
    void template_rejects_stray_braces() {
        assertThatThrownBy(() -> g.template("a}b"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> g.template("a{b"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> g.template("a{}b"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void empty_rules_are_pruned() throws Exception {
        g.define("blank", Symbol.EPSILON);
        g.define("also", reference("blank").then(Symbol.EPSILON));
        g.define("root", literal("a").then(reference("blank"))
            .then(reference("also").or("b")));

        assertThat(g.pruneEmptyRules()).containsExactly("blank", "also");
        assertThat(g.names()).containsExactly("root");
        assertThat(g.get("root"))
            .isEqualTo(sequence(literal("a"),
                                choice(literal("b"), Symbol.EPSILON)));
        assertThat(g.compile()).isEqualTo("root ::= \"a\" ( \"b\" | \"\" )");
    }

    @Test
    void optional_alternative_left_by_pruning_keeps_epsilon_last()
        throws Exception {
        g.define("blank", Symbol.EPSILON);
        g.define("root", reference("blank").then(g.maybe("a")).or("b"));

        g.pruneEmptyRules();
        assertThat(g.get("root")).isEqualTo(choice(literal("a"),
                                                   literal("b"),
                                                   Symbol.EPSILON));
        assertThat(g.compile()).isEqualTo("root ::= \"a\" | \"b\" | \"\"");
    }

    @Test
    void pruning_leaves_a_single_epsilon() {
        g.define("blank", Symbol.EPSILON);
        g.define("root", g.maybe(reference("blank").then(g.maybe("a"))));

        g.pruneEmptyRules();
        assertThat(g.get("root"))
            .isEqualTo(choice(literal("a"), Symbol.EPSILON));
    }

    @Test
    void empty_root_is_kept_when_pruning() {
        g.define("root", Symbol.EPSILON);

        assertThat(g.pruneEmptyRules()).isEmpty();
        assertThat(g.get("root")).isSameAs(Symbol.EPSILON);
    }

    @Test
    void user_rule_names_are_translated() throws Exception {
        g.define("root", reference("key_value"));
        g.define("key_value", "k");

        assertThat(g.compile())
            .isEqualTo("root ::= key-value\nkey-value ::= \"k\"");
    }
}
