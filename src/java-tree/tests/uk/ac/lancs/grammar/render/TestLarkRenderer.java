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

import org.junit.jupiter.api.Test;

import uk.ac.lancs.grammar.Grammar;
import uk.ac.lancs.grammar.Symbol;

class TestLarkRenderer {
    @Test
    void grammar_starts_from_root() throws Exception {
        Grammar g = new Grammar();
        g.define("root", literal("a")
            .then(choice(reference("Item"), Symbol.EPSILON)));
        g.define("Item", regex("[0-9]+/x"));

        assertThat(g.compile("lark"))
            .isEqualTo("start: root\n" + "root: \"a\" (item | \"\")\n"
                + "item: /[0-9]+\\/x/");
    }

    @Test
    void recursion_refers_to_synthetic_rule() throws Exception {
        Grammar g = new Grammar();
        g.define("root", g.some(literal("x"), ","));

        assertThat(g.compile(new LarkRenderer()))
            .isEqualTo("start: root\n" + "root: _some_1\n"
                + "_some_1: \"x\" | \"x\" \",\" _some_1");
    }

    @Test
    void literals_are_escaped() throws Exception {
        Grammar g = new Grammar();
        g.define("root", "a\"b\\c");

        assertThat(g.compile("lark"))
            .endsWith("root: \"a\\\"b\\\\c\"");
    }
}
