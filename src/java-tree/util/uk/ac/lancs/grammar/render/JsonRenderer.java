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

import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import javax.json.Json;
import javax.json.JsonArrayBuilder;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonWriter;
import javax.json.JsonWriterFactory;
import javax.json.stream.JsonGenerator;

import uk.ac.lancs.grammar.Choice;
import uk.ac.lancs.grammar.Epsilon;
import uk.ac.lancs.grammar.Literal;
import uk.ac.lancs.grammar.NonTerminal;
import uk.ac.lancs.grammar.Regex;
import uk.ac.lancs.grammar.Renderer;
import uk.ac.lancs.grammar.Rule;
import uk.ac.lancs.grammar.Sequence;
import uk.ac.lancs.grammar.Symbol;
import uk.ac.lancs.grammar.SymbolVisitor;

/**
 * Renders a grammar as a JSON document describing its rules. The
 * top-level object has a field <samp>root</samp> naming the root rule,
 * and an array <samp>rules</samp> of objects with fields
 * <samp>name</samp>, <samp>synthetic</samp> and <samp>body</samp>. Each
 * body is an object whose <samp>type</samp> is one of
 * <samp>literal</samp> (with <samp>text</samp>), <samp>regex</samp>
 * (with <samp>pattern</samp>), <samp>sequence</samp> (with
 * <samp>items</samp>), <samp>choice</samp> (with
 * <samp>alternatives</samp>), <samp>epsilon</samp>, or
 * <samp>reference</samp> (with <samp>name</samp>).
 * 
 * @author simpsons
 */
public final class JsonRenderer implements Renderer {
    private final JsonWriterFactory writerFactory;

    private final boolean pretty;

    /**
     * Create a renderer.
     * 
     * @param pretty {@code true} if the output should be indented
     */
    public JsonRenderer(boolean pretty) {
        this.pretty = pretty;
        Map<String, Object> config = new HashMap<>();
        if (pretty) config.put(JsonGenerator.PRETTY_PRINTING, true);
        this.writerFactory = Json.createWriterFactory(config);
    }

    @Override
    public String render(List<Rule> rules, String root) {
        JsonArrayBuilder ruleArray = Json.createArrayBuilder();
        for (Rule rule : rules) {
            ruleArray.add(Json.createObjectBuilder().add("name", rule.name())
                .add("synthetic", rule.isSynthetic())
                .add("body", toJson(rule.body())));
        }
        JsonObject doc = Json.createObjectBuilder().add("root", root)
            .add("rules", ruleArray).build();

        StringWriter out = new StringWriter();
        try (JsonWriter writer = writerFactory.createWriter(out)) {
            writer.writeObject(doc);
        }
        return out.toString().trim();
    }

    /**
     * Convert a symbol to its JSON description.
     * 
     * @param symbol the symbol
     * 
     * @return the symbol's description
     */
    static JsonObject toJson(Symbol symbol) {
        return symbol.accept(BUILDER).build();
    }

    private static final class Builder
        implements SymbolVisitor<JsonObjectBuilder, RuntimeException> {
        private JsonObjectBuilder start(String type) {
            return Json.createObjectBuilder().add("type", type);
        }

        @Override
        public JsonObjectBuilder visitLiteral(Literal symbol) {
            return start("literal").add("text", symbol.text());
        }

        @Override
        public JsonObjectBuilder visitRegex(Regex symbol) {
            return start("regex").add("pattern", symbol.pattern());
        }

        @Override
        public JsonObjectBuilder visitSequence(Sequence symbol) {
            JsonArrayBuilder items = Json.createArrayBuilder();
            for (Symbol item : symbol.items())
                items.add(item.accept(this));
            return start("sequence").add("items", items);
        }

        @Override
        public JsonObjectBuilder visitChoice(Choice symbol) {
            JsonArrayBuilder alts = Json.createArrayBuilder();
            for (Symbol alt : symbol.alternatives())
                alts.add(alt.accept(this));
            return start("choice").add("alternatives", alts);
        }

        @Override
        public JsonObjectBuilder visitEpsilon(Epsilon symbol) {
            return start("epsilon");
        }

        @Override
        public JsonObjectBuilder visitReference(NonTerminal symbol) {
            return start("reference").add("name", symbol.name());
        }
    }

    private static final Builder BUILDER = new Builder();

    @Override
    public String toString() {
        return pretty ? "json (pretty)" : "json";
    }
}
