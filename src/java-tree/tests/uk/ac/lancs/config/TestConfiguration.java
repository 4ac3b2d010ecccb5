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

package uk.ac.lancs.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TestConfiguration {
    private static Configuration sample() {
        Properties props = new Properties();
        props.setProperty("renderers", "a, b");
        props.setProperty("a.name", "first");
        props.setProperty("a.pretty", "yes");
        props.setProperty("b.name", "second");
        props.setProperty("b.pretty", "off");
        props.setProperty("b.naming.separator", "_");
        return ConfigurationContext.of(props);
    }

    @Test
    void references_resolve_to_subviews() {
        List<String> names = new ArrayList<>();
        for (Configuration sub : sample().references("renderers"))
            names.add(sub.get("name"));

        assertThat(names).containsExactly("first", "second");
    }

    @Test
    void missing_references_yield_nothing() {
        assertThat(sample().references("absent")).isEmpty();
    }

    @Test
    void booleans_and_defaults_are_interpreted() {
        Configuration conf = sample();

        assertThat(conf.subview("a").getBoolean("pretty", false)).isTrue();
        assertThat(conf.subview("b").getBoolean("pretty", true)).isFalse();
        assertThat(conf.subview("c").getBoolean("pretty", true)).isTrue();
        assertThat(conf.get("absent", "dflt")).isEqualTo("dflt");
    }

    @Test
    void nested_subviews_strip_prefixes() {
        Configuration naming = sample().subview("b").subview("naming");

        assertThat(naming.prefix()).isEqualTo("b.naming.");
        assertThat(naming.get("separator")).isEqualTo("_");
        assertThat(naming.keys()).containsExactly("separator");
    }

    @Test
    void keys_are_normalized() {
        assertThat(Configuration.normalizeKey("..a..b.")).isEqualTo("a.b");
        assertThat(Configuration.normalizePrefix("a.b")).isEqualTo("a.b.");
        assertThat(Configuration.normalizePrefix("")).isEmpty();
        assertThat(Configuration.resolveKey("x.y", ".z")).isEqualTo("x.z");
        assertThat(Configuration.resolveKey("x", "z")).isEqualTo("z");
    }

    @Test
    void files_are_loaded_and_cached(@TempDir Path dir) throws Exception {
        File file = dir.resolve("grammar.properties").toFile();
        try (OutputStream out = new FileOutputStream(file)) {
            out.write("renderers=r\nr.name=gbnf\nr.type=gbnf\n"
                .getBytes(StandardCharsets.ISO_8859_1));
        }
        ConfigurationContext ctxt = new ConfigurationContext();

        Configuration conf = ctxt.get(file);
        assertThat(conf.get("r.type")).isEqualTo("gbnf");
        assertThat(ctxt.get(file)).isSameAs(conf);
        Configuration sub = ctxt.get(URI.create(file.toURI() + "#r"));
        assertThat(sub.get("name")).isEqualTo("gbnf");
        assertThat(sub.prefix()).isEqualTo("r.");
    }
}
