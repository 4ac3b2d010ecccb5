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

import java.util.Objects;

import uk.ac.lancs.config.Configuration;

/**
 * Replaces word-separator characters in user rule names with the
 * target notation's preferred separator. Synthetic names are left as
 * assigned, so they remain distinct from user rules.
 * 
 * @author simpsons
 */
public final class SeparatorNamingPolicy implements NamingPolicy {
    private final String replaced;
    private final String separator;

    /**
     * The characters replaced by default, namely
     * <samp>{@value}</samp>
     */
    public static final String DEFAULT_REPLACED = "_";

    /**
     * The default separator, namely <samp>{@value}</samp>
     */
    public static final String DEFAULT_SEPARATOR = "-";

    /**
     * Replaces underscores with hyphens.
     */
    public static final SeparatorNamingPolicy DEFAULT =
        new SeparatorNamingPolicy(DEFAULT_REPLACED, DEFAULT_SEPARATOR);

    /**
     * Create a naming policy.
     * 
     * @param replaced each character to be replaced
     * 
     * @param separator the replacement for each such character
     */
    public SeparatorNamingPolicy(String replaced, String separator) {
        this.replaced = Objects.requireNonNull(replaced, "replaced");
        this.separator = Objects.requireNonNull(separator, "separator");
    }

    /**
     * Create a naming policy from configuration. The parameter
     * <samp>naming.replace</samp> lists the characters to replace
     * (default <samp>{@value #DEFAULT_REPLACED}</samp>), and
     * <samp>naming.separator</samp> gives the replacement (default
     * <samp>{@value #DEFAULT_SEPARATOR}</samp>).
     * 
     * @param conf the configuration
     * 
     * @return the configured policy
     */
    public static SeparatorNamingPolicy of(Configuration conf) {
        return new SeparatorNamingPolicy(conf.get("naming.replace",
                                                  DEFAULT_REPLACED),
                                         conf.get("naming.separator",
                                                  DEFAULT_SEPARATOR));
    }

    @Override
    public String translate(String name, boolean synthetic) {
        if (synthetic || replaced.isEmpty()) return name;
        StringBuilder result = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (replaced.indexOf(c) >= 0)
                result.append(separator);
            else
                result.append(c);
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return "[" + replaced + "]->" + separator;
    }
}
