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

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.grammar.Renderer;
import uk.ac.lancs.grammar.RendererFactory;

/**
 * Creates renderers of the BNF-like constraint notation. The following
 * configuration parameters are recognized:
 * 
 * <dl>
 * 
 * <dt><samp>naming.replace</samp> (default
 * <samp>{@value SeparatorNamingPolicy#DEFAULT_REPLACED}</samp>)</dt>
 * 
 * <dd>The characters in user rule names to be replaced
 * 
 * <dt><samp>naming.separator</samp> (default
 * <samp>{@value SeparatorNamingPolicy#DEFAULT_SEPARATOR}</samp>)</dt>
 * 
 * <dd>The replacement for each such character
 * 
 * </dl>
 * 
 * @see GbnfRenderer
 * 
 * @author simpsons
 */
public final class GbnfRendererFactory implements RendererFactory {
    /**
     * @undocumented
     */
    public static final String TYPE_NAME = "gbnf";

    @Override
    public String format() {
        return TYPE_NAME;
    }

    @Override
    public Renderer makeRenderer(Configuration conf) {
        return new GbnfRenderer(SeparatorNamingPolicy.of(conf));
    }
}
