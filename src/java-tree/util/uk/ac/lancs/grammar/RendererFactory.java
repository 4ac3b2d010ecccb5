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

import uk.ac.lancs.config.Configuration;

/**
 * Creates renderers from configuration. Implementations are found with
 * {@link java.util.ServiceLoader}, so each must be listed in
 * <samp>META-INF/services/uk.ac.lancs.grammar.RendererFactory</samp>.
 * 
 * @author simpsons
 */
public interface RendererFactory {
    /**
     * The configuration field identifying the renderer type
     */
    String TYPE_FIELD = "type";

    /**
     * Get the format identifier under which renderers from this factory
     * are registered by default.
     * 
     * @return the default format identifier
     */
    String format();

    /**
     * Detect whether this factory can create a renderer from the given
     * configuration.
     * 
     * @default This implementation recognizes the string returned by
     * {@link #format()} in the field <samp>{@value #TYPE_FIELD}</samp>.
     * 
     * @param conf the renderer's configuration
     * 
     * @return {@code true} iff this factory can create renderers with
     * the supplied configuration
     */
    default boolean recognize(Configuration conf) {
        return format().equals(conf.get(TYPE_FIELD));
    }

    /**
     * Create a renderer.
     * 
     * @param conf the renderer's configuration
     * 
     * @return the new renderer
     * 
     * @throws IllegalArgumentException if the configuration is
     * malformed
     */
    Renderer makeRenderer(Configuration conf);
}
