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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.ServiceLoader;

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Maps format identifiers to renderers. Registering a renderer under an
 * identifier already in use replaces the earlier one.
 * 
 * @author simpsons
 */
public final class Renderers {
    private final Map<String, Renderer> renderers = new LinkedHashMap<>();

    /**
     * Create an empty registry.
     */
    public Renderers() {}

    /**
     * Create a registry holding one renderer from each available
     * factory, registered under the factory's
     * {@linkplain RendererFactory#format() default identifier} and
     * created with an empty configuration.
     * 
     * @return the new registry
     */
    public static Renderers standard() {
        Renderers result = new Renderers();
        Configuration empty = ConfigurationContext.of(new Properties());
        for (RendererFactory factory : ServiceLoader
            .load(RendererFactory.class))
            result.register(factory.format(), factory.makeRenderer(empty));
        return result;
    }

    /**
     * Register renderers described by configuration. The parameter
     * <samp>renderers</samp> lists subviews, each with a
     * <samp>name</samp> giving the format identifier to register under
     * and a <samp>type</samp> recognized by one of the available
     * factories.
     * 
     * @param config the configuration
     * 
     * @throws IllegalArgumentException if a subview has no name, or no
     * factory recognizes it
     */
    public void configure(Configuration config) {
        renderer_instantiation:
        for (Configuration rendererConf : config.references("renderers")) {
            String name = rendererConf.get("name");
            if (name == null)
                throw new IllegalArgumentException("renderer config ["
                    + rendererConf.prefix() + "] has no name");
            for (RendererFactory factory : ServiceLoader
                .load(RendererFactory.class)) {
                if (!factory.recognize(rendererConf)) continue;
                register(name, factory.makeRenderer(rendererConf));
                continue renderer_instantiation;
            }
            throw new IllegalArgumentException("renderer " + name
                + " of type " + rendererConf.get(RendererFactory.TYPE_FIELD)
                + " not recognized");
        }
    }

    /**
     * Register a renderer.
     * 
     * @param format the format identifier
     * 
     * @param renderer the renderer
     */
    public void register(String format, Renderer renderer) {
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(renderer, "renderer");
        Renderer old = renderers.put(format, renderer);
        if (old == null)
            logger.registered(format, renderer);
        else
            logger.replaced(format, old, renderer);
    }

    /**
     * Get a renderer.
     * 
     * @param format the format identifier
     * 
     * @return the renderer registered under the identifier
     * 
     * @throws UnknownFormatException if no renderer is registered under
     * the identifier
     */
    public Renderer get(String format) throws UnknownFormatException {
        Renderer result = renderers.get(format);
        if (result == null)
            throw new UnknownFormatException(format, renderers.keySet());
        return result;
    }

    /**
     * Get the registered format identifiers.
     * 
     * @return an immutable view of the identifiers in registration
     * order
     */
    public Collection<String> formats() {
        return Collections.unmodifiableSet(renderers.keySet());
    }

    @Detail(ShadowLevel.CONFIG)
    private interface Pretty extends FormattedLogger {
        @Format("renderer for %s registered: %s")
        void registered(String format, Renderer renderer);

        @Format("renderer for %s replaced: %s -> %s")
        void replaced(String format, Renderer old, Renderer renderer);
    }

    private static final Pretty logger =
        FormattedLogger.get(Renderers.class.getName(), Pretty.class);
}
