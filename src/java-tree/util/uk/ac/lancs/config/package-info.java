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

/**
 * Manages configuration held as Java properties, with keys of the form
 * <samp>foo.bar.baz</samp>. Subviews of a configuration can be obtained
 * by specifying a prefix. With a prefix of <samp>foo.</samp>, all
 * properties whose names don't begin with this prefix are hidden, and
 * the names of remaining ones have the prefix removed.
 * 
 * <p>
 * The starting point is to create a {@link ConfigurationContext}, and
 * use it to load a root configuration from a file:
 * 
 * <pre>
 * ConfigurationContext ctxt = new ConfigurationContext();
 * Configuration root = ctxt.get("grammar.properties");
 * Configuration gbnf = root.subview("gbnf");
 * assert gbnf.get("naming.separator")
 *     .equals(root.get("gbnf.naming.separator"));
 * </pre>
 * 
 * <p>
 * A URI fragment selects a subview, so
 * <samp>grammar.properties#gbnf</samp> loads only the properties
 * beginning with <samp>gbnf.</samp>. Configurations loaded using the
 * same context are cached.
 * 
 * @author simpsons
 */
package uk.ac.lancs.config;
