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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Views a set of named configuration properties. Property names are the
 * same as for Java properties files.
 * 
 * <p>
 * Subviews of a configuration are obtainable. For example, if the
 * subview <samp>foo.bar</samp> is obtained, then only properties whose
 * names in the original view begin with <samp>foo.bar.</samp> will be
 * visible. Furthermore, their names will lack the prefix
 * <samp>foo.bar.</samp>.
 * 
 * @author simpsons
 */
public interface Configuration {
    /**
     * Get a configuration parameter.
     * 
     * @param key the parameter key
     * 
     * @return the parameter's value, or {@code null} if not present
     */
    String get(String key);

    /**
     * Get a configuration parameter, or a default.
     * 
     * @param key the parameter key
     * 
     * @param defaultValue the value to return if the parameter is not
     * set
     * 
     * @return the parameter's value, or <samp>defaultValue</samp> if
     * not set
     */
    default String get(String key, String defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        return value;
    }

    /**
     * Get a boolean configuration parameter, or a default.
     * 
     * @param key the parameter key
     * 
     * @param defaultValue the value to return if the parameter is not
     * set
     * 
     * @return {@code true} if the parameter is <samp>true</samp>,
     * <samp>yes</samp> or <samp>on</samp> (ignoring case);
     * <samp>defaultValue</samp> if not set; {@code false} otherwise
     */
    default boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        if (value == null) return defaultValue;
        switch (value.trim().toLowerCase()) {
        case "true":
        case "yes":
        case "on":
            return true;
        default:
            return false;
        }
    }

    /**
     * Obtain a locally referenced configuration. The value names a
     * subview of the root configuration. If it begins with a
     * <samp>.</samp>, it is resolved relative to the key, as by
     * {@link #resolveKey(String, String)}.
     * 
     * @param key the key used as a base for resolving a relative name
     * 
     * @param value the reference to the configuration
     * 
     * @return the referenced configuration
     * 
     * @throws NullPointerException if <samp>value</samp> is
     * {@code null}
     */
    Configuration reference(String key, String value);

    /**
     * Obtain locally referenced configurations from a space- or
     * comma-separated list.
     * 
     * @param key the key used to obtain the references, and as a base
     * for resolving relative names
     * 
     * @return a list of configurations corresponding to the references
     * in the specified parameter, or an empty list if not specified
     */
    default List<Configuration> references(String key) {
        String value = get(key);
        if (value == null || value.trim().isEmpty())
            return Collections.emptyList();
        return Arrays.asList(value.trim().split("[\\s,]+")).stream()
            .map(s -> reference(key, s)).collect(Collectors.toList());
    }

    /**
     * Get a subview.
     * 
     * @param prefix the additional prefix to narrow down the available
     * parameters
     * 
     * @return the requested subview
     */
    Configuration subview(String prefix);

    /**
     * Get the prefix of this view relative to the root configuration.
     * 
     * @return the normalized prefix, ending in <samp>.</samp>, or an
     * empty string for the root
     */
    String prefix();

    /**
     * List keys in this configuration.
     * 
     * @return the keys
     */
    Iterable<String> keys();

    /**
     * List a subset of keys.
     * 
     * @param condition a condition selecting keys to include
     * 
     * @return the selected keys
     */
    default Iterable<String>
        selectedKeys(Predicate<? super String> condition) {
        return new Iterable<String>() {
            @Override
            public Iterator<String> iterator() {
                return new FilterIterator<>(keys().iterator(), condition);
            }
        };
    }

    /**
     * Normalize a node key. Double dots are condensed to single ones.
     * Leading and trailing dots are removed.
     * 
     * @param key the node key to normalize
     * 
     * @return the normalized node key
     */
    public static String normalizeKey(String key) {
        if (key == null) return null;
        List<String> parts = new ArrayList<>();
        for (String part : key.split("\\.+"))
            if (!part.isEmpty()) parts.add(part);
        return String.join(".", parts);
    }

    /**
     * Normalize a node key prefix.
     * 
     * @param prefix the node key prefix to normalize
     * 
     * @return the normalized prefix, or an empty string if the prefix
     * is empty after normalization
     */
    public static String normalizePrefix(String prefix) {
        if (prefix == null) return null;
        String key = normalizeKey(prefix);
        return key.isEmpty() ? "" : key + '.';
    }

    /**
     * Resolve a potentially relative key against a base. If the key
     * does not begin with a <samp>.</samp>, it is returned unchanged.
     * Otherwise, everything after the last <samp>.</samp> in the base
     * is removed, and the key is appended.
     * 
     * @param base the base to resolve the key against
     * 
     * @param key the key to resolve
     * 
     * @return the key resolved against the base
     */
    public static String resolveKey(String base, String key) {
        if (key.isEmpty()) return "";
        if (key.charAt(0) != '.') return key;
        int lastDot = base.lastIndexOf('.');
        if (lastDot < 0) return key.substring(1);
        return base.substring(0, lastDot) + key;
    }
}
