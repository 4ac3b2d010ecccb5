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

package uk.ac.lancs.logging;

import java.lang.invoke.MethodHandle;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.util.HashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Formats log messages. Extend this interface with one {@code void}
 * method per message, annotate each with {@link Format} and optionally
 * {@link Detail}, and obtain an implementation with
 * {@link #get(String, Class)}.
 * 
 * @author simpsons
 */
public interface FormattedLogger {
    /**
     * Get the unformatted logger that supports this formatted logger.
     * 
     * @return the supporting unformatted logger
     */
    Logger base();

    /**
     * Get a formatted logger for a given type, basing it on the named
     * logger.
     * 
     * @param <T> the formatted type
     * 
     * @param name the logger name, to be supplied to
     * {@link Logger#getLogger(String)}
     * 
     * @param type the interface type annotated with the message formats
     * 
     * @return the requested formatted logger
     */
    public static <T extends FormattedLogger> T get(String name,
                                                    Class<T> type) {
        return get(Logger.getLogger(name), type);
    }

    /**
     * Get a formatted logger for a given type, basing it on the given
     * logger.
     * 
     * @param <T> the formatted type
     * 
     * @param logger the base logger that the formatted logger will
     * delegate to
     * 
     * @param type the interface type annotated with the message formats
     * 
     * @return the requested formatted logger
     * 
     * @throws IllegalArgumentException if a method of the type returns
     * a value, throws a checked exception, or has no format
     */
    public static <T extends FormattedLogger> T get(Logger logger,
                                                    Class<T> type) {
        MethodHandle logHandle = Statics.logHandle.bindTo(logger);
        MethodHandle baseHandle = Statics.baseHandle.bindTo(logger);

        Map<Method, MethodHandle> translation = new HashMap<>();
        for (Method cand : type.getMethods()) {
            if (cand.equals(Statics.baseMethod)) {
                translation.put(cand, baseHandle);
                continue;
            }

            if (cand.getReturnType() != Void.TYPE)
                throw new IllegalArgumentException("method " + cand
                    + " does not return void but " + cand.getReturnType());
            if (cand.getExceptionTypes().length > 0)
                throw new IllegalArgumentException("method " + cand
                    + " throws");

            Format fmt = cand.getAnnotation(Format.class);
            if (fmt == null) throw new IllegalArgumentException("method "
                + cand + " not a log message");

            /* The method's own level overrides the interface's, which
             * overrides INFO. */
            Detail detail = cand.getAnnotation(Detail.class);
            if (detail == null)
                detail = cand.getDeclaringClass().getAnnotation(Detail.class);
            Level lvl = detail == null ? Level.INFO : detail.value().level;

            translation.put(cand, logHandle.bindTo(lvl).bindTo(fmt.value()));
        }

        InvocationHandler actions = new InvocationHandler() {
            @Override
            public Object invoke(Object base, Method meth, Object[] args)
                throws Throwable {
                MethodHandle act = translation.get(meth);
                if (act == null) throw new UnsupportedOperationException(meth
                    .toString());
                if (args == null) args = new Object[0];
                if (meth.equals(Statics.baseMethod)) return act.invoke();
                return act.invoke(args);
            }
        };
        return type
            .cast(Proxy.newProxyInstance(type.getClassLoader(), new Class<?>[]
            { type }, actions));
    }
}
