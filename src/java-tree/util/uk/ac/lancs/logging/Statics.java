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
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Method;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the handles that formatted loggers bind to.
 * 
 * @author simpsons
 */
final class Statics {
    private Statics() {}

    @SuppressWarnings("unused")
    private static void log(Logger logger, Level lvl, String fmt,
                            Object[] args) {
        if (!logger.isLoggable(lvl)) return;
        logger.log(lvl, String.format(fmt, args));
    }

    @SuppressWarnings("unused")
    private static Logger base(Logger logger) {
        return logger;
    }

    static final MethodHandle logHandle;
    static final Method baseMethod;
    static final MethodHandle baseHandle;

    static {
        try {
            baseMethod = FormattedLogger.class.getMethod("base");
        } catch (NoSuchMethodException | SecurityException ex) {
            throw new UnsupportedOperationException("base", ex);
        }

        MethodHandles.Lookup lookup = MethodHandles.lookup();

        try {
            logHandle = lookup.unreflect(Statics.class
                .getDeclaredMethod("log", Logger.class, Level.class,
                                   String.class, Object[].class));
        } catch (IllegalAccessException | NoSuchMethodException
            | SecurityException ex) {
            throw new UnsupportedOperationException("log", ex);
        }

        try {
            baseHandle = lookup.unreflect(Statics.class
                .getDeclaredMethod("base", Logger.class));
        } catch (IllegalAccessException | NoSuchMethodException
            | SecurityException ex) {
            throw new UnsupportedOperationException("base", ex);
        }
    }
}
