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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TestFormattedLogger {
    @Detail(ShadowLevel.FINE)
    interface Messages extends FormattedLogger {
        @Format("rule %s has %d alternatives")
        void counted(String rule, int count);

        @Format("giving up on %s")
        @Detail(ShadowLevel.WARNING)
        void failed(String rule);
    }

    interface Plain extends FormattedLogger {
        @Format("hello %s")
        void hello(String who);
    }

    interface Broken extends FormattedLogger {
        String notVoid();
    }

    private final List<LogRecord> records = new ArrayList<>();

    private final Handler capture = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
    };

    private Logger base;

    @BeforeEach
    void setUp() {
        base = Logger.getLogger(TestFormattedLogger.class.getName());
        base.setUseParentHandlers(false);
        base.setLevel(Level.ALL);
        base.addHandler(capture);
    }

    @AfterEach
    void tearDown() {
        base.removeHandler(capture);
    }

    @Test
    void messages_are_formatted_at_declared_levels() {
        Messages logger = FormattedLogger.get(base, Messages.class);
        logger.counted("expr", 3);
        logger.failed("term");

        assertThat(records).extracting(LogRecord::getMessage)
            .containsExactly("rule expr has 3 alternatives",
                             "giving up on term");
        assertThat(records).extracting(LogRecord::getLevel)
            .containsExactly(Level.FINE, Level.WARNING);
    }

    @Test
    void undecorated_messages_default_to_info() {
        FormattedLogger.get(base.getName(), Plain.class).hello("world");

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void suppressed_levels_are_not_formatted() {
        base.setLevel(Level.INFO);
        FormattedLogger.get(base, Messages.class).counted("expr", 1);

        assertThat(records).isEmpty();
    }

    @Test
    void base_logger_is_exposed() {
        assertThat(FormattedLogger.get(base, Plain.class).base())
            .isSameAs(base);
    }

    @Test
    void non_message_methods_are_rejected() {
        assertThatThrownBy(() -> FormattedLogger.get(base, Broken.class))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
