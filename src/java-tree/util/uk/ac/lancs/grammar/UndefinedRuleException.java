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

/**
 * Indicates that a rule is referenced but never defined.
 * 
 * @author simpsons
 */
public class UndefinedRuleException extends GrammarException {
    private static final long serialVersionUID = 1L;

    private final String ruleName;

    private final String referrer;

    /**
     * Create an exception for a missing rule.
     * 
     * @param ruleName the name of the missing rule
     * 
     * @param referrer the name of the rule whose body contains the
     * reference, or {@code null} if the missing rule is the root
     */
    public UndefinedRuleException(String ruleName, String referrer) {
        super(referrer == null ? "undefined root rule: " + ruleName
            : "undefined rule: " + ruleName + " (referenced by " + referrer
                + ")");
        this.ruleName = ruleName;
        this.referrer = referrer;
    }

    /**
     * Get the name of the missing rule.
     * 
     * @return the missing rule's name
     */
    public String ruleName() {
        return ruleName;
    }

    /**
     * Get the name of the rule that holds the unresolved reference.
     * 
     * @return the referring rule's name, or {@code null} if the missing
     * rule is the root
     */
    public String referrer() {
        return referrer;
    }
}
