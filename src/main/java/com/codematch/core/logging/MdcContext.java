package com.codematch.core.logging;

import org.slf4j.MDC;

/**
 * Tags log lines with the verification session and, inside a verification attempt,
 * the contract candidate being worked on. {@code logback-spring.xml} prints both keys.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setCandidate(String candidateId) {
        MDC.put("candidateId", candidateId);
    }

    public static void clearCandidate() {
        MDC.remove("candidateId");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("candidateId");
    }
}
