package com.iksanov.coherentcache.core.protocol;

final class ScriptReplies {

    private ScriptReplies() {}

    static boolean isOne(Object reply) {
        if (reply instanceof Number number) return number.longValue() == 1L;
        throw new IllegalStateException("Expected integer script reply but got " + (reply == null ? "nil" : reply.getClass().getName()));
    }
}
