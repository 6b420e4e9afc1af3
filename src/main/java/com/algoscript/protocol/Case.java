package com.algoscript.protocol;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a case file: a text directive handed to the engine as written, a JSON
 * invocation whose arguments are still JSON, or an entry that could not be read as either.
 */
public final class Case {

    private final String directive;
    private final String algorithm;
    private final List<JsonNode> args;
    private final String store;
    private final String problem;

    private Case(String directive, String algorithm, List<JsonNode> args, String store, String problem) {
        this.directive = directive;
        this.algorithm = algorithm;
        this.args = args;
        this.store = store;
        this.problem = problem;
    }

    public static Case directive(String text) {
        return new Case(text, null, Collections.emptyList(), null, null);
    }

    public static Case invocation(String algorithm, List<JsonNode> args, String store) {
        return new Case(null, algorithm, List.copyOf(args), store, null);
    }

    /** An entry that is reported as a failed case when run. {@code source} is the entry as written. */
    public static Case malformed(String source, String problem) {
        return new Case(source, null, Collections.emptyList(), null, problem);
    }

    public boolean isMalformed() { return problem != null; }

    /** Why the entry could not be read, null unless {@link #isMalformed()}. */
    public String problem() { return problem; }

    public boolean isInvocation() { return algorithm != null; }

    /** Directive text (the source text of a malformed entry), null for invocations. */
    public String directive() { return directive; }

    public String algorithm() { return algorithm; }
    public List<JsonNode> args() { return args; }

    /** Global that receives the invocation result, or null. */
    public String store() { return store; }

    @Override
    public String toString() {
        return isInvocation() ? algorithm + args : directive;
    }
}
