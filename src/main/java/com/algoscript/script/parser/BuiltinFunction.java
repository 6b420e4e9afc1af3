package com.algoscript.script.parser;

import java.util.List;

/** Functional interface for built-in functions. */
public interface BuiltinFunction {
    Value call(List<Value> args);
}
