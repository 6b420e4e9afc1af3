package com.algoscript.script;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.algoscript.debug.ConsoleDebugSink;
import com.algoscript.debug.Debug;
import com.algoscript.debug.DebugLevel;
import com.algoscript.protocol.Case;
import com.algoscript.protocol.CaseFileParser;
import com.algoscript.protocol.CaseRunner;
import com.algoscript.protocol.ResultWriter;
import com.algoscript.script.parser.AlgoScriptException;
import com.algoscript.script.parser.Environment;

public final class AlgoCli {

    private static final String TAG = "algoscript.cli";

    public static void main(String[] args) {
        List<String> execs = new ArrayList<>();
        Map<String, String> flags = parseArgs(args, execs);

        if (flags.containsKey("help")) {
            System.err.println("Usage: AlgoCli [--src=algorithm.txt] [--in=input.in] [--out=output.out]"
                    + " [--exec=CASE]... [--max-depth=N] [--verbose]");
            System.exit(0);
        }

        DebugLevel level = flags.containsKey("verbose") ? DebugLevel.DEBUG : DebugLevel.WARN;
        Debug.get().setSink(new ConsoleDebugSink(System.err, level));

        Path src = Path.of(flags.getOrDefault("src", "algorithm.txt"));
        Path in = Path.of(flags.getOrDefault("in", flags.getOrDefault("input", "input.in")));
        Path out = Path.of(flags.getOrDefault("out", "output.out"));

        AlgoScript engine = new AlgoScript();
        if (flags.containsKey("max-depth")) {
            try {
                engine.setMaxCallDepth(Integer.parseInt(flags.get("max-depth")));
            } catch (IllegalArgumentException e) {
                System.err.println("Invalid --max-depth: " + flags.get("max-depth"));
                System.exit(2);
                return;
            }
        }

        final String program;
        try {
            program = Files.readString(src, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read algorithm file: " + src);
            Debug.get().e(TAG, "read failed", e);
            System.exit(3);
            return;
        }

        final Environment env;
        try {
            env = engine.loadProgram(program);
        } catch (AlgoScriptException e) {
            System.err.println("Program error: " + e.getMessage());
            System.exit(1);
            return;
        }

        final List<Case> cases = new ArrayList<>();
        try {
            CaseFileParser parser = new CaseFileParser(null);
            if (!execs.isEmpty()) {
                for (String e : execs) cases.addAll(parser.parse(e));
            } else if (Files.exists(in)) {
                cases.addAll(new CaseFileParser(in.toAbsolutePath().getParent()).parseFile(in));
            } else {
                Debug.get().w(TAG, "No cases: " + in + " not found and no --exec given");
            }
        } catch (IOException e) {
            System.err.println("Failed to read cases: " + e.getMessage());
            System.exit(3);
            return;
        }

        String text = ResultWriter.write(new CaseRunner(engine, env).runAll(cases));
        try {
            Files.writeString(out, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Error writing output file " + out + ": " + e.getMessage());
            System.exit(3);
            return;
        }
        Debug.get().i(TAG, "Ran " + cases.size() + " case(s), wrote " + out);
    }

    /**
     * Minimal arg parser:
     *   --src=algorithm.txt --in=input.in --out=output.out
     *   --exec='Sum: 3' --exec='FindMax(T)'
     *   --max-depth=500 --verbose
     */
    static Map<String, String> parseArgs(String[] args, List<String> execs) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                String key = a.substring(2, i);
                String value = a.substring(i + 1);
                if (key.equals("exec")) execs.add(value);
                else out.put(key, value);
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    private AlgoCli() {}
}
