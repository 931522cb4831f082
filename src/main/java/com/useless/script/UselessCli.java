package com.useless.script;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import com.useless.debug.Debug;
import com.useless.debug.DebugLevel;
import com.useless.debug.StreamDebugSink;
import com.useless.script.parser.ParseException;
import com.useless.script.present.ConsolePresenter;
import com.useless.script.present.TranscriptPresenter;

public final class UselessCli {

    static final String SEED_ENV = "USELESS_SEED";

    static final String USAGE =
            "Usage: UselessCli [--seed <n>] [--no-mind-change] [--transcript] [--verbose] <script-file>";

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    /** Runs the CLI and returns the process exit code instead of exiting. */
    public static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        String file = null;
        Long seed = null;
        boolean mindChanges = true;
        boolean transcript = false;
        boolean verbose = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--seed":
                    if (i + 1 >= args.length) return usage(err, "--seed needs a value");
                    seed = parseSeed(args[++i]);
                    if (seed == null) return usage(err, "--seed must be a whole number, got " + args[i]);
                    break;
                case "--no-mind-change":
                    mindChanges = false;
                    break;
                case "--transcript":
                    transcript = true;
                    break;
                case "--verbose":
                    verbose = true;
                    break;
                default:
                    if (a.startsWith("--")) return usage(err, "unknown option " + a);
                    if (file != null) return usage(err, "only one script file, please");
                    file = a;
            }
        }
        if (file == null) return usage(err, null);

        if (seed == null && env != null && env.get(SEED_ENV) != null) {
            seed = parseSeed(env.get(SEED_ENV));
            if (seed == null) return usage(err, SEED_ENV + " must be a whole number, got " + env.get(SEED_ENV));
        }

        final Path scriptPath = Path.of(file);
        final String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            e.printStackTrace(err);
            return ExitCode.UNREADABLE_SCRIPT.code();
        }

        if (verbose) Debug.get().setSink(new StreamDebugSink(err, DebugLevel.DEBUG));

        UselessScript engine = new UselessScript();
        engine.setSeed(seed);
        engine.setMindChanges(mindChanges);
        TranscriptPresenter recorder = new TranscriptPresenter(new ConsolePresenter(out, err));
        engine.setPresenter(recorder);

        try {
            RunResult result = engine.run(script);
            if (transcript) out.println(recorder.toJson());
            if (verbose) err.println("seed: " + result.seed());
            return result.exitCode().code();
        } catch (ParseException e) {
            err.println("Parse error: " + e.getMessage());
            return ExitCode.PARSE_ERROR.code();
        } finally {
            if (verbose) Debug.get().setSink(null);
        }
    }

    private static Long parseSeed(String s) {
        try {
            return Long.parseLong(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int usage(PrintStream err, String problem) {
        if (problem != null) err.println(problem);
        err.println(USAGE);
        return ExitCode.USAGE.code();
    }

    private UselessCli() {}
}
