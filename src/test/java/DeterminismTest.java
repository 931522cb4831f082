import org.junit.jupiter.api.Test;

import com.useless.script.RunResult;
import com.useless.script.UselessScript;
import com.useless.script.parser.ParseException;
import com.useless.script.present.TranscriptPresenter;

import static org.junit.jupiter.api.Assertions.*;

public class DeterminismTest {

    private static final String PROGRAM = String.join("\n",
            "let items = [1, 2, 3, 4];",
            "let person = {\"name\": \"Ada\", \"age\": 36};",
            "async function later(v) {",
            "  try { let got = await promise(v, 30); print(got); } catch e { print(access(e, \"kind\")); }",
            "}",
            "later(\"first\");",
            "later(\"second\");",
            "function describe(p) { return access(p, \"name\"); }",
            "try { print(describe(person)); } catch e { print(e); }",
            "try { print(index(items, 1)); } catch e { print(e); }",
            "try { print(add(2, 2)); } catch e { print(e); }",
            "try { print(equals(items, 4)); } catch e { print(e); }",
            "if lessThan(1, 2) { print(\"then\"); } else { print(\"else\"); }",
            "loop { print(multiply(3, 3)); }",
            "print(items);"
    );

    private static String transcript(long seed, StringBuilder summary) {
        UselessScript us = new UselessScript();
        us.setSeed(seed);
        TranscriptPresenter out = new TranscriptPresenter();
        us.setPresenter(out);
        RunResult r = us.run(PROGRAM);
        summary.append(r.exitCode()).append('/').append(r.ticks()).append('/').append(r.error());
        return out.toJson();
    }

    @Test
    void sameSeedSameTranscript() {
        for (long seed = 0; seed < 40; seed++) {
            StringBuilder first = new StringBuilder();
            StringBuilder second = new StringBuilder();
            assertEquals(transcript(seed, first), transcript(seed, second), "seed " + seed);
            assertEquals(first.toString(), second.toString(), "seed " + seed);
        }
    }

    @Test
    void differentSeedsDiverge() {
        String base = transcript(0, new StringBuilder());
        boolean diverged = false;
        for (long seed = 1; seed < 20 && !diverged; seed++) {
            diverged = !base.equals(transcript(seed, new StringBuilder()));
        }
        assertTrue(diverged);
    }

    @Test
    void seedIsReportedEvenWhenDrawn() {
        UselessScript us = new UselessScript();
        us.setPresenter(new TranscriptPresenter());
        RunResult r = us.run("#[directive(disable_useless)]\nprint(1);");

        UselessScript replay = new UselessScript();
        replay.setSeed(r.seed());
        TranscriptPresenter out = new TranscriptPresenter();
        replay.setPresenter(out);
        assertTrue(replay.run("#[directive(disable_useless)]\nprint(1);").succeeded());
        assertEquals(Long.valueOf(r.seed()), replay.getSeed());
    }

    @Test
    void parseFailuresDoNotDependOnTheSeed() {
        for (long seed = 0; seed < 10; seed++) {
            UselessScript us = new UselessScript();
            us.setSeed(seed);
            assertThrows(ParseException.class, () -> us.run("let x = ;"));
        }
    }
}
