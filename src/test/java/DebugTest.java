import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.useless.debug.Debug;
import com.useless.debug.DebugLevel;
import com.useless.debug.DebugSink;
import com.useless.debug.StreamDebugSink;
import com.useless.script.RunResult;
import com.useless.script.UselessScript;
import com.useless.script.present.TranscriptPresenter;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class DebugTest {

    @AfterEach
    void clearSink() {
        Debug.get().setSink(null);
    }

    @Test
    void drawnSeedIsLogged() {
        List<String> infos = new ArrayList<>();
        Debug.get().setSink((level, tag, message, error) -> {
            if (level == DebugLevel.INFO && tag.equals("random")) infos.add(message);
        });

        UselessScript us = new UselessScript();
        us.setPresenter(new TranscriptPresenter());
        long seed = us.run("#[directive(disable_useless)]\nprint(1);").seed();

        assertEquals(List.of("no seed given, using " + seed), infos);
    }

    @Test
    void unknownDirectiveWarns() {
        DebugSink sink = mock(DebugSink.class);
        Debug.get().setSink(sink);

        UselessScript us = new UselessScript();
        us.setSeed(1L);
        us.setPresenter(new TranscriptPresenter());
        assertTrue(us.run("#[directive(be_useful)]").succeeded());

        verify(sink).log(eq(DebugLevel.WARN), eq("interpreter"), contains("be_useful"), isNull());
    }

    @Test
    void streamSinkHonoursThreshold() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        Debug.get().setSink(new StreamDebugSink(new PrintStream(bytes, true, StandardCharsets.UTF_8), DebugLevel.WARN));

        Debug.Tagged log = Debug.tag("test");
        log.d("hidden %d", 1);
        log.w("shown %d", 2);
        Debug.get().log(DebugLevel.ERROR, "test", "failed", new IllegalStateException("x"));

        String text = bytes.toString(StandardCharsets.UTF_8);
        assertFalse(text.contains("hidden"));
        assertTrue(text.contains("[WARN] test: shown 2"));
        assertTrue(text.contains("[ERROR] test: failed"));
        assertTrue(text.contains("IllegalStateException"));
    }

    @Test
    void nothingIsFormattedWithoutASink() {
        assertFalse(Debug.get().hasSink());
        // A bad format string would throw if it were formatted.
        Debug.tag("test").d("%d", "not a number");
    }

    @Test
    void hubStartsWithTheQuietSink() {
        assertNotNull(Debug.get().getSink());
        assertFalse(Debug.get().hasSink());
    }

    @Test
    void scriptsRunWithoutAnInstalledSink() {
        TranscriptPresenter out = new TranscriptPresenter();
        UselessScript us = new UselessScript();
        us.setSeed(7L);
        us.setPresenter(out);

        String src = String.join("\n",
                "#[directive(disable_useless)]",
                "async function later() { return 5; }",
                "let v = await later();",
                "print(v);"
        );
        RunResult result = us.run(src);

        assertTrue(result.succeeded(), String.valueOf(result.error()));
        assertEquals(List.of("5.0"), out.outputs());
        assertFalse(Debug.get().hasSink());
    }
}
