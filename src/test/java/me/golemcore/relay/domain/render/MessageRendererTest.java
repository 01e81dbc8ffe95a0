package me.golemcore.relay.domain.render;

import me.golemcore.relay.infrastructure.config.RelayProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MessageRendererTest {

    private RelayProperties properties;
    private MessageRenderer renderer;

    @BeforeEach
    void setUp() {
        properties = new RelayProperties();
        renderer = new MessageRenderer(properties);
    }

    @Test
    void shouldRenderProgressWithPreviewActionsAndFooter() {
        String rendered = renderer.renderProgress(Duration.ofSeconds(5), List.of("▸ `ls`", "✓ `pwd`"), "Hello");

        assertEquals("Hello ▍\n\n▸ `ls`\n✓ `pwd`\n\n▸ · 5s", rendered);
    }

    @Test
    void shouldRenderBareProgressFooter() {
        assertEquals("▸ · 0s", renderer.renderProgress(Duration.ZERO, List.of(), null));
    }

    @Test
    void shouldShowTailOfLongStreamingText() {
        properties.getRender().setMaxStreamingChars(5);
        MessageRenderer narrow = new MessageRenderer(properties);

        assertEquals("defgh ▍", narrow.streamingPreview("abcdefgh"));
    }

    @Test
    void shouldRenderFinalAnswerWithStatusFooter() {
        List<String> messages = renderer.renderFinal(true, "Done", Duration.ofSeconds(65), "gpt-test");

        assertEquals(List.of("Done\n\n✓ · 1m 05s · gpt-test"), messages);
    }

    @Test
    void shouldRenderFooterOnlyForBlankAnswer() {
        List<String> messages = renderer.renderFinal(false, "  ", Duration.ofSeconds(3), null);

        assertEquals(List.of("✗ · 3s"), messages);
    }

    @Test
    void shouldMarkContinuationMessages() {
        properties.getRender().setMaxBodyChars(10);
        MessageRenderer small = new MessageRenderer(properties);

        List<String> messages = small.renderFinal(true, "aaaa\n\nbbbb\n\ncccc", Duration.ZERO, null);

        assertEquals(List.of(
                "aaaa\n\n✓ · 0s",
                "continued (2/2)\n\nbbbb\n\ncccc\n\n✓ · 0s"), messages);
    }

    @Test
    void shouldAppendContinuationMarkerToHeader() {
        properties.getRender().setMaxBodyChars(4);
        MessageRenderer small = new MessageRenderer(properties);

        List<String> messages = small.prepareMultiMessage(new MarkdownParts("title", "aaaa\n\nbbbb", null));

        assertEquals(List.of("title\n\naaaa", "title · continued (2/2)\n\nbbbb"), messages);
    }

    @Test
    void shouldRenderError() {
        assertEquals("boom\n\n✗ · error", renderer.renderError("boom"));
    }

    @Test
    void shouldFormatElapsedTime() {
        assertEquals("0s", MessageRenderer.formatElapsed(null));
        assertEquals("0s", MessageRenderer.formatElapsed(Duration.ofSeconds(-3)));
        assertEquals("59s", MessageRenderer.formatElapsed(Duration.ofSeconds(59)));
        assertEquals("1m 05s", MessageRenderer.formatElapsed(Duration.ofSeconds(65)));
        assertEquals("1h 02m", MessageRenderer.formatElapsed(Duration.ofSeconds(3725)));
    }
}
