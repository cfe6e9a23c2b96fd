package scribe.core.service.editor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import scribe.core.config.EditorConfig;
import scribe.core.model.block.Block;
import scribe.core.model.block.BlockPayload;
import scribe.core.model.block.BlockType;
import scribe.core.model.editor.ContentAnalysis;

/**
 * Derives word count, reading time and block counts from a post's blocks.
 *
 * <p>Words are counted in text, quote, callout, code and twitter blocks only.
 * Reading time is the word count divided by the reading speed, rounded up.
 */
@ApplicationScoped
public class ContentAnalyzer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int wordsPerMinute;

    @Inject
    public ContentAnalyzer(EditorConfig config) {
        this(config.analysis().wordsPerMinute());
    }

    public ContentAnalyzer(int wordsPerMinute) {
        if (wordsPerMinute <= 0) {
            throw new IllegalArgumentException("Words per minute must be positive: " + wordsPerMinute);
        }
        this.wordsPerMinute = wordsPerMinute;
    }

    public ContentAnalysis analyze(List<Block> blocks) {
        int words = 0;
        final Map<BlockType, Integer> counts = new EnumMap<>(BlockType.class);
        for (Block block : blocks) {
            words += countWords(readableText(block.payload()));
            counts.merge(block.type(), 1, Integer::sum);
        }
        final int readingTime = (words + wordsPerMinute - 1) / wordsPerMinute;
        return new ContentAnalysis(words, readingTime, counts, blocks.size());
    }

    static int countWords(String text) {
        if (text == null) {
            return 0;
        }
        final var trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;
    }

    private static String readableText(BlockPayload payload) {
        if (payload instanceof BlockPayload.Text text) {
            return text.text();
        }
        if (payload instanceof BlockPayload.Quote quote) {
            return quote.quote();
        }
        if (payload instanceof BlockPayload.Callout callout) {
            return callout.content();
        }
        if (payload instanceof BlockPayload.Code code) {
            return code.codeText();
        }
        if (payload instanceof BlockPayload.Twitter twitter) {
            return twitter.content();
        }
        return null;
    }
}
