package dev.personalagent.services.chat;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits streamed model output into answer text and reasoning enclosed in
 * {@code <think>...</think>}. Tags may arrive split across tokens; a
 * possible tag prefix at the end of a token is held back until the next one.
 */
final class ThinkTagParser {

    static final String OPEN = "<think>";
    static final String CLOSE = "</think>";

    record Segment(boolean thinking, String text) {
    }

    private final StringBuilder pending = new StringBuilder();
    private boolean thinking;

    List<Segment> feed(String token) {
        pending.append(token);
        List<Segment> segments = new ArrayList<>();
        while (true) {
            String tag = thinking ? CLOSE : OPEN;
            int index = pending.indexOf(tag);
            if (index >= 0) {
                emit(segments, pending.substring(0, index));
                pending.delete(0, index + tag.length());
                thinking = !thinking;
                continue;
            }
            int held = partialTagLength(pending, tag);
            emit(segments, pending.substring(0, pending.length() - held));
            pending.delete(0, pending.length() - held);
            return segments;
        }
    }

    /** Releases whatever is still held back at the end of the stream. */
    List<Segment> flush() {
        List<Segment> segments = new ArrayList<>();
        emit(segments, pending.toString());
        pending.setLength(0);
        return segments;
    }

    private void emit(List<Segment> segments, String text) {
        if (!text.isEmpty()) {
            segments.add(new Segment(thinking, text));
        }
    }

    // Length of the longest suffix of text that is a proper prefix of tag
    static int partialTagLength(CharSequence text, String tag) {
        for (int length = Math.min(tag.length() - 1, text.length()); length > 0; length--) {
            if (tag.startsWith(text.subSequence(text.length() - length, text.length()).toString())) {
                return length;
            }
        }
        return 0;
    }
}
