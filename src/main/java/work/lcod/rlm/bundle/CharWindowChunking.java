package work.lcod.rlm.bundle;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code by_chars}: one chunk per physical line; lines longer than {@code maxChars} are cut into
 * successive windows that all keep the line's number. Lengths are counted in code points.
 */
final class CharWindowChunking implements ChunkingStrategy {
    static final String NAME = "by_chars";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<ChunkSlice> split(String text, int maxChars) {
        if (maxChars < 1) {
            throw new IllegalArgumentException("maxChars must be >= 1");
        }
        List<String> lines = splitLinesKeepingEnds(text);
        if (lines.isEmpty()) {
            return List.of(new ChunkSlice(1, 1, ""));
        }
        List<ChunkSlice> slices = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            int lineNo = i + 1;
            String line = lines.get(i);
            int length = line.codePointCount(0, line.length());
            if (length <= maxChars) {
                slices.add(new ChunkSlice(lineNo, lineNo, line));
                continue;
            }
            int start = 0;
            while (start < line.length()) {
                int remaining = line.codePointCount(start, line.length());
                int end = line.offsetByCodePoints(start, Math.min(maxChars, remaining));
                slices.add(new ChunkSlice(lineNo, lineNo, line.substring(start, end)));
                start = end;
            }
        }
        return slices;
    }

    static List<String> splitLinesKeepingEnds(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n') {
                lines.add(text.substring(start, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < text.length() && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                lines.add(text.substring(start, end));
                start = end;
                i = end - 1;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }
}
