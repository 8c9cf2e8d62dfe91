package work.lcod.rlm.bundle;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GlobTest {
    @Test
    void starCrossesDirectories() {
        assertTrue(Glob.matches("*.md", "docs/a.md"));
        assertTrue(Glob.matches("docs/*", "docs/nested/b.txt"));
        assertFalse(Glob.matches("*.md", "docs/a.mdx"));
    }

    @Test
    void supportsCharacterClasses() {
        assertTrue(Glob.matches("docs/[ab].md", "docs/a.md"));
        assertFalse(Glob.matches("docs/[!ab].md", "docs/a.md"));
        assertTrue(Glob.matches("docs/?.md", "docs/c.md"));
    }

    @Test
    void regexCharactersAreLiteral() {
        assertTrue(Glob.matches("a+b(1).txt", "a+b(1).txt"));
        assertFalse(Glob.matches("a.txt", "abtxt"));
    }
}
