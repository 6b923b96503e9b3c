package io.vidsort4j.utils;

import io.vidsort4j.core.Priority;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlListParserTest {

    @Test
    void shouldSkipBlankLinesAndComments() throws IOException {
        UrlListParser.Result result = parse("""
                # batch 1

                https://x.com/a/status/1
                   https://www.youtube.com/watch?v=abc   urgent
                """);

        assertEquals(2, result.entries().size());
        assertEquals(Priority.NORMAL, result.entries().get(0).priority());
        assertEquals("https://www.youtube.com/watch?v=abc", result.entries().get(1).url());
        assertEquals(Priority.URGENT, result.entries().get(1).priority());
        assertEquals(4, result.entries().get(1).lineNumber());
        assertTrue(result.rejected().isEmpty());
    }

    @Test
    void malformedLinesShouldBeRejectedWithTheirLineNumber() throws IOException {
        UrlListParser.Result result = parse("""
                ftp://example.com/video.mp4
                https://x.com/a/status/1 soon
                https://x.com/a/status/2 urgent extra
                not a url
                https://x.com/a/status/3
                """);

        assertEquals(List.of("https://x.com/a/status/3"),
                result.entries().stream().map(UrlListParser.UrlEntry::url).toList());
        assertEquals(4, result.rejected().size());
        assertTrue(result.rejected().get(0).startsWith("line 1: "));
        assertTrue(result.rejected().get(1).startsWith("line 2: "));
        assertTrue(result.rejected().get(2).startsWith("line 3: "));
        assertTrue(result.rejected().get(3).startsWith("line 4: "));
    }

    @Test
    void repeatedUrlShouldKeepTheHighestPriority() throws IOException {
        UrlListParser.Result result = parse("""
                https://x.com/a/status/1
                https://x.com/a/status/1 URGENT
                https://x.com/a/status/1 normal
                """);

        assertEquals(1, result.entries().size());
        assertEquals(Priority.URGENT, result.entries().get(0).priority());
        assertEquals(1, result.entries().get(0).lineNumber());
    }

    @Test
    void byteOrderMarkShouldBeIgnored() throws IOException {
        UrlListParser.Result result = parse("\uFEFFhttps://x.com/a/status/1\n");

        assertEquals("https://x.com/a/status/1", result.entries().get(0).url());
    }

    private static UrlListParser.Result parse(String text) throws IOException {
        return UrlListParser.parse(new StringReader(text));
    }
}
