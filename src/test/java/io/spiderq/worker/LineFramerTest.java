package io.spiderq.worker;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

final class LineFramerTest {

    @Test
    void splitsOnNewlinesAndDropsCarriageReturns() throws Exception {
        List<String> frames = new ArrayList<>();
        LineFramer.Result result = LineFramer.strict(1024).frame(stream("a\r\nb\n\n  \nc\n"), frames::add);

        Assertions.assertEquals(List.of("a", "b", "c"), frames);
        Assertions.assertEquals(3, result.frames());
        Assertions.assertFalse(result.truncatedTail());
    }

    @Test
    void reassemblesRecordsSplitAcrossReads() throws Exception {
        String text = "{\"type\":\"log\",\"message\":\"héllo wörld\"}\n{\"type\":\"done\",\"count\":2}\n";
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        List<String> frames = new ArrayList<>();

        LineFramer.strict(1024).frame(new OneByteAtATime(bytes), frames::add);

        Assertions.assertEquals(List.of(
                "{\"type\":\"log\",\"message\":\"héllo wörld\"}",
                "{\"type\":\"done\",\"count\":2}"), frames);
    }

    @Test
    void strictModeRejectsUnterminatedTail() throws Exception {
        List<String> frames = new ArrayList<>();
        LineFramer.Result result = LineFramer.strict(1024).frame(stream("complete\n{\"type\":\"do"), frames::add);

        Assertions.assertEquals(List.of("complete"), frames);
        Assertions.assertTrue(result.truncatedTail());
    }

    @Test
    void lenientModeKeepsUnterminatedTail() throws Exception {
        List<String> frames = new ArrayList<>();
        LineFramer.Result result = LineFramer.lenient(1024).frame(stream("Traceback\nValueError: bad"), frames::add);

        Assertions.assertEquals(List.of("Traceback", "ValueError: bad"), frames);
        Assertions.assertFalse(result.truncatedTail());
    }

    @Test
    void oversizedFrameIsSkippedUpToNextNewline() throws Exception {
        List<String> frames = new ArrayList<>();
        String big = "x".repeat(40);
        LineFramer.Result result = LineFramer.strict(16).frame(stream("ok\n" + big + "\nafter\n"), frames::add);

        Assertions.assertEquals(List.of("ok", "after"), frames);
        Assertions.assertEquals(1, result.oversizedFrames());
    }

    @Test
    void rejectsNonPositiveLimit() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> LineFramer.strict(0));
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static final class OneByteAtATime extends InputStream {
        private final byte[] data;
        private int pos;

        OneByteAtATime(byte[] data) {
            this.data = data;
        }

        @Override
        public int read() {
            return pos < data.length ? data[pos++] & 0xff : -1;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (pos >= data.length) {
                return -1;
            }
            b[off] = data[pos++];
            return 1;
        }
    }
}
