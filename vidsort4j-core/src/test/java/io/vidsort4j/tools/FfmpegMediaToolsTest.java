package io.vidsort4j.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vidsort4j.media.MediaProbe;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FfmpegMediaToolsTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void probeShouldReadFormatDurationAndFirstVideoStream() throws Exception {
        MediaProbe.MediaInfo info = FfmpegMediaTools.parseProbe(om.readTree("""
                {"streams": [
                   {"codec_type": "video", "width": 720, "height": 1280},
                   {"codec_type": "audio"},
                   {"codec_type": "video", "width": 90, "height": 160}
                 ],
                 "format": {"duration": "31.250000"}}
                """));

        assertEquals(31.25, info.durationSeconds(), 1e-9);
        assertEquals(720, info.width());
        assertEquals(1280, info.height());
        assertTrue(info.hasAudio());
    }

    @Test
    void streamDurationShouldBeUsedWhenFormatHasNone() throws Exception {
        MediaProbe.MediaInfo info = FfmpegMediaTools.parseProbe(om.readTree("""
                {"streams": [{"codec_type": "video", "width": 640, "height": 360, "duration": "12.5"}],
                 "format": {}}
                """));

        assertEquals(12.5, info.durationSeconds(), 1e-9);
        assertFalse(info.hasAudio());
    }

    @Test
    void audioOnlyOrEmptyOutputShouldFail() throws Exception {
        assertThrows(IOException.class, () -> FfmpegMediaTools.parseProbe(om.readTree("""
                {"streams": [{"codec_type": "audio"}], "format": {"duration": "3.0"}}
                """)));
        assertThrows(IOException.class, () -> FfmpegMediaTools.parseProbe(om.readTree("")));
    }

    @Test
    void probeShouldRunFfprobeWithJsonOutput() throws Exception {
        ProcessRunner runner = mock(ProcessRunner.class);
        when(runner.runChecked(anyList(), any())).thenReturn(new ProcessRunner.Result(0,
                "{\"streams\":[{\"codec_type\":\"video\",\"width\":2,\"height\":2}],\"format\":{\"duration\":\"1\"}}", ""));
        FfmpegMediaTools tools = new FfmpegMediaTools(runner, om, "ffmpeg", "ffprobe", Duration.ofSeconds(5));

        tools.probe(Path.of("/tmp/in.mp4"));

        verify(runner).runChecked(eq(List.of("ffprobe", "-v", "quiet", "-print_format", "json",
                "-show_format", "-show_streams", "/tmp/in.mp4")), eq(Duration.ofSeconds(5)));
    }
}
