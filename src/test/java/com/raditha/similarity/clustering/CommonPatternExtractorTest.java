package com.raditha.similarity.clustering;

import com.raditha.similarity.ai.SemanticJudge;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CommonPatternExtractorTest {

    @Mock
    private SemanticJudge judge;

    @Test
    void testFallbackWithoutJudge() {
        assertEquals("Similar code structure", new CommonPatternExtractor(null).extract(List.of("a", "b")));
    }

    @Test
    void testUsesTrimmedJudgeReply() throws Exception {
        when(judge.judge(anyString())).thenReturn("  Accumulate a field over a list  \n");

        assertEquals("Accumulate a field over a list", new CommonPatternExtractor(judge).extract(List.of("a", "b")));
    }

    @Test
    void testBlankReply() throws Exception {
        when(judge.judge(anyString())).thenReturn("   ");

        assertEquals("Common pattern detected", new CommonPatternExtractor(judge).extract(List.of("a", "b")));
    }

    @Test
    void testFailureFallsBack() throws Exception {
        when(judge.judge(anyString())).thenThrow(new IOException("503"));

        assertEquals("Similar code structure", new CommonPatternExtractor(judge).extract(List.of("a", "b")));
    }

    @Test
    void testPromptNumbersBlocks() throws Exception {
        when(judge.judge(anyString())).thenReturn("pattern");

        new CommonPatternExtractor(judge).extract(List.of("first()", "second()"));

        verify(judge).judge(argThat(prompt -> prompt.contains("Block 1:\n```\nfirst()\n```")
                && prompt.contains("Block 2:\n```\nsecond()\n```")));
    }
}
