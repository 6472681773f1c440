package com.herzen.recall;

import com.herzen.recall.session.SessionModels.RefinedTranscript;
import com.herzen.recall.session.SessionService;
import com.herzen.recall.session.TranscriptRefiner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TranscriptRefinementTest {
    @Autowired
    private SessionService sessionService;

    @TestConfiguration
    static class RefinerConfig {
        @Bean
        TranscriptRefiner transcriptRefiner() {
            return rawText -> {
                if (rawText.contains("falha")) {
                    throw new IllegalStateException("refinement service unavailable");
                }
                if (rawText.contains("vazio")) {
                    return " ";
                }
                return rawText.replace("fusao", "fusão") + ".";
            };
        }
    }

    @Test
    void returnsRefinedText() {
        RefinedTranscript transcript = sessionService.refineTranscript("a fusao une nucleos leves");
        assertEquals("a fusão une nucleos leves.", transcript.text());
        assertTrue(transcript.refined());
    }

    @Test
    void fallsBackToRawTextWhenRefinerFails() {
        RefinedTranscript transcript = sessionService.refineTranscript("falha na fusao");
        assertEquals("falha na fusao", transcript.text());
        assertFalse(transcript.refined());
    }

    @Test
    void fallsBackToRawTextWhenRefinerReturnsNothing() {
        RefinedTranscript transcript = sessionService.refineTranscript("texto vazio");
        assertEquals("texto vazio", transcript.text());
        assertFalse(transcript.refined());
    }

    @Test
    void blankInputIsNotSentToTheRefiner() {
        assertEquals(new RefinedTranscript("", false), sessionService.refineTranscript(null));
        assertEquals(new RefinedTranscript("  ", false), sessionService.refineTranscript("  "));
    }
}
