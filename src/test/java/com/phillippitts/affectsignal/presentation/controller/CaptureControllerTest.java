package com.phillippitts.affectsignal.presentation.controller;

import com.phillippitts.affectsignal.domain.CaptureKey;
import com.phillippitts.affectsignal.domain.EmotionScore;
import com.phillippitts.affectsignal.domain.EmotionVector;
import com.phillippitts.affectsignal.domain.ExpressionSource;
import com.phillippitts.affectsignal.domain.ImageArtifact;
import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.exception.UnknownSessionException;
import com.phillippitts.affectsignal.presentation.exception.GlobalExceptionHandler;
import com.phillippitts.affectsignal.service.pipeline.AffectPipeline;
import com.phillippitts.affectsignal.service.pipeline.CaptureTrigger;
import com.phillippitts.affectsignal.service.pipeline.SessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CaptureControllerTest {

    private static final MockMultipartFile IMAGE =
            new MockMultipartFile("image", "frame.png", "image/png", new byte[]{1, 2, 3});

    private SessionRegistry sessions;
    private AffectPipeline pipeline;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        sessions = mock(SessionRegistry.class);
        pipeline = mock(AffectPipeline.class);
        when(sessions.open("s1")).thenReturn(pipeline);
        mvc = MockMvcBuilders.standaloneSetup(new CaptureController(sessions))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void acceptsCapture() throws Exception {
        when(pipeline.trigger(any(), any()))
                .thenReturn(new CaptureTrigger("q1", false, new CompletableFuture<>()));

        mvc.perform(multipart("/api/sessions/s1/captures").file(IMAGE)
                        .param("roundId", "technical")
                        .param("questionId", "q1")
                        .param("ordinal", "0"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.questionId").value("q1"))
                .andExpect(jsonPath("$.status").value("accepted"));

        ArgumentCaptor<CaptureKey> key = ArgumentCaptor.forClass(CaptureKey.class);
        ArgumentCaptor<ImageArtifact> image = ArgumentCaptor.forClass(ImageArtifact.class);
        verify(pipeline).trigger(key.capture(), image.capture());
        assertThat(key.getValue()).isEqualTo(new CaptureKey("technical", "q1", 0));
        assertThat(image.getValue().mimeType()).isEqualTo("image/png");
        assertThat(image.getValue().payload()).containsExactly(1, 2, 3);
    }

    @Test
    void reportsDuplicateCapture() throws Exception {
        when(pipeline.trigger(any(), any()))
                .thenReturn(new CaptureTrigger("q1", true, new CompletableFuture<>()));

        mvc.perform(multipart("/api/sessions/s1/captures").file(IMAGE)
                        .param("roundId", "technical")
                        .param("questionId", "q1")
                        .param("ordinal", "0"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("duplicate"));
    }

    @Test
    void missingImageIsBadRequest() throws Exception {
        mvc.perform(multipart("/api/sessions/s1/captures")
                        .param("roundId", "technical")
                        .param("questionId", "q1")
                        .param("ordinal", "0"))
                .andExpect(status().isBadRequest());

        verify(pipeline, never()).trigger(any(), any());
    }

    @Test
    void nonNumericOrdinalIsBadRequest() throws Exception {
        mvc.perform(multipart("/api/sessions/s1/captures").file(IMAGE)
                        .param("roundId", "technical")
                        .param("questionId", "q1")
                        .param("ordinal", "first"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MethodArgumentTypeMismatchException"));
    }

    @Test
    void emptyImageIsBadRequest() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("image", "frame.jpg", "image/jpeg", new byte[0]);

        mvc.perform(multipart("/api/sessions/s1/captures").file(empty)
                        .param("roundId", "technical")
                        .param("questionId", "q1")
                        .param("ordinal", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("image payload must not be empty"));
    }

    @Test
    void closedSessionIsConflict() throws Exception {
        when(pipeline.trigger(any(), any())).thenThrow(new IllegalStateException("Session s1 is closed"));

        mvc.perform(multipart("/api/sessions/s1/captures").file(IMAGE)
                        .param("roundId", "technical")
                        .param("questionId", "q1")
                        .param("ordinal", "0"))
                .andExpect(status().isConflict());
    }

    @Test
    void returnsStoredExpression() throws Exception {
        QuestionExpression e = new QuestionExpression("q1", "technical", 0, 0,
                EmotionVector.of(EmotionScore.of("Joy", 0.9)), ExpressionSource.REAL, Instant.EPOCH);
        when(sessions.get("s1")).thenReturn(pipeline);
        when(pipeline.expression("q1")).thenReturn(Optional.of(e));

        mvc.perform(get("/api/sessions/s1/expressions/q1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questionId").value("q1"))
                .andExpect(jsonPath("$.source").value("REAL"))
                .andExpect(jsonPath("$.vector.scores[0].label").value("Joy"));
    }

    @Test
    void unresolvedExpressionIsNotFound() throws Exception {
        when(sessions.get("s1")).thenReturn(pipeline);
        when(pipeline.expression("q9")).thenReturn(Optional.empty());

        mvc.perform(get("/api/sessions/s1/expressions/q9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void reportForUnknownSessionIsNotFound() throws Exception {
        when(sessions.get("nope")).thenThrow(new UnknownSessionException("nope"));

        mvc.perform(get("/api/sessions/nope/report"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("UnknownSessionException"));
    }

    @Test
    void closeSession() throws Exception {
        when(sessions.close("s1")).thenReturn(true);

        mvc.perform(delete("/api/sessions/s1"))
                .andExpect(status().isNoContent());
    }

    @Test
    void closeUnknownSessionIsNotFound() throws Exception {
        when(sessions.close("nope")).thenReturn(false);

        mvc.perform(delete("/api/sessions/nope"))
                .andExpect(status().isNotFound());
    }
}
