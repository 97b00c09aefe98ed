package com.phillippitts.affectsignal.presentation.exception;

import com.phillippitts.affectsignal.exception.DuplicateKeyException;
import com.phillippitts.affectsignal.exception.UnknownSessionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void duplicateReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleDuplicate(new DuplicateKeyException("q1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("DuplicateKeyException");
        assertThat(response.getBody().details()).contains("q1");
    }

    @Test
    void closedSessionReturns409() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleIllegalState(new IllegalStateException("Session s1 is closed"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void unknownSessionReturns404() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnknownSession(new UnknownSessionException("s9"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().message()).isEqualTo("Session not found");
    }

    @Test
    void invalidInputReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleBadRequest(new IllegalArgumentException("ordinal must be >= 0, got: -1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().details()).contains("ordinal");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void unexpectedReturns500WithoutInternals() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new RuntimeException("db password: secret123"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("secret123").doesNotContain("RuntimeException");
    }
}
