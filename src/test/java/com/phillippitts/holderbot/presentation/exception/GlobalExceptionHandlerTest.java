package com.phillippitts.holderbot.presentation.exception;

import com.phillippitts.holderbot.exception.InvalidSubjectException;
import com.phillippitts.holderbot.exception.StorageException;
import com.phillippitts.holderbot.exception.VisionOracleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidSubjectReturns400WithReason() {
        ResponseEntity<?> response = handler.handleInvalidSubject(
                new InvalidSubjectException("subject id must not be blank"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidSubjectException")
                .contains("Invalid subject")
                .contains("subject id must not be blank");
    }

    @Test
    void illegalArgumentReturns400() {
        ResponseEntity<?> response = handler.handleIllegalArgument(
                new IllegalArgumentException("Unsupported export format: xml"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("InvalidRequest").contains("xml");
    }

    @Test
    void storageFailureReturns503WithoutInternals() {
        StorageException ex = new StorageException("applyCorrection", "42",
                new SQLException("password=secret123 rejected"));

        ResponseEntity<?> response = handler.handleStorage(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("StorageException")
                .contains("temporarily unavailable")
                .contains("retry")
                .doesNotContain("secret123");
    }

    @Test
    void oracleFailureReturns503WithoutInternals() {
        VisionOracleException ex = new VisionOracleException("api key sk-abc rejected", "top", 401);

        ResponseEntity<?> response = handler.handleOracle(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString())
                .contains("VisionOracleException")
                .contains("Image analysis temporarily unavailable")
                .doesNotContain("sk-abc");
    }

    @Test
    void unexpectedReturns500WithGenericBody() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("Internal stack trace"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .contains("unexpected error")
                .contains("contact support")
                .doesNotContain("IllegalStateException")
                .doesNotContain("stack trace");
    }

    @Test
    void errorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleInvalidSubject(new InvalidSubjectException("blank"));

        String body = response.getBody().toString();
        assertThat(body).contains("errorCode=");
        assertThat(body).contains("message=");
        assertThat(body).contains("details=");
        assertThat(body).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
