package com.tripbooking.common.exception;

import com.tripbooking.common.dto.BaseResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link GlobalExceptionHandler} status mapping and the downstream error messages.
 */
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("downstream 400: passed on as 400")
    void downstreamBadRequest_mapsTo400() {
        DownstreamException ex = new DownstreamException("flight", "create", 400, "invalid airline");

        ResponseEntity<BaseResponse<?>> response = handler.handleDownstreamException(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getErrorCode()).isEqualTo("DOWNSTREAM_ERROR");
        assertThat(response.getBody().getMessage())
                .isEqualTo("flight create request returned status code 400 (invalid airline)");
    }

    @Test
    @DisplayName("downstream 400 while fetching a stored sub-booking: 502, not the caller's fault")
    void downstreamBadRequestOnFetch_mapsTo502() {
        DownstreamException ex = new DownstreamException("hotel", "fetch", 400, "malformed ref");

        ResponseEntity<BaseResponse<?>> response = handler.handleDownstreamException(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().getErrorCode()).isEqualTo("DOWNSTREAM_ERROR");
    }

    @Test
    @DisplayName("downstream 5xx, not-found and transport failures: 502")
    void downstreamFailures_mapTo502() {
        assertThat(handler.handleDownstreamException(
                new DownstreamException("hotel", "create", 500, "boom")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(handler.handleDownstreamException(
                new SubBookingNotFoundException("car", "C1", "no such booking")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(handler.handleDownstreamException(
                new DownstreamException("car", "fetch", DownstreamException.TRANSPORT_FAILURE, "connection refused"))
                .getStatusCode())
                .isEqualTo(HttpStatus.BAD_GATEWAY);
    }

    @Test
    @DisplayName("transport failure message names the failing call")
    void transportFailure_message() {
        DownstreamException ex = new DownstreamException(
                "car", "fetch", DownstreamException.TRANSPORT_FAILURE, "connection refused");

        assertThat(ex.isTransportFailure()).isTrue();
        assertThat(ex.getMessage()).isEqualTo("car fetch request failed: connection refused");
    }

    @Test
    @DisplayName("not found: 404 with the resource message")
    void notFound_mapsTo404() {
        ResponseEntity<BaseResponse<?>> response = handler.handleResourceNotFoundException(
                new ResourceNotFoundException("booking", "T1"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().getMessage()).isEqualTo("no such booking: T1");
        assertThat(response.getBody().isSuccess()).isFalse();
    }

    @Test
    @DisplayName("persistence failure: 503")
    void persistence_mapsTo503() {
        ResponseEntity<BaseResponse<?>> response = handler.handlePersistenceException(
                new PersistenceException("Failed to read trip record T1", new IllegalStateException("db down")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().getErrorCode()).isEqualTo("PERSISTENCE_ERROR");
    }
}
