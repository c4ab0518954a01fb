package com.tripbooking.trip.client;

import com.tripbooking.common.exception.DownstreamException;
import com.tripbooking.common.exception.SubBookingNotFoundException;
import feign.FeignException;
import feign.RetryableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;

/**
 * Base for sub-booking clients backed by a Feign interface.
 * Holds the status contract shared by all booking services: create answers 201, fetch answers 200,
 * fetch answers 404 for an unknown reference. Anything else becomes a {@link DownstreamException}.
 */
@Slf4j
public abstract class HttpSubBookingClient<Q, C> implements SubBookingClient<Q, C> {

    private final ResourceKind kind;
    private final String endpoint;

    protected HttpSubBookingClient(ResourceKind kind, String endpoint) {
        this.kind = kind;
        this.endpoint = endpoint;
    }

    protected abstract ResponseEntity<C> post(Q request);

    protected abstract ResponseEntity<C> get(String ref);

    protected abstract String referenceOf(C confirmation);

    @Override
    public ResourceKind kind() {
        return kind;
    }

    @Override
    public SubBooking<C> create(Q request) {
        ResponseEntity<C> response;
        try {
            response = post(request);
        } catch (FeignException e) {
            throw translate(DownstreamException.CREATE, e);
        }
        C confirmation = expectStatus(DownstreamException.CREATE, response, HttpStatus.CREATED);
        String ref = referenceOf(confirmation);
        if (!StringUtils.hasText(ref)) {
            throw new DownstreamException(kind.resourceName(), DownstreamException.CREATE,
                    response.getStatusCode().value(), "confirmation carries no booking reference");
        }
        log.debug("Booked {} {} at {}", kind.resourceName(), ref, endpoint);
        return new SubBooking<>(ref, confirmation);
    }

    @Override
    public C fetch(String ref) {
        ResponseEntity<C> response;
        try {
            response = get(ref);
        } catch (FeignException.NotFound e) {
            log.warn("{} booking {} not found at {}", kind.resourceName(), ref, endpoint);
            throw new SubBookingNotFoundException(kind.resourceName(), ref, e.contentUTF8());
        } catch (FeignException e) {
            throw translate(DownstreamException.FETCH, e);
        }
        return expectStatus(DownstreamException.FETCH, response, HttpStatus.OK);
    }

    private C expectStatus(String operation, ResponseEntity<C> response, HttpStatus expected) {
        int status = response.getStatusCode().value();
        if (status != expected.value()) {
            throw new DownstreamException(kind.resourceName(), operation, status, String.valueOf(response.getBody()));
        }
        if (response.getBody() == null) {
            throw new DownstreamException(kind.resourceName(), operation, status, "empty response body");
        }
        return response.getBody();
    }

    private DownstreamException translate(String operation, FeignException e) {
        if (e instanceof RetryableException || e.status() < 0) {
            return new DownstreamException(kind.resourceName(), operation, DownstreamException.TRANSPORT_FAILURE,
                    endpoint + ": " + e.getMessage(), e);
        }
        return new DownstreamException(kind.resourceName(), operation, e.status(), e.contentUTF8(), e);
    }
}
