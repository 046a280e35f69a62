package com.teamchat.common.web;

import com.teamchat.common.api.ApiCodes;
import com.teamchat.common.api.Result;
import com.teamchat.common.error.ChannelAccessDeniedException;
import com.teamchat.common.error.ChannelNotFoundException;
import com.teamchat.common.error.TransientWriteFailureException;
import com.teamchat.common.error.UnknownIdentityException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.POST, "chat/nope"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void chatExceptions_carryTheirOwnStatusAndCode() {
        assertEnvelope(handler.handleChat(new UnknownIdentityException("x")),
                HttpStatus.UNAUTHORIZED, ApiCodes.UNKNOWN_IDENTITY, "unknown_identity");
        assertEnvelope(handler.handleChat(new ChannelAccessDeniedException()),
                HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN, "channel_access_denied");
        assertEnvelope(handler.handleChat(new ChannelNotFoundException(9L)),
                HttpStatus.NOT_FOUND, ApiCodes.CHANNEL_NOT_FOUND, "channel_not_found");
        assertEnvelope(handler.handleChat(new TransientWriteFailureException("storage_unavailable", new QueryTimeoutException("t"))),
                HttpStatus.SERVICE_UNAVAILABLE, ApiCodes.TRANSIENT_WRITE_FAILURE, "storage_unavailable");
    }

    @Test
    void illegalArgument_isBadRequestWithReason() {
        assertEnvelope(handler.handleBadRequest(new IllegalArgumentException("content_blank")),
                HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST, "content_blank");
    }

    @Test
    void jwtFailure_isUnauthorized() {
        assertEnvelope(handler.handleJwt(new JwtException("")),
                HttpStatus.UNAUTHORIZED, ApiCodes.UNAUTHORIZED, "invalid_token");
    }

    @Test
    void unexpected_isInternalErrorWithoutDetails() {
        assertEnvelope(handler.handleAny(new IllegalStateException("secret stack detail")),
                HttpStatus.INTERNAL_SERVER_ERROR, ApiCodes.INTERNAL_ERROR, "internal_error");
    }

    private static void assertEnvelope(ResponseEntity<Result<Void>> resp, HttpStatus status, int code, String message) {
        assertThat(resp.getStatusCode()).isEqualTo(status);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(code);
        assertThat(resp.getBody().message()).isEqualTo(message);
    }
}
