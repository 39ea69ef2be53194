package io.github.cyfko.zapformat.core.exception;

import io.github.cyfko.zapformat.core.model.Token;
import io.github.cyfko.zapformat.core.model.TokenKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ZapSyntaxExceptionTest {

    @Test
    @DisplayName("Should create ZapSyntaxException with message")
    void shouldCreateZapSyntaxExceptionWithMessage() {
        // Given
        String message = "Invalid Zap syntax";

        // When
        ZapSyntaxException exception = new ZapSyntaxException(message);

        // Then
        assertEquals(message, exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should create ZapSyntaxException with message and cause")
    void shouldCreateZapSyntaxExceptionWithMessageAndCause() {
        // Given
        String message = "Invalid Zap syntax";
        Throwable cause = new IllegalArgumentException("Root cause");

        // When
        ZapSyntaxException exception = new ZapSyntaxException(message, cause);

        // Then
        assertEquals(message, exception.getMessage());
        assertEquals(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should be unchecked")
    void shouldBeUnchecked() {
        // Given
        ZapSyntaxException exception = new ZapSyntaxException("test");

        // Then
        assertInstanceOf(RuntimeException.class, exception);
    }

    @Test
    @DisplayName("Should carry lexing position")
    void shouldCarryLexingPosition() {
        // When
        ZapLexException exception = new ZapLexException("Unexpected character '@' at line 3, column 7", 3, 7);

        // Then
        assertInstanceOf(ZapSyntaxException.class, exception);
        assertEquals(3, exception.getLine());
        assertEquals(7, exception.getColumn());
        assertEquals("Unexpected character '@' at line 3, column 7", exception.getMessage());
    }

    @Test
    @DisplayName("Should describe the offending token")
    void shouldDescribeOffendingToken() {
        // Given
        Token offending = new Token(TokenKind.RIGHT_BRACE, "}", 4, 2);

        // When
        ZapParseException exception = new ZapParseException("Expected \":\"", offending);

        // Then
        assertInstanceOf(ZapSyntaxException.class, exception);
        assertEquals("Expected \":\". Got 'RIGHT_BRACE' at line 4", exception.getMessage());
        assertEquals(TokenKind.RIGHT_BRACE, exception.getTokenKind());
        assertEquals(4, exception.getLine());
    }

    @Test
    @DisplayName("Should keep the cause of a formatting failure")
    void shouldKeepCauseOfFormattingFailure() {
        // Given
        Throwable cause = new ZapSyntaxException("boom");

        // When
        ZapFormatException exception = new ZapFormatException("Zap formatting error: boom", cause);

        // Then
        assertEquals("Zap formatting error: boom", exception.getMessage());
        assertSame(cause, exception.getCause());
        assertFalse(ZapSyntaxException.class.isInstance(exception));
    }
}
