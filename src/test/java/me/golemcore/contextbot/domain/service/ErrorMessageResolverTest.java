package me.golemcore.contextbot.domain.service;

import me.golemcore.contextbot.domain.exception.ContextBotException;
import me.golemcore.contextbot.domain.exception.ErrorKind;
import me.golemcore.contextbot.domain.exception.InvalidConfigurationException;
import me.golemcore.contextbot.infrastructure.i18n.MessageService;
import me.golemcore.contextbot.testsupport.TestSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorMessageResolverTest {

    private ErrorMessageResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ErrorMessageResolver(new MessageService(), TestSettings.defaults());
    }

    @Test
    void transientAndFatalFailuresGetGenericMessage() {
        String generic = "Oops, Clementine hit a snag. Please try again in a moment.";

        assertEquals(generic, resolver.messageFor(ErrorKind.RATE_LIMITED));
        assertEquals(generic, resolver.messageFor(ErrorKind.TIMEOUT));
        assertEquals(generic, resolver.messageFor(ErrorKind.UNAUTHORIZED));
        assertEquals(generic, resolver.messageFor(ErrorKind.MALFORMED_RESPONSE));
    }

    @Test
    void rawDownstreamDetailIsNeverShown() {
        ContextBotException error = new ContextBotException(ErrorKind.SERVICE_ERROR,
                "HTTP 500: {\"trace\":\"secret\"}");

        assertFalse(resolver.messageFor(error).contains("secret"));
    }

    @Test
    void invalidConfigurationExplainsTheProblem() {
        String text = resolver.messageFor(new InvalidConfigurationException("context size must be between 50 and 250"));

        assertEquals("That configuration was rejected: context size must be between 50 and 250", text);
    }

    @Test
    void missingAssistantAsksForConfiguration() {
        assertTrue(resolver.messageFor(ErrorKind.NO_ASSISTANT_CONFIGURED).startsWith("No assistant is configured"));
    }

    @Test
    void contextUnavailableMentionsChannelAccess() {
        assertTrue(resolver.messageFor(ErrorKind.CONTEXT_UNAVAILABLE).contains("couldn't read"));
    }
}
