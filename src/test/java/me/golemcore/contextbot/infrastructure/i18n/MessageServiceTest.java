package me.golemcore.contextbot.infrastructure.i18n;

import org.junit.jupiter.api.Test;

import java.util.ListResourceBundle;

import static org.junit.jupiter.api.Assertions.*;

class MessageServiceTest {

    private final MessageService messageService = new MessageService();

    @Test
    void formatsArguments() {
        assertEquals("Oops, Pico hit a snag. Please try again in a moment.",
                messageService.getMessage("error.generic", "Pico"));
    }

    @Test
    void unquotesApostrophesInMessagesWithoutArguments() {
        assertTrue(messageService.getMessage("context.empty").startsWith("I couldn't find"));
    }

    @Test
    void returnsKeyForMissingMessage() {
        assertEquals("no.such.key", messageService.getMessage("no.such.key"));
        assertFalse(messageService.hasMessage("no.such.key"));
        assertTrue(messageService.hasMessage("answer.sources"));
    }

    @Test
    void readsGivenBundle() {
        MessageService custom = new MessageService(new ListResourceBundle() {
            @Override
            protected Object[][] getContents() {
                return new Object[][] { { "greeting", "Hello {0}" } };
            }
        });

        assertEquals("Hello Ann", custom.getMessage("greeting", "Ann"));
    }
}
