package me.golemcore.contextbot.domain.service;

import me.golemcore.contextbot.infrastructure.i18n.MessageService;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class LoadingMessageProviderTest {

    @Test
    void loadsNumberedMessagesFromBundle() {
        LoadingMessageProvider provider = new LoadingMessageProvider(new MessageService());

        assertEquals(12, provider.getMessages().size());
        for (int i = 0; i < 50; i++) {
            assertTrue(provider.getMessages().contains(provider.randomMessage()));
        }
    }

    @Test
    void stopsAtFirstMissingKey() {
        MessageService messageService = mock(MessageService.class);
        when(messageService.hasMessage("loading.1")).thenReturn(true);
        when(messageService.hasMessage("loading.2")).thenReturn(true);
        when(messageService.getMessage("loading.1")).thenReturn("One moment...");
        when(messageService.getMessage("loading.2")).thenReturn("Looking...");

        LoadingMessageProvider provider = new LoadingMessageProvider(messageService);

        assertEquals(List.of("One moment...", "Looking..."), provider.getMessages());
    }

    @Test
    void failsWithoutAnyMessage() {
        assertThrows(IllegalStateException.class, () -> new LoadingMessageProvider(mock(MessageService.class)));
    }
}
