package me.golemcore.contextbot.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PromptLoaderTest {

    @TempDir
    Path tempDir;

    private PromptLoader promptLoader;
    private BotProperties.PromptsProperties properties;

    @BeforeEach
    void setUp() {
        promptLoader = new PromptLoader(new DefaultResourceLoader());
        properties = new BotProperties.PromptsProperties();
    }

    @Test
    void loadsBundledPromptsByDefault() {
        PromptLoader.Prompts prompts = promptLoader.load(properties);

        assertTrue(prompts.contextSystemPrompt().contains("conversation"));
        assertFalse(prompts.userPrompt().isBlank());
    }

    @Test
    void loadsPromptsFromFilesAndStripsWhitespace() throws Exception {
        Path system = Files.writeString(tempDir.resolve("system.txt"), "\n  Summarize the thread.\n\n",
                StandardCharsets.UTF_8);
        Path user = Files.writeString(tempDir.resolve("user.txt"), "Answer in one line.", StandardCharsets.UTF_8);
        properties.setContextSystemLocation("file:" + system);
        properties.setUserLocation("file:" + user);

        PromptLoader.Prompts prompts = promptLoader.load(properties);

        assertEquals("Summarize the thread.", prompts.contextSystemPrompt());
        assertEquals("Answer in one line.", prompts.userPrompt());
    }

    @Test
    void failsOnMissingPromptFile() {
        properties.setUserLocation("file:" + tempDir.resolve("absent.txt"));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> promptLoader.load(properties));
        assertTrue(error.getMessage().contains("user prompt"));
    }

    @Test
    void failsOnEmptyPromptFile() throws Exception {
        Path empty = Files.writeString(tempDir.resolve("empty.txt"), "   \n", StandardCharsets.UTF_8);
        properties.setContextSystemLocation("file:" + empty);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> promptLoader.load(properties));
        assertTrue(error.getMessage().startsWith("Empty context system prompt"));
    }

    @Test
    void failsWithoutLocation() {
        properties.setUserLocation(" ");

        assertThrows(IllegalStateException.class, () -> promptLoader.load(properties));
    }
}
