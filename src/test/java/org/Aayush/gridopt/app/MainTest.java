package org.Aayush.gridopt.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.Aayush.gridopt.config.GridOptimizerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Main Tests")
class MainTest {

    @Test
    @DisplayName("Episode mode prints the latest result and the loss metrics")
    void testRunEpisodes() throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Main.runEpisodes(GridOptimizerConfig.defaults(), 3, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        List<JsonNode> documents = new ObjectMapper()
                .readerFor(JsonNode.class)
                .<JsonNode>readValues(buffer.toString(StandardCharsets.UTF_8))
                .readAll();

        assertEquals(2, documents.size());
        JsonNode latest = documents.get(0);
        assertEquals(3L, latest.get("episode").asLong());
        assertEquals(6, latest.get("paths").size());
        JsonNode metrics = documents.get(1);
        assertEquals(3L, metrics.get("episodes_trained").asLong());
        assertEquals(3, metrics.get("history").size());
    }

    @Test
    @DisplayName("Main runs a fixed number of episodes from the command line")
    void testMainWithEpisodes() {
        PrintStream originalOut = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            System.setOut(new PrintStream(buffer));
            assertDoesNotThrow(() -> Main.main(new String[]{"--episodes", "2"}));
        } finally {
            System.setOut(originalOut);
        }

        String output = buffer.toString();
        assertTrue(output.contains("\"episodes_trained\""));
        assertTrue(output.contains("\"loss_percent\""));
    }

    @Test
    @DisplayName("Argument parsing accepts only --episodes N")
    void testParseEpisodes() {
        assertEquals(0, Main.parseEpisodes(new String[0]));
        assertEquals(12, Main.parseEpisodes(new String[]{"--episodes", "12"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseEpisodes(new String[]{"--episodes"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseEpisodes(new String[]{"--episodes", "x"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseEpisodes(new String[]{"--episodes", "0"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseEpisodes(new String[]{"--runs", "3"}));
    }
}
