package work.lcod.rlm.subcall;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProviderSettingsTest {
    @Test
    void builtInsAreAvailable() {
        ProviderSettings settings = ProviderSettings.defaults();
        assertTrue(settings.names().containsAll(List.of("openai", "anthropic", "google", "triton")));
        assertEquals("OPENAI_API_KEY", settings.config("OpenAI").apiKeyEnv());
        assertEquals(ProviderSettings.DEFAULT_TIMEOUT, settings.config("openai").timeout());
        assertEquals("raw_text", settings.config("triton").extras().get("codec"));
    }

    @Test
    void workspaceOverridesHome() throws Exception {
        Path home = Files.createTempDirectory("rlm-home");
        Path workspace = Files.createTempDirectory("rlm-ws");
        write(home, "[providers.openai]\nmodel = \"home-model\"\ntimeout_s = 5\n");
        write(workspace, "[providers.openai]\nmodel = \"ws-model\"\n\n[providers.local]\nbase_url = \"http://127.0.0.1:9000\"\ntimeout = \"1500ms\"\n");

        ProviderSettings settings = ProviderSettings.load(workspace, home);

        ProviderConfig openai = settings.config("openai");
        assertEquals("ws-model", openai.model());
        assertEquals(Duration.ofSeconds(5), openai.timeout());
        assertEquals("https://api.openai.com/v1", openai.baseUrl());
        assertEquals(Duration.ofMillis(1500), settings.config("local").timeout());
    }

    @Test
    void inlineSecretsAreRejected() throws Exception {
        Path workspace = Files.createTempDirectory("rlm-ws");
        write(workspace, "[providers.openai]\napi_key = \"sk-123\"\n");

        var ex = assertThrows(IllegalArgumentException.class, () -> ProviderSettings.load(workspace, null));
        assertTrue(ex.getMessage().contains("api_key"));
    }

    @Test
    void malformedTomlIsRejected() throws Exception {
        Path workspace = Files.createTempDirectory("rlm-ws");
        write(workspace, "[providers.openai\nmodel = \n");

        assertThrows(IllegalArgumentException.class, () -> ProviderSettings.load(workspace, null));
    }

    @Test
    void unknownProviderGetsEmptyConfig() {
        ProviderConfig config = ProviderSettings.defaults().config("mystery");
        assertEquals("mystery", config.name());
        assertEquals(ProviderSettings.DEFAULT_TIMEOUT, config.timeout());
        assertTrue(ProviderSettings.defaults().find("mystery").isEmpty());
    }

    private static void write(Path root, String toml) throws Exception {
        Path file = root.resolve(".rlm").resolve(ProviderSettings.CONFIG_FILE);
        Files.createDirectories(file.getParent());
        Files.writeString(file, toml);
    }
}
