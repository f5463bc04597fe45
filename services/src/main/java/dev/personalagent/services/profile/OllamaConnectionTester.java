package dev.personalagent.services.profile;

import com.google.common.base.Stopwatch;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import dev.personalagent.core.config.ChatConfig;
import dev.personalagent.core.domain.ConnectionTestResult;
import dev.personalagent.core.domain.ModelProfile;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Sends a one-word prompt to the profile's Ollama endpoint and measures the
 * round trip.
 */
@Singleton
public class OllamaConnectionTester implements ConnectionTester {

    private static final Logger LOG = LoggerFactory.getLogger(OllamaConnectionTester.class);

    private static final String PROBE_PROMPT = "ping";
    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(30);

    private final ChatConfig chatConfig;

    @Inject
    public OllamaConnectionTester(ChatConfig chatConfig) {
        this.chatConfig = chatConfig;
    }

    @Override
    public ConnectionTestResult test(ModelProfile profile) {
        String baseUrl = profile.baseUrl() != null && !profile.baseUrl().isBlank()
                ? profile.baseUrl()
                : chatConfig.getOllamaBaseUrl();
        LOG.info("Testing profile '{}' against {} ({})", profile.name(), baseUrl, profile.modelId());

        Stopwatch stopwatch = Stopwatch.createStarted();
        try {
            ChatLanguageModel model = OllamaChatModel.builder()
                    .baseUrl(baseUrl)
                    .modelName(profile.modelId())
                    .timeout(PROBE_TIMEOUT)
                    .maxRetries(0)
                    .build();
            model.generate(PROBE_PROMPT);
            long elapsed = stopwatch.elapsed(TimeUnit.MILLISECONDS);
            LOG.info("Profile '{}' answered in {} ms", profile.name(), elapsed);
            return ConnectionTestResult.ok(elapsed);
        } catch (RuntimeException e) {
            LOG.warn("Profile '{}' connection test failed: {}", profile.name(), e.getMessage());
            return ConnectionTestResult.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
