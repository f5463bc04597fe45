package dev.personalagent.services.chat;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import dev.personalagent.core.config.ChatConfig;
import dev.personalagent.core.domain.ModelParameters;
import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.service.ServiceException;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaStreamingChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Streams from a local or remote Ollama server.
 */
@Singleton
public class OllamaStreamingModelFactory implements StreamingModelFactory {

    private static final Logger LOG = LoggerFactory.getLogger(OllamaStreamingModelFactory.class);

    public static final String PROVIDER = "ollama";

    private final ChatConfig chatConfig;

    @Inject
    public OllamaStreamingModelFactory(ChatConfig chatConfig) {
        this.chatConfig = chatConfig;
    }

    @Override
    public StreamingChatLanguageModel create(ModelProfile profile) throws ServiceException {
        if (!PROVIDER.equalsIgnoreCase(profile.providerId())) {
            throw new ServiceException(ServiceException.Kind.CONFIGURATION,
                    "Provider '" + profile.providerId() + "' is not supported, only " + PROVIDER);
        }
        String baseUrl = profile.baseUrl() != null && !profile.baseUrl().isBlank()
                ? profile.baseUrl()
                : chatConfig.getOllamaBaseUrl();
        ModelParameters parameters = profile.parameters() != null ? profile.parameters() : ModelParameters.defaults();

        LOG.info("Streaming with {} at {} (temperature {})", profile.modelId(), baseUrl, parameters.temperature());
        return OllamaStreamingChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(profile.modelId())
                .temperature(parameters.temperature())
                .numPredict(parameters.maxTokens())
                .timeout(Duration.ofSeconds(chatConfig.getRequestTimeoutSeconds()))
                .build();
    }
}
