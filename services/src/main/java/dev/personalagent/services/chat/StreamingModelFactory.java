package dev.personalagent.services.chat;

import dev.personalagent.core.domain.ModelProfile;
import dev.personalagent.core.service.ServiceException;
import dev.langchain4j.model.chat.StreamingChatLanguageModel;

/**
 * Builds the streaming model a profile points at.
 */
public interface StreamingModelFactory {

    /**
     * @throws ServiceException with {@link ServiceException.Kind#CONFIGURATION}
     *                          if the profile's provider is not supported
     */
    StreamingChatLanguageModel create(ModelProfile profile) throws ServiceException;
}
