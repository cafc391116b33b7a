package info.isaksson.erland.seqtoeventb.advisor;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.service.AiServices;

import java.util.Objects;

/**
 * {@link PropertyAdvisor} backed by a LangChain4j chat model.
 */
public final class LangChainPropertyAdvisor implements PropertyAdvisor {

    private final PropertyAssistant assistant;

    public LangChainPropertyAdvisor(ChatModel chatModel) {
        Objects.requireNonNull(chatModel, "chatModel");
        this.assistant = AiServices.create(PropertyAssistant.class, chatModel);
    }

    /**
     * Advisor talking to an OpenAI-compatible endpoint.
     *
     * @throws IllegalArgumentException if no API key is configured
     */
    public static LangChainPropertyAdvisor openAi(AdvisorOptions options) {
        if (options == null || !options.hasApiKey()) {
            throw new IllegalArgumentException("No API key; set " + AdvisorOptions.API_KEY_ENV);
        }
        ChatModel model = OpenAiChatModel.builder()
                .apiKey(options.apiKey)
                .baseUrl(options.baseUrl)
                .modelName(options.modelName)
                .timeout(options.timeout)
                .build();
        return new LangChainPropertyAdvisor(model);
    }

    @Override
    public String proposeProperties(AdvisoryRequest request) {
        return assistant.propose(
                request.baseName,
                String.join(", ", request.participants),
                String.join(", ", request.messages));
    }
}
