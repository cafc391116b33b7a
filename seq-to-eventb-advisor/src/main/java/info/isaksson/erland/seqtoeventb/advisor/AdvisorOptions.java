package info.isaksson.erland.seqtoeventb.advisor;

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the OpenAI-compatible chat endpoint.
 */
public final class AdvisorOptions {

    public static final String API_KEY_ENV = "OPENAI_API_KEY";

    public String apiKey;
    public String baseUrl = "https://api.openai.com/v1";
    public String modelName = "gpt-4o-mini";
    public Duration timeout = Duration.ofSeconds(60);

    public static AdvisorOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static AdvisorOptions fromEnvironment(Map<String, String> env) {
        AdvisorOptions o = new AdvisorOptions();
        o.apiKey = env.get(API_KEY_ENV);
        return o;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
