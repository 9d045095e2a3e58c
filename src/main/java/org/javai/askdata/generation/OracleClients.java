package org.javai.askdata.generation;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Factory for oracles reached over OpenAI-compatible chat completion endpoints.
 *
 * <p>Groq exposes such an endpoint, so the Spring AI OpenAI model is pointed at Groq's
 * base URL with a Groq API key.</p>
 */
public final class OracleClients {

	public static final String GROQ_BASE_URL = "https://api.groq.com/openai";
	public static final String GROQ_DEFAULT_MODEL = "llama-3.3-70b-versatile";
	public static final String GROQ_API_KEY_ENV = "GROQ_API_KEY";

	private OracleClients() {
	}

	/**
	 * Creates a Groq-backed oracle using the {@code GROQ_API_KEY} environment variable.
	 */
	public static ChatClientOracle groq() {
		return groq(System.getenv(GROQ_API_KEY_ENV), GROQ_DEFAULT_MODEL);
	}

	public static ChatClientOracle groq(String apiKey, String model) {
		return openAiCompatible(GROQ_BASE_URL, apiKey, model);
	}

	/**
	 * Creates an oracle for any OpenAI-compatible endpoint.
	 *
	 * @throws IllegalStateException if no API key is supplied
	 */
	public static ChatClientOracle openAiCompatible(String baseUrl, String apiKey, String model) {
		if (apiKey == null || apiKey.isBlank()) {
			throw new IllegalStateException(GROQ_API_KEY_ENV + " not found. Set it as an environment variable.");
		}
		String effectiveModel = model != null && !model.isBlank() ? model : GROQ_DEFAULT_MODEL;
		OpenAiApi api = OpenAiApi.builder()
				.baseUrl(baseUrl != null && !baseUrl.isBlank() ? baseUrl : GROQ_BASE_URL)
				.apiKey(apiKey)
				.build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(api)
				.defaultOptions(OpenAiChatOptions.builder().model(effectiveModel).build())
				.build();
		return new ChatClientOracle(ChatClient.create(chatModel), effectiveModel);
	}
}
