package org.javai.askdata.generation;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Oracle backed by a Spring AI {@link ChatClient}.
 *
 * <p>The composed prompt is sent as a single user message; temperature and the token
 * limit travel as per-request {@link ChatOptions}. Any exception raised by the client
 * is a transport failure and surfaces as {@link OracleUnavailableException}.</p>
 */
public final class ChatClientOracle implements Oracle {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientOracle.class);

	private final ChatClient chatClient;
	private final String modelId;

	/**
	 * @param chatClient the Spring AI ChatClient
	 * @param modelId optional identifier for observability (e.g., "llama-3.3-70b-versatile")
	 */
	public ChatClientOracle(ChatClient chatClient, String modelId) {
		if (chatClient == null) {
			throw new IllegalArgumentException("chatClient must not be null");
		}
		this.chatClient = chatClient;
		this.modelId = modelId != null && !modelId.isBlank() ? modelId : "unknown";
	}

	public ChatClientOracle(ChatClient chatClient) {
		this(chatClient, null);
	}

	@Override
	public OracleResponse complete(OracleRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		try {
			ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
			spec.options(ChatOptions.builder()
					.temperature(request.temperature())
					.maxTokens(request.maxTokens())
					.build());
			spec.user(request.prompt());
			String content = spec.call().content();
			logger.debug("Prompt sent to {}:\n{}", modelId, request.prompt());
			logger.info("Oracle response from {}:\n{}", modelId, content);
			return new OracleResponse(content != null ? content.strip() : "");
		}
		catch (RuntimeException e) {
			throw new OracleUnavailableException("Oracle call to " + modelId + " failed: " + e.getMessage(), e);
		}
	}

	@Override
	public String modelId() {
		return modelId;
	}
}
