package io.agentmcp.llm.providers;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import io.agentmcp.llm.LLMConfig;
import io.agentmcp.llm.LLMException;
import io.agentmcp.llm.LLMProvider;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;

/**
 * Base for providers backed by a LangChain4j {@link ChatLanguageModel}. Converts requests into
 * LangChain4j messages and maps provider failures onto {@link LLMException.ErrorType}s.
 */
abstract class ChatModelProvider extends LLMProvider {

  private final ChatLanguageModel model;

  ChatModelProvider(LLMConfig config, ChatLanguageModel model) {
    super(config);
    this.model = model;
  }

  /** Display name used in error messages. */
  protected abstract String displayName();

  @Override
  public LLMResponse complete(LLMRequest request) throws LLMException {
    long startTime = System.currentTimeMillis();

    List<ChatMessage> messages = new ArrayList<>();
    if (request.systemPrompt() != null && !request.systemPrompt().isEmpty()) {
      messages.add(SystemMessage.from(request.systemPrompt()));
    }
    for (Message msg : request.messages()) {
      switch (msg.role()) {
        case USER -> messages.add(UserMessage.from(msg.content()));
        case ASSISTANT -> messages.add(AiMessage.from(msg.content()));
        case SYSTEM -> messages.add(SystemMessage.from(msg.content()));
      }
    }

    try {
      Response<AiMessage> response = model.generate(messages);

      String content = response.content().text();
      int tokens = response.tokenUsage() != null ? response.tokenUsage().totalTokenCount() : 0;
      long duration = System.currentTimeMillis() - startTime;

      return new LLMResponse(content, config.model(), tokens, duration);
    } catch (RuntimeException e) {
      throw classify(e);
    }
  }

  /** Maps a LangChain4j failure onto an error type. */
  LLMException classify(RuntimeException e) {
    String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();

    if (hasCause(e, SocketTimeoutException.class)
        || hasCause(e, HttpTimeoutException.class)
        || message.toLowerCase().contains("timeout")) {
      return new LLMException(
          LLMException.ErrorType.TIMEOUT, displayName() + " request timed out", e);
    }
    if (message.contains("401") || message.contains("403")) {
      return new LLMException(
          LLMException.ErrorType.AUTH_FAILED,
          "Authentication failed. Check your " + displayName() + " API key.",
          e);
    }
    if (message.contains("429")) {
      return new LLMException(
          LLMException.ErrorType.RATE_LIMITED,
          "Rate limit exceeded. Wait a moment and try again.",
          e);
    }
    if (message.contains("404") || message.toLowerCase().contains("model not found")) {
      return new LLMException(
          LLMException.ErrorType.MODEL_NOT_FOUND,
          "Model not found: " + config.providerName() + "/" + config.model(),
          e);
    }
    if (message.contains("400")) {
      return new LLMException(
          LLMException.ErrorType.INVALID_REQUEST,
          displayName() + " rejected the request: " + message,
          e);
    }
    return new LLMException(
        LLMException.ErrorType.NETWORK_ERROR,
        "Error calling " + displayName() + ": " + message,
        e);
  }

  private static boolean hasCause(Throwable t, Class<? extends Throwable> type) {
    for (Throwable c = t; c != null; c = c.getCause()) {
      if (type.isInstance(c)) {
        return true;
      }
    }
    return false;
  }
}
