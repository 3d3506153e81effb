package io.agentmcp.agent;

import io.agentmcp.agent.tools.CommandExecutor;
import io.agentmcp.agent.tools.ToolSet;
import io.agentmcp.llm.ConversationHistory;
import io.agentmcp.llm.LLMConfig;
import io.agentmcp.llm.LLMProvider;
import io.agentmcp.llm.LLMProviderFactory;
import io.agentmcp.llm.ModelResolutionException;
import io.agentmcp.llm.ModelResolver;
import io.agentmcp.llm.ModelResolver.ResolvedModel;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds {@link ConversationAgent}s from a provider/model request. */
public final class AgentFactory {

  private static final Logger LOG = LoggerFactory.getLogger(AgentFactory.class);

  private final ModelResolver resolver;
  private final CommandExecutor executor;
  private final Function<LLMConfig, LLMProvider> providerFactory;
  private final AgentSettings settings;

  public AgentFactory(ModelResolver resolver, CommandExecutor executor) {
    this(resolver, executor, LLMProviderFactory::create, AgentSettings.defaults());
  }

  public AgentFactory(
      ModelResolver resolver,
      CommandExecutor executor,
      Function<LLMConfig, LLMProvider> providerFactory,
      AgentSettings settings) {
    this.resolver = resolver;
    this.executor = executor;
    this.providerFactory = providerFactory;
    this.settings = settings;
  }

  /**
   * Resolves the model and creates an idle agent.
   *
   * @throws ModelResolutionException if the model cannot be resolved or its client cannot be built
   */
  public CreatedAgent create(AgentRequest request) throws ModelResolutionException {
    ResolvedModel resolved =
        resolver.resolve(request.provider(), request.model(), request.thinkingLevel());

    ToolSet tools = ToolSet.create(request.tools(), request.cwd(), executor);

    LLMProvider provider;
    try {
      provider = providerFactory.apply(resolved.config());
    } catch (RuntimeException e) {
      throw new ModelResolutionException(
          "Failed to resolve model "
              + request.provider()
              + "/"
              + request.model()
              + ": "
              + e.getMessage(),
          e);
    }

    LOG.info(
        "Created agent {}/{} in {} with tools {}",
        resolved.config().providerName(),
        resolved.config().model(),
        request.cwd(),
        tools.names());
    ConversationAgent agent =
        new ConversationAgent(
            provider, tools, request.cwd(), settings, new ConversationHistory());
    return new CreatedAgent(agent, resolved.fallbackMessage());
  }
}
