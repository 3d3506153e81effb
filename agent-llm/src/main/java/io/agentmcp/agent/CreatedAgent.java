package io.agentmcp.agent;

import java.util.Optional;

/**
 * A freshly created agent and the model fallback warning, if resolution had to adjust the request.
 */
public record CreatedAgent(ConversationAgent agent, Optional<String> fallbackMessage) {}
