package io.agentmcp.session;

/** Receives {@link AgentEvent}s from a {@link WorkHandle}. */
@FunctionalInterface
public interface AgentEventListener {

  void onEvent(AgentEvent event);
}
