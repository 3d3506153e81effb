package io.agentmcp.llm.providers;

import static org.junit.jupiter.api.Assertions.*;

import io.agentmcp.llm.LLMConfig;
import io.agentmcp.llm.LLMException;
import io.agentmcp.llm.LLMProvider.LLMRequest;
import java.util.List;
import org.junit.jupiter.api.Test;

class MockProviderTest {

  @Test
  void replaysScriptThenEchoes() throws Exception {
    MockProvider provider = new MockProvider(LLMConfig.mock(), List.of("first"));

    assertEquals("first", provider.complete(LLMRequest.of("a")).content());
    assertEquals("Mock response to: b", provider.complete(LLMRequest.of("b")).content());
  }

  @Test
  void closedProviderIsUnavailable() {
    MockProvider provider = new MockProvider(LLMConfig.mock());
    provider.close();

    LLMException e =
        assertThrows(LLMException.class, () -> provider.complete(LLMRequest.of("a")));
    assertEquals(LLMException.ErrorType.PROVIDER_UNAVAILABLE, e.getType());
  }
}
