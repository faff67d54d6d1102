package com.cheflink.agent.llm;

import com.cheflink.agent.model.Message;
import com.cheflink.agent.model.ModelCompletion;
import com.cheflink.agent.tool.ToolDefinition;

import java.util.List;

public interface LlmClient {

    /**
     * Send the conversation snapshot and the tools on offer to the model.
     *
     * @param messages  conversation so far (system + user + assistant + tool results)
     * @param tools     tool definitions the model may choose to invoke
     * @return the raw output; interpretation is the caller's job
     */
    ModelCompletion complete(List<Message> messages, List<ToolDefinition> tools);
}
