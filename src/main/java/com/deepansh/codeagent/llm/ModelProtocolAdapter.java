package com.deepansh.codeagent.llm;

import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.tool.ToolSpec;

import java.util.List;

public interface ModelProtocolAdapter {

    /**
     * Send the full conversation history and the available tools to the model.
     *
     * @param history full conversation so far (system + user + assistant + tool results)
     * @param tools   tools the model may choose to invoke
     * @return the next assistant message; tool calls in emission order, reasoning kept separate
     * @throws com.deepansh.codeagent.exception.ProviderException on any provider failure
     */
    Message send(List<Message> history, List<ToolSpec> tools);

    /** Provider key used in logs and error messages */
    String provider();
}
