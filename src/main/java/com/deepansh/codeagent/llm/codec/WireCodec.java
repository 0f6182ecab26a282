package com.deepansh.codeagent.llm.codec;

import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.tool.ToolSpec;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Two-way translation between canonical messages and one provider's wire shape.
 *
 * Encoding produces plain maps that the HTTP layer serializes as-is. Decoding
 * a message list and encoding it again preserves tool names, arguments,
 * call ids and outputs.
 */
public interface WireCodec {

    List<Map<String, Object>> encodeTools(List<ToolSpec> tools);

    List<Map<String, Object>> encodeMessages(List<Message> history);

    List<Message> decodeMessages(JsonNode wireMessages);

    /**
     * @throws com.deepansh.codeagent.exception.ProviderException INVALID_RESPONSE when the body
     *         does not have the expected structure
     */
    Message decodeReply(JsonNode responseBody);
}
