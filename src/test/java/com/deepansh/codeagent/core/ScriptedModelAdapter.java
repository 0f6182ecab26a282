package com.deepansh.codeagent.core;

import com.deepansh.codeagent.llm.ModelProtocolAdapter;
import com.deepansh.codeagent.model.Message;
import com.deepansh.codeagent.model.ToolCall;
import com.deepansh.codeagent.tool.ToolSpec;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Test adapter that replays canned replies and records every request.
 */
public class ScriptedModelAdapter implements ModelProtocolAdapter {

    private final Deque<Supplier<Message>> replies = new ArrayDeque<>();
    private final List<List<Message>> requests = new ArrayList<>();

    public ScriptedModelAdapter reply(Message message) {
        replies.add(() -> message);
        return this;
    }

    public ScriptedModelAdapter reply(Supplier<Message> supplier) {
        replies.add(supplier);
        return this;
    }

    public ScriptedModelAdapter toolCalls(ToolCall... calls) {
        return reply(Message.builder().role(Message.Role.assistant).content("").toolCalls(List.of(calls)).build());
    }

    public static ToolCall call(String id, String tool, Map<String, Object> args) {
        return ToolCall.builder().id(id).toolName(tool).arguments(args).build();
    }

    @Override
    public synchronized Message send(List<Message> history, List<ToolSpec> tools) {
        requests.add(List.copyOf(history));
        Supplier<Message> next = replies.poll();
        if (next == null) {
            throw new IllegalStateException("no scripted reply left");
        }
        return next.get();
    }

    @Override
    public String provider() {
        return "scripted";
    }

    public synchronized List<List<Message>> requests() {
        return List.copyOf(requests);
    }
}
