package com.deepansh.codeagent.tool;

import java.util.List;

/**
 * Contributes tool specs to the registry at startup, alongside the built-in
 * {@link AgentTool} beans. External process tools come in this way.
 */
public interface ToolSpecLoader {

    List<ToolSpec> load();
}
