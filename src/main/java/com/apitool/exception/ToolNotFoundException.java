package com.apitool.exception;

public class ToolNotFoundException extends ToolEngineException {

    public ToolNotFoundException(String toolId) {
        super(ErrorKind.TOOL_NOT_FOUND, "Tool not found: " + toolId);
    }
}
