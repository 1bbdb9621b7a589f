package com.boundplan.planning.model;

public record ToolSelection(String stepId, String selectedTool) {
}
