package com.mcpbuilder.dispatch.api;

public record UpdateStatusRequest(String status) {}
