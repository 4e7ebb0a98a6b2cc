package com.example.orchestrator.scheduler.api;

public record ClearHistoryResponse(int deleted) {}
