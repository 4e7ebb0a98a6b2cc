package com.example.orchestrator.scheduler.api;

import jakarta.validation.constraints.NotNull;

public record JobEnabledRequest(@NotNull Boolean enabled) {}
