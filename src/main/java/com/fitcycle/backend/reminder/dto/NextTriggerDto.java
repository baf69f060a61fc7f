package com.fitcycle.backend.reminder.dto;

import java.time.Instant;

public record NextTriggerDto(String type, Instant at) {}
