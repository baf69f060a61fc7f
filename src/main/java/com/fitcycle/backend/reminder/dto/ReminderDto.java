package com.fitcycle.backend.reminder.dto;

public record ReminderDto(String type, String time, boolean enabled, String day) {}
