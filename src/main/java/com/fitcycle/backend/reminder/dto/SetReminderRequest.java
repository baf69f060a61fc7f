package com.fitcycle.backend.reminder.dto;

/** enabled 省略 = true；day 只有 weekly_pdf 會看 */
public record SetReminderRequest(String time, Boolean enabled, String day) {}
