package com.fitcycle.backend.reminder.model;

/** reminders_json 裡每個 type 存的內容；day 只有 weekly 類型會用到（mon..sun） */
public record ReminderSetting(String time, boolean enabled, String day) {}
