package com.fitcycle.backend.auth.security;

public record TelegramIdentity(long tgId, String name) {}
