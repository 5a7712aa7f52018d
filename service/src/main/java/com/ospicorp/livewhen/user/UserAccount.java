package com.ospicorp.livewhen.user;

import java.time.Instant;

public record UserAccount(String id, String email, Instant createdAt) {}
