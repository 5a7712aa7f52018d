package com.ospicorp.livewhen.streamer;

import java.time.Instant;

public record ActivityRequest(Instant timestamp, String platform) {}
