package com.ospicorp.livewhen.streamer;

public record StreamerWithFollowers(Streamer streamer, int followerCount) {}
