package com.linguabot.model;

public record LeaderboardEntry(int rank, String userId, long score, Level level) {
}
