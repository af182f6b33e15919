package com.molcollab.model;

public record RoomSummary(String roomId, String subjectId, int participantCount, boolean isRecording) {}
