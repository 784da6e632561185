package com.studyprep.data.vector;

import java.util.UUID;

public class NeighborHit {
    private final UUID questionId;
    private final double distance;

    public NeighborHit(UUID questionId, double distance) {
        this.questionId = questionId;
        this.distance = distance;
    }

    public UUID getQuestionId() { return questionId; }
    public double getDistance() { return distance; }
}
