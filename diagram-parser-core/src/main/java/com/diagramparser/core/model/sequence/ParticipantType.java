package com.diagramparser.core.model.sequence;

public enum ParticipantType {
    PARTICIPANT,
    ACTOR
}
