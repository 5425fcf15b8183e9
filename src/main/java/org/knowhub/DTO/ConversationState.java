package org.knowhub.DTO;

public enum ConversationState {
    EMPTY,
    ACTIVE,
    EXPIRED
}
