package org.knowhub.DTO;

public enum StatsGroupBy {
    NONE,
    DAY,
    AUTHOR,
    CONVERSATION
}
