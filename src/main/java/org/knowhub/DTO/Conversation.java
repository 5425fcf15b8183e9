package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

// 会话，存储在 Redis 中
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation {
    private String id;
    @Builder.Default
    private List<Turn> turns = new ArrayList<>();
    private Instant createdAt;
    private Instant lastActivityAt;

    public boolean hasTurns() {
        return turns != null && !turns.isEmpty();
    }

    public Turn lastTurn() {
        return hasTurns() ? turns.get(turns.size() - 1) : null;
    }
}
