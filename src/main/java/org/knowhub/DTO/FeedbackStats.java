package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackStats {
    private LocalDateTime from;
    private LocalDateTime to;
    private StatsGroupBy groupBy;
    private FeedbackGroupStats overall;
    private List<FeedbackGroupStats> groups;
}
