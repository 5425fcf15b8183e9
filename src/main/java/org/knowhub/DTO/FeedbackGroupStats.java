package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackGroupStats {
    private String key;
    private long positive;
    private long negative;
    private long neutral;
    private long removed;
    /** positive + negative + neutral，撤回的不计入 */
    private long total;
    private double positivePercentage;
}
