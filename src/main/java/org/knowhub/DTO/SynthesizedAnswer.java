package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
@AllArgsConstructor
public class SynthesizedAnswer {
    private final String answer;
    private final List<Citation> citations;
    /** false 表示没有检索到依据，answer 为兜底文案 */
    private final boolean grounded;
}
