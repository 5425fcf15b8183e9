package org.knowhub.DTO;

import lombok.AllArgsConstructor;
import lombok.Getter;
import reactor.core.publisher.Flux;

/**
 * 流式回答。prompt 为 null 时 tokens 只包含兜底文案。
 */
@Getter
@AllArgsConstructor
public class AnswerStream {
    private final Flux<String> tokens;
    private final BoundedPrompt prompt;
}
