package org.knowhub.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.knowhub.DTO.Message;
import org.knowhub.config.AiProperties;
import org.knowhub.exception.GenerationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatCompletionClientTest {

    private static final List<Message> MESSAGES = List.of(new Message("user", "hello"));

    @Test
    void completeReturnsMessageContent() {
        ChatCompletionClient client = client(request -> Mono.just(response(HttpStatus.OK, MediaType.APPLICATION_JSON,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Deploy via terraform [1].\"}}]}")));

        assertThat(client.complete(MESSAGES)).isEqualTo("Deploy via terraform [1].");
    }

    @Test
    void missingContentIsGenerationError() {
        ChatCompletionClient client = client(request -> Mono.just(response(HttpStatus.OK, MediaType.APPLICATION_JSON,
                "{\"choices\":[]}")));

        assertThatThrownBy(() -> client.complete(MESSAGES)).isInstanceOf(GenerationException.class);
    }

    @Test
    void serverErrorIsGenerationError() {
        ChatCompletionClient client = client(request -> Mono.just(response(HttpStatus.BAD_GATEWAY,
                MediaType.APPLICATION_JSON, "{}")));

        assertThatThrownBy(() -> client.complete(MESSAGES)).isInstanceOf(GenerationException.class);
    }

    @Test
    void streamEmitsDeltaContentUntilDone() {
        String sse = "data: {\"choices\":[{\"delta\":{\"content\":\"Deploy \"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{\"content\":\"via terraform\"}}]}\n\n"
                + "data: {\"choices\":[{\"delta\":{}}]}\n\n"
                + "data: [DONE]\n\n";
        ChatCompletionClient client = client(request -> Mono.just(response(HttpStatus.OK, MediaType.TEXT_EVENT_STREAM, sse)));

        List<String> tokens = client.stream(MESSAGES).collectList().block();

        assertThat(tokens).containsExactly("Deploy ", "via terraform");
    }

    @Test
    void streamErrorIsGenerationError() {
        ChatCompletionClient client = client(request -> Mono.just(response(HttpStatus.SERVICE_UNAVAILABLE,
                MediaType.APPLICATION_JSON, "{}")));

        assertThatThrownBy(() -> client.stream(MESSAGES).collectList().block())
                .isInstanceOf(GenerationException.class);
    }

    private static ChatCompletionClient client(ExchangeFunction exchange) {
        WebClient webClient = WebClient.builder().exchangeFunction(exchange).baseUrl("http://chat.test").build();
        return new ChatCompletionClient(webClient, new ObjectMapper(), new AiProperties(), "test-chat");
    }

    private static ClientResponse response(HttpStatus status, MediaType type, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, type.toString())
                .body(body)
                .build();
    }
}
