package com.clauselens.infrastructure.ai;

import com.clauselens.domain.analysis.service.ReasoningServiceException;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AiClauseReasoningServiceTest {

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private OpenAIClient openAIClient;

    @Mock
    private ReasoningPromptBuilder promptBuilder;

    @Mock
    private ReasoningResponseParser responseParser;

    private ReasoningUsageTracker usageTracker;
    private AiClauseReasoningService service;

    @BeforeEach
    void setUp() {
        usageTracker = new ReasoningUsageTracker();
        service = new AiClauseReasoningService(openAIClient, promptBuilder, responseParser, usageTracker);
        ReflectionTestUtils.setField(service, "model", "gpt-4o-mini");
    }

    private ChatCompletion replyWith(String content) {
        ChatCompletionMessage message = mock(ChatCompletionMessage.class);
        when(message.content()).thenReturn(Optional.of(content));
        ChatCompletion.Choice choice = mock(ChatCompletion.Choice.class);
        when(choice.message()).thenReturn(message);
        ChatCompletion completion = mock(ChatCompletion.class);
        when(completion.choices()).thenReturn(List.of(choice));
        return completion;
    }

    @Test
    @DisplayName("a reply with content is returned and counted as a success")
    void successfulCall() {
        ChatCompletion completion = replyWith("Summary text");
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class))).thenReturn(completion);

        LlmCallResult result = service.call("summary", "system", "user", 300, null);

        assertThat(result.content()).isEqualTo("Summary text");
        assertThat(usageTracker.getFailureRate()).isZero();
    }

    @Test
    @DisplayName("a reply without content counts as exactly one failed request")
    void emptyReplyCountedOnce() {
        ChatCompletion ok = replyWith("[]");
        ChatCompletion empty = mock(ChatCompletion.class);
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class)))
                .thenReturn(ok)
                .thenReturn(empty);

        service.call("tags", "system", "user", 200, null);
        assertThatThrownBy(() -> service.call("tags", "system", "user", 200, null))
                .isInstanceOf(ReasoningServiceException.class)
                .hasMessageContaining("no content");

        assertThat(usageTracker.getFailureRate()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("transport errors are wrapped and counted as failures")
    void transportError() {
        when(openAIClient.chat().completions().create(any(ChatCompletionCreateParams.class)))
                .thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> service.call("risk", "system", "user", 2000, null))
                .isInstanceOf(ReasoningServiceException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(usageTracker.getFailureRate()).isEqualTo(100.0);
    }
}
