package io.tabula.core.evaluation;

import static org.assertj.core.api.Assertions.assertThat;

import io.tabula.core.provider.LlmProvider;
import io.tabula.core.provider.LlmProviderException;
import io.tabula.core.provider.LlmRequest;
import io.tabula.core.provider.LlmResponse;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class LlmJudgeTest {

    @Test
    void shouldParseVerdictWrappedInProse() {
        StubProvider provider = new StubProvider(
            "Here is my grade: {\"relevance\": 9, \"accuracy\": 14, \"completeness\": 7, \"verdict\": \"WARN\", \"feedback\": \"cite rows\"} thanks"
        );
        LlmJudge judge = new LlmJudge(provider, "judge-model");

        JudgeVerdict verdict = judge.evaluateResponse("What is the average?", List.of("avg: 87.7"), "It is 87.7");

        assertThat(verdict.relevance()).isEqualTo(9);
        assertThat(verdict.accuracy()).isEqualTo(10);
        assertThat(verdict.verdict()).isEqualTo(JudgeVerdict.WARN);
        assertThat(verdict.feedback()).isEqualTo("cite rows");
        assertThat(provider.requests).singleElement().satisfies(request -> {
            assertThat(request.model()).isEqualTo("judge-model");
            assertThat(request.systemPrompt()).isEqualTo(LlmJudge.RESPONSE_SYSTEM_PROMPT);
            assertThat(request.messages().get(0).text()).contains("avg: 87.7", "It is 87.7");
        });
    }

    @Test
    void shouldFallBackWhenProviderFails() {
        LlmJudge judge = new LlmJudge(new StubProvider(null), "judge-model");

        JudgeVerdict verdict = judge.evaluateTurn("q", List.of("answer"), List.of(), List.of());

        assertThat(verdict.verdict()).isEqualTo(JudgeVerdict.PASS);
        assertThat(verdict.relevance()).isEqualTo(5);
        assertThat(verdict.feedback()).startsWith("Judge turn evaluation failed:");
    }

    @Test
    void shouldFallBackOnUnparseableAnswer() {
        JudgeVerdict verdict = new LlmJudge(new StubProvider("looks fine to me"), "m")
            .evaluateResponse("q", List.of(), "a");

        assertThat(verdict).isEqualTo(JudgeVerdict.fallback(verdict.feedback()));
        assertThat(verdict.feedback()).contains("no JSON object");
    }

    @Test
    void shouldTreatUnknownVerdictAsPass() {
        assertThat(new JudgeVerdict(1, 2, 3, "maybe", null).verdict()).isEqualTo(JudgeVerdict.PASS);
    }

    private static final class StubProvider implements LlmProvider {
        private final String answer;
        private final List<LlmRequest> requests = new ArrayList<>();

        private StubProvider(String answer) {
            this.answer = answer;
        }

        @Override
        public String name() {
            return "stub";
        }

        @Override
        public LlmResponse complete(LlmRequest request) throws LlmProviderException {
            requests.add(request);
            if (answer == null) {
                throw new LlmProviderException("HTTP 500 boom", 500);
            }
            return LlmResponse.text(answer);
        }
    }
}
