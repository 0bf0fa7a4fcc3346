package com.nei10u.cosmic.service;

import com.nei10u.cosmic.model.CosmicFingerprint;
import com.nei10u.cosmic.model.LifePurposeProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NarrativeServiceTest {

    private ChatClient.ChatClientRequestSpec request;
    private ChatClient.CallResponseSpec response;
    private NarrativeService service;
    private final CosmicFingerprint fp = Fingerprints.london();

    @BeforeEach
    void setUp() {
        ChatClient.Builder builder = mock(ChatClient.Builder.class);
        ChatClient chatClient = mock(ChatClient.class);
        request = mock(ChatClient.ChatClientRequestSpec.class);
        response = mock(ChatClient.CallResponseSpec.class);
        when(builder.build()).thenReturn(chatClient);
        when(chatClient.prompt()).thenReturn(request);
        when(request.system(anyString())).thenReturn(request);
        when(request.user(anyString())).thenReturn(request);
        when(request.call()).thenReturn(response);

        service = new NarrativeService(builder, new FingerprintContextFormatter());
        service.setFallbackEnabled(true);
    }

    @Nested
    @DisplayName("首次解读")
    class FirstReading {

        @Test
        @DisplayName("模型输出原样返回（去掉首尾空白），system 里带人设与指纹上下文")
        void passesThrough() {
            when(response.content()).thenReturn("  ✦ You arrived knowing.  ");

            NarrativeService.Reading reading = service.firstReading(fp, "rid-1");

            assertThat(reading.text()).isEqualTo("✦ You arrived knowing.");
            assertThat(reading.fallback()).isFalse();
            ArgumentCaptor<String> system = ArgumentCaptor.forClass(String.class);
            verify(request).system(system.capture());
            assertThat(system.getValue())
                    .startsWith("You are Pearl")
                    .contains(FingerprintContextFormatter.HEADER)
                    .contains("Sun: Pisces");
        }

        @Test
        @DisplayName("空输出：用名字的第一个词拼兜底文案")
        void blankFallsBack() {
            when(response.content()).thenReturn("   ");

            NarrativeService.Reading reading = service.firstReading(fp, "rid-2");

            assertThat(reading.fallback()).isTrue();
            assertThat(reading.text()).startsWith("✦ I see you, John.").endsWith("✦");
        }

        @Test
        void exceptionFallsBack() {
            when(response.content()).thenThrow(new IllegalStateException("upstream 502"));

            assertThat(service.firstReading(fp, "rid-3").fallback()).isTrue();
        }

        @Test
        @DisplayName("关闭兜底时直接抛出")
        void fallbackDisabled() {
            service.setFallbackEnabled(false);
            when(response.content()).thenThrow(new IllegalStateException("upstream 502"));

            assertThatThrownBy(() -> service.firstReading(fp, "rid-4"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("upstream 502");
        }
    }

    @Nested
    @DisplayName("人生使命")
    class LifePurpose {

        @Test
        @DisplayName("解析 ```json 包裹的下划线键名")
        void parsesFencedJson() {
            when(response.content()).thenReturn("""
                    Here you go:
                    ```json
                    {
                      "headline": "You came to build bridges.",
                      "purpose_direction": "Toward the collective.",
                      "career_alignment": "Stewardship of lasting value.",
                      "leadership_style": "Quiet authority.",
                      "fulfillment_drivers": "Shared vision.",
                      "long_term_path": "Slow mastery."
                    }
                    ```
                    """);

            LifePurposeProfile profile = service.lifePurpose(fp, "rid-5");

            assertThat(profile.isFallback()).isFalse();
            assertThat(profile.getHeadline()).isEqualTo("You came to build bridges.");
            assertThat(profile.getPurposeDirection()).isEqualTo("Toward the collective.");
            assertThat(profile.getLongTermPath()).isEqualTo("Slow mastery.");
            assertThat(profile.getSourceData().getNorthNodeSign()).isEqualTo("Aquarius");

            ArgumentCaptor<String> user = ArgumentCaptor.forClass(String.class);
            verify(request).user(user.capture());
            assertThat(user.getValue())
                    .contains("Life Purpose reading for John Smith")
                    .contains("☋ South Node: Leo");
        }

        @Test
        @DisplayName("缺失字段用固定文案补齐")
        void fillsMissingFields() {
            when(response.content()).thenReturn("{\"headline\": \"Only this.\"}");

            LifePurposeProfile profile = service.lifePurpose(fp, "rid-6");

            assertThat(profile.isFallback()).isFalse();
            assertThat(profile.getHeadline()).isEqualTo("Only this.");
            assertThat(profile.getCareerAlignment()).isEqualTo("Your career path aligns with your deepest nature.");
            assertThat(profile.getLongTermPath()).isEqualTo("Your Saturn teaches patience; the mastery is coming.");
        }

        @Test
        @DisplayName("非 JSON 输出：模板兜底")
        void notJsonFallsBack() {
            when(response.content()).thenReturn("The stars are quiet tonight.");

            LifePurposeProfile profile = service.lifePurpose(fp, "rid-7");

            assertThat(profile.isFallback()).isTrue();
            assertThat(profile).usingRecursiveComparison()
                    .isEqualTo(LifePurposeTemplates.fallback(fp.getNatalChart()));
        }

        @Test
        void exceptionFallsBack() {
            when(response.content()).thenThrow(new IllegalStateException("rate limited"));

            assertThat(service.lifePurpose(fp, "rid-8").isFallback()).isTrue();
        }

        @Test
        @DisplayName("关闭兜底时解析失败也抛出")
        void fallbackDisabled() {
            service.setFallbackEnabled(false);
            when(response.content()).thenReturn("not json");

            assertThatThrownBy(() -> service.lifePurpose(fp, "rid-9"))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void normalizeJson() {
        assertThat(NarrativeService.normalizeJson("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
        assertThat(NarrativeService.normalizeJson("no braces")).isEmpty();
        assertThat(NarrativeService.normalizeJson(null)).isEmpty();
    }
}
