package com.example.contentpipeline.integration.llm;

import com.example.contentpipeline.config.PipelineProperties;
import com.example.contentpipeline.service.MalformedOutputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.chat.prompt.PromptTemplate;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Chat model calls used by the OpenAI-backed summary generator and translator.
 */
@Service
@ConditionalOnProperty(prefix = "pipeline", name = "backend", havingValue = "openai")
public class OpenAiContentService {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiContentService.class);

    static final String SUMMARIZE_PROMPT = """
            You summarize video transcripts.
            Write, in the language with code "{language}":
            - highLevel: exactly one sentence giving the overview
            - keyTakeaways: 3 to 5 short sentences, most important first
            - actionItems: 2 to 4 imperative follow-up actions

            Transcript:
            {transcript}

            {formatInstructions}
            """;

    static final String TRANSLATE_PROMPT = """
            Translate the following text into {languageName}.
            Answer with the translation only, keep the meaning and tone, and do not add notes.

            Text:
            {text}
            """;

    private final ChatClient chatClient;
    private final BeanOutputConverter<SummaryDraft> summaryConverter;

    @Autowired
    public OpenAiContentService(PipelineProperties properties) {
        PipelineProperties.OpenAi openai = properties.getOpenai();
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(OpenAiApi.builder()
                        .baseUrl(openai.getBaseUrl())
                        .apiKey(openai.getApiKey())
                        .build())
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(openai.getModel())
                        .build())
                .build();
        this.chatClient = ChatClient.builder(chatModel).build();
        this.summaryConverter = new BeanOutputConverter<>(SummaryDraft.class);
        logger.info("OpenAI content service configured with model {}", openai.getModel());
    }

    OpenAiContentService(ChatClient chatClient) {
        this.chatClient = chatClient;
        this.summaryConverter = new BeanOutputConverter<>(SummaryDraft.class);
    }

    public SummaryDraft summarize(String transcript, String languageCode) {
        Prompt prompt = new PromptTemplate(SUMMARIZE_PROMPT).create(Map.of(
                "language", languageCode,
                "transcript", transcript,
                "formatInstructions", summaryConverter.getFormat()));

        String text = call(prompt);
        logger.debug("Raw summary response: {}", text);
        try {
            return summaryConverter.convert(stripCodeFence(text));
        } catch (RuntimeException e) {
            throw new MalformedOutputException("Model summary could not be parsed: " + e.getMessage(), e);
        }
    }

    public String translate(String text, String languageName) {
        Prompt prompt = new PromptTemplate(TRANSLATE_PROMPT).create(Map.of(
                "languageName", languageName,
                "text", text));
        String translated = call(prompt);
        if (translated == null || translated.isBlank()) {
            throw new MalformedOutputException("Model returned an empty translation");
        }
        return translated.trim();
    }

    private String call(Prompt prompt) {
        ChatResponse response = chatClient.prompt(prompt).call().chatResponse();
        if (response == null || response.getResult() == null) {
            throw new MalformedOutputException("Model returned no result");
        }
        return response.getResult().getOutput().getText();
    }

    static String stripCodeFence(String text) {
        if (text == null) {
            return null;
        }
        return text.replaceAll("```json", "").replaceAll("```", "").trim();
    }
}
