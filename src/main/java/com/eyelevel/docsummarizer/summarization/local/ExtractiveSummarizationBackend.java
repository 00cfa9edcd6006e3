package com.eyelevel.docsummarizer.summarization.local;

import com.eyelevel.docsummarizer.config.SummarizerProperties;
import com.eyelevel.docsummarizer.exception.SummarizationException;
import com.eyelevel.docsummarizer.model.LlmBackend;
import com.eyelevel.docsummarizer.model.SummaryMode;
import com.eyelevel.docsummarizer.summarization.SummarizationBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Offline, deterministic summarizer. Sentences are scored by the average corpus frequency of their
 * content words and the best ones are returned in document order.
 */
@Slf4j
@Service("extractiveSummarizationBackend")
public class ExtractiveSummarizationBackend implements SummarizationBackend {

    static final String MODEL_NAME = "extractive-word-frequency";

    private static final Pattern PAGE_MARKER = Pattern.compile("(?m)^=== Page \\d+ ===$");
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern WORD = Pattern.compile("[\\p{L}][\\p{L}'-]*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_SENTENCE_WORDS = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "after", "all", "also", "an", "and", "any", "are", "as", "at", "be", "been", "but", "by",
            "can", "could", "did", "do", "does", "for", "from", "had", "has", "have", "he", "her", "his", "if", "in",
            "into", "is", "it", "its", "may", "more", "most", "no", "not", "of", "on", "or", "other", "our", "she",
            "should", "so", "such", "than", "that", "the", "their", "them", "then", "there", "these", "they", "this",
            "those", "to", "under", "up", "was", "we", "were", "what", "when", "which", "while", "who", "will",
            "with", "would", "you", "your");

    private final SummarizerProperties.Summarization.Local settings;

    public ExtractiveSummarizationBackend(final SummarizerProperties properties) {
        this.settings = properties.getSummarization().getLocal();
    }

    @Override
    public LlmBackend backend() {
        return LlmBackend.LOCAL;
    }

    @Override
    public String modelName() {
        return MODEL_NAME;
    }

    @Override
    public String summarize(final String text, final SummaryMode mode) {
        if (text == null || text.isBlank()) {
            throw new SummarizationException("Cannot summarize empty text");
        }
        final List<String> sentences = splitSentences(text);
        if (sentences.isEmpty()) {
            throw new SummarizationException("Document contains no summarizable sentences");
        }

        final Map<String, Integer> frequencies = wordFrequencies(sentences);
        final int limit = Math.min(sentenceLimit(mode), sentences.size());
        final List<Integer> chosen = IntStream.range(0, sentences.size())
                                              .boxed()
                                              .sorted(Comparator.comparingDouble(
                                                      (Integer i) -> score(sentences.get(i), frequencies))
                                                      .reversed()
                                                      .thenComparing(Comparator.naturalOrder()))
                                              .limit(limit)
                                              .sorted()
                                              .toList();
        log.debug("Selected {} of {} sentences for a {} summary.", chosen.size(), sentences.size(), mode);

        if (mode == SummaryMode.BULLET_POINTS) {
            return chosen.stream().map(i -> "• " + sentences.get(i)).collect(Collectors.joining("\n"));
        }
        return chosen.stream().map(sentences::get).collect(Collectors.joining(" "));
    }

    @Override
    public Map<String, Object> modelInfo() {
        return Map.of("backend", backend().getValue(), "model", modelName(), "provider", "local",
                      "configured", true);
    }

    private int sentenceLimit(final SummaryMode mode) {
        return switch (mode) {
            case BRIEF -> settings.getBriefSentences();
            case DETAILED -> settings.getDetailedSentences();
            case BULLET_POINTS -> settings.getBulletSentences();
        };
    }

    static List<String> splitSentences(final String text) {
        final String flattened = WHITESPACE.matcher(PAGE_MARKER.matcher(text).replaceAll(" ")).replaceAll(" ").strip();
        final List<String> sentences = new ArrayList<>();
        final List<String> fragments = new ArrayList<>();
        for (final String candidate : SENTENCE_BOUNDARY.split(flattened)) {
            final String sentence = candidate.strip();
            if (sentence.isEmpty()) {
                continue;
            }
            fragments.add(sentence);
            if (words(sentence).size() >= MIN_SENTENCE_WORDS) {
                sentences.add(sentence);
            }
        }
        return sentences.isEmpty() ? fragments : sentences;
    }

    private static Map<String, Integer> wordFrequencies(final List<String> sentences) {
        final Map<String, Integer> frequencies = new HashMap<>();
        for (final String sentence : sentences) {
            for (final String word : words(sentence)) {
                if (!STOP_WORDS.contains(word)) {
                    frequencies.merge(word, 1, Integer::sum);
                }
            }
        }
        return frequencies;
    }

    private static double score(final String sentence, final Map<String, Integer> frequencies) {
        final List<String> words = words(sentence);
        if (words.isEmpty()) {
            return 0;
        }
        final int total = words.stream().mapToInt(word -> frequencies.getOrDefault(word, 0)).sum();
        return (double) total / words.size();
    }

    private static List<String> words(final String sentence) {
        final List<String> words = new ArrayList<>();
        final Matcher matcher = WORD.matcher(sentence);
        while (matcher.find()) {
            words.add(matcher.group().toLowerCase(Locale.ROOT));
        }
        return words;
    }
}
