package com.optionbot.sentiment;

import com.optionbot.config.Config;
import com.optionbot.core.diagnostics.CauseCode;
import com.optionbot.model.Headline;
import com.optionbot.model.SentimentMethod;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Financial headline classifier backed by a local Ollama chat model.
 * The model is built on first use and released by {@link #close()}; one instance lives for one run.
 */
public final class ClassifierScorer implements SentimentScorer, AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ClassifierScorer.class);

    private final Supplier<ChatLanguageModel> modelFactory;
    private final long batchTimeoutMs;
    private final ExecutorService inferenceExecutor;
    private ChatLanguageModel chatModel;
    private boolean closed;

    public ClassifierScorer(Config config) {
        this(() -> buildModel(config), Duration.ofSeconds(Math.max(1, config.getInt("sentiment.classifier.timeout_sec", 60))));
    }

    ClassifierScorer(Supplier<ChatLanguageModel> modelFactory, Duration batchTimeout) {
        this.modelFactory = modelFactory;
        this.batchTimeoutMs = Math.max(1L, batchTimeout == null ? 60_000L : batchTimeout.toMillis());
        this.inferenceExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sentiment-classifier");
            t.setDaemon(true);
            return t;
        });
    }

    private static ChatLanguageModel buildModel(Config config) {
        return OllamaChatModel.builder()
                .baseUrl(config.getString("sentiment.classifier.base_url", "http://127.0.0.1:11434"))
                .modelName(config.getString("sentiment.classifier.model", "llama3.1:latest"))
                .temperature(0.0)
                .format("json")
                .timeout(Duration.ofSeconds(Math.max(1, config.getInt("sentiment.classifier.timeout_sec", 60))))
                .maxRetries(0)
                .build();
    }

    @Override
    public SentimentMethod method() {
        return SentimentMethod.CLASSIFIER;
    }

    @Override
    public List<Double> scoreBatch(List<Headline> headlines) throws SentimentScoringException {
        if (headlines == null || headlines.isEmpty()) {
            return List.of();
        }
        ChatLanguageModel model = model();
        String prompt = buildPrompt(headlines);
        Future<String> reply = inferenceExecutor.submit(() -> model.generate(prompt));
        String raw;
        try {
            raw = reply.get(batchTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            reply.cancel(true);
            throw new SentimentScoringException(CauseCode.CLASSIFIER_TIMEOUT,
                    "classifier batch exceeded " + batchTimeoutMs + " ms", e);
        } catch (InterruptedException e) {
            reply.cancel(true);
            Thread.currentThread().interrupt();
            throw new SentimentScoringException(CauseCode.CLASSIFIER_TIMEOUT, "classifier batch interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new SentimentScoringException(CauseCode.RUNTIME_ERROR,
                    "classifier inference failed: " + cause.getMessage(), cause);
        }
        return parseReply(raw, headlines.size());
    }

    private synchronized ChatLanguageModel model() throws SentimentScoringException {
        if (closed) {
            throw new SentimentScoringException(CauseCode.CLASSIFIER_INIT_FAILED, "classifier already closed");
        }
        if (chatModel == null) {
            try {
                chatModel = modelFactory.get();
            } catch (RuntimeException | LinkageError e) {
                throw new SentimentScoringException(CauseCode.CLASSIFIER_INIT_FAILED,
                        "failed to initialize classifier model: " + e.getMessage(), e);
            }
            if (chatModel == null) {
                throw new SentimentScoringException(CauseCode.CLASSIFIER_INIT_FAILED, "classifier model factory returned null");
            }
            LOG.info("sentiment classifier model initialized");
        }
        return chatModel;
    }

    static String buildPrompt(List<Headline> headlines) {
        StringBuilder sb = new StringBuilder(256 + headlines.size() * 96);
        sb.append("You are a financial sentiment classifier.\n");
        sb.append("Classify each numbered news headline as positive, negative or neutral for the company's stock,\n");
        sb.append("with a confidence between 0 and 1.\n");
        sb.append("Reply with JSON only, in the form:\n");
        sb.append("{\"results\":[{\"id\":1,\"label\":\"positive\",\"confidence\":0.87}]}\n");
        sb.append("Return exactly one result per headline, ids in the same order.\n\n");
        sb.append("Headlines:\n");
        for (int i = 0; i < headlines.size(); i++) {
            Headline h = headlines.get(i);
            String text = h == null ? "" : h.text.replace('\n', ' ').replace('\r', ' ');
            sb.append(i + 1).append(". ").append(text).append('\n');
        }
        return sb.toString();
    }

    /**
     * Maps the model reply to signed scores: positive gives +confidence, negative -confidence, neutral 0.
     */
    static List<Double> parseReply(String raw, int expected) throws SentimentScoringException {
        String body = stripFences(raw);
        JSONArray results;
        try {
            if (body.startsWith("[")) {
                results = new JSONArray(body);
            } else {
                JSONObject root = new JSONObject(body);
                results = root.optJSONArray("results");
            }
        } catch (JSONException e) {
            throw new SentimentScoringException(CauseCode.CLASSIFIER_BAD_REPLY, "classifier reply is not JSON", e);
        }
        if (results == null || results.length() != expected) {
            throw new SentimentScoringException(CauseCode.CLASSIFIER_BAD_REPLY,
                    "classifier returned " + (results == null ? 0 : results.length()) + " results for " + expected + " headlines");
        }
        List<Double> out = new ArrayList<>(expected);
        for (int i = 0; i < results.length(); i++) {
            JSONObject item = results.optJSONObject(i);
            if (item == null) {
                throw new SentimentScoringException(CauseCode.CLASSIFIER_BAD_REPLY, "classifier result " + (i + 1) + " is not an object");
            }
            String label = item.optString("label", "").trim().toLowerCase(Locale.ROOT);
            double confidence = item.optDouble("confidence", Double.NaN);
            if (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new SentimentScoringException(CauseCode.CLASSIFIER_BAD_REPLY,
                        "classifier result " + (i + 1) + " has invalid confidence");
            }
            switch (label) {
                case "positive":
                    out.add(confidence);
                    break;
                case "negative":
                    out.add(-confidence);
                    break;
                case "neutral":
                    out.add(0.0);
                    break;
                default:
                    throw new SentimentScoringException(CauseCode.CLASSIFIER_BAD_REPLY,
                            "classifier result " + (i + 1) + " has unknown label '" + label + "'");
            }
        }
        return out;
    }

    private static String stripFences(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("```")) {
            text = text.replaceFirst("^```(?:json)?", "");
            int end = text.lastIndexOf("```");
            if (end >= 0) {
                text = text.substring(0, end);
            }
        }
        return text.trim();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        chatModel = null;
        inferenceExecutor.shutdownNow();
    }
}
