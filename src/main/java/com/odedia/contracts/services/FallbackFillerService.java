package com.odedia.contracts.services;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odedia.contracts.dto.FallbackResult;
import com.odedia.contracts.schema.ContractField;
import com.odedia.contracts.schema.ContractSchema;

/**
 * Asks a language model for the fields the rule-based extractor left empty.
 *
 * Features:
 * - Requests only the missing fields, keyed by their Arabic headers
 * - Truncates the contract text to a fixed character budget
 * - Retries transport failures and non-JSON replies (see {@link ResilientLlmService})
 * - Ignores keys that were not requested
 *
 * The result is merged with {@link FallbackResult#mergeInto}, which never
 * overwrites a field the extractor already filled.
 */
@Service
public class FallbackFillerService {

    private static final Logger logger = LoggerFactory.getLogger(FallbackFillerService.class);

    private static final String OPERATION = "FallbackFill";

    static final String SYSTEM_PROMPT =
            "أنت مساعد يستخرج حقول عقود العمل بدقة ويعيد النتيجة بصيغة JSON فقط دون أي شرح.";

    private final ContractSchema schema;
    private final FallbackModelClient modelClient;
    private final ResilientLlmService resilientLlm;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final String apiKey;
    private final String model;
    private final int maxChars;

    public FallbackFillerService(ContractSchema schema,
            FallbackModelClient modelClient,
            ResilientLlmService resilientLlm,
            ObjectMapper objectMapper,
            @Value("${app.ai.fallback.enabled:false}") boolean enabled,
            @Value("${app.ai.fallback.apiKey:}") String apiKey,
            @Value("${app.ai.fallback.model:sonar}") String model,
            @Value("${app.ai.fallback.maxChars:22000}") int maxChars) {
        this.schema = schema;
        this.modelClient = modelClient;
        this.resilientLlm = resilientLlm;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.apiKey = apiKey;
        this.model = model;
        this.maxChars = maxChars;

        logger.info("Initialized FallbackFillerService: enabled={}, model={}, maxChars={}, credential={}",
                enabled, model, maxChars, hasCredential() ? "present" : "missing");
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Asks the model for the given fields.
     *
     * @param missingFields  Fields to fill; fields outside the schema are dropped
     * @param normalizedText Normalized contract text
     * @return Values for exactly the requested fields
     * @throws FallbackException when no credential is configured or every
     *                           attempt failed
     */
    public FallbackResult fill(List<ContractField> missingFields, String normalizedText) throws FallbackException {
        List<ContractField> requested = missingFields.stream().filter(schema::contains).distinct().toList();
        if (requested.isEmpty()) {
            return new FallbackResult(Map.of(), Map.of(), Map.of(), "");
        }
        if (!hasCredential()) {
            throw new FallbackException("Missing fallback API key (app.ai.fallback.apiKey)");
        }

        String prompt = buildPrompt(requested, truncate(normalizedText));
        logger.info("Requesting {} missing fields from fallback model {}", requested.size(), model);

        try {
            FallbackResult result = resilientLlm.callWithRetryOrThrow(OPERATION,
                    () -> parseResponse(modelClient.complete(model, SYSTEM_PROMPT, prompt), requested));
            long answered = result.values().values().stream().filter(v -> !v.isBlank()).count();
            logger.info("Fallback model answered {}/{} fields", answered, requested.size());
            return result;
        } catch (ResilientLlmService.LlmCallException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new FallbackException("Fallback model unavailable: " + cause.getMessage(), e);
        }
    }

    String truncate(String text) {
        String trimmed = text == null ? "" : text.strip();
        return trimmed.length() > maxChars ? trimmed.substring(0, maxChars) : trimmed;
    }

    String buildPrompt(List<ContractField> requested, String text) {
        String fields = String.join("\n", requested.stream().map(f -> "- " + f.getHeader()).toList());
        return String.format("""
                لديك نص عقد عمل بعد التطبيع. املأ الحقول التالية فقط:

                %s

                قواعد الإخراج:
                - أعد كائن JSON واحدًا فقط.
                - المفاتيح هي أسماء الحقول أعلاه حرفيًا، ولا تضف حقولًا أخرى.
                - الحقل غير الموجود في النص قيمته "".
                - التواريخ بصيغة DD/MM/YYYY.
                - المبالغ والأعداد أرقام فقط دون فواصل أو عملة.
                - رقم الجوال أرقام متصلة، وإن بدأ بـ 9660 فاحذف الصفر بعد 966.
                - أضف "_evidence": قاموس من اسم الحقل إلى مقتطف قصير من النص يثبت القيمة.
                - أضف "_confidence": قاموس من اسم الحقل إلى رقم بين 0 و 1.

                نص العقد:
                \"\"\"%s\"\"\"
                """, fields, text);
    }

    /**
     * Reads the model's reply: the whole reply as JSON, or the outermost
     * {@code {...}} block inside it.
     *
     * @throws IllegalArgumentException when the reply holds no JSON object
     */
    FallbackResult parseResponse(String content, List<ContractField> requested) {
        JsonNode root = readJsonObject(content);
        if (root == null) {
            throw new IllegalArgumentException("Fallback model returned non-JSON");
        }

        Map<ContractField, String> values = new EnumMap<>(ContractField.class);
        for (ContractField field : requested) {
            values.put(field, asText(root.get(field.getHeader())));
        }

        Map<ContractField, String> evidence = new EnumMap<>(ContractField.class);
        JsonNode evidenceNode = sideMap(root, "_evidence", "evidence");
        forEachRequested(evidenceNode, requested, (field, node) -> evidence.put(field, asText(node)));

        Map<ContractField, Double> confidence = new EnumMap<>(ContractField.class);
        JsonNode confidenceNode = sideMap(root, "_confidence", "confidence");
        forEachRequested(confidenceNode, requested, (field, node) -> confidence.put(field, asDouble(node)));

        return new FallbackResult(values, evidence, confidence, content);
    }

    private JsonNode readJsonObject(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        String text = content.strip();
        JsonNode node = tryRead(text);
        if (node == null || !node.isObject()) {
            int start = text.indexOf('{');
            int end = text.lastIndexOf('}');
            if (start >= 0 && end > start) {
                node = tryRead(text.substring(start, end + 1));
            }
        }
        return node != null && node.isObject() ? node : null;
    }

    private JsonNode tryRead(String candidate) {
        try {
            return objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            logger.debug("Not a JSON object: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static JsonNode sideMap(JsonNode root, String... names) {
        for (String name : names) {
            JsonNode node = root.get(name);
            if (node != null && node.isObject()) {
                return node;
            }
        }
        return null;
    }

    private void forEachRequested(JsonNode node, List<ContractField> requested,
            BiConsumer<ContractField, JsonNode> consumer) {
        if (node == null) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            schema.fieldForHeader(entry.getKey())
                    .filter(requested::contains)
                    .ifPresent(field -> consumer.accept(field, entry.getValue()));
        }
    }

    private static String asText(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return (node.isValueNode() ? node.asText() : node.toString()).strip();
    }

    private static double asDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText().strip());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private boolean hasCredential() {
        return apiKey != null && !apiKey.isBlank();
    }
}
