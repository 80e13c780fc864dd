/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.leadflow.agents;

import dev.mars.leadflow.workflow.handler.Handler;
import dev.mars.leadflow.workflow.handler.HandlerConfig;
import dev.mars.leadflow.workflow.handler.ResolvedInput;
import dev.mars.leadflow.workflow.handler.StepExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores leads against weighted Ideal Customer Profile criteria and ranks them.
 * <p>
 * Inputs: {@code enriched_leads} (list of lead maps, required) and
 * {@code scoring_criteria} (map with a {@code criteria} list). Without criteria in
 * the input, the workflow config's {@code scoring} entry is used, then a built-in
 * default set.
 * <p>
 * Each criterion has a {@code field} (dot paths allowed), a positive {@code weight}
 * and one of: {@code min}/{@code max} for a linear range score, {@code value} for an
 * equality match, or neither for a presence check. Raw scores lie in [0, 1].
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public class ScoringHandler implements Handler {

    private static final Logger logger = LoggerFactory.getLogger(ScoringHandler.class);

    public static final String TYPE = "ScoringAgent";

    public static final String LEADS_INPUT = "enriched_leads";
    public static final String CRITERIA_INPUT = "scoring_criteria";
    public static final String CONFIG_KEY = "scoring";

    static final List<Map<String, Object>> DEFAULT_CRITERIA = List.of(
            Map.<String, Object>of("field", "company_size", "weight", 0.3, "min", 100, "max", 1000),
            Map.<String, Object>of("field", "company_revenue", "weight", 0.25, "min", 20_000_000, "max", 200_000_000),
            Map.<String, Object>of("field", "recent_funding", "weight", 0.2, "value", true),
            Map.<String, Object>of("field", "hiring_sales", "weight", 0.15, "value", true),
            Map.<String, Object>of("field", "is_corporate_email", "weight", 0.1, "value", true)
    );

    private final String stepId;

    public ScoringHandler(HandlerConfig config) {
        this.stepId = Objects.requireNonNull(config, "Handler config cannot be null").getStepId();
    }

    @Override
    public Map<String, Object> execute(ResolvedInput input, Map<String, Object> workflowConfig)
            throws StepExecutionException {
        if (input.isAbsent(LEADS_INPUT) || !input.isDeclared(LEADS_INPUT)) {
            throw new StepExecutionException("Missing required input: " + LEADS_INPUT);
        }
        Object leadsValue = input.get(LEADS_INPUT).orElse(List.of());
        if (!(leadsValue instanceof List)) {
            throw new StepExecutionException("Input " + LEADS_INPUT + " must be a list but was "
                    + leadsValue.getClass().getSimpleName());
        }
        List<?> leads = (List<?>) leadsValue;
        List<Map<String, Object>> criteria = selectCriteria(input, workflowConfig);

        logger.debug("Step '{}': scoring {} leads with {} criteria", stepId, leads.size(), criteria.size());

        List<Map<String, Object>> scored = new ArrayList<>();
        for (int i = 0; i < leads.size(); i++) {
            Object lead = leads.get(i);
            if (!(lead instanceof Map)) {
                throw new StepExecutionException(LEADS_INPUT + "[" + i + "] must be a mapping");
            }
            scored.add(scoreLead(asStringMap((Map<?, ?>) lead), criteria));
        }

        // List.sort is stable, so equal scores keep their input order
        scored.sort(Comparator.comparingDouble((Map<String, Object> lead) -> (Double) lead.get("total_score"))
                .reversed());

        int total = scored.size();
        double min = 0.0;
        double max = 0.0;
        for (int i = 0; i < total; i++) {
            Map<String, Object> lead = scored.get(i);
            lead.put("rank", i + 1);
            lead.put("percentile", (double) (total - i) / total * 100.0);
            double score = (Double) lead.get("total_score");
            min = i == 0 ? score : Math.min(min, score);
            max = i == 0 ? score : Math.max(max, score);
        }

        Map<String, Object> scoreRange = new LinkedHashMap<>();
        scoreRange.put("min", min);
        scoreRange.put("max", max);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_leads", total);
        metadata.put("scoring_criteria_used", criteria.size());
        metadata.put("score_range", scoreRange);

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("ranked_leads", scored);
        output.put("scoring_metadata", metadata);

        logger.info("Step '{}': ranked {} leads, top score {}", stepId, total, max);
        return output;
    }

    private List<Map<String, Object>> selectCriteria(ResolvedInput input, Map<String, Object> workflowConfig) {
        List<Map<String, Object>> criteria = extractCriteria(input.get(CRITERIA_INPUT).orElse(null));
        if (criteria.isEmpty() && workflowConfig != null) {
            criteria = extractCriteria(workflowConfig.get(CONFIG_KEY));
        }
        if (criteria.isEmpty()) {
            logger.debug("Step '{}': no scoring criteria provided, using defaults", stepId);
            criteria = DEFAULT_CRITERIA;
        }
        return criteria;
    }

    private static List<Map<String, Object>> extractCriteria(Object source) {
        List<Map<String, Object>> criteria = new ArrayList<>();
        if (!(source instanceof Map)) {
            return criteria;
        }
        Object list = ((Map<?, ?>) source).get("criteria");
        if (list instanceof List) {
            for (Object item : (List<?>) list) {
                if (item instanceof Map) {
                    criteria.add(asStringMap((Map<?, ?>) item));
                }
            }
        }
        return criteria;
    }

    private Map<String, Object> scoreLead(Map<String, Object> lead, List<Map<String, Object>> criteria) {
        Map<String, Object> breakdown = new LinkedHashMap<>();
        double total = 0.0;

        for (Map<String, Object> criterion : criteria) {
            Object fieldValue = criterion.get("field");
            String field = fieldValue != null ? fieldValue.toString() : "";
            Double weight = toDouble(criterion.get("weight"));
            if (field.trim().isEmpty() || weight == null || weight <= 0) {
                continue;
            }

            double raw = evaluate(getFieldValue(lead, field), criterion);
            double weighted = raw * weight;

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("raw_score", raw);
            entry.put("weight", weight);
            entry.put("weighted_score", weighted);
            breakdown.put(field, entry);

            total += weighted;
        }

        Map<String, Object> scored = new LinkedHashMap<>(lead);
        scored.put("total_score", BigDecimal.valueOf(total).setScale(2, RoundingMode.HALF_UP).doubleValue());
        scored.put("score_breakdown", breakdown);
        return scored;
    }

    static double evaluate(Object value, Map<String, Object> criterion) {
        if (value == null) {
            return 0.0;
        }
        if (criterion.containsKey("min") && criterion.containsKey("max")) {
            return scoreRange(value, criterion);
        }
        if (criterion.containsKey("value")) {
            return scoreMatch(value, criterion.get("value"));
        }
        return scorePresence(value);
    }

    private static double scoreRange(Object value, Map<String, Object> criterion) {
        Double numeric = value instanceof Boolean ? Double.valueOf((Boolean) value ? 1.0 : 0.0) : toDouble(value);
        Double min = toDouble(criterion.get("min"));
        Double max = toDouble(criterion.get("max"));
        if (numeric == null || min == null || max == null) {
            return 0.0;
        }
        if (min.equals(max)) {
            return numeric.equals(min) ? 1.0 : 0.0;
        }
        if (numeric < min) {
            return 0.0;
        }
        if (numeric > max) {
            return 1.0;
        }
        return (numeric - min) / (max - min);
    }

    private static double scoreMatch(Object value, Object expected) {
        if (value instanceof String) {
            return String.valueOf(expected).equalsIgnoreCase((String) value) ? 1.0 : 0.0;
        }
        if (value instanceof Number && expected instanceof Number) {
            return ((Number) value).doubleValue() == ((Number) expected).doubleValue() ? 1.0 : 0.0;
        }
        return Objects.equals(value, expected) ? 1.0 : 0.0;
    }

    private static double scorePresence(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? 1.0 : 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() > 0 ? 1.0 : 0.0;
        }
        if (value instanceof String) {
            return ((String) value).trim().isEmpty() ? 0.0 : 1.0;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty() ? 0.0 : 1.0;
        }
        return 1.0;
    }

    /**
     * Reads a possibly dotted field path, e.g. {@code company.size}.
     */
    static Object getFieldValue(Map<String, Object> lead, String field) {
        Object current = lead;
        for (String part : field.split("\\.")) {
            if (!(current instanceof Map) || !((Map<?, ?>) current).containsKey(part)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }

    /**
     * Numeric view of a value; NaN and infinities count as non-numeric.
     */
    private static Double toDouble(Object value) {
        double number;
        if (value instanceof Number) {
            number = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                number = Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(number) ? number : null;
    }

    private static Map<String, Object> asStringMap(Map<?, ?> map) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((key, value) -> result.put(String.valueOf(key), value));
        return result;
    }
}
