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


package dev.mars.leadflow.workflow.parser;

import dev.mars.leadflow.workflow.InputBinding;
import dev.mars.leadflow.workflow.StepSpec;
import dev.mars.leadflow.workflow.WorkflowSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses workflow documents with SnakeYAML. JSON documents are accepted too.
 * <pre>
 * workflow_name: lead-pipeline
 * version: "1.0"
 * config: { scoring: {...} }
 * steps:
 *   - id: score
 *     agent: ScoringAgent
 *     instructions: Rank leads
 *     inputs: { leads: "{{enrich.enriched_leads}}", criteria: "{{config.scoring}}" }
 *     tools: [ { name: Api, config: { api_key: "{{API_KEY}}" } } ]
 *     output_schema: { ranked_leads: list }
 *     next_steps: [ outreach ]
 * </pre>
 * Tool configurations go through {@link PlaceholderResolver} and end up in the
 * step config keyed by tool name. Input values that are exactly one
 * {@code {{...}}} reference become bindings: {@code {{config.path}}} reads the
 * workflow config, {@code {{input.path}}} reads the run inputs of the execution
 * context, and {@code {{step}}} or {@code {{step.key}}} reads a step output. Any
 * other value is a literal.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-01
 * @version 1.0
 */
public class YamlWorkflowSpecParser implements WorkflowSpecParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowSpecParser.class);

    private static final String CONFIG_PREFIX = "config.";
    private static final String INPUT_PREFIX = "input.";

    private final Yaml yaml;
    private final PlaceholderResolver placeholderResolver;

    public YamlWorkflowSpecParser() {
        this(new PlaceholderResolver());
    }

    public YamlWorkflowSpecParser(PlaceholderResolver placeholderResolver) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.placeholderResolver = Objects.requireNonNull(placeholderResolver, "Placeholder resolver cannot be null");
    }

    @Override
    public WorkflowSpec parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        }
    }

    @Override
    public WorkflowSpec parseFromString(String content) throws WorkflowParseException {
        Object document;
        try {
            document = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("Workflow document is not valid YAML or JSON: " + e.getMessage(), e);
        }
        if (!(document instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid workflow document");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) document;
        return parseWorkflow(data);
    }

    private WorkflowSpec parseWorkflow(Map<String, Object> data) throws WorkflowParseException {
        String name = getStringValue(data, "workflow_name");
        if (name == null || name.trim().isEmpty()) {
            throw new WorkflowParseException(null, "workflow_name", "Workflow name is required");
        }

        Object stepsValue = data.get("steps");
        if (!(stepsValue instanceof List)) {
            throw new WorkflowParseException(name, "steps", "Steps must be a list");
        }

        List<StepSpec> steps = new ArrayList<>();
        List<?> stepList = (List<?>) stepsValue;
        for (int i = 0; i < stepList.size(); i++) {
            String path = "steps[" + i + "]";
            Object stepValue = stepList.get(i);
            if (!(stepValue instanceof Map)) {
                throw new WorkflowParseException(name, path, "Step must be a mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> stepData = (Map<String, Object>) stepValue;
            try {
                steps.add(parseStep(name, path, stepData));
            } catch (IllegalArgumentException e) {
                throw new WorkflowParseException(name, path, e.getMessage(), e);
            }
        }

        Map<String, Object> config = getMapValue(data, "config");
        WorkflowSpec spec = WorkflowSpec.builder(name)
                .version(getStringValue(data, "version", "1.0"))
                .description(getStringValue(data, "description"))
                .config(config != null ? config : Map.of())
                .steps(steps)
                .build();

        logger.debug("Parsed workflow '{}' with {} steps", name, steps.size());
        return spec;
    }

    private StepSpec parseStep(String workflowName, String path, Map<String, Object> data)
            throws WorkflowParseException {
        String id = getStringValue(data, "id");
        if (id == null || id.trim().isEmpty()) {
            throw new WorkflowParseException(workflowName, path + ".id", "Step id is required");
        }
        String agent = getStringValue(data, "agent");
        if (agent == null || agent.trim().isEmpty()) {
            throw new WorkflowParseException(workflowName, path + ".agent", "Handler type is required for step " + id);
        }

        StepSpec.Builder builder = StepSpec.builder(id, agent)
                .instructions(getStringValue(data, "instructions"));

        Map<String, Object> inputs = getMapValue(data, "inputs");
        if (inputs != null) {
            for (Map.Entry<String, Object> entry : inputs.entrySet()) {
                builder.input(toBinding(String.valueOf(entry.getKey()), entry.getValue()));
            }
        }

        builder.config(parseTools(workflowName, path, data.get("tools")));

        Map<String, Object> outputSchema = getMapValue(data, "output_schema");
        if (outputSchema != null) {
            builder.requiredOutputs(outputSchema.keySet().stream().map(String::valueOf).toArray(String[]::new));
        }

        builder.next(getStringList(workflowName, path + ".next_steps", data.get("next_steps")).toArray(new String[0]));
        return builder.build();
    }

    private Map<String, Object> parseTools(String workflowName, String path, Object toolsValue)
            throws WorkflowParseException {
        Map<String, Object> tools = new LinkedHashMap<>();
        if (toolsValue == null) {
            return tools;
        }
        if (!(toolsValue instanceof List)) {
            throw new WorkflowParseException(workflowName, path + ".tools", "Tools must be a list");
        }
        List<?> toolList = (List<?>) toolsValue;
        for (int i = 0; i < toolList.size(); i++) {
            if (!(toolList.get(i) instanceof Map)) {
                throw new WorkflowParseException(workflowName, path + ".tools[" + i + "]", "Tool must be a mapping");
            }
            @SuppressWarnings("unchecked")
            Map<String, Object> tool = (Map<String, Object>) toolList.get(i);
            String toolName = getStringValue(tool, "name");
            if (toolName == null || toolName.trim().isEmpty()) {
                throw new WorkflowParseException(workflowName, path + ".tools[" + i + "].name", "Tool name is required");
            }
            tools.put(toolName, placeholderResolver.resolveMap(getMapValue(tool, "config")));
        }
        return tools;
    }

    /**
     * Maps a raw input value to a binding. Only a value that is exactly one
     * {@code {{...}}} reference is treated as a reference.
     */
    static InputBinding toBinding(String targetKey, Object value) {
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.startsWith("{{") && text.endsWith("}}") && text.indexOf("{{", 2) < 0) {
                String reference = text.substring(2, text.length() - 2).trim();
                if (reference.startsWith(CONFIG_PREFIX) && reference.length() > CONFIG_PREFIX.length()) {
                    return InputBinding.workflowConfig(targetKey, reference.substring(CONFIG_PREFIX.length()));
                }
                if (reference.startsWith(INPUT_PREFIX) && reference.length() > INPUT_PREFIX.length()) {
                    return InputBinding.context(targetKey, reference.substring(INPUT_PREFIX.length()));
                }
                if (!reference.isEmpty()) {
                    int dot = reference.indexOf('.');
                    if (dot < 0) {
                        return InputBinding.stepOutput(targetKey, reference);
                    }
                    if (dot > 0 && dot < reference.length() - 1) {
                        return InputBinding.stepOutput(targetKey, reference.substring(0, dot), reference.substring(dot + 1));
                    }
                }
            }
        }
        return InputBinding.literal(targetKey, value);
    }

    private List<String> getStringList(String workflowName, String path, Object value) throws WorkflowParseException {
        List<String> result = new ArrayList<>();
        if (value == null) {
            return result;
        }
        if (value instanceof String) {
            result.add((String) value);
            return result;
        }
        if (!(value instanceof List)) {
            throw new WorkflowParseException(workflowName, path, "Expected a list of step ids");
        }
        for (Object item : (List<?>) value) {
            if (item == null) {
                throw new WorkflowParseException(workflowName, path, "Step id cannot be null");
            }
            result.add(item.toString());
        }
        return result;
    }

    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        if (data == null) return defaultValue;
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        if (data == null) return null;
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }
}
