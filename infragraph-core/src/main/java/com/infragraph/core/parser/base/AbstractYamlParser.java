package com.infragraph.core.parser.base;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infragraph.core.parser.IacParseException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract base class for parsers of structured-markup dialects (YAML or JSON).
 *
 * <p>This class provides:
 * <ul>
 *   <li>YAML loading via SnakeYAML (a new {@link Yaml} per call, since SnakeYAML
 *       instances are not thread-safe)</li>
 *   <li>JSON loading via a shared Jackson {@link ObjectMapper}</li>
 *   <li>Error position extraction into byte offsets</li>
 *   <li>Helpers for "string or list of strings" properties such as dependency lists</li>
 * </ul>
 *
 * <p>Both loaders produce plain {@code Map}/{@code List}/scalar trees so downstream
 * stages can walk attributes the same way for every dialect.
 *
 * @see AbstractParser
 */
public abstract class AbstractYamlParser extends AbstractParser {

    /**
     * JSON mapper for parsing JSON documents.
     * Thread-safe and reusable across parse operations.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractYamlParser() {
        super();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the YAML loader used for one document.
     *
     * <p>Subclasses override this to register custom tag constructors.
     *
     * @return new YAML loader
     */
    protected Yaml createYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    /**
     * Loads YAML text into a plain tree.
     *
     * @param text YAML text
     * @return root value (null for an empty document)
     * @throws IacParseException if the text is not valid YAML
     */
    protected Object loadYaml(String text) throws IacParseException {
        try {
            return createYaml().load(text);
        } catch (MarkedYAMLException e) {
            Mark mark = e.getProblemMark() != null ? e.getProblemMark() : e.getContextMark();
            long offset = mark != null ? byteOffset(text, mark.getIndex()) : -1;
            throw new IacParseException("Invalid YAML: " + firstLine(e.getMessage()), offset, e);
        } catch (YAMLException e) {
            throw new IacParseException("Invalid YAML: " + firstLine(e.getMessage()), -1, e);
        }
    }

    /**
     * Loads JSON text into a plain tree.
     *
     * @param text JSON text
     * @return root value
     * @throws IacParseException if the text is not valid JSON
     */
    protected Object loadJson(String text) throws IacParseException {
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            long offset = location != null ? byteOffset(text, (int) location.getCharOffset()) : -1;
            throw new IacParseException("Invalid JSON: " + e.getOriginalMessage(), offset, e);
        }
    }

    /**
     * Reads a "string or list of strings" value.
     *
     * @param value raw value
     * @return strings, empty when absent or of another shape
     */
    protected static List<String> stringOrList(Object value) {
        List<String> values = new ArrayList<>();
        if (value instanceof String s) {
            values.add(s);
        } else if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof String s) {
                    values.add(s);
                }
            }
        }
        return values;
    }

    /**
     * Reads AWS-style tag lists ({@code [{Key: k, Value: v}]}) or plain tag maps.
     *
     * @param value raw tags value
     * @return tags as string map
     */
    protected static Map<String, String> readTags(Object value) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                Map<String, Object> entry = asMap(item);
                if (entry == null) {
                    continue;
                }
                String key = asText(entry.get("Key"));
                String tagValue = asText(entry.get("Value"));
                if (key != null && tagValue != null) {
                    tags.put(key, tagValue);
                }
            }
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> {
                String tagValue = asText(v);
                if (tagValue != null) {
                    tags.put(String.valueOf(k), tagValue);
                }
            });
        }
        return tags;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "unknown error";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline).strip() : message.strip();
    }
}
