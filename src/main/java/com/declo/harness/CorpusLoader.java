package com.declo.harness;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads a corpus file:
 * <pre>
 * {"examples": [{"title": "...", "chain": "...", "comprehension": "..."}, ...]}
 * </pre>
 * A bare top-level array of examples is accepted too. Unknown fields are skipped.
 */
public class CorpusLoader {
    public static final String DEFAULT_RESOURCE = "/examples.json";

    private final JsonFactory factory = new JsonFactory();

    public ImmutableList<CorpusExample> loadDefault() throws IOException {
        try (InputStream input = CorpusLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IOException("Bundled corpus " + DEFAULT_RESOURCE + " not found on the classpath");
            }
            return load(input);
        }
    }

    public ImmutableList<CorpusExample> load(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.START_ARRAY) {
                return parseExamples(parser);
            }
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Expected a corpus object or array but found " + token);
            }
            ImmutableList<CorpusExample> examples = null;
            while (parser.nextToken() != JsonToken.END_OBJECT) {
                String fieldName = parser.getCurrentName();
                JsonToken value = parser.nextToken();
                if ("examples".equals(fieldName) && value == JsonToken.START_ARRAY) {
                    examples = parseExamples(parser);
                } else {
                    parser.skipChildren();
                }
            }
            if (examples == null) {
                throw new IOException("Corpus has no \"examples\" array");
            }
            return examples;
        }
    }

    private ImmutableList<CorpusExample> parseExamples(JsonParser parser) throws IOException {
        MutableList<CorpusExample> examples = Lists.mutable.empty();
        while (true) {
            JsonToken token = parser.nextToken();
            if (token == JsonToken.END_ARRAY) {
                break;
            }
            if (token != JsonToken.START_OBJECT) {
                throw new IOException("Unexpected JSON token in examples: " + token);
            }
            examples.add(parseExample(parser, examples.size() + 1));
        }
        return examples.toImmutable();
    }

    private CorpusExample parseExample(JsonParser parser, int index) throws IOException {
        String title = null;
        String chain = null;
        String comprehension = null;

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            JsonToken value = parser.nextToken();
            switch (fieldName) {
                case "title" -> title = text(parser, value, fieldName, index);
                case "chain" -> chain = text(parser, value, fieldName, index);
                case "comprehension" -> comprehension = text(parser, value, fieldName, index);
                default -> parser.skipChildren();
            }
        }

        if (chain == null || comprehension == null) {
            throw new IOException("Example " + index + (title != null ? " (" + title + ")" : "")
                    + " needs both \"chain\" and \"comprehension\"");
        }
        return new CorpusExample(title != null ? title : "Example " + index, chain, comprehension);
    }

    private static String text(JsonParser parser, JsonToken value, String fieldName, int index) throws IOException {
        if (value != JsonToken.VALUE_STRING) {
            throw new IOException("Example " + index + ": \"" + fieldName + "\" must be a string but was " + value);
        }
        return parser.getText();
    }
}
