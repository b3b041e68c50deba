package im.arun.controltree.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.controltree.model.ControlTree;

import java.io.UncheckedIOException;

/**
 * Nested-object encoding: an array of {@code {id, title, children}} objects for the root's children.
 */
public class JsonControlFormatter implements ControlTreeFormatter {
    private final ObjectMapper objectMapper;

    public JsonControlFormatter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String format(ControlTree tree) {
        try {
            return objectMapper.writeValueAsString(tree.toItems());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize control tree", e);
        }
    }
}
