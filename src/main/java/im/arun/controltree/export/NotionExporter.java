package im.arun.controltree.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.controltree.error.ControlTreeException;
import im.arun.controltree.error.ErrorKind;
import im.arun.controltree.model.ControlItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Converts the JSON control tree into nested Notion blocks ready for bulk import.
 * Every control becomes a {@code heading_1} block whose children are a provenance paragraph
 * followed by the converted child controls.
 */
public class NotionExporter {
    private static final Logger logger = LoggerFactory.getLogger(NotionExporter.class);

    private final ObjectMapper objectMapper;
    private final String provenanceNote;

    public NotionExporter(String provenanceNote) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.provenanceNote = provenanceNote;
    }

    public void export(Path controlsJson, Path destination) throws ControlTreeException {
        List<ControlItem> tree = loadTree(controlsJson);
        ArrayNode blocks = convertTree(tree);
        try {
            objectMapper.writeValue(destination.toFile(), blocks);
        } catch (IOException e) {
            throw new ControlTreeException(ErrorKind.OUTPUT_WRITE_FAILURE,
                "Error writing Notion JSON: " + e.getMessage(), e);
        }
        logger.info("Notion import JSON written to {} ({} top-level blocks)", destination, blocks.size());
    }

    List<ControlItem> loadTree(Path controlsJson) throws ControlTreeException {
        try {
            return objectMapper.readValue(controlsJson.toFile(), new TypeReference<List<ControlItem>>() {});
        } catch (IOException e) {
            throw new ControlTreeException(ErrorKind.EXPORT_INPUT_INVALID,
                "Error loading JSON: " + e.getMessage(), e);
        }
    }

    public ArrayNode convertTree(List<ControlItem> tree) {
        ArrayNode blocks = objectMapper.createArrayNode();
        for (ControlItem item : tree) {
            blocks.add(convertNode(item));
        }
        return blocks;
    }

    ObjectNode convertNode(ControlItem item) {
        ArrayNode children = objectMapper.createArrayNode();
        children.add(paragraph(provenanceNote));
        if (item.getChildren() != null) {
            for (ControlItem child : item.getChildren()) {
                children.add(convertNode(child));
            }
        }

        ObjectNode page = block("heading_1", item.getId() + " — " + item.getTitle());
        page.set("children", children);
        return page;
    }

    private ObjectNode paragraph(String text) {
        return block("paragraph", text);
    }

    private ObjectNode block(String type, String content) {
        ObjectNode block = objectMapper.createObjectNode();
        block.put("object", "block");
        block.put("type", type);

        ObjectNode richText = objectMapper.createObjectNode();
        richText.put("type", "text");
        richText.putObject("text").put("content", content);

        block.putObject(type).putArray("rich_text").add(richText);
        return block;
    }
}
