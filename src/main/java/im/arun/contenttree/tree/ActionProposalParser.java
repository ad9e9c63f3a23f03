package im.arun.contenttree.tree;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Reads an edit proposal ({@code {summary, actions}}) from raw assistant
 * output. Handles markdown-fenced JSON and trailing commas; anything that
 * still does not parse yields an empty proposal.
 */
public class ActionProposalParser {
    private static final Logger logger = LoggerFactory.getLogger(ActionProposalParser.class);
    private final ObjectMapper objectMapper;

    public ActionProposalParser() {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public ActionProposal parse(String response) {
        if (response == null || response.trim().isEmpty()) {
            logger.warn("Empty proposal payload");
            return ActionProposal.empty();
        }

        try {
            JsonNode tree = objectMapper.readTree(cleanJson(response));
            if (tree == null || !tree.isObject()) {
                logger.warn("Proposal payload is not a JSON object");
                return ActionProposal.empty();
            }
            ActionProposal proposal = objectMapper.treeToValue(tree, ActionProposal.class);
            if (proposal.getActions() == null) {
                proposal.setActions(new ArrayList<>());
            }
            return proposal;
        } catch (Exception e) {
            logger.error("Failed to parse proposal: {}", e.getMessage());
            logger.debug("Original payload: {}", response);
            return ActionProposal.empty();
        }
    }

    /**
     * Strip a ```json fence if present.
     */
    String getJsonContent(String response) {
        String content = response;
        int startIdx = content.indexOf("```json");
        if (startIdx != -1) {
            content = content.substring(startIdx + 7);
        } else if (content.startsWith("```")) {
            content = content.substring(3);
        }

        int endIdx = content.lastIndexOf("```");
        if (endIdx != -1) {
            content = content.substring(0, endIdx);
        }
        return content.strip();
    }

    private String cleanJson(String response) {
        String cleaned = getJsonContent(response);
        try {
            objectMapper.readTree(cleaned);
            return cleaned;
        } catch (Exception e) {
            // Trailing commas are the usual culprit
            return cleaned.replaceAll(",\\s*]", "]").replaceAll(",\\s*}", "}");
        }
    }
}
