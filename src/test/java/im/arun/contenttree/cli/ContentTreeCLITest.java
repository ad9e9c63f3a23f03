package im.arun.contenttree.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.contenttree.TestTrees;
import im.arun.contenttree.model.ContentNode;
import im.arun.contenttree.model.NodeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ContentTreeCLITest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private Path input;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws Exception {
        input = tempDir.resolve("tree.json");
        mapper.writeValue(input.toFile(), TestTrees.hotel());
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        ContentTreeCLI cli = new ContentTreeCLI(new PrintWriter(out, true), new PrintWriter(err, true));
        return ContentTreeCLI.commandLine(cli).execute(args);
    }

    @Test
    void printsStats() throws Exception {
        int exitCode = run("--input", input.toString(), "--stats");

        assertThat(exitCode).isZero();
        JsonNode stats = mapper.readTree(out.toString());
        assertThat(stats.get("total_nodes").asInt()).isEqualTo(10);
        assertThat(stats.get("completion_rate").asInt()).isEqualTo(80);
    }

    @Test
    void validatesSearchResult() throws Exception {
        int exitCode = run("--input", input.toString(), "--search", "sandwich", "--validate");

        assertThat(exitCode).isZero();
        JsonNode report = mapper.readTree(out.toString());
        assertThat(report.get("issues").size()).isEqualTo(1);
        assertThat(report.get("issues").get(0).get("nodeId").asText()).isEqualTo("m2");
        assertThat(report.get("issues").get(0).get("severity").asText()).isEqualTo("warning");
        assertThat(report.get("score").asInt()).isEqualTo(97);
    }

    @Test
    void exportsToFileWithCaseInsensitiveFormat() throws Exception {
        Path output = tempDir.resolve("tree.csv");

        int exitCode = run("--input", input.toString(), "--export", "Csv", "--output", output.toString());

        assertThat(exitCode).isZero();
        String csv = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(csv).startsWith("\uFEFFSystem_ID,");
        assertThat(csv.split("\n")).hasSize(11);
        assertThat(err.toString()).contains("Exporting... 100%").contains("Output written to");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void appliesProposalBeforePrintingTree() throws Exception {
        Path proposal = tempDir.resolve("proposal.json");
        Files.writeString(proposal, "{\"summary\":\"tidy\",\"actions\":["
            + "{\"type\":\"update\",\"targetId\":\"m2\",\"data\":{\"price\":\"9\"}},"
            + "{\"type\":\"delete\",\"targetId\":\"faq\"}]}");

        int exitCode = run("--input", input.toString(), "--apply", proposal.toString());

        assertThat(exitCode).isZero();
        ContentNode root = mapper.readValue(out.toString(), ContentNode.class);
        assertThat(root.getChildren()).extracting(ContentNode::getId).containsExactly("general", "dining");
        assertThat(root.getChildren().get(1).getChildren().get(0).getChildren().get(1).getPrice()).isEqualTo("9");
        assertThat(err.toString()).contains("APPLIED");
    }

    @Test
    void noSearchMatchIsNotAnError() {
        int exitCode = run("--input", input.toString(), "--search", "helipad");

        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("No nodes match \"helipad\"");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void warnsAboutDuplicateIds() throws Exception {
        mapper.writeValue(input.toFile(), TestTrees.node("root", NodeKind.ROOT, "Hotel",
            TestTrees.item("x", "A", "1"), TestTrees.item("x", "B", "2")));

        int exitCode = run("--input", input.toString(), "--stats");

        assertThat(exitCode).isZero();
        assertThat(err.toString()).contains("duplicate ids [x]");
    }

    @Test
    void missingInputFails() {
        int exitCode = run("--input", tempDir.resolve("absent.json").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("input file not found");
    }

    @Test
    void malformedInputFails() throws Exception {
        Files.writeString(input, "{ not json");

        int exitCode = run("--input", input.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("could not read tree JSON");
    }
}
